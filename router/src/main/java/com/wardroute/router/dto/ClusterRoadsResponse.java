package com.wardroute.router.dto;

import com.wardroute.router.model.ClusterRoads;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClusterRoadsResponse {

    private int clusterId;
    private VehicleInfoDto vehicleInfo;
    private int buildingsCount;
    private List<RoadSegmentDto> roads;
    private int totalRoadSegments;
    private ClusterBoundsDto clusterBounds;

    public static ClusterRoadsResponse from(ClusterRoads clusterRoads) {
        List<RoadSegmentDto> roads = clusterRoads.getRoads().stream()
                .map(RoadSegmentDto::from)
                .collect(Collectors.toList());
        return new ClusterRoadsResponse(
                clusterRoads.getClusterId(),
                VehicleInfoDto.from(clusterRoads.getVehicle()),
                clusterRoads.getBuildingsCount(),
                roads,
                roads.size(),
                ClusterBoundsDto.from(clusterRoads.getBounds())
        );
    }
}
