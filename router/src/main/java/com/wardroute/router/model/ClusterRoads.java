package com.wardroute.router.model;

import lombok.Value;

import java.util.List;

/**
 * Road segments touched by one cluster's snapped houses, for per-vehicle map overlays.
 */
@Value
public class ClusterRoads {

    int clusterId;
    Vehicle vehicle;
    int buildingsCount;
    List<RoadSegment> roads;
    ClusterBounds bounds;

    public ClusterRoads(int clusterId, Vehicle vehicle, int buildingsCount, List<RoadSegment> roads,
                        ClusterBounds bounds) {
        this.clusterId = clusterId;
        this.vehicle = vehicle;
        this.buildingsCount = buildingsCount;
        this.roads = List.copyOf(roads);
        this.bounds = bounds;
    }
}
