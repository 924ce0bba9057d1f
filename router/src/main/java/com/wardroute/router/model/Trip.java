package com.wardroute.router.model;

import lombok.Value;

import java.util.List;

@Value
public class Trip {

    String tripId;
    String vehicleId;
    int clusterId;
    List<Long> orderedStopIds;
    List<Coordinate> routeNodes;
    int degradedSegments;

    public Trip(String tripId, String vehicleId, int clusterId, List<Long> orderedStopIds,
                List<Coordinate> routeNodes, int degradedSegments) {
        this.tripId = tripId;
        this.vehicleId = vehicleId;
        this.clusterId = clusterId;
        this.orderedStopIds = List.copyOf(orderedStopIds);
        this.routeNodes = List.copyOf(routeNodes);
        this.degradedSegments = degradedSegments;
    }

    public int getHouseCount() {
        return orderedStopIds.size();
    }
}
