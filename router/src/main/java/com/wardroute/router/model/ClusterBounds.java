package com.wardroute.router.model;

import lombok.Value;

import java.util.List;

@Value
public class ClusterBounds {

    double minLongitude;
    double maxLongitude;
    double minLatitude;
    double maxLatitude;

    public static ClusterBounds of(List<DemandPoint> members) {
        double minLon = Double.POSITIVE_INFINITY;
        double maxLon = Double.NEGATIVE_INFINITY;
        double minLat = Double.POSITIVE_INFINITY;
        double maxLat = Double.NEGATIVE_INFINITY;
        for (DemandPoint member : members) {
            Coordinate c = member.getCoordinate();
            minLon = Math.min(minLon, c.getLongitude());
            maxLon = Math.max(maxLon, c.getLongitude());
            minLat = Math.min(minLat, c.getLatitude());
            maxLat = Math.max(maxLat, c.getLatitude());
        }
        return new ClusterBounds(minLon, maxLon, minLat, maxLat);
    }
}
