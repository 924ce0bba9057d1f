package com.wardroute.router.model;

import lombok.Value;

@Value
public class DemandPoint {

    long id;
    Coordinate coordinate;

    public static DemandPoint of(long id, double longitude, double latitude) {
        return new DemandPoint(id, Coordinate.of(longitude, latitude));
    }
}
