package com.wardroute.router.model;

import lombok.Value;

import java.util.List;

@Value
public class Coordinate {

    double longitude;
    double latitude;

    public static Coordinate of(double longitude, double latitude) {
        return new Coordinate(longitude, latitude);
    }

    /**
     * Planar Euclidean distance in source coordinate units (degrees for WGS84 input).
     */
    public double distanceTo(Coordinate other) {
        double dx = longitude - other.longitude;
        double dy = latitude - other.latitude;
        return Math.sqrt(dx * dx + dy * dy);
    }

    public List<Double> toLonLat() {
        return List.of(longitude, latitude);
    }
}
