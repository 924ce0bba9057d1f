package com.wardroute.router.model;

import lombok.Value;

import java.util.List;

/**
 * Degradations absorbed during a run instead of being raised.
 */
@Value
public class RunDiagnostics {

    int skippedGeometries;
    int degradedSegments;
    int unsnappedPoints;
    List<String> rejectedVehicleIds;
    int unassignedHouses;

    public RunDiagnostics(int skippedGeometries, int degradedSegments, int unsnappedPoints,
                          List<String> rejectedVehicleIds, int unassignedHouses) {
        this.skippedGeometries = skippedGeometries;
        this.degradedSegments = degradedSegments;
        this.unsnappedPoints = unsnappedPoints;
        this.rejectedVehicleIds = List.copyOf(rejectedVehicleIds);
        this.unassignedHouses = unassignedHouses;
    }
}
