package com.wardroute.router.model;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
public class OptimizationResult {

    int activeVehicles;
    int totalHouses;
    int totalTrips;
    Map<String, RouteAssignment> routeAssignments;
    RunDiagnostics diagnostics;

    public OptimizationResult(int activeVehicles, int totalHouses, int totalTrips,
                              Map<String, RouteAssignment> routeAssignments, RunDiagnostics diagnostics) {
        this.activeVehicles = activeVehicles;
        this.totalHouses = totalHouses;
        this.totalTrips = totalTrips;
        this.routeAssignments = Collections.unmodifiableMap(new LinkedHashMap<>(routeAssignments));
        this.diagnostics = diagnostics;
    }
}
