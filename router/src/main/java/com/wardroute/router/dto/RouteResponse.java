package com.wardroute.router.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.wardroute.router.model.OptimizationResult;
import com.wardroute.router.model.RouteAssignment;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteResponse {

    private String status;
    private String message;
    private int activeVehicles;
    private int totalHouses;
    private int totalTrips;
    private Map<String, VehicleAssignmentDto> routeAssignments;
    private DiagnosticsDto diagnostics;

    public static RouteResponse from(OptimizationResult result) {
        Map<String, VehicleAssignmentDto> assignments = new LinkedHashMap<>();
        for (Map.Entry<String, RouteAssignment> entry : result.getRouteAssignments().entrySet()) {
            assignments.put(entry.getKey(), VehicleAssignmentDto.from(entry.getValue()));
        }
        return new RouteResponse(
                "success",
                String.format("Route optimization completed with %d active vehicles", result.getActiveVehicles()),
                result.getActiveVehicles(),
                result.getTotalHouses(),
                result.getTotalTrips(),
                assignments,
                DiagnosticsDto.from(result.getDiagnostics())
        );
    }

    public static RouteResponse error(String message) {
        RouteResponse response = new RouteResponse();
        response.setStatus("error");
        response.setMessage(message);
        response.setRouteAssignments(new LinkedHashMap<>());
        return response;
    }

    @JsonIgnore
    public boolean isError() {
        return status != null && status.startsWith("error");
    }
}
