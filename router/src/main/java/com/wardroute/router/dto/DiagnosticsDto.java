package com.wardroute.router.dto;

import com.wardroute.router.model.RunDiagnostics;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DiagnosticsDto {

    private int skippedGeometries;
    private int degradedSegments;
    private int unsnappedPoints;
    private List<String> rejectedVehicles;
    private int unassignedHouses;

    public static DiagnosticsDto from(RunDiagnostics diagnostics) {
        return new DiagnosticsDto(
                diagnostics.getSkippedGeometries(),
                diagnostics.getDegradedSegments(),
                diagnostics.getUnsnappedPoints(),
                new ArrayList<>(diagnostics.getRejectedVehicleIds()),
                diagnostics.getUnassignedHouses()
        );
    }
}
