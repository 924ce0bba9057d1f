package com.wardroute.router.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Optimization input. When {@code vehicles} is omitted the fleet for {@code wardNo} is
 * fetched from the fleet API.
 */
@Data
@NoArgsConstructor
public class RouteRequest {

    private String wardNo;

    @Valid
    private List<VehicleDto> vehicles;

    @NotNull
    @Valid
    private List<DemandPointDto> demandPoints;

    private List<RoadGeometryDto> roads;
}
