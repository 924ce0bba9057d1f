package com.wardroute.router.service;

import com.wardroute.router.dto.DemandPointDto;
import com.wardroute.router.dto.RoadGeometryDto;
import com.wardroute.router.dto.RouteRequest;
import com.wardroute.router.dto.VehicleDto;
import com.wardroute.router.model.OptimizationInput;
import com.wardroute.router.model.Vehicle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns a request into plain pipeline input, pulling the fleet from the fleet API when the
 * request names a ward instead of listing vehicles.
 */
@Component
public class RouteRequestAdapter {

    private static final Logger logger = LoggerFactory.getLogger(RouteRequestAdapter.class);

    private final FleetClient fleetClient;

    public RouteRequestAdapter(FleetClient fleetClient) {
        this.fleetClient = fleetClient;
    }

    public OptimizationInput adapt(RouteRequest request) {
        List<Vehicle> vehicles;
        if (request.getVehicles() != null && !request.getVehicles().isEmpty()) {
            vehicles = request.getVehicles().stream().map(VehicleDto::toVehicle).collect(Collectors.toList());
        } else if (request.getWardNo() != null && !request.getWardNo().isBlank()) {
            vehicles = fleetClient.fetchVehiclesByWard(request.getWardNo());
        } else {
            logger.warn("Request lists no vehicles and no ward number");
            vehicles = List.of();
        }

        return new OptimizationInput(
                vehicles,
                request.getDemandPoints() == null ? List.of()
                        : request.getDemandPoints().stream().map(DemandPointDto::toDemandPoint).collect(Collectors.toList()),
                request.getRoads() == null ? List.of()
                        : request.getRoads().stream().map(RoadGeometryDto::toRoadGeometry).collect(Collectors.toList())
        );
    }
}
