package com.wardroute.router.algorithm;

import com.wardroute.router.exception.InputException;
import com.wardroute.router.model.OptimizationResult;
import com.wardroute.router.model.RouteAssignment;
import com.wardroute.router.model.RunDiagnostics;
import com.wardroute.router.model.Trip;
import com.wardroute.router.model.Vehicle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class AssignmentAggregator {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentAggregator.class);

    /**
     * Builds one {@link RouteAssignment} per active vehicle, in the order the vehicles were
     * supplied. Vehicles without trips are kept with an empty trip list.
     */
    public OptimizationResult aggregate(List<Vehicle> activeVehicles, Map<String, List<Trip>> tripsByVehicle,
                                        RunDiagnostics diagnostics) {
        if (activeVehicles == null || activeVehicles.isEmpty()) {
            throw new InputException(InputException.Reason.NO_ACTIVE_VEHICLES);
        }

        Map<String, RouteAssignment> assignments = new LinkedHashMap<>();
        int totalHouses = 0;
        int totalTrips = 0;

        for (Vehicle vehicle : activeVehicles) {
            List<Trip> trips = tripsByVehicle.getOrDefault(vehicle.getId(), List.of());
            RouteAssignment assignment = new RouteAssignment(vehicle, trips);
            assignments.put(vehicle.getId(), assignment);
            totalHouses += assignment.getHousesAssigned();
            totalTrips += assignment.getTripsAssigned();
        }

        logger.info("Aggregated {} houses into {} trips across {} active vehicles",
                totalHouses, totalTrips, activeVehicles.size());
        return new OptimizationResult(activeVehicles.size(), totalHouses, totalTrips, assignments, diagnostics);
    }
}
