package com.wardroute.router.algorithm;

import com.wardroute.router.exception.InputException;
import com.wardroute.router.model.Coordinate;
import com.wardroute.router.model.OptimizationResult;
import com.wardroute.router.model.RouteAssignment;
import com.wardroute.router.model.RunDiagnostics;
import com.wardroute.router.model.Trip;
import com.wardroute.router.model.Vehicle;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AssignmentAggregatorTest {

    private final AssignmentAggregator aggregator = new AssignmentAggregator();
    private final RunDiagnostics diagnostics = new RunDiagnostics(0, 0, 0, List.of(), 0);

    @Test
    void shouldSumHousesAndTripsAcrossVehicles() {
        List<Vehicle> vehicles = List.of(Vehicle.active("V1", 4), Vehicle.active("V2", 4));
        Map<String, List<Trip>> trips = Map.of(
                "V1", List.of(trip("V1-T1", "V1", 4), trip("V1-T2", "V1", 1)),
                "V2", List.of(trip("V2-T1", "V2", 3)));

        OptimizationResult result = aggregator.aggregate(vehicles, trips, diagnostics);

        assertEquals(2, result.getActiveVehicles());
        assertEquals(8, result.getTotalHouses());
        assertEquals(3, result.getTotalTrips());
        RouteAssignment first = result.getRouteAssignments().get("V1");
        assertEquals(2, first.getTripsAssigned());
        assertEquals(5, first.getHousesAssigned());
        assertEquals(4, first.getCapacityPerTrip());
    }

    @Test
    void shouldKeepIdleVehiclesInInputOrder() {
        List<Vehicle> vehicles = List.of(Vehicle.active("V3", 4), Vehicle.active("V1", 4), Vehicle.active("V2", 4));
        Map<String, List<Trip>> trips = Map.of("V1", List.of(trip("V1-T1", "V1", 2)));

        OptimizationResult result = aggregator.aggregate(vehicles, trips, diagnostics);

        assertEquals(List.of("V3", "V1", "V2"), new ArrayList<>(result.getRouteAssignments().keySet()));
        assertEquals(0, result.getRouteAssignments().get("V3").getTripsAssigned());
        assertEquals(0, result.getRouteAssignments().get("V2").getHousesAssigned());
        assertEquals(2, result.getTotalHouses());
    }

    @Test
    void shouldRejectEmptyFleet() {
        InputException e = assertThrows(InputException.class,
                () -> aggregator.aggregate(List.of(), Map.of(), diagnostics));

        assertEquals(InputException.Reason.NO_ACTIVE_VEHICLES, e.getReason());
    }

    private static Trip trip(String tripId, String vehicleId, int houses) {
        List<Long> stops = new ArrayList<>();
        for (long i = 1; i <= houses; i++) {
            stops.add(i);
        }
        return new Trip(tripId, vehicleId, 0, stops, List.of(Coordinate.of(0, 0)), 0);
    }
}
