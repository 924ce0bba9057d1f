package com.wardroute.router.model;

import com.wardroute.router.exception.InputException;
import lombok.Value;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Value
public class OptimizationInput {

    List<Vehicle> vehicles;
    List<DemandPoint> demandPoints;
    List<RoadGeometry> roads;

    /**
     * @throws InputException when two vehicles or two demand points share an id
     */
    public OptimizationInput(List<Vehicle> vehicles, List<DemandPoint> demandPoints, List<RoadGeometry> roads) {
        Set<String> vehicleIds = new HashSet<>();
        for (Vehicle vehicle : vehicles) {
            if (!vehicleIds.add(vehicle.getId())) {
                throw new InputException(InputException.Reason.DUPLICATE_VEHICLE_ID, vehicle.getId());
            }
        }
        Set<Long> demandIds = new HashSet<>();
        for (DemandPoint demandPoint : demandPoints) {
            if (!demandIds.add(demandPoint.getId())) {
                throw new InputException(InputException.Reason.DUPLICATE_DEMAND_ID, String.valueOf(demandPoint.getId()));
            }
        }

        this.vehicles = List.copyOf(vehicles);
        this.demandPoints = List.copyOf(demandPoints);
        this.roads = List.copyOf(roads);
    }

    /**
     * Active vehicles in the order they were supplied.
     */
    public List<Vehicle> activeVehicles() {
        return vehicles.stream()
                .filter(v -> v.getStatus().isActive())
                .collect(Collectors.toList());
    }
}
