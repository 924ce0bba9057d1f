package com.wardroute.router.dto;

import com.wardroute.router.model.RouteAssignment;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VehicleAssignmentDto {

    private VehicleInfoDto vehicleInfo;
    private int tripsAssigned;
    private int housesAssigned;
    private int capacityPerTrip;
    private List<TripDto> trips;

    public static VehicleAssignmentDto from(RouteAssignment assignment) {
        return new VehicleAssignmentDto(
                VehicleInfoDto.from(assignment.getVehicle()),
                assignment.getTripsAssigned(),
                assignment.getHousesAssigned(),
                assignment.getCapacityPerTrip(),
                assignment.getTrips().stream().map(TripDto::from).collect(Collectors.toList())
        );
    }
}
