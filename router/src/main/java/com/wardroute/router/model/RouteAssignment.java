package com.wardroute.router.model;

import lombok.Value;

import java.util.List;

@Value
public class RouteAssignment {

    Vehicle vehicle;
    List<Trip> trips;

    public RouteAssignment(Vehicle vehicle, List<Trip> trips) {
        this.vehicle = vehicle;
        this.trips = List.copyOf(trips);
    }

    public int getTripsAssigned() {
        return trips.size();
    }

    public int getHousesAssigned() {
        return trips.stream().mapToInt(Trip::getHouseCount).sum();
    }

    public int getCapacityPerTrip() {
        return vehicle.getCapacityPerTrip();
    }
}
