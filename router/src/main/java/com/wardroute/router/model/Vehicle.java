package com.wardroute.router.model;

import lombok.Value;

@Value
public class Vehicle {

    public static final String DEFAULT_TYPE = "garbage_truck";

    String id;
    String vehicleType;
    int capacityPerTrip;
    VehicleStatus status;

    public static Vehicle active(String id, int capacityPerTrip) {
        return new Vehicle(id, DEFAULT_TYPE, capacityPerTrip, VehicleStatus.ACTIVE);
    }
}
