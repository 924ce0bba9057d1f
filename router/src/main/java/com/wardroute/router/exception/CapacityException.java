package com.wardroute.router.exception;

import lombok.Getter;

@Getter
public class CapacityException extends RuntimeException {

    private final String vehicleId;
    private final int capacityPerTrip;

    public CapacityException(String vehicleId, int capacityPerTrip) {
        super(String.format("Vehicle %s has invalid capacity per trip: %d", vehicleId, capacityPerTrip));
        this.vehicleId = vehicleId;
        this.capacityPerTrip = capacityPerTrip;
    }
}
