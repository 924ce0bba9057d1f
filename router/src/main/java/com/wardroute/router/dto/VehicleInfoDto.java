package com.wardroute.router.dto;

import com.wardroute.router.model.Vehicle;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VehicleInfoDto {

    private String vehicleId;
    private String vehicleType;
    private String status;
    private int capacityPerTrip;

    public static VehicleInfoDto from(Vehicle vehicle) {
        return new VehicleInfoDto(
                vehicle.getId(),
                vehicle.getVehicleType(),
                vehicle.getStatus().name().toLowerCase(Locale.ROOT),
                vehicle.getCapacityPerTrip()
        );
    }
}
