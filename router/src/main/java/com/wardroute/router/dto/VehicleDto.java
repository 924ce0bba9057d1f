package com.wardroute.router.dto;

import com.wardroute.router.model.Vehicle;
import com.wardroute.router.model.VehicleStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VehicleDto {

    @NotBlank
    private String id;

    private String vehicleType;

    @NotNull
    private Integer capacityPerTrip;

    private String status;

    public Vehicle toVehicle() {
        String type = vehicleType == null || vehicleType.isBlank() ? Vehicle.DEFAULT_TYPE : vehicleType;
        return new Vehicle(id, type, capacityPerTrip, VehicleStatus.fromLabel(status));
    }
}
