package com.wardroute.router.dto;

import com.wardroute.router.model.DemandPoint;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DemandPointDto {

    @NotNull
    private Long id;

    @NotNull
    private Double longitude;

    @NotNull
    private Double latitude;

    public DemandPoint toDemandPoint() {
        return DemandPoint.of(id, longitude, latitude);
    }
}
