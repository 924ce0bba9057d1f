package com.wardroute.router.dto;

import com.wardroute.router.model.Coordinate;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CoordinateDto {

    private double longitude;
    private double latitude;

    public static CoordinateDto from(Coordinate coordinate) {
        return new CoordinateDto(coordinate.getLongitude(), coordinate.getLatitude());
    }
}
