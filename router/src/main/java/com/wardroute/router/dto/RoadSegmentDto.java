package com.wardroute.router.dto;

import com.wardroute.router.model.RoadSegment;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RoadSegmentDto {

    private CoordinateDto startCoordinate;
    private CoordinateDto endCoordinate;
    private double distanceMeters;

    public static RoadSegmentDto from(RoadSegment segment) {
        return new RoadSegmentDto(
                CoordinateDto.from(segment.getStart()),
                CoordinateDto.from(segment.getEnd()),
                segment.getDistanceMeters()
        );
    }
}
