package com.wardroute.router.dto;

import com.wardroute.router.model.Coordinate;
import com.wardroute.router.model.Trip;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TripDto {

    private String tripId;
    private int clusterId;
    private int houseCount;
    private List<Long> houses;
    private List<List<Double>> route;
    private int degradedSegments;

    public static TripDto from(Trip trip) {
        return new TripDto(
                trip.getTripId(),
                trip.getClusterId(),
                trip.getHouseCount(),
                new ArrayList<>(trip.getOrderedStopIds()),
                trip.getRouteNodes().stream().map(Coordinate::toLonLat).collect(Collectors.toList()),
                trip.getDegradedSegments()
        );
    }
}
