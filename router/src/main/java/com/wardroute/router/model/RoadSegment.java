package com.wardroute.router.model;

import lombok.Value;

@Value
public class RoadSegment {
    Coordinate start;
    Coordinate end;
    double distanceMeters;
}
