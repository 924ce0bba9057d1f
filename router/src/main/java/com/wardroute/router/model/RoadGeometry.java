package com.wardroute.router.model;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A road line feature; single lines have exactly one part.
 */
@Value
public class RoadGeometry {

    List<List<Coordinate>> parts;

    public RoadGeometry(List<List<Coordinate>> parts) {
        this.parts = parts == null ? List.of() : List.copyOf(parts.stream().map(List::copyOf).collect(Collectors.toList()));
    }

    public static RoadGeometry line(Coordinate... vertices) {
        return new RoadGeometry(List.of(List.of(vertices)));
    }
}
