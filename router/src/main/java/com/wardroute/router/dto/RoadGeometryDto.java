package com.wardroute.router.dto;

import com.wardroute.router.model.Coordinate;
import com.wardroute.router.model.RoadGeometry;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A road feature as {@code [lon, lat]} vertex lists: {@code coordinates} for a single line,
 * {@code parts} for a multi-line. Both may be given; parts follow the single line.
 */
@Data
@NoArgsConstructor
public class RoadGeometryDto {

    private List<List<Double>> coordinates;

    private List<List<List<Double>>> parts;

    public static RoadGeometryDto line(List<List<Double>> coordinates) {
        RoadGeometryDto dto = new RoadGeometryDto();
        dto.setCoordinates(coordinates);
        return dto;
    }

    public static RoadGeometryDto multiLine(List<List<List<Double>>> parts) {
        RoadGeometryDto dto = new RoadGeometryDto();
        dto.setParts(parts);
        return dto;
    }

    public RoadGeometry toRoadGeometry() {
        List<List<Coordinate>> converted = new ArrayList<>();
        if (coordinates != null) {
            converted.add(toVertices(coordinates));
        }
        if (parts != null) {
            for (List<List<Double>> part : parts) {
                if (part != null) {
                    converted.add(toVertices(part));
                }
            }
        }
        return new RoadGeometry(converted);
    }

    private static List<Coordinate> toVertices(List<List<Double>> positions) {
        List<Coordinate> vertices = new ArrayList<>(positions.size());
        for (List<Double> position : positions) {
            // malformed positions drop out and may leave the part degenerate
            if (position != null && position.size() >= 2 && position.get(0) != null && position.get(1) != null) {
                vertices.add(Coordinate.of(position.get(0), position.get(1)));
            }
        }
        return vertices;
    }
}
