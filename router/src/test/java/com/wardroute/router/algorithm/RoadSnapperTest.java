package com.wardroute.router.algorithm;

import com.wardroute.router.config.OptimizerProperties;
import com.wardroute.router.graph.RoadGraph;
import com.wardroute.router.graph.RoadNetworkBuilder;
import com.wardroute.router.model.Coordinate;
import com.wardroute.router.model.DemandPoint;
import com.wardroute.router.model.RoadGeometry;
import com.wardroute.router.model.SnappedStop;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoadSnapperTest {

    private final RoadSnapper snapper = new RoadSnapper();
    private final RoadNetworkBuilder builder = new RoadNetworkBuilder(new OptimizerProperties());

    @Test
    void shouldSnapToNearestNode() {
        RoadGraph graph = builder.build(List.of(
                RoadGeometry.line(Coordinate.of(0, 0), Coordinate.of(1, 0), Coordinate.of(2, 0))));

        SnappedStop stop = snapper.snap(DemandPoint.of(7, 1.2, 0.3), graph);

        assertEquals(Coordinate.of(1, 0), stop.getNode());
        assertEquals(1, stop.getNodeIndex());
        assertEquals(Math.sqrt(0.04 + 0.09), stop.getDistance(), 1e-12);
        assertFalse(stop.isUnsnapped());
    }

    @Test
    void shouldBreakTiesTowardFirstNode() {
        RoadGraph graph = builder.build(List.of(
                RoadGeometry.line(Coordinate.of(0, 0), Coordinate.of(2, 0))));

        SnappedStop stop = snapper.snap(DemandPoint.of(1, 1, 0), graph);

        assertEquals(0, stop.getNodeIndex());
    }

    @Test
    void shouldLeavePointUnsnappedOnEmptyGraph() {
        RoadGraph graph = builder.build(List.of());

        SnappedStop stop = snapper.snap(DemandPoint.of(3, 85.3, 27.7), graph);

        assertTrue(stop.isUnsnapped());
        assertEquals(Coordinate.of(85.3, 27.7), stop.getNode());
    }

    @Test
    void shouldSnapAllInInputOrder() {
        RoadGraph graph = builder.build(List.of(
                RoadGeometry.line(Coordinate.of(0, 0), Coordinate.of(1, 0))));

        List<SnappedStop> stops = snapper.snapAll(List.of(
                DemandPoint.of(10, 0.9, 0), DemandPoint.of(11, 0.1, 0)), graph);

        assertEquals(10L, stops.get(0).getDemandPointId());
        assertEquals(1, stops.get(0).getNodeIndex());
        assertEquals(0, stops.get(1).getNodeIndex());
    }
}
