package com.wardroute.router.algorithm;

import com.wardroute.router.graph.RoadGraph;
import com.wardroute.router.model.Coordinate;
import com.wardroute.router.model.DemandPoint;
import com.wardroute.router.model.SnappedStop;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps demand points to their nearest road graph node by linear scan.
 */
@Component
public class RoadSnapper {

    /**
     * Ties go to the node that comes first in the graph's enumeration order. With an empty
     * graph the point snaps to its own coordinate and is flagged unsnapped.
     */
    public SnappedStop snap(DemandPoint demandPoint, RoadGraph graph) {
        if (graph.isEmpty()) {
            return SnappedStop.unsnapped(demandPoint);
        }

        Coordinate location = demandPoint.getCoordinate();
        List<Coordinate> nodes = graph.nodes();
        int bestIndex = 0;
        double bestDistance = location.distanceTo(nodes.get(0));
        for (int i = 1; i < nodes.size(); i++) {
            double distance = location.distanceTo(nodes.get(i));
            if (distance < bestDistance) {
                bestDistance = distance;
                bestIndex = i;
            }
        }
        return new SnappedStop(demandPoint, nodes.get(bestIndex), bestIndex, bestDistance);
    }

    public List<SnappedStop> snapAll(List<DemandPoint> demandPoints, RoadGraph graph) {
        List<SnappedStop> snapped = new ArrayList<>(demandPoints.size());
        for (DemandPoint demandPoint : demandPoints) {
            snapped.add(snap(demandPoint, graph));
        }
        return snapped;
    }
}
