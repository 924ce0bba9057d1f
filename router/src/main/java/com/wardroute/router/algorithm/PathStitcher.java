package com.wardroute.router.algorithm;

import com.wardroute.router.graph.RoadGraph;
import com.wardroute.router.graph.ShortestPathFinder;
import com.wardroute.router.model.Coordinate;
import com.wardroute.router.model.SnappedStop;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Joins consecutive stops with shortest road paths. A pair with no road path between
 * its snapped nodes is joined by a direct segment and counted as degraded.
 */
@Component
public class PathStitcher {

    private static final Logger logger = LoggerFactory.getLogger(PathStitcher.class);

    private final ShortestPathFinder shortestPathFinder;

    public PathStitcher(ShortestPathFinder shortestPathFinder) {
        this.shortestPathFinder = shortestPathFinder;
    }

    public StitchedRoute stitch(List<SnappedStop> orderedStops, RoadGraph graph) {
        List<Coordinate> route = new ArrayList<>();
        if (orderedStops.isEmpty()) {
            return new StitchedRoute(route, 0);
        }

        SnappedStop current = orderedStops.get(0);
        route.add(current.getNode());
        int degraded = 0;

        for (int i = 1; i < orderedStops.size(); i++) {
            SnappedStop next = orderedStops.get(i);

            if (!current.isUnsnapped() && current.getNodeIndex() == next.getNodeIndex()) {
                current = next;
                continue;
            }

            Optional<List<Integer>> path = current.isUnsnapped() || next.isUnsnapped()
                    ? Optional.empty()
                    : shortestPathFinder.findPath(graph, current.getNodeIndex(), next.getNodeIndex());

            if (path.isPresent()) {
                // first node is the junction already on the route
                List<Integer> segment = path.get();
                for (int s = 1; s < segment.size(); s++) {
                    route.add(graph.node(segment.get(s)));
                }
            } else {
                degraded++;
                route.add(next.getNode());
                logger.debug("No road path between stops {} and {}, using direct segment",
                        current.getDemandPointId(), next.getDemandPointId());
            }
            current = next;
        }

        return new StitchedRoute(route, degraded);
    }

    @Value
    public static class StitchedRoute {
        List<Coordinate> nodes;
        int degradedSegments;

        public StitchedRoute(List<Coordinate> nodes, int degradedSegments) {
            this.nodes = List.copyOf(nodes);
            this.degradedSegments = degradedSegments;
        }
    }
}
