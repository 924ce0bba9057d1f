package com.wardroute.router.graph;

import com.wardroute.router.config.OptimizerProperties;
import com.wardroute.router.exception.GeometryException;
import com.wardroute.router.model.Coordinate;
import com.wardroute.router.model.RoadGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns road line geometries into a {@link RoadGraph}. Degenerate features are skipped
 * and counted; they never abort the build.
 */
@Component
public class RoadNetworkBuilder {

    private static final Logger logger = LoggerFactory.getLogger(RoadNetworkBuilder.class);

    private final int precision;

    public RoadNetworkBuilder(OptimizerProperties properties) {
        this.precision = properties.getCoordinatePrecision();
    }

    public RoadGraph build(List<RoadGeometry> geometries) {
        if (geometries == null || geometries.isEmpty()) {
            logger.warn("No road geometries supplied, building empty road graph");
            return RoadGraph.empty(precision);
        }

        Accumulator accumulator = new Accumulator();
        int skipped = 0;

        for (int i = 0; i < geometries.size(); i++) {
            try {
                addGeometry(accumulator, i, geometries.get(i));
            } catch (GeometryException e) {
                skipped++;
                logger.warn("Skipping degenerate road geometry: {}", e.getMessage());
            }
        }

        RoadGraph graph = new RoadGraph(accumulator.nodes, accumulator.adjacency, accumulator.nodeIndex,
                accumulator.edgeKeys.size(), precision, skipped);
        logger.info("Built road graph with {} nodes and {} edges from {} geometries ({} skipped)",
                graph.nodeCount(), graph.edgeCount(), geometries.size(), skipped);
        return graph;
    }

    void addGeometry(Accumulator accumulator, int featureIndex, RoadGeometry geometry) {
        if (geometry == null || geometry.getParts().isEmpty()) {
            throw new GeometryException(featureIndex, "geometry is empty");
        }

        boolean hasUsablePart = false;
        for (List<Coordinate> part : geometry.getParts()) {
            if (part.size() >= 2) {
                hasUsablePart = true;
                break;
            }
        }
        if (!hasUsablePart) {
            throw new GeometryException(featureIndex, "geometry has fewer than two vertices");
        }

        for (List<Coordinate> part : geometry.getParts()) {
            if (part.size() < 2) {
                logger.debug("Dropping degenerate part of road feature {}", featureIndex);
                continue;
            }
            int previous = accumulator.nodeFor(part.get(0));
            for (int v = 1; v < part.size(); v++) {
                int current = accumulator.nodeFor(part.get(v));
                accumulator.addEdge(previous, current);
                previous = current;
            }
        }
    }

    final class Accumulator {
        private final List<Coordinate> nodes = new ArrayList<>();
        private final List<List<RoadGraph.Edge>> adjacency = new ArrayList<>();
        private final Map<RoadGraph.NodeKey, Integer> nodeIndex = new HashMap<>();
        private final Set<Long> edgeKeys = new HashSet<>();

        int nodeFor(Coordinate coordinate) {
            RoadGraph.NodeKey key = RoadGraph.NodeKey.of(coordinate, precision);
            Integer existing = nodeIndex.get(key);
            if (existing != null) {
                return existing;
            }
            int index = nodes.size();
            nodes.add(coordinate);
            adjacency.add(new ArrayList<>());
            nodeIndex.put(key, index);
            return index;
        }

        void addEdge(int a, int b) {
            if (a == b) {
                return;
            }
            long edgeKey = ((long) Math.min(a, b) << 32) | Math.max(a, b);
            if (!edgeKeys.add(edgeKey)) {
                return;
            }
            double weight = nodes.get(a).distanceTo(nodes.get(b));
            adjacency.get(a).add(new RoadGraph.Edge(b, weight));
            adjacency.get(b).add(new RoadGraph.Edge(a, weight));
        }
    }
}
