package com.wardroute.router.graph;

import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Point-to-point Dijkstra over a {@link RoadGraph} with early exit at the target.
 */
@Component
public class ShortestPathFinder {

    private static final int NO_PREDECESSOR = -1;

    /**
     * @return node indices from source to target inclusive, or empty when the target is unreachable.
     */
    public Optional<List<Integer>> findPath(RoadGraph graph, int source, int target) {
        int n = graph.nodeCount();
        if (source < 0 || target < 0 || source >= n || target >= n) {
            return Optional.empty();
        }
        if (source == target) {
            return Optional.of(List.of(source));
        }

        double[] distance = new double[n];
        int[] predecessor = new int[n];
        boolean[] settled = new boolean[n];
        Arrays.fill(distance, Double.POSITIVE_INFINITY);
        Arrays.fill(predecessor, NO_PREDECESSOR);

        PriorityQueue<Label> frontier = new PriorityQueue<>(
                Comparator.comparingDouble(Label::getDistance).thenComparingInt(Label::getNode));
        distance[source] = 0.0;
        frontier.add(new Label(source, 0.0));

        while (!frontier.isEmpty()) {
            Label current = frontier.poll();
            int node = current.getNode();
            if (settled[node]) {
                continue;
            }
            settled[node] = true;
            if (node == target) {
                return Optional.of(reconstruct(predecessor, source, target));
            }

            for (RoadGraph.Edge edge : graph.neighbors(node)) {
                int next = edge.getTarget();
                if (settled[next]) {
                    continue;
                }
                double candidate = current.getDistance() + edge.getWeight();
                if (candidate < distance[next]) {
                    distance[next] = candidate;
                    predecessor[next] = node;
                    frontier.add(new Label(next, candidate));
                }
            }
        }
        return Optional.empty();
    }

    private List<Integer> reconstruct(int[] predecessor, int source, int target) {
        List<Integer> path = new ArrayList<>();
        for (int node = target; node != NO_PREDECESSOR; node = predecessor[node]) {
            path.add(node);
            if (node == source) {
                break;
            }
        }
        Collections.reverse(path);
        return path;
    }

    @Value
    private static class Label {
        int node;
        double distance;
    }
}
