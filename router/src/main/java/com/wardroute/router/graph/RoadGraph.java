package com.wardroute.router.graph;

import com.wardroute.router.model.Coordinate;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted undirected road graph. Immutable once built by {@link RoadNetworkBuilder}.
 * <p>
 * Nodes are addressed by dense indices in first-observed order. Node identity is the
 * coordinate quantized to {@code precision} decimal places; each node keeps the raw
 * coordinate it was first seen with.
 * </p>
 */
public final class RoadGraph {

    private final List<Coordinate> nodes;
    private final List<List<Edge>> adjacency;
    private final Map<NodeKey, Integer> nodeIndex;
    private final int edgeCount;
    private final int precision;
    private final int skippedGeometries;

    RoadGraph(List<Coordinate> nodes, List<List<Edge>> adjacency, Map<NodeKey, Integer> nodeIndex,
              int edgeCount, int precision, int skippedGeometries) {
        this.nodes = List.copyOf(nodes);
        List<List<Edge>> frozen = new ArrayList<>(adjacency.size());
        for (List<Edge> edges : adjacency) {
            frozen.add(List.copyOf(edges));
        }
        this.adjacency = Collections.unmodifiableList(frozen);
        this.nodeIndex = Map.copyOf(nodeIndex);
        this.edgeCount = edgeCount;
        this.precision = precision;
        this.skippedGeometries = skippedGeometries;
    }

    public static RoadGraph empty(int precision) {
        return new RoadGraph(List.of(), List.of(), new HashMap<>(), 0, precision, 0);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int skippedGeometries() {
        return skippedGeometries;
    }

    public Coordinate node(int index) {
        return nodes.get(index);
    }

    /**
     * Nodes in enumeration order.
     */
    public List<Coordinate> nodes() {
        return nodes;
    }

    public List<Edge> neighbors(int index) {
        return adjacency.get(index);
    }

    /**
     * @return the node index for the coordinate, or -1 when no node shares its key.
     */
    public int indexOf(Coordinate coordinate) {
        Integer index = nodeIndex.get(NodeKey.of(coordinate, precision));
        return index == null ? -1 : index;
    }

    @Value
    public static class Edge {
        int target;
        double weight;
    }

    @Value
    static class NodeKey {
        long lon;
        long lat;

        static NodeKey of(Coordinate coordinate, int precision) {
            double scale = Math.pow(10, precision);
            return new NodeKey(
                    Math.round(coordinate.getLongitude() * scale),
                    Math.round(coordinate.getLatitude() * scale));
        }
    }
}
