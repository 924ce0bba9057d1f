package com.wardroute.router.service;

import com.wardroute.router.algorithm.DemandPartitioner;
import com.wardroute.router.algorithm.RoadSnapper;
import com.wardroute.router.config.OptimizerProperties;
import com.wardroute.router.dto.AllClustersRoadsResponse;
import com.wardroute.router.dto.ClusterRoadsResponse;
import com.wardroute.router.dto.RouteRequest;
import com.wardroute.router.exception.ClusterNotFoundException;
import com.wardroute.router.graph.RoadGraph;
import com.wardroute.router.graph.RoadNetworkBuilder;
import com.wardroute.router.model.Cluster;
import com.wardroute.router.model.ClusterBounds;
import com.wardroute.router.model.ClusterRoads;
import com.wardroute.router.model.OptimizationInput;
import com.wardroute.router.model.RoadSegment;
import com.wardroute.router.model.SnappedStop;
import com.wardroute.router.model.Vehicle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Answers the per-cluster road query used for map overlays. The partition is recomputed
 * from the request; it is deterministic, so it matches the one used for optimization.
 */
@Service
public class ClusterRoadsService {

    private static final Logger logger = LoggerFactory.getLogger(ClusterRoadsService.class);

    private final RouteRequestAdapter requestAdapter;
    private final RoadNetworkBuilder roadNetworkBuilder;
    private final DemandPartitioner demandPartitioner;
    private final RoadSnapper roadSnapper;
    private final OptimizerProperties properties;

    public ClusterRoadsService(RouteRequestAdapter requestAdapter,
                               RoadNetworkBuilder roadNetworkBuilder,
                               DemandPartitioner demandPartitioner,
                               RoadSnapper roadSnapper,
                               OptimizerProperties properties) {
        this.requestAdapter = requestAdapter;
        this.roadNetworkBuilder = roadNetworkBuilder;
        this.demandPartitioner = demandPartitioner;
        this.roadSnapper = roadSnapper;
        this.properties = properties;
    }

    public ClusterRoadsResponse getClusterRoads(int clusterId, RouteRequest request) {
        List<ClusterRoads> all = describeClusters(requestAdapter.adapt(request));
        if (clusterId < 0 || clusterId >= all.size()) {
            throw new ClusterNotFoundException(clusterId);
        }
        return ClusterRoadsResponse.from(all.get(clusterId));
    }

    public AllClustersRoadsResponse getAllClusterRoads(RouteRequest request) {
        List<ClusterRoadsResponse> clusters = describeClusters(requestAdapter.adapt(request)).stream()
                .map(ClusterRoadsResponse::from)
                .collect(Collectors.toList());
        return new AllClustersRoadsResponse(clusters.size(), clusters);
    }

    public List<ClusterRoads> describeClusters(OptimizationInput input) {
        List<Vehicle> activeVehicles = input.activeVehicles();
        RoadGraph graph = roadNetworkBuilder.build(input.getRoads());
        List<Cluster> clusters = demandPartitioner.partition(input.getDemandPoints(), activeVehicles);

        List<ClusterRoads> described = new ArrayList<>(clusters.size());
        for (Cluster cluster : clusters) {
            Vehicle vehicle = activeVehicles.get(cluster.getClusterId());
            List<RoadSegment> roads = touchedSegments(roadSnapper.snapAll(cluster.getMembers(), graph), graph);
            described.add(new ClusterRoads(cluster.getClusterId(), vehicle, cluster.size(), roads,
                    ClusterBounds.of(cluster.getMembers())));
            logger.debug("Cluster {} touches {} road segments", cluster.getClusterId(), roads.size());
        }
        return described;
    }

    /**
     * Edges incident to any snapped node, each undirected edge once, in first-seen order.
     */
    private List<RoadSegment> touchedSegments(List<SnappedStop> snapped, RoadGraph graph) {
        List<RoadSegment> segments = new ArrayList<>();
        Set<Integer> visitedNodes = new HashSet<>();
        Set<Long> seenEdges = new HashSet<>();

        for (SnappedStop stop : snapped) {
            if (stop.isUnsnapped() || !visitedNodes.add(stop.getNodeIndex())) {
                continue;
            }
            int from = stop.getNodeIndex();
            for (RoadGraph.Edge edge : graph.neighbors(from)) {
                int to = edge.getTarget();
                long edgeKey = ((long) Math.min(from, to) << 32) | Math.max(from, to);
                if (seenEdges.add(edgeKey)) {
                    segments.add(new RoadSegment(graph.node(from), graph.node(to),
                            edge.getWeight() * properties.getMetersPerDegree()));
                }
            }
        }
        return segments;
    }
}
