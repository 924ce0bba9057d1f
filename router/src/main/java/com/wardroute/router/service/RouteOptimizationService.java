package com.wardroute.router.service;

import com.wardroute.router.algorithm.AssignmentAggregator;
import com.wardroute.router.algorithm.CapacitySegmenter;
import com.wardroute.router.algorithm.DemandPartitioner;
import com.wardroute.router.algorithm.PathStitcher;
import com.wardroute.router.algorithm.RoadSnapper;
import com.wardroute.router.algorithm.StopSequencer;
import com.wardroute.router.dto.RouteRequest;
import com.wardroute.router.dto.RouteResponse;
import com.wardroute.router.exception.CapacityException;
import com.wardroute.router.graph.RoadGraph;
import com.wardroute.router.graph.RoadNetworkBuilder;
import com.wardroute.router.model.Cluster;
import com.wardroute.router.model.DemandPoint;
import com.wardroute.router.model.OptimizationInput;
import com.wardroute.router.model.OptimizationResult;
import com.wardroute.router.model.RunDiagnostics;
import com.wardroute.router.model.SnappedStop;
import com.wardroute.router.model.Trip;
import com.wardroute.router.model.Vehicle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs the optimization pipeline: road graph and partition, then per cluster capacity
 * segmentation, snapping, sequencing and stitching, then aggregation. Each stage sees only
 * the finished output of the stages before it.
 */
@Service
public class RouteOptimizationService {

    private static final Logger logger = LoggerFactory.getLogger(RouteOptimizationService.class);

    private final RouteRequestAdapter requestAdapter;
    private final RoadNetworkBuilder roadNetworkBuilder;
    private final DemandPartitioner demandPartitioner;
    private final CapacitySegmenter capacitySegmenter;
    private final RoadSnapper roadSnapper;
    private final StopSequencer stopSequencer;
    private final PathStitcher pathStitcher;
    private final AssignmentAggregator assignmentAggregator;

    public RouteOptimizationService(RouteRequestAdapter requestAdapter,
                                    RoadNetworkBuilder roadNetworkBuilder,
                                    DemandPartitioner demandPartitioner,
                                    CapacitySegmenter capacitySegmenter,
                                    RoadSnapper roadSnapper,
                                    StopSequencer stopSequencer,
                                    PathStitcher pathStitcher,
                                    AssignmentAggregator assignmentAggregator) {
        this.requestAdapter = requestAdapter;
        this.roadNetworkBuilder = roadNetworkBuilder;
        this.demandPartitioner = demandPartitioner;
        this.capacitySegmenter = capacitySegmenter;
        this.roadSnapper = roadSnapper;
        this.stopSequencer = stopSequencer;
        this.pathStitcher = pathStitcher;
        this.assignmentAggregator = assignmentAggregator;
    }

    public RouteResponse optimizeRoute(RouteRequest request) {
        OptimizationResult result = optimize(requestAdapter.adapt(request));
        return RouteResponse.from(result);
    }

    public OptimizationResult optimize(OptimizationInput input) {
        List<Vehicle> activeVehicles = input.activeVehicles();
        logger.info("Optimizing {} demand points with {} of {} vehicles active and {} road geometries",
                input.getDemandPoints().size(), activeVehicles.size(), input.getVehicles().size(),
                input.getRoads().size());

        RoadGraph graph = roadNetworkBuilder.build(input.getRoads());
        List<Cluster> clusters = demandPartitioner.partition(input.getDemandPoints(), activeVehicles);

        Map<String, List<Trip>> tripsByVehicle = new HashMap<>();
        List<String> rejectedVehicleIds = new ArrayList<>();
        int unassignedHouses = 0;
        int degradedSegments = 0;
        int unsnappedPoints = 0;

        for (Cluster cluster : clusters) {
            Vehicle vehicle = activeVehicles.get(cluster.getClusterId());

            List<List<DemandPoint>> segments;
            try {
                segments = capacitySegmenter.segment(cluster, vehicle);
            } catch (CapacityException e) {
                logger.warn("Excluding vehicle {} from assignment: {}", vehicle.getId(), e.getMessage());
                rejectedVehicleIds.add(vehicle.getId());
                unassignedHouses += cluster.size();
                continue;
            }

            List<Trip> trips = tripsByVehicle.computeIfAbsent(vehicle.getId(), id -> new ArrayList<>());
            for (List<DemandPoint> segment : segments) {
                List<SnappedStop> snapped = roadSnapper.snapAll(segment, graph);
                unsnappedPoints += (int) snapped.stream().filter(SnappedStop::isUnsnapped).count();

                List<SnappedStop> ordered = stopSequencer.sequence(snapped);
                PathStitcher.StitchedRoute route = pathStitcher.stitch(ordered, graph);
                degradedSegments += route.getDegradedSegments();

                Trip trip = new Trip(
                        vehicle.getId() + "-T" + (trips.size() + 1),
                        vehicle.getId(),
                        cluster.getClusterId(),
                        ordered.stream().map(SnappedStop::getDemandPointId).collect(Collectors.toList()),
                        route.getNodes(),
                        route.getDegradedSegments()
                );
                trips.add(trip);
                logger.debug("Trip {} covers {} houses over {} route nodes",
                        trip.getTripId(), trip.getHouseCount(), trip.getRouteNodes().size());
            }
        }

        if (degradedSegments > 0) {
            logger.warn("{} route segments fell back to direct connections", degradedSegments);
        }

        RunDiagnostics diagnostics = new RunDiagnostics(graph.skippedGeometries(), degradedSegments,
                unsnappedPoints, rejectedVehicleIds, unassignedHouses);
        return assignmentAggregator.aggregate(activeVehicles, tripsByVehicle, diagnostics);
    }
}
