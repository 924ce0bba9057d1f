package com.wardroute.router.controller;

import com.wardroute.router.dto.AllClustersRoadsResponse;
import com.wardroute.router.dto.ClusterRoadsResponse;
import com.wardroute.router.dto.RouteRequest;
import com.wardroute.router.dto.RouteResponse;
import com.wardroute.router.exception.ClusterNotFoundException;
import com.wardroute.router.exception.FleetClientException;
import com.wardroute.router.exception.InputException;
import com.wardroute.router.service.ClusterRoadsService;
import com.wardroute.router.service.JobTrackingService;
import com.wardroute.router.service.KafkaRouteProducer;
import com.wardroute.router.service.RouteOptimizationService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;

@RestController
@RequestMapping("/api/route")
public class RouteController {

    private static final Logger logger = LoggerFactory.getLogger(RouteController.class);

    @Autowired
    private RouteOptimizationService routeOptimizationService;

    @Autowired
    private ClusterRoadsService clusterRoadsService;

    @Autowired(required = false)
    private KafkaRouteProducer kafkaRouteProducer;

    @Autowired
    private JobTrackingService jobTrackingService;

    @Value("${kafka.enabled:true}")
    private boolean kafkaEnabled;

    @Value("${kafka.batch.threshold:500}")
    private int kafkaBatchThreshold;

    @Value("${kafka.job.timeout:3m}")
    private Duration jobTimeout;

    @PostMapping("/optimize")
    public ResponseEntity<RouteResponse> optimizeRoute(@Valid @RequestBody RouteRequest request) {
        try {
            int demandCount = request.getDemandPoints().size();
            logger.info("Received optimization request for ward {} with {} demand points",
                    request.getWardNo(), demandCount);

            // Large wards go through the job queue, small ones are solved inline
            if (kafkaEnabled && kafkaRouteProducer != null && demandCount > kafkaBatchThreshold) {
                return handleWithKafka(request);
            } else {
                return ResponseEntity.ok(routeOptimizationService.optimizeRoute(request));
            }

        } catch (InputException e) {
            logger.warn("Route optimization rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(RouteResponse.error(e.getMessage()));
        } catch (FleetClientException e) {
            logger.error("Fleet lookup failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(RouteResponse.error(e.getMessage()));
        } catch (Exception e) {
            logger.error("Route optimization failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(RouteResponse.error("Route optimization failed: " + e.getMessage()));
        }
    }

    @PostMapping("/clusters/{clusterId}")
    public ResponseEntity<?> getClusterRoads(@PathVariable int clusterId,
                                             @Valid @RequestBody RouteRequest request) {
        try {
            ClusterRoadsResponse response = clusterRoadsService.getClusterRoads(clusterId, request);
            return ResponseEntity.ok(response);
        } catch (ClusterNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(RouteResponse.error(e.getMessage()));
        } catch (Exception e) {
            return clusterError(e);
        }
    }

    @PostMapping("/clusters")
    public ResponseEntity<?> getAllClusterRoads(@Valid @RequestBody RouteRequest request) {
        try {
            AllClustersRoadsResponse response = clusterRoadsService.getAllClusterRoads(request);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            return clusterError(e);
        }
    }

    private ResponseEntity<RouteResponse> handleWithKafka(RouteRequest request) {
        String jobId = kafkaRouteProducer.submitOptimizationJob(request);

        RouteResponse response = jobTrackingService.waitForResult(jobId, jobTimeout);

        if (response.isError()) {
            return ResponseEntity.badRequest().body(response);
        }
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<RouteResponse> clusterError(Exception e) {
        if (e instanceof InputException) {
            return ResponseEntity.badRequest().body(RouteResponse.error(e.getMessage()));
        }
        if (e instanceof FleetClientException) {
            logger.error("Fleet lookup failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(RouteResponse.error(e.getMessage()));
        }
        logger.error("Cluster query failed: {}", e.getMessage(), e);
        return ResponseEntity.internalServerError().body(RouteResponse.error("Cluster query failed: " + e.getMessage()));
    }
}
