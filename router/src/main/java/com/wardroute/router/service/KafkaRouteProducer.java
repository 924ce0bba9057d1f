package com.wardroute.router.service;

import com.wardroute.router.dto.RouteOptimizationMessage;
import com.wardroute.router.dto.RouteRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Service
@ConditionalOnProperty(name = "kafka.enabled", havingValue = "true")
public class KafkaRouteProducer {

    private static final Logger logger = LoggerFactory.getLogger(KafkaRouteProducer.class);
    static final String TOPIC = "route-optimization-requests";

    @Autowired
    private KafkaTemplate<String, RouteOptimizationMessage> kafkaTemplate;

    @Autowired
    private JobTrackingService jobTrackingService;

    /**
     * Registers a job and publishes the whole request as one message keyed by job id.
     *
     * @return the job id to wait on
     */
    public String submitOptimizationJob(RouteRequest request) {
        String jobId = UUID.randomUUID().toString();
        int demandPoints = request.getDemandPoints() == null ? 0 : request.getDemandPoints().size();

        jobTrackingService.createJob(jobId, demandPoints);

        RouteOptimizationMessage message = new RouteOptimizationMessage(jobId, request, System.currentTimeMillis());
        kafkaTemplate.send(TOPIC, jobId, message);

        logger.info("Submitted job {} with {} demand points and {} road geometries",
                jobId, demandPoints, request.getRoads() == null ? 0 : request.getRoads().size());
        return jobId;
    }
}
