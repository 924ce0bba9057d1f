package com.wardroute.router.service;

import com.wardroute.router.dto.RouteOptimizationMessage;
import com.wardroute.router.dto.RouteResponse;
import com.wardroute.router.exception.InputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.annotation.RetryableTopic;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.retry.annotation.Backoff;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "kafka.enabled", havingValue = "true")
public class KafkaRouteConsumer {

    private static final Logger logger = LoggerFactory.getLogger(KafkaRouteConsumer.class);

    @Autowired
    private RouteOptimizationService routeOptimizationService;

    @Autowired
    private JobTrackingService jobTrackingService;

    @RetryableTopic(
            attempts = "3",
            backoff = @Backoff(delay = 2000, multiplier = 2.0),
            dltStrategy = org.springframework.kafka.retrytopic.DltStrategy.FAIL_ON_ERROR
    )
    @KafkaListener(topics = KafkaRouteProducer.TOPIC)
    public void processJob(RouteOptimizationMessage message,
                           @Header(KafkaHeaders.RECEIVED_TOPIC) String topic,
                           @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
                           Acknowledgment ack) {

        String jobId = message.getJobId();
        logger.info("Processing job {} from {} (partition: {}), queued {} ms",
                jobId, topic, partition, System.currentTimeMillis() - message.getSubmittedAt());

        try {
            RouteResponse response = routeOptimizationService.optimizeRoute(message.getRequest());
            jobTrackingService.completeJob(jobId, response);
            ack.acknowledge();

            logger.info("Completed job {} with {} houses in {} trips",
                    jobId, response.getTotalHouses(), response.getTotalTrips());

        } catch (InputException e) {
            logger.warn("Job {} rejected: {}", jobId, e.getMessage());
            jobTrackingService.failJob(jobId, e.getMessage());
            ack.acknowledge();

        } catch (Exception e) {
            logger.error("Failed to process job {}: {}", jobId, e.getMessage(), e);
            jobTrackingService.failJob(jobId, "Route optimization failed: " + e.getMessage());
            ack.acknowledge();
        }
    }
}
