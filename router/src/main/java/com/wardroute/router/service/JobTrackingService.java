package com.wardroute.router.service;

import com.wardroute.router.dto.RouteResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Service
public class JobTrackingService {

    private static final Logger logger = LoggerFactory.getLogger(JobTrackingService.class);

    private final Map<String, JobStatus> jobStatuses = new ConcurrentHashMap<>();
    private final Map<String, RouteResponse> jobResults = new ConcurrentHashMap<>();
    private final Map<String, CountDownLatch> jobLatches = new ConcurrentHashMap<>();

    public void createJob(String jobId, int demandPoints) {
        jobStatuses.put(jobId, new JobStatus(demandPoints));
        jobLatches.put(jobId, new CountDownLatch(1));
        logger.info("Created job {} for {} demand points", jobId, demandPoints);
    }

    public void completeJob(String jobId, RouteResponse response) {
        JobStatus status = jobStatuses.get(jobId);
        if (status == null) {
            logger.warn("Received result for unknown job: {}", jobId);
            return;
        }

        jobResults.put(jobId, response);
        CountDownLatch latch = jobLatches.get(jobId);
        if (latch != null) {
            latch.countDown();
        }
        logger.info("Job {} ({} demand points) finished with status {} after {} ms",
                jobId, status.getDemandPoints(), response.getStatus(), System.currentTimeMillis() - status.getCreatedAt());
    }

    public void failJob(String jobId, String reason) {
        completeJob(jobId, RouteResponse.error(reason));
    }

    public RouteResponse waitForResult(String jobId, Duration timeout) {
        CountDownLatch latch = jobLatches.get(jobId);
        if (latch == null) {
            return RouteResponse.error("Job not found");
        }

        try {
            boolean completed = latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!completed) {
                logger.warn("Job {} timed out after {} seconds", jobId, timeout.getSeconds());
                return RouteResponse.error("Request timed out");
            }

            RouteResponse result = jobResults.get(jobId);
            return result != null ? result : RouteResponse.error("Job failed");

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Job {} was interrupted", jobId);
            return RouteResponse.error("Request was interrupted");
        } finally {
            cleanup(jobId);
        }
    }

    private void cleanup(String jobId) {
        jobStatuses.remove(jobId);
        jobResults.remove(jobId);
        jobLatches.remove(jobId);
        logger.debug("Cleaned up job {}", jobId);
    }

    private static class JobStatus {
        private final int demandPoints;
        private final long createdAt;

        public JobStatus(int demandPoints) {
            this.demandPoints = demandPoints;
            this.createdAt = System.currentTimeMillis();
        }

        public int getDemandPoints() {
            return demandPoints;
        }

        public long getCreatedAt() {
            return createdAt;
        }
    }
}
