package com.wardroute.router.service;

import com.wardroute.router.dto.DemandPointDto;
import com.wardroute.router.dto.RouteOptimizationMessage;
import com.wardroute.router.dto.RouteRequest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KafkaRouteProducerTest {

    @Mock
    private KafkaTemplate<String, RouteOptimizationMessage> kafkaTemplate;

    @Mock
    private JobTrackingService jobTrackingService;

    @InjectMocks
    private KafkaRouteProducer kafkaRouteProducer;

    @Test
    void shouldRegisterJobAndPublishWholeRequest() {
        RouteRequest request = new RouteRequest();
        request.setWardNo("7");
        request.setDemandPoints(List.of(new DemandPointDto(1L, 85.3, 27.7), new DemandPointDto(2L, 85.31, 27.7)));

        String jobId = kafkaRouteProducer.submitOptimizationJob(request);

        assertNotNull(jobId);
        verify(jobTrackingService).createJob(jobId, 2);

        ArgumentCaptor<RouteOptimizationMessage> message = ArgumentCaptor.forClass(RouteOptimizationMessage.class);
        verify(kafkaTemplate, times(1)).send(eq(KafkaRouteProducer.TOPIC), eq(jobId), message.capture());
        assertEquals(jobId, message.getValue().getJobId());
        assertSame(request, message.getValue().getRequest());
        assertTrue(message.getValue().getSubmittedAt() > 0);
    }

    @Test
    void shouldUseDistinctJobIds() {
        RouteRequest request = new RouteRequest();
        request.setDemandPoints(List.of(new DemandPointDto(1L, 85.3, 27.7)));

        String first = kafkaRouteProducer.submitOptimizationJob(request);
        String second = kafkaRouteProducer.submitOptimizationJob(request);

        assertNotEquals(first, second);
        verify(kafkaTemplate, times(2)).send(eq(KafkaRouteProducer.TOPIC), anyString(), any(RouteOptimizationMessage.class));
    }
}
