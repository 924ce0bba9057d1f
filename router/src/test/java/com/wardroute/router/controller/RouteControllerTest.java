package com.wardroute.router.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wardroute.router.dto.AllClustersRoadsResponse;
import com.wardroute.router.dto.ClusterRoadsResponse;
import com.wardroute.router.dto.DemandPointDto;
import com.wardroute.router.dto.RouteRequest;
import com.wardroute.router.dto.RouteResponse;
import com.wardroute.router.dto.VehicleDto;
import com.wardroute.router.exception.ClusterNotFoundException;
import com.wardroute.router.exception.FleetClientException;
import com.wardroute.router.exception.InputException;
import com.wardroute.router.service.ClusterRoadsService;
import com.wardroute.router.service.JobTrackingService;
import com.wardroute.router.service.KafkaRouteProducer;
import com.wardroute.router.service.RouteOptimizationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RouteController.class)
@TestPropertySource(properties = {"kafka.enabled=false", "kafka.batch.threshold=500"})
class RouteControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RouteOptimizationService routeOptimizationService;

    @MockBean
    private ClusterRoadsService clusterRoadsService;

    @MockBean
    private KafkaRouteProducer kafkaRouteProducer;

    @MockBean
    private JobTrackingService jobTrackingService;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void shouldOptimizeRouteWithValidRequest() throws Exception {
        RouteResponse response = new RouteResponse("success", "Route optimization completed with 1 active vehicles",
                1, 2, 1, new LinkedHashMap<>(), null);
        when(routeOptimizationService.optimizeRoute(any(RouteRequest.class))).thenReturn(response);

        mockMvc.perform(post("/api/route/optimize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.totalHouses").value(2))
                .andExpect(jsonPath("$.error").doesNotExist());

        verifyNoInteractions(kafkaRouteProducer);
    }

    @Test
    void shouldReturnBadRequestWhenDemandIsEmpty() throws Exception {
        when(routeOptimizationService.optimizeRoute(any(RouteRequest.class)))
                .thenThrow(new InputException(InputException.Reason.EMPTY_DEMAND));

        mockMvc.perform(post("/api/route/optimize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value("No demand points were supplied"));
    }

    @Test
    void shouldReturnBadRequestForMissingDemandPoints() throws Exception {
        RouteRequest request = validRequest();
        request.setDemandPoints(null);

        mockMvc.perform(post("/api/route/optimize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"));

        verifyNoInteractions(routeOptimizationService);
    }

    @Test
    void shouldReturnBadRequestForVehicleWithoutId() throws Exception {
        RouteRequest request = validRequest();
        request.setVehicles(List.of(new VehicleDto("", null, 5, "active")));

        mockMvc.perform(post("/api/route/optimize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldReturnBadGatewayWhenFleetIsUnreachable() throws Exception {
        when(routeOptimizationService.optimizeRoute(any(RouteRequest.class)))
                .thenThrow(new FleetClientException("Failed to fetch vehicles: connection refused"));

        mockMvc.perform(post("/api/route/optimize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    void shouldReturnClusterRoads() throws Exception {
        ClusterRoadsResponse response = new ClusterRoadsResponse(1, null, 4, List.of(), 0, null);
        when(clusterRoadsService.getClusterRoads(eq(1), any(RouteRequest.class))).thenReturn(response);

        mockMvc.perform(post("/api/route/clusters/1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.clusterId").value(1))
                .andExpect(jsonPath("$.buildingsCount").value(4));
    }

    @Test
    void shouldReturnNotFoundForUnknownCluster() throws Exception {
        when(clusterRoadsService.getClusterRoads(eq(9), any(RouteRequest.class)))
                .thenThrow(new ClusterNotFoundException(9));

        mockMvc.perform(post("/api/route/clusters/9")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    void shouldReturnAllClusters() throws Exception {
        when(clusterRoadsService.getAllClusterRoads(any(RouteRequest.class)))
                .thenReturn(new AllClustersRoadsResponse(2, List.of()));

        mockMvc.perform(post("/api/route/clusters")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalClusters").value(2));
    }

    private static RouteRequest validRequest() {
        RouteRequest request = new RouteRequest();
        request.setVehicles(List.of(new VehicleDto("V1", "garbage_truck", 5, "active")));
        request.setDemandPoints(List.of(new DemandPointDto(1L, 85.30, 27.70), new DemandPointDto(2L, 85.31, 27.70)));
        return request;
    }
}
