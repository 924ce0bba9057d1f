package com.wardroute.router.service;

import com.wardroute.router.algorithm.DemandPartitioner;
import com.wardroute.router.algorithm.RoadSnapper;
import com.wardroute.router.config.OptimizerProperties;
import com.wardroute.router.dto.AllClustersRoadsResponse;
import com.wardroute.router.dto.ClusterRoadsResponse;
import com.wardroute.router.dto.DemandPointDto;
import com.wardroute.router.dto.RoadGeometryDto;
import com.wardroute.router.dto.RouteRequest;
import com.wardroute.router.dto.VehicleDto;
import com.wardroute.router.exception.ClusterNotFoundException;
import com.wardroute.router.exception.InputException;
import com.wardroute.router.graph.RoadNetworkBuilder;
import com.wardroute.router.model.Vehicle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ClusterRoadsServiceTest {

    @Mock
    private FleetClient fleetClient;

    private ClusterRoadsService service;

    @BeforeEach
    void setUp() {
        OptimizerProperties properties = new OptimizerProperties();
        service = new ClusterRoadsService(
                new RouteRequestAdapter(fleetClient),
                new RoadNetworkBuilder(properties),
                new DemandPartitioner(properties),
                new RoadSnapper(),
                properties);
    }

    @Test
    void shouldDescribeRoadsTouchedByCluster() {
        ClusterRoadsResponse response = service.getClusterRoads(0, wardRequest());

        assertEquals(0, response.getClusterId());
        assertEquals("V1", response.getVehicleInfo().getVehicleId());
        assertEquals(3, response.getBuildingsCount());
        // nodes 0..2 touch edges 0-1, 1-2 and the link 2-3 once each
        assertEquals(3, response.getTotalRoadSegments());
        assertEquals(111.0, response.getRoads().get(0).getDistanceMeters(), 0.01);
        assertEquals(85.300, response.getClusterBounds().getMinLongitude(), 1e-9);
        assertEquals(85.302, response.getClusterBounds().getMaxLongitude(), 1e-9);
    }

    @Test
    void shouldDescribeEveryCluster() {
        AllClustersRoadsResponse response = service.getAllClusterRoads(wardRequest());

        assertEquals(2, response.getTotalClusters());
        assertEquals("V2", response.getClusters().get(1).getVehicleInfo().getVehicleId());
        assertEquals(3, response.getClusters().get(1).getBuildingsCount());
    }

    @Test
    void shouldRejectUnknownCluster() {
        assertThrows(ClusterNotFoundException.class, () -> service.getClusterRoads(2, wardRequest()));
        assertThrows(ClusterNotFoundException.class, () -> service.getClusterRoads(-1, wardRequest()));
    }

    @Test
    void shouldLoadFleetForWardWhenVehiclesAreOmitted() {
        RouteRequest request = wardRequest();
        request.setVehicles(null);
        request.setWardNo("7");
        when(fleetClient.fetchVehiclesByWard("7")).thenReturn(List.of(Vehicle.active("F1", 20), Vehicle.active("F2", 20)));

        AllClustersRoadsResponse response = service.getAllClusterRoads(request);

        assertEquals(2, response.getTotalClusters());
        assertEquals("F1", response.getClusters().get(0).getVehicleInfo().getVehicleId());
        verify(fleetClient).fetchVehiclesByWard("7");
    }

    @Test
    void shouldRejectFleetWithRepeatedVehicleRecords() {
        RouteRequest request = wardRequest();
        request.setVehicles(null);
        request.setWardNo("7");
        when(fleetClient.fetchVehiclesByWard("7")).thenReturn(List.of(Vehicle.active("F1", 20), Vehicle.active("F1", 20)));

        InputException e = assertThrows(InputException.class, () -> service.getAllClusterRoads(request));

        assertEquals(InputException.Reason.DUPLICATE_VEHICLE_ID, e.getReason());
    }

    private static RouteRequest wardRequest() {
        double[] longitudes = {85.300, 85.301, 85.302, 85.350, 85.351, 85.352};
        List<DemandPointDto> points = new ArrayList<>();
        List<List<Double>> road = new ArrayList<>();
        for (int i = 0; i < longitudes.length; i++) {
            points.add(new DemandPointDto((long) i + 1, longitudes[i], 27.70));
            road.add(List.of(longitudes[i], 27.70));
        }

        RouteRequest request = new RouteRequest();
        request.setVehicles(List.of(
                new VehicleDto("V1", null, 10, "active"),
                new VehicleDto("V2", null, 10, "online")));
        request.setDemandPoints(points);
        request.setRoads(List.of(RoadGeometryDto.line(road)));
        return request;
    }
}
