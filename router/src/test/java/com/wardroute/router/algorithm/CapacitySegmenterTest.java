package com.wardroute.router.algorithm;

import com.wardroute.router.exception.CapacityException;
import com.wardroute.router.model.Cluster;
import com.wardroute.router.model.DemandPoint;
import com.wardroute.router.model.Vehicle;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CapacitySegmenterTest {

    private final CapacitySegmenter segmenter = new CapacitySegmenter();

    @Test
    void shouldSplitClusterIntoCapacitySizedTrips() {
        Cluster cluster = new Cluster(0, "V1", points(10));

        List<List<DemandPoint>> trips = segmenter.segment(cluster, Vehicle.active("V1", 4));

        assertEquals(List.of(4, 4, 2), trips.stream().map(List::size).collect(Collectors.toList()));
        assertEquals(cluster.getMembers(), trips.stream().flatMap(List::stream).collect(Collectors.toList()));
    }

    @Test
    void shouldKeepSmallClusterInOneTrip() {
        Cluster cluster = new Cluster(0, "V1", points(3));

        List<List<DemandPoint>> trips = segmenter.segment(cluster, Vehicle.active("V1", 50));

        assertEquals(1, trips.size());
        assertEquals(3, trips.get(0).size());
    }

    @Test
    void shouldFillTripsExactlyWhenCapacityDivides() {
        Cluster cluster = new Cluster(0, "V1", points(6));

        List<List<DemandPoint>> trips = segmenter.segment(cluster, Vehicle.active("V1", 3));

        assertEquals(2, trips.size());
        assertTrue(trips.stream().allMatch(trip -> trip.size() == 3));
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        Cluster cluster = new Cluster(0, "V1", points(3));

        CapacityException e = assertThrows(CapacityException.class,
                () -> segmenter.segment(cluster, Vehicle.active("V1", 0)));

        assertTrue(e.getMessage().contains("V1"));
    }

    private static List<DemandPoint> points(int count) {
        List<DemandPoint> points = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            points.add(DemandPoint.of(i + 1, 85.3 + i * 0.001, 27.7));
        }
        return points;
    }
}
