package com.wardroute.router.algorithm;

import com.wardroute.router.exception.CapacityException;
import com.wardroute.router.model.Cluster;
import com.wardroute.router.model.DemandPoint;
import com.wardroute.router.model.Vehicle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class CapacitySegmenter {

    private static final Logger logger = LoggerFactory.getLogger(CapacitySegmenter.class);

    /**
     * Cuts the cluster into consecutive trips of at most {@code capacityPerTrip} members,
     * keeping the cluster's member order. Split boundaries are never re-optimized.
     *
     * @throws CapacityException when the vehicle's capacity per trip is not positive
     */
    public List<List<DemandPoint>> segment(Cluster cluster, Vehicle vehicle) {
        int capacity = vehicle.getCapacityPerTrip();
        if (capacity <= 0) {
            throw new CapacityException(vehicle.getId(), capacity);
        }

        List<DemandPoint> members = cluster.getMembers();
        List<List<DemandPoint>> trips = new ArrayList<>();
        for (int i = 0; i < members.size(); i += capacity) {
            int endIndex = Math.min(i + capacity, members.size());
            trips.add(List.copyOf(members.subList(i, endIndex)));
        }

        if (trips.size() > 1) {
            logger.debug("Cluster {} ({} houses) split into {} trips for vehicle {} with capacity {}",
                    cluster.getClusterId(), members.size(), trips.size(), vehicle.getId(), capacity);
        }
        return trips;
    }
}
