package com.wardroute.router.algorithm;

import com.wardroute.router.model.Coordinate;
import com.wardroute.router.model.SnappedStop;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy nearest-neighbour ordering of a trip's stops. Heuristic, not an optimal tour.
 */
@Component
public class StopSequencer {

    /**
     * Starts from the first stop as given and repeatedly moves to the remaining stop whose
     * snapped node is closest to the current one; ties go to the lowest remaining index.
     */
    public List<SnappedStop> sequence(List<SnappedStop> stops) {
        if (stops.isEmpty()) {
            return new ArrayList<>();
        }

        List<SnappedStop> remaining = new ArrayList<>(stops);
        List<SnappedStop> sorted = new ArrayList<>(stops.size());

        SnappedStop current = remaining.remove(0);
        sorted.add(current);

        while (!remaining.isEmpty()) {
            int nearestIndex = findNearestStop(current.getNode(), remaining);
            current = remaining.remove(nearestIndex);
            sorted.add(current);
        }
        return sorted;
    }

    private int findNearestStop(Coordinate position, List<SnappedStop> stops) {
        int nearestIndex = 0;
        double minDistance = Double.MAX_VALUE;

        for (int i = 0; i < stops.size(); i++) {
            double distance = position.distanceTo(stops.get(i).getNode());
            if (distance < minDistance) {
                minDistance = distance;
                nearestIndex = i;
            }
        }
        return nearestIndex;
    }
}
