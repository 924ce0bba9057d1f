package com.wardroute.router.model;

import lombok.Value;

@Value
public class SnappedStop {

    public static final int NO_NODE = -1;

    DemandPoint demandPoint;
    Coordinate node;
    int nodeIndex;
    double distance;

    public static SnappedStop unsnapped(DemandPoint demandPoint) {
        return new SnappedStop(demandPoint, demandPoint.getCoordinate(), NO_NODE, 0.0);
    }

    public boolean isUnsnapped() {
        return nodeIndex == NO_NODE;
    }

    public long getDemandPointId() {
        return demandPoint.getId();
    }
}
