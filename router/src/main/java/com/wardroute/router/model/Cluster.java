package com.wardroute.router.model;

import lombok.Value;

import java.util.List;

/**
 * One partition cell. Member ids keep the order in which the points were supplied.
 */
@Value
public class Cluster {

    int clusterId;
    String vehicleId;
    List<DemandPoint> members;

    public Cluster(int clusterId, String vehicleId, List<DemandPoint> members) {
        this.clusterId = clusterId;
        this.vehicleId = vehicleId;
        this.members = List.copyOf(members);
    }

    public int size() {
        return members.size();
    }
}
