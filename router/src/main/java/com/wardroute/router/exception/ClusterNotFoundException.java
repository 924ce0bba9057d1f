package com.wardroute.router.exception;

public class ClusterNotFoundException extends RuntimeException {

    public ClusterNotFoundException(int clusterId) {
        super("Cluster " + clusterId + " not found");
    }
}
