package com.wardroute.router.exception;

public class FleetClientException extends RuntimeException {

    public FleetClientException(String message) {
        super(message);
    }

    public FleetClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
