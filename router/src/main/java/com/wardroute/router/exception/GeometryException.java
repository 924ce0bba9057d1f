package com.wardroute.router.exception;

import lombok.Getter;

@Getter
public class GeometryException extends RuntimeException {

    private final int featureIndex;

    public GeometryException(int featureIndex, String message) {
        super("Road feature " + featureIndex + ": " + message);
        this.featureIndex = featureIndex;
    }
}
