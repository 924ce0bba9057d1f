package com.wardroute.router.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "optimizer")
public class OptimizerProperties {

    /** Seed for k-means++ initialisation; fixed so identical input partitions identically. */
    private long randomSeed = 42L;

    /** Number of k-means restarts; the lowest-inertia run wins. */
    private int restarts = 10;

    private int maxIterations = 300;

    /** Convergence threshold on centroid shift, relative to the mean per-axis variance. */
    private double tolerance = 1e-4;

    /** Linear degrees-to-meters factor used when reporting distances. */
    private double metersPerDegree = 111000.0;

    /** Decimal places kept when keying road graph nodes by coordinate. */
    private int coordinatePrecision = 9;
}
