package com.wardroute.router.algorithm;

import com.wardroute.router.config.OptimizerProperties;
import com.wardroute.router.exception.InputException;
import com.wardroute.router.model.Cluster;
import com.wardroute.router.model.DemandPoint;
import com.wardroute.router.model.Vehicle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Splits demand points among active vehicles with seeded k-means over Web Mercator
 * coordinates.
 * <p>
 * Initialisation is k-means++ driven by a single {@link Random} seeded from
 * {@link OptimizerProperties#getRandomSeed()}; {@code restarts} runs are made and the one
 * with the lowest inertia is kept (earliest run on ties). Cluster ids are renumbered by
 * first appearance in input order, so cluster {@code i} is owned by the {@code i}-th active
 * vehicle and always contains the earliest demand point not held by a lower cluster.
 * </p>
 */
@Component
public class DemandPartitioner {

    private static final Logger logger = LoggerFactory.getLogger(DemandPartitioner.class);
    private static final double EARTH_RADIUS_METERS = 6378137.0;
    private static final double MAX_MERCATOR_LATITUDE = 85.05112878;

    private final OptimizerProperties properties;

    public DemandPartitioner(OptimizerProperties properties) {
        this.properties = properties;
    }

    /**
     * @param demandPoints   points in input enumeration order
     * @param activeVehicles vehicles already filtered to active status, in input order
     * @return one cluster per non-empty partition cell, at most {@code min(vehicles, points)}
     */
    public List<Cluster> partition(List<DemandPoint> demandPoints, List<Vehicle> activeVehicles) {
        if (demandPoints == null || demandPoints.isEmpty()) {
            throw new InputException(InputException.Reason.EMPTY_DEMAND);
        }
        if (activeVehicles == null || activeVehicles.isEmpty()) {
            throw new InputException(InputException.Reason.NO_ACTIVE_VEHICLES);
        }

        int k = Math.min(activeVehicles.size(), demandPoints.size());
        double[][] projected = project(demandPoints);
        int[] labels = k == 1 ? new int[demandPoints.size()] : bestOfRestarts(projected, k);
        int[] canonical = canonicalize(labels);

        List<List<DemandPoint>> members = new ArrayList<>();
        for (int i = 0; i < demandPoints.size(); i++) {
            int clusterId = canonical[i];
            while (members.size() <= clusterId) {
                members.add(new ArrayList<>());
            }
            members.get(clusterId).add(demandPoints.get(i));
        }

        List<Cluster> clusters = new ArrayList<>(members.size());
        for (int clusterId = 0; clusterId < members.size(); clusterId++) {
            String vehicleId = activeVehicles.get(clusterId).getId();
            clusters.add(new Cluster(clusterId, vehicleId, members.get(clusterId)));
            logger.debug("Cluster {} -> vehicle {} with {} demand points",
                    clusterId, vehicleId, members.get(clusterId).size());
        }

        logger.info("Partitioned {} demand points into {} clusters for {} active vehicles",
                demandPoints.size(), clusters.size(), activeVehicles.size());
        return clusters;
    }

    static double[][] project(List<DemandPoint> demandPoints) {
        double[][] projected = new double[demandPoints.size()][2];
        for (int i = 0; i < demandPoints.size(); i++) {
            double lon = demandPoints.get(i).getCoordinate().getLongitude();
            double lat = Math.max(-MAX_MERCATOR_LATITUDE,
                    Math.min(MAX_MERCATOR_LATITUDE, demandPoints.get(i).getCoordinate().getLatitude()));
            projected[i][0] = EARTH_RADIUS_METERS * Math.toRadians(lon);
            projected[i][1] = EARTH_RADIUS_METERS * Math.log(Math.tan(Math.PI / 4 + Math.toRadians(lat) / 2));
        }
        return projected;
    }

    private int[] bestOfRestarts(double[][] points, int k) {
        Random random = new Random(properties.getRandomSeed());
        double tolerance = properties.getTolerance() * meanVariance(points);
        int restarts = Math.max(1, properties.getRestarts());

        int[] bestLabels = null;
        double bestInertia = Double.POSITIVE_INFINITY;

        for (int run = 0; run < restarts; run++) {
            double[][] centroids = seedCentroids(points, k, random);
            int[] labels = new int[points.length];
            double inertia = lloyd(points, centroids, labels, tolerance);
            logger.debug("k-means restart {} finished with inertia {}", run, inertia);
            if (inertia < bestInertia) {
                bestInertia = inertia;
                bestLabels = labels;
            }
        }
        return bestLabels;
    }

    /**
     * k-means++ seeding: each further centroid is drawn with probability proportional to
     * its squared distance from the nearest centroid chosen so far.
     */
    private double[][] seedCentroids(double[][] points, int k, Random random) {
        int n = points.length;
        double[][] centroids = new double[k][];
        centroids[0] = points[random.nextInt(n)].clone();

        double[] nearest = new double[n];
        for (int i = 0; i < n; i++) {
            nearest[i] = squaredDistance(points[i], centroids[0]);
        }

        for (int c = 1; c < k; c++) {
            double total = 0.0;
            for (double d : nearest) {
                total += d;
            }

            int chosen;
            if (total <= 0.0) {
                chosen = random.nextInt(n);
            } else {
                double target = random.nextDouble() * total;
                double cumulative = 0.0;
                chosen = n - 1;
                for (int i = 0; i < n; i++) {
                    cumulative += nearest[i];
                    if (cumulative > target) {
                        chosen = i;
                        break;
                    }
                }
            }

            centroids[c] = points[chosen].clone();
            for (int i = 0; i < n; i++) {
                nearest[i] = Math.min(nearest[i], squaredDistance(points[i], centroids[c]));
            }
        }
        return centroids;
    }

    /**
     * Runs Lloyd iterations in place. Labels are always refreshed against the final
     * centroids, including when the iteration budget runs out.
     *
     * @return inertia of the final labelling
     */
    double lloyd(double[][] points, double[][] centroids, int[] labels, double tolerance) {
        Arrays.fill(labels, -1);
        int maxIterations = Math.max(1, properties.getMaxIterations());
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            boolean changed = assign(points, centroids, labels);
            if (!changed) {
                break;
            }
            double shift = updateCentroids(points, centroids, labels);
            if (shift <= tolerance) {
                break;
            }
        }
        assign(points, centroids, labels);

        double inertia = 0.0;
        for (int i = 0; i < points.length; i++) {
            inertia += squaredDistance(points[i], centroids[labels[i]]);
        }
        return inertia;
    }

    private boolean assign(double[][] points, double[][] centroids, int[] labels) {
        boolean changed = false;
        for (int i = 0; i < points.length; i++) {
            int best = 0;
            double bestDistance = squaredDistance(points[i], centroids[0]);
            for (int c = 1; c < centroids.length; c++) {
                double distance = squaredDistance(points[i], centroids[c]);
                if (distance < bestDistance) {
                    bestDistance = distance;
                    best = c;
                }
            }
            if (labels[i] != best) {
                labels[i] = best;
                changed = true;
            }
        }
        return changed;
    }

    /**
     * Moves each centroid to the mean of its members. Empty clusters keep their centroid.
     *
     * @return total squared centroid shift
     */
    private double updateCentroids(double[][] points, double[][] centroids, int[] labels) {
        int k = centroids.length;
        double[][] sums = new double[k][2];
        int[] counts = new int[k];
        for (int i = 0; i < points.length; i++) {
            sums[labels[i]][0] += points[i][0];
            sums[labels[i]][1] += points[i][1];
            counts[labels[i]]++;
        }

        double shift = 0.0;
        for (int c = 0; c < k; c++) {
            if (counts[c] == 0) {
                continue;
            }
            double[] updated = {sums[c][0] / counts[c], sums[c][1] / counts[c]};
            shift += squaredDistance(updated, centroids[c]);
            centroids[c] = updated;
        }
        return shift;
    }

    private static int[] canonicalize(int[] labels) {
        Map<Integer, Integer> renumbered = new HashMap<>();
        int[] canonical = new int[labels.length];
        for (int i = 0; i < labels.length; i++) {
            Integer id = renumbered.get(labels[i]);
            if (id == null) {
                id = renumbered.size();
                renumbered.put(labels[i], id);
            }
            canonical[i] = id;
        }
        return canonical;
    }

    private static double meanVariance(double[][] points) {
        double variance = 0.0;
        for (int axis = 0; axis < 2; axis++) {
            double mean = 0.0;
            for (double[] point : points) {
                mean += point[axis];
            }
            mean /= points.length;
            double sum = 0.0;
            for (double[] point : points) {
                sum += (point[axis] - mean) * (point[axis] - mean);
            }
            variance += sum / points.length;
        }
        return variance / 2;
    }

    private static double squaredDistance(double[] a, double[] b) {
        double dx = a[0] - b[0];
        double dy = a[1] - b[1];
        return dx * dx + dy * dy;
    }
}
