package com.flowmetrics.service.core.query;

import com.flowmetrics.service.core.archive.AggregateStats;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Percentiles over exact samples and archived buckets. An archived bucket is expanded into evenly spaced points on
 * the two segments min to mean and mean to max, each carrying an equal share of the bucket count.
 */
public final class PercentileEstimator {

    static final int MAX_POINTS_PER_BUCKET = 100;

    private PercentileEstimator() {}

    /** Nearest-rank on an ascending list: index {@code min(floor(n * p), n - 1)}. */
    public static Double exact(List<Double> sorted, double p) {
        int n = sorted.size();
        if (n == 0) {
            return null;
        }
        int index = Math.min((int) (n * p), n - 1);
        return sorted.get(index);
    }

    /** Weighted nearest-rank; with only exact samples this matches {@link #exact}. */
    public static Double estimate(List<Double> exactSamples, Collection<AggregateStats> buckets, double p) {
        List<WeightedPoint> points = new ArrayList<>(exactSamples.size());
        for (Double value : exactSamples) {
            points.add(new WeightedPoint(value, 1.0));
        }
        for (AggregateStats bucket : buckets) {
            expand(bucket, points);
        }
        if (points.isEmpty()) {
            return null;
        }
        points.sort(Comparator.comparingDouble(WeightedPoint::value));
        double total = 0.0;
        for (WeightedPoint point : points) {
            total += point.weight();
        }
        double target = p * total;
        double cumulative = 0.0;
        for (WeightedPoint point : points) {
            cumulative += point.weight();
            if (cumulative > target) {
                return point.value();
            }
        }
        return points.get(points.size() - 1).value();
    }

    static void expand(AggregateStats bucket, List<WeightedPoint> into) {
        if (bucket.isEmpty()) {
            return;
        }
        int k = (int) Math.min(bucket.count(), MAX_POINTS_PER_BUCKET);
        double weight = (double) bucket.count() / k;
        for (int i = 0; i < k; i++) {
            double q = (i + 0.5) / k;
            into.add(new WeightedPoint(interpolate(bucket, q), weight));
        }
    }

    static double interpolate(AggregateStats bucket, double q) {
        double mean = bucket.sum() / bucket.count();
        if (q < 0.5) {
            return bucket.min() + (mean - bucket.min()) * (q / 0.5);
        }
        return mean + (bucket.max() - mean) * ((q - 0.5) / 0.5);
    }

    record WeightedPoint(double value, double weight) {}
}
