package com.ryuqq.fanout.adapter.inmemory.api;

import java.util.List;

/**
 * Aggregation applied to the datapoints of one period bucket.
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public enum Statistic {

    AVERAGE("Average"),
    SUM("Sum"),
    MINIMUM("Minimum"),
    MAXIMUM("Maximum"),
    SAMPLE_COUNT("SampleCount");

    private final String label;

    Statistic(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Looks up a statistic by its wire label (e.g. "Average").
     *
     * @param label the statistic label
     * @return the matching statistic, or null if the label is unknown
     */
    public static Statistic fromLabel(String label) {
        for (Statistic statistic : values()) {
            if (statistic.label.equals(label)) {
                return statistic;
            }
        }
        return null;
    }

    /**
     * Aggregates the values of one bucket.
     *
     * @param values non-empty bucket values
     * @return the aggregated value
     * @throws IllegalArgumentException if values is null or empty
     */
    public double aggregate(List<Double> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("values cannot be null or empty");
        }
        switch (this) {
            case SUM:
                return sum(values);
            case MINIMUM:
                return values.stream().mapToDouble(Double::doubleValue).min().getAsDouble();
            case MAXIMUM:
                return values.stream().mapToDouble(Double::doubleValue).max().getAsDouble();
            case SAMPLE_COUNT:
                return values.size();
            case AVERAGE:
            default:
                return sum(values) / values.size();
        }
    }

    private static double sum(List<Double> values) {
        double total = 0;
        for (Double value : values) {
            total += value;
        }
        return total;
    }
}
