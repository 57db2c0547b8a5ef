package com.assetmetrics.history.domain;

/**
 * One value of one metric.
 *
 * @param epochSeconds Sample time (Unix epoch seconds)
 * @param value Metric value
 */
public record DataPoint(
    long epochSeconds,
    double value
) {}
