/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.counterincrease.query.aggregator;

import org.opensearch.counterincrease.core.model.Sample;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One labelled series of samples flowing through the pipeline stages.
 *
 * <h2>Time Range Semantics:</h2>
 * <p>The {@code minTimestamp} and {@code maxTimestamp} fields define the time range boundaries
 * (both inclusive) for this time series. These represent the conceptual start and end of the
 * time series, <strong>not necessarily the actual timestamps present in the samples list</strong>.
 * The samples list is sparse: windows or points without data have no entry.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * List<Sample> samples = List.of(new FloatSample(1000L, 1.0), new FloatSample(2000L, 2.0));
 * TimeSeries series = new TimeSeries(samples, Map.of("__name__", "http_requests_total"), 1000L, 3000L, 1000L);
 * }</pre>
 */
public class TimeSeries {

    private final List<Sample> samples;
    private final Map<String, String> labels;
    private final long minTimestamp;
    private final long maxTimestamp;
    private final long step;

    /**
     * @param samples samples in ascending timestamp order
     * @param labels labels identifying the series, may be null for an unlabelled series
     * @param minTimestamp minimum timestamp boundary (inclusive)
     * @param maxTimestamp maximum timestamp boundary (inclusive)
     * @param step step size between samples
     */
    public TimeSeries(List<Sample> samples, Map<String, String> labels, long minTimestamp, long maxTimestamp, long step) {
        this.samples = List.copyOf(samples);
        this.labels = labels == null ? Collections.emptyMap() : Collections.unmodifiableMap(new TreeMap<>(labels));
        this.minTimestamp = minTimestamp;
        this.maxTimestamp = maxTimestamp;
        this.step = step;
    }

    /**
     * @return the samples, in ascending timestamp order
     */
    public List<Sample> getSamples() {
        return samples;
    }

    /**
     * @return the labels, sorted by name
     */
    public Map<String, String> getLabels() {
        return labels;
    }

    /**
     * @return the minimum timestamp boundary (inclusive)
     */
    public long getMinTimestamp() {
        return minTimestamp;
    }

    /**
     * @return the maximum timestamp boundary (inclusive)
     */
    public long getMaxTimestamp() {
        return maxTimestamp;
    }

    /**
     * @return the step size in milliseconds
     */
    public long getStep() {
        return step;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimeSeries that = (TimeSeries) o;
        return Objects.equals(samples, that.samples)
            && Objects.equals(labels, that.labels)
            && minTimestamp == that.minTimestamp
            && maxTimestamp == that.maxTimestamp
            && step == that.step;
    }

    @Override
    public int hashCode() {
        return Objects.hash(samples, labels, minTimestamp, maxTimestamp, step);
    }

    @Override
    public String toString() {
        return "TimeSeries{"
            + "samples="
            + samples
            + ", labels="
            + labels
            + ", minTimestamp="
            + minTimestamp
            + ", maxTimestamp="
            + maxTimestamp
            + ", step="
            + step
            + '}';
    }
}
