/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.counterincrease.core.model;

import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;

import java.io.IOException;
import java.util.Objects;

/**
 * A sample implementation that stores a floating-point counter reading.
 *
 * Used both as the input unit of counter series and as the first/last boundary
 * observations tracked by each window accumulator.
 */
public class FloatSample implements Sample, Writeable {

    /**
     * Prometheus staleness marker. A NaN with this exact bit pattern signals that a series
     * disappeared at the given timestamp rather than carrying a reading.
     */
    public static final long STALE_NAN_BITS = 0x7ff0000000000002L;

    private final long timestamp;
    private final double value;

    /**
     * Constructs a new FloatSample with the specified timestamp and value.
     *
     * @param timestamp the timestamp of the sample
     * @param value the floating-point value
     */
    public FloatSample(long timestamp, double value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    /**
     * Read a FloatSample from the input stream.
     *
     * @param in the input stream
     * @throws IOException if an I/O error occurs
     */
    public FloatSample(StreamInput in) throws IOException {
        this.timestamp = in.readLong();
        this.value = in.readDouble();
    }

    @Override
    public long getTimestamp() {
        return timestamp;
    }

    /**
     * Returns the floating-point value of this sample.
     *
     * @return the value
     */
    @Override
    public double getValue() {
        return value;
    }

    /**
     * Check whether a value is the Prometheus staleness marker.
     *
     * @param value the value to inspect
     * @return true if the value carries the stale NaN bit pattern
     */
    public static boolean isStaleMarker(double value) {
        return Double.doubleToRawLongBits(value) == STALE_NAN_BITS;
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeLong(timestamp);
        out.writeDouble(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FloatSample that = (FloatSample) o;
        return timestamp == that.timestamp && Double.compare(that.value, value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "FloatSample{" + "timestamp=" + timestamp + ", value=" + value + '}';
    }
}
