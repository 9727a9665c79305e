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

import java.io.IOException;

/**
 * Represents a single observation of a counter.
 *
 * A sample consists of a timestamp in epoch milliseconds and the raw counter reading at that
 * instant. Samples are immutable once observed.
 */
public interface Sample {
    /**
     * Get the timestamp of the sample.
     *
     * @return the timestamp in milliseconds
     */
    long getTimestamp();

    /**
     * Get the raw counter value of this sample.
     *
     * @return the value as a double
     */
    double getValue();

    /**
     * Write this sample to the output stream for serialization.
     *
     * @param out the output stream
     * @throws IOException if an I/O error occurs
     */
    void writeTo(StreamOutput out) throws IOException;

    /**
     * Create a sample instance from the input stream for deserialization.
     *
     * @param in the input stream
     * @return a new sample instance
     * @throws IOException if an I/O error occurs
     */
    static Sample readFrom(StreamInput in) throws IOException {
        return new FloatSample(in);
    }
}
