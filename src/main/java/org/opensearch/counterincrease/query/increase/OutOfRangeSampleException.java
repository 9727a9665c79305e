/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.counterincrease.query.increase;

/**
 * Thrown when a sample lies outside the [lowest, greatest] bounds an engine instance was created with.
 * The caller violated the declared time bound; the sample is not ingested.
 */
public class OutOfRangeSampleException extends IllegalArgumentException {

    private final long timestamp;

    /**
     * @param message description of the violation
     * @param timestamp the rejected sample timestamp
     */
    public OutOfRangeSampleException(String message, long timestamp) {
        super(message);
        this.timestamp = timestamp;
    }

    /**
     * @return the timestamp of the rejected sample
     */
    public long getTimestamp() {
        return timestamp;
    }
}
