/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.counterincrease.query.increase;

/**
 * Thrown when two partial states cannot be combined: their schedules differ, or within one window
 * their sample ranges overlap in time so reset detection across the seam would be wrong.
 */
public class UnmergeablePartialsException extends IllegalStateException {

    /**
     * @param message description of the conflict
     */
    public UnmergeablePartialsException(String message) {
        super(message);
    }
}
