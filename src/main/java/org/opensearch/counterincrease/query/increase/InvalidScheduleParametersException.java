/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.counterincrease.query.increase;

/**
 * Thrown when a window schedule cannot be built from the supplied lowest/greatest time,
 * step and range.
 */
public class InvalidScheduleParametersException extends IllegalArgumentException {

    /**
     * @param message description of the rejected parameters
     */
    public InvalidScheduleParametersException(String message) {
        super(message);
    }
}
