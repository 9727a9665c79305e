/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.counterincrease.query.increase;

import java.util.Locale;

/**
 * Counter functions computed by the window engine.
 */
public enum CounterFunction {
    /** Extrapolated, reset-compensated increase over each window. */
    INCREASE("increase"),
    /** The increase divided by the window range in seconds. */
    RATE("rate");

    private final String name;

    CounterFunction(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Parse function type from string.
     * @param name the function name
     * @return the corresponding function
     */
    public static CounterFunction fromString(String name) {
        String normalized = name.toLowerCase(Locale.ROOT);
        for (CounterFunction function : values()) {
            if (function.name.equals(normalized)) {
                return function;
            }
        }
        throw new IllegalArgumentException("Unknown counter function: " + name);
    }

    @Override
    public String toString() {
        return name;
    }
}
