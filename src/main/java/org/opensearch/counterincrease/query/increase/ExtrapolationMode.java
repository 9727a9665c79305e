/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.counterincrease.query.increase;

import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;

import java.io.IOException;
import java.util.Locale;

/**
 * How the observed increase of a window is scaled up to the window's nominal width.
 */
public enum ExtrapolationMode implements Writeable {
    /**
     * Assume the observed average rate held over the whole window:
     * {@code increase = correctedTotal * range / (last.timestamp - first.timestamp)}.
     */
    PROPORTIONAL("proportional", (byte) 0),
    /**
     * Prometheus' {@code extrapolatedRate}: extend towards each boundary by the gap to it when the gap is
     * shorter than 1.1 average sample intervals, otherwise by half an interval, and never extend the
     * start past the point where the counter would have been zero.
     */
    PROMETHEUS("prometheus", (byte) 1);

    private final String name;
    private final byte id;

    ExtrapolationMode(String name, byte id) {
        this.name = name;
        this.id = id;
    }

    /**
     * @return the name used in settings and stage arguments
     */
    public String getName() {
        return name;
    }

    /**
     * Parse a mode from its name.
     *
     * @param name the mode name, case insensitive
     * @return the mode
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ExtrapolationMode fromString(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Extrapolation mode cannot be null");
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        for (ExtrapolationMode mode : values()) {
            if (mode.name.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown extrapolation mode: " + name);
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeByte(id);
    }

    /**
     * Read an ExtrapolationMode from the input stream.
     *
     * @param in the input stream
     * @return the mode
     * @throws IOException if an I/O error occurs or the id is unknown
     */
    public static ExtrapolationMode readFrom(StreamInput in) throws IOException {
        byte id = in.readByte();
        for (ExtrapolationMode mode : values()) {
            if (mode.id == id) {
                return mode;
            }
        }
        throw new IOException("Unknown extrapolation mode ID: " + id);
    }

    @Override
    public String toString() {
        return name;
    }
}
