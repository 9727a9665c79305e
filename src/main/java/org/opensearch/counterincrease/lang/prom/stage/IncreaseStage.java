/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.counterincrease.lang.prom.stage;

import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.counterincrease.query.increase.CounterFunction;
import org.opensearch.counterincrease.query.increase.ExtrapolationMode;
import org.opensearch.counterincrease.query.stage.PipelineStageAnnotation;

import java.io.IOException;
import java.util.Map;

/**
 * Pipeline stage that implements PromQL's increase function.
 *
 * For every window of width {@code range}, evaluated every {@code step}, it reports how much a counter
 * grew, compensating counter resets (a drop in value is read as a restart from zero) and extrapolating
 * the increase seen between the first and the last sample to the full window width.
 *
 * Only use increase with counters. A gauge that goes down is read as a counter reset and produces
 * misleading results.
 *
 * Usage: fetch a | increase range:5m step:1m
 */
@PipelineStageAnnotation(name = "increase")
public class IncreaseStage extends AbstractCounterWindowStage {
    /** The name of this pipeline stage. */
    public static final String NAME = "increase";

    /**
     * @param range window width in milliseconds
     * @param step spacing between evaluation points in milliseconds
     * @param extrapolationMode extrapolation to use, or null for the node default
     */
    public IncreaseStage(long range, long step, ExtrapolationMode extrapolationMode) {
        super(range, step, extrapolationMode);
    }

    @Override
    protected CounterFunction function() {
        return CounterFunction.INCREASE;
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * Create a IncreaseStage instance from the input stream for deserialization.
     *
     * @param in The stream input to read from
     * @return A new IncreaseStage instance
     * @throws IOException if an I/O error occurs during deserialization
     */
    public static IncreaseStage readFrom(StreamInput in) throws IOException {
        long range = in.readVLong();
        long step = in.readVLong();
        ExtrapolationMode extrapolationMode = in.readOptionalWriteable(ExtrapolationMode::readFrom);
        return new IncreaseStage(range, step, extrapolationMode);
    }

    /**
     * Create a IncreaseStage from arguments map.
     * Supports both range/step (milliseconds) and time_range/time_step (strings like "5m").
     *
     * @param args Map of argument names to values
     * @return IncreaseStage instance
     * @throws IllegalArgumentException if the range or step is missing or invalid
     */
    public static IncreaseStage fromArgs(Map<String, Object> args) {
        long range = parseDuration(args, RANGE_ARG, TIME_RANGE_ARG, NAME);
        long step = parseDuration(args, STEP_ARG, TIME_STEP_ARG, NAME);
        return new IncreaseStage(range, step, parseExtrapolation(args));
    }
}
