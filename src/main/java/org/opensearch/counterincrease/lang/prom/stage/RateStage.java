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
 * Pipeline stage that implements PromQL's rate function: the per-second average rate of increase
 * of a counter over each window, i.e. the window's increase divided by the range in seconds.
 *
 * Usage: fetch a | rate range:5m step:1m
 */
@PipelineStageAnnotation(name = "rate")
public class RateStage extends AbstractCounterWindowStage {
    /** The name of this pipeline stage. */
    public static final String NAME = "rate";

    /**
     * @param range window width in milliseconds
     * @param step spacing between evaluation points in milliseconds
     * @param extrapolationMode extrapolation to use, or null for the node default
     */
    public RateStage(long range, long step, ExtrapolationMode extrapolationMode) {
        super(range, step, extrapolationMode);
    }

    @Override
    protected CounterFunction function() {
        return CounterFunction.RATE;
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * Create a RateStage instance from the input stream for deserialization.
     *
     * @param in The stream input to read from
     * @return A new RateStage instance
     * @throws IOException if an I/O error occurs during deserialization
     */
    public static RateStage readFrom(StreamInput in) throws IOException {
        long range = in.readVLong();
        long step = in.readVLong();
        ExtrapolationMode extrapolationMode = in.readOptionalWriteable(ExtrapolationMode::readFrom);
        return new RateStage(range, step, extrapolationMode);
    }

    /**
     * Create a RateStage from arguments map.
     * Supports both range/step (milliseconds) and time_range/time_step (strings like "5m").
     *
     * @param args Map of argument names to values
     * @return RateStage instance
     * @throws IllegalArgumentException if the range or step is missing or invalid
     */
    public static RateStage fromArgs(Map<String, Object> args) {
        long range = parseDuration(args, RANGE_ARG, TIME_RANGE_ARG, NAME);
        long step = parseDuration(args, STEP_ARG, TIME_STEP_ARG, NAME);
        return new RateStage(range, step, parseExtrapolation(args));
    }
}
