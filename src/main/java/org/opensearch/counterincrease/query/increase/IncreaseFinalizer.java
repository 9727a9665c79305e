/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.counterincrease.query.increase;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a completed {@link IncreaseTransitionState} into one value per window.
 *
 * <h2>Per-window result</h2>
 * <ul>
 *   <li>No sample, or a single sample: {@code null}. One reading defines no increase, and reporting zero
 *       would claim the counter was idle.</li>
 *   <li>Two or more samples sharing one timestamp: {@code null}, the observed rate is undefined.</li>
 *   <li>Otherwise the reset-compensated total is extrapolated to the window width according to the
 *       {@link ExtrapolationMode}, and divided by the range in seconds for {@link CounterFunction#RATE}.</li>
 * </ul>
 *
 * Finalizing consumes the state.
 */
public class IncreaseFinalizer {

    private static final Logger logger = LogManager.getLogger(IncreaseFinalizer.class);

    /** Gaps to a window boundary shorter than this many average sample intervals are extrapolated in full. */
    static final double EXTRAPOLATION_THRESHOLD_FACTOR = 1.1;

    private static final double MILLIS_PER_SECOND = 1000.0;

    private final CounterFunction function;
    private final ExtrapolationMode extrapolationMode;

    /**
     * @param function increase or rate
     * @param extrapolationMode how observed increases are scaled to the window width
     */
    public IncreaseFinalizer(CounterFunction function, ExtrapolationMode extrapolationMode) {
        this.function = function;
        this.extrapolationMode = extrapolationMode;
    }

    /**
     * Evaluate every window of the state, in window order.
     *
     * @param state the completed state, consumed by this call
     * @return one entry per window, null where the window has no usable data
     * @throws IllegalStateException if the state was already finalized or merged away
     */
    public List<Double> finish(IncreaseTransitionState state) {
        state.consume();
        WindowSchedule schedule = state.getSchedule();
        List<Double> results = new ArrayList<>(schedule.size());
        for (int i = 0; i < schedule.size(); i++) {
            results.add(evaluate(schedule.window(i), state.getAccumulator(i)));
        }
        return results;
    }

    /**
     * Evaluate a single window.
     *
     * @param window the window bounds
     * @param accumulator the window's accumulated samples
     * @return the function value, or null if the window has no usable data
     */
    Double evaluate(EvaluationWindow window, CounterAccumulator accumulator) {
        if (accumulator.getSampleCount() < 2) {
            return null;
        }
        long observedDuration = accumulator.getLastSample().getTimestamp() - accumulator.getFirstSample().getTimestamp();
        if (observedDuration == 0) {
            logger.debug(
                "window [{}, {}] has {} samples at a single timestamp, reporting no data",
                window.start(),
                window.end(),
                accumulator.getSampleCount()
            );
            return null;
        }

        double increase = switch (extrapolationMode) {
            case PROPORTIONAL -> accumulator.getCorrectedTotal() * ((double) window.width() / observedDuration);
            case PROMETHEUS -> prometheusExtrapolation(window, accumulator, observedDuration);
        };

        if (function == CounterFunction.RATE) {
            return increase / (window.width() / MILLIS_PER_SECOND);
        }
        return increase;
    }

    private static double prometheusExtrapolation(EvaluationWindow window, CounterAccumulator accumulator, long observedDuration) {
        double total = accumulator.getCorrectedTotal();
        double sampledInterval = observedDuration;
        double averageInterval = sampledInterval / (accumulator.getSampleCount() - 1);
        double durationToStart = accumulator.getFirstSample().getTimestamp() - window.start();
        double durationToEnd = window.end() - accumulator.getLastSample().getTimestamp();

        // a counter cannot be extrapolated below zero
        double firstValue = accumulator.getFirstSample().getValue();
        if (total > 0 && firstValue >= 0) {
            double durationToZero = sampledInterval * (firstValue / total);
            if (durationToZero < durationToStart) {
                durationToStart = durationToZero;
            }
        }

        double threshold = averageInterval * EXTRAPOLATION_THRESHOLD_FACTOR;
        double extrapolateToInterval = sampledInterval;
        extrapolateToInterval += durationToStart < threshold ? durationToStart : averageInterval / 2;
        extrapolateToInterval += durationToEnd < threshold ? durationToEnd : averageInterval / 2;
        return total * (extrapolateToInterval / sampledInterval);
    }

    public CounterFunction getFunction() {
        return function;
    }

    public ExtrapolationMode getExtrapolationMode() {
        return extrapolationMode;
    }
}
