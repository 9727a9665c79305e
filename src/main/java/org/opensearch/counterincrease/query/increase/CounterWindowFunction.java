/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.counterincrease.query.increase;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate-function boundary of the counter window engine.
 *
 * <p>A host aggregation framework drives one series through four calls:</p>
 * <ol>
 *   <li>{@link #create} or the first {@link #transition} builds the {@link IncreaseTransitionState};</li>
 *   <li>{@link #transition} / {@link #addDataPoint} feed samples in timestamp order;</li>
 *   <li>{@link #combine} folds partial states from parallel scans of disjoint time ranges;</li>
 *   <li>{@link #finish} consumes the state and returns one value (or null) per window.</li>
 * </ol>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * CounterWindowFunction increase = new CounterWindowFunction(CounterFunction.INCREASE, CounterIncreaseConfig.current());
 * IncreaseTransitionState state = null;
 * for (Sample sample : orderedSamples) {
 *     state = increase.transition(state, lowest, greatest, step, range, sample.getTimestamp(), sample.getValue());
 * }
 * List<Double> perWindow = increase.finish(state);
 * }</pre>
 *
 * <p>Instances are immutable and may be shared; the states they create may not.</p>
 */
public class CounterWindowFunction {

    private final CounterFunction function;
    private final ExtrapolationMode extrapolationMode;
    private final int maxWindows;
    private final boolean skipStaleMarkers;
    private final IncreaseFinalizer finalizer;

    /**
     * Create a function using the window cap and staleness handling of the given configuration.
     *
     * @param function increase or rate
     * @param config engine configuration
     */
    public CounterWindowFunction(CounterFunction function, CounterIncreaseConfig config) {
        this(function, config.extrapolationMode(), config.maxWindowsPerSeries(), config.skipStaleMarkers());
    }

    /**
     * @param function increase or rate
     * @param extrapolationMode how observed increases are scaled to the window width
     * @param maxWindows upper limit on windows per series
     * @param skipStaleMarkers whether staleness markers are dropped on ingestion
     */
    public CounterWindowFunction(CounterFunction function, ExtrapolationMode extrapolationMode, int maxWindows, boolean skipStaleMarkers) {
        this.function = Objects.requireNonNull(function, "function cannot be null");
        this.extrapolationMode = Objects.requireNonNull(extrapolationMode, "extrapolation mode cannot be null");
        this.maxWindows = maxWindows;
        this.skipStaleMarkers = skipStaleMarkers;
        this.finalizer = new IncreaseFinalizer(function, extrapolationMode);
    }

    /**
     * Create an empty state for one series.
     *
     * @param lowestTime lower query bound (inclusive), epoch millis
     * @param greatestTime upper query bound (inclusive), epoch millis
     * @param stepSize spacing between evaluation points, millis
     * @param range window width, millis
     * @return a new state
     * @throws InvalidScheduleParametersException if the schedule parameters are malformed
     */
    public IncreaseTransitionState create(long lowestTime, long greatestTime, long stepSize, long range) {
        return new IncreaseTransitionState(WindowSchedule.of(lowestTime, greatestTime, stepSize, range, maxWindows), skipStaleMarkers);
    }

    /**
     * Transition function: creates the state on the first sample and ingests the sample.
     *
     * @param state the state returned by the previous call, or null for the first sample
     * @param lowestTime lower query bound (inclusive)
     * @param greatestTime upper query bound (inclusive)
     * @param stepSize spacing between evaluation points
     * @param range window width
     * @param timestamp sample timestamp
     * @param value raw counter reading
     * @return the state to pass to the next call
     * @throws InvalidScheduleParametersException if the state has to be created and the parameters are malformed
     * @throws OutOfRangeSampleException if the sample lies outside {@code [lowestTime, greatestTime]}
     */
    public IncreaseTransitionState transition(
        IncreaseTransitionState state,
        long lowestTime,
        long greatestTime,
        long stepSize,
        long range,
        long timestamp,
        double value
    ) {
        if (state == null) {
            state = create(lowestTime, greatestTime, stepSize, range);
        }
        state.addDataPoint(timestamp, value);
        return state;
    }

    /**
     * Ingest one sample into an existing state.
     *
     * @param state the state
     * @param timestamp sample timestamp
     * @param value raw counter reading
     * @throws OutOfRangeSampleException if the sample lies outside the state's query bounds
     */
    public void addDataPoint(IncreaseTransitionState state, long timestamp, double value) {
        state.addDataPoint(timestamp, value);
    }

    /**
     * Combine two partial states. Either side may be null when its partial saw no input.
     *
     * @param left first partial
     * @param right second partial, consumed if both are present
     * @return the combined state, or null if both are null
     * @throws UnmergeablePartialsException if the partials cannot be combined
     */
    public IncreaseTransitionState combine(IncreaseTransitionState left, IncreaseTransitionState right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        return left.merge(right);
    }

    /**
     * Final function: evaluate every window and consume the state.
     *
     * @param state the completed state, or null if the series had no input
     * @return per-window values in window order; empty if the state is null
     */
    public List<Double> finish(IncreaseTransitionState state) {
        if (state == null) {
            return List.of();
        }
        return finalizer.finish(state);
    }

    public CounterFunction getFunction() {
        return function;
    }

    public ExtrapolationMode getExtrapolationMode() {
        return extrapolationMode;
    }

    public int getMaxWindows() {
        return maxWindows;
    }

    public boolean isSkipStaleMarkers() {
        return skipStaleMarkers;
    }
}
