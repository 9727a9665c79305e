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
import org.opensearch.counterincrease.core.model.FloatSample;

import java.io.IOException;
import java.util.Locale;

/**
 * Aggregation state threaded through the ingestion of one counter series.
 *
 * <p>The state owns a {@link WindowSchedule} and one {@link CounterAccumulator} per window. Every
 * ingested sample is routed to the contiguous run of windows that contain its timestamp, so a sample
 * updates several accumulators when windows overlap and none when it falls into a gap.</p>
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>Created once per series, either explicitly or lazily on the first sample.</li>
 *   <li>Mutated only by {@link #addDataPoint(long, double)} and {@link #merge(IncreaseTransitionState)}.</li>
 *   <li>Consumed exactly once, by finalization or by being merged into another state. A consumed state
 *       rejects every further call.</li>
 * </ul>
 *
 * <h2>Parallel partials</h2>
 * <p>Partial states built over disjoint time ranges of the same series with the same schedule and the
 * same stale marker handling can be combined with {@link #merge(IncreaseTransitionState)}. Each window
 * keeps only its first and last sample, so a merged state covers the whole span between its parts:
 * partials must be merged in an order where every merge joins time ranges that are adjacent, with no
 * still unmerged partial lying between them. After merging {@code [0,10]} with {@code [90,100]},
 * merging {@code [50,60]} into the result is rejected as an overlap; merging left to right, or any tree of adjacent pairs, is
 * not. States are {@link Writeable} so that partials can be shipped to the node that combines them; a
 * state read from the stream is held to the node's window cap.</p>
 *
 * <p>Instances are not thread-safe. One thread feeds one state.</p>
 */
public class IncreaseTransitionState implements Writeable {

    /**
     * Estimated memory overhead of the state object itself: header, schedule reference, accumulator
     * array reference, latest timestamp and flags.
     */
    static final long ESTIMATED_MEMORY_OVERHEAD = 40;

    private final WindowSchedule schedule;
    private final CounterAccumulator[] accumulators;
    private final boolean skipStaleMarkers;
    private long latestTimestamp = Long.MIN_VALUE;
    private boolean consumed;

    /**
     * Create an empty state that skips Prometheus staleness markers.
     *
     * @param schedule the windows to track
     */
    public IncreaseTransitionState(WindowSchedule schedule) {
        this(schedule, true);
    }

    /**
     * Create an empty state.
     *
     * @param schedule the windows to track
     * @param skipStaleMarkers whether samples carrying the staleness NaN are dropped
     */
    public IncreaseTransitionState(WindowSchedule schedule, boolean skipStaleMarkers) {
        this.schedule = schedule;
        this.skipStaleMarkers = skipStaleMarkers;
        this.accumulators = new CounterAccumulator[schedule.size()];
        for (int i = 0; i < accumulators.length; i++) {
            accumulators[i] = new CounterAccumulator();
        }
    }

    /**
     * Read a partial state from the stream. The schedule is checked against the node's window cap
     * before any accumulator is allocated.
     *
     * @param in the input stream
     * @throws IOException if an I/O error occurs
     * @throws InvalidScheduleParametersException if the schedule exceeds the node's window cap
     */
    public IncreaseTransitionState(StreamInput in) throws IOException {
        this(in, CounterIncreaseConfig.current().maxWindowsPerSeries());
    }

    /**
     * Read a partial state from the stream with an explicit window cap.
     *
     * @param in the input stream
     * @param maxWindows upper limit on the number of windows
     * @throws IOException if an I/O error occurs
     * @throws InvalidScheduleParametersException if the schedule exceeds {@code maxWindows}
     */
    public IncreaseTransitionState(StreamInput in, int maxWindows) throws IOException {
        this.schedule = new WindowSchedule(in, maxWindows);
        this.skipStaleMarkers = in.readBoolean();
        this.latestTimestamp = in.readLong();
        this.accumulators = new CounterAccumulator[schedule.size()];
        for (int i = 0; i < accumulators.length; i++) {
            accumulators[i] = new CounterAccumulator(in);
        }
    }

    /**
     * Ingest the next sample of the series.
     *
     * @param timestamp sample timestamp, not earlier than any sample ingested before
     * @param value raw counter reading
     * @throws OutOfRangeSampleException if the timestamp lies outside the schedule's query bounds
     * @throws IllegalArgumentException if the timestamp is earlier than a previously ingested one
     */
    public void addDataPoint(long timestamp, double value) {
        ensureNotConsumed();
        if (schedule.inBounds(timestamp) == false) {
            throw new OutOfRangeSampleException(
                String.format(
                    Locale.ROOT,
                    "sample time [%d] is outside the query bounds [%d, %d]",
                    timestamp,
                    schedule.getLowestTime(),
                    schedule.getGreatestTime()
                ),
                timestamp
            );
        }
        if (timestamp < latestTimestamp) {
            throw new IllegalArgumentException(
                String.format(
                    Locale.ROOT,
                    "inputs must be in ascending time order, got [%d] after [%d]",
                    timestamp,
                    latestTimestamp
                )
            );
        }
        // a skipped stale marker still advances the ordering watermark
        latestTimestamp = timestamp;
        if (skipStaleMarkers && FloatSample.isStaleMarker(value)) {
            return;
        }

        int last = schedule.lastWindowIndex(timestamp);
        for (int i = schedule.firstWindowIndex(timestamp); i <= last; i++) {
            accumulators[i].add(timestamp, value);
        }
    }

    /**
     * Absorb another partial state of the same series into this one. The other state is consumed.
     *
     * @param other partial state built with an equal schedule and stale handling over a disjoint time range
     * @return this state
     * @throws UnmergeablePartialsException if the schedules or stale handling differ, or any window's partials
     *         overlap in time
     */
    public IncreaseTransitionState merge(IncreaseTransitionState other) {
        ensureNotConsumed();
        other.ensureNotConsumed();
        if (this == other) {
            throw new UnmergeablePartialsException("cannot merge a partial state with itself");
        }
        if (schedule.equals(other.schedule) == false) {
            throw new UnmergeablePartialsException("cannot merge partial states with different schedules: " + schedule + " vs " + other.schedule);
        }
        if (skipStaleMarkers != other.skipStaleMarkers) {
            throw new UnmergeablePartialsException(
                String.format(
                    Locale.ROOT,
                    "cannot merge partial states with different stale marker handling: skip=%s vs skip=%s",
                    skipStaleMarkers,
                    other.skipStaleMarkers
                )
            );
        }
        // check every window before mutating anything so a failed merge leaves this state intact
        for (int i = 0; i < accumulators.length; i++) {
            checkMergeable(i, accumulators[i], other.accumulators[i]);
        }
        for (int i = 0; i < accumulators.length; i++) {
            accumulators[i].mergeWith(other.accumulators[i]);
        }
        latestTimestamp = Math.max(latestTimestamp, other.latestTimestamp);
        other.consumed = true;
        return this;
    }

    private static void checkMergeable(int index, CounterAccumulator left, CounterAccumulator right) {
        if (left.isEmpty() || right.isEmpty()) {
            return;
        }
        boolean leftFirst = left.getLastSample().getTimestamp() <= right.getFirstSample().getTimestamp();
        boolean rightFirst = right.getLastSample().getTimestamp() <= left.getFirstSample().getTimestamp();
        if (leftFirst == false && rightFirst == false) {
            throw new UnmergeablePartialsException(
                String.format(
                    Locale.ROOT,
                    "partial sample ranges overlap in window %d: [%d, %d] and [%d, %d]",
                    index,
                    left.getFirstSample().getTimestamp(),
                    left.getLastSample().getTimestamp(),
                    right.getFirstSample().getTimestamp(),
                    right.getLastSample().getTimestamp()
                )
            );
        }
    }

    /**
     * Mark this state as consumed. Called by the finalizer once it has read the accumulators.
     */
    void consume() {
        ensureNotConsumed();
        consumed = true;
    }

    private void ensureNotConsumed() {
        if (consumed) {
            throw new IllegalStateException("transition state has already been finalized or merged");
        }
    }

    public boolean isConsumed() {
        return consumed;
    }

    public WindowSchedule getSchedule() {
        return schedule;
    }

    /**
     * @return number of windows tracked by this state
     */
    public int getWindowCount() {
        return accumulators.length;
    }

    /**
     * @param index window index
     * @return the accumulator of that window
     */
    public CounterAccumulator getAccumulator(int index) {
        return accumulators[index];
    }

    /**
     * @return true if at least one sample was routed to a window
     */
    public boolean hasData() {
        for (CounterAccumulator accumulator : accumulators) {
            if (accumulator.isEmpty() == false) {
                return true;
            }
        }
        return false;
    }

    /**
     * Get estimated memory usage for circuit breaker tracking.
     *
     * @return estimated memory usage in bytes
     */
    public long getEstimatedMemoryUsage() {
        long total = ESTIMATED_MEMORY_OVERHEAD + 4L * accumulators.length;
        for (CounterAccumulator accumulator : accumulators) {
            total += accumulator.getEstimatedMemoryUsage();
        }
        return total;
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        ensureNotConsumed();
        schedule.writeTo(out);
        out.writeBoolean(skipStaleMarkers);
        out.writeLong(latestTimestamp);
        for (CounterAccumulator accumulator : accumulators) {
            accumulator.writeTo(out);
        }
    }
}
