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
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Evenly spaced evaluation windows derived from a query's time bounds, step and range.
 *
 * <p>Evaluation points are {@code t_k = lowestTime + range + k * stepSize} for every {@code k >= 0}
 * with {@code t_k <= greatestTime}. Window {@code k} covers {@code [t_k - range, t_k]}, so the first
 * window is the first one whose whole lookback lies inside the query bounds.</p>
 *
 * <h2>Sample routing</h2>
 * <p>A sample at {@code t} belongs to every window with {@code start <= t <= end}. The matching
 * indexes form one contiguous run which is computed arithmetically:</p>
 * <pre>
 *   k_min = ceil((t - lowestTime - range) / stepSize)
 *   k_max = floor((t - lowestTime) / stepSize)
 * </pre>
 * <p>Window ends are inclusive. A window start is inclusive too, except when the same instant is the
 * end of an earlier window of this schedule: the sample then belongs to the earlier window only, so
 * back-to-back windows ({@code stepSize == range}) never count a boundary sample twice.</p>
 *
 * <p>The schedule is immutable and is fully determined by its four parameters, so two partial states
 * built from the same parameters always agree on their windows.</p>
 */
public final class WindowSchedule implements Writeable {

    /** Maximum number of windows per series unless configured otherwise, matching Prometheus' per-series point cap. */
    public static final int DEFAULT_MAX_WINDOWS = 11_000;

    private final long lowestTime;
    private final long greatestTime;
    private final long stepSize;
    private final long range;
    private final int windowCount;

    private WindowSchedule(long lowestTime, long greatestTime, long stepSize, long range, int windowCount) {
        this.lowestTime = lowestTime;
        this.greatestTime = greatestTime;
        this.stepSize = stepSize;
        this.range = range;
        this.windowCount = windowCount;
    }

    /**
     * Read a schedule from the stream, capped at the node's configured
     * {@link CounterIncreaseConfig#maxWindowsPerSeries()}.
     *
     * @param in the input stream
     * @throws IOException if an I/O error occurs
     * @throws InvalidScheduleParametersException if the decoded parameters are malformed or exceed the cap
     */
    public WindowSchedule(StreamInput in) throws IOException {
        this(in, CounterIncreaseConfig.current().maxWindowsPerSeries());
    }

    /**
     * Read a schedule from the stream. Only the parameters travel; the windows are recomputed and checked
     * against {@code maxWindows} like a locally built schedule.
     *
     * @param in the input stream
     * @param maxWindows upper limit on the number of windows
     * @throws IOException if an I/O error occurs
     * @throws InvalidScheduleParametersException if the decoded parameters are malformed or exceed the cap
     */
    public WindowSchedule(StreamInput in, int maxWindows) throws IOException {
        this.lowestTime = in.readLong();
        this.greatestTime = in.readLong();
        this.stepSize = in.readVLong();
        this.range = in.readVLong();
        this.windowCount = computeWindowCount(lowestTime, greatestTime, stepSize, range, maxWindows);
    }

    /**
     * Build a schedule capped at {@link #DEFAULT_MAX_WINDOWS}.
     *
     * @see #of(long, long, long, long, int)
     */
    public static WindowSchedule of(long lowestTime, long greatestTime, long stepSize, long range) {
        return of(lowestTime, greatestTime, stepSize, range, DEFAULT_MAX_WINDOWS);
    }

    /**
     * Build a schedule.
     *
     * @param lowestTime lower query bound (inclusive), epoch millis
     * @param greatestTime upper query bound (inclusive), epoch millis
     * @param stepSize spacing between evaluation points in millis, must be positive
     * @param range width of every window in millis, must be positive
     * @param maxWindows upper limit on the number of windows
     * @return the schedule
     * @throws InvalidScheduleParametersException if the parameters are malformed or produce too many windows
     */
    public static WindowSchedule of(long lowestTime, long greatestTime, long stepSize, long range, int maxWindows) {
        int count = computeWindowCount(lowestTime, greatestTime, stepSize, range, maxWindows);
        return new WindowSchedule(lowestTime, greatestTime, stepSize, range, count);
    }

    private static int computeWindowCount(long lowestTime, long greatestTime, long stepSize, long range, int maxWindows) {
        if (stepSize <= 0) {
            throw new InvalidScheduleParametersException("step size must be positive, got: " + stepSize);
        }
        if (range <= 0) {
            throw new InvalidScheduleParametersException("range must be positive, got: " + range);
        }
        if (lowestTime > greatestTime) {
            throw new InvalidScheduleParametersException(
                String.format(Locale.ROOT, "lowest time [%d] must not be after greatest time [%d]", lowestTime, greatestTime)
            );
        }
        long span;
        try {
            span = Math.subtractExact(greatestTime, lowestTime);
        } catch (ArithmeticException e) {
            throw new InvalidScheduleParametersException(
                String.format(Locale.ROOT, "time span [%d, %d] is too large", lowestTime, greatestTime)
            );
        }
        if (span < range) {
            return 0;
        }
        long count = (span - range) / stepSize + 1;
        if (count > maxWindows) {
            throw new InvalidScheduleParametersException(
                String.format(
                    Locale.ROOT,
                    "schedule would produce %d windows, more than the maximum of %d; increase the step size",
                    count,
                    maxWindows
                )
            );
        }
        return (int) count;
    }

    /**
     * @return number of windows
     */
    public int size() {
        return windowCount;
    }

    /**
     * @return true if the schedule has no window
     */
    public boolean isEmpty() {
        return windowCount == 0;
    }

    /**
     * @param index window index
     * @return the evaluation time (window end) of the window
     */
    public long evaluationTime(int index) {
        return lowestTime + range + index * stepSize;
    }

    /**
     * @param index window index
     * @return the window at that index
     */
    public EvaluationWindow window(int index) {
        Objects.checkIndex(index, windowCount);
        long end = evaluationTime(index);
        return new EvaluationWindow(index, end - range, end);
    }

    /**
     * @return all windows in evaluation order
     */
    public List<EvaluationWindow> windows() {
        List<EvaluationWindow> windows = new ArrayList<>(windowCount);
        for (int i = 0; i < windowCount; i++) {
            windows.add(window(i));
        }
        return windows;
    }

    /**
     * @param timestamp sample timestamp
     * @return true if the timestamp lies inside {@code [lowestTime, greatestTime]}
     */
    public boolean inBounds(long timestamp) {
        return timestamp >= lowestTime && timestamp <= greatestTime;
    }

    /**
     * Index of the first window a sample at {@code timestamp} belongs to. If the result is greater than
     * {@link #lastWindowIndex(long)} the sample belongs to no window (it falls in a gap between windows or
     * after the last one).
     *
     * @param timestamp an in-bounds sample timestamp
     * @return first matching window index
     */
    public int firstWindowIndex(long timestamp) {
        long sinceEarliestEnd = timestamp - lowestTime - range;
        if (sinceEarliestEnd <= 0) {
            return 0;
        }
        long first = -Math.floorDiv(-sinceEarliestEnd, stepSize);
        return (int) Math.min(first, windowCount);
    }

    /**
     * Index of the last window a sample at {@code timestamp} belongs to, or -1 if none.
     *
     * @param timestamp an in-bounds sample timestamp
     * @return last matching window index
     */
    public int lastWindowIndex(long timestamp) {
        long sinceLowest = timestamp - lowestTime;
        if (sinceLowest < 0 || windowCount == 0) {
            return -1;
        }
        long last = sinceLowest / stepSize;
        if (sinceLowest % stepSize == 0 && endsEarlierWindow(timestamp)) {
            // the window starting here shares its start with the end of an earlier window
            last--;
        }
        return (int) Math.min(last, windowCount - 1L);
    }

    private boolean endsEarlierWindow(long timestamp) {
        long sinceEarliestEnd = timestamp - lowestTime - range;
        return sinceEarliestEnd >= 0 && sinceEarliestEnd % stepSize == 0 && sinceEarliestEnd / stepSize < windowCount;
    }

    public long getLowestTime() {
        return lowestTime;
    }

    public long getGreatestTime() {
        return greatestTime;
    }

    public long getStepSize() {
        return stepSize;
    }

    public long getRange() {
        return range;
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeLong(lowestTime);
        out.writeLong(greatestTime);
        out.writeVLong(stepSize);
        out.writeVLong(range);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WindowSchedule that = (WindowSchedule) o;
        return lowestTime == that.lowestTime && greatestTime == that.greatestTime && stepSize == that.stepSize && range == that.range;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lowestTime, greatestTime, stepSize, range);
    }

    @Override
    public String toString() {
        return "WindowSchedule{"
            + "lowestTime="
            + lowestTime
            + ", greatestTime="
            + greatestTime
            + ", stepSize="
            + stepSize
            + ", range="
            + range
            + ", windows="
            + windowCount
            + '}';
    }
}
