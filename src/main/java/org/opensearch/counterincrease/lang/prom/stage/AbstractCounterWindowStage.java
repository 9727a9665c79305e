/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.counterincrease.lang.prom.stage;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.unit.TimeValue;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.xcontent.ToXContent;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.counterincrease.core.model.FloatSample;
import org.opensearch.counterincrease.core.model.Sample;
import org.opensearch.counterincrease.query.aggregator.TimeSeries;
import org.opensearch.counterincrease.query.increase.CounterFunction;
import org.opensearch.counterincrease.query.increase.CounterIncreaseConfig;
import org.opensearch.counterincrease.query.increase.CounterWindowFunction;
import org.opensearch.counterincrease.query.increase.ExtrapolationMode;
import org.opensearch.counterincrease.query.increase.IncreaseTransitionState;
import org.opensearch.counterincrease.query.increase.WindowSchedule;
import org.opensearch.counterincrease.query.stage.UnaryPipelineStage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for the PromQL counter functions evaluated over sliding windows ({@code increase}, {@code rate}).
 *
 * <p>Each input series is fed, in order, to its own {@link CounterWindowFunction} instance using the
 * series' {@code [minTimestamp, maxTimestamp]} as the query bounds. The output series carries one
 * sample per window that produced a value, placed at the window's evaluation time; windows without
 * usable data are left out. As in Prometheus, the metric name label is dropped because the result is
 * no longer the original metric.</p>
 */
public abstract class AbstractCounterWindowStage implements UnaryPipelineStage {

    private static final Logger logger = LogManager.getLogger(AbstractCounterWindowStage.class);

    /** Label holding the metric name. */
    public static final String METRIC_NAME_LABEL = "__name__";

    static final String RANGE_ARG = "range";
    static final String TIME_RANGE_ARG = "time_range";
    static final String STEP_ARG = "step";
    static final String TIME_STEP_ARG = "time_step";
    static final String EXTRAPOLATION_ARG = "extrapolation";

    private final long range;
    private final long step;
    private final ExtrapolationMode extrapolationMode;

    /**
     * @param range window width in milliseconds
     * @param step spacing between evaluation points in milliseconds
     * @param extrapolationMode extrapolation to use, or null for the node default
     */
    protected AbstractCounterWindowStage(long range, long step, ExtrapolationMode extrapolationMode) {
        if (range <= 0) {
            throw new IllegalArgumentException("range must be positive, got: " + range);
        }
        if (step <= 0) {
            throw new IllegalArgumentException("step must be positive, got: " + step);
        }
        this.range = range;
        this.step = step;
        this.extrapolationMode = extrapolationMode;
    }

    /**
     * @return the counter function this stage evaluates
     */
    protected abstract CounterFunction function();

    @Override
    public List<TimeSeries> process(List<TimeSeries> input) {
        if (input == null) {
            throw new NullPointerException(getName() + " stage received null input");
        }
        if (input.isEmpty()) {
            return input;
        }

        CounterWindowFunction windowFunction = createWindowFunction();
        List<TimeSeries> result = new ArrayList<>(input.size());
        for (TimeSeries ts : input) {
            result.add(processSeries(windowFunction, ts));
        }
        return result;
    }

    private TimeSeries processSeries(CounterWindowFunction windowFunction, TimeSeries ts) {
        IncreaseTransitionState state = windowFunction.create(ts.getMinTimestamp(), ts.getMaxTimestamp(), step, range);
        for (Sample sample : ts.getSamples()) {
            windowFunction.addDataPoint(state, sample.getTimestamp(), sample.getValue());
        }
        WindowSchedule schedule = state.getSchedule();
        List<Double> values = windowFunction.finish(state);

        List<Sample> samples = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            Double value = values.get(i);
            if (value != null) {
                samples.add(new FloatSample(schedule.evaluationTime(i), value));
            }
        }
        logger.debug(
            "{} evaluated {} windows for series {}, {} with data",
            getName(),
            schedule.size(),
            ts.getLabels(),
            samples.size()
        );

        Map<String, String> labels = new HashMap<>(ts.getLabels());
        labels.remove(METRIC_NAME_LABEL);
        if (schedule.isEmpty()) {
            return new TimeSeries(samples, labels, ts.getMinTimestamp(), ts.getMaxTimestamp(), step);
        }
        return new TimeSeries(samples, labels, schedule.evaluationTime(0), schedule.evaluationTime(schedule.size() - 1), step);
    }

    private CounterWindowFunction createWindowFunction() {
        CounterIncreaseConfig config = CounterIncreaseConfig.current();
        ExtrapolationMode mode = extrapolationMode != null ? extrapolationMode : config.extrapolationMode();
        return new CounterWindowFunction(function(), mode, config.maxWindowsPerSeries(), config.skipStaleMarkers());
    }

    /**
     * @return window width in milliseconds
     */
    public long getRange() {
        return range;
    }

    /**
     * @return spacing between evaluation points in milliseconds
     */
    public long getStep() {
        return step;
    }

    /**
     * @return the configured extrapolation mode, or null if the node default applies
     */
    public ExtrapolationMode getExtrapolationMode() {
        return extrapolationMode;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field(RANGE_ARG, range);
        builder.field(STEP_ARG, step);
        if (extrapolationMode != null) {
            builder.field(EXTRAPOLATION_ARG, extrapolationMode.getName());
        }
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeVLong(range);
        out.writeVLong(step);
        out.writeOptionalWriteable(extrapolationMode);
    }

    /**
     * Read a duration argument given either in milliseconds or as a time string such as {@code 5m}.
     *
     * @param args the argument map
     * @param millisKey key of the millisecond form
     * @param timeKey key of the time string form
     * @param stageName stage name for error messages
     * @return the duration in milliseconds
     * @throws IllegalArgumentException if neither form is present
     */
    static long parseDuration(Map<String, Object> args, String millisKey, String timeKey, String stageName) {
        if (args.containsKey(millisKey)) {
            Object value = args.get(millisKey);
            if (value instanceof Number number) {
                return number.longValue();
            }
            throw new IllegalArgumentException(
                String.format(Locale.ROOT, "%s stage expects a number for '%s', got: %s", stageName, millisKey, value)
            );
        }
        if (args.containsKey(timeKey)) {
            Object value = args.get(timeKey);
            try {
                return TimeValue.parseTimeValue(String.valueOf(value), null, stageName + " " + timeKey).getMillis();
            } catch (Exception e) {
                throw new IllegalArgumentException("Invalid " + timeKey + " format: " + value, e);
            }
        }
        throw new IllegalArgumentException(
            String.format(Locale.ROOT, "%s stage requires '%s' or '%s' parameter", stageName, millisKey, timeKey)
        );
    }

    /**
     * @param args the argument map
     * @return the extrapolation argument, or null if absent
     */
    static ExtrapolationMode parseExtrapolation(Map<String, Object> args) {
        Object value = args.get(EXTRAPOLATION_ARG);
        return value == null ? null : ExtrapolationMode.fromString(value.toString());
    }

    @Override
    public boolean supportConcurrentSegmentSearch() {
        return false; // reset detection needs every sample of a series in timestamp order
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        AbstractCounterWindowStage that = (AbstractCounterWindowStage) obj;
        return range == that.range && step == that.step && extrapolationMode == that.extrapolationMode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), range, step, extrapolationMode);
    }

    @Override
    public String toString() {
        return getName() + "{range=" + range + ", step=" + step + ", extrapolation=" + extrapolationMode + '}';
    }
}
