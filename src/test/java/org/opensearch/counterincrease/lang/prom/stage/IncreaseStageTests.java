/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.counterincrease.lang.prom.stage;

import org.opensearch.common.io.stream.BytesStreamOutput;
import org.opensearch.common.xcontent.XContentFactory;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.counterincrease.core.model.FloatSample;
import org.opensearch.counterincrease.core.model.Sample;
import org.opensearch.counterincrease.query.aggregator.TimeSeries;
import org.opensearch.counterincrease.query.increase.CounterIncreaseConfig;
import org.opensearch.counterincrease.query.increase.ExtrapolationMode;
import org.opensearch.counterincrease.query.increase.InvalidScheduleParametersException;
import org.opensearch.counterincrease.query.increase.OutOfRangeSampleException;
import org.opensearch.counterincrease.query.stage.PipelineStage;
import org.opensearch.counterincrease.query.stage.PipelineStageFactory;
import org.opensearch.test.AbstractWireSerializingTestCase;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.opensearch.core.xcontent.ToXContent.EMPTY_PARAMS;
import static org.opensearch.counterincrease.TestUtils.assertNullInputThrowsException;
import static org.opensearch.counterincrease.TestUtils.assertSamplesEqual;

public class IncreaseStageTests extends AbstractWireSerializingTestCase<IncreaseStage> {

    private static final long T0 = 1_700_000_000_000L;
    private static final long FIVE_MINUTES = 300_000L;
    private static final long FIFTY_MINUTES = 10 * FIVE_MINUTES;

    @Override
    public void tearDown() throws Exception {
        CounterIncreaseConfig.setCurrent(CounterIncreaseConfig.defaultConfig());
        super.tearDown();
    }

    private static TimeSeries fiveMinuteSeries(Map<String, String> labels, double... values) {
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            samples.add(new FloatSample(T0 + i * FIVE_MINUTES, values[i]));
        }
        return new TimeSeries(samples, labels, T0, T0 + (values.length - 1) * FIVE_MINUTES, FIVE_MINUTES);
    }

    /**
     * Steady counter: 0,10,...,100 every 5 minutes over a single 50 minute window.
     */
    public void testSteadyCounter() {
        IncreaseStage stage = new IncreaseStage(FIFTY_MINUTES, FIFTY_MINUTES, null);
        TimeSeries input = fiveMinuteSeries(
            Map.of("__name__", "http_requests_total", "job", "api"),
            0, 10, 20, 30, 40, 50, 60, 70, 80, 90, 100
        );

        List<TimeSeries> result = stage.process(List.of(input));

        assertEquals(1, result.size());
        TimeSeries output = result.get(0);
        assertSamplesEqual("Steady counter", List.of(new FloatSample(T0 + FIFTY_MINUTES, 100.0)), output.getSamples());
        assertEquals("metric name is dropped", Map.of("job", "api"), output.getLabels());
        assertEquals(T0 + FIFTY_MINUTES, output.getMinTimestamp());
        assertEquals(T0 + FIFTY_MINUTES, output.getMaxTimestamp());
        assertEquals(FIFTY_MINUTES, output.getStep());
    }

    /**
     * Counter reset at the 7th sample: 0,...,50,0,...,40 gives 90.
     */
    public void testCounterReset() {
        IncreaseStage stage = new IncreaseStage(FIFTY_MINUTES, FIFTY_MINUTES, ExtrapolationMode.PROMETHEUS);
        TimeSeries input = fiveMinuteSeries(Map.of("job", "api"), 0, 10, 20, 30, 40, 50, 0, 10, 20, 30, 40);

        List<TimeSeries> result = stage.process(List.of(input));

        assertSamplesEqual("Counter reset", List.of(new FloatSample(T0 + FIFTY_MINUTES, 90.0)), result.get(0).getSamples());
    }

    /**
     * Reset to a non-zero value: 0,1,2,3,2,3,4 over 30 minutes gives 7.
     */
    public void testCounterResetToNonZero() {
        IncreaseStage stage = new IncreaseStage(6 * FIVE_MINUTES, 6 * FIVE_MINUTES, null);
        TimeSeries input = fiveMinuteSeries(Map.of(), 0, 1, 2, 3, 2, 3, 4);

        List<TimeSeries> result = stage.process(List.of(input));

        assertSamplesEqual("Reset to non-zero", List.of(new FloatSample(T0 + 6 * FIVE_MINUTES, 7.0)), result.get(0).getSamples());
    }

    /**
     * Sliding 30s windows every 10s over a counter growing 1 per second.
     */
    public void testSlidingWindows() {
        IncreaseStage stage = new IncreaseStage(30_000L, 10_000L, null);
        List<Sample> samples = new ArrayList<>();
        for (long t = 0; t <= 100_000L; t += 10_000L) {
            samples.add(new FloatSample(t, t / 1000.0));
        }
        TimeSeries input = new TimeSeries(samples, Map.of("job", "api"), 0L, 100_000L, 10_000L);

        TimeSeries output = stage.process(List.of(input)).get(0);

        List<Sample> expected = new ArrayList<>();
        for (long t = 30_000L; t <= 100_000L; t += 10_000L) {
            expected.add(new FloatSample(t, 30.0));
        }
        assertSamplesEqual("Sliding windows", expected, output.getSamples());
        assertEquals(30_000L, output.getMinTimestamp());
        assertEquals(100_000L, output.getMaxTimestamp());
    }

    /**
     * Windows with fewer than two samples are left out of the output.
     */
    public void testWindowsWithoutEnoughDataAreOmitted() {
        IncreaseStage stage = new IncreaseStage(10_000L, 10_000L, null);
        List<Sample> samples = List.of(new FloatSample(5_000L, 1.0), new FloatSample(22_000L, 2.0), new FloatSample(27_000L, 3.0));
        TimeSeries input = new TimeSeries(samples, Map.of(), 0L, 30_000L, 1_000L);

        TimeSeries output = stage.process(List.of(input)).get(0);

        assertSamplesEqual("Sparse windows", List.of(new FloatSample(30_000L, 2.0)), output.getSamples());
        assertEquals(10_000L, output.getMinTimestamp());
        assertEquals(30_000L, output.getMaxTimestamp());
    }

    /**
     * A series shorter than the range has no windows at all.
     */
    public void testSeriesShorterThanRange() {
        IncreaseStage stage = new IncreaseStage(FIFTY_MINUTES, FIVE_MINUTES, null);
        TimeSeries input = fiveMinuteSeries(Map.of("job", "api"), 0, 10, 20);

        TimeSeries output = stage.process(List.of(input)).get(0);

        assertTrue(output.getSamples().isEmpty());
        assertEquals(input.getMinTimestamp(), output.getMinTimestamp());
        assertEquals(input.getMaxTimestamp(), output.getMaxTimestamp());
    }

    public void testEmptyTimeSeries() {
        IncreaseStage stage = new IncreaseStage(1000L, 1000L, null);
        TimeSeries input = new TimeSeries(List.of(), Map.of("job", "api"), 0L, 5000L, 1000L);

        List<TimeSeries> result = stage.process(List.of(input));

        assertEquals(1, result.size());
        assertTrue(result.get(0).getSamples().isEmpty());
    }

    public void testMultipleTimeSeries() {
        IncreaseStage stage = new IncreaseStage(FIFTY_MINUTES, FIFTY_MINUTES, null);
        TimeSeries first = fiveMinuteSeries(Map.of("instance", "a"), 0, 10, 20, 30, 40, 50, 60, 70, 80, 90, 100);
        TimeSeries second = fiveMinuteSeries(Map.of("instance", "b"), 0, 10, 20, 30, 40, 50, 0, 10, 20, 30, 40);

        List<TimeSeries> result = stage.process(List.of(first, second));

        assertEquals(2, result.size());
        assertEquals(Map.of("instance", "a"), result.get(0).getLabels());
        assertEquals(100.0, result.get(0).getSamples().get(0).getValue(), 1e-9);
        assertEquals(Map.of("instance", "b"), result.get(1).getLabels());
        assertEquals(90.0, result.get(1).getSamples().get(0).getValue(), 1e-9);
    }

    public void testExtrapolationModes() {
        // 20 observed over 20s of a 60s window
        List<Sample> samples = List.of(new FloatSample(20_000L, 20.0), new FloatSample(30_000L, 30.0), new FloatSample(40_000L, 40.0));
        TimeSeries input = new TimeSeries(samples, Map.of(), 0L, 60_000L, 10_000L);

        assertEquals(
            60.0,
            new IncreaseStage(60_000L, 60_000L, ExtrapolationMode.PROPORTIONAL).process(List.of(input)).get(0).getSamples().get(0).getValue(),
            1e-9
        );
        assertEquals(
            30.0,
            new IncreaseStage(60_000L, 60_000L, ExtrapolationMode.PROMETHEUS).process(List.of(input)).get(0).getSamples().get(0).getValue(),
            1e-9
        );
    }

    public void testNodeDefaultExtrapolationApplies() {
        List<Sample> samples = List.of(new FloatSample(20_000L, 20.0), new FloatSample(30_000L, 30.0), new FloatSample(40_000L, 40.0));
        TimeSeries input = new TimeSeries(samples, Map.of(), 0L, 60_000L, 10_000L);
        CounterIncreaseConfig.setCurrent(new CounterIncreaseConfig(ExtrapolationMode.PROMETHEUS, 100, true));

        TimeSeries output = new IncreaseStage(60_000L, 60_000L, null).process(List.of(input)).get(0);

        assertEquals(30.0, output.getSamples().get(0).getValue(), 1e-9);
    }

    public void testNodeWindowCapApplies() {
        CounterIncreaseConfig.setCurrent(new CounterIncreaseConfig(ExtrapolationMode.PROPORTIONAL, 5, true));
        TimeSeries input = new TimeSeries(List.of(), Map.of(), 0L, 100_000L, 1000L);

        expectThrows(InvalidScheduleParametersException.class, () -> new IncreaseStage(1000L, 1000L, null).process(List.of(input)));
    }

    public void testSampleOutsideSeriesBounds() {
        TimeSeries input = new TimeSeries(List.of(new FloatSample(10_000L, 1.0)), Map.of(), 0L, 5_000L, 1000L);
        expectThrows(OutOfRangeSampleException.class, () -> new IncreaseStage(1000L, 1000L, null).process(List.of(input)));
    }

    public void testWithEmptyInput() {
        IncreaseStage stage = new IncreaseStage(1000L, 1000L, null);
        assertTrue(stage.process(List.of()).isEmpty());
    }

    public void testNullInputThrowsException() {
        assertNullInputThrowsException(new IncreaseStage(1000L, 1000L, null), "increase");
    }

    public void testInvalidConstructorArguments() {
        expectThrows(IllegalArgumentException.class, () -> new IncreaseStage(0L, 1000L, null));
        expectThrows(IllegalArgumentException.class, () -> new IncreaseStage(1000L, -1L, null));
    }

    public void testGetName() {
        assertEquals("increase", new IncreaseStage(1000L, 1000L, null).getName());
    }

    public void testFromArgsWithMillis() {
        IncreaseStage stage = IncreaseStage.fromArgs(Map.of("range", 300_000, "step", 60_000L));
        assertEquals(300_000L, stage.getRange());
        assertEquals(60_000L, stage.getStep());
        assertNull(stage.getExtrapolationMode());
    }

    public void testFromArgsWithTimeStrings() {
        IncreaseStage stage = IncreaseStage.fromArgs(Map.of("time_range", "5m", "time_step", "30s", "extrapolation", "PROMETHEUS"));
        assertEquals(300_000L, stage.getRange());
        assertEquals(30_000L, stage.getStep());
        assertEquals(ExtrapolationMode.PROMETHEUS, stage.getExtrapolationMode());
    }

    public void testFromArgsInvalid() {
        expectThrows(IllegalArgumentException.class, () -> IncreaseStage.fromArgs(Map.of("step", 1000L)));
        expectThrows(IllegalArgumentException.class, () -> IncreaseStage.fromArgs(Map.of("range", 1000L)));
        expectThrows(IllegalArgumentException.class, () -> IncreaseStage.fromArgs(Map.of("range", "5m", "step", 1000L)));
        expectThrows(IllegalArgumentException.class, () -> IncreaseStage.fromArgs(Map.of("time_range", "five", "step", 1000L)));
        expectThrows(IllegalArgumentException.class, () -> IncreaseStage.fromArgs(Map.of("range", -5L, "step", 1000L)));
        expectThrows(
            IllegalArgumentException.class,
            () -> IncreaseStage.fromArgs(Map.of("range", 1000L, "step", 1000L, "extrapolation", "linear"))
        );
    }

    public void testPipelineStageFactory() {
        assertTrue(PipelineStageFactory.isStageTypeSupported(IncreaseStage.NAME));
        PipelineStage stage = PipelineStageFactory.createWithArgs(IncreaseStage.NAME, Map.of("range", 60_000L, "step", 10_000L));
        assertTrue(stage instanceof IncreaseStage);
    }

    public void testPipelineStageFactoryReadFrom_StreamInput() throws Exception {
        IncreaseStage original = new IncreaseStage(60_000L, 10_000L, ExtrapolationMode.PROMETHEUS);
        try (BytesStreamOutput out = new BytesStreamOutput()) {
            out.writeString(IncreaseStage.NAME);
            original.writeTo(out);
            try (StreamInput in = out.bytes().streamInput()) {
                PipelineStage restored = PipelineStageFactory.readFrom(in);
                assertEquals(original, restored);
            }
        }
    }

    public void testToXContent() throws IOException {
        IncreaseStage stage = new IncreaseStage(300_000L, 60_000L, ExtrapolationMode.PROMETHEUS);
        try (XContentBuilder builder = XContentFactory.jsonBuilder().startObject()) {
            stage.toXContent(builder, EMPTY_PARAMS);
            builder.endObject();
            assertEquals("{\"range\":300000,\"step\":60000,\"extrapolation\":\"prometheus\"}", builder.toString());
        }
    }

    public void testToXContentWithoutExtrapolation() throws IOException {
        IncreaseStage stage = new IncreaseStage(300_000L, 60_000L, null);
        try (XContentBuilder builder = XContentFactory.jsonBuilder().startObject()) {
            stage.toXContent(builder, EMPTY_PARAMS);
            builder.endObject();
            assertEquals("{\"range\":300000,\"step\":60000}", builder.toString());
        }
    }

    public void testSupportConcurrentSegmentSearch() {
        assertFalse(new IncreaseStage(1000L, 1000L, null).supportConcurrentSegmentSearch());
        assertFalse(new IncreaseStage(1000L, 1000L, null).isCoordinatorOnly());
    }

    public void testNotEqualToRateWithSameParameters() {
        assertNotEquals(new IncreaseStage(1000L, 1000L, null), new RateStage(1000L, 1000L, null));
    }

    @Override
    protected IncreaseStage createTestInstance() {
        return new IncreaseStage(
            randomLongBetween(1L, 3_600_000L),
            randomLongBetween(1L, 600_000L),
            randomBoolean() ? null : randomFrom(ExtrapolationMode.values())
        );
    }

    @Override
    protected IncreaseStage mutateInstance(IncreaseStage instance) {
        switch (between(0, 2)) {
            case 0:
                return new IncreaseStage(instance.getRange() + 1, instance.getStep(), instance.getExtrapolationMode());
            case 1:
                return new IncreaseStage(instance.getRange(), instance.getStep() + 1, instance.getExtrapolationMode());
            default:
                ExtrapolationMode mode = instance.getExtrapolationMode() == ExtrapolationMode.PROMETHEUS
                    ? ExtrapolationMode.PROPORTIONAL
                    : ExtrapolationMode.PROMETHEUS;
                return new IncreaseStage(instance.getRange(), instance.getStep(), mode);
        }
    }

    @Override
    protected Writeable.Reader<IncreaseStage> instanceReader() {
        return IncreaseStage::readFrom;
    }
}
