/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.counterincrease.query.aggregator;

import org.opensearch.counterincrease.core.model.FloatSample;
import org.opensearch.counterincrease.core.model.Sample;
import org.opensearch.test.OpenSearchTestCase;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class TimeSeriesTests extends OpenSearchTestCase {

    public void testAccessors() {
        List<Sample> samples = List.of(new FloatSample(1000L, 1.0), new FloatSample(2000L, 2.0));
        TimeSeries series = new TimeSeries(samples, Map.of("job", "api"), 1000L, 3000L, 1000L);

        assertEquals(samples, series.getSamples());
        assertEquals(Map.of("job", "api"), series.getLabels());
        assertEquals(1000L, series.getMinTimestamp());
        assertEquals(3000L, series.getMaxTimestamp());
        assertEquals(1000L, series.getStep());
    }

    public void testLabelsAreSortedAndImmutable() {
        Map<String, String> labels = new HashMap<>();
        labels.put("zone", "b");
        labels.put("__name__", "http_requests_total");
        labels.put("job", "api");
        TimeSeries series = new TimeSeries(List.of(), labels, 0L, 0L, 1L);

        assertEquals(List.of("__name__", "job", "zone"), new ArrayList<>(series.getLabels().keySet()));
        expectThrows(UnsupportedOperationException.class, () -> series.getLabels().put("x", "y"));

        labels.put("extra", "label");
        assertFalse(series.getLabels().containsKey("extra"));
    }

    public void testSamplesAreCopied() {
        List<Sample> samples = new ArrayList<>();
        samples.add(new FloatSample(1000L, 1.0));
        TimeSeries series = new TimeSeries(samples, null, 0L, 1000L, 1000L);

        samples.add(new FloatSample(2000L, 2.0));
        assertEquals(1, series.getSamples().size());
        expectThrows(UnsupportedOperationException.class, () -> series.getSamples().add(new FloatSample(3000L, 3.0)));
    }

    public void testNullLabels() {
        TimeSeries series = new TimeSeries(List.of(), null, 0L, 0L, 1L);
        assertTrue(series.getLabels().isEmpty());
    }

    public void testEqualsAndHashCode() {
        List<Sample> samples = List.of(new FloatSample(1000L, 1.0));
        TimeSeries series = new TimeSeries(samples, Map.of("job", "api"), 0L, 1000L, 1000L);

        assertEquals(series, new TimeSeries(samples, Map.of("job", "api"), 0L, 1000L, 1000L));
        assertEquals(series.hashCode(), new TimeSeries(samples, Map.of("job", "api"), 0L, 1000L, 1000L).hashCode());
        assertNotEquals(series, new TimeSeries(samples, Map.of("job", "web"), 0L, 1000L, 1000L));
        assertNotEquals(series, new TimeSeries(samples, Map.of("job", "api"), 0L, 2000L, 1000L));
        assertNotEquals(series, new TimeSeries(List.of(), Map.of("job", "api"), 0L, 1000L, 1000L));
    }
}
