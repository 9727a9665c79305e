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
 * Running, reset-compensated increase of a counter within one evaluation window.
 *
 * <h2>Reset handling</h2>
 * Every sample after the first is compared with the previous raw reading of <em>this</em> window:
 * <ul>
 *   <li>a non-negative difference is added to the corrected total;</li>
 *   <li>a negative difference is a counter reset. The counter is assumed to have restarted from zero,
 *       so the new reading itself is added.</li>
 * </ul>
 * The corrected total therefore never decreases. The first sample only seeds the window.
 *
 * <h2>Example</h2>
 * <pre>
 *   readings: 0, 1, 2, 3, 2, 3, 4
 *   deltas:      1, 1, 1, 2, 1, 1   (3 -&gt; 2 is a reset, credited as 2)
 *   total:   7
 * </pre>
 *
 * The previous raw value is always the value of the last sample, so it is not stored separately.
 */
public class CounterAccumulator implements Writeable {

    /**
     * Estimated heap footprint of an empty accumulator: object header, two sample references,
     * the corrected total and the sample count.
     */
    static final long ESTIMATED_MEMORY_OVERHEAD = 40;

    /** Estimated heap footprint of one boundary sample: object header, timestamp and value. */
    static final long ESTIMATED_SAMPLE_SIZE = 32;

    private FloatSample firstSample;
    private FloatSample lastSample;
    private double correctedTotal;
    private long sampleCount;

    /**
     * Create an empty accumulator.
     */
    public CounterAccumulator() {}

    /**
     * Read an accumulator from the stream.
     *
     * @param in the input stream
     * @throws IOException if an I/O error occurs
     */
    public CounterAccumulator(StreamInput in) throws IOException {
        this.sampleCount = in.readVLong();
        if (sampleCount > 0) {
            this.firstSample = new FloatSample(in);
            this.lastSample = new FloatSample(in);
            this.correctedTotal = in.readDouble();
        }
    }

    /**
     * Observe the next sample of this window. Samples must arrive in non-decreasing timestamp order.
     *
     * @param timestamp sample timestamp
     * @param value raw counter reading
     */
    public void add(long timestamp, double value) {
        FloatSample sample = new FloatSample(timestamp, value);
        if (firstSample == null) {
            firstSample = sample;
        } else {
            correctedTotal += resetAwareDelta(lastSample.getValue(), value);
        }
        lastSample = sample;
        sampleCount++;
    }

    /**
     * Increase between two consecutive raw readings, treating a decrease as a reset to zero.
     *
     * @param previous the earlier reading
     * @param current the later reading
     * @return the increase contributed by {@code current}
     */
    static double resetAwareDelta(double previous, double current) {
        double delta = current - previous;
        if (delta < 0) {
            return current;
        }
        return delta;
    }

    /**
     * Fold another partial of the same window into this one.
     *
     * <p>The two partials must cover disjoint, ordered stretches of the window's samples. Whichever
     * partial ends first is treated as the earlier one; the reset-aware delta across the seam between
     * its last sample and the other partial's first sample is added, so merging two halves of a
     * sequence gives the same total as ingesting the whole sequence.</p>
     *
     * @param other the partial to absorb, left unchanged
     * @throws UnmergeablePartialsException if the partials overlap in time
     */
    public void mergeWith(CounterAccumulator other) {
        if (other.isEmpty()) {
            return;
        }
        if (isEmpty()) {
            copyFrom(other);
            return;
        }
        CounterAccumulator earlier;
        CounterAccumulator later;
        if (lastSample.getTimestamp() <= other.firstSample.getTimestamp()) {
            earlier = this;
            later = other;
        } else if (other.lastSample.getTimestamp() <= firstSample.getTimestamp()) {
            earlier = other;
            later = this;
        } else {
            throw new UnmergeablePartialsException(
                String.format(
                    Locale.ROOT,
                    "partial sample ranges [%d, %d] and [%d, %d] overlap",
                    firstSample.getTimestamp(),
                    lastSample.getTimestamp(),
                    other.firstSample.getTimestamp(),
                    other.lastSample.getTimestamp()
                )
            );
        }
        double seam = resetAwareDelta(earlier.lastSample.getValue(), later.firstSample.getValue());
        double total = earlier.correctedTotal + later.correctedTotal + seam;
        FloatSample first = earlier.firstSample;
        FloatSample last = later.lastSample;
        this.firstSample = first;
        this.lastSample = last;
        this.correctedTotal = total;
        this.sampleCount += other.sampleCount;
    }

    private void copyFrom(CounterAccumulator other) {
        this.firstSample = other.firstSample;
        this.lastSample = other.lastSample;
        this.correctedTotal = other.correctedTotal;
        this.sampleCount = other.sampleCount;
    }

    /**
     * @return true if no sample has been observed
     */
    public boolean isEmpty() {
        return sampleCount == 0;
    }

    /**
     * @return earliest observed sample, or null if empty
     */
    public FloatSample getFirstSample() {
        return firstSample;
    }

    /**
     * @return latest observed sample, or null if empty
     */
    public FloatSample getLastSample() {
        return lastSample;
    }

    /**
     * @return reset-compensated increase between the first and the last sample
     */
    public double getCorrectedTotal() {
        return correctedTotal;
    }

    public long getSampleCount() {
        return sampleCount;
    }

    /**
     * @return estimated heap usage in bytes
     */
    public long getEstimatedMemoryUsage() {
        return ESTIMATED_MEMORY_OVERHEAD + (isEmpty() ? 0 : 2 * ESTIMATED_SAMPLE_SIZE);
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeVLong(sampleCount);
        if (sampleCount > 0) {
            firstSample.writeTo(out);
            lastSample.writeTo(out);
            out.writeDouble(correctedTotal);
        }
    }

    @Override
    public String toString() {
        return "CounterAccumulator{"
            + "firstSample="
            + firstSample
            + ", lastSample="
            + lastSample
            + ", correctedTotal="
            + correctedTotal
            + ", sampleCount="
            + sampleCount
            + '}';
    }
}
