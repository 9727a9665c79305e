/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.counterincrease.query.stage;

import org.opensearch.counterincrease.query.aggregator.TimeSeries;

import java.util.List;

/**
 * Interface for unary pipeline stages that transform each input series independently.
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * // 5 minute increase evaluated every minute
 * UnaryPipelineStage increase = new IncreaseStage(300_000L, 60_000L, null);
 * List<TimeSeries> increases = increase.process(inputTimeSeries);
 * }</pre>
 */
public interface UnaryPipelineStage extends PipelineStage {

    /**
     * Process the input series and return the transformed series.
     *
     * @param input The input time series to process
     * @return The transformed time series
     */
    List<TimeSeries> process(List<TimeSeries> input);

    /**
     * Check if this stage must be executed only at the coordinator level.
     *
     * @return true if this stage must be executed only at the coordinator level, false otherwise
     */
    default boolean isCoordinatorOnly() {
        return false;
    }
}
