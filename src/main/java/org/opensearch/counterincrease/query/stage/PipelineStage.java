/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.counterincrease.query.stage;

import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.core.xcontent.ToXContent;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.counterincrease.query.aggregator.TimeSeries;

import java.io.IOException;
import java.util.List;

/**
 * Interface for pipeline stages that process time series.
 *
 * <h2>Key Features:</h2>
 * <ul>
 *   <li><strong>Serialization Support:</strong> Extends {@link Writeable} for
 *       distributed processing</li>
 *   <li><strong>XContent Support:</strong> Renders its arguments through {@link ToXContent}
 *       parameters</li>
 * </ul>
 */
public interface PipelineStage extends Writeable {
    /**
     * Get the name of this pipeline stage.
     *
     * @return The stage name
     */
    String getName();

    /**
     * Process time series data.
     *
     * @param input The input time series to process
     * @return The processed time series result
     */
    List<TimeSeries> process(List<TimeSeries> input);

    /**
     * Serialize this stage to XContent including all arguments.
     * @param builder The XContentBuilder to write to
     * @param params Serialization parameters
     * @throws IOException if serialization fails
     */
    void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException;

    /**
     * Write stage-specific data to the output stream for serialization.
     *
     * @param out the output stream
     * @throws IOException if an I/O error occurs
     */
    void writeTo(StreamOutput out) throws IOException;

    /**
     * Check if this stage supports concurrent segment search execution.
     *
     * <p>Stages that need every sample of a series in timestamp order to compute their result
     * return false.</p>
     *
     * @return true if this stage supports concurrent segment search, false otherwise
     */
    default boolean supportConcurrentSegmentSearch() {
        return false;
    }
}
