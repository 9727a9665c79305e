/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.counterincrease.query.increase;

/**
 * One evaluation window of a {@link WindowSchedule}.
 *
 * <p>The window covers {@code [start, end]} in milliseconds and is evaluated at {@code end}.
 * Whether a sample exactly at {@code start} belongs to the window is decided by the schedule,
 * see {@link WindowSchedule#firstWindowIndex(long)}.</p>
 *
 * @param index position of the window in its schedule
 * @param start window start (evaluation time minus range)
 * @param end window end, which is also the evaluation time
 */
public record EvaluationWindow(int index, long start, long end) {

    /**
     * @return the nominal width of the window in milliseconds
     */
    public long width() {
        return end - start;
    }
}
