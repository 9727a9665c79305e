/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.counterincrease.query.increase;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.settings.ClusterSettings;
import org.opensearch.common.settings.Settings;
import org.opensearch.counterincrease.CounterIncreasePlugin;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Node-level configuration of the counter window engine.
 *
 * <h2>Settings:</h2>
 * <p>Settings are defined in {@link CounterIncreasePlugin}:</p>
 * <ul>
 *   <li>{@link CounterIncreasePlugin#EXTRAPOLATION_MODE}</li>
 *   <li>{@link CounterIncreasePlugin#MAX_WINDOWS_PER_SERIES}</li>
 *   <li>{@link CounterIncreasePlugin#SKIP_STALE_MARKERS}</li>
 * </ul>
 *
 * <p>The node's current configuration is held in an {@link AtomicReference} and replaced as a whole on
 * dynamic updates, so readers always see a consistent combination of values. Engine instances copy the
 * values they need when they are created; an update never changes a running aggregation.</p>
 *
 * @param extrapolationMode default extrapolation for stages that do not name one
 * @param maxWindowsPerSeries upper limit on windows per series
 * @param skipStaleMarkers whether staleness markers are dropped on ingestion
 */
public record CounterIncreaseConfig(ExtrapolationMode extrapolationMode, int maxWindowsPerSeries, boolean skipStaleMarkers) {

    private static final Logger logger = LogManager.getLogger(CounterIncreaseConfig.class);

    private static final AtomicReference<CounterIncreaseConfig> current = new AtomicReference<>(defaultConfig());

    /**
     * Read the configuration from settings, falling back to defaults for absent keys.
     *
     * @param settings node or cluster settings
     * @return the configuration
     */
    public static CounterIncreaseConfig fromSettings(Settings settings) {
        return new CounterIncreaseConfig(
            CounterIncreasePlugin.EXTRAPOLATION_MODE.get(settings),
            CounterIncreasePlugin.MAX_WINDOWS_PER_SERIES.get(settings),
            CounterIncreasePlugin.SKIP_STALE_MARKERS.get(settings)
        );
    }

    /**
     * Initialize the configuration from cluster settings and register dynamic update listeners.
     *
     * @param clusterSettings the cluster settings for registering dynamic listeners
     * @param settings the current node settings
     */
    public static void initialize(ClusterSettings clusterSettings, Settings settings) {
        CounterIncreaseConfig initial = fromSettings(settings);
        setCurrent(initial);
        logger.info(
            "Initialized counter increase config: extrapolationMode={}, maxWindowsPerSeries={}, skipStaleMarkers={}",
            initial.extrapolationMode(),
            initial.maxWindowsPerSeries(),
            initial.skipStaleMarkers()
        );

        clusterSettings.addSettingsUpdateConsumer(
            CounterIncreasePlugin.EXTRAPOLATION_MODE,
            mode -> update(current().withExtrapolationMode(mode))
        );
        clusterSettings.addSettingsUpdateConsumer(
            CounterIncreasePlugin.MAX_WINDOWS_PER_SERIES,
            maxWindows -> update(current().withMaxWindowsPerSeries(maxWindows))
        );
        clusterSettings.addSettingsUpdateConsumer(
            CounterIncreasePlugin.SKIP_STALE_MARKERS,
            skip -> update(current().withSkipStaleMarkers(skip))
        );
    }

    private static void update(CounterIncreaseConfig newConfig) {
        setCurrent(newConfig);
        logger.info(
            "Updated counter increase config: extrapolationMode={}, maxWindowsPerSeries={}, skipStaleMarkers={}",
            newConfig.extrapolationMode(),
            newConfig.maxWindowsPerSeries(),
            newConfig.skipStaleMarkers()
        );
    }

    /**
     * @return the node's current configuration
     */
    public static CounterIncreaseConfig current() {
        return current.get();
    }

    /**
     * Replace the node's current configuration.
     *
     * @param config the new configuration
     */
    public static void setCurrent(CounterIncreaseConfig config) {
        current.set(config);
    }

    /**
     * Default configuration for when settings are not available.
     *
     * @return proportional extrapolation, the default window cap and stale markers skipped
     */
    public static CounterIncreaseConfig defaultConfig() {
        return new CounterIncreaseConfig(ExtrapolationMode.PROPORTIONAL, WindowSchedule.DEFAULT_MAX_WINDOWS, true);
    }

    CounterIncreaseConfig withExtrapolationMode(ExtrapolationMode mode) {
        return new CounterIncreaseConfig(mode, maxWindowsPerSeries, skipStaleMarkers);
    }

    CounterIncreaseConfig withMaxWindowsPerSeries(int maxWindows) {
        return new CounterIncreaseConfig(extrapolationMode, maxWindows, skipStaleMarkers);
    }

    CounterIncreaseConfig withSkipStaleMarkers(boolean skip) {
        return new CounterIncreaseConfig(extrapolationMode, maxWindowsPerSeries, skip);
    }
}
