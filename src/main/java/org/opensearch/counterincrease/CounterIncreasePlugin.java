/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.counterincrease;

import org.opensearch.client.Client;
import org.opensearch.cluster.metadata.IndexNameExpressionResolver;
import org.opensearch.cluster.service.ClusterService;
import org.opensearch.common.settings.Setting;
import org.opensearch.common.settings.Settings;
import org.opensearch.core.common.io.stream.NamedWriteableRegistry;
import org.opensearch.core.xcontent.NamedXContentRegistry;
import org.opensearch.counterincrease.query.increase.CounterIncreaseConfig;
import org.opensearch.counterincrease.query.increase.ExtrapolationMode;
import org.opensearch.counterincrease.query.increase.WindowSchedule;
import org.opensearch.env.Environment;
import org.opensearch.env.NodeEnvironment;
import org.opensearch.plugins.Plugin;
import org.opensearch.repositories.RepositoriesService;
import org.opensearch.script.ScriptService;
import org.opensearch.threadpool.ThreadPool;
import org.opensearch.watcher.ResourceWatcherService;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * Plugin providing the windowed counter increase and rate engine.
 */
public class CounterIncreasePlugin extends Plugin {

    /**
     * How observed window increases are extrapolated to the window width: {@code proportional} or
     * {@code prometheus}.
     */
    public static final Setting<ExtrapolationMode> EXTRAPOLATION_MODE = new Setting<>(
        "counter_increase.extrapolation_mode",
        ExtrapolationMode.PROPORTIONAL.getName(),
        ExtrapolationMode::fromString,
        Setting.Property.NodeScope,
        Setting.Property.Dynamic
    );

    /**
     * Upper limit on the number of evaluation windows a single series may request.
     */
    public static final Setting<Integer> MAX_WINDOWS_PER_SERIES = Setting.intSetting(
        "counter_increase.max_windows_per_series",
        WindowSchedule.DEFAULT_MAX_WINDOWS,
        1,
        Setting.Property.NodeScope,
        Setting.Property.Dynamic
    );

    /**
     * Whether samples carrying the Prometheus staleness marker are dropped before ingestion.
     */
    public static final Setting<Boolean> SKIP_STALE_MARKERS = Setting.boolSetting(
        "counter_increase.skip_stale_markers",
        true,
        Setting.Property.NodeScope,
        Setting.Property.Dynamic
    );

    /**
     * Create the plugin and publish the node's counter increase configuration.
     *
     * @param settings the node settings
     */
    public CounterIncreasePlugin(Settings settings) {
        CounterIncreaseConfig.setCurrent(CounterIncreaseConfig.fromSettings(settings));
    }

    @Override
    public Collection<Object> createComponents(
        Client client,
        ClusterService clusterService,
        ThreadPool threadPool,
        ResourceWatcherService resourceWatcherService,
        ScriptService scriptService,
        NamedXContentRegistry xContentRegistry,
        Environment environment,
        NodeEnvironment nodeEnvironment,
        NamedWriteableRegistry namedWriteableRegistry,
        IndexNameExpressionResolver indexNameExpressionResolver,
        Supplier<RepositoriesService> repositoriesServiceSupplier
    ) {
        // registers the dynamic update listeners once per node startup
        CounterIncreaseConfig.initialize(clusterService.getClusterSettings(), environment.settings());
        return Collections.emptyList();
    }

    @Override
    public List<Setting<?>> getSettings() {
        return List.of(EXTRAPOLATION_MODE, MAX_WINDOWS_PER_SERIES, SKIP_STALE_MARKERS);
    }
}
