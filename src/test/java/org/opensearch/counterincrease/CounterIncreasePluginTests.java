/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.counterincrease;

import org.opensearch.common.settings.Setting;
import org.opensearch.common.settings.Settings;
import org.opensearch.counterincrease.query.increase.CounterIncreaseConfig;
import org.opensearch.counterincrease.query.increase.ExtrapolationMode;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;

public class CounterIncreasePluginTests extends OpenSearchTestCase {

    @Override
    public void tearDown() throws Exception {
        CounterIncreaseConfig.setCurrent(CounterIncreaseConfig.defaultConfig());
        super.tearDown();
    }

    public void testRegistersSettings() throws Exception {
        try (CounterIncreasePlugin plugin = new CounterIncreasePlugin(Settings.EMPTY)) {
            List<Setting<?>> settings = plugin.getSettings();
            assertEquals(3, settings.size());
            assertTrue(settings.contains(CounterIncreasePlugin.EXTRAPOLATION_MODE));
            assertTrue(settings.contains(CounterIncreasePlugin.MAX_WINDOWS_PER_SERIES));
            assertTrue(settings.contains(CounterIncreasePlugin.SKIP_STALE_MARKERS));
        }
    }

    public void testPublishesNodeSettings() throws Exception {
        Settings settings = Settings.builder()
            .put("counter_increase.extrapolation_mode", "prometheus")
            .put("counter_increase.max_windows_per_series", 250)
            .build();

        try (CounterIncreasePlugin plugin = new CounterIncreasePlugin(settings)) {
            assertEquals(new CounterIncreaseConfig(ExtrapolationMode.PROMETHEUS, 250, true), CounterIncreaseConfig.current());
        }
    }
}
