package io.hivescan.client.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class DefaultValuesConfigProviderTest {

    private static DefaultValuesConfigProvider provider(Map<String, String> systemProperties, Map<String, String> environment) {
        return new DefaultValuesConfigProvider(systemProperties::get, environment::get);
    }

    @Test
    public void testReadsClasspathDefaults() {
        DefaultValuesConfigProvider provider = provider(Map.of(), Map.of());

        assertEquals("12", provider.getValue(FanOutSettings.RETRY_BUDGET));
        assertEquals("PT0.1S", provider.getValue(FanOutSettings.POLL_INTERVAL));
    }

    @Test
    public void testEnvironmentOverridesDefaults() {
        DefaultValuesConfigProvider provider = provider(Map.of(), Map.of("HIVESCAN_QUERY_RESULT_LIMIT", "500"));

        assertEquals("500", provider.getValue(FanOutSettings.QUERY_RESULT_LIMIT));
    }

    @Test
    public void testSystemPropertyOverridesEnvironment() {
        DefaultValuesConfigProvider provider = provider(
                Map.of(FanOutSettings.FANOUT_CONCURRENCY, "7"),
                Map.of("HIVESCAN_FANOUT_CONCURRENCY", "5"));

        assertEquals("7", provider.getValue(FanOutSettings.FANOUT_CONCURRENCY));
    }

    @Test
    public void testBlankValuesFallThrough() {
        DefaultValuesConfigProvider provider = provider(
                Map.of(FanOutSettings.RETRY_BUDGET, " "),
                Map.of("HIVESCAN_RETRY_BUDGET", ""));

        assertEquals("12", provider.getValue(FanOutSettings.RETRY_BUDGET));
    }

    @Test
    public void testUnknownName() {
        DefaultValuesConfigProvider provider = provider(Map.of(), Map.of());

        assertTrue(provider.getOptionalValue("hivescan.unknown").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> provider.getValue("hivescan.unknown"));
    }

    @Test
    public void testEnvironmentName() {
        assertEquals("HIVESCAN_QUERY_TIME_RANGE", DefaultValuesConfigProvider.toEnvironmentName("hivescan.query.time-range"));
    }

    @Test
    public void testSettingsFromDefaults() throws Exception {
        FanOutSettings settings = FanOutSettings.from(
                provider(Map.of(), Map.of("HIVESCAN_RETRY_BACKOFF", "PT1S")));

        assertEquals(Duration.ofSeconds(1), settings.getRateLimitBackoff());
        assertEquals(12, settings.getRetryBudget());
    }
}
