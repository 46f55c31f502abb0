/**
 * Settings of the orchestrator and where they come from.
 *
 * <p>{@link io.hivescan.client.config.FanOutSettings} holds every policy constant (retry budget,
 * backoff, poll budget and interval, concurrency limit, API URL). Values are read through a
 * {@link io.hivescan.client.config.HivescanConfigProvider}; the default provider layers system
 * properties and environment variables over {@code META-INF/hivescan-defaults.properties}.
 */
@NullMarked
package io.hivescan.client.config;

import org.jspecify.annotations.NullMarked;
