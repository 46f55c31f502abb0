package io.hivescan.client.config;

import java.util.Optional;

/**
 * Source of configuration values, looked up by dotted name such as {@code hivescan.retry.budget}.
 */
public interface HivescanConfigProvider {

    /**
     * @param name the property name
     * @return the value
     * @throws IllegalArgumentException if no value is configured for the name
     */
    String getValue(String name);

    Optional<String> getOptionalValue(String name);
}
