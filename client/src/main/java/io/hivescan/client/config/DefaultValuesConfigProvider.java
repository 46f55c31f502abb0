package io.hivescan.client.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.Enumeration;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.function.UnaryOperator;

import io.hivescan.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a property from, in order of precedence:
 * <ol>
 *   <li>a JVM system property of the same name</li>
 *   <li>an environment variable, the name upper-cased with dots and dashes turned into
 *       underscores ({@code hivescan.poll.budget} becomes {@code HIVESCAN_POLL_BUDGET})</li>
 *   <li>every {@code META-INF/hivescan-defaults.properties} on the classpath</li>
 * </ol>
 */
public class DefaultValuesConfigProvider implements HivescanConfigProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultValuesConfigProvider.class);

    public static final String DEFAULTS_RESOURCE = "META-INF/hivescan-defaults.properties";

    private final Properties defaults;
    private final UnaryOperator<@Nullable String> systemProperties;
    private final UnaryOperator<@Nullable String> environment;

    public DefaultValuesConfigProvider() {
        this(System::getProperty, System::getenv);
    }

    DefaultValuesConfigProvider(UnaryOperator<@Nullable String> systemProperties,
                                UnaryOperator<@Nullable String> environment) {
        this.systemProperties = Assert.checkNotNullParam("systemProperties", systemProperties);
        this.environment = Assert.checkNotNullParam("environment", environment);
        this.defaults = loadDefaults();
    }

    @Override
    public String getValue(String name) {
        return getOptionalValue(name)
                .orElseThrow(() -> new IllegalArgumentException("No configuration value for " + name));
    }

    @Override
    public Optional<String> getOptionalValue(String name) {
        Assert.checkNotNullParam("name", name);
        String value = systemProperties.apply(name);
        if (isBlank(value)) {
            value = environment.apply(toEnvironmentName(name));
        }
        if (isBlank(value)) {
            value = defaults.getProperty(name);
        }
        return isBlank(value) ? Optional.empty() : Optional.of(value.trim());
    }

    static String toEnvironmentName(String name) {
        return name.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
    }

    private static boolean isBlank(@Nullable String value) {
        return value == null || value.isBlank();
    }

    private static Properties loadDefaults() {
        Properties properties = new Properties();
        ClassLoader classLoader = DefaultValuesConfigProvider.class.getClassLoader();
        try {
            Enumeration<URL> resources = classLoader.getResources(DEFAULTS_RESOURCE);
            while (resources.hasMoreElements()) {
                URL url = resources.nextElement();
                LOGGER.debug("Loading configuration defaults from {}", url);
                try (InputStream in = url.openStream()) {
                    properties.load(in);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + DEFAULTS_RESOURCE, e);
        }
        return properties;
    }
}
