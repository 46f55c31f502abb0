package io.hivescan.client;

import static io.hivescan.common.HivescanErrorMessages.MISSING_CREDENTIAL;

import java.util.function.UnaryOperator;

import io.hivescan.spec.HivescanConfigurationException;
import io.hivescan.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * The API key sent with every request.
 * <p>
 * Credentials are resolved once by the caller and passed into {@link HoneycombClient}; the
 * client never reads the environment itself.
 *
 * @param apiKey the Honeycomb API key
 */
public record HoneycombCredentials(String apiKey) {

    public static final String HONEYCOMB_API_KEY = "HONEYCOMB_API_KEY";

    public HoneycombCredentials {
        Assert.checkNotBlankParam("apiKey", apiKey);
    }

    /**
     * Reads the API key from the {@code HONEYCOMB_API_KEY} environment variable.
     *
     * @return the credentials
     * @throws HivescanConfigurationException if the variable is not set or blank
     */
    public static HoneycombCredentials fromEnvironment() throws HivescanConfigurationException {
        return fromEnvironment(System::getenv);
    }

    static HoneycombCredentials fromEnvironment(UnaryOperator<@Nullable String> environment)
            throws HivescanConfigurationException {
        String apiKey = environment.apply(HONEYCOMB_API_KEY);
        if (apiKey == null || apiKey.isBlank()) {
            throw new HivescanConfigurationException(String.format(MISSING_CREDENTIAL, HONEYCOMB_API_KEY));
        }
        return new HoneycombCredentials(apiKey.trim());
    }

    @Override
    public String toString() {
        return "HoneycombCredentials{apiKey=****}";
    }
}
