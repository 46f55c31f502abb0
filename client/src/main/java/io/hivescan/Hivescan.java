package io.hivescan;

import java.util.Optional;

import io.hivescan.client.Futures;
import io.hivescan.client.HoneycombClient;
import io.hivescan.client.HoneycombCredentials;
import io.hivescan.client.config.DefaultValuesConfigProvider;
import io.hivescan.client.config.FanOutSettings;
import io.hivescan.client.http.HttpClientManager;
import io.hivescan.spec.Authorizations;
import io.hivescan.spec.HivescanClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: resolves credentials and settings, then checks that the API key carries the
 * access the caller needs before handing out a client.
 */
public final class Hivescan {

    private static final Logger LOGGER = LoggerFactory.getLogger(Hivescan.class);

    private static final HttpClientManager HTTP_CLIENTS = new HttpClientManager();

    private Hivescan() {
    }

    /**
     * Connects with the API key from {@code HONEYCOMB_API_KEY} and the settings of
     * {@link DefaultValuesConfigProvider}.
     *
     * @param requiredAccess the access types the key must grant, for example {@code "columns"}
     * @return the client, or empty if the key lacks any of the required access types
     * @throws io.hivescan.spec.HivescanConfigurationException if the API key or a setting is missing or invalid
     * @throws HivescanClientException if the authorizations cannot be fetched
     */
    public static Optional<HoneycombClient> connect(String... requiredAccess) throws HivescanClientException {
        return connect(HoneycombCredentials.fromEnvironment(),
                FanOutSettings.from(new DefaultValuesConfigProvider()), requiredAccess);
    }

    public static Optional<HoneycombClient> connect(HoneycombCredentials credentials, FanOutSettings settings,
                                                    String... requiredAccess) throws HivescanClientException {
        HoneycombClient client = HoneycombClient.builder(credentials)
                .settings(settings)
                .httpClient(HTTP_CLIENTS.getOrCreate(settings.getApiUrl()))
                .build();

        Authorizations authorizations = Futures.await(client.listAuthorizations());
        if (!authorizations.hasRequiredAccess(requiredAccess)) {
            LOGGER.warn("API key is missing required access {}:\n{}", String.join(", ", requiredAccess), authorizations);
            return Optional.empty();
        }
        LOGGER.debug("Connected to environment {} of team {}",
                authorizations.environment().name(), authorizations.team().name());
        return Optional.of(client);
    }
}
