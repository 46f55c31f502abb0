package io.hivescan.client;

import static io.hivescan.common.HivescanErrorMessages.AUTHENTICATION_FAILED;
import static io.hivescan.common.HivescanErrorMessages.AUTHORIZATION_FAILED;
import static java.net.HttpURLConnection.HTTP_FORBIDDEN;
import static java.net.HttpURLConnection.HTTP_UNAUTHORIZED;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import io.hivescan.client.http.HttpResponse;
import io.hivescan.spec.HivescanDecodeException;
import io.hivescan.spec.HivescanHttpException;
import io.hivescan.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a received response into a typed value.
 * <p>
 * A body that does not match the target type is a {@link HivescanDecodeException} keeping the
 * raw status, headers and body; a non-success status is a {@link HivescanHttpException}.
 */
public class ResponseDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResponseDecoder.class);

    public <T> T decode(HttpResponse response, JavaType type) throws HivescanDecodeException, HivescanHttpException {
        if (!response.success()) {
            throw new HivescanHttpException(failureMessage(response.statusCode()), response.statusCode(), response.body());
        }

        String body = response.body();
        try {
            return Utils.unmarshalFrom(body, type);
        } catch (JsonProcessingException e) {
            LOGGER.warn("Invalid JSON data: {}", body);
            throw new HivescanDecodeException(response.statusCode(), response.headers(), body, e);
        }
    }

    private static String failureMessage(int statusCode) {
        if (statusCode == HTTP_UNAUTHORIZED) {
            return AUTHENTICATION_FAILED;
        } else if (statusCode == HTTP_FORBIDDEN) {
            return AUTHORIZATION_FAILED;
        }
        return "Request failed";
    }
}
