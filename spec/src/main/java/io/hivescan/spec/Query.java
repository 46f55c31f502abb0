package io.hivescan.spec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A saved query specification, returned by {@code POST /1/queries/{datasetSlug}}.
 *
 * @param id the query identifier, used to start a query result
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Query(@JsonProperty("id") String id) {
}
