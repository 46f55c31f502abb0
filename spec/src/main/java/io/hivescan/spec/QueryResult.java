package io.hivescan.spec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * The state of an asynchronous query execution.
 * <p>
 * Returned both when a result is created ({@code POST /1/query_results/{datasetSlug}}) and
 * when it is polled ({@code GET /1/query_results/{datasetSlug}/{id}}). The result rows are read
 * from the polled status by the client, not bound here.
 *
 * @param id the query result identifier to poll with
 * @param complete whether the server has finished computing the result
 * @param links UI links for the result, may be absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QueryResult(@JsonProperty("id") @Nullable String id,
                          @JsonProperty("complete") boolean complete,
                          @JsonProperty("links") @Nullable QueryResultLinks links) {
}
