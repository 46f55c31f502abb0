package io.hivescan.spec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NameAndSlug(@JsonProperty("name") String name,
                          @JsonProperty("slug") String slug) {
}
