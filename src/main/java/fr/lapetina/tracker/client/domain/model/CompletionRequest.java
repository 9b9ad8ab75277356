package fr.lapetina.tracker.client.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Body of a completion report. {@code bytes} is left out of the JSON when absent.
 * Item identifiers must not be null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompletionRequest(
        @JsonProperty("downloader") String downloader,
        @JsonProperty("version") String version,
        @JsonProperty("items") List<String> items,
        @JsonProperty("bytes") Map<String, Long> bytes
) {
    public CompletionRequest {
        Objects.requireNonNull(items, "Items are required");
        for (String item : items) {
            Objects.requireNonNull(item, "Item identifier must not be null");
        }
        items = List.copyOf(items);
        // insertion order is kept
        bytes = bytes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(bytes)) : null;
    }
}
