package fr.lapetina.tracker.client.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body returned by the tracker when work is handed out.
 * Queues are part of the wire format but not interpreted by the client.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkResponse(
        @JsonProperty("items") List<String> items,
        @JsonProperty("queues") List<String> queues
) {
    public WorkResponse {
        items = items != null ? List.copyOf(items) : List.of();
        queues = queues != null ? List.copyOf(queues) : List.of();
    }
}
