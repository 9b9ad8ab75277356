package fr.lapetina.tracker.client.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a work acquisition request.
 */
public record WorkRequest(
        @JsonProperty("downloader") String downloader,
        @JsonProperty("api_version") String apiVersion,
        @JsonProperty("version") String version
) {
    public static final String API_VERSION = "2";

    public static WorkRequest of(String downloader, String version) {
        return new WorkRequest(downloader, API_VERSION, version);
    }
}
