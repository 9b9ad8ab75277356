package fr.lapetina.tracker.client.infrastructure.http;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outbound tracker request as handed to a {@link TrackerTransport}.
 *
 * @param method  HTTP method
 * @param uri     absolute target URI
 * @param headers header names and values, in insertion order
 * @param body    serialized body, empty for none
 */
public record TrackerHttpRequest(
        String method,
        URI uri,
        Map<String, String> headers,
        byte[] body
) {
    public TrackerHttpRequest {
        Objects.requireNonNull(method, "Method is required");
        Objects.requireNonNull(uri, "URI is required");
        headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
        body = body != null ? body : new byte[0];
    }

    /**
     * Header value by case-insensitive name, or {@code null}.
     */
    public String header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
