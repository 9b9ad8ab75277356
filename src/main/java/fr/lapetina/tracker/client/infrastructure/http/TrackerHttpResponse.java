package fr.lapetina.tracker.client.infrastructure.http;

import java.nio.charset.StandardCharsets;

/**
 * Fully read tracker response.
 *
 * @param statusCode HTTP status code
 * @param body       response body, empty when the tracker sent none
 */
public record TrackerHttpResponse(int statusCode, byte[] body) {

    public TrackerHttpResponse {
        body = body != null ? body : new byte[0];
    }

    public static TrackerHttpResponse of(int statusCode, String body) {
        return new TrackerHttpResponse(statusCode, body.getBytes(StandardCharsets.UTF_8));
    }

    public static TrackerHttpResponse empty(int statusCode) {
        return new TrackerHttpResponse(statusCode, new byte[0]);
    }
}
