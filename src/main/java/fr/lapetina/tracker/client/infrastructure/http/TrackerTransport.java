package fr.lapetina.tracker.client.infrastructure.http;

import java.util.concurrent.CompletableFuture;

/**
 * HTTP layer used by the tracker client.
 *
 * <p>Implementations must be thread-safe and must read the response body to
 * the end before completing, so no connection is left holding an unread body.
 * Timeouts and any retry policy belong to the implementation.
 *
 * <p>Cancelling the returned future should abort the exchange where the
 * underlying client supports it. Network failures complete the future
 * exceptionally with an {@link java.io.IOException}.
 */
public interface TrackerTransport {

    /**
     * Sends a request.
     *
     * @param request the request to send
     * @return future completed with the response, whatever its status code
     */
    CompletableFuture<TrackerHttpResponse> send(TrackerHttpRequest request);
}
