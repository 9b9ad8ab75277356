package fr.lapetina.tracker.client.infrastructure.http;

import fr.lapetina.tracker.client.infrastructure.logging.LeveledLogger;
import fr.lapetina.tracker.client.infrastructure.logging.Slf4jLeveledLogger;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link TrackerTransport} backed by {@code java.net.http.HttpClient}.
 *
 * The configured request timeout is applied to every exchange. Bodies are read
 * into memory in full, tracker payloads being small JSON documents.
 */
public final class JdkTrackerTransport implements TrackerTransport {

    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final LeveledLogger logger;

    public JdkTrackerTransport(HttpClient httpClient, Duration requestTimeout, LeveledLogger logger) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
        this.logger = logger;
    }

    /**
     * Creates a transport with its own HTTP/1.1 client.
     *
     * @param requestTimeout per-request timeout, {@code null} or zero for none
     */
    public JdkTrackerTransport(Duration requestTimeout, LeveledLogger logger) {
        this(newHttpClient(requestTimeout), requestTimeout, logger);
    }

    public JdkTrackerTransport() {
        this(null, new Slf4jLeveledLogger());
    }

    private static HttpClient newHttpClient(Duration requestTimeout) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL);
        if (isPositive(requestTimeout)) {
            builder.connectTimeout(requestTimeout);
        }
        return builder.build();
    }

    @Override
    public CompletableFuture<TrackerHttpResponse> send(TrackerHttpRequest request) {
        HttpRequest httpRequest = toHttpRequest(request);
        Instant startTime = Instant.now();

        logger.debug("performing request", "method", request.method(), "url", request.uri());

        CompletableFuture<HttpResponse<byte[]>> exchange =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray());

        CompletableFuture<TrackerHttpResponse> result = exchange
                .handle((response, ex) -> {
                    long latencyMs = Duration.between(startTime, Instant.now()).toMillis();
                    if (ex != null) {
                        Throwable cause = ex instanceof CompletionException && ex.getCause() != null
                                ? ex.getCause()
                                : ex;
                        logger.error("request failed", "method", request.method(), "url", request.uri(),
                                "error", cause.getClass().getSimpleName() + ": " + cause.getMessage(),
                                "latencyMs", latencyMs);
                        throw new CompletionException(cause);
                    }
                    if (response.statusCode() >= 500) {
                        logger.warn("tracker server error", "method", request.method(), "url", request.uri(),
                                "status", response.statusCode(), "latencyMs", latencyMs);
                    } else {
                        logger.debug("request completed", "method", request.method(), "url", request.uri(),
                                "status", response.statusCode(), "latencyMs", latencyMs);
                    }
                    return new TrackerHttpResponse(response.statusCode(), response.body());
                });

        // Cancelling the dependent future does not reach the exchange on its own.
        result.whenComplete((response, ex) -> {
            if (result.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return result;
    }

    private HttpRequest toHttpRequest(TrackerHttpRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(request.uri())
                .method(request.method(), request.body().length == 0
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofByteArray(request.body()));

        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        if (isPositive(requestTimeout)) {
            builder.timeout(requestTimeout);
        }
        return builder.build();
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isZero() && !duration.isNegative();
    }
}
