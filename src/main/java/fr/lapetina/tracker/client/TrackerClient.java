package fr.lapetina.tracker.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.tracker.client.domain.model.ClientConfig;
import fr.lapetina.tracker.client.domain.model.CompletionRequest;
import fr.lapetina.tracker.client.domain.model.TrackerError;
import fr.lapetina.tracker.client.domain.model.WorkRequest;
import fr.lapetina.tracker.client.domain.model.WorkResponse;
import fr.lapetina.tracker.client.exception.InvalidConfigurationException;
import fr.lapetina.tracker.client.exception.TrackerException;
import fr.lapetina.tracker.client.infrastructure.http.JdkTrackerTransport;
import fr.lapetina.tracker.client.infrastructure.http.TrackerHttpRequest;
import fr.lapetina.tracker.client.infrastructure.http.TrackerHttpResponse;
import fr.lapetina.tracker.client.infrastructure.http.TrackerTransport;
import fr.lapetina.tracker.client.infrastructure.logging.LeveledLogger;
import fr.lapetina.tracker.client.infrastructure.logging.Slf4jLeveledLogger;
import fr.lapetina.tracker.client.infrastructure.metrics.TrackerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Client for the work-distribution tracker.
 *
 * <p>Acquires items with {@link #requestItems(int)} and reports them with
 * {@link #itemsDone(List, Map)}. Every operation has an {@code *Async} form
 * returning a future; cancelling that future cancels the in-flight HTTP call.
 * The blocking forms wait on the same future.
 *
 * <p>Instances hold no mutable state and may be shared between threads.
 *
 * <pre>{@code
 * TrackerClient client = TrackerClient.create(ClientConfig.builder()
 *         .project("my-project")
 *         .projectVersion("20240101.01")
 *         .username("downloader-1")
 *         .requestTimeout(Duration.ofSeconds(30))
 *         .build());
 *
 * try {
 *     List<String> items = client.requestItems(10);
 *     // download...
 *     client.itemsDone(items, bytesByItem);
 * } catch (TrackerException e) {
 *     if (e.is(TrackerError.NO_TASKS_AVAILABLE)) {
 *         // back off
 *     }
 * }
 * }</pre>
 */
public final class TrackerClient {

    private static final Logger log = LoggerFactory.getLogger(TrackerClient.class);

    static final String OPERATION_REQUEST = "request";
    static final String OPERATION_DONE = "done";

    private final ClientConfig config;
    private final TrackerTransport transport;
    private final TrackerRequestFactory requestFactory;
    private final TrackerMetrics metrics;
    private final ObjectMapper objectMapper;

    private TrackerClient(ClientConfig config, TrackerTransport transport, TrackerMetrics metrics) {
        this.config = config;
        this.transport = transport;
        this.requestFactory = new TrackerRequestFactory(config);
        this.metrics = metrics;
        this.objectMapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Creates a client using the JDK transport and SLF4J logging.
     *
     * @throws InvalidConfigurationException if project, project version or username is empty
     */
    public static TrackerClient create(ClientConfig config) {
        return builder(config).build();
    }

    public static Builder builder(ClientConfig config) {
        return new Builder(config);
    }

    /**
     * Returns the normalized configuration this client was built with.
     */
    public ClientConfig getConfig() {
        return config;
    }

    /**
     * Requests up to {@code limit} items.
     *
     * @param limit number of items wanted, at least 1
     * @return items handed out, in tracker order, possibly empty
     * @throws IllegalArgumentException if {@code limit < 1}
     * @throws TrackerException         {@link TrackerError#NO_TASKS_AVAILABLE} on 204 or 404,
     *                                  {@link TrackerError#INVALID_TRACKER_RESPONSE} on other statuses from 300 up
     * @throws IOException              on network failure, timeout or an undecodable body
     */
    public List<String> requestItems(int limit) throws IOException, InterruptedException {
        return await(requestItemsAsync(limit));
    }

    public CompletableFuture<List<String>> requestItemsAsync(int limit) {
        if (limit < 1) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("limit must be greater than 0"));
        }
        String path = limit == 1 ? "request" : "multi=" + limit + "/request";
        Supplier<Object> body = () -> WorkRequest.of(config.username(), config.projectVersion());

        return post(OPERATION_REQUEST, path, body, response -> {
            int status = response.statusCode();
            // 404 is "no work" here, never NO_SUCH_PROJECT
            if (status == 204 || status == 404) {
                throw new TrackerException(TrackerError.NO_TASKS_AVAILABLE);
            }
            if (status >= 300) {
                throw new TrackerException(TrackerError.INVALID_TRACKER_RESPONSE, status);
            }
            // a literal null body decodes to no response at all
            WorkResponse workResponse = objectMapper.readValue(response.body(), WorkResponse.class);
            return workResponse != null ? workResponse.items() : List.of();
        });
    }

    /**
     * Requests a single item.
     *
     * @return the item, or empty if the tracker answered with an empty list
     * @throws TrackerException {@link TrackerError#NO_TASKS_AVAILABLE} when there is no work,
     *                          as for {@link #requestItems(int)}
     */
    public Optional<String> requestItem() throws IOException, InterruptedException {
        return await(requestItemAsync());
    }

    public CompletableFuture<Optional<String>> requestItemAsync() {
        CompletableFuture<List<String>> items = requestItemsAsync(1);
        return linkCancellation(items, items.thenApply(list -> list.stream().findFirst()));
    }

    /**
     * Reports items as done.
     *
     * @param items       items to report; nothing is sent when empty
     * @param bytesByItem bytes transferred per item, {@code null} to omit
     * @throws TrackerException {@link TrackerError#NO_SUCH_PROJECT} on 404,
     *                          {@link TrackerError#INVALID_TRACKER_RESPONSE} on other statuses from 300 up
     * @throws IOException      on network failure or timeout
     */
    public void itemsDone(List<String> items, Map<String, Long> bytesByItem) throws IOException, InterruptedException {
        await(itemsDoneAsync(items, bytesByItem));
    }

    public CompletableFuture<Void> itemsDoneAsync(List<String> items, Map<String, Long> bytesByItem) {
        if (items == null || items.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        Supplier<Object> body = () ->
                new CompletionRequest(config.username(), config.projectVersion(), items, bytesByItem);

        return post(OPERATION_DONE, "done", body, response -> {
            int status = response.statusCode();
            if (status == 404) {
                throw new TrackerException(TrackerError.NO_SUCH_PROJECT);
            }
            if (status >= 300) {
                throw new TrackerException(TrackerError.INVALID_TRACKER_RESPONSE, status);
            }
            return null;
        });
    }

    public void itemDone(String item) throws IOException, InterruptedException {
        await(itemDoneAsync(item));
    }

    public CompletableFuture<Void> itemDoneAsync(String item) {
        return itemsDoneAsync(Collections.singletonList(item), null);
    }

    /**
     * Body is built here so a rejected body fails the returned future like any other error.
     */
    private <T> CompletableFuture<T> post(
            String operation,
            String path,
            Supplier<Object> body,
            ResponseMapper<T> mapper
    ) {
        CompletableFuture<TrackerHttpResponse> exchange;
        TrackerHttpRequest request;
        try {
            request = requestFactory.create("POST", path, objectMapper.writeValueAsBytes(body.get()));
            log.debug("Sending tracker request: operation={}, uri={}", operation, request.uri());
            exchange = transport.send(request);
        } catch (JsonProcessingException | RuntimeException e) {
            metrics.incrementRequestCount(operation, "client_error");
            return CompletableFuture.failedFuture(e);
        }

        Instant startTime = Instant.now();
        CompletableFuture<T> result = exchange.handle((response, ex) -> {
            metrics.recordLatency(operation, Duration.between(startTime, Instant.now()));
            if (ex != null) {
                metrics.incrementRequestCount(operation, "transport_error");
                throw ex instanceof CompletionException ? (CompletionException) ex : new CompletionException(ex);
            }
            try {
                T value = mapper.map(response);
                metrics.incrementRequestCount(operation, "success");
                return value;
            } catch (TrackerException e) {
                metrics.incrementRequestCount(operation, e.getError().name().toLowerCase(Locale.ROOT));
                if (e.is(TrackerError.INVALID_TRACKER_RESPONSE)) {
                    log.warn("Unexpected tracker response: operation={}, uri={}, status={}",
                            operation, request.uri(), response.statusCode());
                } else {
                    log.debug("Tracker signalled {}: operation={}, status={}",
                            e.getError(), operation, response.statusCode());
                }
                throw e;
            } catch (IOException e) {
                metrics.incrementRequestCount(operation, "decode_error");
                log.warn("Failed to decode tracker response: operation={}, uri={}, error={}",
                        operation, request.uri(), e.getMessage());
                throw new CompletionException(e);
            }
        });
        return linkCancellation(exchange, result);
    }

    /**
     * Cancels {@code upstream} when {@code downstream} is cancelled.
     */
    private static <T, U> CompletableFuture<U> linkCancellation(
            CompletableFuture<T> upstream,
            CompletableFuture<U> downstream
    ) {
        downstream.whenComplete((value, ex) -> {
            if (downstream.isCancelled()) {
                upstream.cancel(true);
            }
        });
        return downstream;
    }

    private static <T> T await(CompletableFuture<T> future) throws IOException, InterruptedException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IOException(cause);
        }
    }

    @FunctionalInterface
    private interface ResponseMapper<T> {
        T map(TrackerHttpResponse response) throws IOException;
    }

    public static final class Builder {
        private final ClientConfig config;
        private TrackerTransport transport;
        private LeveledLogger logger;
        private TrackerMetrics metrics;

        private Builder(ClientConfig config) {
            this.config = config;
        }

        /**
         * Transport to use instead of the JDK one. The configured timeout is not applied to it.
         */
        public Builder transport(TrackerTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Log sink for the default transport.
         */
        public Builder logger(LeveledLogger logger) {
            this.logger = logger;
            return this;
        }

        public Builder metrics(TrackerMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Validates the configuration and creates the client. No network call is made.
         *
         * @throws InvalidConfigurationException listing every empty required field
         */
        public TrackerClient build() {
            ClientConfig normalized = config.normalized();
            TrackerTransport effectiveTransport = transport != null
                    ? transport
                    : new JdkTrackerTransport(normalized.requestTimeout(),
                            logger != null ? logger : new Slf4jLeveledLogger());

            log.info("Tracker client created: trackerUrl={}, project={}, version={}, username={}, authenticated={}",
                    normalized.trackerUrl(), normalized.project(), normalized.projectVersion(),
                    normalized.username(), normalized.hasPassword());

            return new TrackerClient(
                    normalized,
                    effectiveTransport,
                    metrics != null ? metrics : TrackerMetrics.inMemory()
            );
        }
    }
}
