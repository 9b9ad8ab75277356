package fr.lapetina.tracker.client;

import fr.lapetina.tracker.client.domain.model.ClientConfig;
import fr.lapetina.tracker.client.infrastructure.http.TrackerHttpRequest;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds authenticated tracker requests for a normalized configuration.
 * Shared by every call so all of them carry the same headers.
 */
final class TrackerRequestFactory {

    static final String CLIENT_IDENTIFIER = "java-trackerclient";

    static final String HEADER_PROJECT = "ateam-tracker-project";
    static final String HEADER_USER = "ateam-tracker-user";
    static final String HEADER_VERSION = "ateam-tracker-version";

    private final ClientConfig config;
    private final Map<String, String> headers;

    TrackerRequestFactory(ClientConfig config) {
        this.config = config;
        this.headers = buildHeaders(config);
    }

    private static Map<String, String> buildHeaders(ClientConfig config) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("content-type", "application/json");
        headers.put("user-agent", CLIENT_IDENTIFIER + " " + config.project() + "/" + config.projectVersion());
        headers.put(HEADER_PROJECT, config.project());
        headers.put(HEADER_USER, config.username());
        headers.put(HEADER_VERSION, config.projectVersion());
        if (config.hasPassword()) {
            String credentials = config.username() + ":" + config.password();
            headers.put("authorization", "Basic "
                    + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
        }
        return headers;
    }

    /**
     * Request to {@code <trackerUrl>/<project>/<path>}.
     */
    TrackerHttpRequest create(String method, String path, byte[] body) {
        URI uri = URI.create(config.trackerUrl() + "/" + config.project() + "/" + path);
        return new TrackerHttpRequest(method, uri, headers, body);
    }
}
