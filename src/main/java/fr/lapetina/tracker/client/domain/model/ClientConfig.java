package fr.lapetina.tracker.client.domain.model;

import fr.lapetina.tracker.client.exception.InvalidConfigurationException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Identity and endpoint settings for a tracker client.
 *
 * Values are taken as supplied; {@link #normalized()} trims, defaults and
 * validates them when the client is created.
 *
 * @param project        tracker project name
 * @param projectVersion downloader version reported to the tracker
 * @param trackerUrl     tracker base URL, {@link #DEFAULT_TRACKER_URL} when empty
 * @param username       downloader name, also used for basic authentication
 * @param password       optional password; basic authentication is only sent when non-empty
 * @param requestTimeout per-request timeout, {@code null} or zero for none
 */
public record ClientConfig(
        String project,
        String projectVersion,
        String trackerUrl,
        String username,
        String password,
        Duration requestTimeout
) {
    public static final String DEFAULT_TRACKER_URL = "https://legacy-api.arpa.li";

    /**
     * Returns a trimmed copy with the default tracker URL applied and a single
     * trailing slash removed.
     *
     * @throws InvalidConfigurationException listing every required field that is empty
     */
    public ClientConfig normalized() {
        String url = trackerUrl == null || trackerUrl.isBlank() ? DEFAULT_TRACKER_URL : trackerUrl;
        if (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }

        String trimmedProject = trim(project);
        String trimmedVersion = trim(projectVersion);
        String trimmedUsername = trim(username);

        List<String> violations = new ArrayList<>();
        if (trimmedProject.isEmpty()) {
            violations.add("option must not be empty: project");
        }
        if (trimmedVersion.isEmpty()) {
            violations.add("option must not be empty: projectVersion");
        }
        if (trimmedUsername.isEmpty()) {
            violations.add("option must not be empty: username");
        }
        if (!violations.isEmpty()) {
            throw new InvalidConfigurationException(violations);
        }

        return new ClientConfig(trimmedProject, trimmedVersion, url, trimmedUsername, password, requestTimeout);
    }

    public boolean hasPassword() {
        return password != null && !password.isEmpty();
    }

    public boolean hasRequestTimeout() {
        return requestTimeout != null && !requestTimeout.isZero() && !requestTimeout.isNegative();
    }

    private static String trim(String value) {
        return value == null ? "" : value.strip();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String project;
        private String projectVersion;
        private String trackerUrl;
        private String username;
        private String password;
        private Duration requestTimeout;

        public Builder project(String project) {
            this.project = project;
            return this;
        }

        public Builder projectVersion(String projectVersion) {
            this.projectVersion = projectVersion;
            return this;
        }

        public Builder trackerUrl(String trackerUrl) {
            this.trackerUrl = trackerUrl;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(project, projectVersion, trackerUrl, username, password, requestTimeout);
        }
    }
}
