package fr.lapetina.tracker.client.infrastructure.config;

import fr.lapetina.tracker.client.domain.model.ClientConfig;

import java.time.Duration;

/**
 * Tracker client settings as read from YAML.
 */
public class TrackerProperties {

    private String project;
    private String projectVersion;
    private String trackerUrl = ClientConfig.DEFAULT_TRACKER_URL;
    private String username;
    private String password;
    private long requestTimeoutMs = 60000;

    // Getters and Setters
    public String getProject() { return project; }
    public void setProject(String project) { this.project = project; }

    public String getProjectVersion() { return projectVersion; }
    public void setProjectVersion(String projectVersion) { this.projectVersion = projectVersion; }

    public String getTrackerUrl() { return trackerUrl; }
    public void setTrackerUrl(String trackerUrl) { this.trackerUrl = trackerUrl; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public long getRequestTimeoutMs() { return requestTimeoutMs; }
    public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

    /**
     * Converts to a client configuration. A timeout of zero or less disables it.
     */
    public ClientConfig toClientConfig() {
        return ClientConfig.builder()
                .project(project)
                .projectVersion(projectVersion)
                .trackerUrl(trackerUrl)
                .username(username)
                .password(password)
                .requestTimeout(requestTimeoutMs > 0 ? Duration.ofMillis(requestTimeoutMs) : null)
                .build();
    }
}
