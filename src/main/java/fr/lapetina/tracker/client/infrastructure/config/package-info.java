/**
 * YAML configuration loading.
 *
 * <p>{@link fr.lapetina.tracker.client.infrastructure.config.TrackerConfigLoader} reads a document
 * such as the one below into {@link fr.lapetina.tracker.client.infrastructure.config.TrackerProperties},
 * which converts to a {@link fr.lapetina.tracker.client.domain.model.ClientConfig}.
 *
 * <pre>{@code
 * project: my-project
 * projectVersion: "20240101.01"
 * trackerUrl: https://legacy-api.arpa.li
 * username: downloader-1
 * password: secret
 * requestTimeoutMs: 60000
 * }</pre>
 *
 * <p>Validation is deferred to client creation.
 */
package fr.lapetina.tracker.client.infrastructure.config;
