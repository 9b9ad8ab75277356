/**
 * Tracker Client - Java client for the work-distribution tracker used by archival downloaders.
 *
 * <p>The client acquires items from the tracker and reports them back once downloaded,
 * mapping tracker status codes onto {@link fr.lapetina.tracker.client.domain.model.TrackerError}.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.tracker.client.TrackerClient} - Main entry point, blocking and async calls</li>
 *   <li>{@link fr.lapetina.tracker.client.domain.model.ClientConfig} - Identity and endpoint settings</li>
 *   <li>{@link fr.lapetina.tracker.client.infrastructure.http.TrackerTransport} - Pluggable HTTP layer</li>
 *   <li>{@link fr.lapetina.tracker.client.infrastructure.config.TrackerConfigLoader} - YAML configuration</li>
 * </ul>
 *
 * <h2>Wire Protocol</h2>
 * <ul>
 *   <li>{@code POST <trackerUrl>/<project>/request} - acquire one item</li>
 *   <li>{@code POST <trackerUrl>/<project>/multi=<n>/request} - acquire up to n items</li>
 *   <li>{@code POST <trackerUrl>/<project>/done} - report completed items</li>
 * </ul>
 *
 * @see fr.lapetina.tracker.client.TrackerClient
 */
package fr.lapetina.tracker.client;
