/**
 * Wire and configuration types of the tracker protocol.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.tracker.client.domain.model.ClientConfig} - Client identity and endpoint settings</li>
 *   <li>{@link fr.lapetina.tracker.client.domain.model.WorkRequest} - Acquire request body</li>
 *   <li>{@link fr.lapetina.tracker.client.domain.model.WorkResponse} - Acquire response body</li>
 *   <li>{@link fr.lapetina.tracker.client.domain.model.CompletionRequest} - Completion report body</li>
 *   <li>{@link fr.lapetina.tracker.client.domain.model.TrackerError} - Status-driven tracker outcomes</li>
 * </ul>
 *
 * <p>All types are immutable records or enums and safe to share between threads.
 */
package fr.lapetina.tracker.client.domain.model;
