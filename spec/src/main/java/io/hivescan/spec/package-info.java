/**
 * Data model and error taxonomy of the Honeycomb API as seen by the hivescan client.
 *
 * <p>The records in this package are bound with Jackson and ignore properties they do not
 * declare, so additions on the server side never break decoding. Fields the API may omit
 * are marked {@link org.jspecify.annotations.Nullable}.
 *
 * <h2>Errors</h2>
 * All client failures extend {@link io.hivescan.spec.HivescanClientException}:
 * <ul>
 *   <li>{@link io.hivescan.spec.HivescanTooManyRetriesException} - still rate limited after the retry budget</li>
 *   <li>{@link io.hivescan.spec.HivescanDecodeException} - body could not be decoded, never retried</li>
 *   <li>{@link io.hivescan.spec.HivescanHttpException} - any other non-success status</li>
 *   <li>{@link io.hivescan.spec.HivescanTransportException} - network or connection failure</li>
 *   <li>{@link io.hivescan.spec.HivescanConfigurationException} - missing credential or invalid setting</li>
 * </ul>
 */
@NullMarked
package io.hivescan.spec;

import org.jspecify.annotations.NullMarked;
