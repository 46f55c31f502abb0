/**
 * Connecting to the Honeycomb API, see {@link io.hivescan.Hivescan#connect(String...)}.
 */
@NullMarked
package io.hivescan;

import org.jspecify.annotations.NullMarked;
