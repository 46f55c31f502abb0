@NullMarked
package io.hivescan.client.http.jdk;

import org.jspecify.annotations.NullMarked;
