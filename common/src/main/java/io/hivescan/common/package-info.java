@NullMarked
package io.hivescan.common;

import org.jspecify.annotations.NullMarked;
