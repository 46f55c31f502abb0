@NullMarked
package io.hivescan.util;

import org.jspecify.annotations.NullMarked;
