package io.hivescan.util;

import org.jspecify.annotations.Nullable;

/**
 * Parameter validation helpers.
 */
public final class Assert {

    private Assert() {
    }

    /**
     * Checks that the given parameter is not {@code null}.
     *
     * @param name the parameter name, used in the exception message
     * @param value the parameter value
     * @param <T> the parameter type
     * @return the value, for chaining
     * @throws IllegalArgumentException if the value is {@code null}
     */
    public static <T> T checkNotNullParam(String name, @Nullable T value) throws IllegalArgumentException {
        if (value == null) {
            throw new IllegalArgumentException("Parameter '" + name + "' may not be null");
        }
        return value;
    }

    /**
     * Checks that the given string parameter is neither {@code null} nor blank.
     *
     * @param name the parameter name, used in the exception message
     * @param value the parameter value
     * @return the value, for chaining
     * @throws IllegalArgumentException if the value is {@code null} or blank
     */
    public static String checkNotBlankParam(String name, @Nullable String value) throws IllegalArgumentException {
        checkNotNullParam(name, value);
        if (value.isBlank()) {
            throw new IllegalArgumentException("Parameter '" + name + "' may not be blank");
        }
        return value;
    }

    /**
     * Checks that the given int parameter is at least {@code min}.
     *
     * @param name the parameter name, used in the exception message
     * @param value the parameter value
     * @param min the smallest accepted value
     * @return the value, for chaining
     * @throws IllegalArgumentException if the value is smaller than {@code min}
     */
    public static int checkMinimumParam(String name, int min, int value) throws IllegalArgumentException {
        if (value < min) {
            throw new IllegalArgumentException("Parameter '" + name + "' must be at least " + min + " but was " + value);
        }
        return value;
    }
}
