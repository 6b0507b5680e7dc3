/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.util;

/**
 * String-related utility methods.
 */
public final class Strings {

    /**
     * Check if the string is blank or null.
     *
     * @param str the string to check
     * @return {@code true} if the string is blank or null
     */
    public static boolean isNullOrBlank(String str) {
        return str == null || str.trim().isEmpty();
    }

    /**
     * Returns the given value if it isn't blank, or the default value otherwise.
     *
     * @param value the value to check
     * @param defaultValue the value returned when {@code value} is null or blank
     * @return {@code value} or {@code defaultValue}
     */
    public static String defaultIfBlank(String value, String defaultValue) {
        return isNullOrBlank(value) ? defaultValue : value;
    }

    /**
     * Abbreviate the supplied string to at most {@code maxLength} characters, appending {@code ...} when it was cut.
     *
     * @param str the string; may be null
     * @param maxLength the maximum length of the result, must be greater than 3
     * @return the abbreviated string, or null if {@code str} is null
     */
    public static String abbreviate(String str, int maxLength) {
        if (str == null || str.length() <= maxLength) {
            return str;
        }
        return str.substring(0, maxLength - 3) + "...";
    }

    private Strings() {
    }
}
