///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * A class with utility methods for validating arguments.
 */
abstract class ArgumentUtil {

    // private constructor to prevent anyone from instantiating the class.
    private ArgumentUtil() {
    }

    /**
     * Throws an exception if {@code argument} is {@code null}.
     *
     * @param argument
     *     The argument to check.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null}.
     */
    static void checkNotNull(Object argument, String argumentName) {
        if (argument == null) {
            throw new NullPointerException(argumentName + " must not be null");
        }
    }

    /**
     * Throws an exception if {@code argument} is negative (less than zero).
     *
     * @param argument
     *     The argument to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is negative
     */
    static void checkNotNegative(int argument, String argumentName) {
        assert argumentName != null : "argumentName must not be null";

        if (argument < 0) {
            throw new IllegalArgumentException(argumentName + " must not be negative");
        }
    }

    /**
     * Throws an exception if {@code argument} is not positive (less than one).
     *
     * @param argument
     *     The argument to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is zero or negative
     */
    static void checkPositive(int argument, String argumentName) {
        assert argumentName != null : "argumentName must not be null";

        if (argument < 1) {
            throw new IllegalArgumentException(argumentName + " must be positive");
        }
    }

    /**
     * Throws an exception if {@code argument} is not a string that can be used as a FITS keyword.
     * <p>
     * A keyword is at most eight characters and may contain only the upper-case letters A-Z, the digits 0-9, the
     * hyphen, and the underscore.
     * </p>
     *
     * @param argument
     *     The string to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code argument} is longer than eight characters or contains a character that is not permitted.
     */
    static void checkKeyword(String argument, String argumentName) {
        checkNotNull(argument, argumentName);
        if (KeywordRecord.KEYWORD_LENGTH < argument.length()) {
            throw new IllegalArgumentException(
                argumentName + " must not be longer than " + KeywordRecord.KEYWORD_LENGTH + " characters");
        }
        if (!argument.matches("^[A-Z0-9_-]*$")) {
            throw new IllegalArgumentException(argumentName + " must only contain A-Z, 0-9, '-', and '_'");
        }
    }
}
