// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.error;

/**
 * Thrown when arguments cannot be encoded for the requested ABI entry, for
 * example a wrong argument count or a value of the wrong Java type.
 */
public sealed class AbiEncodingException extends RadiusException
        permits UnknownMethodException, MissingConstructorException {

    public AbiEncodingException(final String message) {
        super(message);
    }

    public AbiEncodingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
