// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.error;

/**
 * Thrown when return data or event payloads cannot be decoded against the ABI.
 */
public final class AbiDecodingException extends RadiusException {

    public AbiDecodingException(final String message) {
        super(message);
    }

    public AbiDecodingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
