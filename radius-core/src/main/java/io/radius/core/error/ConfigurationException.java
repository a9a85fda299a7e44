// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.error;

/**
 * Thrown when an object cannot be constructed from the supplied input: a bad
 * private key, an unreachable remote signer, malformed ABI JSON or an invalid
 * builder setting. Retrying with the same input will fail the same way.
 */
public final class ConfigurationException extends RadiusException {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
