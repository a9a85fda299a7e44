// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.error;

/**
 * Thrown when a function name is not present in the ABI, on encode or decode.
 */
public final class UnknownMethodException extends AbiEncodingException {

    private final String method;

    public UnknownMethodException(final String method) {
        super("Unknown function '" + method + "'");
        this.method = method;
    }

    public String method() {
        return method;
    }
}
