// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.error;

public final class MissingConstructorException extends AbiEncodingException {

    public MissingConstructorException(final int argumentCount) {
        super("Constructor not defined in ABI, but " + argumentCount + " arguments provided");
    }
}
