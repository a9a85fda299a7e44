// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.error;

/**
 * Base runtime exception for all Radius SDK failures.
 *
 * <p>The hierarchy is sealed so a single {@code catch (RadiusException e)} covers
 * every library failure while callers can still switch on the concrete type.
 *
 * <pre>
 * RadiusException
 * ├── {@link ConfigurationException} - invalid construction input
 * ├── {@link RpcException} - node or transport reported an error
 * ├── {@link AbiEncodingException} - caller misuse of the ABI codec
 * │   ├── {@link UnknownMethodException}
 * │   └── {@link MissingConstructorException}
 * ├── {@link AbiDecodingException} - return data does not match the ABI
 * └── {@link TxnException} - transaction lifecycle failures
 *     ├── {@link IncompleteTransactionException}
 *     ├── {@link TransactionRevertedException}
 *     ├── {@link TransactionTimeoutException}
 *     └── {@link DeploymentFailedException}
 * </pre>
 *
 * <p>Asynchronous operations complete exceptionally with one of these types as
 * the direct cause of the {@link java.util.concurrent.CompletionException}.
 */
public sealed class RadiusException extends RuntimeException
        permits ConfigurationException,
        RpcException,
        AbiEncodingException,
        AbiDecodingException,
        TxnException {

    public RadiusException(final String message) {
        super(message);
    }

    public RadiusException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
