// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.error;

/**
 * Base runtime exception for all Jasmine SDK failures.
 *
 * <p>
 * This sealed class is the root of the SDK's exception hierarchy, so every
 * SDK error can be caught with a single clause while the concrete subtype
 * tells the caller what went wrong.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * JasmineException
 * ├── {@link ConfigurationException} - invalid caller input or setup
 * ├── {@link AbiEncodingException} - ABI encoding failures
 * ├── {@link AbiDecodingException} - ABI decoding failures
 * ├── {@link TransportException} - connectivity and malformed responses
 * │   └── {@link RpcException} - the node returned a JSON-RPC error
 * └── {@link TxnException} - transaction lifecycle failures, tagged with a {@link TransactionStage}
 *     ├── {@link EstimationException}
 *     ├── {@link PricingException}
 *     ├── {@link NonceException}
 *     ├── {@link SigningException}
 *     ├── {@link SubmissionRejectedException}
 *     ├── {@link SubmissionFailedException}
 *     └── {@link ConfirmationFailedException}
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     token.transfer(to, amount, account).join();
 * } catch (CompletionException e) {
 *     if (e.getCause() instanceof SubmissionRejectedException rejected) {
 *         // node refused the transaction
 *     }
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class JasmineException extends RuntimeException
        permits ConfigurationException,
        AbiEncodingException,
        AbiDecodingException,
        TransportException,
        TxnException {

    public JasmineException(final String message) {
        super(message);
    }

    public JasmineException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
