// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.error;

/**
 * Thrown when caller-supplied input or setup is invalid: a malformed endpoint,
 * key or hex string, a signer that does not match the sender, an unexpected
 * chain id or a missing contract artifact.
 */
public final class ConfigurationException extends JasmineException {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
