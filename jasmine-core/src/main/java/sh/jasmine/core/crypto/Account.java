// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.crypto;

import java.util.Objects;

import sh.jasmine.core.error.ConfigurationException;
import sh.jasmine.core.model.SignedTransaction;
import sh.jasmine.core.model.TransactionIntent;
import sh.jasmine.core.tx.LegacyTransaction;
import sh.jasmine.core.types.Address;
import sh.jasmine.core.types.Hash;
import sh.jasmine.primitives.Hex;

/**
 * A locally held key pair and the single address it controls.
 *
 * <p>
 * Accounts are not persisted. {@link #toString()} shows the address only.
 *
 * <pre>{@code
 * Account alice = Account.create();
 * Account bob = Account.fromPrivateKey("0x4c0883a69102937d6231471b5dbb6204fe512961708279f15a8f7a8b1b4f3d2a");
 * }</pre>
 */
public final class Account implements TransactionSigner {

    private final PrivateKey privateKey;
    private final Address address;

    private Account(final PrivateKey privateKey) {
        this.privateKey = Objects.requireNonNull(privateKey, "privateKey");
        this.address = privateKey.toAddress();
    }

    /**
     * Creates an account with a freshly generated key.
     *
     * @return the new account
     */
    public static Account create() {
        return new Account(PrivateKey.generate());
    }

    /**
     * Restores an account from a hex-encoded private key.
     *
     * @param privateKeyHex 32-byte key as hex, with or without {@code 0x}
     * @return the account
     * @throws ConfigurationException if the key is malformed or out of range
     */
    public static Account fromPrivateKey(final String privateKeyHex) {
        if (privateKeyHex == null) {
            throw new ConfigurationException("private key must not be null");
        }
        final String trimmed = privateKeyHex.trim();
        // checked up front so that no exception message echoes the key text
        if (!Hex.isValid(trimmed) || Hex.cleanPrefix(trimmed).length() != 64) {
            throw new ConfigurationException("private key must be 32 bytes of hex");
        }
        try {
            return new Account(PrivateKey.fromHex(trimmed));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("invalid private key: " + e.getMessage(), e);
        }
    }

    public static Account fromPrivateKey(final PrivateKey privateKey) {
        return new Account(privateKey);
    }

    @Override
    public Address address() {
        return address;
    }

    /**
     * Returns the key as {@code 0x}-prefixed hex, for export by the caller.
     *
     * @return the private key hex
     */
    public String privateKeyHex() {
        return Hex.encode(privateKey.toBytes());
    }

    @Override
    public SignedTransaction sign(final TransactionIntent intent, final long chainId) {
        Objects.requireNonNull(intent, "intent");
        if (!address.equals(intent.from())) {
            throw new IllegalArgumentException("intent sender " + intent.from() + " is not " + address);
        }
        final LegacyTransaction tx = intent.toLegacyTransaction();
        final byte[] digest = Keccak256.hash(tx.encodeForSigning(chainId));
        final Signature signature = privateKey.sign(digest).withEip155(chainId);
        final byte[] envelope = tx.encodeAsEnvelope(signature);
        return new SignedTransaction(envelope, Hash.fromBytes(Keccak256.hash(envelope)));
    }

    @Override
    public String toString() {
        return "Account[address=" + address + "]";
    }
}
