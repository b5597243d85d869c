// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.crypto;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import javax.security.auth.Destroyable;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

import sh.jasmine.core.types.Address;
import sh.jasmine.primitives.Hex;

/**
 * secp256k1 private key.
 *
 * <p>
 * Supports:
 * <ul>
 * <li>generation from {@link SecureRandom} and loading from hex</li>
 * <li>address derivation from the public key</li>
 * <li>deterministic ECDSA signing (RFC 6979) with low-s normalization</li>
 * <li>sender recovery from a signature</li>
 * </ul>
 *
 * <pre>{@code
 * PrivateKey key = PrivateKey.fromHex("0x4c0883a6...");
 * Signature sig = key.sign(Keccak256.hash(payload));
 * assert PrivateKey.recoverAddress(Keccak256.hash(payload), sig).equals(key.toAddress());
 * }</pre>
 *
 * <p>
 * The key material is never rendered by {@link #toString()}. Calling
 * {@link #destroy()} drops the internal references; later use throws
 * {@link IllegalStateException}.
 *
 * @since 0.1.0
 */
public final class PrivateKey implements Destroyable {

    private static final int PRIVATE_KEY_SIZE = 32;
    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    private static final ECDomainParameters CURVE = new ECDomainParameters(
            CURVE_PARAMS.getCurve(),
            CURVE_PARAMS.getG(),
            CURVE_PARAMS.getN(),
            CURVE_PARAMS.getH());
    private static final BigInteger HALF_CURVE_ORDER = CURVE.getN().shiftRight(1);
    private static final FixedPointCombMultiplier MULTIPLIER = new FixedPointCombMultiplier();
    private static final SecureRandom RANDOM = new SecureRandom();

    private volatile BigInteger privateKeyValue;
    private volatile ECPoint publicKey;
    private volatile boolean destroyed;

    private PrivateKey(final byte[] keyBytes) {
        if (keyBytes.length != PRIVATE_KEY_SIZE) {
            throw new IllegalArgumentException(
                    "Private key must be " + PRIVATE_KEY_SIZE + " bytes, got " + keyBytes.length);
        }
        try {
            final BigInteger value = new BigInteger(1, keyBytes);
            if (value.signum() == 0) {
                throw new IllegalArgumentException("Private key cannot be zero");
            }
            if (value.compareTo(CURVE.getN()) >= 0) {
                throw new IllegalArgumentException("Private key must be less than curve order");
            }
            this.privateKeyValue = value;
            this.publicKey = MULTIPLIER.multiply(CURVE.getG(), value).normalize();
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    /**
     * Generates a fresh key from a cryptographically secure random source.
     *
     * @return a new private key
     */
    public static PrivateKey generate() {
        final byte[] keyBytes = new byte[PRIVATE_KEY_SIZE];
        while (true) {
            RANDOM.nextBytes(keyBytes);
            final BigInteger candidate = new BigInteger(1, keyBytes);
            if (candidate.signum() > 0 && candidate.compareTo(CURVE.getN()) < 0) {
                return new PrivateKey(keyBytes);
            }
        }
    }

    /**
     * Creates a private key from a hex string.
     *
     * @param hexString hex-encoded private key, with or without {@code 0x}
     * @return private key instance
     * @throws IllegalArgumentException if the hex is malformed or the key is out of range
     */
    public static PrivateKey fromHex(final String hexString) {
        Objects.requireNonNull(hexString, "hex string cannot be null");
        return new PrivateKey(Hex.decode(hexString.trim()));
    }

    /**
     * Creates a private key from raw bytes. The array is zeroed afterwards.
     *
     * @param keyBytes 32-byte private key
     * @return private key instance
     */
    public static PrivateKey fromBytes(final byte[] keyBytes) {
        Objects.requireNonNull(keyBytes, "key bytes cannot be null");
        return new PrivateKey(keyBytes);
    }

    /**
     * Derives the Ethereum address: the last 20 bytes of the Keccak-256 hash
     * of the uncompressed public key without its {@code 0x04} prefix.
     *
     * @return the address controlled by this key
     */
    public Address toAddress() {
        final ECPoint pubKey;
        synchronized (this) {
            checkNotDestroyed();
            pubKey = publicKey;
        }
        return addressOf(pubKey);
    }

    /**
     * Returns the 32-byte big-endian key. Callers own the returned array.
     *
     * @return the raw key bytes
     */
    public byte[] toBytes() {
        final BigInteger key;
        synchronized (this) {
            checkNotDestroyed();
            key = privateKeyValue;
        }
        return toBytes32(key);
    }

    /**
     * Signs a 32-byte digest with deterministic ECDSA (RFC 6979).
     *
     * @param messageHash 32-byte digest
     * @return signature with {@code v} set to the recovery id (0 or 1)
     */
    public Signature sign(final byte[] messageHash) {
        Objects.requireNonNull(messageHash, "message hash cannot be null");
        if (messageHash.length != 32) {
            throw new IllegalArgumentException("Message hash must be 32 bytes, got " + messageHash.length);
        }
        final BigInteger d;
        synchronized (this) {
            checkNotDestroyed();
            d = privateKeyValue;
        }

        final BigInteger n = CURVE.getN();
        final HMacDSAKCalculator kCalculator = new HMacDSAKCalculator(new SHA256Digest());
        kCalculator.init(n, d, messageHash);
        final BigInteger z = new BigInteger(1, messageHash);

        while (true) {
            final BigInteger k = kCalculator.nextK();
            final ECPoint p = MULTIPLIER.multiply(CURVE.getG(), k).normalize();
            final BigInteger r = p.getAffineXCoord().toBigInteger().mod(n);
            if (r.signum() == 0) {
                continue;
            }
            BigInteger s = k.modInverse(n).multiply(z.add(r.multiply(d))).mod(n);
            if (s.signum() == 0) {
                continue;
            }
            int recoveryId = p.getAffineYCoord().toBigInteger().testBit(0) ? 1 : 0;
            // EIP-2: s must be in the lower half; flipping s flips R's y-parity
            if (s.compareTo(HALF_CURVE_ORDER) > 0) {
                s = n.subtract(s);
                recoveryId ^= 1;
            }
            return new Signature(toBytes32(r), toBytes32(s), recoveryId);
        }
    }

    /**
     * Recovers the signer's address from a digest and signature.
     *
     * @param messageHash 32-byte digest that was signed
     * @param signature   the signature, with any {@code v} encoding
     * @return the recovered address
     * @throws IllegalArgumentException if no public key can be recovered
     */
    public static Address recoverAddress(final byte[] messageHash, final Signature signature) {
        Objects.requireNonNull(messageHash, "message hash cannot be null");
        Objects.requireNonNull(signature, "signature cannot be null");
        if (messageHash.length != 32) {
            throw new IllegalArgumentException("Message hash must be 32 bytes");
        }

        final BigInteger n = CURVE.getN();
        final BigInteger r = signature.rAsBigInteger();
        final BigInteger s = signature.sAsBigInteger();
        if (r.signum() <= 0 || s.signum() <= 0 || r.compareTo(n) >= 0 || s.compareTo(n) >= 0) {
            throw new IllegalArgumentException("Signature components out of range");
        }

        final byte[] compressed = new byte[33];
        compressed[0] = (byte) (signature.recoveryId() == 1 ? 0x03 : 0x02);
        System.arraycopy(toBytes32(r), 0, compressed, 1, 32);
        final ECPoint bigR;
        try {
            bigR = CURVE.getCurve().decodePoint(compressed);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Failed to recover public key from signature", e);
        }

        // Q = r^-1 (sR - eG)
        final BigInteger rInv = r.modInverse(n);
        final BigInteger e = new BigInteger(1, messageHash);
        final ECPoint q = bigR.multiply(rInv.multiply(s).mod(n))
                .subtract(CURVE.getG().multiply(rInv.multiply(e).mod(n)))
                .normalize();
        if (q.isInfinity()) {
            throw new IllegalArgumentException("Failed to recover public key from signature");
        }
        return addressOf(q);
    }

    @Override
    public void destroy() {
        synchronized (this) {
            destroyed = true;
            privateKeyValue = null;
            publicKey = null;
        }
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public String toString() {
        try {
            return "PrivateKey[address=" + toAddress() + "]";
        } catch (IllegalStateException e) {
            return "PrivateKey[destroyed]";
        }
    }

    private void checkNotDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("PrivateKey has been destroyed");
        }
    }

    private static Address addressOf(final ECPoint pubKey) {
        final byte[] encoded = pubKey.getEncoded(false);
        final byte[] hash = Keccak256.hash(Arrays.copyOfRange(encoded, 1, encoded.length));
        return Address.fromBytes(Arrays.copyOfRange(hash, 12, 32));
    }

    private static byte[] toBytes32(final BigInteger value) {
        final byte[] bytes = value.toByteArray();
        if (bytes.length == 32) {
            return bytes;
        }
        final byte[] result = new byte[32];
        if (bytes.length < 32) {
            System.arraycopy(bytes, 0, result, 32 - bytes.length, bytes.length);
        } else {
            System.arraycopy(bytes, bytes.length - 32, result, 0, 32);
        }
        return result;
    }
}
