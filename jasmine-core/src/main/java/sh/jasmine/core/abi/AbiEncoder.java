// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.abi;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import sh.jasmine.core.crypto.Keccak256;
import sh.jasmine.core.types.HexData;

/**
 * Encodes function calls and argument tuples in the Solidity ABI format.
 *
 * <pre>{@code
 * HexData calldata = AbiEncoder.encodeFunction(
 *         "transfer(address,uint256)",
 *         List.of(new AddressType(recipient), UInt.uint256(amount)));
 * }</pre>
 */
public final class AbiEncoder {

    private static final int WORD = 32;

    private AbiEncoder() {
    }

    /**
     * Returns the first four bytes of the Keccak-256 hash of a canonical signature.
     *
     * @param signature e.g. {@code balanceOf(address)}
     * @return the 4-byte selector
     */
    public static byte[] selector(final String signature) {
        Objects.requireNonNull(signature, "signature");
        return Arrays.copyOf(Keccak256.hash(signature.getBytes(StandardCharsets.UTF_8)), 4);
    }

    public static HexData encodeFunction(final String signature, final List<AbiType> args) {
        return HexData.fromBytes(concat(selector(signature), encode(args)));
    }

    /**
     * Encodes {@code args} as a tuple: static heads in order, then the tails of
     * the dynamic values, with each dynamic head holding its tail offset.
     *
     * @param args the arguments
     * @return the encoded tuple
     */
    public static byte[] encode(final List<AbiType> args) {
        Objects.requireNonNull(args, "args");
        final int headSize = args.size() * WORD;
        final List<byte[]> heads = new ArrayList<>(args.size());
        final List<byte[]> tails = new ArrayList<>();
        int tailOffset = headSize;

        for (AbiType arg : args) {
            Objects.requireNonNull(arg, "args cannot contain null values");
            if (arg.isDynamic()) {
                final byte[] tail = arg.encode();
                heads.add(word(BigInteger.valueOf(tailOffset)));
                tails.add(tail);
                tailOffset += tail.length;
            } else {
                heads.add(arg.encode());
            }
        }

        final byte[] result = new byte[tailOffset];
        int offset = 0;
        for (byte[] head : heads) {
            System.arraycopy(head, 0, result, offset, head.length);
            offset += head.length;
        }
        for (byte[] tail : tails) {
            System.arraycopy(tail, 0, result, offset, tail.length);
            offset += tail.length;
        }
        return result;
    }

    static byte[] word(final BigInteger value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Unsigned value cannot be negative");
        }
        byte[] bytes = value.toByteArray();
        if (bytes.length > 1 && bytes[0] == 0) {
            bytes = Arrays.copyOfRange(bytes, 1, bytes.length);
        }
        if (bytes.length > WORD) {
            throw new IllegalArgumentException("Value too large for uint256");
        }
        final byte[] result = new byte[WORD];
        System.arraycopy(bytes, 0, result, WORD - bytes.length, bytes.length);
        return result;
    }

    static byte[] padRight(final byte[] data) {
        final int padding = (WORD - (data.length % WORD)) % WORD;
        return padding == 0 ? data : Arrays.copyOf(data, data.length + padding);
    }

    static byte[] concat(final byte[] a, final byte[] b) {
        final byte[] result = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, result, a.length, b.length);
        return result;
    }
}
