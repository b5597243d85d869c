// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.rpc.internal;

import java.lang.reflect.Array;
import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import com.fasterxml.jackson.databind.ObjectMapper;

import sh.jasmine.core.error.JasmineException;
import sh.jasmine.core.error.TransportException;

/**
 * Shared helpers for hex quantities, JSON-RPC error data and future
 * unwrapping. Not part of the public API.
 */
public final class RpcUtils {

    /** Shared mapper; thread-safe once configured. */
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private RpcUtils() {
    }

    /**
     * Flattens the {@code data} member of a JSON-RPC error. Nodes nest revert
     * data in objects or arrays ({@code {data: {data: "0x..."}}}); the first
     * string found is returned.
     *
     * @param dataValue the raw {@code data} member
     * @return the extracted string, or {@code null} when absent
     */
    public static String extractErrorData(final Object dataValue) {
        if (dataValue == null) {
            return null;
        }
        if (dataValue instanceof String s) {
            return s;
        }
        if (dataValue instanceof Map<?, ?> map) {
            return extractFromIterable(map.values(), dataValue);
        }
        if (dataValue.getClass().isArray()) {
            final int length = Array.getLength(dataValue);
            for (int i = 0; i < length; i++) {
                final String extracted = extractErrorData(Array.get(dataValue, i));
                if (extracted != null) {
                    return extracted;
                }
            }
            return dataValue.toString();
        }
        if (dataValue instanceof Iterable<?> iterable) {
            return extractFromIterable(iterable, dataValue);
        }
        return dataValue.toString();
    }

    private static String extractFromIterable(final Iterable<?> iterable, final Object fallback) {
        for (final Object item : iterable) {
            final String extracted = extractErrorData(item);
            if (extracted != null) {
                return extracted;
            }
        }
        return fallback.toString();
    }

    public static String stringValue(final Object value) {
        return value != null ? value.toString() : null;
    }

    /**
     * Decodes a hex quantity to a long; {@code null} stays {@code null} and an
     * empty quantity is zero.
     */
    public static Long decodeHexLong(final Object value) {
        if (value == null) {
            return null;
        }
        final String hex = value.toString();
        final String normalized = hex.startsWith("0x") ? hex.substring(2) : hex;
        if (normalized.isEmpty()) {
            return 0L;
        }
        return Long.parseLong(normalized, 16);
    }

    public static BigInteger decodeHexBigInteger(final String hex) {
        if (hex == null || hex.isEmpty()) {
            return BigInteger.ZERO;
        }
        final String normalized = hex.startsWith("0x") ? hex.substring(2) : hex;
        if (normalized.isEmpty()) {
            return BigInteger.ZERO;
        }
        return new BigInteger(normalized, 16);
    }

    public static String toQuantityHex(final BigInteger value) {
        return "0x" + value.toString(16);
    }

    public static String toQuantityHex(final long value) {
        return "0x" + Long.toHexString(value);
    }

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException}
     * layers a future adds around its failure.
     */
    public static Throwable unwrap(final Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Blocks on {@code future} and rethrows its failure without the
     * {@link CompletionException} wrapper. SDK failures surface as their own
     * type; anything else is reported as a {@link TransportException}.
     *
     * @param future      the pending result
     * @param description what was awaited, used in the wrapping message
     * @return the result
     */
    public static <T> T await(final CompletableFuture<T> future, final String description) {
        try {
            return future.join();
        } catch (CompletionException e) {
            final Throwable cause = unwrap(e);
            if (cause instanceof JasmineException je) {
                throw je;
            }
            throw new TransportException(description + " failed", cause);
        }
    }
}
