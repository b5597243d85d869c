// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.contract;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.jspecify.annotations.Nullable;

import sh.jasmine.core.abi.AbiDecoder;
import sh.jasmine.core.abi.AbiEncoder;
import sh.jasmine.core.abi.AbiType;
import sh.jasmine.core.error.AbiDecodingException;
import sh.jasmine.core.error.AbiEncodingException;
import sh.jasmine.core.types.HexData;

/**
 * A parsed contract ABI: the functions a binding may call and, optionally,
 * the constructor.
 *
 * <p>
 * Parsed from the standard Solidity JSON ABI. Events, errors and fallback
 * entries are skipped. Overloaded functions are rejected since bindings
 * address functions by name.
 *
 * <p>
 * Instances are immutable and safe to share.
 */
public final class ContractAbi {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, AbiFunction> functionsByName;
    private final @Nullable AbiFunction constructor;

    private ContractAbi(final Map<String, AbiFunction> functionsByName, final @Nullable AbiFunction constructor) {
        this.functionsByName = Collections.unmodifiableMap(functionsByName);
        this.constructor = constructor;
    }

    /**
     * Parses a JSON ABI array.
     *
     * @param json the ABI document
     * @return the parsed ABI
     * @throws AbiEncodingException if the document is not a valid ABI or declares an
     *                              unsupported parameter type
     */
    public static ContractAbi parse(final String json) {
        if (json == null || json.isBlank()) {
            throw new AbiEncodingException("ABI json must not be null or empty");
        }

        final JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new AbiEncodingException("Unable to parse ABI json", e);
        }
        if (!root.isArray()) {
            throw new AbiEncodingException("ABI json must be an array");
        }

        final Map<String, AbiFunction> functions = new LinkedHashMap<>();
        AbiFunction constructor = null;
        final Iterator<JsonNode> iterator = root.elements();
        while (iterator.hasNext()) {
            final JsonNode node = iterator.next();
            final String type = node.path("type").asText("function").toLowerCase(Locale.ROOT);
            if ("function".equals(type)) {
                final AbiFunction fn = new AbiFunction(
                        requireText(node, "name", "function"),
                        mutability(node),
                        parseParameters(node.path("inputs")),
                        parseParameters(node.path("outputs")));
                if (functions.putIfAbsent(fn.name(), fn) != null) {
                    throw new AbiEncodingException(
                            "Overloaded functions are not supported; duplicate name '" + fn.name() + "'");
                }
            } else if ("constructor".equals(type)) {
                if (constructor != null) {
                    throw new AbiEncodingException("Multiple constructors found in ABI");
                }
                constructor = new AbiFunction(
                        "constructor", mutability(node), parseParameters(node.path("inputs")), List.of());
            }
        }
        return new ContractAbi(functions, constructor);
    }

    /**
     * Looks up a function by name.
     *
     * @throws AbiEncodingException if the ABI has no such function
     */
    public AbiFunction function(final String name) {
        final AbiFunction fn = functionsByName.get(name);
        if (fn == null) {
            throw new AbiEncodingException("Unknown function '" + name + "'");
        }
        return fn;
    }

    public Set<String> functionNames() {
        return functionsByName.keySet();
    }

    public Optional<AbiFunction> constructor() {
        return Optional.ofNullable(constructor);
    }

    /**
     * Encodes a call: the 4-byte selector followed by the encoded arguments.
     *
     * <p>
     * Arguments are plain Java values converted per declared type:
     * {@code BigInteger}/{@code Long}/{@code Integer}/{@code Wei} for integers,
     * {@code Address} for addresses, {@code byte[]}/{@code HexData} for bytes,
     * {@code String} for strings.
     *
     * @throws AbiEncodingException for unknown functions, wrong arity or mismatched values
     */
    public HexData encodeCall(final String name, final Object... args) {
        final AbiFunction fn = function(name);
        return AbiEncoder.encodeFunction(fn.signature(), wrapArguments(fn, args));
    }

    /**
     * Encodes constructor arguments, to be appended to the init bytecode.
     *
     * @return the encoded arguments; empty when the ABI declares no constructor
     *         inputs
     */
    public HexData encodeConstructor(final Object... args) {
        if (constructor == null) {
            if (args != null && args.length > 0) {
                throw new AbiEncodingException("Constructor not defined in ABI, but arguments provided");
            }
            return HexData.EMPTY;
        }
        return HexData.fromBytes(AbiEncoder.encode(wrapArguments(constructor, args)));
    }

    /**
     * Decodes the return data of an {@code eth_call} against {@code name}.
     *
     * @throws AbiDecodingException if the data is empty or does not match the
     *                              declared outputs
     */
    public List<AbiType> decodeResult(final String name, final HexData output) {
        final AbiFunction fn = function(name);
        Objects.requireNonNull(output, "output");
        if (output.isEmpty() && !fn.outputs().isEmpty()) {
            throw new AbiDecodingException("eth_call returned empty result for function '" + name + "'");
        }
        return AbiDecoder.decode(output.toBytes(), fn.outputSchemas());
    }

    private static List<AbiType> wrapArguments(final AbiFunction fn, final Object[] args) {
        final Object[] provided = args == null ? new Object[0] : args;
        if (fn.inputs().size() != provided.length) {
            throw new AbiEncodingException("Function " + fn.name() + " expects " + fn.inputs().size()
                    + " arguments but " + provided.length + " were supplied");
        }
        final List<AbiType> values = new ArrayList<>(provided.length);
        for (int i = 0; i < provided.length; i++) {
            final AbiParameter param = fn.inputs().get(i);
            if (provided[i] == null) {
                throw new AbiEncodingException("Argument '" + param.name() + "' of " + fn.name() + " is null");
            }
            values.add(param.schema().wrap(provided[i]));
        }
        return values;
    }

    private static List<AbiParameter> parseParameters(final JsonNode array) {
        if (array.isMissingNode() || array.isNull()) {
            return List.of();
        }
        if (!array.isArray()) {
            throw new AbiEncodingException("ABI parameters must be an array");
        }
        final List<AbiParameter> params = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            final AbiParameter param = new AbiParameter(
                    node.path("name").asText(""), requireText(node, "type", "parameter"));
            // validates the type eagerly so a bad ABI fails at load time
            param.schema();
            params.add(param);
        }
        return params;
    }

    private static String mutability(final JsonNode node) {
        final String value = node.path("stateMutability").asText("");
        if (!value.isBlank()) {
            return value;
        }
        return node.path("constant").asBoolean(false) ? "view" : "nonpayable";
    }

    private static String requireText(final JsonNode node, final String field, final String entryType) {
        final String value = node.path(field).asText();
        if (value == null || value.isBlank()) {
            throw new AbiEncodingException(entryType + " missing required field '" + field + "'");
        }
        return value;
    }
}
