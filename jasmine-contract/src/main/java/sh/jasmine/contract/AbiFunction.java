// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.contract;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import sh.jasmine.core.abi.TypeSchema;

/**
 * A function or constructor entry of a contract ABI.
 *
 * @param name            the function name; {@code "constructor"} for the constructor entry
 * @param stateMutability {@code view}, {@code pure}, {@code nonpayable} or {@code payable}
 * @param inputs          the declared inputs, in order
 * @param outputs         the declared outputs, in order
 */
public record AbiFunction(
        String name, String stateMutability, List<AbiParameter> inputs, List<AbiParameter> outputs) {

    public AbiFunction {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(stateMutability, "stateMutability");
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
    }

    /**
     * Returns the canonical signature the selector is hashed from, e.g.
     * {@code transfer(address,uint256)}.
     */
    public String signature() {
        return name + "(" + inputs.stream().map(p -> p.schema().typeName()).collect(Collectors.joining(",")) + ")";
    }

    /** Whether calling this function cannot change chain state. */
    public boolean isReadOnly() {
        return "view".equals(stateMutability) || "pure".equals(stateMutability);
    }

    public List<TypeSchema> outputSchemas() {
        return outputs.stream().map(AbiParameter::schema).toList();
    }
}
