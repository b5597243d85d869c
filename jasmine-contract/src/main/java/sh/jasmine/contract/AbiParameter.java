// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.contract;

import java.util.Objects;

import sh.jasmine.core.abi.TypeSchema;

/**
 * A named input or output of an ABI entry.
 *
 * @param name the parameter name, empty when the ABI omits it
 * @param type the canonical Solidity type, e.g. {@code uint256}
 */
public record AbiParameter(String name, String type) {

    public AbiParameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public TypeSchema schema() {
        return TypeSchema.parse(type);
    }
}
