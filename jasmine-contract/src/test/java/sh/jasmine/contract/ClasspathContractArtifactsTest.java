// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.contract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import sh.jasmine.core.error.AbiEncodingException;
import sh.jasmine.core.error.ConfigurationException;
import sh.jasmine.core.types.HexData;

class ClasspathContractArtifactsTest {

    private final ContractArtifacts artifacts = ContractArtifacts.classpath();

    @Test
    void bytecodeGainsAPrefixAndLosesTrailingWhitespace() {
        assertEquals(new HexData("0x6080604052348015600f57600080fd5b50"), artifacts.bytecode("Sample"));
    }

    @Test
    void missingArtifactsAreConfigurationErrors() {
        final ConfigurationException bin = assertThrows(ConfigurationException.class,
                () -> artifacts.bytecode("Missing"));
        assertTrue(bin.getMessage().contains("contracts/Missing.bin"));
        assertThrows(ConfigurationException.class, () -> artifacts.abi("Missing"));
    }

    @Test
    void shippedAbisCarryNoBytecode() {
        assertThrows(ConfigurationException.class, () -> artifacts.bytecode(ContractArtifacts.TFC_MANAGER));
    }

    @Test
    void invalidArtifactsAreConfigurationErrors() {
        assertThrows(ConfigurationException.class, () -> artifacts.bytecode("Broken"));
        final ConfigurationException abi = assertThrows(ConfigurationException.class,
                () -> artifacts.abi("Broken"));
        assertInstanceOf(AbiEncodingException.class, abi.getCause());
    }

    @Test
    void abisAreParsedOnce() {
        assertSame(artifacts.abi(ContractArtifacts.TFC_TOKEN), artifacts.abi(ContractArtifacts.TFC_TOKEN));
    }
}
