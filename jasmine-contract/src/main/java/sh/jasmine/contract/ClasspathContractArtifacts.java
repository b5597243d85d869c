// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.contract;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.jasmine.core.error.AbiEncodingException;
import sh.jasmine.core.error.ConfigurationException;
import sh.jasmine.core.types.HexData;

/**
 * Loads artifacts from {@code contracts/} on a class loader. Parsed ABIs are
 * cached per name.
 */
final class ClasspathContractArtifacts implements ContractArtifacts {

    private static final Logger LOG = LoggerFactory.getLogger(ClasspathContractArtifacts.class);

    private static final String DIRECTORY = "contracts/";

    private final ClassLoader loader;
    private final Map<String, ContractAbi> abis = new ConcurrentHashMap<>();

    ClasspathContractArtifacts(final ClassLoader loader) {
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    @Override
    public ContractAbi abi(final String name) {
        Objects.requireNonNull(name, "name");
        return abis.computeIfAbsent(name, n -> {
            final String resource = DIRECTORY + n + ".abi.json";
            try {
                return ContractAbi.parse(read(resource));
            } catch (AbiEncodingException e) {
                throw new ConfigurationException("invalid contract ABI " + resource + ": " + e.getMessage(), e);
            }
        });
    }

    @Override
    public HexData bytecode(final String name) {
        Objects.requireNonNull(name, "name");
        final String resource = DIRECTORY + name + ".bin";
        final String text = read(resource).strip();
        if (text.isEmpty()) {
            throw new ConfigurationException("contract bytecode " + resource + " is empty");
        }
        try {
            return new HexData(text.startsWith("0x") ? text : "0x" + text);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("contract bytecode " + resource + " is not valid hex", e);
        }
    }

    private String read(final String resource) {
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("contract artifact not found on classpath: " + resource);
            }
            final String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            LOG.debug("Loaded contract artifact {} ({} chars)", resource, text.length());
            return text;
        } catch (IOException e) {
            throw new ConfigurationException("failed to read contract artifact " + resource, e);
        }
    }
}
