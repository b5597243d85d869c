// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.contract;

import sh.jasmine.core.error.ConfigurationException;
import sh.jasmine.core.types.HexData;

/**
 * Source of contract ABIs and init bytecode, keyed by contract name.
 *
 * <p>
 * The default implementation, {@link #classpath()}, reads
 * {@code contracts/<Name>.abi.json} and {@code contracts/<Name>.bin}
 * resources. The ABIs of {@value #TFC_TOKEN} and {@value #TFC_MANAGER} ship
 * with this module; compiled bytecode is supplied by the application.
 */
public interface ContractArtifacts {

    String TFC_TOKEN = "TFCToken";

    String TFC_MANAGER = "TFCManager";

    /**
     * @throws ConfigurationException if the artifact is missing or unreadable
     */
    ContractAbi abi(String name);

    /**
     * Returns the init bytecode used to deploy {@code name}.
     *
     * @throws ConfigurationException if the artifact is missing or not valid hex
     */
    HexData bytecode(String name);

    static ContractArtifacts classpath() {
        return new ClasspathContractArtifacts(ContractArtifacts.class.getClassLoader());
    }

    static ContractArtifacts classpath(final ClassLoader loader) {
        return new ClasspathContractArtifacts(loader);
    }
}
