// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.crypto;

import sh.jasmine.core.model.SignedTransaction;
import sh.jasmine.core.model.TransactionIntent;
import sh.jasmine.core.types.Address;

/**
 * Produces signed, broadcast-ready transactions for a single address.
 *
 * <p>
 * Implementations must be thread-safe.
 */
public interface TransactionSigner {

    /**
     * Returns the address whose key this signer holds.
     *
     * @return the sender address
     */
    Address address();

    /**
     * Signs a fully populated intent as an EIP-155 legacy transaction.
     *
     * @param intent  the intent, with gas, gas price and nonce present
     * @param chainId the chain id bound into the signature
     * @return the signed transaction
     * @throws IllegalArgumentException if a required field is missing
     */
    SignedTransaction sign(TransactionIntent intent, long chainId);
}
