// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.contract;

import java.math.BigInteger;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import sh.jasmine.core.abi.AddressType;
import sh.jasmine.core.crypto.TransactionSigner;
import sh.jasmine.core.error.ConfigurationException;
import sh.jasmine.core.model.TransactionReceipt;
import sh.jasmine.core.types.Address;
import sh.jasmine.primitives.Hex;
import sh.jasmine.rpc.TransactionExecutor;

/**
 * Binding for a deployed TFC manager, the contract that mints TFC tokens to
 * holders of an off-chain voucher.
 */
public final class ManagerContract {

    private final ContractBinding binding;

    public ManagerContract(final ContractBinding binding) {
        this.binding = Objects.requireNonNull(binding, "binding");
    }

    /**
     * Binds the manager at {@code address} using the {@value ContractArtifacts#TFC_MANAGER} ABI.
     */
    public static ManagerContract at(
            final Address address, final TransactionExecutor executor, final ContractArtifacts artifacts) {
        return new ManagerContract(
                new ContractBinding(address, artifacts.abi(ContractArtifacts.TFC_MANAGER), executor));
    }

    public Address address() {
        return binding.address();
    }

    /** Returns the address of the token this manager mints. */
    public Address tfcTokenAddress() {
        return ContractBinding.await(tfcTokenAddressAsync(), "tfcToken");
    }

    public CompletableFuture<Address> tfcTokenAddressAsync() {
        return binding.callSingle("tfcToken", AddressType.class).thenApply(AddressType::value);
    }

    /**
     * Redeems a voucher, minting {@code amount} tokens to {@code claimer}.
     *
     * <p>
     * The voucher signature is passed to the contract as raw {@code bytes},
     * exactly as decoded; it is not checked locally, so an invalid voucher
     * surfaces as a reverted transaction.
     *
     * @param amount       tokens to mint
     * @param nonce        voucher nonce
     * @param signatureHex voucher signature, hex with or without {@code 0x}
     * @param claimer      the account claiming, and paying for, the transaction
     * @return the confirmed receipt; fails with {@link ConfigurationException}
     *         when {@code signatureHex} is not valid hex
     */
    public CompletableFuture<TransactionReceipt> claimTFC(
            final BigInteger amount, final BigInteger nonce, final String signatureHex,
            final TransactionSigner claimer) {
        final byte[] signature;
        try {
            signature = decodeVoucher(signatureHex);
        } catch (ConfigurationException e) {
            return CompletableFuture.failedFuture(e);
        }
        return binding.send("claimTFC", claimer, amount, nonce, signature);
    }

    static byte[] decodeVoucher(final String signatureHex) {
        if (signatureHex == null) {
            throw new ConfigurationException("voucher signature must not be null");
        }
        try {
            return Hex.decode(signatureHex.strip());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("voucher signature is not valid hex: " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "ManagerContract[" + binding.address() + "]";
    }
}
