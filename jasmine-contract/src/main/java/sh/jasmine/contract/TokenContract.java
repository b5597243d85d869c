// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.contract;

import java.math.BigInteger;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import sh.jasmine.core.abi.UInt;
import sh.jasmine.core.abi.Utf8String;
import sh.jasmine.core.crypto.TransactionSigner;
import sh.jasmine.core.model.TransactionReceipt;
import sh.jasmine.core.types.Address;
import sh.jasmine.rpc.TransactionExecutor;

/**
 * Binding for a deployed TFC token (ERC-20).
 *
 * <p>
 * Amounts are in the token's smallest unit; use {@link #decimals()} to scale
 * them for display. Synchronous reads throw the typed
 * {@link sh.jasmine.core.error.JasmineException} of the failure; writes
 * return a future that completes with the confirmed receipt.
 *
 * <pre>{@code
 * TokenContract token = sdk.getTfcToken(tokenAddress);
 * BigInteger balance = token.balanceOf(account.address());
 * token.transfer(recipient, BigInteger.TEN, account).join();
 * }</pre>
 */
public final class TokenContract {

    private final ContractBinding binding;

    public TokenContract(final ContractBinding binding) {
        this.binding = Objects.requireNonNull(binding, "binding");
    }

    /**
     * Binds the token at {@code address} using the {@value ContractArtifacts#TFC_TOKEN} ABI.
     */
    public static TokenContract at(
            final Address address, final TransactionExecutor executor, final ContractArtifacts artifacts) {
        return new TokenContract(
                new ContractBinding(address, artifacts.abi(ContractArtifacts.TFC_TOKEN), executor));
    }

    public Address address() {
        return binding.address();
    }

    public String name() {
        return ContractBinding.await(nameAsync(), "name");
    }

    public CompletableFuture<String> nameAsync() {
        return binding.callSingle("name", Utf8String.class).thenApply(Utf8String::value);
    }

    public String symbol() {
        return ContractBinding.await(symbolAsync(), "symbol");
    }

    public CompletableFuture<String> symbolAsync() {
        return binding.callSingle("symbol", Utf8String.class).thenApply(Utf8String::value);
    }

    public int decimals() {
        return ContractBinding.await(decimalsAsync(), "decimals");
    }

    public CompletableFuture<Integer> decimalsAsync() {
        return binding.callSingle("decimals", UInt.class).thenApply(v -> v.value().intValueExact());
    }

    public BigInteger totalSupply() {
        return ContractBinding.await(totalSupplyAsync(), "totalSupply");
    }

    public CompletableFuture<BigInteger> totalSupplyAsync() {
        return binding.callSingle("totalSupply", UInt.class).thenApply(UInt::value);
    }

    public BigInteger balanceOf(final Address owner) {
        return ContractBinding.await(balanceOfAsync(owner), "balanceOf");
    }

    public CompletableFuture<BigInteger> balanceOfAsync(final Address owner) {
        return binding.callSingle("balanceOf", UInt.class, owner).thenApply(UInt::value);
    }

    /** Returns how much {@code spender} may still move on behalf of {@code owner}. */
    public BigInteger allowance(final Address owner, final Address spender) {
        return ContractBinding.await(allowanceAsync(owner, spender), "allowance");
    }

    public CompletableFuture<BigInteger> allowanceAsync(final Address owner, final Address spender) {
        return binding.callSingle("allowance", UInt.class, owner, spender).thenApply(UInt::value);
    }

    /**
     * Moves {@code amount} from the sender's balance to {@code recipient}.
     */
    public CompletableFuture<TransactionReceipt> transfer(
            final Address recipient, final BigInteger amount, final TransactionSigner sender) {
        return binding.send("transfer", sender, recipient, amount);
    }

    /**
     * Moves {@code amount} from {@code owner} to {@code recipient} against the
     * allowance {@code owner} granted to {@code spender}.
     */
    public CompletableFuture<TransactionReceipt> transferFrom(
            final Address owner, final Address recipient, final BigInteger amount, final TransactionSigner spender) {
        return binding.send("transferFrom", spender, owner, recipient, amount);
    }

    public CompletableFuture<TransactionReceipt> approve(
            final Address spender, final BigInteger amount, final TransactionSigner owner) {
        return binding.send("approve", owner, spender, amount);
    }

    @Override
    public String toString() {
        return "TokenContract[" + binding.address() + "]";
    }
}
