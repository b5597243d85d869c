// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.contract;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.jasmine.core.abi.AbiType;
import sh.jasmine.core.crypto.TransactionSigner;
import sh.jasmine.core.error.AbiDecodingException;
import sh.jasmine.core.error.JasmineException;
import sh.jasmine.core.model.TransactionIntent;
import sh.jasmine.core.model.TransactionReceipt;
import sh.jasmine.core.types.Address;
import sh.jasmine.core.types.HexData;
import sh.jasmine.rpc.ChainClient;
import sh.jasmine.rpc.TransactionExecutor;
import sh.jasmine.rpc.internal.RpcUtils;

/**
 * A deployed contract: its address and ABI, wired to a {@link ChainClient}
 * for reads and a {@link TransactionExecutor} for writes.
 *
 * <p>
 * Reads are {@code eth_call}s at {@code latest}. Writes become a
 * {@link TransactionIntent} to the contract address, sent by the acting
 * signer, and resolve once the transaction is confirmed. The binding holds no
 * other state and can be shared between threads.
 *
 * <p>
 * Invalid arguments never throw from the async methods; the returned future
 * fails instead.
 */
public final class ContractBinding {

    private static final Logger LOG = LoggerFactory.getLogger(ContractBinding.class);

    private final Address address;
    private final ContractAbi abi;
    private final TransactionExecutor executor;

    public ContractBinding(final Address address, final ContractAbi abi, final TransactionExecutor executor) {
        this.address = Objects.requireNonNull(address, "address");
        this.abi = Objects.requireNonNull(abi, "abi");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public Address address() {
        return address;
    }

    public ContractAbi abi() {
        return abi;
    }

    public ChainClient client() {
        return executor.client();
    }

    public TransactionExecutor executor() {
        return executor;
    }

    /**
     * Calls a function and returns all decoded outputs.
     *
     * @param function the function name
     * @param args     the arguments, in declaration order
     * @return the decoded outputs
     */
    public CompletableFuture<List<AbiType>> call(final String function, final Object... args) {
        final HexData data;
        try {
            data = abi.encodeCall(function, args);
        } catch (JasmineException e) {
            return CompletableFuture.failedFuture(e);
        }
        LOG.debug("eth_call {} on {}", function, address);
        return client().call(address, data).thenApply(output -> abi.decodeResult(function, output));
    }

    /**
     * Calls a function with exactly one output and returns it as {@code type}.
     *
     * @throws AbiDecodingException (through the future) if the output has another type
     */
    public <T extends AbiType> CompletableFuture<T> callSingle(
            final String function, final Class<T> type, final Object... args) {
        return call(function, args).thenApply(outputs -> {
            if (outputs.size() != 1) {
                throw new AbiDecodingException(
                        function + " returned " + outputs.size() + " values, expected exactly one");
            }
            final AbiType value = outputs.get(0);
            if (!type.isInstance(value)) {
                throw new AbiDecodingException(function + " returned " + value.typeName()
                        + ", expected " + type.getSimpleName());
            }
            return type.cast(value);
        });
    }

    /**
     * Sends a state-changing call from {@code sender} and waits for it to be
     * mined.
     *
     * @param function the function name
     * @param sender   the acting account
     * @param args     the arguments, in declaration order
     * @return the successful receipt
     */
    public CompletableFuture<TransactionReceipt> send(
            final String function, final TransactionSigner sender, final Object... args) {
        Objects.requireNonNull(sender, "sender");
        final HexData data;
        try {
            data = abi.encodeCall(function, args);
        } catch (JasmineException e) {
            return CompletableFuture.failedFuture(e);
        }
        final TransactionIntent intent = TransactionIntent.builder(sender.address())
                .to(address)
                .data(data)
                .build();
        LOG.debug("Submitting {} to {} from {}", function, address, sender.address());
        return executor.submit(intent, sender);
    }

    /**
     * Waits for a read and rethrows its typed failure without the
     * {@code CompletionException} wrapper.
     */
    static <T> T await(final CompletableFuture<T> future, final String function) {
        return RpcUtils.await(future, "contract call " + function);
    }
}
