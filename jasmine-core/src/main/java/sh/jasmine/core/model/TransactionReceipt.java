// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

import sh.jasmine.core.types.Address;
import sh.jasmine.core.types.Hash;
import sh.jasmine.core.types.Wei;

/**
 * Receipt of a mined transaction.
 *
 * <p>
 * {@code status} is {@code true} when execution succeeded and {@code false}
 * when it reverted. {@code contractAddress} is present only for contract
 * creations.
 *
 * @param transactionHash   hash of the transaction
 * @param blockHash         hash of the including block
 * @param blockNumber       number of the including block
 * @param from              sender
 * @param to                recipient, {@code null} for creations
 * @param contractAddress   created contract, {@code null} otherwise
 * @param status            execution outcome
 * @param gasUsed           gas used by this transaction
 * @param cumulativeGasUsed gas used in the block up to and including this transaction
 * @param effectiveGasPrice price actually paid, {@code null} if the node omits it
 * @param logs              emitted events
 */
public record TransactionReceipt(
        Hash transactionHash,
        Hash blockHash,
        long blockNumber,
        Address from,
        @Nullable Address to,
        @Nullable Address contractAddress,
        boolean status,
        long gasUsed,
        long cumulativeGasUsed,
        @Nullable Wei effectiveGasPrice,
        List<LogEntry> logs) {

    public TransactionReceipt {
        Objects.requireNonNull(transactionHash, "transactionHash cannot be null");
        Objects.requireNonNull(blockHash, "blockHash cannot be null");
        Objects.requireNonNull(from, "from cannot be null");
        Objects.requireNonNull(logs, "logs cannot be null");
        logs = List.copyOf(logs);
    }

    public Optional<Address> contractAddressOpt() {
        return Optional.ofNullable(contractAddress);
    }
}
