// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.model;

import java.util.List;
import java.util.Objects;

import sh.jasmine.core.types.Address;
import sh.jasmine.core.types.Hash;
import sh.jasmine.core.types.HexData;

/**
 * An event log emitted by a mined transaction.
 */
public record LogEntry(
        Address address,
        HexData data,
        List<Hash> topics,
        Hash transactionHash,
        long logIndex) {

    public LogEntry {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(topics, "topics cannot be null");
        Objects.requireNonNull(transactionHash, "transactionHash cannot be null");
        topics = List.copyOf(topics);
    }
}
