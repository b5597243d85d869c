// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.contract;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;

import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import sh.jasmine.core.abi.AbiEncoder;
import sh.jasmine.core.abi.AbiType;
import sh.jasmine.core.model.SignedTransaction;
import sh.jasmine.core.model.TransactionReceipt;
import sh.jasmine.core.types.Address;
import sh.jasmine.core.types.Hash;
import sh.jasmine.core.types.HexData;
import sh.jasmine.core.types.Wei;
import sh.jasmine.rpc.ChainClient;

/** Stubs a mocked {@link ChainClient} so every submitted transaction is mined. */
final class Receipts {

    static final Hash BLOCK = new Hash("0x" + "bb".repeat(32));

    private Receipts() {
    }

    static void mineEverything(final ChainClient client, final boolean status) {
        lenient().when(client.estimateGas(any())).thenReturn(CompletableFuture.completedFuture(60_000L));
        lenient().when(client.suggestGasPrice()).thenReturn(CompletableFuture.completedFuture(Wei.gwei(1)));
        lenient().when(client.getTransactionCount(any())).thenReturn(CompletableFuture.completedFuture(3L));
        lenient().when(client.chainId()).thenReturn(CompletableFuture.completedFuture(1337L));
        lenient().when(client.sendRawTransaction(any()))
                .thenAnswer(inv -> CompletableFuture.completedFuture(inv.<SignedTransaction>getArgument(0).hash()));
        lenient().when(client.waitForReceipt(any()))
                .thenAnswer(inv -> CompletableFuture.completedFuture(receipt(inv.getArgument(0), status)));
    }

    static TransactionReceipt receipt(final Hash hash, final boolean status) {
        return new TransactionReceipt(hash, BLOCK, 12L, Address.ZERO, null, null, status,
                50_000L, 50_000L, Wei.gwei(1), List.of());
    }

    static CompletableFuture<HexData> returns(final AbiType... values) {
        return CompletableFuture.completedFuture(HexData.fromBytes(AbiEncoder.encode(List.of(values))));
    }

    static BigInteger big(final long value) {
        return BigInteger.valueOf(value);
    }
}
