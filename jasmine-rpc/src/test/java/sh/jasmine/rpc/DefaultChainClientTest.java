// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import sh.jasmine.core.error.TransportException;
import sh.jasmine.core.model.TransactionIntent;
import sh.jasmine.core.model.TransactionReceipt;
import sh.jasmine.core.types.Address;
import sh.jasmine.core.types.Hash;
import sh.jasmine.core.types.HexData;
import sh.jasmine.core.types.Wei;

class DefaultChainClientTest {

    private static final Address FROM = new Address("0x" + "1".repeat(40));
    private static final Address TO = new Address("0x" + "2".repeat(40));

    @Test
    void estimateGasSendsTheCallObject() {
        FakeProvider provider = new FakeProvider().respond("eth_estimateGas", "0x5208");
        try (DefaultChainClient client = DefaultChainClient.create(provider)) {
            TransactionIntent intent = TransactionIntent.builder(FROM)
                    .to(TO)
                    .value(Wei.of(255))
                    .data(new HexData("0xabcd"))
                    .build();

            assertEquals(21_000L, client.estimateGas(intent).join());

            @SuppressWarnings("unchecked")
            Map<String, Object> tx = (Map<String, Object>) provider.lastParams("eth_estimateGas").get(0);
            assertEquals(FROM.value(), tx.get("from"));
            assertEquals(TO.value(), tx.get("to"));
            assertEquals("0xff", tx.get("value"));
            assertEquals("0xabcd", tx.get("data"));
        }
    }

    @Test
    void estimateGasOmitsToForCreations() {
        FakeProvider provider = new FakeProvider().respond("eth_estimateGas", "0x30d40");
        try (DefaultChainClient client = DefaultChainClient.create(provider)) {
            client.estimateGas(TransactionIntent.builder(FROM).data(new HexData("0x6080")).build()).join();

            Map<?, ?> tx = (Map<?, ?>) provider.lastParams("eth_estimateGas").get(0);
            assertFalse(tx.containsKey("to"));
        }
    }

    @Test
    void readsAtTheRightBlockTags() {
        FakeProvider provider = new FakeProvider()
                .respond("eth_getBalance", "0xde0b6b3a7640000")
                .respond("eth_call", "0x" + "0".repeat(62) + "12")
                .respond("eth_getTransactionCount", "0x3")
                .respond("eth_chainId", "0x539");
        try (DefaultChainClient client = DefaultChainClient.create(provider)) {
            assertEquals(Wei.fromEther(BigDecimal.ONE), client.getBalance(FROM).join());
            assertEquals(List.of(FROM.value(), "latest"), provider.lastParams("eth_getBalance"));

            assertEquals(32, client.call(TO, new HexData("0x313ce567")).join().byteLength());
            assertEquals("latest", provider.lastParams("eth_call").get(1));

            assertEquals(3L, client.getTransactionCount(FROM).join());
            assertEquals("pending", provider.lastParams("eth_getTransactionCount").get(1));

            assertEquals(1337L, client.chainId().join());
        }
    }

    @Test
    void waitForReceiptPollsUntilMined() {
        Hash hash = new Hash("0x" + "a".repeat(64));
        AtomicInteger polls = new AtomicInteger();
        FakeProvider provider = new FakeProvider().respondWith("eth_getTransactionReceipt",
                params -> polls.incrementAndGet() < 3 ? null : FakeProvider.receipt(hash.value(), "0x1"));
        try (DefaultChainClient client =
                DefaultChainClient.builder(provider).pollInterval(Duration.ofMillis(5)).build()) {
            TransactionReceipt receipt = client.waitForReceipt(hash).join();

            assertEquals(hash, receipt.transactionHash());
            assertEquals(3, polls.get());
        }
    }

    @Test
    void singleReceiptLookupIsEmptyWhilePending() {
        FakeProvider provider = new FakeProvider().respond("eth_getTransactionReceipt", null);
        try (DefaultChainClient client = DefaultChainClient.create(provider)) {
            assertTrue(client.getTransactionReceipt(new Hash("0x" + "a".repeat(64))).join().isEmpty());
        }
    }

    @Test
    void malformedResultIsATransportError() {
        FakeProvider provider = new FakeProvider().respond("eth_gasPrice", "not-hex");
        try (DefaultChainClient client = DefaultChainClient.create(provider)) {
            CompletionException e = assertThrows(CompletionException.class, () -> client.suggestGasPrice().join());

            TransportException cause = assertInstanceOf(TransportException.class, e.getCause());
            assertEquals(-32700, cause.code());
        }
    }

    @Test
    void closeReleasesTheProvider() {
        FakeProvider provider = new FakeProvider();
        DefaultChainClient.create(provider).close();

        assertTrue(provider.isClosed());
    }
}
