// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import sh.jasmine.core.crypto.Account;
import sh.jasmine.core.crypto.TransactionSigner;
import sh.jasmine.core.error.ConfigurationException;
import sh.jasmine.core.error.ConfirmationFailedException;
import sh.jasmine.core.error.EstimationException;
import sh.jasmine.core.error.NonceException;
import sh.jasmine.core.error.PricingException;
import sh.jasmine.core.error.RejectionReason;
import sh.jasmine.core.error.RpcException;
import sh.jasmine.core.error.SigningException;
import sh.jasmine.core.error.SubmissionFailedException;
import sh.jasmine.core.error.SubmissionRejectedException;
import sh.jasmine.core.error.TransactionStage;
import sh.jasmine.core.error.TransportException;
import sh.jasmine.core.model.SignedTransaction;
import sh.jasmine.core.model.TransactionIntent;
import sh.jasmine.core.model.TransactionReceipt;
import sh.jasmine.core.types.Address;
import sh.jasmine.core.types.Hash;
import sh.jasmine.core.types.Wei;

class TransactionExecutorTest {

    private static final Account SENDER = Account.fromPrivateKey("0x" + "46".repeat(32));
    private static final Address RECIPIENT = new Address("0x" + "35".repeat(20));

    private DefaultChainClient client;

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
    }

    private TransactionExecutor executor(final JasmineProvider provider) {
        client = DefaultChainClient.builder(provider).pollInterval(Duration.ofMillis(10)).build();
        return TransactionExecutor.create(client);
    }

    private static TransactionIntent transfer() {
        return TransactionIntent.builder(SENDER.address()).to(RECIPIENT).value(Wei.gwei(1)).build();
    }

    private static Throwable failure(final CompletableFuture<?> future) {
        final CompletionException e =
                assertThrows(CompletionException.class, () -> future.orTimeout(5, TimeUnit.SECONDS).join());
        return e.getCause();
    }

    @Test
    void fillsMissingFieldsAndResolvesWithReceipt() throws Exception {
        FakeProvider provider = new FakeProvider().minesEverything("0x539", "0x1");

        TransactionReceipt receipt = executor(provider).submit(transfer(), SENDER).get(5, TimeUnit.SECONDS);

        assertTrue(receipt.status());
        assertEquals(List.of(
                "eth_estimateGas",
                "eth_gasPrice",
                "eth_getTransactionCount",
                "eth_chainId",
                "eth_sendRawTransaction",
                "eth_getTransactionReceipt"), provider.methods());

        TransactionIntent populated = transfer()
                .withGas(0x5208)
                .withGasPrice(Wei.gwei(1))
                .withNonce(7);
        SignedTransaction expected = SENDER.sign(populated, 1337);
        assertEquals(List.of(expected.raw().value()), provider.lastParams("eth_sendRawTransaction"));
        assertEquals(expected.hash(), receipt.transactionHash());
        assertEquals(List.of(SENDER.address().value(), "pending"), provider.lastParams("eth_getTransactionCount"));
    }

    @Test
    void presentFieldsArePassedThroughUntouched() throws Exception {
        FakeProvider provider = new FakeProvider().minesEverything("0x1", "0x1");
        TransactionIntent intent = transfer().withGas(50_000).withGasPrice(Wei.gwei(3)).withNonce(42);

        executor(provider).submit(intent, SENDER).get(5, TimeUnit.SECONDS);

        assertEquals(0, provider.count("eth_estimateGas"));
        assertEquals(0, provider.count("eth_gasPrice"));
        assertEquals(0, provider.count("eth_getTransactionCount"));
        assertEquals(List.of(SENDER.sign(intent, 1).raw().value()), provider.lastParams("eth_sendRawTransaction"));
        assertEquals(Long.valueOf(50_000), intent.gas());
    }

    @Test
    void receiptHashMatchesTheSubmittedHash() throws Exception {
        Hash nodeHash = new Hash("0x" + "c".repeat(64));
        FakeProvider provider = new FakeProvider().minesEverything("0x1", "0x1")
                .respond("eth_sendRawTransaction", nodeHash.value());

        TransactionReceipt receipt = executor(provider).submit(transfer(), SENDER).get(5, TimeUnit.SECONDS);

        assertEquals(nodeHash, receipt.transactionHash());
        assertEquals(List.of(nodeHash.value()), provider.lastParams("eth_getTransactionReceipt"));
    }

    @Test
    void signerSenderMismatchFailsBeforeAnyRpc() {
        FakeProvider provider = new FakeProvider().minesEverything("0x1", "0x1");
        Account other = Account.create();

        Throwable cause = failure(executor(provider).submit(transfer(), other));

        assertInstanceOf(ConfigurationException.class, cause);
        assertTrue(provider.methods().isEmpty());
    }

    @Test
    void estimationFailureIsTyped() {
        RpcException nodeError = new RpcException(3, "execution reverted", "0x08c379a0", 1L);
        FakeProvider provider = new FakeProvider().minesEverything("0x1", "0x1").fail("eth_estimateGas", nodeError);

        Throwable cause = failure(executor(provider).submit(transfer(), SENDER));

        EstimationException e = assertInstanceOf(EstimationException.class, cause);
        assertEquals(TransactionStage.ESTIMATION, e.stage());
        assertSame(nodeError, e.getCause());
        assertFalse(e.transactionHash().isPresent());
        assertEquals(0, provider.count("eth_sendRawTransaction"));
    }

    @Test
    void pricingFailureIsTyped() {
        TransportException down = new TransportException("connection refused", null);
        FakeProvider provider = new FakeProvider().minesEverything("0x1", "0x1").fail("eth_gasPrice", down);

        Throwable cause = failure(executor(provider).submit(transfer(), SENDER));

        PricingException e = assertInstanceOf(PricingException.class, cause);
        assertSame(down, e.getCause());
        assertEquals(0, provider.count("eth_getTransactionCount"));
    }

    @Test
    void nonceFailureIsTyped() {
        FakeProvider provider = new FakeProvider().minesEverything("0x1", "0x1")
                .fail("eth_getTransactionCount", new RpcException(-32000, "header not found", null, 1L));

        Throwable cause = failure(executor(provider).submit(transfer(), SENDER));

        assertInstanceOf(NonceException.class, cause);
        assertEquals(0, provider.count("eth_sendRawTransaction"));
    }

    @Test
    void signingFailureIsTyped() {
        FakeProvider provider = new FakeProvider().minesEverything("0x1", "0x1");
        IllegalStateException boom = new IllegalStateException("hardware wallet unplugged");
        TransactionSigner broken = new TransactionSigner() {
            @Override
            public Address address() {
                return SENDER.address();
            }

            @Override
            public SignedTransaction sign(final TransactionIntent intent, final long chainId) {
                throw boom;
            }
        };

        Throwable cause = failure(executor(provider).submit(transfer(), broken));

        SigningException e = assertInstanceOf(SigningException.class, cause);
        assertSame(boom, e.getCause());
        assertEquals(0, provider.count("eth_sendRawTransaction"));
    }

    @Test
    void nodeRejectionCarriesTheReason() {
        FakeProvider provider = new FakeProvider().minesEverything("0x1", "0x1").fail("eth_sendRawTransaction",
                new RpcException(-32000, "insufficient funds for gas * price + value", null, 9L));

        Throwable cause = failure(executor(provider).submit(transfer(), SENDER));

        SubmissionRejectedException e = assertInstanceOf(SubmissionRejectedException.class, cause);
        assertEquals(RejectionReason.INSUFFICIENT_FUNDS, e.reason());
        assertEquals("insufficient funds for gas * price + value", e.nodeReason());
        assertEquals(localHash(provider), e.transactionHash().orElseThrow());
        assertEquals(0, provider.count("eth_getTransactionReceipt"));
    }

    @Test
    void connectivityFailureOnBroadcastKeepsTheLocalHash() {
        TransportException down = new TransportException("read timed out", null);
        FakeProvider provider = new FakeProvider().minesEverything("0x1", "0x1").fail("eth_sendRawTransaction", down);

        Throwable cause = failure(executor(provider).submit(transfer(), SENDER));

        SubmissionFailedException e = assertInstanceOf(SubmissionFailedException.class, cause);
        assertEquals(TransactionStage.SUBMISSION, e.stage());
        assertEquals(localHash(provider), e.transactionHash().orElseThrow());
        assertSame(down, e.getCause());
        assertEquals(0, provider.count("eth_getTransactionReceipt"));
    }

    @Test
    void revertedReceiptFailsWithHashAndReceipt() {
        FakeProvider provider = new FakeProvider().minesEverything("0x1", "0x0");

        Throwable cause = failure(executor(provider).submit(transfer(), SENDER));

        ConfirmationFailedException e = assertInstanceOf(ConfirmationFailedException.class, cause);
        assertTrue(e.isReverted());
        assertTrue(e.transactionHash().isPresent());
        assertEquals(e.transactionHash().get(), e.receipt().orElseThrow().transactionHash());
    }

    @Test
    void confirmationTimeoutExposesTheHash() {
        FakeProvider provider = new FakeProvider().minesEverything("0x1", "0x1")
                .respond("eth_getTransactionReceipt", null);
        client = DefaultChainClient.builder(provider)
                .pollInterval(Duration.ofMillis(10))
                .confirmationTimeout(Duration.ofMillis(100))
                .build();

        Throwable cause = failure(TransactionExecutor.create(client).submit(transfer(), SENDER));

        ConfirmationFailedException e = assertInstanceOf(ConfirmationFailedException.class, cause);
        assertFalse(e.isReverted());
        assertTrue(e.transactionHash().isPresent());
        assertTrue(provider.count("eth_getTransactionReceipt") > 1);
    }

    @Test
    void receiptPollErrorBecomesConfirmationFailure() {
        FakeProvider provider = new FakeProvider().minesEverything("0x1", "0x1")
                .fail("eth_getTransactionReceipt", new TransportException("socket closed", null));

        Throwable cause = failure(executor(provider).submit(transfer(), SENDER));

        ConfirmationFailedException e = assertInstanceOf(ConfirmationFailedException.class, cause);
        assertInstanceOf(TransportException.class, e.getCause());
        assertTrue(e.transactionHash().isPresent());
    }

    @Test
    void chainIdMismatchIsAConfigurationError() {
        FakeProvider provider = new FakeProvider().minesEverything("0x5", "0x1");
        client = DefaultChainClient.builder(provider).pollInterval(Duration.ofMillis(10)).build();
        TransactionExecutor executor = TransactionExecutor.builder(client).expectedChainId(1L).build();

        Throwable cause = failure(executor.submit(transfer(), SENDER));

        assertInstanceOf(ConfigurationException.class, cause);
        assertEquals(0, provider.count("eth_sendRawTransaction"));
    }

    @Test
    void chainIdIsFetchedOnceButNonceEveryTime() throws Exception {
        FakeProvider provider = new FakeProvider().minesEverything("0x1", "0x1");
        TransactionExecutor executor = executor(provider);

        executor.submit(transfer(), SENDER).get(5, TimeUnit.SECONDS);
        executor.submit(transfer(), SENDER).get(5, TimeUnit.SECONDS);

        assertEquals(1, provider.count("eth_chainId"));
        assertEquals(2, provider.count("eth_getTransactionCount"));
    }

    @Test
    void fixedGasPriceStrategySkipsTheNode() throws Exception {
        FakeProvider provider = new FakeProvider().minesEverything("0x1", "0x1");
        client = DefaultChainClient.builder(provider).pollInterval(Duration.ofMillis(10)).build();
        TransactionExecutor executor = TransactionExecutor.builder(client)
                .gasPriceStrategy(GasPriceStrategy.fixed(Wei.gwei(7)))
                .build();

        executor.submit(transfer(), SENDER).get(5, TimeUnit.SECONDS);

        assertEquals(0, provider.count("eth_gasPrice"));
        SignedTransaction expected = SENDER.sign(transfer().withGas(0x5208).withGasPrice(Wei.gwei(7)).withNonce(7), 1);
        assertEquals(List.of(expected.raw().value()), provider.lastParams("eth_sendRawTransaction"));
    }

    @Test
    void cancelledHandleStopsBeforeBroadcast() throws Exception {
        CompletableFuture<Object> gate = new CompletableFuture<>();
        FakeProvider provider = new FakeProvider().minesEverything("0x1", "0x1");
        JasmineProvider gated = (method, params) -> {
            CompletableFuture<JsonRpcResponse> response = provider.sendAsync(method, params);
            return "eth_estimateGas".equals(method) ? gate.thenCompose(ignored -> response) : response;
        };
        TransactionExecutor executor = executor(gated);

        CompletableFuture<TransactionReceipt> handle = executor.submit(transfer(), SENDER);
        handle.cancel(false);
        gate.complete(null);

        assertTrue(handle.isCancelled());
        Thread.sleep(50);
        assertEquals(0, provider.count("eth_sendRawTransaction"));
    }

    private static Hash localHash(final FakeProvider provider) {
        return new Hash(FakeProvider.hashOfRaw((String) provider.lastParams("eth_sendRawTransaction").get(0)));
    }
}
