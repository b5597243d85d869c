// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.sdk;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.jasmine.contract.ContractAbi;
import sh.jasmine.contract.ContractArtifacts;
import sh.jasmine.contract.ManagerContract;
import sh.jasmine.contract.TokenContract;
import sh.jasmine.core.crypto.Account;
import sh.jasmine.core.crypto.TransactionSigner;
import sh.jasmine.core.error.ConfigurationException;
import sh.jasmine.core.error.ConfirmationFailedException;
import sh.jasmine.core.error.JasmineException;
import sh.jasmine.core.model.TransactionIntent;
import sh.jasmine.core.model.TransactionReceipt;
import sh.jasmine.core.types.Address;
import sh.jasmine.core.types.HexData;
import sh.jasmine.core.types.Wei;
import sh.jasmine.rpc.ChainClient;
import sh.jasmine.rpc.DefaultChainClient;
import sh.jasmine.rpc.HttpJasmineProvider;
import sh.jasmine.rpc.JasmineProvider;
import sh.jasmine.rpc.TransactionExecutor;
import sh.jasmine.rpc.WebSocketJasmineProvider;
import sh.jasmine.rpc.internal.RpcUtils;

/**
 * Entry point of the SDK: one connection to an Ethereum node plus the
 * operations applications need on top of it.
 *
 * <p>
 * Accounts, native transfers, deployment of the TFC contracts and bindings to
 * deployed ones are all served from the same {@link ChainClient} and
 * {@link TransactionExecutor}. The instance is thread-safe; close it to
 * release the connection and the receipt poller.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * try (JasmineSdk sdk = JasmineSdk.connect("https://rpc.sepolia.org")) {
 *     Account alice = sdk.retrieveAccount(System.getenv("ALICE_KEY"));
 *     Wei balance = sdk.balanceOf(alice.address());
 *     TransactionReceipt receipt = sdk.transfer(bob, JasmineSdk.ethToWei(new BigDecimal("0.1")), alice).join();
 * }
 * }</pre>
 */
public final class JasmineSdk implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(JasmineSdk.class);

    private final ChainClient client;
    private final TransactionExecutor executor;
    private final ContractArtifacts artifacts;

    private JasmineSdk(final ChainClient client, final SdkOptions options) {
        this.client = Objects.requireNonNull(client, "client");
        this.executor = TransactionExecutor.builder(client)
                .gasPriceStrategy(options.gasPriceStrategy())
                .expectedChainId(options.expectedChainId())
                .build();
        this.artifacts = options.artifacts();
    }

    public static JasmineSdk connect(final String endpoint) {
        return connect(endpoint, SdkOptions.defaults());
    }

    /**
     * Connects to a node. The scheme selects the transport: {@code http} and
     * {@code https} use JSON-RPC over HTTP, {@code ws} and {@code wss} open a
     * WebSocket.
     *
     * @param endpoint the node URL; surrounding whitespace is ignored
     * @param options  timeouts, gas pricing and confirmation settings
     * @return the connected SDK
     * @throws ConfigurationException if the endpoint is blank, malformed or uses
     *                                another scheme
     * @throws sh.jasmine.core.error.TransportException if a WebSocket endpoint
     *                                                  cannot be reached
     */
    public static JasmineSdk connect(final String endpoint, final SdkOptions options) {
        Objects.requireNonNull(options, "options");
        final String url = endpoint == null ? "" : endpoint.strip();
        final String scheme = scheme(url);

        final JasmineProvider provider;
        if ("http".equals(scheme) || "https".equals(scheme)) {
            provider = HttpJasmineProvider.builder(url)
                    .connectTimeout(options.connectTimeout())
                    .readTimeout(options.readTimeout())
                    .headers(options.headers())
                    .build();
        } else if ("ws".equals(scheme) || "wss".equals(scheme)) {
            provider = WebSocketJasmineProvider.connect(options.rpcConfig(url));
        } else {
            throw new ConfigurationException("unsupported Ethereum endpoint: " + redact(url));
        }
        LOG.debug("Connected to {} node at {}", scheme, redact(url));

        final DefaultChainClient client = DefaultChainClient.builder(provider)
                .pollInterval(options.pollInterval())
                .confirmationTimeout(options.confirmationTimeout())
                .build();
        return new JasmineSdk(client, options);
    }

    /**
     * Wraps an existing client, for custom transports and tests. Closing the
     * SDK closes {@code client}.
     */
    public static JasmineSdk create(final ChainClient client, final SdkOptions options) {
        return new JasmineSdk(client, Objects.requireNonNull(options, "options"));
    }

    public ChainClient client() {
        return client;
    }

    public TransactionExecutor executor() {
        return executor;
    }

    /** Generates a new account from a secure random key. Nothing is persisted. */
    public Account createAccount() {
        return Account.create();
    }

    /**
     * Restores an account from its private key.
     *
     * @param privateKeyHex 32-byte key as hex, with or without {@code 0x}
     * @throws ConfigurationException if the key is malformed
     */
    public Account retrieveAccount(final String privateKeyHex) {
        return Account.fromPrivateKey(privateKeyHex);
    }

    /**
     * Returns the native balance of {@code address} at the latest block.
     *
     * @throws JasmineException the typed failure of the lookup
     */
    public Wei balanceOf(final Address address) {
        return RpcUtils.await(balanceOfAsync(address), "balance lookup");
    }

    public CompletableFuture<Wei> balanceOfAsync(final Address address) {
        return client.getBalance(Objects.requireNonNull(address, "address"));
    }

    /**
     * Sends {@code amount} of the native currency from {@code sender} to
     * {@code recipient}.
     *
     * @return a future completing with the receipt once the transfer is mined
     */
    public CompletableFuture<TransactionReceipt> transfer(
            final Address recipient, final Wei amount, final TransactionSigner sender) {
        Objects.requireNonNull(recipient, "recipient");
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(sender, "sender");
        final TransactionIntent intent = TransactionIntent.builder(sender.address())
                .to(recipient)
                .value(amount)
                .build();
        return executor.submit(intent, sender);
    }

    /** Converts wei to ether exactly, at scale 18. */
    public static BigDecimal weiToEth(final Wei amount) {
        return Objects.requireNonNull(amount, "amount").toEther();
    }

    /**
     * Converts ether to wei. Digits below one wei are dropped, rounding toward
     * zero.
     *
     * @throws ConfigurationException if {@code amount} is negative
     */
    public static Wei ethToWei(final BigDecimal amount) {
        Objects.requireNonNull(amount, "amount");
        if (amount.signum() < 0) {
            throw new ConfigurationException("ether amount must not be negative: " + amount);
        }
        return Wei.fromEther(amount);
    }

    /**
     * Deploys a TFC manager from the {@value ContractArtifacts#TFC_MANAGER}
     * artifacts.
     *
     * @return a future completing with the new contract's address
     */
    public CompletableFuture<Address> deployTfcManager(final TransactionSigner deployer) {
        return deploy(ContractArtifacts.TFC_MANAGER, deployer);
    }

    /**
     * Deploys a standalone TFC token from the {@value ContractArtifacts#TFC_TOKEN}
     * artifacts.
     */
    public CompletableFuture<Address> deployTfcToken(final TransactionSigner deployer) {
        return deploy(ContractArtifacts.TFC_TOKEN, deployer);
    }

    public ManagerContract getTfcManager(final Address address) {
        return ManagerContract.at(address, executor, artifacts);
    }

    public TokenContract getTfcToken(final Address address) {
        return TokenContract.at(address, executor, artifacts);
    }

    @Override
    public void close() {
        client.close();
    }

    private CompletableFuture<Address> deploy(final String contract, final TransactionSigner deployer) {
        Objects.requireNonNull(deployer, "deployer");
        final HexData initCode;
        try {
            final ContractAbi abi = artifacts.abi(contract);
            initCode = concat(artifacts.bytecode(contract), abi.encodeConstructor());
        } catch (JasmineException e) {
            return CompletableFuture.failedFuture(e);
        }
        final TransactionIntent intent = TransactionIntent.builder(deployer.address())
                .data(initCode)
                .build();
        LOG.debug("Deploying {} from {}", contract, deployer.address());
        return executor.submit(intent, deployer).thenApply(receipt -> receipt.contractAddressOpt()
                .orElseThrow(() -> new ConfirmationFailedException(
                        "receipt of " + contract + " deployment has no contract address",
                        receipt.transactionHash(), receipt, null)));
    }

    private static HexData concat(final HexData code, final HexData args) {
        if (args.isEmpty()) {
            return code;
        }
        final byte[] a = code.toBytes();
        final byte[] b = args.toBytes();
        final byte[] out = new byte[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return HexData.fromBytes(out);
    }

    private static String scheme(final String url) {
        if (url.isEmpty()) {
            throw new ConfigurationException("unsupported Ethereum endpoint: endpoint is blank");
        }
        try {
            final String scheme = new URI(url).getScheme();
            return scheme == null ? "" : scheme.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            throw new ConfigurationException("unsupported Ethereum endpoint: " + redact(url), e);
        }
    }

    // node URLs often embed an API key in the path or query
    private static String redact(final String url) {
        final URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            return truncate(url);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            return truncate(url);
        }
        return uri.getScheme() + "://" + uri.getHost() + (uri.getPort() >= 0 ? ":" + uri.getPort() : "");
    }

    private static String truncate(final String url) {
        return url.length() > 16 ? url.substring(0, 16) + "..." : url;
    }
}
