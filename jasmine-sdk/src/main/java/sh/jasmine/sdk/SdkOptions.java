// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.sdk;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.jasmine.contract.ContractArtifacts;
import sh.jasmine.rpc.DefaultChainClient;
import sh.jasmine.rpc.GasPriceStrategy;
import sh.jasmine.rpc.RpcConfig;

/**
 * Settings for {@link JasmineSdk#connect(String, SdkOptions)}.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * var options = SdkOptions.builder()
 *     .readTimeout(Duration.ofSeconds(10))
 *     .gasPriceStrategy(GasPriceStrategy.scaled(110, 100))
 *     .confirmationTimeout(Duration.ofMinutes(2))
 *     .expectedChainId(11155111L)
 *     .build();
 * }</pre>
 */
public final class SdkOptions {

    private static final SdkOptions DEFAULTS = builder().build();

    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final Map<String, String> headers;
    private final GasPriceStrategy gasPriceStrategy;
    private final Duration pollInterval;
    private final @Nullable Duration confirmationTimeout;
    private final @Nullable Long expectedChainId;
    private final ContractArtifacts artifacts;

    private SdkOptions(final Builder builder) {
        this.connectTimeout = builder.connectTimeout;
        this.readTimeout = builder.readTimeout;
        this.headers = Map.copyOf(builder.headers);
        this.gasPriceStrategy = builder.gasPriceStrategy;
        this.pollInterval = builder.pollInterval;
        this.confirmationTimeout = builder.confirmationTimeout;
        this.expectedChainId = builder.expectedChainId;
        this.artifacts = builder.artifacts != null ? builder.artifacts : ContractArtifacts.classpath();
    }

    /**
     * Returns options with every default: 10 s connect and 30 s read timeouts,
     * the node's gas price, 500 ms receipt polling and no confirmation
     * deadline.
     */
    public static SdkOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public Duration readTimeout() {
        return readTimeout;
    }

    /** Extra headers sent with every HTTP request and the WebSocket handshake. */
    public Map<String, String> headers() {
        return headers;
    }

    public GasPriceStrategy gasPriceStrategy() {
        return gasPriceStrategy;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public @Nullable Duration confirmationTimeout() {
        return confirmationTimeout;
    }

    public @Nullable Long expectedChainId() {
        return expectedChainId;
    }

    public ContractArtifacts artifacts() {
        return artifacts;
    }

    RpcConfig rpcConfig(final String url) {
        return new RpcConfig(url, connectTimeout, readTimeout, headers);
    }

    public static final class Builder {
        private Duration connectTimeout = RpcConfig.DEFAULT_CONNECT_TIMEOUT;
        private Duration readTimeout = RpcConfig.DEFAULT_READ_TIMEOUT;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private GasPriceStrategy gasPriceStrategy = GasPriceStrategy.rpc();
        private Duration pollInterval = DefaultChainClient.DEFAULT_POLL_INTERVAL;
        private @Nullable Duration confirmationTimeout;
        private @Nullable Long expectedChainId;
        private @Nullable ContractArtifacts artifacts;

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if the timeout is not positive
         */
        public Builder connectTimeout(final Duration connectTimeout) {
            this.connectTimeout = positive(connectTimeout, "connectTimeout");
            return this;
        }

        /**
         * Sets how long a single JSON-RPC request may take.
         *
         * @throws IllegalArgumentException if the timeout is not positive
         */
        public Builder readTimeout(final Duration readTimeout) {
            this.readTimeout = positive(readTimeout, "readTimeout");
            return this;
        }

        public Builder header(final String name, final String value) {
            headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder gasPriceStrategy(final GasPriceStrategy gasPriceStrategy) {
            this.gasPriceStrategy = Objects.requireNonNull(gasPriceStrategy, "gasPriceStrategy");
            return this;
        }

        /**
         * Sets the delay between receipt polls.
         *
         * @throws IllegalArgumentException if the interval is not positive
         */
        public Builder pollInterval(final Duration pollInterval) {
            this.pollInterval = positive(pollInterval, "pollInterval");
            return this;
        }

        /**
         * Bounds how long a transaction may stay unmined after broadcast.
         * {@code null}, the default, waits indefinitely.
         */
        public Builder confirmationTimeout(final @Nullable Duration confirmationTimeout) {
            this.confirmationTimeout = confirmationTimeout == null
                    ? null
                    : positive(confirmationTimeout, "confirmationTimeout");
            return this;
        }

        /**
         * Refuses to sign for any chain other than {@code expectedChainId}.
         */
        public Builder expectedChainId(final @Nullable Long expectedChainId) {
            this.expectedChainId = expectedChainId;
            return this;
        }

        /** Replaces the classpath artifact source used for deployment and bindings. */
        public Builder artifacts(final ContractArtifacts artifacts) {
            this.artifacts = Objects.requireNonNull(artifacts, "artifacts");
            return this;
        }

        public SdkOptions build() {
            return new SdkOptions(this);
        }

        private static Duration positive(final Duration value, final String name) {
            Objects.requireNonNull(value, name);
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
