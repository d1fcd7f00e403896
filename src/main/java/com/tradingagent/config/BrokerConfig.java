package com.tradingagent.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Brokerage connection settings, bound to {@code tradingagent.broker.*}.
 *
 * <p>Blank credentials are not an error: the service then trades against the simulated venue (see
 * {@link ExecutionConfig}). The fill-poll settings bound how long a live entry or exit waits for
 * confirmation before it is left for reconciliation.
 */
@Configuration
@ConfigurationProperties(prefix = "tradingagent.broker")
@Getter
@Setter
public class BrokerConfig {

    /** Alpaca API key id. */
    private String apiKey;

    /** Alpaca API secret key. */
    private String secretKey;

    /** Trading API base URL (paper by default). */
    private String baseUrl = "https://paper-api.alpaca.markets";

    /** Market data API base URL. */
    private String dataUrl = "https://data.alpaca.markets";

    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(15);

    /** Number of order-status polls after submission, including the first. */
    private int fillPollAttempts = 5;

    /** Delay before the second poll; later delays grow by {@link #fillPollMultiplier}. */
    private Duration fillPollInitialDelay = Duration.ofMillis(500);

    private double fillPollMultiplier = 2.0;

    public boolean hasCredentials() {
        return apiKey != null && !apiKey.isBlank() && secretKey != null && !secretKey.isBlank();
    }
}
