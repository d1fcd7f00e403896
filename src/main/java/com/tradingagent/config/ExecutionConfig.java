package com.tradingagent.config;

import com.tradingagent.execution.AlpacaExecutionVenue;
import com.tradingagent.execution.ExecutionVenue;
import com.tradingagent.execution.SimulatedExecutionVenue;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Chooses the execution venue once at startup.
 *
 * <p>With brokerage credentials configured the service trades live through Alpaca; without them it
 * falls back to the simulated venue and says so in the log. The mode cannot change while running.
 */
@Configuration
public class ExecutionConfig {

    private static final Logger log = LoggerFactory.getLogger(ExecutionConfig.class);

    @Bean
    public ExecutionVenue executionVenue(
            BrokerConfig brokerConfig, TradingProperties tradingProperties, Clock clock) {
        if (!brokerConfig.hasCredentials()) {
            log.warn("No brokerage credentials configured (tradingagent.broker.api-key / secret-key). "
                    + "Running in SIMULATED mode: orders fill instantly at the decision price.");
            return new SimulatedExecutionVenue(tradingProperties.getPortfolioValue(), clock);
        }
        log.info("Brokerage credentials found for key {}. Running in LIVE mode against {}",
                maskKey(brokerConfig.getApiKey()), brokerConfig.getBaseUrl());
        return new AlpacaExecutionVenue(alpacaClient(brokerConfig, brokerConfig.getBaseUrl()));
    }

    static RestClient alpacaClient(BrokerConfig brokerConfig, String baseUrl) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) brokerConfig.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) brokerConfig.getReadTimeout().toMillis());
        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader("APCA-API-KEY-ID", brokerConfig.getApiKey())
                .defaultHeader("APCA-API-SECRET-KEY", brokerConfig.getSecretKey())
                .build();
    }

    private static String maskKey(String key) {
        if (key == null || key.length() < 4) {
            return "****";
        }
        return key.substring(0, 4) + "****";
    }
}
