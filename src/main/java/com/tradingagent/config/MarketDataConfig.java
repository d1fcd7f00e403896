package com.tradingagent.config;

import com.tradingagent.marketdata.AlpacaMarketDataSource;
import com.tradingagent.marketdata.CsvMarketDataSource;
import com.tradingagent.marketdata.MarketDataProperties;
import com.tradingagent.marketdata.MarketDataSource;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Picks the market data source from {@code tradingagent.market-data.provider}. Asking for Alpaca data
 * without credentials falls back to CSV files with a warning.
 */
@Configuration
public class MarketDataConfig {

    private static final Logger log = LoggerFactory.getLogger(MarketDataConfig.class);

    @Bean
    public MarketDataSource marketDataSource(
            MarketDataProperties marketDataProperties, BrokerConfig brokerConfig, Clock clock) {
        if ("alpaca".equalsIgnoreCase(marketDataProperties.getProvider())) {
            if (brokerConfig.hasCredentials()) {
                log.info(
                        "Market data from Alpaca ({}), feed {}",
                        brokerConfig.getDataUrl(),
                        marketDataProperties.getAlpacaFeed());
                return new AlpacaMarketDataSource(
                        ExecutionConfig.alpacaClient(brokerConfig, brokerConfig.getDataUrl()),
                        marketDataProperties.getAlpacaFeed(),
                        clock);
            }
            log.warn("Alpaca market data requested but no credentials configured; using CSV files instead");
        }
        Path directory = Path.of(marketDataProperties.getCsvDirectory());
        log.info("Market data from CSV files in {}", directory.toAbsolutePath());
        return new CsvMarketDataSource(directory);
    }
}
