package com.tradingagent.marketdata;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Properties prefix: {@code tradingagent.market-data.*}. {@code provider} is {@code csv} (files named
 * {@code SYMBOL.csv} under {@code csvDirectory}) or {@code alpaca}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "tradingagent.market-data")
public class MarketDataProperties {

    private String provider = "csv";
    private String csvDirectory = "data";
    private String alpacaFeed = "iex";
}
