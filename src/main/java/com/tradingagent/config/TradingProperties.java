package com.tradingagent.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Top-level trading parameters, loaded from application.properties.
 *
 * <p>Properties prefix: {@code tradingagent.*}. {@code portfolioValue} seeds the risk state; in live
 * mode it is replaced by account equity at the start of each cycle.
 */
@Data
@Component
@ConfigurationProperties(prefix = "tradingagent")
public class TradingProperties {

    private List<String> universe = new ArrayList<>();
    private int lookbackDays = 100;
    private BigDecimal portfolioValue = new BigDecimal("10000");
}
