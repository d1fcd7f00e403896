package com.tradingagent.marketdata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlpacaLatestTradeResponse {

    private String symbol;
    private LatestTrade trade;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LatestTrade {

        @JsonProperty("p")
        private BigDecimal price;
    }
}
