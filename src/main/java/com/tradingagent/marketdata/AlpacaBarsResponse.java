package com.tradingagent.marketdata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Data;

/** Multi-symbol bars page from the Alpaca market data API. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlpacaBarsResponse {

    private Map<String, List<AlpacaBar>> bars;

    @JsonProperty("next_page_token")
    private String nextPageToken;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AlpacaBar {

        @JsonProperty("t")
        private Instant timestamp;

        @JsonProperty("o")
        private BigDecimal open;

        @JsonProperty("h")
        private BigDecimal high;

        @JsonProperty("l")
        private BigDecimal low;

        @JsonProperty("c")
        private BigDecimal close;

        @JsonProperty("v")
        private long volume;
    }
}
