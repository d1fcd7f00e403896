package com.tradingagent.execution;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Data;

/** Order resource as returned by the Alpaca trading API. Quantities and prices arrive as strings. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlpacaOrder {

    private String id;
    private String symbol;
    private String side;
    private String status;
    private String qty;

    @JsonProperty("filled_qty")
    private String filledQty;

    @JsonProperty("filled_avg_price")
    private BigDecimal filledAvgPrice;

    @JsonProperty("filled_at")
    private Instant filledAt;
}
