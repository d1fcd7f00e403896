package com.tradingagent.execution;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlpacaAccount {

    private String status;
    private BigDecimal cash;
    private BigDecimal equity;

    @JsonProperty("buying_power")
    private BigDecimal buyingPower;
}
