package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.TradingMode;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AccountSnapshot {

    TradingMode mode;
    BigDecimal cash;
    BigDecimal equity;
    BigDecimal buyingPower;
    String status;
}
