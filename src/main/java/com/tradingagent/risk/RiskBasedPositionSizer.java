package com.tradingagent.risk;

import com.tradingagent.domain.model.PositionSizing;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sizes a position so the loss at the stop is at most {@code maxRiskFraction} of the portfolio.
 *
 * <p>Formula: shares = floor(portfolioValue * maxRiskFraction / |entry - stop|). For example, with a
 * 10,000 portfolio, 2% risk, entry 250 and stop 245 the raw size is 40 shares.
 *
 * <p>The raw size is then capped so the notional stays within {@code maxPositionFraction} of the
 * portfolio (40 shares at 250 is 10,000, above the 2,000 cap, so 8 shares). Only after the cap is a
 * high-volatility symbol's size scaled down by {@code volatilitySizeFactor}. A size that rounds to zero
 * shares is rejected.
 */
@Component
public class RiskBasedPositionSizer {

    private static final Logger log = LoggerFactory.getLogger(RiskBasedPositionSizer.class);

    private static final BigDecimal MAX_SHARES = BigDecimal.valueOf(Integer.MAX_VALUE);

    private final RiskProperties riskProperties;

    public RiskBasedPositionSizer(RiskProperties riskProperties) {
        this.riskProperties = riskProperties;
    }

    public PositionSizing size(
            BigDecimal entryPrice, BigDecimal stopLoss, BigDecimal portfolioValue, boolean highVolatility) {
        if (entryPrice == null || stopLoss == null) {
            return PositionSizing.rejected("Missing entry or stop price");
        }
        if (entryPrice.signum() <= 0 || portfolioValue == null || portfolioValue.signum() <= 0) {
            return PositionSizing.rejected("Invalid entry price or portfolio value");
        }

        BigDecimal riskPerShare = entryPrice.subtract(stopLoss).abs();
        if (riskPerShare.signum() == 0) {
            return PositionSizing.rejected("Invalid stop loss: no risk per share");
        }

        BigDecimal maxRisk = portfolioValue.multiply(riskProperties.getMaxRiskFraction());
        BigDecimal riskShares = maxRisk.divide(riskPerShare, 0, RoundingMode.DOWN);

        BigDecimal maxPositionValue = portfolioValue.multiply(riskProperties.getMaxPositionFraction());
        BigDecimal capShares = maxPositionValue.divide(entryPrice, 0, RoundingMode.DOWN);

        // Share counts stay in BigDecimal until capped so large portfolios cannot overflow an int.
        BigDecimal shares = riskShares.min(capShares);
        if (highVolatility) {
            shares = shares.multiply(riskProperties.getVolatilitySizeFactor()).setScale(0, RoundingMode.DOWN);
        }

        if (shares.signum() <= 0) {
            return PositionSizing.rejected("Position too small: zero shares within risk limits");
        }
        if (shares.compareTo(MAX_SHARES) > 0) {
            return PositionSizing.rejected("Position too large: " + shares.toPlainString() + " shares exceeds "
                    + MAX_SHARES.toPlainString());
        }

        int quantity = shares.intValueExact();
        BigDecimal qty = BigDecimal.valueOf(quantity);
        BigDecimal positionValue = entryPrice.multiply(qty).setScale(2, RoundingMode.HALF_UP);
        BigDecimal riskAmount = riskPerShare.multiply(qty).setScale(2, RoundingMode.HALF_UP);

        log.debug(
                "Risk sizing: risk/share={} maxRisk={} cap={} highVol={} -> {} shares ({})",
                riskPerShare,
                maxRisk,
                maxPositionValue,
                highVolatility,
                quantity,
                positionValue);

        return PositionSizing.builder()
                .quantity(quantity)
                .positionValue(positionValue)
                .riskPerShare(riskPerShare)
                .riskAmount(riskAmount)
                .riskFraction(riskAmount.divide(portfolioValue, 6, RoundingMode.HALF_UP).doubleValue())
                .positionFraction(positionValue.divide(portfolioValue, 6, RoundingMode.HALF_UP).doubleValue())
                .approved(true)
                .reason("Position sized within risk limits")
                .build();
    }
}
