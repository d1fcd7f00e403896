package com.tradingagent.domain.model;

import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of the ordered pre-trade checklist. {@code validations} lists the checks that passed, in
 * order, so a rejection shows how far the candidate got.
 */
@Getter
@ToString
public class TradeValidation {

    private final boolean approved;
    private final String reason;
    private final List<String> validations;
    private final PositionSizing sizing;

    private TradeValidation(boolean approved, String reason, List<String> validations, PositionSizing sizing) {
        this.approved = approved;
        this.reason = reason;
        this.validations = List.copyOf(validations);
        this.sizing = sizing;
    }

    public static TradeValidation approved(List<String> validations, PositionSizing sizing) {
        return new TradeValidation(true, "All risk checks passed", validations, sizing);
    }

    public static TradeValidation rejected(String reason, List<String> validations, PositionSizing sizing) {
        return new TradeValidation(false, reason, validations, sizing);
    }

    public boolean isRejected() {
        return !approved;
    }
}
