package com.tradingagent.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    CONFLICT("CONFLICT", 409),
    RISK_LIMIT_EXCEEDED("RISK_LIMIT_EXCEEDED", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    MARKET_DATA_ERROR("MARKET_DATA_ERROR", 502),
    BROKER_ERROR("BROKER_ERROR", 502);

    private final String code;
    private final int httpStatus;
}
