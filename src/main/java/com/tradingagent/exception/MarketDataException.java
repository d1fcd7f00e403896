package com.tradingagent.exception;

/** The market data source could not be reached or returned unusable data. Aborts the current cycle. */
public class MarketDataException extends BaseException {

    public MarketDataException(String message) {
        super(ErrorCode.MARKET_DATA_ERROR, message);
    }

    public MarketDataException(String message, Throwable cause) {
        super(ErrorCode.MARKET_DATA_ERROR, message, cause);
    }
}
