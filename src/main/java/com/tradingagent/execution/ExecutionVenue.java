package com.tradingagent.execution;

import com.tradingagent.domain.enums.TradingMode;
import com.tradingagent.domain.model.AccountSnapshot;
import com.tradingagent.domain.model.OrderAck;
import com.tradingagent.domain.model.OrderRequest;
import com.tradingagent.domain.model.OrderState;

/**
 * Where orders go. One implementation fills in-process, the other talks to a brokerage.
 *
 * <p>All methods signal venue failures with {@link com.tradingagent.exception.BrokerException}.
 */
public interface ExecutionVenue {

    TradingMode getMode();

    /**
     * Submits an order.
     *
     * @return the venue's order id and initial status
     * @throws com.tradingagent.exception.BrokerException if the order is rejected or the call fails
     */
    OrderAck placeOrder(OrderRequest request);

    /**
     * Looks up an order's current status and fill details.
     *
     * @throws com.tradingagent.exception.BrokerException if the order is unknown or the call fails
     */
    OrderState getOrder(String orderId);

    AccountSnapshot getAccount();

    /** Cancels every working order. Returns how many cancellations the venue acknowledged. */
    int cancelAllOrders();
}
