package com.tradingagent.execution;

import com.tradingagent.config.BrokerConfig;
import com.tradingagent.domain.model.OrderState;
import com.tradingagent.exception.BrokerException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Polls the venue for an order's fill with bounded exponential backoff.
 *
 * <p>Polling stops as soon as the order reaches a terminal status. If it is still working after
 * {@code fillPollAttempts} polls, the last observed state is returned and the caller books the order as
 * unconfirmed for the next cycle's reconciliation. Total wait is bounded by
 * {@code initialDelay * (multiplier^(attempts-1) - 1) / (multiplier - 1)}.
 */
@Component
public class OrderFillPoller {

    private static final Logger log = LoggerFactory.getLogger(OrderFillPoller.class);

    private final Retry retry;

    public OrderFillPoller(BrokerConfig brokerConfig, RetryRegistry retryRegistry) {
        RetryConfig config = RetryConfig.<OrderState>custom()
                .maxAttempts(Math.max(1, brokerConfig.getFillPollAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        brokerConfig.getFillPollInitialDelay(),
                        brokerConfig.getFillPollMultiplier()))
                .retryOnResult(state -> !state.getStatus().isTerminal())
                .retryExceptions(BrokerException.class)
                .build();
        this.retry = retryRegistry.retry("orderFill", config);
    }

    /**
     * Waits for {@code orderId} to reach a terminal status.
     *
     * @return the last observed state, which may still be working if the poll window ran out
     * @throws BrokerException if every poll failed
     */
    public OrderState awaitFill(ExecutionVenue venue, String orderId) {
        OrderState state = Retry.decorateSupplier(retry, () -> venue.getOrder(orderId)).get();
        if (!state.getStatus().isTerminal()) {
            log.warn("Order {} still {} after fill polling; leaving unconfirmed", orderId, state.getStatus());
        }
        return state;
    }
}
