package com.tradingagent.execution;

import com.tradingagent.domain.enums.OrderSide;
import com.tradingagent.domain.enums.OrderStatus;
import com.tradingagent.domain.enums.OrderType;
import com.tradingagent.domain.enums.TradingMode;
import com.tradingagent.domain.model.AccountSnapshot;
import com.tradingagent.domain.model.OrderAck;
import com.tradingagent.domain.model.OrderRequest;
import com.tradingagent.domain.model.OrderState;
import com.tradingagent.exception.BrokerException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Live venue backed by the Alpaca trading REST API.
 *
 * <p>The {@link RestClient} arrives with base URL and authentication headers already applied (see
 * {@code ExecutionConfig}). Reads are retried; order submission is not, since a retried POST could
 * double an order.
 */
public class AlpacaExecutionVenue implements ExecutionVenue {

    private static final Logger log = LoggerFactory.getLogger(AlpacaExecutionVenue.class);

    private final RestClient restClient;

    public AlpacaExecutionVenue(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public TradingMode getMode() {
        return TradingMode.LIVE;
    }

    /**
     * Submits a day order.
     *
     * @throws BrokerException if Alpaca rejects the order or the call fails
     */
    @Override
    @CircuitBreaker(name = "alpacaApi")
    public OrderAck placeOrder(OrderRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("symbol", request.getSymbol());
        body.put("qty", String.valueOf(request.getQuantity()));
        body.put("side", sideParam(request.getSide()));
        body.put("type", request.getType().name().toLowerCase(Locale.ROOT));
        body.put("time_in_force", "day");
        if (request.getType() == OrderType.LIMIT && request.getLimitPrice() != null) {
            body.put("limit_price", request.getLimitPrice().toPlainString());
        }

        try {
            AlpacaOrder order = restClient
                    .post()
                    .uri("/v2/orders")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(AlpacaOrder.class);
            if (order == null || order.getId() == null) {
                throw new BrokerException("Empty order response for " + request.getSymbol());
            }
            log.info(
                    "Order placed: orderId={} symbol={} side={} qty={} status={}",
                    order.getId(),
                    request.getSymbol(),
                    request.getSide(),
                    request.getQuantity(),
                    order.getStatus());
            return OrderAck.builder()
                    .orderId(order.getId())
                    .symbol(request.getSymbol())
                    .side(request.getSide())
                    .quantity(request.getQuantity())
                    .status(mapStatus(order.getStatus()))
                    .build();
        } catch (RestClientException e) {
            log.error("Order placement failed for {}: {}", request.getSymbol(), e.getMessage());
            throw new BrokerException("Order placement failed: " + e.getMessage(), e);
        }
    }

    @Override
    @CircuitBreaker(name = "alpacaApi")
    @Retry(name = "alpacaApi")
    public OrderState getOrder(String orderId) {
        try {
            AlpacaOrder order =
                    restClient.get().uri("/v2/orders/{id}", orderId).retrieve().body(AlpacaOrder.class);
            if (order == null) {
                throw new BrokerException("Empty order response for " + orderId);
            }
            return OrderState.builder()
                    .orderId(order.getId())
                    .status(mapStatus(order.getStatus()))
                    .filledPrice(order.getFilledAvgPrice())
                    .filledQuantity(parseQuantity(order.getFilledQty()))
                    .filledAt(order.getFilledAt())
                    .build();
        } catch (RestClientException e) {
            log.error("Failed to fetch order {}: {}", orderId, e.getMessage());
            throw new BrokerException("Failed to fetch order " + orderId + ": " + e.getMessage(), e);
        }
    }

    @Override
    @CircuitBreaker(name = "alpacaApi")
    @Retry(name = "alpacaApi")
    public AccountSnapshot getAccount() {
        try {
            AlpacaAccount account = restClient.get().uri("/v2/account").retrieve().body(AlpacaAccount.class);
            if (account == null) {
                throw new BrokerException("Empty account response");
            }
            return AccountSnapshot.builder()
                    .mode(TradingMode.LIVE)
                    .cash(account.getCash())
                    .equity(account.getEquity())
                    .buyingPower(account.getBuyingPower())
                    .status(account.getStatus())
                    .build();
        } catch (RestClientException e) {
            log.error("Failed to fetch account: {}", e.getMessage());
            throw new BrokerException("Failed to fetch account: " + e.getMessage(), e);
        }
    }

    @Override
    @CircuitBreaker(name = "alpacaApi")
    public int cancelAllOrders() {
        try {
            List<Map<String, Object>> cancelled = restClient
                    .delete()
                    .uri("/v2/orders")
                    .retrieve()
                    .body(new ParameterizedTypeReference<List<Map<String, Object>>>() {});
            int count = cancelled != null ? cancelled.size() : 0;
            log.info("Cancelled {} open orders", count);
            return count;
        } catch (RestClientException e) {
            log.error("Cancel all orders failed: {}", e.getMessage());
            throw new BrokerException("Cancel all orders failed: " + e.getMessage(), e);
        }
    }

    static OrderStatus mapStatus(String status) {
        if (status == null) {
            return OrderStatus.NEW;
        }
        switch (status.toLowerCase(Locale.ROOT)) {
            case "filled":
                return OrderStatus.FILLED;
            case "partially_filled":
                return OrderStatus.PARTIALLY_FILLED;
            case "canceled":
            case "cancelled":
                return OrderStatus.CANCELLED;
            case "expired":
            case "done_for_day":
                return OrderStatus.EXPIRED;
            case "rejected":
            case "suspended":
                return OrderStatus.REJECTED;
            default:
                return OrderStatus.NEW;
        }
    }

    private static int parseQuantity(String quantity) {
        if (quantity == null || quantity.isBlank()) {
            return 0;
        }
        return new BigDecimal(quantity).intValue();
    }

    private static String sideParam(OrderSide side) {
        return side.name().toLowerCase(Locale.ROOT);
    }
}
