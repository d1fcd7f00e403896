package com.tradingagent.marketdata;

import com.tradingagent.domain.model.Bar;
import com.tradingagent.exception.MarketDataException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Daily bars and latest trades from the Alpaca market data REST API.
 *
 * <p>Bars for all symbols are fetched in one paged request series ({@code next_page_token}). The
 * {@link RestClient} carries the data base URL and authentication headers.
 */
public class AlpacaMarketDataSource implements MarketDataSource {

    private static final Logger log = LoggerFactory.getLogger(AlpacaMarketDataSource.class);

    private static final int PAGE_LIMIT = 10000;
    private static final int MAX_PAGES = 50;

    private final RestClient restClient;
    private final String feed;
    private final Clock clock;

    public AlpacaMarketDataSource(RestClient restClient, String feed, Clock clock) {
        this.restClient = restClient;
        this.feed = feed;
        this.clock = clock;
    }

    @Override
    @CircuitBreaker(name = "alpacaData")
    @Retry(name = "alpacaData")
    public Map<String, List<Bar>> getBars(List<String> symbols, int lookbackDays) {
        if (symbols.isEmpty()) {
            return Map.of();
        }
        String start = Instant.now(clock)
                .minus(Duration.ofDays(lookbackDays))
                .truncatedTo(ChronoUnit.SECONDS)
                .toString();
        Map<String, List<Bar>> collected = new HashMap<>();
        String pageToken = null;
        int pages = 0;
        try {
            do {
                String token = pageToken;
                AlpacaBarsResponse page = restClient
                        .get()
                        .uri(uri -> {
                            uri.path("/v2/stocks/bars")
                                    .queryParam("symbols", String.join(",", symbols))
                                    .queryParam("timeframe", "1Day")
                                    .queryParam("start", start)
                                    .queryParam("limit", PAGE_LIMIT)
                                    .queryParam("adjustment", "raw")
                                    .queryParam("feed", feed);
                            if (token != null) {
                                uri.queryParam("page_token", token);
                            }
                            return uri.build();
                        })
                        .retrieve()
                        .body(AlpacaBarsResponse.class);
                if (page == null) {
                    break;
                }
                if (page.getBars() != null) {
                    page.getBars().forEach((symbol, bars) -> collected
                            .computeIfAbsent(symbol, s -> new ArrayList<>())
                            .addAll(bars.stream().map(AlpacaMarketDataSource::toBar).toList()));
                }
                pageToken = page.getNextPageToken();
                pages++;
            } while (pageToken != null && pages < MAX_PAGES);
        } catch (RestClientException e) {
            log.error("Failed to fetch bars for {}: {}", symbols, e.getMessage());
            throw new MarketDataException("Failed to fetch bars: " + e.getMessage(), e);
        }

        Map<String, List<Bar>> result = new LinkedHashMap<>();
        for (String symbol : symbols) {
            List<Bar> bars = collected.get(symbol);
            if (bars == null || bars.isEmpty()) {
                log.warn("No bars returned for {}", symbol);
                continue;
            }
            bars.sort(Comparator.comparing(Bar::getTimestamp));
            result.put(symbol, List.copyOf(bars));
        }
        log.debug("Fetched bars for {}/{} symbols over {} days", result.size(), symbols.size(), lookbackDays);
        return result;
    }

    @Override
    @CircuitBreaker(name = "alpacaData")
    @Retry(name = "alpacaData")
    public Optional<BigDecimal> getLatestPrice(String symbol) {
        try {
            AlpacaLatestTradeResponse response = restClient
                    .get()
                    .uri(uri -> uri.path("/v2/stocks/{symbol}/trades/latest")
                            .queryParam("feed", feed)
                            .build(symbol))
                    .retrieve()
                    .body(AlpacaLatestTradeResponse.class);
            if (response == null || response.getTrade() == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(response.getTrade().getPrice());
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        } catch (RestClientException e) {
            log.error("Failed to fetch latest price for {}: {}", symbol, e.getMessage());
            throw new MarketDataException("Failed to fetch latest price for " + symbol + ": " + e.getMessage(), e);
        }
    }

    private static Bar toBar(AlpacaBarsResponse.AlpacaBar bar) {
        return Bar.builder()
                .timestamp(bar.getTimestamp())
                .open(bar.getOpen())
                .high(bar.getHigh())
                .low(bar.getLow())
                .close(bar.getClose())
                .volume(bar.getVolume())
                .build();
    }
}
