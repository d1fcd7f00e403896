package com.tradingagent.unit.marketdata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.tradingagent.domain.model.Bar;
import com.tradingagent.exception.MarketDataException;
import com.tradingagent.marketdata.AlpacaMarketDataSource;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class AlpacaMarketDataSourceTest {

    private static final String DATA_URL = "https://data.alpaca.markets";
    private static final Instant NOW = Instant.parse("2024-06-03T15:00:00Z");

    private MockRestServiceServer server;
    private AlpacaMarketDataSource source;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(DATA_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        source = new AlpacaMarketDataSource(builder.build(), "iex", Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static String bar(String date, double close, long volume) {
        return String.format(
                "{\"t\":\"%sT04:00:00Z\",\"o\":%s,\"h\":%s,\"l\":%s,\"c\":%s,\"v\":%d}",
                date, close, close, close, close, volume);
    }

    @Test
    @DisplayName("Follows page tokens and returns each symbol's bars oldest first")
    void pagedBars() {
        server.expect(requestTo(startsWith(DATA_URL + "/v2/stocks/bars")))
                .andExpect(queryParam("symbols", "AAPL,MSFT,GOOGL"))
                .andExpect(queryParam("timeframe", "1Day"))
                .andExpect(queryParam("start", "2024-02-24T15:00:00Z"))
                .andExpect(queryParam("feed", "iex"))
                .andRespond(withSuccess(
                        "{\"bars\":{\"AAPL\":[" + bar("2024-05-31", 191.5, 1000) + "," + bar("2024-05-30", 190.0, 900)
                                + "]},\"next_page_token\":\"page-2\"}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(DATA_URL + "/v2/stocks/bars")))
                .andExpect(queryParam("page_token", "page-2"))
                .andRespond(withSuccess(
                        "{\"bars\":{\"AAPL\":[" + bar("2024-05-29", 189.0, 800) + "],\"MSFT\":["
                                + bar("2024-05-31", 415.0, 500) + "]},\"next_page_token\":null}",
                        MediaType.APPLICATION_JSON));

        Map<String, List<Bar>> bars = source.getBars(List.of("AAPL", "MSFT", "GOOGL"), 100);

        assertThat(bars).containsOnlyKeys("AAPL", "MSFT");
        assertThat(bars.keySet()).containsExactly("AAPL", "MSFT");
        assertThat(bars.get("AAPL"))
                .extracting(Bar::getClose)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("189.0"), new BigDecimal("190.0"), new BigDecimal("191.5"));
        assertThat(bars.get("MSFT").get(0).getVolume()).isEqualTo(500);
        server.verify();
    }

    @Test
    @DisplayName("Server errors become a MarketDataException")
    void barsFail() {
        server.expect(requestTo(startsWith(DATA_URL + "/v2/stocks/bars"))).andRespond(withServerError());

        assertThatThrownBy(() -> source.getBars(List.of("AAPL"), 100)).isInstanceOf(MarketDataException.class);
    }

    @Test
    @DisplayName("An empty universe makes no request")
    void emptyUniverse() {
        assertThat(source.getBars(List.of(), 100)).isEmpty();
        server.verify();
    }

    @Test
    @DisplayName("Latest price comes from the latest trade")
    void latestPrice() {
        server.expect(requestTo(DATA_URL + "/v2/stocks/AAPL/trades/latest?feed=iex"))
                .andRespond(withSuccess(
                        "{\"symbol\":\"AAPL\",\"trade\":{\"t\":\"2024-06-03T14:59:59Z\",\"p\":192.25,\"s\":100}}",
                        MediaType.APPLICATION_JSON));

        assertThat(source.getLatestPrice("AAPL")).contains(new BigDecimal("192.25"));
    }

    @Test
    @DisplayName("Unknown symbols have no latest price")
    void latestPriceNotFound() {
        server.expect(requestTo(DATA_URL + "/v2/stocks/ZZZZ/trades/latest?feed=iex"))
                .andRespond(withResourceNotFound());

        assertThat(source.getLatestPrice("ZZZZ")).isEqualTo(Optional.empty());
    }

    @Test
    @DisplayName("Other failures on the latest price become a MarketDataException")
    void latestPriceFails() {
        server.expect(requestTo(DATA_URL + "/v2/stocks/AAPL/trades/latest?feed=iex"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> source.getLatestPrice("AAPL"))
                .isInstanceOf(MarketDataException.class)
                .hasMessageContaining("AAPL");
    }
}
