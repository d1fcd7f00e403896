package com.tradingagent.marketdata;

import com.tradingagent.domain.model.Bar;
import com.tradingagent.exception.MarketDataException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads daily bars from {@code <directory>/<SYMBOL>.csv}.
 *
 * <p>Expected columns, with a header row: {@code timestamp,open,high,low,close,volume}. The timestamp is
 * an ISO date ({@code 2024-03-01}) or an ISO instant. The lookback window ends at the file's latest bar,
 * so a static file replays the same history every cycle.
 */
public class CsvMarketDataSource implements MarketDataSource {

    private static final Logger log = LoggerFactory.getLogger(CsvMarketDataSource.class);

    private final Path directory;

    public CsvMarketDataSource(Path directory) {
        this.directory = directory;
    }

    @Override
    public Map<String, List<Bar>> getBars(List<String> symbols, int lookbackDays) {
        if (!Files.isDirectory(directory)) {
            throw new MarketDataException("Market data directory not found: " + directory.toAbsolutePath());
        }
        Map<String, List<Bar>> result = new LinkedHashMap<>();
        for (String symbol : symbols) {
            List<Bar> bars = readBars(symbol);
            if (bars.isEmpty()) {
                log.warn("No CSV data for {}", symbol);
                continue;
            }
            Instant cutoff = bars.get(bars.size() - 1).getTimestamp().minus(Duration.ofDays(lookbackDays));
            result.put(symbol, bars.stream().filter(b -> b.getTimestamp().isAfter(cutoff)).toList());
        }
        return result;
    }

    @Override
    public Optional<BigDecimal> getLatestPrice(String symbol) {
        List<Bar> bars = readBars(symbol);
        return bars.isEmpty() ? Optional.empty() : Optional.of(bars.get(bars.size() - 1).getClose());
    }

    List<Bar> readBars(String symbol) {
        Path file = directory.resolve(symbol + ".csv");
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        try (Stream<String> lines = Files.lines(file, StandardCharsets.UTF_8)) {
            List<Bar> bars = new ArrayList<>();
            lines.skip(1)
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .forEach(line -> bars.add(parse(file, line)));
            bars.sort(Comparator.comparing(Bar::getTimestamp));
            return bars;
        } catch (IOException | UncheckedIOException e) {
            throw new MarketDataException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    private static Bar parse(Path file, String line) {
        String[] cols = line.split(",");
        if (cols.length < 6) {
            throw new MarketDataException("Malformed row in " + file + ": " + line);
        }
        try {
            return Bar.builder()
                    .timestamp(parseTimestamp(cols[0].trim()))
                    .open(new BigDecimal(cols[1].trim()))
                    .high(new BigDecimal(cols[2].trim()))
                    .low(new BigDecimal(cols[3].trim()))
                    .close(new BigDecimal(cols[4].trim()))
                    .volume(new BigDecimal(cols[5].trim()).longValue())
                    .build();
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new MarketDataException("Malformed row in " + file + ": " + line, e);
        }
    }

    private static Instant parseTimestamp(String value) {
        if (value.length() == 10) {
            return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        return Instant.parse(value);
    }
}
