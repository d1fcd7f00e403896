package com.tradingagent.support;

import com.tradingagent.domain.model.Bar;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.IntToDoubleFunction;

/** Builds daily bar series for tests. Bars start on 2024-01-01 UTC, one per calendar day. */
public final class TestBars {

    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    public static final long DEFAULT_VOLUME = 1_000_000L;

    private TestBars() {}

    public static List<Bar> closes(double... closes) {
        long[] volumes = new long[closes.length];
        Arrays.fill(volumes, DEFAULT_VOLUME);
        return closesWithVolumes(closes, volumes);
    }

    public static List<Bar> closesWithVolumes(double[] closes, long[] volumes) {
        List<Bar> bars = new ArrayList<>(closes.length);
        for (int i = 0; i < closes.length; i++) {
            bars.add(bar(i, closes[i], volumes[i]));
        }
        return bars;
    }

    /** {@code count} bars whose close is {@code closeAt.applyAsDouble(i)}. */
    public static List<Bar> series(int count, IntToDoubleFunction closeAt) {
        double[] closes = new double[count];
        for (int i = 0; i < count; i++) {
            closes[i] = closeAt.applyAsDouble(i);
        }
        return closes(closes);
    }

    public static List<Bar> flat(int count, double price) {
        return series(count, i -> price);
    }

    public static Bar bar(int index, double close, long volume) {
        BigDecimal price = BigDecimal.valueOf(close);
        return Bar.builder()
                .timestamp(START.plus(Duration.ofDays(index)))
                .open(price)
                .high(price)
                .low(price)
                .close(price)
                .volume(volume)
                .build();
    }
}
