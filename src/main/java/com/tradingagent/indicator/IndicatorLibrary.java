package com.tradingagent.indicator;

import com.tradingagent.domain.model.Bar;
import java.util.List;
import java.util.OptionalDouble;
import org.springframework.stereotype.Component;
import org.ta4j.core.BarSeries;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.helpers.GainIndicator;
import org.ta4j.core.indicators.helpers.LossIndicator;
import org.ta4j.core.indicators.helpers.VolumeIndicator;
import org.ta4j.core.indicators.statistics.StandardDeviationIndicator;
import org.ta4j.core.num.Num;

/**
 * Stateless technical indicators over a bar series, evaluated at the latest bar.
 *
 * <p>Every function needs at least {@code period + 1} bars and returns {@link OptionalDouble#empty()}
 * when the series is shorter, so callers can degrade to "insufficient data" instead of failing.
 * Calculations are delegated to ta4j indicators; the only extras are the sample (n-1) correction on
 * standard deviation and the simple-average RSI, which ta4j does not provide directly.
 */
@Component
public class IndicatorLibrary {

    // ==============================
    // PRICE AVERAGES
    // ==============================

    /** Simple moving average of the close over the last {@code period} bars. */
    public OptionalDouble sma(List<Bar> bars, int period) {
        return smaAt(bars, period, 0);
    }

    /**
     * SMA of the close evaluated {@code barsAgo} bars before the latest one. Needs
     * {@code period + 1 + barsAgo} bars.
     */
    public OptionalDouble smaAt(List<Bar> bars, int period, int barsAgo) {
        if (!hasEnough(bars, period + barsAgo)) {
            return OptionalDouble.empty();
        }
        BarSeries series = BarSeriesFactory.toSeries("sma", bars);
        SMAIndicator sma = new SMAIndicator(new ClosePriceIndicator(series), period);
        return OptionalDouble.of(sma.getValue(series.getEndIndex() - barsAgo).doubleValue());
    }

    /** Sample standard deviation (n-1) of the close over the last {@code period} bars. */
    public OptionalDouble standardDeviation(List<Bar> bars, int period) {
        if (!hasEnough(bars, period) || period < 2) {
            return OptionalDouble.empty();
        }
        BarSeries series = BarSeriesFactory.toSeries("std", bars);
        double population = new StandardDeviationIndicator(new ClosePriceIndicator(series), period)
                .getValue(series.getEndIndex())
                .doubleValue();
        return OptionalDouble.of(population * Math.sqrt((double) period / (period - 1)));
    }

    /** (close - SMA) / STD. Empty when the deviation is zero. */
    public OptionalDouble zScore(List<Bar> bars, int period) {
        OptionalDouble mean = sma(bars, period);
        OptionalDouble std = standardDeviation(bars, period);
        if (mean.isEmpty() || std.isEmpty() || std.getAsDouble() == 0.0) {
            return OptionalDouble.empty();
        }
        double close = lastClose(bars);
        return OptionalDouble.of((close - mean.getAsDouble()) / std.getAsDouble());
    }

    // ==============================
    // OSCILLATORS
    // ==============================

    /**
     * RSI from the simple averages of gains and losses over the last {@code period} closes.
     *
     * <p>With no losses the RSI is 100, unless there were no gains either, in which case it is 50.
     */
    public OptionalDouble rsi(List<Bar> bars, int period) {
        if (!hasEnough(bars, period)) {
            return OptionalDouble.empty();
        }
        BarSeries series = BarSeriesFactory.toSeries("rsi", bars);
        ClosePriceIndicator close = new ClosePriceIndicator(series);
        int end = series.getEndIndex();
        double avgGain = new SMAIndicator(new GainIndicator(close), period)
                .getValue(end)
                .doubleValue();
        double avgLoss = new SMAIndicator(new LossIndicator(close), period)
                .getValue(end)
                .doubleValue();
        if (avgLoss == 0.0) {
            return OptionalDouble.of(avgGain == 0.0 ? 50.0 : 100.0);
        }
        double rs = avgGain / avgLoss;
        return OptionalDouble.of(100.0 - (100.0 / (1.0 + rs)));
    }

    /** close[t] - close[t - period]. */
    public OptionalDouble momentum(List<Bar> bars, int period) {
        if (!hasEnough(bars, period)) {
            return OptionalDouble.empty();
        }
        BarSeries series = BarSeriesFactory.toSeries("momentum", bars);
        ClosePriceIndicator close = new ClosePriceIndicator(series);
        int end = series.getEndIndex();
        return OptionalDouble.of(close.getValue(end).minus(close.getValue(end - period)).doubleValue());
    }

    // ==============================
    // VOLUME AND VOLATILITY
    // ==============================

    /** Latest volume divided by the average volume of the last {@code period} bars. */
    public OptionalDouble volumeRatio(List<Bar> bars, int period) {
        if (!hasEnough(bars, period)) {
            return OptionalDouble.empty();
        }
        BarSeries series = BarSeriesFactory.toSeries("volume", bars);
        VolumeIndicator volume = new VolumeIndicator(series);
        int end = series.getEndIndex();
        double average = new SMAIndicator(volume, period).getValue(end).doubleValue();
        if (average == 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(volume.getValue(end).doubleValue() / average);
    }

    /**
     * Sample standard deviation of the last {@code period} close-to-close returns, in percent.
     */
    public OptionalDouble returnVolatilityPercent(List<Bar> bars, int period) {
        if (!hasEnough(bars, period) || period < 2) {
            return OptionalDouble.empty();
        }
        BarSeries series = BarSeriesFactory.toSeries("volatility", bars);
        Indicator<Num> close = new ClosePriceIndicator(series);
        int end = series.getEndIndex();
        double[] returns = new double[period];
        for (int k = 0; k < period; k++) {
            int i = end - period + 1 + k;
            double previous = close.getValue(i - 1).doubleValue();
            returns[k] = previous == 0.0 ? 0.0 : close.getValue(i).doubleValue() / previous - 1.0;
        }
        double mean = 0.0;
        for (double r : returns) {
            mean += r;
        }
        mean /= period;
        double sumSquares = 0.0;
        for (double r : returns) {
            sumSquares += (r - mean) * (r - mean);
        }
        return OptionalDouble.of(Math.sqrt(sumSquares / (period - 1)) * 100.0);
    }

    /** Percent change of the latest close against the previous close. */
    public OptionalDouble dailyReturnPercent(List<Bar> bars) {
        if (!hasEnough(bars, 1)) {
            return OptionalDouble.empty();
        }
        double previous = bars.get(bars.size() - 2).getClose().doubleValue();
        if (previous == 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((lastClose(bars) / previous - 1.0) * 100.0);
    }

    public double lastClose(List<Bar> bars) {
        return bars.get(bars.size() - 1).getClose().doubleValue();
    }

    private static boolean hasEnough(List<Bar> bars, int period) {
        return period > 0 && bars != null && bars.size() >= period + 1;
    }
}
