package com.tradingagent.indicator;

import com.tradingagent.domain.model.Bar;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;

/**
 * Builds a ta4j {@link BarSeries} from a list of domain {@link Bar}s.
 *
 * <p>Bars must be in strictly ascending timestamp order; ta4j rejects a bar whose end time does not
 * advance. Daily bars are assumed, the period only labels the bars and plays no part in any indicator
 * used here.
 */
public final class BarSeriesFactory {

    private static final Duration BAR_PERIOD = Duration.ofDays(1);

    private BarSeriesFactory() {}

    public static BarSeries toSeries(String name, List<Bar> bars) {
        BarSeries series = new BaseBarSeriesBuilder().withName(name).build();
        for (Bar bar : bars) {
            series.addBar(
                    BAR_PERIOD,
                    bar.getTimestamp().atZone(ZoneOffset.UTC),
                    bar.getOpen().doubleValue(),
                    bar.getHigh().doubleValue(),
                    bar.getLow().doubleValue(),
                    bar.getClose().doubleValue(),
                    bar.getVolume());
        }
        return series;
    }
}
