package com.oilevels.levels;

import com.oilevels.domain.enums.PricingMode;
import com.oilevels.domain.model.CumulativeSnapshot;
import com.oilevels.domain.model.DailyRecord;
import com.oilevels.domain.model.DaySnapshot;
import com.oilevels.domain.model.TradingDay;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Folds parsed days, in the order given, into one cumulative snapshot set per day.
 *
 * <p>The strike universe is the union of strikes across all days and is closed before
 * the fold starts. On a day where a strike has no record, its money and reference
 * averages carry over unchanged. Each emitted {@link DaySnapshot} covers days up to and
 * including its own and is independent of later days.
 */
@Component
public class CumulativeAggregator {

    private static final Logger log = LoggerFactory.getLogger(CumulativeAggregator.class);

    public List<DaySnapshot> aggregate(List<TradingDay> days, Map<BigDecimal, PricingMode> modes) {
        NavigableSet<BigDecimal> universe = strikeUniverse(days);

        Map<BigDecimal, StrikeAccumulator> state = new TreeMap<>();
        universe.forEach(strike -> state.put(strike, StrikeAccumulator.EMPTY));

        List<DaySnapshot> snapshots = new ArrayList<>(days.size());
        for (TradingDay day : days) {
            Map<BigDecimal, DailyRecord> dayRecords = new TreeMap<>();
            for (DailyRecord record : day.getRecords()) {
                dayRecords.putIfAbsent(record.getStrike(), record);
            }

            NavigableMap<BigDecimal, CumulativeSnapshot> daySnapshots = new TreeMap<>();
            for (BigDecimal strike : universe) {
                StrikeAccumulator next = state.get(strike);
                DailyRecord record = dayRecords.get(strike);
                if (record != null) {
                    next = next.add(record, modes.getOrDefault(strike, PricingMode.STANDARD));
                    state.put(strike, next);
                }
                daySnapshots.put(strike, next.snapshot(strike));
            }
            snapshots.add(new DaySnapshot(day.getDayIndex(), day.getDayLabel(), daySnapshots));
        }

        log.info("Aggregated {} days across {} strikes", days.size(), universe.size());
        return snapshots;
    }

    /** All strikes appearing on any day, ascending. */
    public NavigableSet<BigDecimal> strikeUniverse(List<TradingDay> days) {
        NavigableSet<BigDecimal> universe = new TreeSet<>();
        days.forEach(day -> day.getRecords().forEach(record -> universe.add(record.getStrike())));
        return universe;
    }
}
