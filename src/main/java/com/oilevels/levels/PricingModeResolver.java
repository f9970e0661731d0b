package com.oilevels.levels;

import com.oilevels.domain.enums.PricingMode;
import com.oilevels.domain.model.DailyRecord;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Decides once per strike whether every day must be priced off LTP.
 *
 * <p>The decision looks only at the call VWAP of the strike's day-0 record: a value
 * at or below zero means FORCE_LTP. The resulting mode is applied to both call and put
 * reference prices on all days and is never re-evaluated. A strike with no day-0 record
 * is priced STANDARD.
 */
@Component
public class PricingModeResolver {

    public PricingMode resolve(Collection<DailyRecord> strikeRecords) {
        return strikeRecords.stream()
                .filter(record -> record.getDayIndex() == 0)
                .findFirst()
                .map(first -> first.getCallVwap().signum() <= 0 ? PricingMode.FORCE_LTP : PricingMode.STANDARD)
                .orElse(PricingMode.STANDARD);
    }

    /**
     * Groups records by strike and resolves a mode for each.
     *
     * @return modes keyed by strike, ascending
     */
    public NavigableMap<BigDecimal, PricingMode> resolveAll(Collection<DailyRecord> records) {
        Map<BigDecimal, List<DailyRecord>> byStrike = new TreeMap<>();
        for (DailyRecord record : records) {
            byStrike.computeIfAbsent(record.getStrike(), k -> new ArrayList<>()).add(record);
        }

        NavigableMap<BigDecimal, PricingMode> modes = new TreeMap<>();
        byStrike.forEach((strike, strikeRecords) -> modes.put(strike, resolve(strikeRecords)));
        return modes;
    }
}
