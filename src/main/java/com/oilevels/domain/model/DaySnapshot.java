package com.oilevels.domain.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import lombok.Value;

/**
 * Cumulative picture of every strike in the universe as of one day, keyed by strike ascending.
 */
@Value
public class DaySnapshot {

    int dayIndex;
    String dayLabel;
    NavigableMap<BigDecimal, CumulativeSnapshot> strikes;

    public DaySnapshot(int dayIndex, String dayLabel, NavigableMap<BigDecimal, CumulativeSnapshot> strikes) {
        this.dayIndex = dayIndex;
        this.dayLabel = dayLabel;
        this.strikes = Collections.unmodifiableNavigableMap(new TreeMap<>(strikes));
    }

    /** Snapshots in ascending strike order. */
    public List<CumulativeSnapshot> snapshots() {
        return new ArrayList<>(strikes.values());
    }

    public CumulativeSnapshot get(BigDecimal strike) {
        return strikes.get(strike);
    }
}
