package com.oilevels.domain.model;

import java.util.List;
import lombok.Value;

/**
 * A successfully parsed day sheet: its label (the sheet name), dense day index and records.
 */
@Value
public class TradingDay {

    int dayIndex;
    String dayLabel;
    List<DailyRecord> records;

    public TradingDay(int dayIndex, String dayLabel, List<DailyRecord> records) {
        this.dayIndex = dayIndex;
        this.dayLabel = dayLabel;
        this.records = List.copyOf(records);
    }
}
