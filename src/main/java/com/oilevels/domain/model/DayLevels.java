package com.oilevels.domain.model;

import lombok.Value;

/**
 * Resistance (call) and support (put) tables for one day.
 */
@Value
public class DayLevels {

    int dayIndex;
    String dayLabel;
    RankedTable calls;
    RankedTable puts;
}
