package com.oilevels.layout;

import com.oilevels.domain.enums.ColumnKind;
import lombok.Value;

/**
 * One column of a report table with its two-level label: the group (day) and the metric.
 * Spacer columns have an empty metric label and never carry values.
 */
@Value
public class ReportColumn {

    String group;
    String label;
    ColumnKind kind;

    public static ReportColumn data(String group, String label) {
        return new ReportColumn(group, label, ColumnKind.DATA);
    }

    /** Spacer inside a day block; shares the block's group so the day label spans it. */
    public static ReportColumn spacer(String group) {
        return new ReportColumn(group, "", ColumnKind.SPACER);
    }

    /** Spacer between blocks. */
    public static ReportColumn spacer() {
        return spacer("");
    }

    public boolean isSpacer() {
        return kind == ColumnKind.SPACER;
    }
}
