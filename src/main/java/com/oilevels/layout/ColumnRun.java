package com.oilevels.layout;

import lombok.Value;

/**
 * Inclusive range of column positions, zero-based over the table's columns (index column excluded).
 */
@Value
public class ColumnRun {

    String group;
    int first;
    int last;

    public int width() {
        return last - first + 1;
    }
}
