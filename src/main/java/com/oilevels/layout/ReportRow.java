package com.oilevels.layout;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Value;

/**
 * A row of a report table. Cells align with the table's columns; a null cell is rendered blank.
 */
@Value
public class ReportRow {

    BigDecimal index;
    List<BigDecimal> cells;

    public ReportRow(BigDecimal index, List<BigDecimal> cells) {
        this.index = index;
        this.cells = Collections.unmodifiableList(new ArrayList<>(cells));
    }

    public BigDecimal cell(int column) {
        return cells.get(column);
    }
}
