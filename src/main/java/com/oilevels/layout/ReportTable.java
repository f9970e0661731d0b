package com.oilevels.layout;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Presentation-neutral table handed to the workbook renderer.
 *
 * <p>The renderer writes two header rows (group, then metric label) followed by one row per
 * {@link ReportRow}. Column 0 of the sheet holds the row index; {@code columns} start after it.
 */
@Value
@Builder
public class ReportTable {

    String sheetName;
    String indexLabel;
    boolean indexHidden;

    /** Draw a grid over each data run (metric header and data rows), not only header borders. */
    boolean gridBorders;

    @Singular
    List<ReportColumn> columns;

    @Singular
    List<ReportRow> rows;

    /** Maximal runs of adjacent data columns, e.g. one call or put sub-block. */
    public List<ColumnRun> dataRuns() {
        List<ColumnRun> runs = new ArrayList<>();
        int start = -1;
        for (int i = 0; i <= columns.size(); i++) {
            boolean data = i < columns.size() && !columns.get(i).isSpacer();
            if (data && start < 0) {
                start = i;
            } else if (!data && start >= 0) {
                runs.add(new ColumnRun(columns.get(start).getGroup(), start, i - 1));
                start = -1;
            }
        }
        return runs;
    }

    /** Maximal runs of adjacent columns sharing a non-empty group label; one per day block. */
    public List<ColumnRun> groupRuns() {
        List<ColumnRun> runs = new ArrayList<>();
        int start = 0;
        for (int i = 1; i <= columns.size(); i++) {
            String group = columns.get(start).getGroup();
            if (i == columns.size() || !columns.get(i).getGroup().equals(group)) {
                if (!group.isEmpty()) {
                    runs.add(new ColumnRun(group, start, i - 1));
                }
                start = i;
            }
        }
        return runs;
    }
}
