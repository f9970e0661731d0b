package com.oilevels.levels;

import com.oilevels.domain.model.DayLevels;
import com.oilevels.domain.model.DaySnapshot;
import com.oilevels.layout.ReportTable;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Everything one run of the pipeline derives from a workbook, before rendering.
 */
@Value
@Builder
public class LevelsReport {

    /** Matched day sheets in workbook order, parsed or not. */
    List<String> daySheets;

    /** Sheet name to failure message for day sheets that were skipped. */
    Map<String, String> skippedSheets;

    List<DaySnapshot> snapshots;
    List<DayLevels> dayLevels;
    ReportTable totalTable;
    ReportTable maxTable;

    public int strikeCount() {
        return snapshots.isEmpty() ? 0 : snapshots.get(0).getStrikes().size();
    }

    /** Levels as of the last parsed day. */
    public DayLevels latestLevels() {
        return dayLevels.get(dayLevels.size() - 1);
    }
}
