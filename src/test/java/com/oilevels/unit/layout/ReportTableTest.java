package com.oilevels.unit.layout;

import static org.assertj.core.api.Assertions.assertThat;

import com.oilevels.layout.ColumnRun;
import com.oilevels.layout.ReportColumn;
import com.oilevels.layout.ReportTable;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReportTableTest {

    /** One Max-style day block: call table, inner spacer, put table; then two spacers and a second day. */
    private static ReportTable twoDayBlocks() {
        return ReportTable.builder()
                .sheetName("Max")
                .indexLabel("")
                .column(ReportColumn.data("mon5", "CE Strike"))
                .column(ReportColumn.data("mon5", "Money"))
                .column(ReportColumn.spacer("mon5"))
                .column(ReportColumn.data("mon5", "PE Strike"))
                .column(ReportColumn.spacer())
                .column(ReportColumn.spacer())
                .column(ReportColumn.data("tue6", "CE Strike"))
                .build();
    }

    @Test
    void dataRuns_splitOnEverySpacer() {
        List<ColumnRun> runs = twoDayBlocks().dataRuns();

        assertThat(runs).extracting(ColumnRun::getFirst).containsExactly(0, 3, 6);
        assertThat(runs).extracting(ColumnRun::getLast).containsExactly(1, 3, 6);
        assertThat(runs.get(0).width()).isEqualTo(2);
    }

    @Test
    void groupRuns_spanInnerSpacerAndSkipUnlabelledColumns() {
        List<ColumnRun> runs = twoDayBlocks().groupRuns();

        assertThat(runs).extracting(ColumnRun::getGroup).containsExactly("mon5", "tue6");
        assertThat(runs.get(0).getFirst()).isZero();
        assertThat(runs.get(0).getLast()).isEqualTo(3);
        assertThat(runs.get(1).width()).isEqualTo(1);
    }

    @Test
    void emptyTable_hasNoRuns() {
        ReportTable table = ReportTable.builder().sheetName("Total").indexLabel("Strike").build();

        assertThat(table.dataRuns()).isEmpty();
        assertThat(table.groupRuns()).isEmpty();
    }
}
