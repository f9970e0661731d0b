package com.oilevels.levels;

import com.oilevels.config.LevelsProperties;
import com.oilevels.domain.model.CumulativeSnapshot;
import com.oilevels.domain.model.DayLevels;
import com.oilevels.domain.model.DaySnapshot;
import com.oilevels.domain.model.RankedLevel;
import com.oilevels.domain.model.RankedTable;
import com.oilevels.layout.ReportColumn;
import com.oilevels.layout.ReportRow;
import com.oilevels.layout.ReportTable;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Lays day results out as the two composite report tables.
 *
 * <p>Total table: one row per strike (ascending), one block per day of
 * {@code CE BEP | CE Money | PE Money | PE BEP}, a single spacer between day blocks.
 *
 * <p>Max table: per day a call table and a put table of {@code Strike | Money | AVWAP | BEP},
 * one spacer between them, two spacers between days. Rows are the ranked strikes by strike
 * descending, blank padding up to the configured row count, then a totals row holding only money.
 */
@Component
public class ReportAssembler {

    static final List<String> TOTAL_METRICS = List.of("CE BEP", "CE Money", "PE Money", "PE BEP");
    static final List<String> CALL_METRICS = List.of("CE Strike", "Money", "AVWAP", "CE BEP");
    static final List<String> PUT_METRICS = List.of("PE Strike", "Money", "AVWAP", "PE BEP");

    private final LevelsProperties levelsProperties;

    public ReportAssembler(LevelsProperties levelsProperties) {
        this.levelsProperties = levelsProperties;
    }

    public ReportTable assembleTotal(List<DaySnapshot> days) {
        ReportTable.ReportTableBuilder table = ReportTable.builder()
                .sheetName(levelsProperties.getTotalSheetName())
                .indexLabel("Strike")
                .indexHidden(false)
                .gridBorders(false);

        for (int d = 0; d < days.size(); d++) {
            if (d > 0) {
                table.column(ReportColumn.spacer());
            }
            String label = days.get(d).getDayLabel();
            TOTAL_METRICS.forEach(metric -> table.column(ReportColumn.data(label, metric)));
        }

        if (days.isEmpty()) {
            return table.build();
        }

        for (BigDecimal strike : days.get(0).getStrikes().keySet()) {
            List<BigDecimal> cells = new ArrayList<>();
            for (int d = 0; d < days.size(); d++) {
                if (d > 0) {
                    cells.add(null);
                }
                CumulativeSnapshot snapshot = days.get(d).get(strike);
                cells.add(snapshot.getCallBreakEven());
                cells.add(snapshot.getCallMoney());
                cells.add(snapshot.getPutMoney());
                cells.add(snapshot.getPutBreakEven());
            }
            table.row(new ReportRow(strike, cells));
        }
        return table.build();
    }

    public ReportTable assembleMax(List<DayLevels> days) {
        ReportTable.ReportTableBuilder table = ReportTable.builder()
                .sheetName(levelsProperties.getMaxSheetName())
                .indexLabel("")
                .indexHidden(true)
                .gridBorders(true);

        for (int d = 0; d < days.size(); d++) {
            if (d > 0) {
                table.column(ReportColumn.spacer());
                table.column(ReportColumn.spacer());
            }
            String label = days.get(d).getDayLabel();
            CALL_METRICS.forEach(metric -> table.column(ReportColumn.data(label, metric)));
            table.column(ReportColumn.spacer(label));
            PUT_METRICS.forEach(metric -> table.column(ReportColumn.data(label, metric)));
        }

        int displayRows = levelsProperties.getTopN();
        for (int r = 0; r <= displayRows; r++) {
            List<BigDecimal> cells = new ArrayList<>();
            for (int d = 0; d < days.size(); d++) {
                if (d > 0) {
                    cells.add(null);
                    cells.add(null);
                }
                DayLevels day = days.get(d);
                cells.addAll(rankedCells(day.getCalls(), r, displayRows));
                cells.add(null);
                cells.addAll(rankedCells(day.getPuts(), r, displayRows));
            }
            table.row(new ReportRow(null, cells));
        }
        return table.build();
    }

    /** Four cells of one ranked row: a level, blank padding, or the totals row when {@code row == displayRows}. */
    private List<BigDecimal> rankedCells(RankedTable ranked, int row, int displayRows) {
        if (row == displayRows) {
            return Arrays.asList(null, ranked.getTotalMoney(), null, null);
        }
        List<RankedLevel> display = ranked.byStrikeDescending();
        if (row >= display.size()) {
            return Collections.nCopies(4, null);
        }
        RankedLevel level = display.get(row);
        return Arrays.asList(level.getStrike(), level.getMoney(), level.getReferencePrice(), level.getBreakEven());
    }
}
