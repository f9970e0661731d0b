package com.oilevels.levels;

import com.oilevels.config.LevelsProperties;
import com.oilevels.domain.enums.OptionSide;
import com.oilevels.domain.model.CumulativeSnapshot;
import com.oilevels.domain.model.DayLevels;
import com.oilevels.domain.model.DaySnapshot;
import com.oilevels.domain.model.RankedLevel;
import com.oilevels.domain.model.RankedTable;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Picks the strikes with the most cumulative money on each side of a day snapshot.
 *
 * <p>Ranking is a stable sort on money, descending, over strikes in ascending order, so
 * equal money keeps the lower strike first. Only the selected strikes feed the total.
 */
@Component
public class TopLevelExtractor {

    private final LevelsProperties levelsProperties;

    public TopLevelExtractor(LevelsProperties levelsProperties) {
        this.levelsProperties = levelsProperties;
    }

    public DayLevels extract(DaySnapshot day) {
        return new DayLevels(day.getDayIndex(), day.getDayLabel(), rank(day, OptionSide.CALL), rank(day, OptionSide.PUT));
    }

    public List<DayLevels> extractAll(List<DaySnapshot> days) {
        return days.stream().map(this::extract).toList();
    }

    public RankedTable rank(DaySnapshot day, OptionSide side) {
        int topN = levelsProperties.getTopN();

        List<CumulativeSnapshot> ordered = day.snapshots();
        ordered.sort(Comparator.comparing((CumulativeSnapshot s) -> s.money(side)).reversed());

        List<RankedLevel> levels = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (CumulativeSnapshot snapshot : ordered.subList(0, Math.min(topN, ordered.size()))) {
            levels.add(new RankedLevel(
                    levels.size() + 1,
                    snapshot.getStrike(),
                    snapshot.money(side),
                    snapshot.averageReference(side),
                    snapshot.breakEven(side)));
            total = total.add(snapshot.money(side));
        }

        return new RankedTable(side, day.getDayIndex(), day.getDayLabel(), levels, total, topN);
    }
}
