package com.oilevels.domain.model;

import com.oilevels.domain.enums.OptionSide;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import lombok.Value;

/**
 * Top strikes of one side for one day.
 *
 * <p>{@code levels} holds at most {@code displayRows} entries in rank order (money descending).
 * The display grid always has {@code displayRows} rows; rows past {@code levels.size()} are blank.
 * {@code totalMoney} sums the selected levels only.
 */
@Value
public class RankedTable {

    OptionSide side;
    int dayIndex;
    String dayLabel;
    List<RankedLevel> levels;
    BigDecimal totalMoney;
    int displayRows;

    public RankedTable(
            OptionSide side,
            int dayIndex,
            String dayLabel,
            List<RankedLevel> levels,
            BigDecimal totalMoney,
            int displayRows) {
        this.side = side;
        this.dayIndex = dayIndex;
        this.dayLabel = dayLabel;
        this.levels = List.copyOf(levels);
        this.totalMoney = totalMoney;
        this.displayRows = displayRows;
    }

    /** Selected levels ordered by strike, highest first, as laid out in the summary sheet. */
    public List<RankedLevel> byStrikeDescending() {
        return levels.stream()
                .sorted(Comparator.comparing(RankedLevel::getStrike).reversed())
                .toList();
    }
}
