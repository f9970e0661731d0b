package com.oilevels.domain.model;

import com.oilevels.domain.enums.OptionSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * One strike row of one day sheet, after numeric coercion.
 *
 * <p>Money and price fields are never null: missing or unreadable cells are stored as zero.
 * {@code dayIndex} is the position of the day among the successfully parsed day sheets,
 * in the order the sheets appear in the workbook.
 */
@Value
@Builder
public class DailyRecord {

    BigDecimal strike;
    BigDecimal callMoney;
    BigDecimal callVwap;
    BigDecimal callLtp;
    BigDecimal putMoney;
    BigDecimal putVwap;
    BigDecimal putLtp;
    int dayIndex;
    String dayLabel;

    /** Open-interest-change money for the given side. */
    public BigDecimal money(OptionSide side) {
        return side == OptionSide.CALL ? callMoney : putMoney;
    }

    public BigDecimal vwap(OptionSide side) {
        return side == OptionSide.CALL ? callVwap : putVwap;
    }

    public BigDecimal ltp(OptionSide side) {
        return side == OptionSide.CALL ? callLtp : putLtp;
    }
}
