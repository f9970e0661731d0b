package com.oilevels.levels;

import com.oilevels.domain.enums.OptionSide;
import com.oilevels.domain.enums.PricingMode;
import com.oilevels.domain.model.CumulativeSnapshot;
import com.oilevels.domain.model.DailyRecord;
import java.math.BigDecimal;
import java.math.MathContext;
import lombok.Value;

/**
 * Running state of one strike threaded through the day fold.
 *
 * <p>Money accumulates unconditionally, negative contributions included. A side's reference
 * price joins the average only when it is positive, under either pricing mode.
 */
@Value
public class StrikeAccumulator {

    static final StrikeAccumulator EMPTY = new StrikeAccumulator(
            BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, 0, BigDecimal.ZERO, 0);

    BigDecimal callMoney;
    BigDecimal putMoney;
    BigDecimal callReferenceSum;
    int callReferenceCount;
    BigDecimal putReferenceSum;
    int putReferenceCount;

    /** Folds one day's record for this strike into the running state. */
    StrikeAccumulator add(DailyRecord record, PricingMode mode) {
        BigDecimal callReference = mode.referencePrice(record.vwap(OptionSide.CALL), record.ltp(OptionSide.CALL));
        BigDecimal putReference = mode.referencePrice(record.vwap(OptionSide.PUT), record.ltp(OptionSide.PUT));

        boolean callCounts = callReference.signum() > 0;
        boolean putCounts = putReference.signum() > 0;

        return new StrikeAccumulator(
                callMoney.add(record.money(OptionSide.CALL)),
                putMoney.add(record.money(OptionSide.PUT)),
                callCounts ? callReferenceSum.add(callReference) : callReferenceSum,
                callCounts ? callReferenceCount + 1 : callReferenceCount,
                putCounts ? putReferenceSum.add(putReference) : putReferenceSum,
                putCounts ? putReferenceCount + 1 : putReferenceCount);
    }

    CumulativeSnapshot snapshot(BigDecimal strike) {
        return CumulativeSnapshot.of(
                strike,
                callMoney,
                putMoney,
                average(callReferenceSum, callReferenceCount),
                average(putReferenceSum, putReferenceCount));
    }

    private static BigDecimal average(BigDecimal sum, int count) {
        if (count == 0) {
            return BigDecimal.ZERO;
        }
        return sum.divide(BigDecimal.valueOf(count), MathContext.DECIMAL64);
    }
}
