package com.oilevels.domain.model;

import com.oilevels.domain.enums.OptionSide;
import java.math.BigDecimal;
import lombok.Value;

/**
 * State of one strike after folding days 0..n.
 *
 * <p>Averages are taken over the days whose reference price for that side was positive
 * and are zero until such a day occurs. Break-even prices are derived from the averages:
 * call = strike + average call reference, put = strike - average put reference.
 */
@Value
public class CumulativeSnapshot {

    BigDecimal strike;
    BigDecimal callMoney;
    BigDecimal putMoney;
    BigDecimal averageCallReference;
    BigDecimal averagePutReference;
    BigDecimal callBreakEven;
    BigDecimal putBreakEven;

    public static CumulativeSnapshot of(
            BigDecimal strike,
            BigDecimal callMoney,
            BigDecimal putMoney,
            BigDecimal averageCallReference,
            BigDecimal averagePutReference) {
        return new CumulativeSnapshot(
                strike,
                callMoney,
                putMoney,
                averageCallReference,
                averagePutReference,
                strike.add(averageCallReference),
                strike.subtract(averagePutReference));
    }

    public BigDecimal money(OptionSide side) {
        return side == OptionSide.CALL ? callMoney : putMoney;
    }

    public BigDecimal averageReference(OptionSide side) {
        return side == OptionSide.CALL ? averageCallReference : averagePutReference;
    }

    public BigDecimal breakEven(OptionSide side) {
        return side == OptionSide.CALL ? callBreakEven : putBreakEven;
    }
}
