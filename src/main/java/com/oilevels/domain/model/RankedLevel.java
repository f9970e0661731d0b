package com.oilevels.domain.model;

import java.math.BigDecimal;
import lombok.Value;

/**
 * One selected strike of a ranked table: cumulative money, average reference price and break-even.
 */
@Value
public class RankedLevel {

    int rank;
    BigDecimal strike;
    BigDecimal money;
    BigDecimal referencePrice;
    BigDecimal breakEven;
}
