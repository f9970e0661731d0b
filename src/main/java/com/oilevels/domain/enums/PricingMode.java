package com.oilevels.domain.enums;

import java.math.BigDecimal;

/**
 * Per-strike choice of reference price, fixed from the strike's first-day call VWAP.
 * FORCE_LTP applies when that VWAP was not positive; the same mode drives both call
 * and put pricing for the strike on every day.
 */
public enum PricingMode {
    STANDARD,
    FORCE_LTP;

    /**
     * Reference price for one side of one day: LTP under FORCE_LTP, otherwise VWAP when
     * positive with LTP as the fallback.
     */
    public BigDecimal referencePrice(BigDecimal vwap, BigDecimal ltp) {
        if (this == FORCE_LTP) {
            return ltp;
        }
        return vwap.signum() > 0 ? vwap : ltp;
    }
}
