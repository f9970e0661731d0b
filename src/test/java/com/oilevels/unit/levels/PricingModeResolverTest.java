package com.oilevels.unit.levels;

import static com.oilevels.unit.support.OptionChainWorkbooks.callRecord;
import static com.oilevels.unit.support.OptionChainWorkbooks.record;
import static org.assertj.core.api.Assertions.assertThat;

import com.oilevels.domain.enums.PricingMode;
import com.oilevels.levels.PricingModeResolver;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PricingModeResolverTest {

    private PricingModeResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new PricingModeResolver();
    }

    @Test
    @DisplayName("Zero call VWAP on day 0 forces LTP")
    void zeroFirstDayVwapForcesLtp() {
        PricingMode mode = resolver.resolve(List.of(callRecord(0, 100, 50, 0, 10), callRecord(1, 100, -20, 12, 11)));

        assertThat(mode).isEqualTo(PricingMode.FORCE_LTP);
    }

    @Test
    @DisplayName("Negative call VWAP on day 0 forces LTP")
    void negativeFirstDayVwapForcesLtp() {
        assertThat(resolver.resolve(List.of(callRecord(0, 100, 50, -1, 10)))).isEqualTo(PricingMode.FORCE_LTP);
    }

    @Test
    @DisplayName("Positive call VWAP on day 0 is standard even if a later day has none")
    void positiveFirstDayVwapIsStandard() {
        PricingMode mode = resolver.resolve(List.of(callRecord(1, 100, 5, 0, 9), callRecord(0, 100, 5, 8, 9)));

        assertThat(mode).isEqualTo(PricingMode.STANDARD);
    }

    @Test
    @DisplayName("Only the call side of day 0 is inspected")
    void putVwapIgnored() {
        PricingMode mode = resolver.resolve(List.of(record(0, 100, 5, 8, 9, 5, 0, 7)));

        assertThat(mode).isEqualTo(PricingMode.STANDARD);
    }

    @Test
    @DisplayName("Strike without a day-0 record defaults to standard")
    void missingDayZeroDefaultsToStandard() {
        assertThat(resolver.resolve(List.of(callRecord(1, 100, 5, 0, 9)))).isEqualTo(PricingMode.STANDARD);
    }

    @Test
    @DisplayName("resolveAll groups records by strike")
    void resolveAllGroupsByStrike() {
        Map<BigDecimal, PricingMode> modes = resolver.resolveAll(List.of(
                callRecord(0, 100, 5, 0, 9),
                callRecord(0, 200, 5, 4, 9),
                callRecord(1, 100, 5, 6, 9),
                callRecord(1, 300, 5, 0, 9)));

        assertThat(modes).hasSize(3);
        assertThat(modes.get(new BigDecimal("100"))).isEqualTo(PricingMode.FORCE_LTP);
        assertThat(modes.get(new BigDecimal("200"))).isEqualTo(PricingMode.STANDARD);
        assertThat(modes.get(new BigDecimal("300"))).isEqualTo(PricingMode.STANDARD);
    }

    @Test
    @DisplayName("Reference price follows the mode")
    void referencePriceByMode() {
        BigDecimal vwap = new BigDecimal("12");
        BigDecimal ltp = new BigDecimal("11");

        assertThat(PricingMode.FORCE_LTP.referencePrice(vwap, ltp)).isEqualByComparingTo("11");
        assertThat(PricingMode.STANDARD.referencePrice(vwap, ltp)).isEqualByComparingTo("12");
        assertThat(PricingMode.STANDARD.referencePrice(BigDecimal.ZERO, ltp)).isEqualByComparingTo("11");
    }
}
