package com.oilevels.api.dto.response;

import com.oilevels.domain.model.RankedLevel;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RankedLevelResponse {

    private int rank;
    private BigDecimal strike;
    private BigDecimal money;
    private BigDecimal referencePrice;
    private BigDecimal level;

    public static RankedLevelResponse from(RankedLevel rankedLevel) {
        return RankedLevelResponse.builder()
                .rank(rankedLevel.getRank())
                .strike(rankedLevel.getStrike())
                .money(rankedLevel.getMoney())
                .referencePrice(rankedLevel.getReferencePrice())
                .level(rankedLevel.getBreakEven())
                .build();
    }
}
