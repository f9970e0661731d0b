package com.oilevels.api.dto.response;

import com.oilevels.domain.model.DayLevels;
import com.oilevels.levels.LevelsReport;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Top resistance (call) and support (put) levels as of the last parsed day, in rank order.
 */
@Data
@Builder
public class LevelsPreviewResponse {

    private List<String> daySheets;
    private Map<String, String> skippedSheets;
    private String asOfDay;
    private int strikeCount;
    private List<RankedLevelResponse> resistance;
    private BigDecimal resistanceMoney;
    private List<RankedLevelResponse> support;
    private BigDecimal supportMoney;

    public static LevelsPreviewResponse from(LevelsReport report) {
        DayLevels latest = report.latestLevels();
        return LevelsPreviewResponse.builder()
                .daySheets(report.getDaySheets())
                .skippedSheets(report.getSkippedSheets())
                .asOfDay(latest.getDayLabel())
                .strikeCount(report.strikeCount())
                .resistance(latest.getCalls().getLevels().stream().map(RankedLevelResponse::from).toList())
                .resistanceMoney(latest.getCalls().getTotalMoney())
                .support(latest.getPuts().getLevels().stream().map(RankedLevelResponse::from).toList())
                .supportMoney(latest.getPuts().getTotalMoney())
                .build();
    }
}
