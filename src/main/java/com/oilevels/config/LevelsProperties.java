package com.oilevels.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for level generation, loaded from application.properties.
 *
 * <p>Properties prefix: {@code oilevels.levels.*}. Selector, parser, extractor and
 * renderer all read from this shared bean.
 *
 * <p>Defaults:
 * <ul>
 *   <li>topN: 5 ranked strikes per side per day</li>
 *   <li>headerScanRows: 10 rows searched for the header marker</li>
 *   <li>totalSheetName / maxSheetName: "Total" / "Max"</li>
 *   <li>columnPadding: 2 characters added to the widest value</li>
 *   <li>dayPrefixes: mon..sun, matched case-insensitively at the start of a sheet name</li>
 * </ul>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "oilevels.levels")
public class LevelsProperties {

    @Min(1)
    private int topN = 5;

    @Min(1)
    private int headerScanRows = 10;

    @NotBlank
    private String totalSheetName = "Total";

    @NotBlank
    private String maxSheetName = "Max";

    @Min(0)
    private int columnPadding = 2;

    @NotEmpty
    private List<String> dayPrefixes = new ArrayList<>(List.of("mon", "tue", "wed", "thu", "fri", "sat", "sun"));
}
