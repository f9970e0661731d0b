package com.oilevels.unit.workbook;

import static org.assertj.core.api.Assertions.assertThat;

import com.oilevels.config.LevelsProperties;
import com.oilevels.unit.support.OptionChainWorkbooks;
import com.oilevels.workbook.DaySheetSelector;
import java.util.List;
import org.apache.poi.ss.usermodel.Workbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DaySheetSelectorTest {

    private DaySheetSelector selector;

    @BeforeEach
    void setUp() {
        selector = new DaySheetSelector(new LevelsProperties());
    }

    @Test
    @DisplayName("Matches day prefixes case-insensitively, keeping workbook order")
    void selectsDaySheetsInWorkbookOrder() {
        List<String> selected = selector.select(List.of("tue6", "Notes", "wed6", "THU6", "fri6", "summary", "Mon"));

        assertThat(selected).containsExactly("tue6", "wed6", "THU6", "fri6", "Mon");
    }

    @Test
    @DisplayName("Order is not calendar order")
    void discoveryOrderNotCalendarOrder() {
        assertThat(selector.select(List.of("fri6", "tue6", "wed6"))).containsExactly("fri6", "tue6", "wed6");
    }

    @Test
    @DisplayName("Output sheets are never treated as input")
    void outputSheetsExcluded() {
        assertThat(selector.isDaySheet("Total")).isFalse();
        assertThat(selector.isDaySheet("MAX")).isFalse();
        assertThat(selector.isDaySheet("max")).isFalse();
    }

    @Test
    @DisplayName("Prefix must be at the start of the name")
    void prefixAnchored() {
        assertThat(selector.isDaySheet("data tue")).isFalse();
        assertThat(selector.isDaySheet("Tuesday")).isTrue();
        assertThat(selector.isDaySheet("sat")).isTrue();
    }

    @Test
    @DisplayName("Reads sheet names from a workbook")
    void selectsFromWorkbook() throws Exception {
        try (Workbook workbook = OptionChainWorkbooks.workbook()
                .plainSheet("Cover")
                .daySheet("tue6")
                .daySheet("wed6")
                .plainSheet("Total")
                .build()) {
            assertThat(selector.select(workbook)).containsExactly("tue6", "wed6");
        }
    }

    @Test
    @DisplayName("Configured prefixes replace the defaults")
    void configuredPrefixes() {
        LevelsProperties properties = new LevelsProperties();
        properties.setDayPrefixes(List.of("day"));
        DaySheetSelector custom = new DaySheetSelector(properties);

        assertThat(custom.select(List.of("day1", "tue6", "Day2"))).containsExactly("day1", "Day2");
    }
}
