package com.oilevels.workbook;

import com.oilevels.config.LevelsProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.apache.poi.ss.usermodel.Workbook;
import org.springframework.stereotype.Component;

/**
 * Selects the day sheets of a workbook.
 *
 * <p>A day sheet's name starts with a day-of-week token ("tue", "wed6", "THU6", case-insensitive)
 * and is not one of the generated output sheets. Workbook order is taken as chronological order.
 */
@Component
public class DaySheetSelector {

    private final LevelsProperties levelsProperties;
    private final Pattern dayPattern;

    public DaySheetSelector(LevelsProperties levelsProperties) {
        this.levelsProperties = levelsProperties;
        this.dayPattern = Pattern.compile(
                "^(" + levelsProperties.getDayPrefixes().stream().map(Pattern::quote).collect(Collectors.joining("|")) + ")",
                Pattern.CASE_INSENSITIVE);
    }

    public List<String> select(Workbook workbook) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            names.add(workbook.getSheetName(i));
        }
        return select(names);
    }

    public List<String> select(List<String> sheetNames) {
        return sheetNames.stream().filter(this::isDaySheet).toList();
    }

    public boolean isDaySheet(String sheetName) {
        String lower = sheetName.toLowerCase(Locale.ROOT);
        if (lower.equals(levelsProperties.getTotalSheetName().toLowerCase(Locale.ROOT))
                || lower.equals(levelsProperties.getMaxSheetName().toLowerCase(Locale.ROOT))) {
            return false;
        }
        return dayPattern.matcher(sheetName).find();
    }
}
