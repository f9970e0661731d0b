package com.oilevels.workbook;

import com.oilevels.config.LevelsProperties;
import com.oilevels.domain.enums.SheetFailureReason;
import com.oilevels.domain.model.DailyRecord;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns one option-chain day sheet into typed {@link DailyRecord}s.
 *
 * <p>Parsing runs in two phases:
 * <ol>
 *   <li>Header location: the first row (within {@code headerScanRows}) holding a cell equal to
 *       "strike" or "chg in oi value", compared trimmed and case-insensitively.</li>
 *   <li>Column validation and row conversion. Header names are trimmed; a repeated name is
 *       suffixed ".1", ".2", ... in order of appearance, so the put side of the chain reads as
 *       {@code Chg in OI Value.1}, {@code VWAP.1}, {@code LTP (Chg %).1}.</li>
 * </ol>
 *
 * <p>{@code Strike} and {@code Chg in OI Value} are required. Other columns default to zero when
 * absent. Rows without a numeric strike are dropped; a repeated strike keeps its first row.
 */
@Component
public class DaySheetParser {

    private static final Logger log = LoggerFactory.getLogger(DaySheetParser.class);

    static final String STRIKE = "Strike";
    static final String CALL_MONEY = "Chg in OI Value";
    static final String CALL_VWAP = "VWAP";
    static final String CALL_LTP = "LTP (Chg %)";
    static final String PUT_MONEY = "Chg in OI Value.1";
    static final String PUT_VWAP = "VWAP.1";
    static final String PUT_LTP = "LTP (Chg %).1";

    private static final Set<String> HEADER_MARKERS = Set.of("strike", "chg in oi value");
    private static final List<String> REQUIRED_COLUMNS = List.of(STRIKE, CALL_MONEY);

    private final LevelsProperties levelsProperties;

    public DaySheetParser(LevelsProperties levelsProperties) {
        this.levelsProperties = levelsProperties;
    }

    /**
     * Parses a day sheet.
     *
     * @param sheet the day sheet
     * @param dayIndex dense index of this day among the successfully parsed sheets
     * @return records on success, otherwise a structured failure; never throws for sheet content
     */
    public SheetParseResult parse(Sheet sheet, int dayIndex) {
        String sheetName = sheet.getSheetName();
        DataFormatter formatter = CellValues.formatter();
        try {
            OptionalInt headerRow = locateHeaderRow(sheet, formatter);
            if (headerRow.isEmpty()) {
                return SheetParseResult.failure(
                        sheetName,
                        SheetFailureReason.HEADER_NOT_FOUND,
                        String.format(
                                "No 'Strike' or 'Chg in OI Value' header in the first %d rows",
                                levelsProperties.getHeaderScanRows()));
            }

            Map<String, Integer> columns = readColumns(sheet.getRow(headerRow.getAsInt()), formatter);
            for (String required : REQUIRED_COLUMNS) {
                if (!columns.containsKey(required)) {
                    return SheetParseResult.failure(
                            sheetName,
                            SheetFailureReason.MISSING_REQUIRED_COLUMN,
                            "Missing required column '" + required + "'");
                }
            }

            List<DailyRecord> records = readRecords(sheet, headerRow.getAsInt(), columns, dayIndex);
            log.debug("Parsed sheet {}: header row {}, {} strikes", sheetName, headerRow.getAsInt(), records.size());
            return SheetParseResult.success(sheetName, records);
        } catch (RuntimeException e) {
            log.debug("Sheet {} could not be read", sheetName, e);
            return SheetParseResult.failure(sheetName, SheetFailureReason.UNREADABLE_SHEET, e.toString());
        }
    }

    OptionalInt locateHeaderRow(Sheet sheet, DataFormatter formatter) {
        for (int r = 0; r < levelsProperties.getHeaderScanRows(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                continue;
            }
            for (Cell cell : row) {
                if (HEADER_MARKERS.contains(CellValues.text(formatter, cell).toLowerCase(Locale.ROOT))) {
                    return OptionalInt.of(r);
                }
            }
        }
        return OptionalInt.empty();
    }

    /** Header name to column index, with repeated names suffixed ".1", ".2", ... */
    Map<String, Integer> readColumns(Row header, DataFormatter formatter) {
        Map<String, Integer> columns = new LinkedHashMap<>();
        Map<String, Integer> seen = new HashMap<>();
        for (Cell cell : header) {
            String name = CellValues.text(formatter, cell);
            if (name.isEmpty()) {
                continue;
            }
            int occurrence = seen.merge(name, 1, Integer::sum) - 1;
            columns.putIfAbsent(occurrence == 0 ? name : name + "." + occurrence, cell.getColumnIndex());
        }
        return columns;
    }

    private List<DailyRecord> readRecords(Sheet sheet, int headerRow, Map<String, Integer> columns, int dayIndex) {
        String dayLabel = sheet.getSheetName();
        // keyed by compareTo so 25000 and 25000.0 count as the same strike
        Map<BigDecimal, DailyRecord> byStrike = new TreeMap<>();
        List<DailyRecord> records = new ArrayList<>();

        for (int r = headerRow + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                continue;
            }
            BigDecimal strike = value(row, columns, STRIKE);
            if (strike == null || byStrike.containsKey(strike)) {
                continue;
            }

            DailyRecord record = DailyRecord.builder()
                    .strike(strike)
                    .callMoney(valueOrZero(row, columns, CALL_MONEY))
                    .callVwap(valueOrZero(row, columns, CALL_VWAP))
                    .callLtp(valueOrZero(row, columns, CALL_LTP))
                    .putMoney(valueOrZero(row, columns, PUT_MONEY))
                    .putVwap(valueOrZero(row, columns, PUT_VWAP))
                    .putLtp(valueOrZero(row, columns, PUT_LTP))
                    .dayIndex(dayIndex)
                    .dayLabel(dayLabel)
                    .build();
            byStrike.put(strike, record);
            records.add(record);
        }
        return records;
    }

    private BigDecimal value(Row row, Map<String, Integer> columns, String column) {
        Integer index = columns.get(column);
        return index == null ? null : CellValues.numeric(row.getCell(index));
    }

    private BigDecimal valueOrZero(Row row, Map<String, Integer> columns, String column) {
        BigDecimal value = value(row, columns, column);
        return value != null ? value : BigDecimal.ZERO;
    }
}
