package com.oilevels.unit.workbook;

import static com.oilevels.unit.support.OptionChainWorkbooks.row;
import static org.assertj.core.api.Assertions.assertThat;

import com.oilevels.config.LevelsProperties;
import com.oilevels.domain.enums.SheetFailureReason;
import com.oilevels.domain.model.DailyRecord;
import com.oilevels.unit.support.OptionChainWorkbooks;
import com.oilevels.workbook.DaySheetParser;
import com.oilevels.workbook.SheetParseResult;
import java.io.IOException;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for DaySheetParser: header location, put-side column suffixes, numeric
 * coercion, row filtering and structured per-sheet failures.
 */
class DaySheetParserTest {

    private DaySheetParser parser;
    private Workbook workbook;

    @BeforeEach
    void setUp() {
        parser = new DaySheetParser(new LevelsProperties());
    }

    @AfterEach
    void tearDown() throws IOException {
        if (workbook != null) {
            workbook.close();
        }
    }

    private Sheet sheet(String name, double[]... rows) {
        workbook = OptionChainWorkbooks.workbook().daySheet(name, rows).build();
        return workbook.getSheet(name);
    }

    @Nested
    @DisplayName("Successful parse")
    class Success {

        @Test
        @DisplayName("Reads call and put columns from a header below title rows")
        void readsBothSides() {
            SheetParseResult result = parser.parse(sheet("tue6", row(25000, 81, 120.5, 118, 44, 95.25, 97)), 0);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getRecords()).hasSize(1);
            DailyRecord record = result.getRecords().get(0);
            assertThat(record.getStrike()).isEqualByComparingTo("25000");
            assertThat(record.getCallMoney()).isEqualByComparingTo("81");
            assertThat(record.getCallVwap()).isEqualByComparingTo("120.5");
            assertThat(record.getCallLtp()).isEqualByComparingTo("118");
            assertThat(record.getPutMoney()).isEqualByComparingTo("44");
            assertThat(record.getPutVwap()).isEqualByComparingTo("95.25");
            assertThat(record.getPutLtp()).isEqualByComparingTo("97");
            assertThat(record.getDayIndex()).isZero();
            assertThat(record.getDayLabel()).isEqualTo("tue6");
        }

        @Test
        @DisplayName("Day index is the one supplied by the caller")
        void usesGivenDayIndex() {
            SheetParseResult result = parser.parse(sheet("wed6", row(100, 1, 1, 1, 1, 1, 1)), 3);

            assertThat(result.getRecords().get(0).getDayIndex()).isEqualTo(3);
        }

        @Test
        @DisplayName("Repeated strike keeps the first row")
        void duplicateStrikeKeepsFirst() {
            SheetParseResult result =
                    parser.parse(sheet("tue6", row(100, 10, 1, 1, 0, 0, 0), row(100, 99, 1, 1, 0, 0, 0)), 0);

            assertThat(result.getRecords()).hasSize(1);
            assertThat(result.getRecords().get(0).getCallMoney()).isEqualByComparingTo("10");
        }

        @Test
        @DisplayName("Rows without a numeric strike are dropped; bad cells become zero")
        void coercion() {
            Sheet sheet = sheet("tue6", row(100, 10, 5, 6, 7, 8, 9));
            Row total = sheet.createRow(5);
            total.createCell(4).setCellValue("Total");
            total.createCell(1).setCellValue(999);
            Row text = sheet.createRow(6);
            text.createCell(4).setCellValue(" 200 ");
            text.createCell(1).setCellValue("-");
            text.createCell(2).setCellValue("12.5");

            SheetParseResult result = parser.parse(sheet, 0);

            assertThat(result.getRecords()).hasSize(2);
            DailyRecord fromText = result.getRecords().get(1);
            assertThat(fromText.getStrike()).isEqualByComparingTo("200");
            assertThat(fromText.getCallMoney()).isEqualByComparingTo("0");
            assertThat(fromText.getCallVwap()).isEqualByComparingTo("12.5");
            assertThat(fromText.getPutLtp()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Missing put and price columns default to zero")
        void optionalColumnsDefaultToZero() {
            workbook = new XSSFWorkbook();
            Sheet sheet = workbook.createSheet("thu6");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue(" Strike ");
            header.createCell(1).setCellValue("Chg in OI Value");
            Row data = sheet.createRow(1);
            data.createCell(0).setCellValue(300);
            data.createCell(1).setCellValue(12);

            SheetParseResult result = parser.parse(sheet, 0);

            assertThat(result.isSuccess()).isTrue();
            DailyRecord record = result.getRecords().get(0);
            assertThat(record.getCallMoney()).isEqualByComparingTo("12");
            assertThat(record.getCallVwap()).isEqualByComparingTo("0");
            assertThat(record.getPutMoney()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Formula cells are read through their cached results")
        void formulaCells() {
            workbook = new XSSFWorkbook();
            Sheet sheet = workbook.createSheet("thu8");
            Row header = sheet.createRow(1);
            header.createCell(0).setCellFormula("\"Str\"&\"ike\"");
            header.createCell(1).setCellFormula("\"Chg in OI \"&\"Value\"");
            Row data = sheet.createRow(2);
            data.createCell(0).setCellFormula("24900+100");
            data.createCell(1).setCellValue(75);
            workbook.getCreationHelper().createFormulaEvaluator().evaluateAll();

            SheetParseResult result = parser.parse(sheet, 0);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getRecords()).hasSize(1);
            assertThat(result.getRecords().get(0).getStrike()).isEqualByComparingTo("25000");
            assertThat(result.getRecords().get(0).getCallMoney()).isEqualByComparingTo("75");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Header outside the first ten rows is not found")
        void headerNotFound() {
            workbook = new XSSFWorkbook();
            Sheet sheet = workbook.createSheet("fri6");
            sheet.createRow(10).createCell(0).setCellValue("Strike");

            SheetParseResult result = parser.parse(sheet, 0);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getFailureReason()).isEqualTo(SheetFailureReason.HEADER_NOT_FOUND);
            assertThat(result.getRecords()).isEmpty();
        }

        @Test
        @DisplayName("Header marker without the money column is a missing-column failure")
        void missingRequiredColumn() {
            workbook = new XSSFWorkbook();
            Sheet sheet = workbook.createSheet("fri6");
            Row header = sheet.createRow(2);
            header.createCell(0).setCellValue("Strike");
            header.createCell(1).setCellValue("VWAP");

            SheetParseResult result = parser.parse(sheet, 0);

            assertThat(result.getFailureReason()).isEqualTo(SheetFailureReason.MISSING_REQUIRED_COLUMN);
            assertThat(result.getFailureMessage()).contains("Chg in OI Value");
        }

        @Test
        @DisplayName("Empty sheet has no header")
        void emptySheet() {
            workbook = new XSSFWorkbook();
            Sheet sheet = workbook.createSheet("mon");

            assertThat(parser.parse(sheet, 0).getFailureReason()).isEqualTo(SheetFailureReason.HEADER_NOT_FOUND);
        }
    }
}
