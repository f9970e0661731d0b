package com.oilevels.workbook;

import com.oilevels.config.LevelsProperties;
import com.oilevels.exception.WorkbookWriteException;
import com.oilevels.layout.ColumnRun;
import com.oilevels.layout.ReportColumn;
import com.oilevels.layout.ReportRow;
import com.oilevels.layout.ReportTable;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes {@link ReportTable}s into workbook sheets and styles them. No computation happens here.
 *
 * <p>Sheet layout: row 0 holds group (day) labels merged across each block, row 1 the metric
 * labels and the index label, data starts at row 2. Sheet column 0 is the index column and
 * table column {@code c} lands in sheet column {@code c + 1}.
 *
 * <p>An existing sheet with the same name (any case) is replaced at its current position.
 */
@Component
public class WorkbookRenderer {

    private static final Logger log = LoggerFactory.getLogger(WorkbookRenderer.class);

    static final int HEADER_ROWS = 2;
    private static final int MAX_COLUMN_CHARS = 255;

    private final LevelsProperties levelsProperties;

    public WorkbookRenderer(LevelsProperties levelsProperties) {
        this.levelsProperties = levelsProperties;
    }

    public Sheet render(Workbook workbook, ReportTable table) {
        Sheet sheet = replaceSheet(workbook, table.getSheetName());
        Styles styles = new Styles(workbook);
        List<ReportColumn> columns = table.getColumns();

        Row groupRow = sheet.createRow(0);
        Row labelRow = sheet.createRow(1);
        Cell indexLabel = labelRow.createCell(0);
        indexLabel.setCellValue(table.getIndexLabel());
        indexLabel.setCellStyle(table.isIndexHidden() ? styles.empty : styles.header);

        for (int c = 0; c < columns.size(); c++) {
            ReportColumn column = columns.get(c);
            Cell groupCell = groupRow.createCell(c + 1);
            Cell labelCell = labelRow.createCell(c + 1);
            if (column.isSpacer()) {
                groupCell.setCellStyle(styles.empty);
                labelCell.setCellStyle(styles.empty);
            } else {
                groupCell.setCellStyle(styles.header);
                labelCell.setCellValue(column.getLabel());
                labelCell.setCellStyle(styles.header);
            }
        }

        for (ColumnRun run : table.groupRuns()) {
            groupRow.getCell(run.getFirst() + 1).setCellValue(run.getGroup());
            if (run.width() > 1) {
                sheet.addMergedRegion(new CellRangeAddress(0, 0, run.getFirst() + 1, run.getLast() + 1));
            }
        }

        List<ReportRow> rows = table.getRows();
        for (int r = 0; r < rows.size(); r++) {
            ReportRow reportRow = rows.get(r);
            Row row = sheet.createRow(HEADER_ROWS + r);

            Cell indexCell = row.createCell(0);
            if (reportRow.getIndex() != null) {
                indexCell.setCellValue(reportRow.getIndex().doubleValue());
                indexCell.setCellStyle(styles.header);
            }

            for (int c = 0; c < columns.size(); c++) {
                Cell cell = row.createCell(c + 1);
                BigDecimal value = reportRow.cell(c);
                if (value != null) {
                    cell.setCellValue(value.doubleValue());
                }
                if (columns.get(c).isSpacer()) {
                    cell.setCellStyle(styles.empty);
                }
            }
        }

        if (table.isGridBorders()) {
            for (ColumnRun run : table.dataRuns()) {
                drawGrid(sheet, run, rows.size(), styles.grid);
            }
        }

        if (table.isIndexHidden()) {
            sheet.setColumnHidden(0, true);
        }
        fitColumns(sheet, columns.size() + 1, table.isIndexHidden());

        log.info("Rendered sheet {}: {} columns, {} rows", table.getSheetName(), columns.size(), rows.size());
        return sheet;
    }

    public byte[] toBytes(Workbook workbook) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            workbook.write(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new WorkbookWriteException("Failed to write processed workbook", e);
        }
    }

    private Sheet replaceSheet(Workbook workbook, String name) {
        int existing = -1;
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            if (workbook.getSheetName(i).equalsIgnoreCase(name)) {
                existing = i;
                break;
            }
        }
        if (existing < 0) {
            return workbook.createSheet(name);
        }
        workbook.removeSheetAt(existing);
        Sheet sheet = workbook.createSheet(name);
        workbook.setSheetOrder(name, existing);
        return sheet;
    }

    /** Thin borders on every data cell of one call or put sub-block. */
    private void drawGrid(Sheet sheet, ColumnRun run, int rowCount, CellStyle grid) {
        for (int r = HEADER_ROWS; r < HEADER_ROWS + rowCount; r++) {
            Row row = sheet.getRow(r);
            for (int c = run.getFirst(); c <= run.getLast(); c++) {
                row.getCell(c + 1).setCellStyle(grid);
            }
        }
    }

    /** Width = longest displayed value in the column plus padding, in characters. */
    private void fitColumns(Sheet sheet, int columnCount, boolean skipIndex) {
        DataFormatter formatter = CellValues.formatter();
        int[] longest = new int[columnCount];
        for (Row row : sheet) {
            for (Cell cell : row) {
                int c = cell.getColumnIndex();
                if (c < columnCount) {
                    longest[c] = Math.max(longest[c], CellValues.text(formatter, cell).length());
                }
            }
        }
        for (int c = skipIndex ? 1 : 0; c < columnCount; c++) {
            int chars = Math.min(longest[c] + levelsProperties.getColumnPadding(), MAX_COLUMN_CHARS);
            sheet.setColumnWidth(c, chars * 256);
        }
    }

    private static final class Styles {

        private final CellStyle header;
        private final CellStyle grid;
        private final CellStyle empty;

        private Styles(Workbook workbook) {
            Font bold = workbook.createFont();
            bold.setBold(true);

            header = workbook.createCellStyle();
            header.setFont(bold);
            header.setAlignment(HorizontalAlignment.CENTER);
            thinBorder(header);

            grid = workbook.createCellStyle();
            thinBorder(grid);

            empty = workbook.createCellStyle();
            empty.setBorderTop(BorderStyle.NONE);
            empty.setBorderBottom(BorderStyle.NONE);
            empty.setBorderLeft(BorderStyle.NONE);
            empty.setBorderRight(BorderStyle.NONE);
        }

        private static void thinBorder(CellStyle style) {
            style.setBorderTop(BorderStyle.THIN);
            style.setBorderBottom(BorderStyle.THIN);
            style.setBorderLeft(BorderStyle.THIN);
            style.setBorderRight(BorderStyle.THIN);
        }
    }
}
