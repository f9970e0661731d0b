package com.oilevels.workbook;

import java.math.BigDecimal;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;

/**
 * Cell coercion helpers for option-chain sheets.
 *
 * <p>Numeric coercion accepts numeric cells, numeric text and cached formula results.
 * Anything else (blank, error, boolean, free text) is missing and returns null.
 */
public final class CellValues {

    private CellValues() {}

    public static BigDecimal numeric(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        return switch (type) {
            case NUMERIC -> {
                double value = cell.getNumericCellValue();
                yield Double.isFinite(value) ? BigDecimal.valueOf(value) : null;
            }
            case STRING -> parse(cell.getStringCellValue());
            default -> null;
        };
    }

    /** Numeric text to a number, or null when the text is not a plain decimal. */
    public static BigDecimal parse(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * A formatter for one parse or render pass. {@link DataFormatter} caches formats internally
     * and must not be shared between threads. Formula cells show their cached result.
     */
    public static DataFormatter formatter() {
        DataFormatter formatter = new DataFormatter();
        formatter.setUseCachedValuesForFormulaCells(true);
        return formatter;
    }

    /** Displayed text of a cell, trimmed; empty for a missing cell. */
    public static String text(DataFormatter formatter, Cell cell) {
        if (cell == null) {
            return "";
        }
        return formatter.formatCellValue(cell).trim();
    }
}
