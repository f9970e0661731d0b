package com.oilevels.exception;

import java.util.List;
import java.util.Map;

/**
 * No day sheet matched the selection rule, or every matched sheet failed to parse.
 */
public class NoValidDataException extends BaseException {

    public NoValidDataException(List<String> matchedSheets, Map<String, String> sheetFailures) {
        super(
                ErrorCode.NO_VALID_DATA,
                matchedSheets.isEmpty()
                        ? "No day sheets found in workbook"
                        : String.format("None of the %d day sheets could be parsed", matchedSheets.size()),
                Map.of("daySheets", List.copyOf(matchedSheets), "failures", Map.copyOf(sheetFailures)));
    }
}
