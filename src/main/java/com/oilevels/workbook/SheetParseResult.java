package com.oilevels.workbook;

import com.oilevels.domain.enums.SheetFailureReason;
import com.oilevels.domain.model.DailyRecord;
import java.util.List;
import lombok.Value;

/**
 * Outcome of parsing one day sheet: either records or a failure reason with a message.
 */
@Value
public class SheetParseResult {

    String sheetName;
    List<DailyRecord> records;
    SheetFailureReason failureReason;
    String failureMessage;

    public static SheetParseResult success(String sheetName, List<DailyRecord> records) {
        return new SheetParseResult(sheetName, List.copyOf(records), null, null);
    }

    public static SheetParseResult failure(String sheetName, SheetFailureReason reason, String message) {
        return new SheetParseResult(sheetName, List.of(), reason, message);
    }

    public boolean isSuccess() {
        return failureReason == null;
    }
}
