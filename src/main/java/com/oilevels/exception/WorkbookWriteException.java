package com.oilevels.exception;

/**
 * The report sheets could not be written into the workbook, or the result could not be serialized.
 */
public class WorkbookWriteException extends BaseException {

    public WorkbookWriteException(String message, Throwable cause) {
        super(ErrorCode.WORKBOOK_UNWRITABLE, message, cause);
    }
}
