package com.oilevels.exception;

/**
 * The uploaded bytes could not be opened (or re-serialized) as a spreadsheet workbook.
 */
public class WorkbookReadException extends BaseException {

    public WorkbookReadException(String message, Throwable cause) {
        super(ErrorCode.WORKBOOK_UNREADABLE, message, cause);
    }
}
