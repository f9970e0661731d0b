package com.oilevels.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    PAYLOAD_TOO_LARGE("PAYLOAD_TOO_LARGE", 413),
    UNSUPPORTED_MEDIA_TYPE("UNSUPPORTED_MEDIA_TYPE", 415),
    WORKBOOK_UNREADABLE("WORKBOOK_UNREADABLE", 422),
    NO_VALID_DATA("NO_VALID_DATA", 422),
    WORKBOOK_UNWRITABLE("WORKBOOK_UNWRITABLE", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
