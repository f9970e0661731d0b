package com.oilevels.domain.enums;

/**
 * Why a day sheet was skipped. Skipped sheets never abort the run.
 */
public enum SheetFailureReason {
    HEADER_NOT_FOUND,
    MISSING_REQUIRED_COLUMN,
    UNREADABLE_SHEET
}
