package com.oilevels.domain.enums;

/**
 * Kind of a report column: DATA carries values, SPACER is an empty visual separator.
 */
public enum ColumnKind {
    DATA,
    SPACER
}
