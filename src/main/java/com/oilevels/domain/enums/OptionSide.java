package com.oilevels.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Call (CE) side gives resistance levels, put (PE) side gives support levels.
 */
@Getter
@RequiredArgsConstructor
public enum OptionSide {
    CALL("CE"),
    PUT("PE");

    private final String label;
}
