package com.cadastral.lookup.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Value object carrying the external resolver's answer for a cadastral number.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ResolutionResult {
    private final boolean matched;

    public ResolutionResult(boolean matched) {
        this.matched = matched;
    }
}
