package com.dcruver.lifepatterns.domain;

import lombok.Getter;

/**
 * Raised when a stage receives fewer records than it needs. Fatal.
 */
@Getter
public class InsufficientDataException extends LifePatternException {
    private final int required;
    private final int actual;

    public InsufficientDataException(String stage, int required, int actual) {
        super(String.format("%s needs at least %d records but got %d", stage, required, actual));
        this.required = required;
        this.actual = actual;
    }
}
