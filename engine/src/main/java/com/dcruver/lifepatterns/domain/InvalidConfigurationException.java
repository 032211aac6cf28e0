package com.dcruver.lifepatterns.domain;

import lombok.Getter;

/**
 * Raised for an out-of-range parameter before any stage runs.
 */
@Getter
public class InvalidConfigurationException extends LifePatternException {
    private final String field;
    private final Object value;

    public InvalidConfigurationException(String field, Object value, String constraint) {
        super(String.format("Invalid configuration '%s' = %s: %s", field, value, constraint));
        this.field = field;
        this.value = value;
    }
}
