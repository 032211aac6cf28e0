package com.dcruver.lifepatterns.domain;

/**
 * Base type for every failure raised by the analytics engine.
 */
public class LifePatternException extends RuntimeException {

    public LifePatternException(String message) {
        super(message);
    }

    public LifePatternException(String message, Throwable cause) {
        super(message, cause);
    }
}
