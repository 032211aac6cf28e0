package com.dcruver.lifepatterns.domain;

/**
 * Week-over-week direction of the mood signal.
 */
public enum Trend {
    IMPROVING,
    DECLINING,
    STABLE;

    public static Trend between(double previous, double current, double epsilon) {
        double delta = current - previous;
        if (delta > epsilon) {
            return IMPROVING;
        }
        if (delta < -epsilon) {
            return DECLINING;
        }
        return STABLE;
    }

    public String label() {
        return name().toLowerCase();
    }
}
