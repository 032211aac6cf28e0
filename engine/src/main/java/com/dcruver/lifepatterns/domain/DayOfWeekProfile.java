package com.dcruver.lifepatterns.domain;

import lombok.Builder;
import lombok.Value;

import java.time.DayOfWeek;
import java.util.Map;

/**
 * Average mood per weekday across the whole period.
 */
@Value
@Builder
public class DayOfWeekProfile {
    Map<DayOfWeek, Entry> days;  // only weekdays that occur, Monday first

    public enum Polarity {
        POSITIVE,
        NEGATIVE,
        NEUTRAL
    }

    @Value
    public static class Entry {
        double averageMood;
        int sampleCount;
        Polarity polarity;
    }
}
