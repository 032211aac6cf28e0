package com.dcruver.lifepatterns.domain;

import lombok.Builder;
import lombok.Value;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Optional;

/**
 * A recurring structure in the mood signal at a fixed period.
 */
@Value
@Builder
public class CyclicPattern {
    String description;
    int periodDays;
    double strength;  // 1 - supportingStat
    double supportingStat;  // within-phase variance / overall variance
    int peakPhase;  // offset into the period with the highest mean mood
    int troughPhase;  // offset with the lowest mean mood
    List<Double> phaseMeans;
    DayOfWeek peakDay;  // only for weekly periods
    DayOfWeek troughDay;

    public Optional<DayOfWeek> getPeakDay() {
        return Optional.ofNullable(peakDay);
    }

    public Optional<DayOfWeek> getTroughDay() {
        return Optional.ofNullable(troughDay);
    }
}
