package com.dcruver.lifepatterns.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Summary of one window of consecutive days (normally seven).
 */
@Value
@Builder
public class WeekAggregate {
    int weekIndex;  // 1-based
    LocalDate startDate;
    LocalDate endDate;
    List<String> dayIds;
    Map<Integer, Integer> themeDistribution;  // clusterId -> day count, sorted by id
    int dominantClusterId;
    double moodScore;
    Trend trend;

    public int dayCount() {
        return dayIds.size();
    }
}
