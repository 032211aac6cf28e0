package com.dcruver.lifepatterns.domain.temporal;

import com.dcruver.lifepatterns.config.AnalysisSettings;
import com.dcruver.lifepatterns.domain.ClusteringResult;
import com.dcruver.lifepatterns.domain.DayRecord;
import com.dcruver.lifepatterns.domain.InvalidConfigurationException;
import com.dcruver.lifepatterns.domain.Trend;
import com.dcruver.lifepatterns.domain.WeekAggregate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Cuts the chronological day sequence into fixed windows and summarises each.
 * The last window keeps whatever days remain; nothing is padded or dropped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TemporalAggregator {

    private final AnalysisSettings settings;

    public List<WeekAggregate> aggregate(List<DayRecord> days, ClusteringResult clustering,
                                         MoodSignal mood, int window) {
        if (window < 1) {
            throw new InvalidConfigurationException("week-window", window, "must be >= 1");
        }
        if (days.isEmpty()) {
            return List.of();
        }

        List<WeekAggregate> weeks = new ArrayList<>();
        Double previousMood = null;

        for (int start = 0, weekIndex = 1; start < days.size(); start += window, weekIndex++) {
            List<DayRecord> slice = days.subList(start, Math.min(start + window, days.size()));

            Map<Integer, Integer> distribution = new TreeMap<>();
            double moodSum = 0.0;
            List<String> dayIds = new ArrayList<>();
            for (DayRecord day : slice) {
                distribution.merge(clustering.clusterOf(day.getId()), 1, Integer::sum);
                moodSum += mood.score(day);
                dayIds.add(day.getId());
            }
            double moodScore = moodSum / slice.size();

            Trend trend = previousMood == null
                ? Trend.STABLE
                : Trend.between(previousMood, moodScore, settings.getTrendEpsilon());

            WeekAggregate week = WeekAggregate.builder()
                .weekIndex(weekIndex)
                .startDate(slice.get(0).getDate())
                .endDate(slice.get(slice.size() - 1).getDate())
                .dayIds(List.copyOf(dayIds))
                .themeDistribution(Collections.unmodifiableMap(distribution))
                .dominantClusterId(dominant(distribution))
                .moodScore(moodScore)
                .trend(trend)
                .build();

            log.debug("Week {} ({} to {}): {} days, mood {}, {}", weekIndex, week.getStartDate(),
                week.getEndDate(), slice.size(), String.format("%.3f", moodScore), trend.label());

            weeks.add(week);
            previousMood = moodScore;
        }

        log.info("Aggregated {} days into {} windows of {}", days.size(), weeks.size(), window);
        return List.copyOf(weeks);
    }

    /**
     * Highest count wins; the TreeMap order makes the lowest id win ties.
     */
    private int dominant(Map<Integer, Integer> distribution) {
        int best = -1;
        int bestCount = 0;
        for (Map.Entry<Integer, Integer> entry : distribution.entrySet()) {
            if (entry.getValue() > bestCount) {
                bestCount = entry.getValue();
                best = entry.getKey();
            }
        }
        return best;
    }
}
