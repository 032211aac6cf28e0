package com.dcruver.lifepatterns.domain.cycle;

import com.dcruver.lifepatterns.config.AnalysisSettings;
import com.dcruver.lifepatterns.domain.CyclicPattern;
import com.dcruver.lifepatterns.domain.DayOfWeekProfile;
import com.dcruver.lifepatterns.domain.DayRecord;
import com.dcruver.lifepatterns.domain.temporal.MoodSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.inference.OneWayAnova;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Tests the mood sequence for structure that repeats every p days.
 *
 * Days are grouped by position modulo p. A period counts as cyclic when the
 * mean within-group variance is well below the overall variance and a one-way
 * ANOVA over the groups is significant. Both variances are bias-corrected.
 * At least two full periods of data are needed to judge a period.
 *
 * Positions are taken as consecutive days from the first date; weekday
 * names are derived from that date plus the phase offset.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CycleDetector {

    private static final int WEEK = 7;
    private static final double FLAT_SIGNAL = 1e-12;

    private final AnalysisSettings settings;

    public Optional<CyclicPattern> detectCycles(List<DayRecord> days, MoodSignal mood,
                                                Collection<Integer> periodCandidates) {
        double[] signal = days.stream().mapToDouble(mood::score).toArray();
        double overall = StatUtils.variance(signal);
        if (overall < FLAT_SIGNAL) {
            log.info("Mood signal is flat across {} days, no cycle to detect", days.size());
            return Optional.empty();
        }

        Integer bestPeriod = null;
        double bestRatio = Double.POSITIVE_INFINITY;
        for (int period : new TreeSet<>(periodCandidates)) {
            if (period < 2 || signal.length < 2 * period) {
                log.debug("Skipping period {}: {} days is less than two full periods", period, signal.length);
                continue;
            }
            List<double[]> groups = phaseGroups(signal, period);
            double ratio = meanWithinPhaseVariance(groups) / overall;
            double pValue = significance(groups, ratio);
            log.debug("Period {}: within/overall variance ratio {}, p-value {}",
                period, String.format("%.3f", ratio), String.format("%.4f", pValue));
            if (ratio < settings.getCycleThreshold() && pValue < settings.getCycleSignificance()
                && ratio < bestRatio) {
                bestRatio = ratio;
                bestPeriod = period;
            }
        }

        if (bestPeriod == null) {
            log.info("No candidate period in {} clears the {} variance-ratio threshold at p < {}",
                periodCandidates, settings.getCycleThreshold(), settings.getCycleSignificance());
            return Optional.empty();
        }

        CyclicPattern pattern = describe(days, signal, bestPeriod, bestRatio);
        log.info("Detected {}-day cycle with strength {}", bestPeriod, String.format("%.2f", pattern.getStrength()));
        return Optional.of(pattern);
    }

    /**
     * Mean mood per weekday present in the data, Monday first.
     */
    public DayOfWeekProfile profileDaysOfWeek(List<DayRecord> days, MoodSignal mood) {
        Map<DayOfWeek, double[]> sums = new EnumMap<>(DayOfWeek.class);
        for (DayRecord day : days) {
            double[] sum = sums.computeIfAbsent(day.getDate().getDayOfWeek(), d -> new double[2]);
            sum[0] += mood.score(day);
            sum[1] += 1;
        }

        Map<DayOfWeek, DayOfWeekProfile.Entry> entries = new EnumMap<>(DayOfWeek.class);
        sums.forEach((dayOfWeek, sum) -> {
            double average = sum[0] / sum[1];
            DayOfWeekProfile.Polarity polarity = average > 0 ? DayOfWeekProfile.Polarity.POSITIVE
                : average < 0 ? DayOfWeekProfile.Polarity.NEGATIVE
                : DayOfWeekProfile.Polarity.NEUTRAL;
            entries.put(dayOfWeek, new DayOfWeekProfile.Entry(average, (int) sum[1], polarity));
        });

        return DayOfWeekProfile.builder()
            .days(Collections.unmodifiableMap(entries))
            .build();
    }

    private CyclicPattern describe(List<DayRecord> days, double[] signal, int period, double ratio) {
        List<Double> phaseMeans = new ArrayList<>();
        int peak = 0;
        int trough = 0;
        for (double[] group : phaseGroups(signal, period)) {
            double mean = StatUtils.mean(group);
            int phase = phaseMeans.size();
            phaseMeans.add(mean);
            if (mean > phaseMeans.get(peak)) {
                peak = phase;
            }
            if (mean < phaseMeans.get(trough)) {
                trough = phase;
            }
        }

        double strength = 1.0 - ratio;
        CyclicPattern.CyclicPatternBuilder builder = CyclicPattern.builder()
            .periodDays(period)
            .strength(strength)
            .supportingStat(ratio)
            .peakPhase(peak)
            .troughPhase(trough)
            .phaseMeans(List.copyOf(phaseMeans));

        if (period == WEEK) {
            LocalDate first = days.get(0).getDate();
            DayOfWeek peakDay = first.plusDays(peak).getDayOfWeek();
            DayOfWeek troughDay = first.plusDays(trough).getDayOfWeek();
            builder.peakDay(peakDay)
                .troughDay(troughDay)
                .description(String.format(
                    "Weekly cycle: mood tends to dip on %ss and peak on %ss (strength %.2f).",
                    dayName(troughDay), dayName(peakDay), strength));
        } else {
            builder.description(String.format(
                "Mood repeats every %d days, lowest on day %d and highest on day %d of the cycle (strength %.2f).",
                period, trough + 1, peak + 1, strength));
        }
        return builder.build();
    }

    public static String dayName(DayOfWeek day) {
        return day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    private static List<double[]> phaseGroups(double[] signal, int period) {
        List<double[]> groups = new ArrayList<>(period);
        for (int phase = 0; phase < period; phase++) {
            double[] group = new double[(signal.length - phase + period - 1) / period];
            for (int i = phase, j = 0; i < signal.length; i += period, j++) {
                group[j] = signal[i];
            }
            groups.add(group);
        }
        return groups;
    }

    private static double meanWithinPhaseVariance(List<double[]> groups) {
        double[] variances = groups.stream().mapToDouble(StatUtils::variance).toArray();
        return StatUtils.mean(variances);
    }

    /**
     * One-way ANOVA p-value over the phase groups. Groups without any spread
     * cannot be tested and count as significant.
     */
    private static double significance(List<double[]> groups, double ratio) {
        if (ratio < FLAT_SIGNAL) {
            return 0.0;
        }
        return new OneWayAnova().anovaPValue(groups);
    }
}
