package com.dcruver.lifepatterns.domain.anomaly;

import com.dcruver.lifepatterns.TestData;
import com.dcruver.lifepatterns.config.AnalysisSettings;
import com.dcruver.lifepatterns.domain.Anomaly;
import com.dcruver.lifepatterns.domain.ClusteringResult;
import com.dcruver.lifepatterns.domain.DayRecord;
import com.dcruver.lifepatterns.domain.EntryTextSource;
import com.dcruver.lifepatterns.domain.InsufficientDataException;
import com.dcruver.lifepatterns.domain.InvalidConfigurationException;
import com.dcruver.lifepatterns.domain.ThemeCluster;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AnomalyDetectorTest {

    private static final int DIMENSION = 4;

    private AnomalyDetector detector;
    private List<DayRecord> days;
    private ClusteringResult clustering;
    private EntryTextSource texts;

    @BeforeEach
    void setUp() {
        detector = new AnomalyDetector(TestData.settings(), new CategoryRuleTable());

        // 27 ordinary days around the origin, then three outliers of decreasing deviation
        Random random = new Random(17L);
        days = new ArrayList<>();
        for (int i = 0; i < 27; i++) {
            double[] vector = new double[DIMENSION];
            for (int d = 0; d < DIMENSION; d++) {
                vector[d] = 0.3 * random.nextGaussian();
            }
            days.add(new DayRecord(TestData.dayId(i), TestData.START.plusDays(i), vector));
        }
        days.add(new DayRecord("extreme", TestData.START.plusDays(27), new double[]{40, 40, 40, 40}));
        days.add(new DayRecord("strong", TestData.START.plusDays(28), new double[]{-15, -15, -15, -15}));
        days.add(new DayRecord("mild", TestData.START.plusDays(29), new double[]{6, 6, 6, 6}));

        clustering = singleTheme(days);
        texts = EntryTextSource.of(Map.of(
            "extreme", "Completely exhausted, barely slept.",
            "strong", "Nervous before the review, so much pressure.",
            "mild", "Went to the market."));
    }

    private static ClusteringResult singleTheme(List<DayRecord> days) {
        Map<String, Integer> assignments = new LinkedHashMap<>();
        Set<String> members = new LinkedHashSet<>();
        days.forEach(day -> {
            assignments.put(day.getId(), 0);
            members.add(day.getId());
        });
        ThemeCluster theme = ThemeCluster.builder()
            .clusterId(0)
            .label("Daily Routine")
            .centroid(List.of(0.0, 0.0, 0.0, 0.0))
            .memberIds(members)
            .confidence(0.9)
            .keywords(List.of("market", "walk"))
            .exemplarIds(List.of())
            .build();
        return ClusteringResult.builder()
            .clusters(List.of(theme))
            .assignments(assignments)
            .entryConfidences(Map.of())
            .build();
    }

    @Test
    void testOutliersAreRankedByDeviation() {
        List<Anomaly> anomalies = detector.detect(days, clustering, texts, 0.1, 42L, 3);

        // ceil(0.1 * 30) = 3
        assertEquals(List.of("extreme", "strong", "mild"), anomalies.stream().map(Anomaly::getDayId).toList());
        assertTrue(anomalies.get(0).getScore() > anomalies.get(1).getScore());
        assertTrue(anomalies.get(1).getScore() > anomalies.get(2).getScore());
    }

    @Test
    void testRanksAreContiguousAndScoresDescend() {
        List<Anomaly> anomalies = detector.detect(days, clustering, texts, 0.1, 42L, 3);

        for (int i = 0; i < anomalies.size(); i++) {
            Anomaly anomaly = anomalies.get(i);
            assertEquals(i + 1, anomaly.getRank());
            assertTrue(anomaly.getScore() >= 0.0 && anomaly.getScore() <= 1.0);
            if (i > 0) {
                assertTrue(anomalies.get(i - 1).getScore() >= anomaly.getScore());
            }
        }
    }

    @Test
    void testCategoriesUseDayText() {
        Map<String, Anomaly> byId = new LinkedHashMap<>();
        detector.detect(days, clustering, texts, 0.1, 42L, 3).forEach(a -> byId.put(a.getDayId(), a));

        assertEquals("fatigue spike", byId.get("extreme").getCategory());
        assertEquals("Significant fatigue indicators on 2024-01-28", byId.get("extreme").getDescription());
        assertEquals("stress surge", byId.get("strong").getCategory());
        assertEquals(CategoryRuleTable.UNCLASSIFIED, byId.get("mild").getCategory());
        assertEquals("Unusual pattern detected on 2024-01-30", byId.get("mild").getDescription());
    }

    @Test
    void testTopNCapsOutput() {
        List<Anomaly> top = detector.detect(days, clustering, texts, 0.1, 42L, 1);
        assertEquals(1, top.size());
        assertEquals("extreme", top.get(0).getDayId());
        assertTrue(detector.detect(days, clustering, texts, 0.1, 42L, 0).isEmpty());
        // operative set still caps a generous top-n
        assertEquals(3, detector.detect(days, clustering, texts, 0.1, 42L, 10).size());
    }

    @Test
    void testSameSeedGivesSameResult() {
        assertEquals(detector.detect(days, clustering, texts, 0.1, 7L, 3),
            detector.detect(days, clustering, texts, 0.1, 7L, 3));
    }

    @Test
    void testIdenticalDaysYieldNoAnomalies() {
        List<DayRecord> flat = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            flat.add(new DayRecord(TestData.dayId(i), TestData.START.plusDays(i), new double[]{0.5, 0.5, 0.5, 0.5}));
        }

        assertTrue(detector.detect(flat, singleTheme(flat), EntryTextSource.empty(), 0.1, 42L, 3).isEmpty());
    }

    @Test
    void testContaminationOutOfRangeIsRejected() {
        InvalidConfigurationException error = assertThrows(InvalidConfigurationException.class,
            () -> detector.detect(days, clustering, texts, 0.5, 42L, 3));
        assertEquals("contamination", error.getField());
        assertThrows(InvalidConfigurationException.class,
            () -> detector.detect(days, clustering, texts, 0.0, 42L, 3));
    }

    @Test
    void testSingleDayIsRejected() {
        assertThrows(InsufficientDataException.class,
            () -> detector.detect(days.subList(0, 1), clustering, texts, 0.1, 42L, 3));
    }

    @Test
    void testAveragePathLength() {
        assertEquals(0.0, IsolationForest.averagePathLength(1), 1e-12);
        assertEquals(1.0, IsolationForest.averagePathLength(2), 1e-12);
        assertTrue(IsolationForest.averagePathLength(256) > IsolationForest.averagePathLength(16));
    }

    @Test
    void testCategoryRulesFirstMatchWins() {
        CategoryRuleTable table = new CategoryRuleTable();

        // both stress and fatigue terms present; stress is listed first
        assertEquals("stress surge", table.categorize(List.of("tired"), "Under pressure all day").getCategory());
        assertEquals("confidence dip", table.categorize(List.of("doubt"), null).getCategory());
        assertEquals(CategoryRuleTable.UNCLASSIFIED, table.categorize(List.of(), "").getCategory());
    }
}
