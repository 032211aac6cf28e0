package com.dcruver.lifepatterns.domain.clustering;

import com.dcruver.lifepatterns.TestData;
import com.dcruver.lifepatterns.config.AnalysisSettings;
import com.dcruver.lifepatterns.domain.ClusteringResult;
import com.dcruver.lifepatterns.domain.DayRecord;
import com.dcruver.lifepatterns.domain.DegenerateClusteringWarning;
import com.dcruver.lifepatterns.domain.EntryTextSource;
import com.dcruver.lifepatterns.domain.InsufficientDataException;
import com.dcruver.lifepatterns.domain.InvalidConfigurationException;
import com.dcruver.lifepatterns.domain.ThemeCluster;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ThemeClustererTest {

    private AnalysisSettings settings;
    private ThemeClusterer clusterer;

    @BeforeEach
    void setUp() {
        settings = TestData.settings();
        clusterer = TestData.clusterer(settings);
    }

    @Test
    void testSeparatedBlobsAreRecovered() {
        // Three tight blobs far apart in 8 dimensions, days assigned round-robin
        List<DayRecord> days = TestData.blobs(TestData.axisCenters(3, 8, 10.0), 30, 0.2, 7L);

        ClusteringResult result = clusterer.cluster(days, EntryTextSource.empty(), 3, 42L);

        assertEquals(3, result.getClusters().size());
        assertTrue(result.getWarning().isEmpty());
        for (int i = 0; i < days.size(); i++) {
            // Ids are numbered by first appearance, so day i lands in cluster i % 3
            assertEquals(i % 3, result.clusterOf(days.get(i).getId()), "day " + i);
        }
        for (ThemeCluster cluster : result.getClusters()) {
            assertEquals(10, cluster.size());
            assertTrue(cluster.getConfidence() > 0.8, "confidence " + cluster.getConfidence());
        }
    }

    @Test
    void testFiveInjectedThemesWithFiveClusters() {
        settings.setK(5);
        List<DayRecord> days = TestData.blobs(TestData.axisCenters(5, 16, 10.0), 30, 0.2, 7L);

        ClusteringResult result = clusterer.cluster(days, EntryTextSource.empty(), 5, 42L);

        assertEquals(5, result.getClusters().size());
        for (int i = 0; i < days.size(); i++) {
            assertEquals(i % 5, result.clusterOf(days.get(i).getId()), "day " + i);
        }
        for (ThemeCluster cluster : result.getClusters()) {
            assertEquals(6, cluster.size());
            assertTrue(cluster.getConfidence() > 0.7, "confidence " + cluster.getConfidence());
        }
    }

    @Test
    void testEveryDayBelongsToExactlyOneCluster() {
        List<DayRecord> days = TestData.blobs(TestData.axisCenters(4, 5, 3.0), 23, 1.0, 3L);

        ClusteringResult result = clusterer.cluster(days, EntryTextSource.empty(), 4, 42L);

        Set<String> seen = new HashSet<>();
        int total = 0;
        for (ThemeCluster cluster : result.getClusters()) {
            assertFalse(cluster.getMemberIds().isEmpty());
            total += cluster.size();
            seen.addAll(cluster.getMemberIds());
            for (String id : cluster.getMemberIds()) {
                assertEquals(cluster.getClusterId(), result.clusterOf(id));
            }
        }
        assertEquals(days.size(), total);
        assertEquals(days.size(), seen.size());
        assertEquals(days.size(), result.getEntryConfidences().size());
        result.getEntryConfidences().values()
            .forEach(confidence -> assertTrue(confidence >= 0.0 && confidence <= 1.0));
        result.getClusters()
            .forEach(cluster -> assertTrue(cluster.getConfidence() >= 0.0 && cluster.getConfidence() <= 1.0));
    }

    @Test
    void testSameSeedGivesSamePartition() {
        List<DayRecord> days = TestData.blobs(TestData.axisCenters(3, 6, 2.0), 25, 1.5, 11L);

        ClusteringResult first = clusterer.cluster(days, EntryTextSource.empty(), 3, 99L);
        ClusteringResult second = clusterer.cluster(days, EntryTextSource.empty(), 3, 99L);

        assertEquals(first.getAssignments(), second.getAssignments());
        assertEquals(first.getInertia(), second.getInertia());
        assertEquals(first.getClusters(), second.getClusters());
    }

    @Test
    void testFewerDistinctVectorsThanThemesReducesK() {
        double[] a = {1.0, 0.0};
        double[] b = {0.0, 1.0};
        List<DayRecord> days = List.of(
            new DayRecord("d1", TestData.START, a),
            new DayRecord("d2", TestData.START.plusDays(1), b),
            new DayRecord("d3", TestData.START.plusDays(2), a),
            new DayRecord("d4", TestData.START.plusDays(3), b),
            new DayRecord("d5", TestData.START.plusDays(4), a));

        ClusteringResult result = clusterer.cluster(days, EntryTextSource.empty(), 3, 42L);

        assertEquals(2, result.getClusters().size());
        DegenerateClusteringWarning warning = result.getWarning().orElseThrow();
        assertEquals(3, warning.requestedK());
        assertEquals(2, warning.effectiveK());
        assertTrue(warning.message().contains("only 2 distinct"));
        assertEquals(result.clusterOf("d1"), result.clusterOf("d3"));
        assertNotEquals(result.clusterOf("d1"), result.clusterOf("d2"));
    }

    @Test
    void testSameDirectionVectorsAreDuplicatesUnderCosine() {
        settings.setDistanceMetric(DistanceMetric.COSINE);
        List<DayRecord> days = List.of(
            new DayRecord("d1", TestData.START, new double[]{1.0, 0.0}),
            new DayRecord("d2", TestData.START.plusDays(1), new double[]{2.0, 0.0}),
            new DayRecord("d3", TestData.START.plusDays(2), new double[]{0.0, 1.0}),
            new DayRecord("d4", TestData.START.plusDays(3), new double[]{0.0, 3.0}));

        ClusteringResult result = clusterer.cluster(days, EntryTextSource.empty(), 3, 42L);

        assertEquals(2, result.getClusters().size());
        assertEquals(2, result.getWarning().orElseThrow().effectiveK());
        assertEquals(result.clusterOf("d1"), result.clusterOf("d2"));
        assertEquals(result.clusterOf("d3"), result.clusterOf("d4"));
        assertNotEquals(result.clusterOf("d1"), result.clusterOf("d3"));
    }

    @Test
    void testSignedZeroIsNotADistinctVector() {
        List<DayRecord> days = List.of(
            new DayRecord("d1", TestData.START, new double[]{0.0, 1.0}),
            new DayRecord("d2", TestData.START.plusDays(1), new double[]{-0.0, 1.0}),
            new DayRecord("d3", TestData.START.plusDays(2), new double[]{5.0, 5.0}));

        ClusteringResult result = clusterer.cluster(days, EntryTextSource.empty(), 3, 42L);

        assertEquals(2, result.getClusters().size());
        assertEquals(2, result.getWarning().orElseThrow().distinctVectors());
        assertEquals(result.clusterOf("d1"), result.clusterOf("d2"));
    }

    @Test
    void testKeywordsAndLabelsComeFromMemberTexts() {
        List<DayRecord> days = TestData.blobs(TestData.axisCenters(3, 4, 10.0), 12, 0.1, 5L);
        Map<String, String> texts = new HashMap<>();
        for (int i = 0; i < days.size(); i++) {
            String text = switch (i % 3) {
                case 0 -> TestData.WORK_TEXT;
                case 1 -> TestData.SOCIAL_TEXT;
                default -> TestData.REST_TEXT;
            };
            texts.put(days.get(i).getId(), text);
        }

        ClusteringResult result = clusterer.cluster(days, EntryTextSource.of(texts), 3, 42L);

        assertEquals("Work Performance", result.cluster(0).getLabel());
        assertEquals("Social Connection", result.cluster(1).getLabel());
        assertEquals("Rest & Recovery", result.cluster(2).getLabel());
        assertTrue(result.cluster(0).getKeywords().contains("deadline"));
        assertEquals(3, result.cluster(0).getExemplarIds().size());
        assertTrue(result.cluster(0).getMemberIds().containsAll(result.cluster(0).getExemplarIds()));
    }

    @Test
    void testFewerThanTwoDaysIsRejected() {
        List<DayRecord> days = List.of(new DayRecord("d1", TestData.START, new double[]{1.0}));

        InsufficientDataException error = assertThrows(InsufficientDataException.class,
            () -> clusterer.cluster(days, EntryTextSource.empty(), 3, 42L));
        assertEquals(2, error.getRequired());
        assertEquals(1, error.getActual());
    }

    @Test
    void testNonPositiveKIsRejected() {
        List<DayRecord> days = TestData.blobs(TestData.axisCenters(2, 2, 1.0), 4, 0.1, 1L);

        InvalidConfigurationException error = assertThrows(InvalidConfigurationException.class,
            () -> clusterer.cluster(days, EntryTextSource.empty(), 0, 42L));
        assertEquals("k", error.getField());
    }

    @Test
    void testMixedDimensionsAreRejected() {
        List<DayRecord> days = List.of(
            new DayRecord("d1", TestData.START, new double[]{1.0, 2.0}),
            new DayRecord("d2", TestData.START.plusDays(1), new double[]{1.0}));

        assertThrows(IllegalArgumentException.class,
            () -> clusterer.cluster(days, EntryTextSource.empty(), 3, 42L));
    }
}
