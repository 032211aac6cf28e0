package com.dcruver.lifepatterns.domain.clustering;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ThemeLabelerTest {

    private final ThemeLabeler labeler = new ThemeLabeler();
    private final KeywordExtractor extractor = new KeywordExtractor();

    @Test
    void testBestOverlapWins() {
        assertEquals("Work Performance", labeler.label(0, List.of("deadline", "team", "friends")));
        assertEquals("Health & Wellness", labeler.label(0, List.of("running", "energy", "sleep")));
    }

    @Test
    void testTieGoesToEarlierRule() {
        // one hit each for Work Performance and Social Connection
        assertEquals("Work Performance", labeler.label(0, List.of("meeting", "family")));
    }

    @Test
    void testFallsBackToKeywordsThenNumber() {
        assertEquals("Garden Tomatoes", labeler.label(2, List.of("garden", "tomatoes", "watering")));
        assertEquals("Theme 3", labeler.label(2, List.of()));
    }

    @Test
    void testExtractorRanksByFrequency() {
        List<String> keywords = extractor.extract(List.of(
            "Diary: morning walk, morning coffee",
            "Voice: walk home",
            "Scene: morning light"), 3);

        // equal counts keep first-appearance order
        assertEquals(List.of("morning", "walk", "coffee"), keywords);
    }

    @Test
    void testExtractorSkipsShortAndStopWords() {
        List<String> keywords = extractor.extract(List.of("The cat sat with them about work work"), 10);

        assertEquals(List.of("work"), keywords);
    }
}
