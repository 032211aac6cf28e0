package com.dcruver.lifepatterns.domain.clustering;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the most frequent salient words out of a handful of texts.
 * Salient means four letters or longer and not a stop word.
 */
@Component
public class KeywordExtractor {

    private static final Pattern WORD = Pattern.compile("\\b[a-z]{4,}\\b");

    // Modality prefixes ("diary", "voice", "scene") are noise too
    private static final Set<String> STOP_WORDS = Set.of(
        "the", "a", "an", "and", "or", "but", "in", "on", "at", "to",
        "for", "of", "with", "by", "from", "up", "about", "is", "was",
        "are", "were", "been", "be", "have", "has", "had", "do", "does",
        "did", "will", "would", "could", "should", "may", "might", "can",
        "diary", "voice", "scene", "this", "that", "i", "my", "me",
        "just", "then", "than", "they", "them", "their", "there", "what",
        "when", "into", "some", "very", "really", "today", "felt", "feel");

    /**
     * @return up to {@code limit} words, most frequent first, ties by first appearance
     */
    public List<String> extract(List<String> texts, int limit) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String text : texts) {
            if (text == null) {
                continue;
            }
            Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
            while (matcher.find()) {
                String word = matcher.group();
                if (!STOP_WORDS.contains(word)) {
                    counts.merge(word, 1, Integer::sum);
                }
            }
        }

        // Stable sort keeps first-appearance order among equal counts
        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(counts.entrySet());
        ranked.sort(Map.Entry.<String, Integer>comparingByValue().reversed());

        return ranked.stream()
            .limit(limit)
            .map(Map.Entry::getKey)
            .toList();
    }
}
