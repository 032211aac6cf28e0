package com.dcruver.lifepatterns.domain.insight;

import com.dcruver.lifepatterns.config.AnalysisSettings;
import com.dcruver.lifepatterns.domain.EntryTextSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Scans generated insight text and the original entries for risk and
 * ambiguity language. It only ever returns notes to append; the text it
 * scanned is left untouched.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SafetyFilter {

    public static final String DISCLAIMER = "All insights are observational and non-diagnostic. "
        + "This analysis does not replace professional mental health assessment.";

    private final AnalysisSettings settings;

    public List<String> review(Collection<String> generatedText, Collection<String> dayIds, EntryTextSource texts) {
        List<String> notes = new ArrayList<>();

        boolean generatedRisk = generatedText.stream().anyMatch(text -> mentionsAny(text, settings.getRiskKeywords()));
        long riskyEntries = dayIds.stream()
            .filter(id -> mentionsAny(texts.textOf(id), settings.getRiskKeywords()))
            .count();

        if (generatedRisk || riskyEntries > 0) {
            log.warn("Risk language found in {} entries{}", riskyEntries,
                generatedRisk ? " and in generated insights" : "");
            notes.add(String.format("High-risk emotional language appeared in %d of %d entries. "
                + "This is not a diagnosis; professional consultation is strongly recommended.",
                riskyEntries, dayIds.size()));
        }

        long ambiguousEntries = dayIds.stream()
            .filter(id -> mentionsAny(texts.textOf(id), settings.getAmbiguityKeywords()))
            .count();
        if (ambiguousEntries > 0) {
            notes.add(String.format("Ambiguous self-doubt language detected on %d occasions. "
                + "Interpretations should consider broader context.", ambiguousEntries));
        }

        return List.copyOf(notes);
    }

    private boolean mentionsAny(String text, List<String> keywords) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(keyword -> lower.contains(keyword.toLowerCase(Locale.ROOT)));
    }
}
