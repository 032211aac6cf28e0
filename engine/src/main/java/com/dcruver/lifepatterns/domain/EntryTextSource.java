package com.dcruver.lifepatterns.domain;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Looks up the original text behind a day. The analytics never own text,
 * they only ask for it by day id.
 */
@FunctionalInterface
public interface EntryTextSource {

    /**
     * @return the combined text for the day, or an empty string when unknown
     */
    String textOf(String dayId);

    static EntryTextSource empty() {
        return dayId -> "";
    }

    static EntryTextSource of(Map<String, String> textsById) {
        Map<String, String> copy = Map.copyOf(textsById);
        return dayId -> copy.getOrDefault(dayId, "");
    }

    static EntryTextSource fromEntries(List<JournalEntry> entries) {
        return of(entries.stream()
            .collect(Collectors.toMap(JournalEntry::getEntryId, JournalEntry::combinedText,
                (first, second) -> first)));
    }

    static EntryTextSource from(Function<String, String> lookup) {
        return dayId -> {
            String text = lookup.apply(dayId);
            return text != null ? text : "";
        };
    }
}
