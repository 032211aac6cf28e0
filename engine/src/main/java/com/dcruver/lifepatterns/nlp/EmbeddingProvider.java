package com.dcruver.lifepatterns.nlp;

import com.dcruver.lifepatterns.domain.DayRecord;
import com.dcruver.lifepatterns.domain.JournalEntry;

import java.util.List;

/**
 * Maps a day's multi-modal entry to a fixed-dimension vector.
 * Implementations are constructed once and reused for every entry in a run.
 */
public interface EmbeddingProvider {

    double[] embed(JournalEntry entry);

    /**
     * Embed every entry, keeping input order. All vectors share one dimension.
     */
    default List<DayRecord> embedAll(List<JournalEntry> entries) {
        return entries.stream()
            .map(entry -> new DayRecord(entry.getEntryId(), entry.getDate(), embed(entry)))
            .toList();
    }

    String name();
}
