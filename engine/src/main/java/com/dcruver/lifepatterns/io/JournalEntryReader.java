package com.dcruver.lifepatterns.io;

import com.dcruver.lifepatterns.domain.JournalEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

/**
 * Reads a JSON array of journal entries and returns them in date order.
 * Validation beyond the JSON shape belongs to the ingestion side.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JournalEntryReader {

    private final ObjectMapper objectMapper;

    public List<JournalEntry> read(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Journal file does not exist: " + file);
        }

        List<JournalEntry> entries = objectMapper.readValue(file.toFile(), new TypeReference<List<JournalEntry>>() {});
        List<JournalEntry> sorted = entries.stream()
            .sorted(Comparator.comparing(JournalEntry::getDate, Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();

        log.info("Loaded {} journal entries from {}", sorted.size(), file);
        return sorted;
    }
}
