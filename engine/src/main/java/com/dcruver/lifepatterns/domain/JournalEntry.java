package com.dcruver.lifepatterns.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * One day of raw multi-modal input as handed over by ingestion.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class JournalEntry {
    @JsonProperty("entry_id")
    String entryId;
    LocalDate date;
    String text;
    @JsonProperty("voice_transcript")
    String voiceTranscript;
    @JsonProperty("image_caption")
    String imageCaption;
    @JsonProperty("location_city")
    String locationCity;

    /**
     * All modalities folded into one labelled string, empty parts omitted.
     */
    public String combinedText() {
        List<String> parts = new ArrayList<>();
        if (text != null && !text.isBlank()) {
            parts.add("Diary: " + text.trim());
        }
        if (voiceTranscript != null && !voiceTranscript.isBlank()) {
            parts.add("Voice: " + voiceTranscript.trim());
        }
        if (imageCaption != null && !imageCaption.isBlank()) {
            parts.add("Scene: " + imageCaption.trim());
        }
        return String.join(" ", parts);
    }
}
