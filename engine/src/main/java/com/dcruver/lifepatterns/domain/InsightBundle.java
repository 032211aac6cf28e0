package com.dcruver.lifepatterns.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Natural-language output of the engine. Safety notes are kept apart from
 * the factual statements and never rewrite them.
 */
@Value
@Builder
public class InsightBundle {
    List<String> micro;  // one per week
    String macro;
    String predictive;
    List<String> safetyNotes;
    String disclaimer;

    public boolean hasSafetyNotes() {
        return !safetyNotes.isEmpty();
    }
}
