package com.dcruver.lifepatterns.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * A day that isolates unusually fast in embedding space.
 */
@Value
@Builder
public class Anomaly {
    String dayId;
    LocalDate date;
    double score;  // 0.0-1.0, higher is more anomalous
    int rank;  // 1-based
    String category;
    String description;
}
