package com.dcruver.lifepatterns.domain.temporal;

import com.dcruver.lifepatterns.domain.DayRecord;

/**
 * Per-day mood scalar. The aggregator and cycle detector only average it;
 * they never derive sentiment on their own.
 */
@FunctionalInterface
public interface MoodSignal {

    double score(DayRecord day);
}
