package com.dcruver.lifepatterns.domain.temporal;

import com.dcruver.lifepatterns.domain.DayRecord;

/**
 * Projects each day vector onto a fixed "valence" direction.
 * The direction is normalised to unit length on construction.
 */
public class ValenceProjectionMoodSignal implements MoodSignal {

    private final double[] direction;

    public ValenceProjectionMoodSignal(double[] direction) {
        double norm = 0.0;
        for (double value : direction) {
            norm += value * value;
        }
        if (norm == 0.0) {
            throw new IllegalArgumentException("Valence direction must be non-zero");
        }
        norm = Math.sqrt(norm);
        this.direction = new double[direction.length];
        for (int i = 0; i < direction.length; i++) {
            this.direction[i] = direction[i] / norm;
        }
    }

    @Override
    public double score(DayRecord day) {
        if (day.dimension() != direction.length) {
            throw new IllegalArgumentException(String.format(
                "Day %s has dimension %d, valence direction has %d",
                day.getId(), day.dimension(), direction.length));
        }
        double projection = 0.0;
        for (int i = 0; i < direction.length; i++) {
            projection += day.component(i) * direction[i];
        }
        return projection;
    }
}
