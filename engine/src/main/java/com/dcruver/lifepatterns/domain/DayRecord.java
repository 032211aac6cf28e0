package com.dcruver.lifepatterns.domain;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Value;

import java.time.LocalDate;
import java.util.Arrays;

/**
 * A single day reduced to its embedding vector.
 * The vector is copied on the way in and on the way out.
 */
@Value
public class DayRecord {
    String id;
    LocalDate date;
    @Getter(AccessLevel.NONE)
    double[] embedding;

    public DayRecord(String id, LocalDate date, double[] embedding) {
        if (id == null || date == null || embedding == null) {
            throw new IllegalArgumentException("id, date and embedding are required");
        }
        this.id = id;
        this.date = date;
        this.embedding = embedding.clone();
    }

    public double[] getEmbedding() {
        return embedding.clone();
    }

    public int dimension() {
        return embedding.length;
    }

    /**
     * Read a single component without copying the vector.
     */
    public double component(int index) {
        return embedding[index];
    }

    @Override
    public String toString() {
        return "DayRecord(" + id + ", " + date + ", dim=" + embedding.length
            + ", head=" + Arrays.toString(Arrays.copyOf(embedding, Math.min(3, embedding.length))) + ")";
    }
}
