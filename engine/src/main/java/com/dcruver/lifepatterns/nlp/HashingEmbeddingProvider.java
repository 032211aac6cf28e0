package com.dcruver.lifepatterns.nlp;

import com.dcruver.lifepatterns.domain.JournalEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline bag-of-words embedder: each token is hashed into one of D buckets
 * and the count vector is L2-normalised. Deterministic across JVMs because
 * String.hashCode is specified.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "lifepatterns.embedding.provider", havingValue = "hashing")
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private static final Pattern TOKEN = Pattern.compile("[a-z0-9']+");

    private final int dimension;

    public HashingEmbeddingProvider(@Value("${lifepatterns.embedding.hashing.dimension:256}") int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("Hashing dimension must be >= 1");
        }
        this.dimension = dimension;
        log.info("HashingEmbeddingProvider initialized with {} dimensions", dimension);
    }

    @Override
    public double[] embed(JournalEntry entry) {
        double[] vector = new double[dimension];
        Matcher matcher = TOKEN.matcher(entry.combinedText().toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            vector[Math.floorMod(matcher.group().hashCode(), dimension)] += 1.0;
        }

        double norm = 0.0;
        for (double value : vector) {
            norm += value * value;
        }
        if (norm > 0.0) {
            norm = Math.sqrt(norm);
            for (int i = 0; i < vector.length; i++) {
                vector[i] /= norm;
            }
        }
        return vector;
    }

    @Override
    public String name() {
        return "hashing-" + dimension;
    }
}
