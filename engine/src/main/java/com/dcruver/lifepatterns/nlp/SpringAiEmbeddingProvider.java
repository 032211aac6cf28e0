package com.dcruver.lifepatterns.nlp;

import com.dcruver.lifepatterns.domain.DayRecord;
import com.dcruver.lifepatterns.domain.JournalEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Embeds entries through a Spring AI EmbeddingModel (Ollama by default).
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "lifepatterns.embedding.provider", havingValue = "ollama", matchIfMissing = true)
public class SpringAiEmbeddingProvider implements EmbeddingProvider {

    static final String EMPTY_ENTRY_TEXT = "No content recorded.";

    private final EmbeddingModel embeddingModel;

    public SpringAiEmbeddingProvider(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
        log.info("SpringAiEmbeddingProvider initialized with EmbeddingModel: {}",
            embeddingModel.getClass().getSimpleName());
    }

    @Override
    public double[] embed(JournalEntry entry) {
        return embedTexts(List.of(textFor(entry))).get(0);
    }

    /**
     * One batched call for the whole run.
     */
    @Override
    public List<DayRecord> embedAll(List<JournalEntry> entries) {
        if (entries.isEmpty()) {
            return List.of();
        }
        List<double[]> vectors = embedTexts(entries.stream().map(this::textFor).toList());

        List<DayRecord> days = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            JournalEntry entry = entries.get(i);
            days.add(new DayRecord(entry.getEntryId(), entry.getDate(), vectors.get(i)));
        }
        log.info("Embedded {} entries ({} dimensions)", days.size(), vectors.get(0).length);
        return days;
    }

    @Override
    public String name() {
        return "spring-ai:" + embeddingModel.getClass().getSimpleName();
    }

    private String textFor(JournalEntry entry) {
        String text = entry.combinedText();
        if (text.isBlank()) {
            log.warn("Entry {} has no text, embedding placeholder", entry.getEntryId());
            return EMPTY_ENTRY_TEXT;
        }
        return text;
    }

    private List<double[]> embedTexts(List<String> texts) {
        EmbeddingResponse response;
        try {
            response = embeddingModel.embedForResponse(texts);
        } catch (RuntimeException e) {
            throw new EmbeddingException("Embedding model call failed for " + texts.size() + " texts", e);
        }

        List<Embedding> results = response.getResults();
        if (results.size() != texts.size()) {
            throw new EmbeddingException(String.format(
                "Embedding model returned %d vectors for %d texts", results.size(), texts.size()));
        }

        List<double[]> vectors = new ArrayList<>(results.size());
        int dimension = -1;
        for (Embedding result : results) {
            // Convert float[] to double[]
            float[] floatArray = result.getOutput();
            if (dimension < 0) {
                dimension = floatArray.length;
            } else if (floatArray.length != dimension) {
                throw new EmbeddingException(String.format(
                    "Inconsistent embedding dimensions: %d and %d", dimension, floatArray.length));
            }
            double[] vector = new double[floatArray.length];
            for (int i = 0; i < floatArray.length; i++) {
                vector[i] = floatArray[i];
            }
            vectors.add(vector);
        }
        if (dimension == 0) {
            throw new EmbeddingException("Embedding model returned empty vectors");
        }
        return vectors;
    }
}
