package com.dcruver.lifepatterns.nlp;

import com.dcruver.lifepatterns.TestData;
import com.dcruver.lifepatterns.domain.DayRecord;
import com.dcruver.lifepatterns.domain.JournalEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SpringAiEmbeddingProviderTest {

    @Mock
    private EmbeddingModel embeddingModel;

    private SpringAiEmbeddingProvider provider;

    @BeforeEach
    void setUp() {
        provider = new SpringAiEmbeddingProvider(embeddingModel);
    }

    private static EmbeddingResponse response(float[]... vectors) {
        List<Embedding> embeddings = new ArrayList<>();
        for (int i = 0; i < vectors.length; i++) {
            embeddings.add(new Embedding(vectors[i], i));
        }
        return new EmbeddingResponse(embeddings);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testBatchesEntriesInOneCall() {
        when(embeddingModel.embedForResponse(anyList()))
            .thenReturn(response(new float[]{1.0f, 0.0f}, new float[]{0.0f, 1.0f}));

        List<JournalEntry> entries = List.of(
            JournalEntry.builder().entryId("a").date(TestData.START).text("Long walk").build(),
            JournalEntry.builder().entryId("b").date(TestData.START.plusDays(1)).build());

        List<DayRecord> days = provider.embedAll(entries);

        assertEquals(2, days.size());
        assertArrayEquals(new double[]{1.0, 0.0}, days.get(0).getEmbedding());
        assertEquals("b", days.get(1).getId());

        ArgumentCaptor<List<String>> captor = ArgumentCaptor.forClass(List.class);
        verify(embeddingModel, times(1)).embedForResponse(captor.capture());
        // empty entries get a placeholder instead of an empty string
        assertEquals(List.of("Diary: Long walk", SpringAiEmbeddingProvider.EMPTY_ENTRY_TEXT), captor.getValue());
    }

    @Test
    void testCountMismatchIsRejected() {
        when(embeddingModel.embedForResponse(anyList())).thenReturn(response(new float[]{1.0f}));

        assertThrows(EmbeddingException.class, () -> provider.embedAll(TestData.journal(2)));
    }

    @Test
    void testInconsistentDimensionsAreRejected() {
        when(embeddingModel.embedForResponse(anyList()))
            .thenReturn(response(new float[]{1.0f, 2.0f}, new float[]{1.0f}));

        assertThrows(EmbeddingException.class, () -> provider.embedAll(TestData.journal(2)));
    }

    @Test
    void testModelFailureIsWrapped() {
        when(embeddingModel.embedForResponse(anyList())).thenThrow(new IllegalStateException("connection refused"));

        EmbeddingException error = assertThrows(EmbeddingException.class, () -> provider.embedAll(TestData.journal(2)));
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }
}
