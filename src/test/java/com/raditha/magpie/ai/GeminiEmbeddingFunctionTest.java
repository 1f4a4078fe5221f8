package com.raditha.magpie.ai;

import com.raditha.magpie.embedding.EmbeddingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class GeminiEmbeddingFunctionTest {

    private GeminiAIService aiService;
    private GeminiEmbeddingFunction function;

    @BeforeEach
    void setUp() {
        aiService = mock(GeminiAIService.class);
        when(aiService.embeddingModel()).thenReturn("text-embedding-004");
        function = new GeminiEmbeddingFunction(aiService);
    }

    @Test
    void testBatchRequestAndResponse() throws Exception {
        when(aiService.sendApiRequest(eq("text-embedding-004"), eq("batchEmbedContents"), anyString()))
                .thenReturn("{\"embeddings\":[{\"values\":[0.1,0.2]},{\"values\":[0.3,0.4]}]}");

        List<double[]> vectors = function.embedBatch(List.of("def a(): pass", "def b(): pass"));

        assertEquals(2, vectors.size());
        assertArrayEquals(new double[] { 0.3, 0.4 }, vectors.get(1), 1e-12);
        verify(aiService).sendApiRequest(eq("text-embedding-004"), eq("batchEmbedContents"),
                contains("\"model\":\"models/text-embedding-004\""));
    }

    @Test
    void testPayloadShape() {
        String payload = function.buildPayload("m", List.of("x = 1"));

        assertEquals("{\"requests\":[{\"model\":\"models/m\",\"content\":{\"parts\":[{\"text\":\"x = 1\"}]}}]}",
                payload);
    }

    @Test
    void testCountMismatchRejected() {
        assertThrows(EmbeddingException.class,
                () -> function.parseResponse("{\"embeddings\":[{\"values\":[1.0]}]}", 2));
        assertThrows(EmbeddingException.class, () -> function.parseResponse("not json", 1));
    }

    @Test
    void testServiceFailureBecomesEmbeddingException() throws Exception {
        when(aiService.sendApiRequest(anyString(), anyString(), anyString()))
                .thenThrow(new IOException("API request failed with status: 500"));

        EmbeddingException ex = assertThrows(EmbeddingException.class, () -> function.embed("x"));
        assertTrue(ex.getMessage().contains("500"));
    }

    @Test
    void testProviderLimits() {
        assertEquals(8000, function.inputBudget());
        assertEquals(100, function.batchSize());
    }
}
