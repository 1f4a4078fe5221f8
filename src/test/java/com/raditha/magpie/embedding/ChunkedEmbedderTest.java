package com.raditha.magpie.embedding;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChunkedEmbedderTest {

    /**
     * Embeds a block as [length, 1] with a small input budget.
     */
    private static class LengthEmbedding implements EmbeddingFunction {
        private final int budget;
        private final int batch;
        final List<Integer> batchSizes = new ArrayList<>();

        LengthEmbedding(int budget, int batch) {
            this.budget = budget;
            this.batch = batch;
        }

        @Override
        public double[] embed(String text) {
            return new double[] { text.length(), 1.0 };
        }

        @Override
        public List<double[]> embedBatch(List<String> texts) {
            batchSizes.add(texts.size());
            return EmbeddingFunction.super.embedBatch(texts);
        }

        @Override
        public int inputBudget() {
            return budget;
        }

        @Override
        public int batchSize() {
            return batch;
        }
    }

    @Test
    void testSplit() {
        assertEquals(List.of("abcd", "efgh", "ij"), ChunkedEmbedder.split("abcdefghij", 4));
        assertEquals(List.of("abc"), ChunkedEmbedder.split("abc", 4));
        assertTrue(ChunkedEmbedder.split("", 4).isEmpty());
    }

    @Test
    void testLongTextIsMeanPooled() {
        ChunkedEmbedder embedder = new ChunkedEmbedder(new LengthEmbedding(4, 64));

        double[] vector = embedder.embed("abcdefghij");

        assertEquals(10.0 / 3, vector[0], 1e-9);
        assertEquals(1.0, vector[1], 1e-9);
    }

    @Test
    void testShortTextEmbeddedOnce() {
        ChunkedEmbedder embedder = new ChunkedEmbedder(new LengthEmbedding(100, 64));

        assertArrayEquals(new double[] { 5.0, 1.0 }, embedder.embed("hello"), 1e-9);
    }

    @Test
    void testBlocksSentInBatches() {
        LengthEmbedding function = new LengthEmbedding(2, 3);
        ChunkedEmbedder embedder = new ChunkedEmbedder(function);

        List<double[]> vectors = embedder.embedAll(List.of("aaaa", "bbbbbb", "cc"));

        assertEquals(3, vectors.size());
        assertEquals(List.of(3, 3), function.batchSizes);
        assertArrayEquals(new double[] { 2.0, 1.0 }, vectors.get(1), 1e-9);
    }

    @Test
    void testEmptyTextPoolsToZeroVector() {
        ChunkedEmbedder embedder = new ChunkedEmbedder(new LengthEmbedding(4, 64));

        List<double[]> vectors = embedder.embedAll(List.of("", "abc"));

        assertArrayEquals(new double[] { 0.0, 0.0 }, vectors.get(0));
    }

    @Test
    void testDimensionMismatchRejected() {
        EmbeddingFunction inconsistent = text -> text.startsWith("a") ? new double[2] : new double[3];
        ChunkedEmbedder embedder = new ChunkedEmbedder(inconsistent);

        assertThrows(EmbeddingException.class, () -> embedder.embedAll(List.of("abc", "xyz")));
    }

    @Test
    void testWrongVectorCountRejected() {
        EmbeddingFunction shortChanged = new EmbeddingFunction() {
            @Override
            public double[] embed(String text) {
                return new double[] { 1.0 };
            }

            @Override
            public List<double[]> embedBatch(List<String> texts) {
                return List.of(new double[] { 1.0 });
            }
        };

        assertThrows(EmbeddingException.class,
                () -> new ChunkedEmbedder(shortChanged).embedAll(List.of("a", "b")));
    }

    @Test
    void testNullFunctionRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ChunkedEmbedder(null));
    }
}
