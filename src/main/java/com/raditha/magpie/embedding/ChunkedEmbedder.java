package com.raditha.magpie.embedding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Embeds texts of any length through an {@link EmbeddingFunction} with a bounded input size.
 * <p>
 * Each text is split into fixed-size character blocks, all blocks of all texts are sent in
 * batches, and the block vectors of a text are mean-pooled into one vector. Every vector must
 * have the same dimension.
 */
public class ChunkedEmbedder {
    private static final Logger logger = LoggerFactory.getLogger(ChunkedEmbedder.class);

    private final EmbeddingFunction embeddingFunction;

    public ChunkedEmbedder(EmbeddingFunction embeddingFunction) {
        if (embeddingFunction == null) {
            throw new IllegalArgumentException("embeddingFunction cannot be null");
        }
        this.embeddingFunction = embeddingFunction;
    }

    /**
     * Embed one text.
     */
    public double[] embed(String text) {
        return embedAll(List.of(text)).get(0);
    }

    /**
     * Embed every text, returning one vector per text in the same order.
     *
     * @throws EmbeddingException if the provider fails or returns vectors of differing dimension
     */
    public List<double[]> embedAll(List<String> texts) {
        int budget = Math.max(1, embeddingFunction.inputBudget());

        // Step 1: split into blocks, remembering which text each block belongs to
        List<String> blocks = new ArrayList<>();
        int[] blockCounts = new int[texts.size()];
        for (int i = 0; i < texts.size(); i++) {
            List<String> textBlocks = split(texts.get(i), budget);
            blockCounts[i] = textBlocks.size();
            blocks.addAll(textBlocks);
        }

        // Step 2: embed blocks in batches
        List<double[]> blockVectors = embedBlocks(blocks);
        int dimension = blockVectors.isEmpty() ? 0 : blockVectors.get(0).length;
        for (double[] vector : blockVectors) {
            if (vector == null || vector.length != dimension) {
                throw new EmbeddingException(String.format(
                        "Embedding dimension mismatch: expected %d, got %s",
                        dimension, vector == null ? "null" : String.valueOf(vector.length)));
            }
        }

        // Step 3: mean-pool the blocks of each text
        List<double[]> result = new ArrayList<>(texts.size());
        int offset = 0;
        for (int count : blockCounts) {
            result.add(meanPool(blockVectors.subList(offset, offset + count), dimension));
            offset += count;
        }
        logger.debug("Embedded {} texts as {} blocks (dimension {})", texts.size(), blocks.size(), dimension);
        return result;
    }

    private List<double[]> embedBlocks(List<String> blocks) {
        int batchSize = Math.max(1, embeddingFunction.batchSize());
        List<double[]> vectors = new ArrayList<>(blocks.size());
        for (int start = 0; start < blocks.size(); start += batchSize) {
            List<String> batch = blocks.subList(start, Math.min(blocks.size(), start + batchSize));
            List<double[]> batchVectors = embeddingFunction.embedBatch(batch);
            if (batchVectors == null || batchVectors.size() != batch.size()) {
                throw new EmbeddingException(String.format(
                        "Embedding provider returned %d vectors for %d inputs",
                        batchVectors == null ? 0 : batchVectors.size(), batch.size()));
            }
            vectors.addAll(batchVectors);
        }
        return vectors;
    }

    /**
     * Fixed-size character blocks. Empty text has no blocks and pools to the zero vector.
     */
    static List<String> split(String text, int budget) {
        List<String> blocks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return blocks;
        }
        for (int start = 0; start < text.length(); start += budget) {
            blocks.add(text.substring(start, Math.min(text.length(), start + budget)));
        }
        return blocks;
    }

    private static double[] meanPool(List<double[]> vectors, int dimension) {
        double[] pooled = new double[dimension];
        if (vectors.isEmpty()) {
            return pooled;
        }
        for (double[] vector : vectors) {
            for (int i = 0; i < dimension; i++) {
                pooled[i] += vector[i];
            }
        }
        for (int i = 0; i < dimension; i++) {
            pooled[i] /= vectors.size();
        }
        return pooled;
    }
}
