package com.raditha.magpie.embedding;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps text to a fixed-dimension vector. Implementations are injected into the engine,
 * so tests can substitute a deterministic stub.
 */
@FunctionalInterface
public interface EmbeddingFunction {

    /**
     * Embed a single text.
     *
     * @throws EmbeddingException if the vector cannot be produced
     */
    double[] embed(String text);

    /**
     * Embed several texts. The default calls {@link #embed(String)} once per text;
     * remote providers override it to send one request per batch.
     */
    default List<double[]> embedBatch(List<String> texts) {
        List<double[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    /**
     * Maximum number of characters accepted per call. Longer texts are split by the caller.
     */
    default int inputBudget() {
        return Integer.MAX_VALUE;
    }

    /**
     * Largest batch the provider accepts in one {@link #embedBatch(List)} call.
     */
    default int batchSize() {
        return 64;
    }
}
