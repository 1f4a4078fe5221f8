package com.raditha.magpie.embedding;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Vectors of every distinct text of a job, computed once before scoring and read-only
 * afterwards. Scoring threads only read from the cache.
 */
public final class EmbeddingCache {

    private final Map<String, double[]> vectors;

    private EmbeddingCache(Map<String, double[]> vectors) {
        this.vectors = Map.copyOf(vectors);
    }

    /**
     * Embed every distinct text through the chunked embedder and freeze the result.
     */
    public static EmbeddingCache build(Iterable<String> texts, ChunkedEmbedder embedder) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String text : texts) {
            distinct.add(text);
        }
        List<String> ordered = new ArrayList<>(distinct);
        List<double[]> embedded = embedder.embedAll(ordered);

        Map<String, double[]> map = new HashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            map.put(ordered.get(i), embedded.get(i));
        }
        return new EmbeddingCache(map);
    }

    public static EmbeddingCache empty() {
        return new EmbeddingCache(Map.of());
    }

    /**
     * A copy of the cached vector; the cache itself never changes after it is built.
     *
     * @throws IllegalStateException if the text was not embedded when the cache was built
     */
    public double[] vectorFor(String text) {
        double[] vector = vectors.get(text);
        if (vector == null) {
            throw new IllegalStateException("No embedding cached for text of length " + text.length());
        }
        return vector.clone();
    }

    public boolean contains(String text) {
        return vectors.containsKey(text);
    }

    public int size() {
        return vectors.size();
    }
}
