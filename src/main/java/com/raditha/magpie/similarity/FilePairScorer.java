package com.raditha.magpie.similarity;

import com.raditha.magpie.embedding.EmbeddingCache;
import com.raditha.magpie.model.CombinedScore;
import com.raditha.magpie.model.FilePairScore;
import com.raditha.magpie.model.SourceFile;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scores every pair of comparable files between two repositories.
 * <p>
 * Token sets are computed once per file when the scorer is built and vectors come from the
 * frozen {@link EmbeddingCache}, so the parallel scoring only reads shared state.
 */
public class FilePairScorer {

    private final TokenSimilarity tokenSimilarity = new TokenSimilarity();
    private final SemanticSimilarity semanticSimilarity = new SemanticSimilarity();
    private final FilePairCombiner combiner;
    private final EmbeddingCache embeddings;
    private final Map<SourceFile, Set<String>> tokenSets;

    /**
     * @param files      Every file that will take part in scoring
     * @param embeddings Vectors of the normalized texts of those files
     * @param combiner   Weights and band thresholds
     */
    public FilePairScorer(Collection<SourceFile> files, EmbeddingCache embeddings, FilePairCombiner combiner) {
        this.combiner = combiner;
        this.embeddings = embeddings;
        Map<SourceFile, Set<String>> sets = new HashMap<>();
        for (SourceFile file : files) {
            sets.put(file, Set.copyOf(TokenSimilarity.tokenSet(file.normalizedText())));
        }
        this.tokenSets = Map.copyOf(sets);
    }

    /**
     * Score the cross product of two file lists.
     *
     * @return every pair, highest combined score first
     */
    public List<FilePairScore> score(List<SourceFile> filesA, List<SourceFile> filesB) {
        return filesA.parallelStream()
                .flatMap(a -> filesB.stream().map(b -> score(a, b)))
                .sorted(FilePairScore.BY_COMBINED_DESC)
                .toList();
    }

    /**
     * Score a single pair.
     */
    public FilePairScore score(SourceFile fileA, SourceFile fileB) {
        double tokenScore = tokenSimilarity.calculate(tokensOf(fileA), tokensOf(fileB));
        double semanticScore = semanticSimilarity.calculate(
                embeddings.vectorFor(fileA.normalizedText()),
                embeddings.vectorFor(fileB.normalizedText()));
        CombinedScore combined = combiner.combine(tokenScore, semanticScore);
        return new FilePairScore(fileA, fileB, tokenScore, semanticScore, combined.score(), combined.band());
    }

    private Set<String> tokensOf(SourceFile file) {
        Set<String> tokens = tokenSets.get(file);
        if (tokens == null) {
            throw new IllegalStateException("File was not registered with the scorer: " + file);
        }
        return tokens;
    }
}
