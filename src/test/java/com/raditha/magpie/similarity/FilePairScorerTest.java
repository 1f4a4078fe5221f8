package com.raditha.magpie.similarity;

import com.raditha.magpie.embedding.ChunkedEmbedder;
import com.raditha.magpie.embedding.EmbeddingCache;
import com.raditha.magpie.embedding.HashingEmbeddingFunction;
import com.raditha.magpie.model.Band;
import com.raditha.magpie.model.FilePairScore;
import com.raditha.magpie.model.SourceFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FilePairScorerTest {

    private SourceFile a1;
    private SourceFile a2;
    private SourceFile b1;
    private FilePairScorer scorer;

    @BeforeEach
    void setUp() {
        a1 = new SourceFile("repoA", "util.py", "", "def total ( items ) : return sum ( items )");
        a2 = new SourceFile("repoA", "main.py", "", "print ( total ( [ 1 , 2 , 3 ] ) )");
        b1 = new SourceFile("repoB", "helpers.py", "", "def total ( items ) : return sum ( items )");
        List<SourceFile> all = List.of(a1, a2, b1);
        EmbeddingCache cache = EmbeddingCache.build(
                all.stream().map(SourceFile::normalizedText).toList(),
                new ChunkedEmbedder(new HashingEmbeddingFunction()));
        scorer = new FilePairScorer(all, cache, new FilePairCombiner());
    }

    @Test
    void testIdenticalNormalizedTextScoresOne() {
        FilePairScore score = scorer.score(a1, b1);

        assertEquals(1.0, score.tokenScore());
        assertEquals(1.0, score.semanticScore(), 1e-9);
        assertEquals(1.0, score.combinedScore(), 1e-9);
        assertEquals(Band.CRITICAL, score.band());
    }

    @Test
    void testCrossProductSortedByCombinedScore() {
        List<FilePairScore> scores = scorer.score(List.of(a1, a2), List.of(b1));

        assertEquals(2, scores.size());
        assertEquals("util.py", scores.get(0).fileA().path());
        assertTrue(scores.get(0).combinedScore() >= scores.get(1).combinedScore());
    }

    @Test
    void testEmptySideProducesNoPairs() {
        assertTrue(scorer.score(List.of(), List.of(b1)).isEmpty());
    }

    @Test
    void testUnregisteredFileRejected() {
        SourceFile stranger = new SourceFile("repoC", "x.py", "", "x = 1");

        assertThrows(IllegalStateException.class, () -> scorer.score(a1, stranger));
    }
}
