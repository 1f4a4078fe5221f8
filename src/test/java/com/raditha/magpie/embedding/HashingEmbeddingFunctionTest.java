package com.raditha.magpie.embedding;

import com.raditha.magpie.similarity.SemanticSimilarity;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HashingEmbeddingFunctionTest {

    private final HashingEmbeddingFunction function = new HashingEmbeddingFunction();
    private final SemanticSimilarity cosine = new SemanticSimilarity();

    @Test
    void testDimensionAndBudget() {
        assertEquals(384, function.embed("x = 1").length);
        assertEquals(2000, function.inputBudget());
        assertEquals(16, new HashingEmbeddingFunction(16, 100).embed("x = 1").length);
    }

    @Test
    void testDeterministic() {
        assertArrayEquals(function.embed("for i in range(10): print(i)"),
                function.embed("for i in range(10): print(i)"));
    }

    @Test
    void testUnitLength() {
        double[] vector = function.embed("return left + right");
        double norm = 0.0;
        for (double v : vector) {
            norm += v * v;
        }
        assertEquals(1.0, norm, 1e-9);
    }

    @Test
    void testEmptyTextIsZeroVector() {
        for (double v : function.embed("")) {
            assertEquals(0.0, v);
        }
    }

    @Test
    void testSimilarCodeCloserThanUnrelatedCode() {
        double[] base = function.embed("def add ( a , b ) : return a + b");
        double[] near = function.embed("def add ( a , b ) : result = a + b return result");
        double[] far = function.embed("class Server : def listen ( self , port ) : self . sock . bind ( port )");

        assertTrue(cosine.calculate(base, near) > cosine.calculate(base, far));
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new HashingEmbeddingFunction(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new HashingEmbeddingFunction(10, 0));
    }

    @Property(tries = 100)
    void identicalTextsHaveCosineOne(@ForAll("code") String text) {
        Assume.that(!text.isBlank());

        assertEquals(1.0, cosine.calculate(function.embed(text), function.embed(text)), 1e-9);
    }

    @Provide
    Arbitrary<String> code() {
        return Arbitraries.strings().withChars("abxy_01+=() ").ofMaxLength(40);
    }
}
