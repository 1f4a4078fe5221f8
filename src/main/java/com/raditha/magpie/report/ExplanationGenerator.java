package com.raditha.magpie.report;

import com.raditha.magpie.model.RepoPairResult;

/**
 * Produces a free-text explanation for a flagged repository pair.
 * Explanations are optional: the engine works the same without one.
 */
@FunctionalInterface
public interface ExplanationGenerator {

    /**
     * Generator that never explains anything.
     */
    ExplanationGenerator NONE = result -> "";

    String explain(RepoPairResult result);
}
