package com.raditha.magpie.model;

/**
 * A suspiciously similar pair of commits from two different repositories.
 */
public record CommitFlag(
        CommitRecord commitA,
        CommitRecord commitB,
        double messageSimilarity,
        double diffSimilarity,
        FlagReason reason) {
}
