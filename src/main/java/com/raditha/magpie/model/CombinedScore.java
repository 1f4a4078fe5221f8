package com.raditha.magpie.model;

/**
 * Output of the file-pair combiner: the weighted score and its band.
 */
public record CombinedScore(double score, Band band) {
}
