package com.raditha.magpie.model;

/**
 * Confidence band of a similarity score, ordered from weakest to strongest.
 * NONE means the score fell below the lowest cut point and the pair is unflagged.
 */
public enum Band {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isFlagged() {
        return this != NONE;
    }
}
