package com.raditha.magpie.model;

/**
 * Which commit signal crossed the threshold.
 */
public enum FlagReason {
    DIFF,
    MESSAGE,
    DIFF_AND_MESSAGE;

    public static FlagReason of(boolean diff, boolean message) {
        if (diff && message) {
            return DIFF_AND_MESSAGE;
        }
        if (diff) {
            return DIFF;
        }
        if (message) {
            return MESSAGE;
        }
        throw new IllegalArgumentException("At least one signal must have triggered");
    }
}
