package com.raditha.magpie.config;

/**
 * Values given on the command line. Zero, null or false mean "not given" so that
 * the YAML file or the defaults apply.
 *
 * @param language         Language tag
 * @param thresholdPercent Threshold as a percentage 0-100
 * @param preset           Preset name (strict, lenient, moderate)
 * @param maxCommits       Commit window per repository
 * @param maxFileChars     Truncation budget in characters
 * @param aggressive       Force identifier anonymization on
 * @param noCommits        Disable commit analysis
 */
public record CliOverrides(
        String language,
        int thresholdPercent,
        String preset,
        int maxCommits,
        int maxFileChars,
        boolean aggressive,
        boolean noCommits) {

    public static CliOverrides none() {
        return new CliOverrides(null, 0, null, 0, 0, false, false);
    }
}
