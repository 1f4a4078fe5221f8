package com.raditha.magpie.model;

/**
 * Headline counts of a report.
 */
public record ReportSummary(
        int totalRepos,
        int suspiciousPairs,
        int totalFilePairsCompared) {
}
