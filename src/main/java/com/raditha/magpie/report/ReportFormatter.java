package com.raditha.magpie.report;

import com.raditha.magpie.model.CommitFlag;
import com.raditha.magpie.model.CommitRecord;
import com.raditha.magpie.model.FilePairScore;
import com.raditha.magpie.model.RepoPairResult;
import com.raditha.magpie.model.Report;
import com.raditha.magpie.model.SimilarityMatrix;

import java.util.List;

/**
 * Plain-text rendering of a {@link Report} for the console. Scores are shown as percentages.
 */
public class ReportFormatter {

    private static final int FILE_PAIRS_PER_REPO_PAIR = 5;
    private static final int NAME_WIDTH = 16;

    /**
     * One-line summary.
     */
    public String getSummary(Report report) {
        return String.format(
                "Compared %d repositories: %d suspicious pairs, %d file pairs compared, %d commit flags (threshold: %.0f%%)",
                report.summary().totalRepos(),
                report.summary().suspiciousPairs(),
                report.summary().totalFilePairsCompared(),
                report.commitFlags().size(),
                report.threshold() * 100);
    }

    /**
     * Full report with matrix, suspicious pairs and commit findings.
     */
    public String getDetailedReport(Report report) {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(80)).append("\n");
        sb.append("REPOSITORY SIMILARITY REPORT\n");
        sb.append("=".repeat(80)).append("\n\n");

        sb.append("Language: ").append(report.language()).append("\n");
        sb.append("Threshold: ").append(String.format("%.0f%%", report.threshold() * 100)).append("\n");
        sb.append("Generated: ").append(report.generatedAt()).append("\n\n");

        sb.append(getSummary(report)).append("\n\n");

        appendMatrix(sb, report.repositoryMatrix());

        if (report.suspiciousPairs().isEmpty()) {
            sb.append("No suspicious repository pairs.\n\n");
        } else {
            sb.append("Suspicious pairs (most similar first):\n");
            sb.append("-".repeat(80)).append("\n\n");
            List<RepoPairResult> pairs = report.suspiciousPairs();
            for (int i = 0; i < pairs.size(); i++) {
                appendPair(sb, i + 1, pairs.get(i));
            }
        }

        appendCommits(sb, report);
        sb.append("Scores are similarity signals, not verdicts. Review flagged pairs manually.\n");
        return sb.toString();
    }

    private void appendMatrix(StringBuilder sb, SimilarityMatrix matrix) {
        sb.append("Similarity matrix:\n");
        sb.append(String.format("%-" + NAME_WIDTH + "s", ""));
        for (int j = 0; j < matrix.size(); j++) {
            sb.append(String.format("%8s", "#" + (j + 1)));
        }
        sb.append("\n");
        for (int i = 0; i < matrix.size(); i++) {
            String name = "#" + (i + 1) + " " + TemplateExplanationGenerator.shortName(matrix.repositories().get(i));
            sb.append(String.format("%-" + NAME_WIDTH + "s", abbreviate(name)));
            for (int j = 0; j < matrix.size(); j++) {
                sb.append(String.format("%7.1f%%", matrix.get(i, j) * 100));
            }
            sb.append("\n");
        }
        sb.append("\n");
    }

    private void appendPair(StringBuilder sb, int index, RepoPairResult pair) {
        sb.append(String.format("Pair #%d - %.1f%% similar%n", index, pair.repoSimilarity() * 100));
        sb.append("  A: ").append(pair.repoA()).append("\n");
        sb.append("  B: ").append(pair.repoB()).append("\n");
        List<FilePairScore> files = pair.filePairs();
        for (int k = 0; k < Math.min(FILE_PAIRS_PER_REPO_PAIR, files.size()); k++) {
            FilePairScore file = files.get(k);
            sb.append(String.format("  %-8s %5.1f%%  %s <-> %s%n",
                    file.band(), file.combinedScore() * 100, file.fileA().path(), file.fileB().path()));
        }
        if (!pair.explanation().isEmpty()) {
            sb.append("\n");
            for (String line : pair.explanation().split("\n")) {
                sb.append("  | ").append(line).append("\n");
            }
        }
        sb.append("\n");
    }

    private void appendCommits(StringBuilder sb, Report report) {
        if (!report.commitFlags().isEmpty()) {
            sb.append("Similar commits:\n");
            sb.append("-".repeat(80)).append("\n");
            for (CommitFlag flag : report.commitFlags()) {
                sb.append(String.format("  %s %s <-> %s %s  diff %.1f%%, message %.1f%% (%s)%n",
                        TemplateExplanationGenerator.shortName(flag.commitA().repoId()),
                        flag.commitA().shortHash(),
                        TemplateExplanationGenerator.shortName(flag.commitB().repoId()),
                        flag.commitB().shortHash(),
                        flag.diffSimilarity() * 100,
                        flag.messageSimilarity() * 100,
                        flag.reason()));
            }
            sb.append("\n");
        }
        if (!report.largeCommits().isEmpty()) {
            sb.append("Large commits (possible bulk imports):\n");
            for (CommitRecord commit : report.largeCommits()) {
                sb.append(String.format("  %s %s  %d lines changed%n",
                        TemplateExplanationGenerator.shortName(commit.repoId()),
                        commit.shortHash(),
                        commit.changedLineCount()));
            }
            sb.append("\n");
        }
    }

    private static String abbreviate(String name) {
        if (name.length() < NAME_WIDTH) {
            return name;
        }
        return name.substring(0, NAME_WIDTH - 4) + "...";
    }
}
