package com.raditha.magpie.job;

import com.raditha.magpie.aggregation.RepositoryAggregator;
import com.raditha.magpie.commit.CommitAnalysis;
import com.raditha.magpie.commit.CommitAnalyzer;
import com.raditha.magpie.config.AnalysisConfig;
import com.raditha.magpie.embedding.ChunkedEmbedder;
import com.raditha.magpie.embedding.EmbeddingCache;
import com.raditha.magpie.embedding.EmbeddingFunction;
import com.raditha.magpie.git.RepositoryMaterializer;
import com.raditha.magpie.model.CommitRecord;
import com.raditha.magpie.model.FilePairScore;
import com.raditha.magpie.model.RepoPairResult;
import com.raditha.magpie.model.Report;
import com.raditha.magpie.model.RepositorySnapshot;
import com.raditha.magpie.model.SourceFile;
import com.raditha.magpie.normalization.CodePreprocessor;
import com.raditha.magpie.report.ExplanationGenerator;
import com.raditha.magpie.report.ReportBuilder;
import com.raditha.magpie.similarity.FilePairCombiner;
import com.raditha.magpie.similarity.FilePairScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one job through its stages: cloning, preprocessing, embedding, scoring and reasoning.
 * <p>
 * Cancellation is honoured at every stage boundary. Any exception escaping a stage fails the
 * job with the stage name and the cause; nothing is rethrown to the caller.
 */
public class AnalysisPipeline {
    private static final Logger logger = LoggerFactory.getLogger(AnalysisPipeline.class);

    private final RepositoryMaterializer materializer;
    private final EmbeddingFunction embeddingFunction;
    private final ExplanationGenerator explanationGenerator;
    private final ReportBuilder reportBuilder;

    public AnalysisPipeline(RepositoryMaterializer materializer, EmbeddingFunction embeddingFunction,
            ExplanationGenerator explanationGenerator, ReportBuilder reportBuilder) {
        this.materializer = materializer;
        this.embeddingFunction = embeddingFunction;
        this.explanationGenerator = explanationGenerator == null ? ExplanationGenerator.NONE : explanationGenerator;
        this.reportBuilder = reportBuilder;
    }

    public AnalysisPipeline(RepositoryMaterializer materializer, EmbeddingFunction embeddingFunction,
            ExplanationGenerator explanationGenerator) {
        this(materializer, embeddingFunction, explanationGenerator, new ReportBuilder());
    }

    /**
     * Run the job to completion or failure.
     */
    public JobSnapshot run(AnalysisJob job) {
        try {
            execute(job);
        } catch (JobCancelledException e) {
            job.fail(stageOf(job) + ": " + e.getMessage());
        } catch (Exception e) {
            logger.debug("Job {} failed in {}", job.id(), stageOf(job), e);
            job.fail(stageOf(job) + ": " + describe(e));
        }
        return job.snapshot();
    }

    private void execute(AnalysisJob job) throws Exception {
        AnalysisRequest request = job.request();
        AnalysisConfig config = request.config();
        List<String> repositories = request.repositories();

        // Step 1: read every repository
        checkpoint(job);
        job.transition(JobStatus.CLONING);
        Map<String, RepositorySnapshot> snapshots = new LinkedHashMap<>();
        int commitWindow = config.analyzeCommits() ? config.maxCommits() : 0;
        for (int i = 0; i < repositories.size(); i++) {
            String repo = repositories.get(i);
            snapshots.put(repo, materializer.materialize(repo, request.branch(), config.language(), commitWindow));
            job.progress(JobStatus.CLONING.progressAt((i + 1) / (double) repositories.size()));
            checkpoint(job);
        }

        // Step 2: normalize files, dropping those too small to compare
        job.transition(JobStatus.PREPROCESSING);
        CodePreprocessor preprocessor = new CodePreprocessor(config);
        Map<String, List<SourceFile>> filesByRepo = new LinkedHashMap<>();
        int done = 0;
        for (RepositorySnapshot snapshot : snapshots.values()) {
            List<SourceFile> comparable = snapshot.files().entrySet().parallelStream()
                    .map(e -> preprocessor.prepare(snapshot.repoId(), e.getKey(), e.getValue()))
                    .filter(preprocessor::isComparable)
                    .toList();
            filesByRepo.put(snapshot.repoId(), comparable);
            logger.info("Repository {}: {} of {} files comparable", snapshot.repoId(), comparable.size(),
                    snapshot.files().size());
            job.progress(JobStatus.PREPROCESSING.progressAt(++done / (double) snapshots.size()));
        }
        checkpoint(job);

        // Step 3: embed every distinct normalized text once
        job.transition(JobStatus.EMBEDDING);
        ChunkedEmbedder embedder = new ChunkedEmbedder(embeddingFunction);
        List<SourceFile> allFiles = filesByRepo.values().stream().flatMap(List::stream).toList();
        EmbeddingCache cache = EmbeddingCache.build(allFiles.stream().map(SourceFile::normalizedText).toList(),
                embedder);
        logger.info("Embedded {} distinct texts", cache.size());
        checkpoint(job);

        // Step 4: score file pairs, aggregate per repository pair, compare commits
        job.transition(JobStatus.SCORING);
        FilePairCombiner combiner = new FilePairCombiner(config.weights(), config.bands());
        FilePairScorer scorer = new FilePairScorer(allFiles, cache, combiner);
        RepositoryAggregator aggregator = new RepositoryAggregator(config.threshold());
        List<RepoPairResult> comparisons = new ArrayList<>();
        int totalPairs = repositories.size() * (repositories.size() - 1) / 2;
        for (int i = 0; i < repositories.size(); i++) {
            for (int j = i + 1; j < repositories.size(); j++) {
                String repoA = repositories.get(i);
                String repoB = repositories.get(j);
                List<FilePairScore> pairs = scorer.score(filesByRepo.get(repoA), filesByRepo.get(repoB));
                RepoPairResult result = aggregator.aggregate(repoA, repoB, pairs);
                logger.debug("{} vs {}: {} file pairs, similarity {}", repoA, repoB, pairs.size(),
                        result.repoSimilarity());
                comparisons.add(result);
                job.progress(JobStatus.SCORING.progressAt(comparisons.size() / (double) (totalPairs + 1)));
            }
        }
        CommitAnalysis commits = analyzeCommits(config, preprocessor, combiner, embedder, snapshots);
        job.progress(JobStatus.SCORING.progressEnd());
        checkpoint(job);

        // Step 5: explain flagged pairs
        job.transition(JobStatus.REASONING);
        List<RepoPairResult> explained = new ArrayList<>(comparisons.size());
        for (RepoPairResult result : comparisons) {
            explained.add(result.flagged() ? result.withExplanation(explain(result)) : result);
        }
        checkpoint(job);

        Report report = reportBuilder.build(repositories, explained, commits, config.language(), config.threshold());
        job.complete(report);
    }

    private CommitAnalysis analyzeCommits(AnalysisConfig config, CodePreprocessor preprocessor,
            FilePairCombiner combiner, ChunkedEmbedder embedder, Map<String, RepositorySnapshot> snapshots) {
        if (!config.analyzeCommits()) {
            return CommitAnalysis.empty();
        }
        // Repositories without history contribute no commits; provider failures fail the stage
        Map<String, List<CommitRecord>> commitsByRepo = new LinkedHashMap<>();
        snapshots.forEach((repo, snapshot) -> commitsByRepo.put(repo, snapshot.commits()));
        return new CommitAnalyzer(config, preprocessor, combiner, embedder).analyze(commitsByRepo);
    }

    private String explain(RepoPairResult result) {
        try {
            String text = explanationGenerator.explain(result);
            return text == null ? "" : text;
        } catch (RuntimeException e) {
            logger.warn("Explanation for {} / {} unavailable: {}", result.repoA(), result.repoB(), describe(e));
            return "";
        }
    }

    private static void checkpoint(AnalysisJob job) {
        if (job.isCancellationRequested() || Thread.currentThread().isInterrupted()) {
            throw new JobCancelledException(job.snapshot().status());
        }
    }

    private static String stageOf(AnalysisJob job) {
        return job.snapshot().status().name();
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
