package com.raditha.magpie.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.raditha.magpie.model.FilePairScore;
import com.raditha.magpie.model.RepoPairResult;
import com.raditha.magpie.report.ExplanationGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Asks Gemini to explain why two repositories look alike.
 * Failures are thrown; the pipeline degrades them to an empty explanation.
 */
public class GeminiExplanationGenerator implements ExplanationGenerator {
    private static final Logger logger = LoggerFactory.getLogger(GeminiExplanationGenerator.class);

    private static final int MAX_PAIRS = 5;
    private static final int SNIPPET_CHARS = 600;

    private final GeminiAIService aiService;
    private final ObjectMapper mapper = new ObjectMapper();

    public GeminiExplanationGenerator(GeminiAIService aiService) {
        this.aiService = aiService;
    }

    @Override
    public String explain(RepoPairResult result) {
        String prompt = buildPrompt(result);
        try {
            String response = aiService.sendApiRequest(aiService.generationModel(), "generateContent",
                    buildPayload(prompt));
            String text = extractText(response);
            logger.debug("Gemini explanation for {} / {}: {} chars", result.repoA(), result.repoB(), text.length());
            return text;
        } catch (IOException e) {
            throw new UncheckedIOException("Gemini explanation failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for Gemini", e);
        }
    }

    /**
     * Build prompt describing the pair and its strongest file matches.
     */
    String buildPrompt(RepoPairResult result) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Two source code repositories were compared for code reuse.\n\n");
        prompt.append("Repository A: ").append(result.repoA()).append("\n");
        prompt.append("Repository B: ").append(result.repoB()).append("\n");
        prompt.append(String.format("Repository similarity: %.2f%n%n", result.repoSimilarity()));

        List<FilePairScore> pairs = result.filePairs();
        for (int i = 0; i < Math.min(MAX_PAIRS, pairs.size()); i++) {
            FilePairScore pair = pairs.get(i);
            prompt.append(String.format("File pair %d: %s <-> %s (combined %.2f, token %.2f, semantic %.2f)%n",
                    i + 1, pair.fileA().path(), pair.fileB().path(),
                    pair.combinedScore(), pair.tokenScore(), pair.semanticScore()));
            prompt.append("A snippet:\n").append(snippet(pair.fileA().rawText())).append("\n");
            prompt.append("B snippet:\n").append(snippet(pair.fileB().rawText())).append("\n\n");
        }

        prompt.append("Rules:\n");
        prompt.append("- Explain in at most five sentences what the similar files have in common\n");
        prompt.append("- Say whether the overlap looks like copying, shared boilerplate or a common library\n");
        prompt.append("- The scores are signals, not proof; do not accuse anyone\n");
        return prompt.toString();
    }

    String buildPayload(String prompt) {
        ObjectNode root = mapper.createObjectNode();
        root.putArray("contents").addObject().putArray("parts").addObject().put("text", prompt);
        return root.toString();
    }

    String extractText(String response) throws IOException {
        JsonNode root = mapper.readTree(response);
        JsonNode parts = root.path("candidates").path(0).path("content").path("parts");
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            text.append(part.path("text").asText(""));
        }
        return text.toString().trim();
    }

    private static String snippet(String raw) {
        return raw.length() > SNIPPET_CHARS ? raw.substring(0, SNIPPET_CHARS) + "..." : raw;
    }
}
