package com.raditha.magpie.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.raditha.magpie.embedding.EmbeddingException;
import com.raditha.magpie.embedding.EmbeddingFunction;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Embeddings from Gemini's {@code batchEmbedContents} endpoint.
 */
public class GeminiEmbeddingFunction implements EmbeddingFunction {

    // text-embedding-004 accepts 2048 tokens; roughly four characters per token
    private static final int INPUT_BUDGET = 8000;
    private static final int MAX_BATCH = 100;

    private final GeminiAIService aiService;
    private final ObjectMapper mapper = new ObjectMapper();

    public GeminiEmbeddingFunction(GeminiAIService aiService) {
        this.aiService = aiService;
    }

    @Override
    public double[] embed(String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<double[]> embedBatch(List<String> texts) {
        String model = aiService.embeddingModel();
        String response;
        try {
            response = aiService.sendApiRequest(model, "batchEmbedContents", buildPayload(model, texts));
        } catch (IOException e) {
            throw new EmbeddingException("Gemini embedding request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while waiting for Gemini embeddings", e);
        }
        return parseResponse(response, texts.size());
    }

    @Override
    public int inputBudget() {
        return INPUT_BUDGET;
    }

    @Override
    public int batchSize() {
        return MAX_BATCH;
    }

    String buildPayload(String model, List<String> texts) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode requests = root.putArray("requests");
        for (String text : texts) {
            ObjectNode request = requests.addObject();
            request.put("model", "models/" + model);
            request.putObject("content").putArray("parts").addObject().put("text", text);
        }
        return root.toString();
    }

    List<double[]> parseResponse(String body, int expected) {
        JsonNode embeddings;
        try {
            embeddings = mapper.readTree(body).path("embeddings");
        } catch (IOException e) {
            throw new EmbeddingException("Malformed Gemini embedding response", e);
        }
        if (!embeddings.isArray() || embeddings.size() != expected) {
            throw new EmbeddingException(String.format(
                    "Expected %d embeddings from Gemini, got %d", expected, embeddings.size()));
        }
        List<double[]> vectors = new ArrayList<>(expected);
        for (JsonNode embedding : embeddings) {
            JsonNode values = embedding.path("values");
            double[] vector = new double[values.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = values.get(i).asDouble();
            }
            vectors.add(vector);
        }
        return vectors;
    }
}
