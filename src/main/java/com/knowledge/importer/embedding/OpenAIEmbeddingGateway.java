package com.knowledge.importer.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Embedding gateway for OpenAI-compatible {@code /v1/embeddings} endpoints.
 *
 * <p>Request: {@code {"model": ..., "input": ...}}. Response: {@code {"data": [{"embedding": [...]}]}}.
 * Any non-2xx status, malformed body, empty vector, I/O error or timeout yields an empty result.</p>
 *
 * <pre>
 * EmbeddingGateway gateway = OpenAIEmbeddingGateway.builder()
 *     .apiKey(System.getenv("OPENAI_API_KEY"))
 *     .model("text-embedding-3-small")
 *     .timeout(Duration.ofSeconds(10))
 *     .build();
 * </pre>
 */
public class OpenAIEmbeddingGateway implements EmbeddingGateway {
    private static final Logger log = LoggerFactory.getLogger(OpenAIEmbeddingGateway.class);

    public static final String DEFAULT_BASE_URL = "https://api.openai.com";
    public static final String DEFAULT_MODEL = "text-embedding-3-small";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final Integer dimensions;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OpenAIEmbeddingGateway(Builder builder) {
        String url = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.apiKey = builder.apiKey;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.dimensions = builder.dimensions;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Optional<float[]> embed(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        List<Optional<float[]>> results = call(List.of(text), text);
        return results.isEmpty() ? Optional.empty() : results.get(0);
    }

    @Override
    public List<Optional<float[]>> embedBatch(List<String> texts) {
        List<Integer> positions = new ArrayList<>();
        List<String> inputs = new ArrayList<>();
        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i);
            if (text != null && !text.isBlank()) {
                positions.add(i);
                inputs.add(text);
            }
        }
        List<Optional<float[]>> results = new ArrayList<>();
        for (int i = 0; i < texts.size(); i++) {
            results.add(Optional.empty());
        }
        if (inputs.isEmpty()) {
            return results;
        }
        List<Optional<float[]>> embedded = call(inputs, inputs);
        for (int i = 0; i < embedded.size() && i < positions.size(); i++) {
            results.set(positions.get(i), embedded.get(i));
        }
        return results;
    }

    @Override
    public String getModel() {
        return model;
    }

    private List<Optional<float[]>> call(List<String> inputs, Object input) {
        try {
            String body = objectMapper.writeValueAsString(new EmbeddingRequest(model, input, dimensions));
            HttpRequest.Builder request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/v1/embeddings"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body));
            if (apiKey != null && !apiKey.isBlank()) {
                request.header("Authorization", "Bearer " + apiKey);
            }

            HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                log.warn("embedding.failed model={} status={}", model, response.statusCode());
                return List.of();
            }
            return parse(response.body(), inputs.size());
        } catch (IOException e) {
            log.warn("embedding.failed model={} error={}", model, e.getMessage());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("embedding.interrupted model={}", model);
            return List.of();
        } catch (RuntimeException e) {
            log.warn("embedding.failed model={} error={}", model, e.getMessage());
            return List.of();
        }
    }

    private List<Optional<float[]>> parse(String body, int expected) throws IOException {
        EmbeddingResponse response = objectMapper.readValue(body, EmbeddingResponse.class);
        if (response.data() == null || response.data().isEmpty()) {
            log.warn("embedding.malformed model={} reason=no data", model);
            return List.of();
        }
        List<EmbeddingData> data = new ArrayList<>(response.data());
        data.sort(Comparator.comparingInt(d -> d.index() != null ? d.index() : 0));
        List<Optional<float[]>> vectors = new ArrayList<>(expected);
        for (EmbeddingData entry : data) {
            vectors.add(toVector(entry.embedding()));
        }
        return vectors;
    }

    private static Optional<float[]> toVector(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            Double v = values.get(i);
            if (v == null) {
                return Optional.empty();
            }
            vector[i] = v.floatValue();
        }
        return Optional.of(vector);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String apiKey;
        private String model;
        private Integer dimensions;
        private Duration timeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        /**
         * Requests vectors of a specific length from models that support shortening.
         */
        public Builder dimensions(Integer dimensions) {
            if (dimensions != null && dimensions <= 0) {
                throw new IllegalArgumentException("dimensions must be > 0");
            }
            this.dimensions = dimensions;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public OpenAIEmbeddingGateway build() {
            return new OpenAIEmbeddingGateway(this);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record EmbeddingRequest(String model, Object input, Integer dimensions) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingResponse(List<EmbeddingData> data) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingData(Integer index, List<Double> embedding) {}
}
