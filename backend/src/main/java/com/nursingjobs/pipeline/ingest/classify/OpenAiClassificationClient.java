package com.nursingjobs.pipeline.ingest.classify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nursingjobs.pipeline.config.PipelineProperties;
import com.nursingjobs.pipeline.ingest.model.ClassifierVerdict;
import com.nursingjobs.pipeline.ingest.model.JobRecord;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * Chat-completions classifier. One request per job, no retries: a slow or failed call is a
 * failure for that job only.
 */
@Service
public class OpenAiClassificationClient implements ClassificationClient {
    private final PipelineProperties properties;
    private final ClassificationPromptBuilder promptBuilder;
    private final ClassificationResponseParser responseParser;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public OpenAiClassificationClient(
        PipelineProperties properties,
        ClassificationPromptBuilder promptBuilder,
        ClassificationResponseParser responseParser,
        ObjectMapper objectMapper,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.getClassification().getTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public ClassifierVerdict classify(JobRecord job, String employerName) {
        PipelineProperties.Classification config = properties.getClassification();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new ClassificationServiceException("pipeline.classification.api-key is not configured");
        }
        URI uri;
        try {
            uri = URI.create(config.getEndpoint());
        } catch (IllegalArgumentException e) {
            throw new ClassificationServiceException("invalid classification endpoint " + config.getEndpoint());
        }

        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
            .header("Authorization", "Bearer " + config.getApiKey())
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .header("User-Agent", properties.getUserAgent())
            .POST(HttpRequest.BodyPublishers.ofString(requestBody(job, employerName), StandardCharsets.UTF_8))
            .build();

        HttpResponse<byte[]> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new ClassificationFailureException("timeout after " + config.getTimeoutSeconds() + "s", e);
        } catch (IOException e) {
            throw new ClassificationFailureException("io_error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClassificationFailureException("interrupted", e);
        }

        int status = response.statusCode();
        if (status == 401 || status == 403) {
            throw new ClassificationServiceException("classification service rejected credentials (HTTP " + status + ")");
        }
        if (status < 200 || status >= 300) {
            throw new ClassificationFailureException("classification service returned HTTP " + status);
        }
        byte[] body = response.body();
        if (body == null || body.length == 0) {
            throw new ClassificationFailureException("empty response body");
        }
        if (body.length > config.getMaxResponseBytes()) {
            throw new ClassificationFailureException(
                "response of " + body.length + " bytes exceeds limit of " + config.getMaxResponseBytes()
            );
        }
        return responseParser.parse(extractContent(new String(body, StandardCharsets.UTF_8)));
    }

    private String requestBody(JobRecord job, String employerName) {
        PipelineProperties.Classification config = properties.getClassification();
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", config.getModel());
        ArrayNode messages = root.putArray("messages");
        messages.addObject()
            .put("role", "system")
            .put("content", ClassificationPromptBuilder.SYSTEM_PROMPT);
        messages.addObject()
            .put("role", "user")
            .put("content", promptBuilder.build(job, employerName));
        root.put("max_completion_tokens", config.getMaxCompletionTokens());
        root.putObject("response_format").put("type", "json_object");
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new ClassificationFailureException("could not encode request", e);
        }
    }

    private String extractContent(String responseBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new ClassificationFailureException("response envelope is not JSON", e);
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new ClassificationFailureException("response has no message content");
        }
        return content.asText();
    }
}
