package dev.invox.invoiceparser.googleai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Client that invokes Google AI Studio's Gemini API using a per-call API key.
 */
public class GoogleAiGeminiClient implements GeminiClient {

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    private static final Logger LOGGER = LoggerFactory.getLogger(GoogleAiGeminiClient.class);
    private static final String JSON_MIME_TYPE = "application/json";
    private static final int ERROR_BODY_PREVIEW = 300;

    private final RestClient restClient;
    private final GeminiGenerationOptions defaultOptions;
    private final ObservationRegistry observationRegistry;

    public GoogleAiGeminiClient(RestClient restClient, GeminiGenerationOptions defaultOptions,
        ObservationRegistry observationRegistry) {
        this.restClient = restClient;
        this.defaultOptions = defaultOptions != null ? defaultOptions : GeminiGenerationOptions.NONE;
        this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
    }

    @Override
    public GeminiGenerationOptions getDefaultOptions() {
        return defaultOptions;
    }

    @Override
    public String generateContent(GeminiContentRequest request, String apiKey) {
        if (request == null) {
            throw new IllegalArgumentException("Request must not be null");
        }
        if (!StringUtils.hasText(apiKey)) {
            throw new IllegalArgumentException("API key must not be empty");
        }
        GeminiGenerationOptions resolvedOptions = defaultOptions.forModel(request.model());
        Observation observation = Observation.start("google.ai.gemini.call", observationRegistry)
            .highCardinalityKeyValue("model", resolvedOptions.model());
        try (Observation.Scope scope = observation.openScope()) {
            LOGGER.info("Calling Google AI Gemini model '{}' with {} bytes of {}", resolvedOptions.model(),
                request.fileBytes().length, request.mimeType());
            GenerateContentRequest body = buildRequest(request, resolvedOptions);
            GenerateContentResponse response = executeRequest(resolvedOptions.model(), body, apiKey);
            return extractContent(response);
        } catch (RuntimeException ex) {
            observation.error(ex);
            throw ex;
        } finally {
            observation.stop();
        }
    }

    private GenerateContentRequest buildRequest(GeminiContentRequest request, GeminiGenerationOptions options) {
        List<Part> userParts = new ArrayList<>();
        if (StringUtils.hasText(request.userPrompt())) {
            userParts.add(Part.ofText(request.userPrompt()));
        }
        userParts.add(Part.ofInline(new InlineData(request.mimeType(),
            Base64.getEncoder().encodeToString(request.fileBytes()))));

        Content systemInstruction = StringUtils.hasText(request.systemInstruction())
            ? new Content(null, List.of(Part.ofText(request.systemInstruction())))
            : null;
        GenerationConfig generationConfig = new GenerationConfig(options.temperature(), options.topP(),
            options.topK(), options.maxOutputTokens(), JSON_MIME_TYPE, request.responseJsonSchema());
        return new GenerateContentRequest(systemInstruction, List.of(new Content("user", userParts)),
            generationConfig);
    }

    private GenerateContentResponse executeRequest(String modelName, GenerateContentRequest request, String apiKey) {
        if (!StringUtils.hasText(modelName)) {
            throw new IllegalStateException("Gemini model name must be configured");
        }
        try {
            return restClient.post()
                .uri(uriBuilder -> uriBuilder
                    .path("/models/{model}:generateContent")
                    .queryParam("key", apiKey)
                    .build(modelName))
                .body(request)
                .retrieve()
                .body(GenerateContentResponse.class);
        } catch (RestClientResponseException ex) {
            int status = ex.getStatusCode().value();
            throw new GeminiApiException(status, "Google AI Gemini request for model '%s' failed with status %d: %s"
                .formatted(modelName, status, preview(ex.getResponseBodyAsString())), ex);
        } catch (RestClientException ex) {
            throw new GeminiApiException("Google AI Gemini request for model '%s' failed: %s"
                .formatted(modelName, ex.getMessage()), ex);
        }
    }

    private String extractContent(GenerateContentResponse response) {
        if (response == null || CollectionUtils.isEmpty(response.candidates())) {
            LOGGER.warn("Gemini response did not contain any candidates");
            return "";
        }
        return response.candidates().stream()
            .filter(candidate -> candidate != null && candidate.content() != null)
            .flatMap(candidate -> {
                List<Part> parts = candidate.content().parts();
                return parts != null ? parts.stream() : List.<Part>of().stream();
            })
            .map(Part::text)
            .filter(StringUtils::hasText)
            .findFirst()
            .orElse("");
    }

    private static String preview(String body) {
        if (!StringUtils.hasText(body)) {
            return "(empty body)";
        }
        String trimmed = body.strip();
        return trimmed.length() > ERROR_BODY_PREVIEW ? trimmed.substring(0, ERROR_BODY_PREVIEW) + "..." : trimmed;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record GenerateContentRequest(Content systemInstruction, List<Content> contents,
        GenerationConfig generationConfig) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Content(String role, List<Part> parts) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Part(String text, InlineData inlineData) {

        static Part ofText(String text) {
            return new Part(text, null);
        }

        static Part ofInline(InlineData inlineData) {
            return new Part(null, inlineData);
        }
    }

    record InlineData(String mimeType, String data) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record GenerationConfig(Double temperature, Double topP, Integer topK, Integer maxOutputTokens,
        String responseMimeType, Map<String, Object> responseJsonSchema) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateContentResponse(List<Candidate> candidates) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Candidate(Content content, String finishReason) {
    }
}
