package dev.invox.invoiceparser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.invox.invoiceparser.googleai.GeminiClient;
import dev.invox.invoiceparser.googleai.GeminiContentRequest;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Performs one timed extraction attempt of one document against one Gemini model.
 */
public class ExtractionInvoker {

    static final String RAW_FIELD = "_raw";

    private static final Logger LOGGER = LoggerFactory.getLogger(ExtractionInvoker.class);

    private final GeminiClient geminiClient;
    private final ObjectMapper objectMapper;
    private final ObjectReader payloadReader;
    private final InvoicePrompts prompts;
    private final ExecutorService executor;
    private final Duration attemptTimeout;

    public ExtractionInvoker(GeminiClient geminiClient, ObjectMapper objectMapper, InvoicePrompts prompts,
        ExecutorService executor, Duration attemptTimeout) {
        this.geminiClient = geminiClient;
        this.objectMapper = objectMapper;
        this.payloadReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.prompts = prompts;
        this.executor = executor;
        this.attemptTimeout = attemptTimeout;
    }

    /**
     * Calls Gemini and waits at most the attempt timeout. Errors are returned as classified failures; only an
     * interrupt of the calling thread escapes as an exception.
     */
    public ExtractionOutcome invoke(InvoiceInput input, String model, String apiKey) {
        GeminiContentRequest request = new GeminiContentRequest(model, prompts.systemInstruction(),
            prompts.userPrompt(), prompts.responseSchema(), input.content(), input.mimeType());

        Future<String> future;
        try {
            future = executor.submit(() -> geminiClient.generateContent(request, apiKey));
        } catch (RejectedExecutionException ex) {
            LOGGER.error("Gemini call for {} could not be scheduled", input.label(), ex);
            return ExtractionOutcome.failure(ErrorClassifier.messageOf(ex), FailureClassification.OTHER);
        }

        String text;
        try {
            text = future.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            String message = "Request timed out after %d seconds".formatted(attemptTimeout.toSeconds());
            LOGGER.warn("Gemini model {} did not answer for {}: {}", model, input.label(), message);
            return ExtractionOutcome.failure(message, FailureClassification.TIMED_OUT);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new InvoiceProcessingException("Interrupted while waiting for Gemini model " + model, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            FailureClassification classification = ErrorClassifier.classify(cause);
            LOGGER.warn("Gemini model {} failed for {} ({}): {}", model, input.label(), classification,
                ErrorClassifier.messageOf(cause));
            return ExtractionOutcome.failure(ErrorClassifier.messageOf(cause), classification);
        }

        return parseResponse(text, input);
    }

    ExtractionOutcome parseResponse(String response, InvoiceInput input) {
        String trimmed = response != null ? response.trim() : "";
        String sanitised = sanitiseResponse(trimmed);
        if (StringUtils.hasText(sanitised)) {
            try {
                JsonNode payload = payloadReader.readTree(sanitised);
                if (payload != null && !payload.isMissingNode() && !payload.isNull()) {
                    return ExtractionOutcome.success(payload, false);
                }
            } catch (JsonProcessingException ex) {
                LOGGER.warn("Gemini response for {} is not valid JSON: {}", input.label(), ex.getOriginalMessage());
            }
        }
        LOGGER.warn("Storing unparsed Gemini response for {} ({} characters)", input.label(), trimmed.length());
        ObjectNode raw = objectMapper.createObjectNode();
        raw.put(RAW_FIELD, trimmed);
        return ExtractionOutcome.success(raw, true);
    }

    private String sanitiseResponse(String trimmed) {
        String sanitised = trimmed;
        if (sanitised.length() >= 6 && sanitised.startsWith("```") && sanitised.endsWith("```")) {
            LOGGER.debug("Removing Markdown code fences from Gemini response");
            int firstBreak = sanitised.indexOf('\n');
            if (firstBreak > 0) {
                sanitised = sanitised.substring(firstBreak + 1, sanitised.length() - 3).trim();
            } else {
                sanitised = sanitised.substring(3, sanitised.length() - 3).trim();
            }
        }
        if (sanitised.length() >= 2 && sanitised.startsWith("`") && sanitised.endsWith("`")) {
            sanitised = sanitised.substring(1, sanitised.length() - 1).trim();
        }
        return sanitised;
    }
}
