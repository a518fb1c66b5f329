package dev.invox.invoiceparser.catalog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Models available for extraction, their fallback order and their rate limits.
 */
public record ModelCatalog(
    String defaultModel,
    List<String> models,
    List<String> fallbackOrder,
    Map<String, ModelRateLimit> rateLimits
) {

    public static final String DEFAULT_MODEL = "gemini-2.5-flash";

    private static final ModelCatalog DEFAULTS;

    static {
        List<String> order = List.of(
            "gemini-2.5-flash",
            "gemini-2.5-pro",
            "gemini-2.5-flash-lite",
            "gemini-2.0-flash",
            "gemini-2.0-flash-lite");
        Map<String, ModelRateLimit> limits = new LinkedHashMap<>();
        limits.put("gemini-2.5-flash", new ModelRateLimit(10, 1000, 5));
        limits.put("gemini-2.5-pro", new ModelRateLimit(2, 100, 1));
        limits.put("gemini-2.5-flash-lite", new ModelRateLimit(15, 1500, 5));
        limits.put("gemini-2.0-flash", new ModelRateLimit(15, 1500, 5));
        limits.put("gemini-2.0-flash-lite", new ModelRateLimit(30, 3000, 10));
        DEFAULTS = new ModelCatalog(DEFAULT_MODEL, order, order, limits);
    }

    public ModelCatalog {
        Objects.requireNonNull(defaultModel, "defaultModel must not be null");
        models = List.copyOf(models);
        fallbackOrder = List.copyOf(fallbackOrder);
        rateLimits = Collections.unmodifiableMap(new LinkedHashMap<>(rateLimits));
    }

    public static ModelCatalog defaults() {
        return DEFAULTS;
    }

    /**
     * Builds a catalog from an untrusted JSON document. Anything that is not an object yields the defaults;
     * blank names and non-numeric limits are ignored.
     */
    public static ModelCatalog normalize(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            return DEFAULTS;
        }

        List<String> rawModels = textValues(raw.get("models"));
        List<String> rawFallbackOrder = textValues(raw.get("fallbackOrder"));
        JsonNode defaultNode = raw.get("defaultModel");
        String defaultCandidate = defaultNode != null && defaultNode.isTextual() && StringUtils.hasText(defaultNode.asText())
            ? defaultNode.asText().trim()
            : null;

        LinkedHashSet<String> modelSet = new LinkedHashSet<>(rawModels);
        modelSet.addAll(rawFallbackOrder);
        List<String> models = new ArrayList<>(modelSet);
        List<String> fallbackOrder = rawFallbackOrder.isEmpty()
            ? new ArrayList<>(models)
            : new ArrayList<>(new LinkedHashSet<>(rawFallbackOrder));

        String defaultModel = defaultCandidate;
        if (defaultModel == null) {
            defaultModel = !fallbackOrder.isEmpty() ? fallbackOrder.get(0)
                : !models.isEmpty() ? models.get(0)
                : DEFAULT_MODEL;
        }
        if (!models.contains(defaultModel)) {
            models.add(0, defaultModel);
        }
        if (!fallbackOrder.contains(defaultModel)) {
            fallbackOrder.add(0, defaultModel);
        }

        Map<String, ModelRateLimit> rateLimits = new LinkedHashMap<>(DEFAULTS.rateLimits());
        JsonNode rawLimits = raw.get("rateLimits");
        if (rawLimits != null && rawLimits.isObject()) {
            rawLimits.fields().forEachRemaining(field -> {
                String model = field.getKey();
                JsonNode limit = field.getValue();
                if (!StringUtils.hasText(model) || limit == null || !limit.isObject()) {
                    return;
                }
                ModelRateLimit base = rateLimits.getOrDefault(model, ModelRateLimit.UNMETERED);
                rateLimits.put(model, new ModelRateLimit(
                    intOrDefault(limit.get("rpm"), base.rpm()),
                    intOrDefault(limit.get("rpd"), base.rpd()),
                    intOrDefault(limit.get("concurrent"), base.concurrent())));
            });
        }

        return new ModelCatalog(defaultModel, models, fallbackOrder, rateLimits);
    }

    /**
     * @return the configured fallback order, or every model when no order is configured
     */
    @JsonIgnore
    public List<String> effectiveFallbackOrder() {
        return fallbackOrder.isEmpty() ? models : fallbackOrder;
    }

    public ModelRateLimit rateLimitFor(String model) {
        return rateLimits.getOrDefault(model, ModelRateLimit.UNMETERED);
    }

    @JsonIgnore
    public List<ModelCatalogEntry> entries() {
        List<ModelCatalogEntry> entries = new ArrayList<>(models.size());
        for (String model : models) {
            entries.add(new ModelCatalogEntry(model, rateLimitFor(model), fallbackOrder.indexOf(model),
                model.equals(defaultModel)));
        }
        return entries;
    }

    private static List<String> textValues(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (element.isTextual() && StringUtils.hasText(element.asText())) {
                values.add(element.asText());
            }
        }
        return values;
    }

    private static int intOrDefault(JsonNode node, int fallback) {
        if (node == null || !node.isNumber()) {
            return fallback;
        }
        double value = node.doubleValue();
        if (Double.isNaN(value) || value < 0) {
            return fallback;
        }
        if (value >= Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        return (int) value;
    }
}
