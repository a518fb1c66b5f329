package dev.invox.invoiceparser.catalog;

/**
 * Flattened view of one catalog model.
 *
 * @param model            model identifier
 * @param rateLimit        limit applied to the model
 * @param fallbackPosition zero-based position in the fallback order, or {@code -1} when the model is not part of it
 * @param defaultModel     whether this is the catalog's default model
 */
public record ModelCatalogEntry(String model, ModelRateLimit rateLimit, int fallbackPosition, boolean defaultModel) {
}
