package dev.invox.invoiceparser.catalog;

/**
 * Published whenever a catalog becomes the current one, at first load and after each refresh.
 */
public record ModelCatalogLoadedEvent(ModelCatalog catalog) {
}
