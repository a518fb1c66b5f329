package dev.invox.invoiceparser.catalog;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "invoice.catalog")
public class ModelCatalogProperties {

    /**
     * Location of the cached catalog document. Missing files fall back to the built-in catalog.
     */
    private String path = "gemini-models.json";

    /**
     * Remote catalog document fetched by a refresh. Refreshing is disabled when unset.
     */
    private String url;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }
}
