package dev.invox.invoiceparser.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Owns the current {@link ModelCatalog}. The catalog is read from the cached document on first use, falling
 * back to the built-in defaults, and replaced by {@link #refresh()}.
 */
public class ModelCatalogRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModelCatalogRepository.class);

    private final ModelCatalogProperties properties;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;
    private final ApplicationEventPublisher eventPublisher;

    private volatile ModelCatalog current;

    public ModelCatalogRepository(ModelCatalogProperties properties, ObjectMapper objectMapper,
        RestClient restClient, ApplicationEventPublisher eventPublisher) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.restClient = restClient;
        this.eventPublisher = eventPublisher;
    }

    public ModelCatalog current() {
        ModelCatalog catalog = current;
        if (catalog != null) {
            return catalog;
        }
        synchronized (this) {
            if (current == null) {
                ModelCatalog loaded = readFromDisk().orElseGet(ModelCatalog::defaults);
                LOGGER.info("Loaded Gemini model catalog with {} models (default {})", loaded.models().size(),
                    loaded.defaultModel());
                current = loaded;
                eventPublisher.publishEvent(new ModelCatalogLoadedEvent(loaded));
            }
            return current;
        }
    }

    /**
     * Fetches the remote catalog, caches it on disk and makes it current. When no URL is configured or the fetch
     * fails the current catalog is kept and returned.
     */
    public synchronized ModelCatalog refresh() {
        String url = properties.getUrl();
        if (!StringUtils.hasText(url)) {
            LOGGER.warn("Gemini model catalog URL is not configured; keeping the current catalog");
            return current();
        }

        ModelCatalog refreshed;
        try {
            refreshed = ModelCatalog.normalize(fetch(url));
        } catch (ModelCatalogException | IllegalArgumentException ex) {
            LOGGER.warn("Failed to refresh Gemini model catalog from {}", url, ex);
            return current();
        }

        current = refreshed;
        writeToDisk(refreshed);
        LOGGER.info("Refreshed Gemini model catalog from {} with {} models", url, refreshed.models().size());
        eventPublisher.publishEvent(new ModelCatalogLoadedEvent(refreshed));
        return refreshed;
    }

    private JsonNode fetch(String url) {
        String body;
        try {
            body = restClient.get()
                .uri(url)
                .retrieve()
                .body(String.class);
        } catch (RestClientException ex) {
            throw new ModelCatalogException("Failed to fetch Gemini catalog from " + url, ex);
        }
        if (!StringUtils.hasText(body)) {
            throw new ModelCatalogException("Gemini catalog at " + url + " was empty");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new ModelCatalogException("Gemini catalog at " + url + " is not valid JSON", ex);
        }
    }

    private Optional<ModelCatalog> readFromDisk() {
        Path path = catalogPath();
        if (path == null || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(ModelCatalog.normalize(objectMapper.readTree(path.toFile())));
        } catch (IOException | IllegalArgumentException ex) {
            LOGGER.warn("Failed to load Gemini model catalog from {}", path, ex);
            return Optional.empty();
        }
    }

    private void writeToDisk(ModelCatalog catalog) {
        Path path = catalogPath();
        if (path == null) {
            return;
        }
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), catalog);
        } catch (IOException ex) {
            LOGGER.warn("Failed to persist Gemini model catalog to {}", path, ex);
        }
    }

    private Path catalogPath() {
        return StringUtils.hasText(properties.getPath()) ? Path.of(properties.getPath()) : null;
    }
}
