package dev.invox.invoiceparser.usage;

import dev.invox.invoiceparser.catalog.ModelCatalogLoadedEvent;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;

/**
 * Creates usage records for the models of each newly loaded catalog on a background executor.
 */
public class ModelUsageSynchronizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModelUsageSynchronizer.class);

    private final UsageTracker usageTracker;
    private final Executor executor;

    public ModelUsageSynchronizer(UsageTracker usageTracker, Executor executor) {
        this.usageTracker = usageTracker;
        this.executor = executor;
    }

    @EventListener
    public void onCatalogLoaded(ModelCatalogLoadedEvent event) {
        List<String> models = event.catalog().models();
        try {
            executor.execute(() -> {
                try {
                    usageTracker.sync(models);
                } catch (RuntimeException ex) {
                    LOGGER.error("Background Gemini usage synchronisation failed", ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            LOGGER.error("Could not schedule Gemini usage synchronisation for {} models", models.size(), ex);
        }
    }
}
