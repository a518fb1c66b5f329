package dev.invox.invoiceparser;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Utility for populating mapped diagnostic context (MDC) entries so log lines emitted during
 * a batch share the same identifiers (batch id, file id, model, stage).
 */
final class InvoiceProcessingMdc {

    private static final String KEY_BATCH_ID = "invoice.batchId";
    private static final String KEY_FILE_ID = "invoice.fileId";
    private static final String KEY_MODEL = "invoice.model";
    private static final String KEY_STAGE = "invoice.stage";

    private InvoiceProcessingMdc() {
        // Utility class
    }

    static Context open(String batchId) {
        return new Context(batchId);
    }

    static void attachFile(String fileId) {
        putIfHasText(KEY_FILE_ID, fileId);
        MDC.remove(KEY_MODEL);
    }

    static void attachModel(String model) {
        putIfHasText(KEY_MODEL, model);
    }

    static void setStage(String stage) {
        putIfHasText(KEY_STAGE, stage);
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String batchId) {
            this.previous = MDC.getCopyOfContextMap();
            putIfHasText(KEY_BATCH_ID, batchId);
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
