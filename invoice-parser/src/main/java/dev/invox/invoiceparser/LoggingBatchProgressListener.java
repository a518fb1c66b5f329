package dev.invox.invoiceparser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes batch progress to the application log.
 */
public class LoggingBatchProgressListener implements BatchProgressListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingBatchProgressListener.class);

    @Override
    public void onStatusUpdate(String message) {
        LOGGER.info(message);
    }

    @Override
    public void onProgress(int completed, int total) {
        LOGGER.debug("Batch progress {}/{}", completed, total);
    }
}
