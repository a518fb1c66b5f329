package dev.invox.invoiceparser;

/**
 * Receives progress notifications while a batch is processed.
 */
public interface BatchProgressListener {

    void onStatusUpdate(String message);

    void onProgress(int completed, int total);

    static BatchProgressListener none() {
        return new BatchProgressListener() {
            @Override
            public void onStatusUpdate(String message) {
            }

            @Override
            public void onProgress(int completed, int total) {
            }
        };
    }
}
