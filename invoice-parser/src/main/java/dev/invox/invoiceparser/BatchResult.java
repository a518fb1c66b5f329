package dev.invox.invoiceparser;

/**
 * Counts of files that ended the batch as processed or failed.
 */
public record BatchResult(int processedFiles, int failedFiles) {
}
