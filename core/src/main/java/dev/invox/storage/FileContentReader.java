package dev.invox.storage;

/**
 * Reads the binary content of a stored invoice file.
 */
public interface FileContentReader {

    /**
     * @param path local filesystem path or {@code gs://bucket/object} reference
     * @return the file content, never {@code null}
     * @throws InvoiceStorageException when the content cannot be read
     */
    byte[] readBinary(String path);
}
