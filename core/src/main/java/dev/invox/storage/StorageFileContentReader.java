package dev.invox.storage;

import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * {@link FileContentReader} that resolves {@code gs://} references through Google Cloud Storage
 * and everything else through the local filesystem.
 */
public class StorageFileContentReader implements FileContentReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(StorageFileContentReader.class);

    static final String GCS_SCHEME = "gs://";

    private final Storage storage;

    /**
     * @param storage Cloud Storage client; may be {@code null} when only local paths are used
     */
    public StorageFileContentReader(Storage storage) {
        this.storage = storage;
    }

    @Override
    public byte[] readBinary(String path) {
        if (!StringUtils.hasText(path)) {
            throw new InvoiceStorageException("File path must not be empty");
        }
        if (path.startsWith(GCS_SCHEME)) {
            return readFromBucket(path);
        }
        return readFromDisk(path);
    }

    private byte[] readFromDisk(String path) {
        Path resolved;
        try {
            resolved = Paths.get(path);
        } catch (InvalidPathException ex) {
            throw new InvoiceStorageException("Invalid file path '%s'".formatted(path), ex);
        }
        if (!Files.isRegularFile(resolved)) {
            throw new InvoiceStorageException("File '%s' does not exist".formatted(path));
        }
        try {
            byte[] content = Files.readAllBytes(resolved);
            LOGGER.debug("Read {} bytes from {}", content.length, resolved);
            return content;
        } catch (IOException ex) {
            throw new InvoiceStorageException("Failed to read file '%s'".formatted(path), ex);
        }
    }

    private byte[] readFromBucket(String path) {
        if (storage == null) {
            throw new InvoiceStorageException(
                "Cannot read '%s': Google Cloud Storage integration is disabled".formatted(path));
        }
        BlobId blobId = parseBlobId(path);
        try {
            Blob blob = storage.get(blobId);
            if (blob == null) {
                throw new InvoiceStorageException("Blob not found for %s".formatted(path));
            }
            byte[] content = blob.getContent();
            LOGGER.debug("Read {} bytes from {}", content.length, path);
            return content;
        } catch (StorageException ex) {
            throw new InvoiceStorageException("Failed to download %s".formatted(path), ex);
        }
    }

    static BlobId parseBlobId(String path) {
        String remainder = path.substring(GCS_SCHEME.length());
        int slash = remainder.indexOf('/');
        if (slash <= 0 || slash == remainder.length() - 1) {
            throw new InvoiceStorageException("Malformed Cloud Storage reference '%s'".formatted(path));
        }
        return BlobId.of(remainder.substring(0, slash), remainder.substring(slash + 1));
    }
}
