package dev.invox.files;

import java.time.Instant;
import java.util.Objects;

/**
 * An imported invoice document together with its extraction status.
 *
 * @param id            stable identifier of the file
 * @param fileName      display name shown to users
 * @param mimeType      declared content type; may be {@code null}
 * @param storedPath    local path or {@code gs://} reference of the binary content
 * @param status        current processing status
 * @param parsedDetails JSON payload written after extraction; may be {@code null}
 * @param createdAt     import time
 * @param updatedAt     time of the last status or payload change
 */
public record FileTask(
    String id,
    String fileName,
    String mimeType,
    String storedPath,
    FileStatus status,
    String parsedDetails,
    Instant createdAt,
    Instant updatedAt
) {

    public FileTask {
        Objects.requireNonNull(id, "id must not be null");
        status = status != null ? status : FileStatus.UNPROCESSED;
    }

    public static FileTask imported(String id, String fileName, String mimeType, String storedPath, Instant now) {
        return new FileTask(id, fileName, mimeType, storedPath, FileStatus.UNPROCESSED, null, now, now);
    }

    public FileTask withStatus(FileStatus newStatus, Instant now) {
        return new FileTask(id, fileName, mimeType, storedPath, newStatus, parsedDetails, createdAt, now);
    }

    public FileTask withParsedDetails(String json, Instant now) {
        return new FileTask(id, fileName, mimeType, storedPath, status, json, createdAt, now);
    }
}
