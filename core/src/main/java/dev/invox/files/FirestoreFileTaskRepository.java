package dev.invox.files;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.SetOptions;
import dev.invox.storage.InvoiceStorageException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists invoice files and status updates in Firestore, one document per file.
 */
public class FirestoreFileTaskRepository implements FileTaskRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreFileTaskRepository.class);

    private final Firestore firestore;
    private final String collectionName;

    public FirestoreFileTaskRepository(Firestore firestore, String collectionName) {
        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.collectionName = Objects.requireNonNull(collectionName, "collectionName");
        LOGGER.info("FirestoreFileTaskRepository initialized with collection '{}'", collectionName);
    }

    @Override
    public void save(FileTask task) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("fileName", task.fileName());
        payload.put("mimeType", task.mimeType());
        payload.put("storedPath", task.storedPath());
        payload.put("status", task.status().label());
        payload.put("parsedDetails", task.parsedDetails());
        payload.put("createdAt", toTimestamp(task.createdAt()));
        payload.put("updatedAt", toTimestamp(task.updatedAt()));
        write(task.id(), payload);
    }

    @Override
    public void updateStatus(String fileId, FileStatus status) {
        LOGGER.info("Firestore status update for file {} -> {}", fileId, status.label());
        Map<String, Object> payload = new HashMap<>();
        payload.put("status", status.label());
        payload.put("updatedAt", Timestamp.now());
        write(fileId, payload);
    }

    @Override
    public void updateParsedDetails(String fileId, String parsedDetailsJson) {
        LOGGER.info("Storing parsed details for file {} ({} characters)", fileId,
            parsedDetailsJson != null ? parsedDetailsJson.length() : 0);
        Map<String, Object> payload = new HashMap<>();
        payload.put("parsedDetails", parsedDetailsJson);
        payload.put("updatedAt", Timestamp.now());
        write(fileId, payload);
    }

    @Override
    public List<FileTask> findByIds(List<String> fileIds) {
        if (fileIds == null || fileIds.isEmpty()) {
            return List.of();
        }
        DocumentReference[] references = fileIds.stream()
            .map(id -> firestore.collection(collectionName).document(id))
            .toArray(DocumentReference[]::new);
        try {
            List<DocumentSnapshot> snapshots = firestore.getAll(references).get();
            Map<String, FileTask> byId = new HashMap<>();
            for (DocumentSnapshot snapshot : snapshots) {
                if (snapshot != null && snapshot.exists()) {
                    byId.put(snapshot.getId(), fromSnapshot(snapshot));
                }
            }
            List<FileTask> ordered = new ArrayList<>(byId.size());
            for (String id : fileIds) {
                FileTask task = byId.get(id);
                if (task != null) {
                    ordered.add(task);
                }
            }
            return ordered;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new InvoiceStorageException("Interrupted while loading invoice files from Firestore", ex);
        } catch (ExecutionException ex) {
            throw new InvoiceStorageException("Failed to load invoice files from Firestore", ex);
        }
    }

    private void write(String fileId, Map<String, Object> payload) {
        DocumentReference reference = firestore.collection(collectionName)
            .document(Objects.requireNonNull(fileId, "fileId"));
        try {
            reference.set(payload, SetOptions.merge()).get();
        } catch (InterruptedException ex) {
            LOGGER.error("Interrupted while writing Firestore document {}/{}", collectionName, fileId, ex);
            Thread.currentThread().interrupt();
            throw new InvoiceStorageException("Interrupted while writing invoice file to Firestore", ex);
        } catch (ExecutionException ex) {
            LOGGER.error("ExecutionException while writing Firestore document {}/{}", collectionName, fileId, ex);
            throw new InvoiceStorageException("Failed to store invoice file in Firestore", ex);
        }
    }

    static FileTask fromSnapshot(DocumentSnapshot snapshot) {
        return new FileTask(
            snapshot.getId(),
            snapshot.getString("fileName"),
            snapshot.getString("mimeType"),
            snapshot.getString("storedPath"),
            FileStatus.fromLabel(snapshot.getString("status")),
            snapshot.getString("parsedDetails"),
            toInstant(snapshot.getTimestamp("createdAt")),
            toInstant(snapshot.getTimestamp("updatedAt")));
    }

    private static Timestamp toTimestamp(Instant instant) {
        if (instant == null) {
            return Timestamp.now();
        }
        return Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano());
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos()) : null;
    }
}
