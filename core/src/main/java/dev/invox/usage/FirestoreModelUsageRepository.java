package dev.invox.usage;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import dev.invox.storage.InvoiceStorageException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists Gemini usage counters in Firestore. The model name is the document id.
 */
public class FirestoreModelUsageRepository implements ModelUsageRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreModelUsageRepository.class);

    private final Firestore firestore;
    private final String collectionName;

    public FirestoreModelUsageRepository(Firestore firestore, String collectionName) {
        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.collectionName = Objects.requireNonNull(collectionName, "collectionName");
        LOGGER.info("FirestoreModelUsageRepository initialized with collection '{}'", collectionName);
    }

    @Override
    public Optional<ModelUsageRecord> load(String model) {
        try {
            DocumentSnapshot snapshot = document(model).get().get();
            if (snapshot == null || !snapshot.exists()) {
                return Optional.empty();
            }
            return Optional.of(fromSnapshot(model, snapshot));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new InvoiceStorageException("Interrupted while loading usage for model " + model, ex);
        } catch (ExecutionException ex) {
            throw new InvoiceStorageException("Failed to load usage for model " + model, ex);
        }
    }

    @Override
    public void upsert(ModelUsageRecord record) {
        try {
            document(record.model()).set(toPayload(record)).get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new InvoiceStorageException("Interrupted while storing usage for model " + record.model(), ex);
        } catch (ExecutionException ex) {
            throw new InvoiceStorageException("Failed to store usage for model " + record.model(), ex);
        }
    }

    @Override
    public boolean insertIfAbsent(ModelUsageRecord record) {
        DocumentReference reference = document(record.model());
        Map<String, Object> payload = toPayload(record);
        try {
            return firestore.runTransaction(transaction -> {
                DocumentSnapshot snapshot = transaction.get(reference).get();
                if (snapshot.exists()) {
                    return false;
                }
                transaction.create(reference, payload);
                return true;
            }).get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new InvoiceStorageException("Interrupted while creating usage for model " + record.model(), ex);
        } catch (ExecutionException ex) {
            throw new InvoiceStorageException("Failed to create usage for model " + record.model(), ex);
        }
    }

    private DocumentReference document(String model) {
        return firestore.collection(collectionName).document(Objects.requireNonNull(model, "model"));
    }

    private static Map<String, Object> toPayload(ModelUsageRecord record) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", record.model());
        payload.put("day", record.day());
        payload.put("minuteWindowStart", record.minuteWindowStart());
        payload.put("requestsMinute", record.requestsMinute());
        payload.put("requestsDay", record.requestsToday());
        payload.put("updatedAt", Timestamp.now());
        return payload;
    }

    static ModelUsageRecord fromSnapshot(String model, DocumentSnapshot snapshot) {
        return new ModelUsageRecord(
            model,
            snapshot.getString("day"),
            longValue(snapshot.getLong("minuteWindowStart")),
            (int) longValue(snapshot.getLong("requestsMinute")),
            (int) longValue(snapshot.getLong("requestsDay")));
    }

    private static long longValue(Long value) {
        return value != null ? Math.max(0L, value) : 0L;
    }
}
