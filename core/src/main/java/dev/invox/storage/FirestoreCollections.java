package dev.invox.storage;

/**
 * Shared constants describing the Firestore layout used for invoice files and
 * Gemini usage counters.
 */
public final class FirestoreCollections {

    /**
     * Default Firestore collection containing imported invoice files and their extraction status.
     */
    public static final String DEFAULT_FILES_COLLECTION = "invoiceFiles";

    /**
     * Default Firestore collection holding one usage document per Gemini model.
     */
    public static final String DEFAULT_MODEL_USAGE_COLLECTION = "geminiModelUsage";

    private FirestoreCollections() {
    }
}
