package dev.invox.invoiceparser;

import com.google.cloud.ServiceOptions;
import dev.invox.storage.FirestoreCollections;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.springframework.util.StringUtils;

/**
 * Firestore settings resolved for the invoice processing service.
 */
public record InvoiceProcessingSettings(
    String projectId,
    String filesCollection,
    String modelUsageCollection
) {

    private static final String DEFAULT_LOCAL_PROJECT_ID = "invox-local";

    public static InvoiceProcessingSettings fromEnvironment() {
        return fromEnvironment(System.getenv(), ServiceOptions::getDefaultProjectId);
    }

    static InvoiceProcessingSettings fromEnvironment(Map<String, String> env,
        Supplier<String> defaultProjectSupplier) {

        Objects.requireNonNull(env, "env");
        Objects.requireNonNull(defaultProjectSupplier, "defaultProjectSupplier");

        String filesCollection = env.getOrDefault(
            "INVOICE_FIRESTORE_COLLECTION",
            FirestoreCollections.DEFAULT_FILES_COLLECTION);
        String usageCollection = env.getOrDefault(
            "INVOICE_FIRESTORE_USAGE_COLLECTION",
            FirestoreCollections.DEFAULT_MODEL_USAGE_COLLECTION);
        String projectId = firstNonEmpty(
            env.get("PROJECT_ID"),
            env.get("FIRESTORE_PROJECT_ID"),
            env.get("GOOGLE_CLOUD_PROJECT"),
            env.get("GCLOUD_PROJECT"),
            env.get("GCP_PROJECT"),
            defaultProjectSupplier.get());

        String localProjectId = env.getOrDefault("LOCAL_PROJECT_ID", DEFAULT_LOCAL_PROJECT_ID);

        if (StringUtils.hasText(localProjectId) && localProjectId.equals(projectId) && isRunningOnCloudRun(env)) {
            throw new IllegalStateException(String.format("Firestore project id resolved to local project '%s' while running on"
                + " Cloud Run. Update the deployment environment to use the production project id.", projectId));
        }

        if (!StringUtils.hasText(projectId)) {
            throw new IllegalStateException("Firestore project id must be configured via PROJECT_ID "
                + "or available from the Cloud environment.");
        }

        return new InvoiceProcessingSettings(projectId, filesCollection, usageCollection);
    }

    private static boolean isRunningOnCloudRun(Map<String, String> env) {
        return StringUtils.hasText(env.get("K_SERVICE"));
    }

    private static String firstNonEmpty(String... values) {
        if (values == null) {
            return null;
        }
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                return value;
            }
        }
        return null;
    }
}
