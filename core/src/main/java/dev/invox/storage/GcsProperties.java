package dev.invox.storage;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gcs")
public class GcsProperties {

    /**
     * Flag indicating whether invoice files may be read from Google Cloud Storage.
     */
    private boolean enabled;

    /**
     * Optional path or resource string that resolves to the service account credentials file.
     * When omitted, application default credentials will be used.
     */
    private String credentials;

    /**
     * Optional Google Cloud project identifier used when building the storage client.
     */
    private String projectId;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getCredentials() {
        return credentials;
    }

    public void setCredentials(String credentials) {
        this.credentials = credentials;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }
}
