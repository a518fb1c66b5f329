package dev.invox.files;

import java.util.Arrays;

/**
 * Processing lifecycle states for an imported invoice file.
 */
public enum FileStatus {

    /**
     * The file was imported and has not been submitted for extraction yet.
     */
    UNPROCESSED("Unprocessed"),

    /**
     * The file belongs to a running batch. A file left in this state after a crash
     * should be submitted again.
     */
    PROCESSING("Processing"),

    /**
     * Gemini returned a payload and it was stored.
     */
    PROCESSED("Processed"),

    /**
     * Every candidate model failed or the batch aborted before the file finished.
     */
    FAILED("Failed");

    private final String label;

    FileStatus(String label) {
        this.label = label;
    }

    /**
     * @return the value persisted in storage and shown to users
     */
    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == PROCESSED || this == FAILED;
    }

    public static FileStatus fromLabel(String value) {
        if (value == null) {
            return UNPROCESSED;
        }
        return Arrays.stream(values())
            .filter(status -> status.label.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown file status '" + value + "'"));
    }
}
