package dev.invox.invoiceparser;

import java.util.Objects;

/**
 * Document content handed to the extractor.
 *
 * @param fileId   id of the stored file task
 * @param label    human readable label used in logs, {@code <fileName> (#<id prefix>)}
 * @param mimeType content type sent to Gemini
 * @param content  raw document bytes
 */
public record InvoiceInput(String fileId, String label, String mimeType, byte[] content) {

    private static final int ID_PREFIX_LENGTH = 8;

    public InvoiceInput {
        Objects.requireNonNull(fileId, "fileId must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    static String labelFor(String fileName, String fileId) {
        String prefix = fileId.length() > ID_PREFIX_LENGTH ? fileId.substring(0, ID_PREFIX_LENGTH) : fileId;
        return "%s (#%s)".formatted(fileName, prefix);
    }

    @Override
    public String toString() {
        return "InvoiceInput{fileId=%s, label=%s, mimeType=%s, bytes=%d}".formatted(fileId, label, mimeType,
            content.length);
    }
}
