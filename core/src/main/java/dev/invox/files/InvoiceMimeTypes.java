package dev.invox.files;

import java.util.Locale;
import java.util.Map;
import org.springframework.util.StringUtils;

/**
 * Content types accepted for invoice documents, keyed by file extension.
 */
public final class InvoiceMimeTypes {

    public static final String FALLBACK = "application/octet-stream";

    private static final Map<String, String> BY_EXTENSION = Map.of(
        ".pdf", "application/pdf",
        ".png", "image/png",
        ".jpg", "image/jpeg",
        ".jpeg", "image/jpeg",
        ".webp", "image/webp",
        ".tif", "image/tiff",
        ".tiff", "image/tiff",
        ".bmp", "image/bmp",
        ".heic", "image/heic");

    private InvoiceMimeTypes() {
    }

    /**
     * Returns the declared type when present, otherwise the type registered for the file
     * extension, otherwise {@link #FALLBACK}.
     */
    public static String resolve(String fileName, String declared) {
        if (StringUtils.hasText(declared)) {
            return declared;
        }
        if (!StringUtils.hasText(fileName)) {
            return FALLBACK;
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return FALLBACK;
        }
        String extension = fileName.substring(dot).toLowerCase(Locale.ROOT);
        return BY_EXTENSION.getOrDefault(extension, FALLBACK);
    }

    public static boolean isSupported(String fileName) {
        return !FALLBACK.equals(resolve(fileName, null));
    }
}
