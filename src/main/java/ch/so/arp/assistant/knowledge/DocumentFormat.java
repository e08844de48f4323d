package ch.so.arp.assistant.knowledge;

import java.util.Arrays;
import java.util.Locale;

/**
 * Source formats accepted for knowledge uploads.
 */
public enum DocumentFormat {

    TXT("txt"),
    MD("md"),
    PDF("pdf"),
    DOCX("docx");

    private final String extension;

    DocumentFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * Resolve the format from the extension of a file name.
     *
     * @throws UnsupportedDocumentFormatException when the extension is missing or
     *                                            not part of the allow-list
     */
    public static DocumentFormat fromFileName(String fileName) {
        int separator = fileName == null ? -1 : fileName.lastIndexOf('.');
        String extension = separator < 0 ? "" : fileName.substring(separator + 1);
        return fromExtension(extension);
    }

    public static DocumentFormat fromExtension(String extension) {
        String normalized = extension == null ? "" : extension.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(format -> format.extension.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new UnsupportedDocumentFormatException(normalized));
    }
}
