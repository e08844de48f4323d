package ch.so.arp.assistant.knowledge;

/**
 * Raised when an upload uses a file extension outside of the allow-list.
 */
public class UnsupportedDocumentFormatException extends RuntimeException {

    private final String extension;

    public UnsupportedDocumentFormatException(String extension) {
        super("Unsupported document format: '" + extension + "'");
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
