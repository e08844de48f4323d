package ch.so.arp.assistant.knowledge;

/**
 * Raised when the text of an uploaded document cannot be extracted.
 */
public class DocumentExtractionException extends RuntimeException {

    public DocumentExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
