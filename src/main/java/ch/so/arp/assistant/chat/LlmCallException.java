package ch.so.arp.assistant.chat;

/**
 * A single call to the model endpoint failed: the endpoint was unreachable,
 * answered with a non-success status or returned an unusable body.
 */
public class LlmCallException extends Exception {

    public LlmCallException(String message) {
        super(message);
    }

    public LlmCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
