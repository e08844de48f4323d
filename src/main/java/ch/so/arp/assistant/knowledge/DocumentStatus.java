package ch.so.arp.assistant.knowledge;

/**
 * Lifecycle of a knowledge document. Deleted documents keep their row as an
 * audit trail while their chunks are removed.
 */
public enum DocumentStatus {

    ACTIVE("active"),
    DELETED("deleted");

    private final String columnValue;

    DocumentStatus(String columnValue) {
        this.columnValue = columnValue;
    }

    String columnValue() {
        return columnValue;
    }

    static DocumentStatus fromColumnValue(String value) {
        for (DocumentStatus status : values()) {
            if (status.columnValue.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown document status: " + value);
    }
}
