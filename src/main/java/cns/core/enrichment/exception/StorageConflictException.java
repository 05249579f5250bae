package cns.core.enrichment.exception;

public class StorageConflictException extends RuntimeException {

    private final String recordKey;

    public StorageConflictException(String recordKey, String message) {
        super(message);
        this.recordKey = recordKey;
    }

    public String getRecordKey() {
        return recordKey;
    }
}
