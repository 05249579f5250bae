package cns.core.enrichment.queue;

public enum NackResult {
    RETRY_SCHEDULED,
    FAILED,
    IGNORED
}
