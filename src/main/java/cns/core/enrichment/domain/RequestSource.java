package cns.core.enrichment.domain;

public enum RequestSource {
    MANUAL,
    BOM_UPLOAD,
    SCHEDULED_RECHECK
}
