package cns.core.enrichment.dto;

import cns.core.enrichment.domain.RequestSource;

public record SubmitRequest(String mpn,
                            String manufacturer,
                            Integer priority,
                            RequestSource source,
                            String organizationId,
                            String lineReference) {
}
