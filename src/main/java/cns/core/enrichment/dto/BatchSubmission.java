package cns.core.enrichment.dto;

import cns.core.enrichment.domain.RequestSource;
import java.util.List;

public record BatchSubmission(String organizationId,
                              String label,
                              RequestSource source,
                              List<Item> items) {

    public record Item(String mpn, String manufacturer, Integer priority, String lineReference) {
    }
}
