package cns.core.enrichment.dto;

import cns.core.enrichment.domain.ReviewStatus;

public record ReviewRequest(ReviewStatus status, String reviewer, String note) {
}
