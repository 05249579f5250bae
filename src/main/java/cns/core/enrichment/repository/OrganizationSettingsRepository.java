package cns.core.enrichment.repository;

import cns.core.enrichment.domain.OrganizationSettings;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OrganizationSettingsRepository extends JpaRepository<OrganizationSettings, String> {
}
