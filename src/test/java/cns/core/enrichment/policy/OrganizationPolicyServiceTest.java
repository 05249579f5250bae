package cns.core.enrichment.policy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import cns.core.enrichment.config.EnrichmentProperties;
import cns.core.enrichment.domain.OrganizationSettings;
import cns.core.enrichment.repository.OrganizationSettingsRepository;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OrganizationPolicyServiceTest {

    @Mock
    private OrganizationSettingsRepository settingsRepository;

    private EnrichmentProperties properties;
    private OrganizationPolicyService service;

    @BeforeEach
    void setUp() {
        properties = new EnrichmentProperties();
        properties.getPolicy().setSupplierPriority(List.of("mouser", "digikey"));
        service = new OrganizationPolicyService(properties, settingsRepository);
    }

    @Test
    void usesPropertyDefaultsWithoutSettingsRow() {
        when(settingsRepository.findById("org-1")).thenReturn(Optional.empty());

        EnrichmentPolicy policy = service.resolve("org-1");

        assertThat(policy.catalogThreshold()).isEqualTo(95.0);
        assertThat(policy.cacheThreshold()).isEqualTo(80.0);
        assertThat(policy.cacheTtl()).isEqualTo(Duration.ofHours(72));
        assertThat(policy.supplierPriority()).containsExactly("mouser", "digikey");
        assertThat(policy.circuitBreaker().failureThreshold()).isEqualTo(5);
        assertThat(policy.retry().maxAttempts()).isEqualTo(3);
    }

    @Test
    void organizationSettingsOverrideDefaults() {
        OrganizationSettings settings = new OrganizationSettings("org-1");
        settings.setCatalogThreshold(90.0);
        settings.setCacheThreshold(70.0);
        settings.setCacheTtlHours(24L);
        settings.setSupplierPriority("digikey, mouser");
        settings.setDisabledSuppliers("arrow");
        settings.setCircuitBreakerFailureThreshold(2);
        settings.setRetryEnabled(false);
        when(settingsRepository.findById("org-1")).thenReturn(Optional.of(settings));

        EnrichmentPolicy policy = service.resolve("org-1");

        assertThat(policy.catalogThreshold()).isEqualTo(90.0);
        assertThat(policy.cacheThreshold()).isEqualTo(70.0);
        assertThat(policy.cacheTtl()).isEqualTo(Duration.ofHours(24));
        assertThat(policy.supplierPriority()).containsExactly("digikey", "mouser");
        assertThat(policy.supplierEnabled("arrow")).isFalse();
        assertThat(policy.circuitBreaker().failureThreshold()).isEqualTo(2);
        assertThat(policy.circuitBreaker().timeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(policy.retry().effectiveAttempts()).isEqualTo(1);
    }

    @Test
    void inconsistentSettingsFallBackToDefaults() {
        OrganizationSettings settings = new OrganizationSettings("org-1");
        settings.setCatalogThreshold(75.0);
        settings.setCacheThreshold(85.0);
        when(settingsRepository.findById("org-1")).thenReturn(Optional.of(settings));

        EnrichmentPolicy policy = service.resolve("org-1");

        assertThat(policy.catalogThreshold()).isEqualTo(95.0);
        assertThat(policy.cacheThreshold()).isEqualTo(80.0);
    }

    @Test
    void nullOrganizationUsesDefaults() {
        EnrichmentPolicy policy = service.resolve(null);

        assertThat(policy.organizationId()).isNull();
        assertThat(policy.catalogEnabled()).isTrue();
    }
}
