package cns.core.enrichment.policy;

import cns.core.enrichment.config.EnrichmentProperties;
import cns.core.enrichment.domain.OrganizationSettings;
import cns.core.enrichment.quality.ScoringWeights;
import cns.core.enrichment.repository.OrganizationSettingsRepository;
import cns.core.enrichment.resilience.CircuitBreakerSettings;
import cns.core.enrichment.resilience.RetryPolicy;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class OrganizationPolicyService {

    private static final Logger log = LoggerFactory.getLogger(OrganizationPolicyService.class);
    private final EnrichmentProperties properties;
    private final OrganizationSettingsRepository settingsRepository;

    public OrganizationPolicyService(EnrichmentProperties properties,
                                     OrganizationSettingsRepository settingsRepository) {
        this.properties = properties;
        this.settingsRepository = settingsRepository;
    }

    public EnrichmentPolicy resolve(String organizationId) {
        OrganizationSettings settings = organizationId == null
                ? null
                : settingsRepository.findById(organizationId).orElse(null);
        EnrichmentProperties.Policy defaults = properties.getPolicy();
        if (settings == null) {
            return fromDefaults(organizationId, defaults);
        }
        try {
            return merge(organizationId, defaults, settings);
        } catch (IllegalArgumentException ex) {
            log.warn("Invalid organization settings, using defaults organizationId={} message={}",
                    organizationId, ex.getMessage());
            return fromDefaults(organizationId, defaults);
        }
    }

    private EnrichmentPolicy fromDefaults(String organizationId, EnrichmentProperties.Policy defaults) {
        EnrichmentProperties.CircuitBreaker breaker = defaults.getCircuitBreaker();
        EnrichmentProperties.Retry retry = defaults.getRetry();
        return new EnrichmentPolicy(
                organizationId,
                defaults.getCatalogThreshold(),
                defaults.getCacheThreshold(),
                Duration.ofHours(defaults.getCacheTtlHours()),
                defaults.isCatalogEnabled(),
                defaults.isCacheEnabled(),
                defaults.getSupplierPriority(),
                Set.of(),
                defaults.getMinMatchConfidence(),
                new CircuitBreakerSettings(breaker.isEnabled(), breaker.getFailureThreshold(),
                        Duration.ofSeconds(breaker.getTimeoutSeconds()), breaker.getSuccessThreshold()),
                new RetryPolicy(retry.isEnabled(), retry.getMaxAttempts(),
                        Duration.ofMillis(retry.getInitialDelayMs()), retry.getBase(),
                        Duration.ofMillis(retry.getMaxDelayMs()), retry.isJitter()),
                ScoringWeights.from(defaults.getScoring()));
    }

    private EnrichmentPolicy merge(String organizationId,
                                   EnrichmentProperties.Policy defaults,
                                   OrganizationSettings settings) {
        EnrichmentProperties.CircuitBreaker breaker = defaults.getCircuitBreaker();
        EnrichmentProperties.Retry retry = defaults.getRetry();
        List<String> priority = settings.getSupplierPriority() == null
                ? defaults.getSupplierPriority()
                : splitList(settings.getSupplierPriority());
        Set<String> disabled = settings.getDisabledSuppliers() == null
                ? Set.of()
                : Set.copyOf(splitList(settings.getDisabledSuppliers()));
        return new EnrichmentPolicy(
                organizationId,
                orDefault(settings.getCatalogThreshold(), defaults.getCatalogThreshold()),
                orDefault(settings.getCacheThreshold(), defaults.getCacheThreshold()),
                Duration.ofHours(orDefault(settings.getCacheTtlHours(), defaults.getCacheTtlHours())),
                orDefault(settings.getCatalogEnabled(), defaults.isCatalogEnabled()),
                orDefault(settings.getCacheEnabled(), defaults.isCacheEnabled()),
                priority,
                disabled,
                defaults.getMinMatchConfidence(),
                new CircuitBreakerSettings(
                        orDefault(settings.getCircuitBreakerEnabled(), breaker.isEnabled()),
                        orDefault(settings.getCircuitBreakerFailureThreshold(), breaker.getFailureThreshold()),
                        Duration.ofSeconds(orDefault(settings.getCircuitBreakerTimeoutSeconds(), breaker.getTimeoutSeconds())),
                        orDefault(settings.getCircuitBreakerSuccessThreshold(), breaker.getSuccessThreshold())),
                new RetryPolicy(
                        orDefault(settings.getRetryEnabled(), retry.isEnabled()),
                        orDefault(settings.getRetryMaxAttempts(), retry.getMaxAttempts()),
                        Duration.ofMillis(orDefault(settings.getRetryInitialDelayMs(), retry.getInitialDelayMs())),
                        retry.getBase(),
                        Duration.ofMillis(orDefault(settings.getRetryMaxDelayMs(), retry.getMaxDelayMs())),
                        retry.isJitter()),
                ScoringWeights.from(defaults.getScoring()));
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }

    private static List<String> splitList(String csv) {
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(token -> !token.isEmpty())
                .toList();
    }
}
