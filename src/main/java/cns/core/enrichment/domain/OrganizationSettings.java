package cns.core.enrichment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "organization_enrichment_settings")
public class OrganizationSettings {

    @Id
    @Column(name = "organization_id", length = 64)
    private String organizationId;

    @Column(name = "catalog_threshold")
    private Double catalogThreshold;

    @Column(name = "cache_threshold")
    private Double cacheThreshold;

    @Column(name = "cache_ttl_hours")
    private Long cacheTtlHours;

    @Column(name = "catalog_enabled")
    private Boolean catalogEnabled;

    @Column(name = "cache_enabled")
    private Boolean cacheEnabled;

    @Column(name = "supplier_priority", length = 1024)
    private String supplierPriority;

    @Column(name = "disabled_suppliers", length = 1024)
    private String disabledSuppliers;

    @Column(name = "circuit_breaker_enabled")
    private Boolean circuitBreakerEnabled;

    @Column(name = "circuit_breaker_failure_threshold")
    private Integer circuitBreakerFailureThreshold;

    @Column(name = "circuit_breaker_timeout_seconds")
    private Long circuitBreakerTimeoutSeconds;

    @Column(name = "circuit_breaker_success_threshold")
    private Integer circuitBreakerSuccessThreshold;

    @Column(name = "retry_enabled")
    private Boolean retryEnabled;

    @Column(name = "retry_max_attempts")
    private Integer retryMaxAttempts;

    @Column(name = "retry_initial_delay_ms")
    private Long retryInitialDelayMs;

    @Column(name = "retry_max_delay_ms")
    private Long retryMaxDelayMs;

    protected OrganizationSettings() {
    }

    public OrganizationSettings(String organizationId) {
        this.organizationId = organizationId;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public Double getCatalogThreshold() {
        return catalogThreshold;
    }

    public void setCatalogThreshold(Double catalogThreshold) {
        this.catalogThreshold = catalogThreshold;
    }

    public Double getCacheThreshold() {
        return cacheThreshold;
    }

    public void setCacheThreshold(Double cacheThreshold) {
        this.cacheThreshold = cacheThreshold;
    }

    public Long getCacheTtlHours() {
        return cacheTtlHours;
    }

    public void setCacheTtlHours(Long cacheTtlHours) {
        this.cacheTtlHours = cacheTtlHours;
    }

    public Boolean getCatalogEnabled() {
        return catalogEnabled;
    }

    public void setCatalogEnabled(Boolean catalogEnabled) {
        this.catalogEnabled = catalogEnabled;
    }

    public Boolean getCacheEnabled() {
        return cacheEnabled;
    }

    public void setCacheEnabled(Boolean cacheEnabled) {
        this.cacheEnabled = cacheEnabled;
    }

    public String getSupplierPriority() {
        return supplierPriority;
    }

    public void setSupplierPriority(String supplierPriority) {
        this.supplierPriority = supplierPriority;
    }

    public String getDisabledSuppliers() {
        return disabledSuppliers;
    }

    public void setDisabledSuppliers(String disabledSuppliers) {
        this.disabledSuppliers = disabledSuppliers;
    }

    public Boolean getCircuitBreakerEnabled() {
        return circuitBreakerEnabled;
    }

    public void setCircuitBreakerEnabled(Boolean circuitBreakerEnabled) {
        this.circuitBreakerEnabled = circuitBreakerEnabled;
    }

    public Integer getCircuitBreakerFailureThreshold() {
        return circuitBreakerFailureThreshold;
    }

    public void setCircuitBreakerFailureThreshold(Integer circuitBreakerFailureThreshold) {
        this.circuitBreakerFailureThreshold = circuitBreakerFailureThreshold;
    }

    public Long getCircuitBreakerTimeoutSeconds() {
        return circuitBreakerTimeoutSeconds;
    }

    public void setCircuitBreakerTimeoutSeconds(Long circuitBreakerTimeoutSeconds) {
        this.circuitBreakerTimeoutSeconds = circuitBreakerTimeoutSeconds;
    }

    public Integer getCircuitBreakerSuccessThreshold() {
        return circuitBreakerSuccessThreshold;
    }

    public void setCircuitBreakerSuccessThreshold(Integer circuitBreakerSuccessThreshold) {
        this.circuitBreakerSuccessThreshold = circuitBreakerSuccessThreshold;
    }

    public Boolean getRetryEnabled() {
        return retryEnabled;
    }

    public void setRetryEnabled(Boolean retryEnabled) {
        this.retryEnabled = retryEnabled;
    }

    public Integer getRetryMaxAttempts() {
        return retryMaxAttempts;
    }

    public void setRetryMaxAttempts(Integer retryMaxAttempts) {
        this.retryMaxAttempts = retryMaxAttempts;
    }

    public Long getRetryInitialDelayMs() {
        return retryInitialDelayMs;
    }

    public void setRetryInitialDelayMs(Long retryInitialDelayMs) {
        this.retryInitialDelayMs = retryInitialDelayMs;
    }

    public Long getRetryMaxDelayMs() {
        return retryMaxDelayMs;
    }

    public void setRetryMaxDelayMs(Long retryMaxDelayMs) {
        this.retryMaxDelayMs = retryMaxDelayMs;
    }
}
