package cns.core.enrichment.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "cns.enrichment")
public class EnrichmentProperties {

    private int batchSize = 50;
    private int maxConcurrentJobs = 5;
    private long schedulerFixedDelayMs = 5000;
    private long stuckThresholdMs = 120000;
    private int retryAttempts = 3;
    private long retryDelaySeconds = 30;
    private long httpTimeoutMs = 5000;
    private int httpMaxConnections = 50;
    private long lockLeaseMs = 30000;
    private int lockPollAttempts = 5;
    private long lockPollIntervalMs = 100;
    private String lockStore = "jpa";
    private String cacheStore = "memory";
    private String cacheKeyPrefix = "cns:component:";
    private int cacheCompressionThresholdBytes = 4096;
    private long expirySweepDelayMs = 60000;
    private List<SupplierEndpoint> suppliers = new ArrayList<>();
    private Map<String, String> manufacturerAliases = new LinkedHashMap<>(Map.of(
            "TI", "TEXAS INSTRUMENTS",
            "ADI", "ANALOG DEVICES",
            "ST", "STMICROELECTRONICS",
            "ON", "ONSEMI",
            "ON SEMICONDUCTOR", "ONSEMI",
            "NXP SEMICONDUCTORS", "NXP",
            "MICROCHIP TECHNOLOGY", "MICROCHIP",
            "INFINEON TECHNOLOGIES", "INFINEON"));
    private Policy policy = new Policy();

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxConcurrentJobs() {
        return maxConcurrentJobs;
    }

    public void setMaxConcurrentJobs(int maxConcurrentJobs) {
        this.maxConcurrentJobs = maxConcurrentJobs;
    }

    public long getSchedulerFixedDelayMs() {
        return schedulerFixedDelayMs;
    }

    public void setSchedulerFixedDelayMs(long schedulerFixedDelayMs) {
        this.schedulerFixedDelayMs = schedulerFixedDelayMs;
    }

    public long getStuckThresholdMs() {
        return stuckThresholdMs;
    }

    public void setStuckThresholdMs(long stuckThresholdMs) {
        this.stuckThresholdMs = stuckThresholdMs;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public void setRetryAttempts(int retryAttempts) {
        this.retryAttempts = retryAttempts;
    }

    public long getRetryDelaySeconds() {
        return retryDelaySeconds;
    }

    public void setRetryDelaySeconds(long retryDelaySeconds) {
        this.retryDelaySeconds = retryDelaySeconds;
    }

    public long getHttpTimeoutMs() {
        return httpTimeoutMs;
    }

    public void setHttpTimeoutMs(long httpTimeoutMs) {
        this.httpTimeoutMs = httpTimeoutMs;
    }

    public int getHttpMaxConnections() {
        return httpMaxConnections;
    }

    public void setHttpMaxConnections(int httpMaxConnections) {
        this.httpMaxConnections = httpMaxConnections;
    }

    public long getLockLeaseMs() {
        return lockLeaseMs;
    }

    public void setLockLeaseMs(long lockLeaseMs) {
        this.lockLeaseMs = lockLeaseMs;
    }

    public int getLockPollAttempts() {
        return lockPollAttempts;
    }

    public void setLockPollAttempts(int lockPollAttempts) {
        this.lockPollAttempts = lockPollAttempts;
    }

    public long getLockPollIntervalMs() {
        return lockPollIntervalMs;
    }

    public void setLockPollIntervalMs(long lockPollIntervalMs) {
        this.lockPollIntervalMs = lockPollIntervalMs;
    }

    public String getLockStore() {
        return lockStore;
    }

    public void setLockStore(String lockStore) {
        this.lockStore = lockStore;
    }

    public String getCacheStore() {
        return cacheStore;
    }

    public void setCacheStore(String cacheStore) {
        this.cacheStore = cacheStore;
    }

    public String getCacheKeyPrefix() {
        return cacheKeyPrefix;
    }

    public void setCacheKeyPrefix(String cacheKeyPrefix) {
        this.cacheKeyPrefix = cacheKeyPrefix;
    }

    public int getCacheCompressionThresholdBytes() {
        return cacheCompressionThresholdBytes;
    }

    public void setCacheCompressionThresholdBytes(int cacheCompressionThresholdBytes) {
        this.cacheCompressionThresholdBytes = cacheCompressionThresholdBytes;
    }

    public long getExpirySweepDelayMs() {
        return expirySweepDelayMs;
    }

    public void setExpirySweepDelayMs(long expirySweepDelayMs) {
        this.expirySweepDelayMs = expirySweepDelayMs;
    }

    public List<SupplierEndpoint> getSuppliers() {
        return suppliers;
    }

    public void setSuppliers(List<SupplierEndpoint> suppliers) {
        this.suppliers = suppliers;
    }

    public Map<String, String> getManufacturerAliases() {
        return manufacturerAliases;
    }

    public void setManufacturerAliases(Map<String, String> manufacturerAliases) {
        this.manufacturerAliases = manufacturerAliases;
    }

    public Policy getPolicy() {
        return policy;
    }

    public void setPolicy(Policy policy) {
        this.policy = policy;
    }

    public static class SupplierEndpoint {

        private String id;
        private String baseUrl;
        private String lookupPath = "/parts/lookup";
        private int maxRequestsPerHour = 1000;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getLookupPath() {
            return lookupPath;
        }

        public void setLookupPath(String lookupPath) {
            this.lookupPath = lookupPath;
        }

        public int getMaxRequestsPerHour() {
            return maxRequestsPerHour;
        }

        public void setMaxRequestsPerHour(int maxRequestsPerHour) {
            this.maxRequestsPerHour = maxRequestsPerHour;
        }
    }

    /**
     * Organization policy defaults. Individual organizations override these through
     * the {@code organization_enrichment_settings} table.
     */
    public static class Policy {

        private double catalogThreshold = 95.0;
        private double cacheThreshold = 80.0;
        private long cacheTtlHours = 72;
        private boolean catalogEnabled = true;
        private boolean cacheEnabled = true;
        private List<String> supplierPriority = new ArrayList<>();
        private double minMatchConfidence = 0.5;
        private CircuitBreaker circuitBreaker = new CircuitBreaker();
        private Retry retry = new Retry();
        private Scoring scoring = new Scoring();

        public double getCatalogThreshold() {
            return catalogThreshold;
        }

        public void setCatalogThreshold(double catalogThreshold) {
            this.catalogThreshold = catalogThreshold;
        }

        public double getCacheThreshold() {
            return cacheThreshold;
        }

        public void setCacheThreshold(double cacheThreshold) {
            this.cacheThreshold = cacheThreshold;
        }

        public long getCacheTtlHours() {
            return cacheTtlHours;
        }

        public void setCacheTtlHours(long cacheTtlHours) {
            this.cacheTtlHours = cacheTtlHours;
        }

        public boolean isCatalogEnabled() {
            return catalogEnabled;
        }

        public void setCatalogEnabled(boolean catalogEnabled) {
            this.catalogEnabled = catalogEnabled;
        }

        public boolean isCacheEnabled() {
            return cacheEnabled;
        }

        public void setCacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
        }

        public List<String> getSupplierPriority() {
            return supplierPriority;
        }

        public void setSupplierPriority(List<String> supplierPriority) {
            this.supplierPriority = supplierPriority;
        }

        public double getMinMatchConfidence() {
            return minMatchConfidence;
        }

        public void setMinMatchConfidence(double minMatchConfidence) {
            this.minMatchConfidence = minMatchConfidence;
        }

        public CircuitBreaker getCircuitBreaker() {
            return circuitBreaker;
        }

        public void setCircuitBreaker(CircuitBreaker circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
        }

        public Retry getRetry() {
            return retry;
        }

        public void setRetry(Retry retry) {
            this.retry = retry;
        }

        public Scoring getScoring() {
            return scoring;
        }

        public void setScoring(Scoring scoring) {
            this.scoring = scoring;
        }
    }

    public static class CircuitBreaker {

        private boolean enabled = true;
        private int failureThreshold = 5;
        private long timeoutSeconds = 60;
        private int successThreshold = 2;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public int getSuccessThreshold() {
            return successThreshold;
        }

        public void setSuccessThreshold(int successThreshold) {
            this.successThreshold = successThreshold;
        }
    }

    public static class Retry {

        private boolean enabled = true;
        private int maxAttempts = 3;
        private long initialDelayMs = 200;
        private double base = 2.0;
        private long maxDelayMs = 5000;
        private boolean jitter = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public double getBase() {
            return base;
        }

        public void setBase(double base) {
            this.base = base;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public boolean isJitter() {
            return jitter;
        }

        public void setJitter(boolean jitter) {
            this.jitter = jitter;
        }
    }

    public static class Scoring {

        private double completenessWeight = 0.5;
        private double confidenceWeight = 0.3;
        private double matchWeight = 0.2;
        private double requiredTierWeight = 0.50;
        private double highPriorityTierWeight = 0.35;
        private double recommendedTierWeight = 0.15;

        public double getCompletenessWeight() {
            return completenessWeight;
        }

        public void setCompletenessWeight(double completenessWeight) {
            this.completenessWeight = completenessWeight;
        }

        public double getConfidenceWeight() {
            return confidenceWeight;
        }

        public void setConfidenceWeight(double confidenceWeight) {
            this.confidenceWeight = confidenceWeight;
        }

        public double getMatchWeight() {
            return matchWeight;
        }

        public void setMatchWeight(double matchWeight) {
            this.matchWeight = matchWeight;
        }

        public double getRequiredTierWeight() {
            return requiredTierWeight;
        }

        public void setRequiredTierWeight(double requiredTierWeight) {
            this.requiredTierWeight = requiredTierWeight;
        }

        public double getHighPriorityTierWeight() {
            return highPriorityTierWeight;
        }

        public void setHighPriorityTierWeight(double highPriorityTierWeight) {
            this.highPriorityTierWeight = highPriorityTierWeight;
        }

        public double getRecommendedTierWeight() {
            return recommendedTierWeight;
        }

        public void setRecommendedTierWeight(double recommendedTierWeight) {
            this.recommendedTierWeight = recommendedTierWeight;
        }
    }
}
