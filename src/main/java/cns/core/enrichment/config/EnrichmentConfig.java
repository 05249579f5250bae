package cns.core.enrichment.config;

import cns.core.enrichment.supplier.HttpSupplierAdapter;
import cns.core.enrichment.supplier.SupplierAdapter;
import cns.core.enrichment.supplier.SupplierRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Semaphore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

@Configuration
@EnableConfigurationProperties(EnrichmentProperties.class)
public class EnrichmentConfig {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentConfig.class);

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "enrichmentExecutor")
    ThreadPoolTaskExecutor enrichmentExecutor(EnrichmentProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getMaxConcurrentJobs());
        executor.setMaxPoolSize(properties.getMaxConcurrentJobs());
        executor.setQueueCapacity(Math.max(properties.getBatchSize(), properties.getMaxConcurrentJobs()) * 2);
        executor.setThreadNamePrefix("enrichment-");
        executor.initialize();
        return executor;
    }

    @Bean
    Semaphore enrichmentSemaphore(EnrichmentProperties properties) {
        return new Semaphore(properties.getMaxConcurrentJobs());
    }

    @Bean
    ConnectionProvider supplierConnectionProvider(EnrichmentProperties properties) {
        return ConnectionProvider.builder("supplier-pool")
                .maxConnections(properties.getHttpMaxConnections())
                .pendingAcquireMaxCount(properties.getHttpMaxConnections() * 2)
                .build();
    }

    @Bean
    SupplierRegistry supplierRegistry(EnrichmentProperties properties,
                                      ConnectionProvider supplierConnectionProvider,
                                      ObjectMapper objectMapper,
                                      ObjectProvider<MeterRegistry> meterRegistryProvider) {
        HttpClient httpClient = HttpClient.create(supplierConnectionProvider)
                .responseTimeout(Duration.ofMillis(properties.getHttpTimeoutMs()));
        ReactorClientHttpConnector connector = new ReactorClientHttpConnector(httpClient);
        MeterRegistry registry = meterRegistryProvider.getIfAvailable();
        List<SupplierAdapter> adapters = new ArrayList<>();
        for (EnrichmentProperties.SupplierEndpoint endpoint : properties.getSuppliers()) {
            WebClient webClient = WebClient.builder()
                    .baseUrl(endpoint.getBaseUrl())
                    .clientConnector(connector)
                    .build();
            adapters.add(new HttpSupplierAdapter(endpoint.getId(), webClient, endpoint.getLookupPath(),
                    endpoint.getMaxRequestsPerHour(), objectMapper, registry));
        }
        log.info("Supplier adapters registered count={} ids={}", adapters.size(),
                adapters.stream().map(SupplierAdapter::id).toList());
        return new SupplierRegistry(adapters);
    }
}
