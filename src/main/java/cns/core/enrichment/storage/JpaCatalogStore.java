package cns.core.enrichment.storage;

import cns.core.enrichment.domain.CatalogRecord;
import cns.core.enrichment.repository.CatalogRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

@Component
public class JpaCatalogStore implements CatalogStore {

    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {
    };
    private static final Set<String> SPECIFICATION_FIELDS = Set.of(
            "parameters", "package", "packaging", "rohs_compliant", "reach_compliant",
            "halogen_free", "aec_qualified");
    private static final Set<String> PRICING_FIELDS = Set.of(
            "price_breaks", "unit_price", "stock_quantity", "minimum_order_quantity", "lead_time_days");
    private static final Set<String> COLUMN_FIELDS = Set.of(
            "description", "category", "lifecycle_status", "datasheet_url");

    private final CatalogRecordRepository repository;
    private final ObjectMapper objectMapper;

    public JpaCatalogStore(CatalogRecordRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    public void upsert(RecordKey key, Map<String, Object> fields, double qualityScore, String source,
                       String fingerprint) {
        CatalogRecord record = repository.findByRecordKey(key.value())
                .orElseGet(() -> new CatalogRecord(UUID.randomUUID(), key.value(), key.mpn(), key.manufacturer()));
        Map<String, Object> specifications = new LinkedHashMap<>();
        Map<String, Object> pricing = new LinkedHashMap<>();
        Map<String, Object> metadata = new LinkedHashMap<>();
        fields.forEach((name, value) -> {
            if (SPECIFICATION_FIELDS.contains(name)) {
                specifications.put(name, value);
            } else if (PRICING_FIELDS.contains(name)) {
                pricing.put(name, value);
            } else if (!COLUMN_FIELDS.contains(name)) {
                metadata.put(name, value);
            }
        });
        record.setDescription(text(fields.get("description")));
        record.setCategory(text(fields.get("category")));
        record.setLifecycleStatus(text(fields.get("lifecycle_status")));
        record.setDatasheetUrl(text(fields.get("datasheet_url")));
        record.setSpecificationsJson(toJson(specifications));
        record.setPricingJson(toJson(pricing));
        record.setMetadataJson(toJson(metadata));
        record.setQualityScore(qualityScore);
        record.setEnrichmentSource(source);
        record.setPayloadFingerprint(fingerprint);
        repository.save(record);
    }

    @Override
    public Optional<StoredComponent> find(String recordKey) {
        return repository.findByRecordKey(recordKey).map(record -> {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.putAll(fromJson(record.getMetadataJson()));
            fields.putAll(fromJson(record.getSpecificationsJson()));
            fields.putAll(fromJson(record.getPricingJson()));
            putIfPresent(fields, "description", record.getDescription());
            putIfPresent(fields, "category", record.getCategory());
            putIfPresent(fields, "lifecycle_status", record.getLifecycleStatus());
            putIfPresent(fields, "datasheet_url", record.getDatasheetUrl());
            return new StoredComponent(record.getRecordKey(), record.getQualityScore(), fields,
                    record.getPayloadFingerprint());
        });
    }

    @Override
    public boolean exists(String recordKey) {
        return repository.findByRecordKey(recordKey).isPresent();
    }

    @Override
    public Set<String> existingKeys(Collection<String> recordKeys) {
        if (recordKeys.isEmpty()) {
            return Set.of();
        }
        return new HashSet<>(repository.findExistingRecordKeys(recordKeys));
    }

    @Override
    public List<String> recordKeysAfter(String after, int limit) {
        return repository.findRecordKeysAfter(after, PageRequest.of(0, limit));
    }

    private String toJson(Map<String, Object> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize catalog payload", ex);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Stored catalog payload is not valid JSON", ex);
        }
    }

    private static void putIfPresent(Map<String, Object> fields, String name, String value) {
        if (value != null) {
            fields.put(name, value);
        }
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
