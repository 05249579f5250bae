package cns.core.enrichment.storage;

import cns.core.enrichment.config.EnrichmentProperties;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "cns.enrichment", name = "cache-store", havingValue = "redis")
public class RedisCacheStore implements CacheStore {

    static final String COMPRESSED_PREFIX = "gz:";

    private final StringRedisTemplate redis;
    private final int compressionThresholdBytes;

    public RedisCacheStore(StringRedisTemplate redis, EnrichmentProperties properties) {
        this(redis, properties.getCacheCompressionThresholdBytes());
    }

    RedisCacheStore(StringRedisTemplate redis, int compressionThresholdBytes) {
        this.redis = redis;
        this.compressionThresholdBytes = compressionThresholdBytes;
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        redis.opsForValue().set(key, encode(value), ttl);
    }

    @Override
    public Optional<String> get(String key) {
        String stored = redis.opsForValue().get(key);
        return Optional.ofNullable(stored).map(this::decode);
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(redis.delete(key));
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(redis.hasKey(key));
    }

    @Override
    public Set<String> existing(Collection<String> keys) {
        if (keys.isEmpty()) {
            return Set.of();
        }
        List<String> ordered = List.copyOf(keys);
        List<String> values = redis.opsForValue().multiGet(ordered);
        Set<String> present = new HashSet<>();
        if (values == null) {
            return present;
        }
        for (int i = 0; i < ordered.size(); i++) {
            if (values.get(i) != null) {
                present.add(ordered.get(i));
            }
        }
        return present;
    }

    String encode(String value) {
        byte[] raw = value.getBytes(StandardCharsets.UTF_8);
        if (raw.length <= compressionThresholdBytes) {
            return value;
        }
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(buffer)) {
            gzip.write(raw);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to compress cache value", ex);
        }
        return COMPRESSED_PREFIX + Base64.getEncoder().encodeToString(buffer.toByteArray());
    }

    String decode(String stored) {
        if (!stored.startsWith(COMPRESSED_PREFIX)) {
            return stored;
        }
        byte[] compressed = Base64.getDecoder().decode(stored.substring(COMPRESSED_PREFIX.length()));
        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return new String(gzip.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to decompress cache value", ex);
        }
    }
}
