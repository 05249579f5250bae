package cns.core.enrichment.supplier;

import cns.core.enrichment.exception.PermanentSupplierException;
import cns.core.enrichment.exception.SupplierException;
import cns.core.enrichment.exception.TransientSupplierException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

/**
 * Supplier reached over HTTP. Expects {@code GET <lookupPath>?mpn=&manufacturer=} to answer
 * with {@code {"found":..,"confidence":..,"mpn":..,"manufacturer":..,"fields":{..},"fieldConfidence":{..}}}.
 */
public class HttpSupplierAdapter implements SupplierAdapter {

    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Double>> CONFIDENCES = new TypeReference<>() {
    };

    private final String id;
    private final WebClient webClient;
    private final String lookupPath;
    private final int maxRequestsPerHour;
    private final ObjectMapper objectMapper;
    private final Timer foundTimer;
    private final Timer notFoundTimer;
    private final Timer errorTimer;

    public HttpSupplierAdapter(String id,
                               WebClient webClient,
                               String lookupPath,
                               int maxRequestsPerHour,
                               ObjectMapper objectMapper,
                               MeterRegistry registry) {
        this.id = id;
        this.webClient = webClient;
        this.lookupPath = lookupPath;
        this.maxRequestsPerHour = maxRequestsPerHour;
        this.objectMapper = objectMapper;
        if (registry == null) {
            foundTimer = null;
            notFoundTimer = null;
            errorTimer = null;
        } else {
            foundTimer = timer(registry, "found");
            notFoundTimer = timer(registry, "not_found");
            errorTimer = timer(registry, "error");
        }
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public int maxRequestsPerHour() {
        return maxRequestsPerHour;
    }

    @Override
    public SupplierLookup lookup(String mpn, String manufacturer) {
        long startedNs = System.nanoTime();
        try {
            Optional<String> body = webClient.get()
                    .uri(builder -> builder.path(lookupPath)
                            .queryParam("mpn", mpn)
                            .queryParamIfPresent("manufacturer",
                                    Optional.ofNullable(manufacturer).filter(value -> !value.isBlank()))
                            .build())
                    .accept(MediaType.APPLICATION_JSON)
                    .<Optional<String>>exchangeToMono(response -> {
                        HttpStatusCode status = response.statusCode();
                        if (status.value() == HttpStatus.NOT_FOUND.value()) {
                            return response.releaseBody().then(Mono.just(Optional.<String>empty()));
                        }
                        if (status.isError()) {
                            return response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(text -> Mono.<Optional<String>>error(toException(status, text)));
                        }
                        return response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(Optional::of);
                    })
                    .block();
            SupplierLookup lookup = body == null || body.isEmpty()
                    ? SupplierLookup.notFound(id, null)
                    : parse(body.get());
            recordTimer(lookup.found() ? foundTimer : notFoundTimer, startedNs);
            return lookup;
        } catch (SupplierException ex) {
            recordTimer(errorTimer, startedNs);
            throw ex;
        } catch (WebClientException ex) {
            recordTimer(errorTimer, startedNs);
            throw new TransientSupplierException(id, "Supplier unreachable: " + ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            recordTimer(errorTimer, startedNs);
            throw new TransientSupplierException(id, "Supplier call failed: " + ex.getMessage(), ex);
        }
    }

    SupplierLookup parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new PermanentSupplierException(id, "Malformed supplier response: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new PermanentSupplierException(id, "Malformed supplier response: expected an object", (Integer) null);
        }
        if (!root.path("found").asBoolean(true)) {
            return SupplierLookup.notFound(id, body);
        }
        JsonNode fieldsNode = root.path("fields");
        if (!fieldsNode.isMissingNode() && !fieldsNode.isObject()) {
            throw new PermanentSupplierException(id, "Malformed supplier response: fields is not an object", (Integer) null);
        }
        Map<String, Object> fields = fieldsNode.isObject()
                ? objectMapper.convertValue(fieldsNode, FIELDS)
                : new LinkedHashMap<>();
        Map<String, Double> fieldConfidence;
        try {
            JsonNode confidenceNode = root.path("fieldConfidence");
            fieldConfidence = confidenceNode.isObject()
                    ? objectMapper.convertValue(confidenceNode, CONFIDENCES)
                    : Map.of();
        } catch (IllegalArgumentException ex) {
            throw new PermanentSupplierException(id, "Malformed supplier response: bad fieldConfidence", ex);
        }
        String returnedMpn = text(root, "mpn", fields.get("mpn"));
        String returnedManufacturer = text(root, "manufacturer", fields.get("manufacturer"));
        double confidence = root.path("confidence").asDouble(1.0);
        return new SupplierLookup(id, true, returnedMpn, returnedManufacturer, confidence,
                fields, fieldConfidence, body);
    }

    private SupplierException toException(HttpStatusCode status, String body) {
        int statusCode = status.value();
        String message = "Supplier " + id + " returned " + statusCode + " " + body;
        if (status.is5xxServerError() || statusCode == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return new TransientSupplierException(id, message, statusCode);
        }
        return new PermanentSupplierException(id, message, statusCode);
    }

    private static String text(JsonNode root, String name, Object fallback) {
        JsonNode node = root.get(name);
        if (node != null && node.isTextual()) {
            return node.asText();
        }
        return fallback == null ? null : fallback.toString();
    }

    private Timer timer(MeterRegistry registry, String result) {
        return Timer.builder("cns.supplier.lookup")
                .tag("supplier", id)
                .tag("result", result)
                .register(registry);
    }

    private void recordTimer(Timer timer, long startedNs) {
        if (timer == null) {
            return;
        }
        long duration = System.nanoTime() - startedNs;
        if (duration > 0L) {
            timer.record(duration, TimeUnit.NANOSECONDS);
        }
    }
}
