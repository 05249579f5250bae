package cns.core.enrichment.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import cns.core.enrichment.audit.AuditRecorder;
import cns.core.enrichment.domain.AuditOutcome;
import cns.core.enrichment.domain.AuditRun;
import cns.core.enrichment.domain.ReviewStatus;
import cns.core.enrichment.exception.ResourceNotFoundException;
import cns.core.enrichment.resilience.CircuitBreakerRegistry;
import cns.core.enrichment.resilience.CircuitBreakerSettings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class AuditControllerTest {

    private static final Instant STARTED = Instant.parse("2024-05-01T10:00:00Z");

    private final AuditRecorder auditRecorder = mock(AuditRecorder.class);
    private final CircuitBreakerRegistry breakers =
            new CircuitBreakerRegistry(Clock.fixed(STARTED, ZoneOffset.UTC));
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new AuditController(auditRecorder), new SupplierController(breakers))
                .setControllerAdvice(new GlobalErrorHandler())
                .build();
    }

    @Test
    void listsRunsOfRequest() throws Exception {
        UUID requestId = UUID.randomUUID();
        when(auditRecorder.runsForRequest(requestId)).thenReturn(List.of(run(requestId)));

        mvc.perform(get("/api/audit/runs").param("requestId", requestId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].outcome").value("PLACED_CACHE"))
                .andExpect(jsonPath("$[0].recordKey").value("LM358|TI"));
    }

    @Test
    void reviewRequiresStatus() throws Exception {
        mvc.perform(post("/api/audit/runs/{id}/review", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reviewer\":\"alice\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("status is required"));
        verifyNoInteractions(auditRecorder);
    }

    @Test
    void reviewOfUnknownRunIsNotFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(auditRecorder.review(any(), any(), any(), any()))
                .thenThrow(new ResourceNotFoundException("Audit run not found: " + id));

        mvc.perform(post("/api/audit/runs/{id}/review", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"APPROVED\",\"reviewer\":\"alice\"}"))
                .andExpect(status().isNotFound());
        verify(auditRecorder).review(id, ReviewStatus.APPROVED, "alice", null);
    }

    @Test
    void invalidRunIdIsBadRequest() throws Exception {
        mvc.perform(get("/api/audit/runs/{id}/comparisons", "not-a-uuid"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void exposesCircuitBreakerState() throws Exception {
        CircuitBreakerSettings settings = new CircuitBreakerSettings(true, 1, Duration.ofSeconds(60), 1);
        breakers.onFailure("mouser", settings);
        breakers.onSuccess("digikey", settings);

        mvc.perform(get("/api/suppliers/circuit-breakers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].supplierId").value("digikey"))
                .andExpect(jsonPath("$[0].state").value("CLOSED"))
                .andExpect(jsonPath("$[1].supplierId").value("mouser"))
                .andExpect(jsonPath("$[1].state").value("OPEN"));
    }

    private static AuditRun run(UUID requestId) {
        return new AuditRun(UUID.randomUUID(), requestId, null, "org-1", "LM358|TI", "LM358", "TI", "mouser",
                AuditOutcome.PLACED_CACHE, 88.5, 1.0, "cache", false, STARTED, STARTED.plusMillis(420), null, "[]");
    }
}
