package cns.core.enrichment.api;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import cns.core.enrichment.exception.PromotionRejectedException;
import cns.core.enrichment.storage.CacheExpirySweeper;
import cns.core.enrichment.storage.PlacementOutcome;
import cns.core.enrichment.storage.PlacementResult;
import cns.core.enrichment.storage.RecordKey;
import cns.core.enrichment.storage.StorageRouter;
import cns.core.enrichment.storage.Tier;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class StorageControllerTest {

    private final StorageRouter storageRouter = mock(StorageRouter.class);
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new StorageController(storageRouter, mock(CacheExpirySweeper.class)))
                .setControllerAdvice(new GlobalErrorHandler())
                .build();
    }

    @Test
    void promoteReturnsPlacement() throws Exception {
        when(storageRouter.promote(RecordKey.of("LM358", "TI"), "alice"))
                .thenReturn(new PlacementResult(Tier.CATALOG, PlacementOutcome.PROMOTED, "manual promotion by alice"));

        mvc.perform(post("/api/storage/promote")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mpn\":\"LM358\",\"manufacturer\":\"TI\",\"operator\":\"alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tier").value("CATALOG"))
                .andExpect(jsonPath("$.outcome").value("PROMOTED"));
    }

    @Test
    void rejectedPromotionIsConflict() throws Exception {
        when(storageRouter.promote(RecordKey.of("LM358", "TI"), "alice"))
                .thenThrow(new PromotionRejectedException("Required fields missing"));

        mvc.perform(post("/api/storage/promote")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mpn\":\"LM358\",\"manufacturer\":\"TI\",\"operator\":\"alice\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("conflict"))
                .andExpect(jsonPath("$.message").value("Required fields missing"));
    }

    @Test
    void promoteWithoutOperatorIsBadRequest() throws Exception {
        mvc.perform(post("/api/storage/promote")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mpn\":\"LM358\"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(storageRouter);
    }

    @Test
    void untrackedRecordIsNotFound() throws Exception {
        when(storageRouter.tracking(RecordKey.of("NE555", null))).thenReturn(Optional.empty());

        mvc.perform(get("/api/storage/tracking").param("mpn", "NE555"))
                .andExpect(status().isNotFound());
    }

    @Test
    void missingParameterIsBadRequest() throws Exception {
        mvc.perform(get("/api/storage/tracking"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("bad_request"));
    }
}
