package cns.core.enrichment.api;

import cns.core.enrichment.resilience.CircuitBreakerRegistry;
import cns.core.enrichment.resilience.CircuitBreakerSnapshot;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/suppliers")
public class SupplierController {

    private final CircuitBreakerRegistry breakers;

    public SupplierController(CircuitBreakerRegistry breakers) {
        this.breakers = breakers;
    }

    @GetMapping("/circuit-breakers")
    public ResponseEntity<List<CircuitBreakerSnapshot>> circuitBreakers() {
        return ResponseEntity.ok(breakers.snapshots());
    }
}
