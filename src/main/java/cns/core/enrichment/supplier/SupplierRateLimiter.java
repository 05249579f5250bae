package cns.core.enrichment.supplier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

@Component
public class SupplierRateLimiter {

    private static final Duration WINDOW = Duration.ofHours(1);
    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public SupplierRateLimiter(Clock clock) {
        this.clock = clock;
    }

    public boolean tryAcquire(String supplierId, int maxRequestsPerHour) {
        if (maxRequestsPerHour == Integer.MAX_VALUE) {
            return true;
        }
        Instant now = clock.instant();
        Window window = windows.compute(supplierId, (key, current) -> {
            if (current == null || !now.isBefore(current.start.plus(WINDOW))) {
                return new Window(now);
            }
            return current;
        });
        synchronized (window) {
            if (window.used >= maxRequestsPerHour) {
                return false;
            }
            window.used++;
            return true;
        }
    }

    public int remaining(String supplierId, int maxRequestsPerHour) {
        Window window = windows.get(supplierId);
        if (window == null || !clock.instant().isBefore(window.start.plus(WINDOW))) {
            return maxRequestsPerHour;
        }
        synchronized (window) {
            return Math.max(0, maxRequestsPerHour - window.used);
        }
    }

    private static final class Window {
        private final Instant start;
        private int used;

        private Window(Instant start) {
            this.start = start;
        }
    }
}
