package dev.buyergroup.provider;

import dev.buyergroup.config.ProviderConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Spaces provider calls at least {@code 1 / requestsPerSecond} apart across all workers.
 * Each caller reserves the next free slot and waits for it without blocking a thread.
 */
@Component
public class RequestPacer {

    private final long intervalNanos;
    private final AtomicLong nextSlot = new AtomicLong(Long.MIN_VALUE);

    @Autowired
    public RequestPacer(ProviderConfig config) {
        this(config.getRequestsPerSecond());
    }

    public RequestPacer(double requestsPerSecond) {
        this.intervalNanos = requestsPerSecond <= 0 ? 0 : (long) (1_000_000_000L / requestsPerSecond);
    }

    /**
     * Completes once the caller's slot has arrived.
     */
    public Mono<Void> acquire() {
        if (intervalNanos == 0) {
            return Mono.empty();
        }
        return Mono.defer(() -> {
            long now = System.nanoTime();
            long wait = reserve(now) - now;
            return wait <= 0 ? Mono.<Void>empty() : Mono.delay(Duration.ofNanos(wait)).then();
        });
    }

    /**
     * Reserve the next slot at or after {@code now}.
     *
     * @return the reserved slot, in {@link System#nanoTime()} units
     */
    long reserve(long now) {
        while (true) {
            long next = nextSlot.get();
            long slot = Math.max(next, now);
            if (nextSlot.compareAndSet(next, slot + intervalNanos)) {
                return slot;
            }
        }
    }

    long getIntervalNanos() {
        return intervalNanos;
    }
}
