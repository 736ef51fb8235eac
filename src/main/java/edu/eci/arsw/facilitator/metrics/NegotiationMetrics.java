package edu.eci.arsw.facilitator.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;

/**
 * Métricas de establecimiento de enlaces entre pares: tiempo hasta un camino
 * (directo o retransmitido) y proporción de enlaces directos en los últimos
 * cinco minutos.
 */
@Service
public class NegotiationMetrics {

    private static final long WINDOW_MS = 5 * 60_000L;

    private final Clock clock;
    private final Timer setupTimer;
    private final Counter directCounter;
    private final Counter relayedCounter;
    private final Counter failCounter;

    private final ConcurrentLinkedQueue<Sample> samples = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<Long> directs = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<Long> relays = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<Long> failures = new ConcurrentLinkedQueue<>();

    record Sample(long ts, long setupMs) {
    }

    public NegotiationMetrics(MeterRegistry registry, Clock clock) {
        this.clock = clock;
        this.setupTimer = Timer.builder("facilitator.link.setup.ms")
                .publishPercentiles(0.95, 0.99)
                .publishPercentileHistogram(true)
                .serviceLevelObjectives(
                        Duration.ofMillis(250),
                        Duration.ofMillis(500),
                        Duration.ofSeconds(1),
                        Duration.ofSeconds(2),
                        Duration.ofSeconds(5))
                .register(registry);

        this.directCounter = Counter.builder("facilitator.link.direct").register(registry);
        this.relayedCounter = Counter.builder("facilitator.link.relayed").register(registry);
        this.failCounter = Counter.builder("facilitator.link.failed").register(registry);
    }

    /**
     * Registra un enlace que quedó directo.
     *
     * @param setup tiempo desde el inicio de la negociación
     */
    public void recordDirect(Duration setup) {
        long now = clock.millis();
        record(setup, now);
        directs.add(now);
        directCounter.increment();
    }

    /**
     * Registra un enlace que terminó retransmitido.
     *
     * @param setup tiempo desde el inicio de la negociación
     */
    public void recordRelayed(Duration setup) {
        long now = clock.millis();
        record(setup, now);
        relays.add(now);
        relayedCounter.increment();
    }

    public void recordFailure() {
        failures.add(clock.millis());
        evictOld();
        failCounter.increment();
    }

    /**
     * Instantánea de la ventana actual.
     *
     * @return percentiles del tiempo de establecimiento y proporción de directos
     */
    public Snapshot snapshot() {
        evictOld();
        List<Long> window = samples.stream().map(Sample::setupMs).sorted().toList();
        double p95 = percentile(window, 0.95);
        double p99 = percentile(window, 0.99);
        long d = directs.size();
        long r = relays.size();
        long f = failures.size();
        double directRate = (d + r + f) == 0 ? 0.0 : (double) d / (double) (d + r + f);
        return new Snapshot((long) p95, (long) p99, directRate, d, r, f, window.size());
    }

    private void record(Duration setup, long now) {
        long ms = Math.max(0, setup.toMillis());
        setupTimer.record(ms, TimeUnit.MILLISECONDS);
        samples.add(new Sample(now, ms));
        evictOld();
    }

    private void evictOld() {
        long now = clock.millis();
        while (!samples.isEmpty() && now - samples.peek().ts() > WINDOW_MS)
            samples.poll();
        evict(directs, now);
        evict(relays, now);
        evict(failures, now);
    }

    private static void evict(ConcurrentLinkedQueue<Long> queue, long now) {
        while (!queue.isEmpty() && now - queue.peek() > WINDOW_MS)
            queue.poll();
    }

    private static double percentile(List<Long> sorted, double q) {
        if (sorted.isEmpty())
            return 0;
        int idx = (int) Math.ceil(q * sorted.size()) - 1;
        idx = Math.max(0, Math.min(idx, sorted.size() - 1));
        return sorted.get(idx);
    }

    /**
     * Instantánea de las métricas de negociación.
     */
    public record Snapshot(long p95ms, long p99ms, double directRate,
                           long direct, long relayed, long failed, int samples) {
    }
}
