package edu.eci.arsw.facilitator.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TimerService} sobre un {@link ScheduledExecutorService}.
 */
public class ScheduledTimerService implements TimerService {
    private static final Logger log = LoggerFactory.getLogger(ScheduledTimerService.class);

    private final ScheduledExecutorService executor;

    public ScheduledTimerService(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    @Override
    public Timer schedule(Duration delay, Runnable task) {
        ScheduledFuture<?> future = executor.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Timer task failed", e);
            }
        }, Math.max(0, delay.toNanos()), TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }
}
