package fr.lapetina.microbatch.worker;

import fr.lapetina.microbatch.domain.model.WorkerHealth;
import fr.lapetina.microbatch.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background supervisor for the worker pool.
 *
 * Periodically inspects each worker: a dead thread is marked DOWN and
 * restarted (up to a restart limit), a stale heartbeat marks the worker
 * DEGRADED, a fresh heartbeat marks it UP.
 */
public final class WorkerSupervisor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerSupervisor.class);

    private final WorkerPool pool;
    private final MetricsRegistry metrics;
    private final ScheduledExecutorService scheduler;
    private final Duration checkInterval;
    private final Duration heartbeatTimeout;
    private final int maxRestarts;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Set<Integer> exhausted = ConcurrentHashMap.newKeySet();

    public WorkerSupervisor(
            WorkerPool pool,
            MetricsRegistry metrics,
            Duration checkInterval,
            Duration heartbeatTimeout,
            int maxRestarts
    ) {
        this.pool = pool;
        this.metrics = metrics;
        this.checkInterval = checkInterval;
        this.heartbeatTimeout = heartbeatTimeout;
        this.maxRestarts = maxRestarts;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "worker-supervisor");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic checks.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::checkAllWorkers,
                    checkInterval.toMillis(),
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Worker supervisor started: interval={}, heartbeatTimeout={}, maxRestarts={}",
                    checkInterval, heartbeatTimeout, maxRestarts);
        }
    }

    /**
     * Inspects every worker once.
     */
    public void checkAllWorkers() {
        if (!running.get() || !pool.isRunning()) {
            return;
        }
        for (WorkerHandle handle : pool.getWorkers()) {
            try {
                checkWorker(handle);
            } catch (Exception e) {
                // Keep the schedule alive; a thrown exception would cancel it
                log.error("Worker check failed: workerId={}, error={}", handle.getId(), e.getMessage(), e);
            }
        }
    }

    void checkWorker(WorkerHandle handle) {
        WorkerHealth current = handle.getHealth();
        if (current == WorkerHealth.STOPPED) {
            return;
        }

        if (!handle.isAlive()) {
            setWorkerHealth(handle, WorkerHealth.DOWN);
            if (handle.getRestarts() < maxRestarts) {
                if (pool.restart(handle)) {
                    metrics.incrementWorkerRestarts(handle.getId());
                }
            } else {
                if (exhausted.add(handle.getId())) {
                    log.error("Worker restart limit reached, capacity reduced: workerId={}, restarts={}, liveWorkers={}/{}",
                            handle.getId(), handle.getRestarts(), pool.getLiveWorkerCount(), pool.getWorkerCount());
                }
                // Requests routed here before the worker went DOWN would otherwise wait out their timeout
                pool.reassignQueued(handle);
            }
            return;
        }

        if (current == WorkerHealth.STARTING) {
            // Predictor still loading
            return;
        }

        Duration age = handle.getHeartbeatAge();
        if (age.compareTo(heartbeatTimeout) > 0) {
            log.warn("Worker heartbeat stale: workerId={}, heartbeatAgeMs={}", handle.getId(), age.toMillis());
            setWorkerHealth(handle, WorkerHealth.DEGRADED);
        } else {
            setWorkerHealth(handle, WorkerHealth.UP);
        }
    }

    private void setWorkerHealth(WorkerHandle handle, WorkerHealth health) {
        WorkerHealth previous = handle.setHealth(health);
        if (previous != health) {
            log.info("Worker health changed: workerId={}, previousHealth={}, newHealth={}, restarts={}",
                    handle.getId(), previous, health, handle.getRestarts());
        }
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Worker supervisor stopped");
        }
    }
}
