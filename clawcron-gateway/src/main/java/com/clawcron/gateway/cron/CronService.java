package com.clawcron.gateway.cron;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Manages cron jobs: CRUD, persistence, scheduling, and execution.
 * <p>
 * A single heartbeat thread wakes at the earliest next run time (bounded by
 * the configured floor and ceiling), picks up edits made to the store file by
 * other processes, and dispatches every due job onto a worker pool so that a
 * slow job never delays another. Mutations raise a wake signal so the
 * heartbeat re-plans immediately.
 */
@Slf4j
public class CronService implements AutoCloseable {

    private static final long CLOSE_TIMEOUT_MS = 5_000;

    private final CronStore store;
    private final CronJobExecutor executor;
    private final Consumer<CronState.CronEvent> onEvent;
    private final LongSupplier clock;
    private final long maxSleepMs;
    private final long minSleepMs;

    /** Guards the store: every read-modify-write of the job collection. */
    private final ReentrantLock lock = new ReentrantLock();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private final ScheduledExecutorService heartbeat;
    private final ExecutorService workers;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final Object timerGuard = new Object();
    private ScheduledFuture<?> pendingTick;
    private boolean ticking;
    private volatile boolean wakeRequested;
    private volatile Long nextWakeAtMs;
    private volatile CronState.HeartbeatPhase phase = CronState.HeartbeatPhase.IDLE;

    public CronService(CronState.CronServiceDeps deps) {
        this(deps, System::currentTimeMillis);
    }

    CronService(CronState.CronServiceDeps deps, LongSupplier clock) {
        Objects.requireNonNull(deps.getStorePath(), "storePath");
        Objects.requireNonNull(deps.getHandler(), "handler");
        this.store = new CronStore(deps.getStorePath());
        this.onEvent = deps.getOnEvent();
        this.clock = clock;
        this.maxSleepMs = Math.max(1, deps.getMaxSleepMs());
        this.minSleepMs = Math.max(0, Math.min(deps.getMinSleepMs(), this.maxSleepMs));
        this.executor = new CronJobExecutor(store, lock, this::syncFromDisk, this::wake, deps.getHandler(),
                this::emit, clock, inFlight, deps.getRunLogLimit());

        this.heartbeat = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cron-heartbeat");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger workerSeq = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "cron-worker-" + workerSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Load the store, compute next run times of all enabled jobs, persist,
     * then start the heartbeat.
     */
    public void start() {
        if (phase == CronState.HeartbeatPhase.STOPPED || heartbeat.isShutdown()) {
            throw new IllegalStateException("cron service was stopped");
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }

        int count;
        lock.lock();
        try {
            store.load();
            long now = clock.getAsLong();
            for (CronTypes.CronJob job : store.jobs().values()) {
                if (job.isEnabled()) {
                    job.getState().setNextRunAtMs(CronScheduleCalculator.computeNextRunAtMs(job.getSchedule(), now));
                }
            }
            persist();
            count = store.jobs().size();
        } finally {
            lock.unlock();
        }

        log.info("cron: service started with {} jobs ({})", count, store.getStorePath());
        scheduleTick(0);
    }

    /**
     * Stop the heartbeat. Jobs already running finish on their own; nothing
     * new is dispatched.
     */
    public void stop() {
        boolean wasRunning;
        synchronized (timerGuard) {
            wasRunning = running.getAndSet(false);
            phase = CronState.HeartbeatPhase.STOPPED;
            if (pendingTick != null) {
                pendingTick.cancel(false);
                pendingTick = null;
            }
        }
        heartbeat.shutdown();
        workers.shutdown();
        nextWakeAtMs = null;
        if (wasRunning) {
            log.info("cron: service stopped");
        }
    }

    /**
     * {@link #stop()} and wait briefly for in-flight jobs.
     */
    @Override
    public void close() {
        stop();
        try {
            if (!workers.awaitTermination(CLOSE_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("cron: {} job(s) still running after {}ms", executor.inFlightCount(), CLOSE_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Ask the heartbeat to re-plan now instead of sleeping out its interval.
     */
    public void wake() {
        wakeRequested = true;
        synchronized (timerGuard) {
            if (!running.get() || ticking) {
                // a running tick re-arms at zero delay when it sees the flag
                return;
            }
            if (pendingTick != null) {
                pendingTick.cancel(false);
            }
            try {
                pendingTick = heartbeat.schedule(this::tick, 0, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("cron: wake ignored, heartbeat shut down");
            }
        }
    }

    // =========================================================================
    // Heartbeat
    // =========================================================================

    private void tick() {
        synchronized (timerGuard) {
            ticking = true;
            pendingTick = null;
            wakeRequested = false;
        }

        long delay = maxSleepMs;
        try {
            if (!running.get()) {
                return;
            }
            enterPhase(CronState.HeartbeatPhase.CHECKING);
            List<CronTypes.CronJob> due = new ArrayList<>();
            lock.lock();
            try {
                syncFromDisk();
                long now = clock.getAsLong();
                for (CronTypes.CronJob job : store.jobs().values()) {
                    Long next = job.getState().getNextRunAtMs();
                    if (job.isEnabled() && next != null && now >= next && executor.tryClaim(job.getId())) {
                        due.add(job.copy());
                    }
                }
            } finally {
                lock.unlock();
            }

            if (!due.isEmpty()) {
                enterPhase(CronState.HeartbeatPhase.DISPATCHING);
                log.debug("cron: dispatching {} due job(s)", due.size());
                for (CronTypes.CronJob job : due) {
                    dispatch(job);
                }
            }

            lock.lock();
            try {
                delay = computeSleepMs(clock.getAsLong());
            } finally {
                lock.unlock();
            }
        } catch (Exception e) {
            log.error("cron: heartbeat cycle failed: {}", e.getMessage(), e);
            delay = maxSleepMs;
        } finally {
            synchronized (timerGuard) {
                ticking = false;
                if (running.get()) {
                    phase = CronState.HeartbeatPhase.WAITING;
                    scheduleTick(wakeRequested ? 0 : delay);
                }
            }
        }
    }

    /** Phase changes made by a tick never overwrite {@code STOPPED}. */
    private void enterPhase(CronState.HeartbeatPhase next) {
        synchronized (timerGuard) {
            if (running.get()) {
                phase = next;
            }
        }
    }

    private void dispatch(CronTypes.CronJob job) {
        try {
            workers.execute(() -> executor.execute(job, false));
        } catch (RejectedExecutionException e) {
            executor.release(job.getId());
            log.warn("cron: could not dispatch job {}: worker pool shut down", job.getId());
        }
    }

    private void scheduleTick(long delayMs) {
        synchronized (timerGuard) {
            if (!running.get()) {
                return;
            }
            if (pendingTick != null) {
                pendingTick.cancel(false);
            }
            nextWakeAtMs = clock.getAsLong() + delayMs;
            try {
                pendingTick = heartbeat.schedule(this::tick, delayMs, TimeUnit.MILLISECONDS);
                log.debug("cron: next heartbeat in {}ms", delayMs);
            } catch (RejectedExecutionException e) {
                log.debug("cron: heartbeat shut down, not re-arming");
            }
        }
    }

    /**
     * Sleep until the earliest next run of an enabled, idle job, clamped to
     * the floor and ceiling; the ceiling when there is none.
     * Call with the lock held.
     */
    private long computeSleepMs(long now) {
        Long earliest = earliestNextRun();
        if (earliest == null) {
            return maxSleepMs;
        }
        return Math.max(minSleepMs, Math.min(maxSleepMs, earliest - now));
    }

    private Long earliestNextRun() {
        Long earliest = null;
        for (CronTypes.CronJob job : store.jobs().values()) {
            Long next = job.getState().getNextRunAtMs();
            if (job.isEnabled() && next != null && !executor.isInFlight(job.getId())
                    && (earliest == null || next < earliest)) {
                earliest = next;
            }
        }
        return earliest;
    }

    /**
     * Pick up external edits of the store file. Jobs that are new without a
     * next run, changed their schedule, or were re-enabled get their next run
     * recomputed; the rest keep the persisted value. Call with the lock held.
     */
    private void syncFromDisk() {
        if (!store.isLoaded()) {
            store.load();
            return;
        }
        Map<String, CronTypes.CronJob> before = new HashMap<>(store.jobs());
        if (!store.reloadIfChanged()) {
            return;
        }
        long now = clock.getAsLong();
        for (CronTypes.CronJob job : store.jobs().values()) {
            if (!job.isEnabled()) {
                continue;
            }
            CronTypes.CronJob prior = before.get(job.getId());
            boolean shifted = prior != null
                    && (!prior.isEnabled() || !Objects.equals(prior.getSchedule(), job.getSchedule()));
            if (job.getState().getNextRunAtMs() == null || shifted) {
                job.getState().setNextRunAtMs(CronScheduleCalculator.computeNextRunAtMs(job.getSchedule(), now));
            }
        }
    }

    // =========================================================================
    // CRUD
    // =========================================================================

    public CronTypes.CronJob addJob(CronTypes.CronJobCreate create) {
        return addJobsBatch(List.of(create)).get(0);
    }

    /**
     * Add several jobs with one write and one wake. Every definition must
     * carry a schedule; nothing is added otherwise.
     */
    public List<CronTypes.CronJob> addJobsBatch(List<CronTypes.CronJobCreate> creates) {
        if (creates == null || creates.isEmpty()) {
            return List.of();
        }
        for (CronTypes.CronJobCreate create : creates) {
            if (create == null || create.getSchedule() == null || create.getSchedule().getKind() == null) {
                throw new IllegalArgumentException("job definition requires a schedule");
            }
        }

        List<CronTypes.CronJob> added = new ArrayList<>();
        lock.lock();
        try {
            syncFromDisk();
            long now = clock.getAsLong();
            for (CronTypes.CronJobCreate create : creates) {
                CronTypes.CronSchedule schedule = create.getSchedule().toBuilder().build();
                CronTypes.CronPayload payload = create.getPayload() != null
                        ? create.getPayload().toBuilder().build()
                        : new CronTypes.CronPayload();
                String id = newJobId();
                CronTypes.CronJob job = CronTypes.CronJob.builder()
                        .id(id)
                        .name(resolveName(create.getName(), payload.getMessage(), id))
                        .enabled(true)
                        .schedule(schedule)
                        .payload(payload)
                        .state(CronTypes.CronJobState.builder()
                                .nextRunAtMs(CronScheduleCalculator.computeNextRunAtMs(schedule, now))
                                .build())
                        .createdAtMs(now)
                        .updatedAtMs(now)
                        .deleteAfterRun(create.isDeleteAfterRun())
                        .build();
                store.put(job);
                added.add(job.copy());
            }
            persist();
        } finally {
            lock.unlock();
        }

        for (CronTypes.CronJob job : added) {
            log.info("cron: added job '{}' ({}) {}", job.getName(), job.getId(), job.getSchedule().describe());
            emit(CronState.CronEvent.builder()
                    .jobId(job.getId())
                    .action(CronState.CronAction.ADDED)
                    .nextRunAtMs(job.getState().getNextRunAtMs())
                    .build());
        }
        wake();
        return added;
    }

    public Optional<CronTypes.CronJob> getJob(String id) {
        lock.lock();
        try {
            syncFromDisk();
            CronTypes.CronJob job = store.get(id);
            return Optional.ofNullable(job != null ? job.copy() : null);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Jobs ordered by next run time, jobs without one last.
     */
    public List<CronTypes.CronJob> listJobs(boolean includeDisabled) {
        List<CronTypes.CronJob> result = new ArrayList<>();
        lock.lock();
        try {
            syncFromDisk();
            for (CronTypes.CronJob job : store.jobs().values()) {
                if (includeDisabled || job.isEnabled()) {
                    result.add(job.copy());
                }
            }
        } finally {
            lock.unlock();
        }
        result.sort(Comparator.comparing(
                (CronTypes.CronJob job) -> job.getState().getNextRunAtMs(),
                Comparator.nullsLast(Comparator.naturalOrder())));
        return result;
    }

    public boolean removeJob(String id) {
        CronTypes.CronJob removed;
        lock.lock();
        try {
            syncFromDisk();
            removed = store.remove(id);
            if (removed != null) {
                persist();
            }
        } finally {
            lock.unlock();
        }
        if (removed == null) {
            return false;
        }
        log.info("cron: removed job '{}' ({})", removed.getName(), id);
        emit(CronState.CronEvent.builder().jobId(id).action(CronState.CronAction.REMOVED).build());
        wake();
        return true;
    }

    /**
     * Enable or disable a job. Enabling recomputes the next run from now;
     * disabling clears it.
     */
    public Optional<CronTypes.CronJob> enableJob(String id, boolean enabled) {
        CronTypes.CronJob updated;
        lock.lock();
        try {
            syncFromDisk();
            CronTypes.CronJob job = store.get(id);
            if (job == null) {
                return Optional.empty();
            }
            long now = clock.getAsLong();
            job.setEnabled(enabled);
            job.setUpdatedAtMs(now);
            job.getState().setNextRunAtMs(enabled
                    ? CronScheduleCalculator.computeNextRunAtMs(job.getSchedule(), now)
                    : null);
            persist();
            updated = job.copy();
        } finally {
            lock.unlock();
        }

        log.info("cron: job '{}' ({}) {}", updated.getName(), id, enabled ? "enabled" : "disabled");
        emit(CronState.CronEvent.builder()
                .jobId(id)
                .action(CronState.CronAction.UPDATED)
                .nextRunAtMs(updated.getState().getNextRunAtMs())
                .build());
        wake();
        return Optional.of(updated);
    }

    /**
     * Execute a job now on the calling thread, outside its schedule.
     * Returns false when the job does not exist, is disabled and
     * {@code force} is not set, or is already running.
     */
    public boolean runJob(String id, boolean force) {
        CronTypes.CronJob snapshot;
        lock.lock();
        try {
            syncFromDisk();
            CronTypes.CronJob job = store.get(id);
            if (job == null) {
                return false;
            }
            if (!force && !job.isEnabled()) {
                log.info("cron: job {} is disabled, not running", id);
                return false;
            }
            if (!executor.tryClaim(id)) {
                log.warn("cron: job {} is already running", id);
                return false;
            }
            snapshot = job.copy();
        } finally {
            lock.unlock();
        }
        executor.execute(snapshot, true);
        return true;
    }

    // =========================================================================
    // Diagnostics
    // =========================================================================

    public CronState.CronStatusSummary status() {
        lock.lock();
        try {
            if (!running.get()) {
                syncFromDisk();
            }
            int enabled = 0;
            for (CronTypes.CronJob job : store.jobs().values()) {
                if (job.isEnabled()) {
                    enabled++;
                }
            }
            return CronState.CronStatusSummary.builder()
                    .running(running.get())
                    .storePath(store.getStorePath().toString())
                    .jobs(store.jobs().size())
                    .enabledJobs(enabled)
                    .inFlight(executor.inFlightCount())
                    .nextWakeAtMs(running.get() ? earliestNextRun() : null)
                    .phase(phase)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * When the heartbeat is next scheduled to fire, or null when stopped.
     */
    public Long getNextHeartbeatAtMs() {
        return running.get() ? nextWakeAtMs : null;
    }

    public CronState.HeartbeatPhase getPhase() {
        return phase;
    }

    /**
     * Recent executions, newest first; all jobs when {@code jobId} is null.
     */
    public List<CronRunLog> getRunLogs(String jobId, int limit) {
        return executor.getRunLogs(jobId, Math.max(0, limit));
    }

    public CronStore getStore() {
        return store;
    }

    // =========================================================================
    // Internal
    // =========================================================================

    private String newJobId() {
        String id;
        do {
            id = UUID.randomUUID().toString().substring(0, 8);
        } while (store.jobs().containsKey(id));
        return id;
    }

    private static String resolveName(String name, String message, String id) {
        if (name != null && !name.isBlank()) {
            return name.trim();
        }
        if (message != null && !message.isBlank()) {
            String trimmed = message.trim();
            return trimmed.length() > 30 ? trimmed.substring(0, 30) : trimmed;
        }
        return id;
    }

    /** Call with the lock held. */
    private void persist() {
        try {
            store.save();
        } catch (IOException e) {
            log.error("cron: failed to save store {}: {}", store.getStorePath(), e.getMessage());
        }
    }

    private void emit(CronState.CronEvent event) {
        if (onEvent == null) {
            return;
        }
        try {
            onEvent.accept(event);
        } catch (RuntimeException e) {
            log.warn("cron: event listener failed on {} {}: {}", event.getAction().key(), event.getJobId(),
                    e.getMessage());
        }
    }
}
