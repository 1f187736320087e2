package com.clawcron.gateway.cron;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Runs one job through the {@link CronJobHandler}, records the outcome in the
 * job's state, re-arms or retires it, and persists the store.
 * <p>
 * The in-flight set is the only guard against running the same job twice at
 * once inside one process; callers must {@link #tryClaim(String)} before
 * {@link #execute(CronTypes.CronJob, boolean)}.
 */
@Slf4j
class CronJobExecutor {

    private final CronStore store;
    private final ReentrantLock lock;
    private final Runnable syncFromDisk;
    private final Runnable afterRun;
    private final CronJobHandler handler;
    private final Consumer<CronState.CronEvent> emitter;
    private final LongSupplier clock;
    private final Set<String> inFlight;
    private final Deque<CronRunLog> runLogs = new ArrayDeque<>();
    private final int runLogLimit;

    CronJobExecutor(CronStore store,
            ReentrantLock lock,
            Runnable syncFromDisk,
            Runnable afterRun,
            CronJobHandler handler,
            Consumer<CronState.CronEvent> emitter,
            LongSupplier clock,
            Set<String> inFlight,
            int runLogLimit) {
        this.store = store;
        this.lock = lock;
        this.syncFromDisk = syncFromDisk;
        this.afterRun = afterRun;
        this.handler = handler;
        this.emitter = emitter;
        this.clock = clock;
        this.inFlight = inFlight;
        this.runLogLimit = Math.max(1, runLogLimit);
    }

    /** Mark a job in flight; false if it already is. */
    boolean tryClaim(String jobId) {
        return inFlight.add(jobId);
    }

    /** Undo a claim for a job that was never started. */
    void release(String jobId) {
        inFlight.remove(jobId);
    }

    boolean isInFlight(String jobId) {
        return inFlight.contains(jobId);
    }

    int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Run a claimed job to completion. Never throws; failures end up in the
     * job's state and the returned run log. {@code afterRun} is signalled once
     * the job has left the in-flight set, so its new next run gets planned.
     */
    CronRunLog execute(CronTypes.CronJob snapshot, boolean manual) {
        String jobId = snapshot.getId();
        long startMs = clock.getAsLong();
        try {
            log.info("cron: executing job '{}' ({})", snapshot.getName(), jobId);
            emitter.accept(CronState.CronEvent.builder()
                    .jobId(jobId)
                    .action(CronState.CronAction.STARTED)
                    .runAtMs(startMs)
                    .build());

            String output = null;
            String error = null;
            try {
                CompletableFuture<String> future = handler.handle(snapshot);
                output = future != null ? future.get() : null;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                error = "interrupted";
            } catch (Exception e) {
                error = describeFailure(e);
            }

            CronTypes.RunStatus status = error == null ? CronTypes.RunStatus.OK : CronTypes.RunStatus.ERROR;
            if (error == null) {
                log.info("cron: job '{}' completed", snapshot.getName());
            } else {
                log.error("cron: job '{}' failed: {}", snapshot.getName(), error);
            }

            Long nextRunAtMs = finish(jobId, startMs, error);
            long endMs = clock.getAsLong();

            CronRunLog runLog = CronRunLog.builder()
                    .jobId(jobId)
                    .jobName(snapshot.getName())
                    .startedAtMs(startMs)
                    .finishedAtMs(endMs)
                    .durationMs(endMs - startMs)
                    .status(status)
                    .error(error)
                    .output(output)
                    .manual(manual)
                    .build();
            appendRunLog(runLog);

            emitter.accept(CronState.CronEvent.builder()
                    .jobId(jobId)
                    .action(CronState.CronAction.FINISHED)
                    .runAtMs(startMs)
                    .durationMs(endMs - startMs)
                    .status(status)
                    .error(error)
                    .summary(output)
                    .nextRunAtMs(nextRunAtMs)
                    .build());
            return runLog;
        } finally {
            inFlight.remove(jobId);
            afterRun.run();
        }
    }

    /**
     * Apply the outcome to the stored job and persist. Returns the job's new
     * next run time, or null when it was retired or is gone.
     */
    private Long finish(String jobId, long startMs, String error) {
        lock.lock();
        try {
            syncFromDisk.run();
            CronTypes.CronJob job = store.get(jobId);
            if (job == null) {
                log.info("cron: job {} was removed while running; result not recorded", jobId);
                return null;
            }

            long now = clock.getAsLong();
            CronTypes.CronJobState state = job.getState();
            state.setLastRunAtMs(startMs);
            state.setLastStatus(error == null ? CronTypes.RunStatus.OK : CronTypes.RunStatus.ERROR);
            state.setLastError(error);
            job.setUpdatedAtMs(now);

            Long next = null;
            if (job.isOneShot()) {
                if (job.isDeleteAfterRun()) {
                    store.remove(jobId);
                    log.info("cron: one-shot job '{}' ({}) deleted after run", job.getName(), jobId);
                } else {
                    job.setEnabled(false);
                    state.setNextRunAtMs(null);
                }
            } else {
                next = CronScheduleCalculator.computeNextRunAtMs(job.getSchedule(), now);
                state.setNextRunAtMs(next);
            }

            try {
                store.save();
            } catch (IOException e) {
                log.error("cron: failed to persist run state of {}: {}", jobId, e.getMessage());
            }
            return next;
        } finally {
            lock.unlock();
        }
    }

    List<CronRunLog> getRunLogs(String jobId, int limit) {
        List<CronRunLog> result = new ArrayList<>();
        synchronized (runLogs) {
            Iterator<CronRunLog> it = runLogs.descendingIterator();
            while (it.hasNext() && result.size() < limit) {
                CronRunLog entry = it.next();
                if (jobId == null || jobId.equals(entry.getJobId())) {
                    result.add(entry);
                }
            }
        }
        return result;
    }

    private void appendRunLog(CronRunLog runLog) {
        synchronized (runLogs) {
            runLogs.addLast(runLog);
            while (runLogs.size() > runLogLimit) {
                runLogs.removeFirst();
            }
        }
    }

    /**
     * Root-cause message of a handler failure.
     */
    static String describeFailure(Throwable error) {
        Throwable root = error;
        while ((root instanceof CompletionException || root instanceof ExecutionException)
                && root.getCause() != null) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return message != null && !message.isBlank() ? message : root.getClass().getSimpleName();
    }
}
