package com.clawcron.gateway.runtime;

import com.clawcron.common.config.ClawCronConfig;
import com.clawcron.common.config.ConfigPaths;
import com.clawcron.common.infra.InstanceLock;
import com.clawcron.gateway.cron.CronJobHandler;
import com.clawcron.gateway.cron.CronService;
import com.clawcron.gateway.cron.CronState;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Owns the long-running cron service: decides whether it runs at all, guards
 * the jobs file with the instance lock, and starts and stops the heartbeat.
 */
@Slf4j
public class GatewayCronRunner {

    private final CronService cronService;
    private final Path storePath;
    private final boolean cronEnabled;
    private InstanceLock.LockHandle lockHandle;

    public GatewayCronRunner(CronService cronService, ClawCronConfig cfg) {
        this(cronService, cfg, System.getenv());
    }

    public GatewayCronRunner(CronService cronService, ClawCronConfig cfg, Map<String, String> env) {
        this.cronService = cronService;
        this.storePath = cronService.getStore().getStorePath();
        this.cronEnabled = !"1".equals(env.get("CLAWCRON_SKIP_CRON"))
                && (cfg.getCron() == null || cfg.getCron().isEnabled());
    }

    /**
     * Build a service from configuration.
     */
    public static CronService createService(ClawCronConfig cfg,
            Path stateDir,
            CronJobHandler handler,
            Consumer<CronState.CronEvent> onEvent) {
        ClawCronConfig.CronConfig cron = cfg.getCron() != null ? cfg.getCron() : new ClawCronConfig.CronConfig();
        return new CronService(CronState.CronServiceDeps.builder()
                .storePath(ConfigPaths.resolveCronStorePath(cfg, stateDir))
                .handler(handler)
                .onEvent(onEvent)
                .maxSleepMs(cron.getMaxSleepMs())
                .minSleepMs(cron.getMinSleepMs())
                .runLogLimit(cron.getRunLogLimit())
                .build());
    }

    /**
     * Start the cron service if enabled. Returns whether it was started.
     *
     * @throws InstanceLock.InstanceLockError if another service owns the store
     */
    public synchronized boolean start() {
        if (!cronEnabled) {
            log.info("cron: disabled by config or CLAWCRON_SKIP_CRON");
            return false;
        }
        if (lockHandle != null) {
            return true;
        }
        lockHandle = InstanceLock.acquire(storePath);
        try {
            cronService.start();
        } catch (RuntimeException e) {
            lockHandle.release();
            lockHandle = null;
            throw e;
        }
        log.info("cron: started ({})", storePath);
        return true;
    }

    /**
     * Stop the cron service and release the store.
     */
    public synchronized void stop() {
        cronService.close();
        if (lockHandle != null) {
            lockHandle.release();
            lockHandle = null;
            log.info("cron: stopped");
        }
    }

    /**
     * Log lifecycle events; registered as the service's event listener.
     */
    public static void logEvent(CronState.CronEvent event) {
        if (event.getAction() == CronState.CronAction.FINISHED) {
            log.debug("cron: event {} job={} status={} next={}", event.getAction().key(), event.getJobId(),
                    event.getStatus() != null ? event.getStatus().key() : null, event.getNextRunAtMs());
        } else {
            log.debug("cron: event {} job={}", event.getAction().key(), event.getJobId());
        }
    }

    public boolean isCronEnabled() {
        return cronEnabled;
    }

    public boolean isHoldingLock() {
        return lockHandle != null;
    }

    public CronService getCronService() {
        return cronService;
    }
}
