package com.clawcron.app.commands;

import com.clawcron.common.config.ClawCronConfig;
import com.clawcron.common.infra.InstanceLock;
import com.clawcron.gateway.cron.CronService;
import com.clawcron.gateway.cron.CronState;
import com.clawcron.gateway.cron.CronTypes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CronCommands}.
 */
class CronCommandsTest {

    @TempDir
    Path tempDir;

    private CronService cronService;
    private CronCommands cronCommands;
    private CommandContext cliCtx;
    private final AtomicInteger runs = new AtomicInteger();

    @BeforeEach
    void setUp() {
        cronService = new CronService(CronState.CronServiceDeps.builder()
                .storePath(tempDir.resolve("cron/jobs.json"))
                .handler(job -> {
                    runs.incrementAndGet();
                    if ("fail".equals(job.getPayload().getMessage())) {
                        return CompletableFuture.failedFuture(new IllegalStateException("nope"));
                    }
                    return CompletableFuture.completedFuture("ok");
                })
                .build());
        cronCommands = new CronCommands(cronService);
        ClawCronConfig config = new ClawCronConfig();
        config.setCron(new ClawCronConfig.CronConfig());
        cliCtx = new CommandContext("cli", "cli", null, config);
    }

    @AfterEach
    void tearDown() {
        cronService.close();
    }

    private CommandResult run(String args) {
        return cronCommands.handleCron(args, cliCtx);
    }

    private CronTypes.CronJob onlyJob() {
        List<CronTypes.CronJob> jobs = cronService.listJobs(true);
        assertEquals(1, jobs.size());
        return jobs.get(0);
    }

    // =========================================================================
    // add
    // =========================================================================

    @Test
    void add_everyEcho_createsJob() {
        CommandResult result = run("add --name water -m 'Drink water' --every 3600 --kind echo");

        assertFalse(result.error(), result.text());
        assertTrue(result.text().contains("Added job 'water'"));
        CronTypes.CronJob job = onlyJob();
        assertEquals(3_600_000L, job.getSchedule().getEveryMs());
        assertEquals(CronTypes.PayloadKind.ECHO, job.getPayload().getKind());
        assertFalse(job.getPayload().isDeliver());
    }

    @Test
    void add_defaultsToAgentTurn() {
        run("add --name news --message 'Summarize news' --cron '0 9 * * *' --timezone Europe/Moscow");

        CronTypes.CronJob job = onlyJob();
        assertEquals(CronTypes.PayloadKind.AGENT_TURN, job.getPayload().getKind());
        assertEquals("Europe/Moscow", job.getSchedule().getTz());
    }

    @Test
    void add_usesConfiguredTimezoneWhenNoneGiven() {
        cliCtx.config().getCron().setTimezone("Europe/Moscow");
        run("add --name report --message report --at 2030-01-01T12:00:00 --delete-after-run");

        CronTypes.CronJob job = onlyJob();
        assertEquals(1893488400000L, job.getSchedule().getAtMs());
        assertTrue(job.isDeleteAfterRun());
    }

    @Test
    void add_deliverRequiresRecipientAndChannel() {
        CommandResult result = run("add --name water --message water --every 60 --deliver --to 42");

        assertTrue(result.error());
        assertTrue(result.text().contains("--deliver requires --to and --channel"));
        assertTrue(cronService.listJobs(true).isEmpty());
    }

    @Test
    void add_withDelivery_storesTarget() {
        assertFalse(run("add -n water -m water -e 60 -d --to 42 --channel telegram").error());

        CronTypes.CronPayload payload = onlyJob().getPayload();
        assertTrue(payload.isDeliver());
        assertEquals("42", payload.getTo());
        assertEquals("telegram", payload.getChannel());
    }

    @Test
    void add_fromChat_deliversBackToSender() {
        CommandContext chat = new CommandContext("s1", "telegram", "777", cliCtx.config());
        assertFalse(cronCommands.handleCron("add --name n --message hi --every 60 --kind echo", chat).error());

        CronTypes.CronPayload payload = onlyJob().getPayload();
        assertTrue(payload.isDeliver());
        assertEquals("777", payload.getTo());
        assertEquals("telegram", payload.getChannel());
    }

    @Test
    void add_missingScheduleOrName_isError() {
        assertTrue(run("add --name x --message y").error());
        assertTrue(run("add --message y --every 5").error());
        assertTrue(run("add --name x --message y --cron 'bad expr'").error());
        assertTrue(cronService.listJobs(true).isEmpty());
    }

    @Test
    void addBatch_createsAllJobs() {
        CommandResult result = run("add-batch [{\"message\":\"one\",\"every_seconds\":60,\"type\":\"echo\"},"
                + "{\"message\":\"two\",\"cron_expr\":\"0 9 * * *\"},"
                + "{\"message\":\"three\",\"at\":\"2030-01-01T00:00:00Z\"}]");

        assertFalse(result.error(), result.text());
        assertTrue(result.text().contains("Created 3 jobs"));
        assertEquals(3, cronService.listJobs(true).size());
    }

    @Test
    void addBatch_quotedArgument_isUnwrapped() {
        CommandResult result = run("add-batch '[{\"message\":\"one\",\"every_seconds\":60}]'");
        assertFalse(result.error(), result.text());
        assertEquals(1, cronService.listJobs(true).size());
    }

    @Test
    void addBatch_invalidEntry_addsNothing() {
        CommandResult result = run("add-batch [{\"message\":\"one\",\"every_seconds\":60},{\"message\":\"two\"}]");
        assertTrue(result.error());
        assertTrue(result.text().contains("job #2"));
        assertTrue(cronService.listJobs(true).isEmpty());

        assertTrue(run("add-batch not json").error());
        assertTrue(run("add-batch").error());
    }

    // =========================================================================
    // list / remove / enable / run
    // =========================================================================

    @Test
    void list_emptyAndPopulated() {
        assertEquals("No scheduled jobs.", run("list").text());

        run("add --name water --message water --every 60");
        CronTypes.CronJob job = onlyJob();
        String text = run("list").text();
        assertTrue(text.contains(job.getId()));
        assertTrue(text.contains("every 60s"));
    }

    @Test
    void list_hidesDisabledUnlessAll() {
        run("add --name water --message water --every 60");
        String id = onlyJob().getId();
        run("enable " + id + " --disable");

        assertEquals("No scheduled jobs.", run("list").text());
        assertTrue(run("list --all").text().contains("disabled"));
    }

    @Test
    void remove_existingAndMissing() {
        run("add --name water --message water --every 60");
        String id = onlyJob().getId();

        assertTrue(run("remove " + id).text().contains("Removed job " + id));
        CommandResult missing = run("remove " + id);
        assertTrue(missing.error());
        assertTrue(missing.text().contains("not found"));
        assertTrue(run("remove").error());
    }

    @Test
    void enable_togglesJob() {
        run("add --name water --message water --every 60");
        String id = onlyJob().getId();

        assertTrue(run("enable " + id + " --disable").text().contains("disabled"));
        assertFalse(onlyJob().isEnabled());
        assertTrue(run("enable " + id).text().contains("enabled"));
        assertTrue(onlyJob().isEnabled());
        assertTrue(run("enable nope").error());
    }

    @Test
    void run_executesAndReportsFailure() {
        run("add --name ok --message fine --every 60");
        String id = onlyJob().getId();
        assertEquals("✓ Job executed", run("run " + id).text());
        assertEquals(1, runs.get());

        run("remove " + id);
        run("add --name bad --message fail --every 60");
        String bad = onlyJob().getId();
        CommandResult failed = run("run " + bad);
        assertTrue(failed.error());
        assertTrue(failed.text().contains("nope"));
    }

    @Test
    void run_disabledNeedsForce() {
        run("add --name ok --message fine --every 60");
        String id = onlyJob().getId();
        run("enable " + id + " --disable");

        assertTrue(run("run " + id).error());
        assertFalse(run("run " + id + " --force").error());
        assertEquals(1, runs.get());
    }

    // =========================================================================
    // status / runs / misc
    // =========================================================================

    @Test
    void status_reportsCounts() {
        run("add --name water --message water --every 60");
        String text = run("status").text();

        assertTrue(text.contains("Jobs: 1 (1 enabled)"));
        assertTrue(text.contains("not running"));
    }

    @Test
    void status_staleLockFile_isNotRunning() throws Exception {
        Path store = cronService.getStore().getStorePath();
        Files.createDirectories(store.getParent());
        Files.writeString(InstanceLock.lockPathFor(store), "{\"pid\":1}");

        assertTrue(run("status").text().contains("Scheduler: not running"));

        try (InstanceLock.LockHandle held = InstanceLock.acquire(store, 1000, 10)) {
            assertTrue(run("status").text().contains("running in another process"));
        }
    }

    @Test
    void runs_listsHistoryNewestFirst() {
        assertEquals("No runs recorded.", run("runs").text());

        run("add --name water --message water --every 60");
        String id = onlyJob().getId();
        run("run " + id);
        run("run " + id);

        String text = run("runs " + id).text();
        assertTrue(text.startsWith("Recent runs:"));
        assertEquals(2, text.lines().filter(l -> l.startsWith("- ")).count());
        assertEquals(1, run("runs " + id + " 1").text().lines().filter(l -> l.startsWith("- ")).count());
        assertTrue(run("runs " + id + " zero").error());
    }

    @Test
    void emptyOrUnknownSubcommand() {
        assertTrue(run("").text().startsWith("Usage: /cron"));
        CommandResult unknown = run("frobnicate");
        assertTrue(unknown.error());
        assertTrue(unknown.text().contains("Unknown cron subcommand"));
        assertTrue(run("add --name 'unterminated").error());
    }
}
