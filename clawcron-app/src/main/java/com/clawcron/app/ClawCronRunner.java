package com.clawcron.app;

import com.clawcron.app.commands.CommandArgs;
import com.clawcron.app.commands.CommandProcessor;
import com.clawcron.app.commands.CommandResult;
import com.clawcron.common.config.ConfigService;
import com.clawcron.gateway.runtime.GatewayCronRunner;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.concurrent.CountDownLatch;

/**
 * Runs either one command ({@code cron list}, {@code cron add ...}) or the
 * long-lived scheduler, depending on the process arguments.
 */
@Slf4j
@Component
public class ClawCronRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_FAILED = 1;
    static final int EXIT_UNKNOWN_COMMAND = 2;

    private final CommandProcessor commandProcessor;
    private final ConfigService configService;
    private final GatewayCronRunner cronRunner;
    private final CountDownLatch shutdown = new CountDownLatch(1);
    private volatile int exitCode;

    public ClawCronRunner(CommandProcessor commandProcessor,
            ConfigService configService,
            GatewayCronRunner cronRunner) {
        this.commandProcessor = commandProcessor;
        this.configService = configService;
        this.cronRunner = cronRunner;
    }

    @Override
    public void run(String... args) throws Exception {
        if (ClawCronApplication.isCommandInvocation(args)) {
            exitCode = runCommand(ClawCronApplication.commandArgs(args), System.out, System.err);
            return;
        }
        if (!cronRunner.start()) {
            log.info("Scheduler disabled; nothing to do");
            return;
        }
        shutdown.await();
    }

    /**
     * Execute one command given as process arguments and print its reply.
     */
    int runCommand(String[] args, PrintStream out, PrintStream err) {
        String line = "/" + CommandArgs.join(Arrays.asList(args));
        CommandResult result = commandProcessor.handleCommand(line, "cli", "cli", null, configService.loadConfig());
        if (result == null) {
            err.println("Unknown command: " + args[0]);
            return EXIT_UNKNOWN_COMMAND;
        }
        (result.error() ? err : out).println(result.text());
        return result.error() ? EXIT_FAILED : 0;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    @PreDestroy
    public void onShutdown() {
        cronRunner.stop();
        shutdown.countDown();
    }
}
