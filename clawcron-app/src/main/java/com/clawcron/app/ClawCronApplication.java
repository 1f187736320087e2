package com.clawcron.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.ComponentScan;

import java.util.Arrays;

/**
 * ClawCron application entry point.
 * <p>
 * Without arguments the scheduler runs until the process is stopped. With
 * {@code cron <subcommand> ...} one command is executed against the jobs
 * file and the process exits.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.clawcron")
public class ClawCronApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext ctx = SpringApplication.run(ClawCronApplication.class, args);
        if (isCommandInvocation(args)) {
            System.exit(SpringApplication.exit(ctx));
        }
    }

    static boolean isCommandInvocation(String[] args) {
        return commandArgs(args).length > 0;
    }

    /**
     * Arguments after any leading {@code --property=value} settings.
     */
    static String[] commandArgs(String[] args) {
        int start = 0;
        while (start < args.length && args[start].startsWith("--") && args[start].contains("=")) {
            start++;
        }
        return Arrays.copyOfRange(args, start, args.length);
    }
}
