package com.clawcron.app.commands;

import com.clawcron.common.config.ClawCronConfig;
import com.clawcron.common.infra.InstanceLock;
import com.clawcron.gateway.cron.CronNormalize;
import com.clawcron.gateway.cron.CronParse;
import com.clawcron.gateway.cron.CronRunLog;
import com.clawcron.gateway.cron.CronService;
import com.clawcron.gateway.cron.CronState;
import com.clawcron.gateway.cron.CronTypes;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scheduled job commands: /cron list, add, add-batch, remove, enable, run,
 * status, runs.
 */
@Component
public class CronCommands {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int DEFAULT_RUNS_LIMIT = 10;

    private static final Set<String> FLAGS = Set.of("all", "deliver", "delete-after-run", "disable", "force");
    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("a", "all"),
            Map.entry("n", "name"),
            Map.entry("m", "message"),
            Map.entry("e", "every"),
            Map.entry("c", "cron"),
            Map.entry("d", "deliver"),
            Map.entry("f", "force"),
            Map.entry("tz", "tz"),
            Map.entry("timezone", "tz"),
            Map.entry("k", "kind"),
            Map.entry("t", "kind"),
            Map.entry("type", "kind"));

    static final String USAGE = String.join("\n",
            "Usage: /cron <subcommand>",
            "  list [--all]",
            "  add --name N --message M (--every SECONDS | --cron EXPR | --at ISO) [--tz ZONE]",
            "      [--kind echo|agent_turn] [--deliver --to T --channel C] [--delete-after-run]",
            "  add-batch <json array>",
            "  remove <id>",
            "  enable <id> [--disable]",
            "  run <id> [--force]",
            "  status",
            "  runs [<id>] [limit]");

    private final CronService cronService;

    public CronCommands(CronService cronService) {
        this.cronService = cronService;
    }

    /**
     * Handle /cron: dispatch to the subcommand.
     */
    public CommandResult handleCron(String args, CommandContext ctx) {
        String trimmed = args == null ? "" : args.trim();
        if (isSubcommand(trimmed, "add-batch")) {
            try {
                return handleAddBatch(trimmed.substring("add-batch".length()).trim(), ctx);
            } catch (IllegalArgumentException e) {
                return CommandResult.error("Error: " + e.getMessage());
            }
        }

        List<String> tokens;
        try {
            tokens = CommandArgs.tokenize(trimmed);
        } catch (IllegalArgumentException e) {
            return CommandResult.error("Error: " + e.getMessage());
        }
        if (tokens.isEmpty()) {
            return CommandResult.text(USAGE);
        }

        String sub = tokens.get(0).toLowerCase();
        List<String> rest = tokens.subList(1, tokens.size());
        try {
            return switch (sub) {
                case "list", "ls" -> handleList(rest);
                case "add" -> handleAdd(rest, ctx);
                case "remove", "rm" -> handleRemove(rest);
                case "enable" -> handleEnable(rest);
                case "run" -> handleRun(rest);
                case "status" -> handleStatus();
                case "runs" -> handleRuns(rest);
                case "help" -> CommandResult.text(USAGE);
                default -> CommandResult.error("Unknown cron subcommand: " + sub + "\n" + USAGE);
            };
        } catch (IllegalArgumentException e) {
            return CommandResult.error("Error: " + e.getMessage());
        }
    }

    // =========================================================================
    // list
    // =========================================================================

    private CommandResult handleList(List<String> tokens) {
        CommandArgs.Parsed parsed = CommandArgs.parse(tokens, FLAGS, ALIASES);
        List<CronTypes.CronJob> jobs = cronService.listJobs(parsed.flag("all"));
        if (jobs.isEmpty()) {
            return CommandResult.text("No scheduled jobs.");
        }

        StringBuilder sb = new StringBuilder("Scheduled jobs:\n");
        for (CronTypes.CronJob job : jobs) {
            sb.append(String.format("- %s  %s  [%s]  %s  %s",
                    job.getId(),
                    job.getName(),
                    job.getSchedule() != null ? job.getSchedule().describe() : "unknown",
                    job.getPayload() != null ? job.getPayload().getKind().key() : "",
                    job.isEnabled() ? "enabled" : "disabled"));
            Long next = job.getState().getNextRunAtMs();
            if (next != null) {
                sb.append("  next: ").append(CronParse.formatUtc(next)).append(" UTC");
            }
            sb.append('\n');
        }
        return CommandResult.text(sb.toString().stripTrailing());
    }

    // =========================================================================
    // add / add-batch
    // =========================================================================

    private CommandResult handleAdd(List<String> tokens, CommandContext ctx) {
        CommandArgs.Parsed parsed = CommandArgs.parse(tokens, FLAGS, ALIASES);
        String name = parsed.option("name");
        String message = parsed.option("message");
        if (name == null || name.isBlank()) {
            return CommandResult.error("Error: --name is required");
        }
        if (message == null || message.isBlank()) {
            return CommandResult.error("Error: --message is required");
        }

        boolean deliver = parsed.flag("deliver");
        String to = parsed.option("to");
        String channel = parsed.option("channel");
        if (deliver && (isBlank(to) || isBlank(channel))) {
            return CommandResult.error("Error: --deliver requires --to and --channel");
        }

        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("name", name);
        raw.put("message", message);
        raw.put("kind", parsed.options().getOrDefault("kind", "agent_turn"));
        putIfPresent(raw, "every_seconds", parsed.option("every"));
        putIfPresent(raw, "cron_expr", parsed.option("cron"));
        putIfPresent(raw, "at", parsed.option("at"));
        putIfPresent(raw, "timezone", parsed.option("tz"));
        raw.put("deliver", deliver);
        putIfPresent(raw, "channel", channel);
        putIfPresent(raw, "to", to);
        raw.put("deleteAfterRun", parsed.flag("delete-after-run"));
        applySenderDefaults(raw, ctx);

        CronTypes.CronJob job = cronService.addJob(CronNormalize.normalizeCronJobCreate(raw, defaultTimezone(ctx)));

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("✓ Added job '%s' (%s)\n", job.getName(), job.getId()));
        sb.append("  Schedule: ").append(job.getSchedule().describe()).append('\n');
        sb.append("  Type: ").append(job.getPayload().getKind().key());
        Long next = job.getState().getNextRunAtMs();
        if (next != null) {
            sb.append("\n  Next run: ").append(CronParse.formatUtc(next)).append(" UTC");
        }
        return CommandResult.text(sb.toString());
    }

    /**
     * The JSON is taken verbatim from the rest of the line; a single quoted
     * argument is unwrapped first.
     */
    private CommandResult handleAddBatch(String json, CommandContext ctx) {
        if (json.isEmpty()) {
            return CommandResult.error("Error: add-batch requires a JSON array of jobs");
        }
        if (json.startsWith("'")) {
            json = String.join(" ", CommandArgs.tokenize(json));
        }
        List<Map<String, Object>> entries;
        try {
            entries = MAPPER.readValue(json, new TypeReference<List<Map<String, Object>>>() {
            });
        } catch (JsonProcessingException e) {
            return CommandResult.error("Error: invalid JSON: " + e.getOriginalMessage());
        }
        if (entries == null || entries.isEmpty()) {
            return CommandResult.error("Error: batch is empty");
        }
        for (Map<String, Object> entry : entries) {
            applySenderDefaults(entry, ctx);
        }

        List<CronTypes.CronJob> created = cronService.addJobsBatch(
                CronNormalize.normalizeBatch(entries, defaultTimezone(ctx)));
        StringBuilder sb = new StringBuilder(String.format("✓ Created %d jobs successfully", created.size()));
        for (CronTypes.CronJob job : created) {
            sb.append(String.format("\n  %s  %s", job.getId(), job.getName()));
        }
        return CommandResult.text(sb.toString());
    }

    /**
     * Jobs created from a chat deliver back to the sender unless the input
     * names another recipient.
     */
    private static void applySenderDefaults(Map<String, Object> raw, CommandContext ctx) {
        if (ctx.senderId() == null || raw.get("to") != null) {
            return;
        }
        raw.put("deliver", true);
        raw.put("to", ctx.senderId());
        if (raw.get("channel") == null && ctx.channel() != null) {
            raw.put("channel", ctx.channel());
        }
    }

    // =========================================================================
    // remove / enable / run
    // =========================================================================

    private CommandResult handleRemove(List<String> tokens) {
        String id = requireId(tokens);
        if (cronService.removeJob(id)) {
            return CommandResult.text("✓ Removed job " + id);
        }
        return CommandResult.error("Job " + id + " not found");
    }

    private CommandResult handleEnable(List<String> tokens) {
        CommandArgs.Parsed parsed = CommandArgs.parse(tokens, FLAGS, ALIASES);
        String id = requireId(parsed.positional());
        boolean disable = parsed.flag("disable");
        return cronService.enableJob(id, !disable)
                .map(job -> CommandResult.text(String.format("✓ Job '%s' %s", job.getName(),
                        disable ? "disabled" : "enabled")))
                .orElseGet(() -> CommandResult.error("Job " + id + " not found"));
    }

    private CommandResult handleRun(List<String> tokens) {
        CommandArgs.Parsed parsed = CommandArgs.parse(tokens, FLAGS, ALIASES);
        String id = requireId(parsed.positional());
        if (!cronService.runJob(id, parsed.flag("force"))) {
            return CommandResult.error("Failed to run job " + id);
        }

        List<CronRunLog> runs = cronService.getRunLogs(id, 1);
        if (!runs.isEmpty() && runs.get(0).getStatus() == CronTypes.RunStatus.ERROR) {
            return CommandResult.error("Job " + id + " failed: " + runs.get(0).getError());
        }
        return CommandResult.text("✓ Job executed");
    }

    // =========================================================================
    // status / runs
    // =========================================================================

    private CommandResult handleStatus() {
        CronState.CronStatusSummary status = cronService.status();

        StringBuilder sb = new StringBuilder("Cron status\n");
        sb.append("  Store: ").append(status.getStorePath()).append('\n');
        sb.append(String.format("  Jobs: %d (%d enabled)\n", status.getJobs(), status.getEnabledJobs()));
        if (status.isRunning()) {
            sb.append("  Scheduler: running (").append(status.getPhase().name().toLowerCase()).append(")\n");
            sb.append("  In flight: ").append(status.getInFlight()).append('\n');
            sb.append("  Next wake: ").append(status.getNextWakeAtMs() != null
                    ? CronParse.formatUtc(status.getNextWakeAtMs()) + " UTC"
                    : "none");
        } else {
            sb.append("  Scheduler: ").append(InstanceLock.isLocked(cronService.getStore().getStorePath())
                    ? "running in another process"
                    : "not running");
        }
        return CommandResult.text(sb.toString());
    }

    private CommandResult handleRuns(List<String> tokens) {
        String jobId = null;
        int limit = DEFAULT_RUNS_LIMIT;
        if (tokens.size() >= 2) {
            jobId = tokens.get(0);
            limit = parseLimit(tokens.get(1));
        } else if (tokens.size() == 1) {
            String only = tokens.get(0);
            if (cronService.getJob(only).isEmpty() && only.chars().allMatch(Character::isDigit)) {
                limit = parseLimit(only);
            } else {
                jobId = only;
            }
        }

        List<CronRunLog> runs = cronService.getRunLogs(jobId, limit);
        if (runs.isEmpty()) {
            return CommandResult.text("No runs recorded.");
        }
        StringBuilder sb = new StringBuilder("Recent runs:\n");
        for (CronRunLog run : runs) {
            sb.append(String.format("- %s  %s  %s  %dms%s",
                    CronParse.formatUtc(run.getStartedAtMs()),
                    run.getJobName(),
                    run.getStatus().key(),
                    run.getDurationMs(),
                    run.getError() != null ? "  " + run.getError() : ""));
            sb.append('\n');
        }
        return CommandResult.text(sb.toString().stripTrailing());
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private static boolean isSubcommand(String line, String name) {
        return line.regionMatches(true, 0, name, 0, name.length())
                && (line.length() == name.length() || Character.isWhitespace(line.charAt(name.length())));
    }

    private static String requireId(List<String> tokens) {
        if (tokens.isEmpty() || isBlank(tokens.get(0))) {
            throw new IllegalArgumentException("job id is required");
        }
        return tokens.get(0);
    }

    private static int parseLimit(String raw) {
        try {
            int limit = Integer.parseInt(raw);
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be positive: " + raw);
            }
            return limit;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be a number: " + raw);
        }
    }

    private static String defaultTimezone(CommandContext ctx) {
        ClawCronConfig config = ctx.config();
        return config != null && config.getCron() != null ? config.getCron().getTimezone() : null;
    }

    private static void putIfPresent(Map<String, Object> map, String key, String value) {
        if (!isBlank(value)) {
            map.put(key, value);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
