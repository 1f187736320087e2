package com.clawcron.common.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration paths: state directory, config file and cron store.
 */
public final class ConfigPaths {

    private ConfigPaths() {
    }

    // =========================================================================
    // Directory / file name constants
    // =========================================================================

    private static final String STATE_DIRNAME = ".clawcron";
    private static final String CONFIG_FILENAME = "clawcron.json";
    private static final String CRON_DIRNAME = "cron";
    private static final String CRON_STORE_FILENAME = "jobs.json";

    // =========================================================================
    // State directory
    // =========================================================================

    /**
     * State directory for mutable data (cron store, locks).
     * Can be overridden via CLAWCRON_STATE_DIR.
     * Default: ~/.clawcron
     */
    public static Path resolveStateDir() {
        return resolveStateDir(System.getenv(), homeDir());
    }

    public static Path resolveStateDir(Map<String, String> env, String homedir) {
        String override = envTrimmed(env, "CLAWCRON_STATE_DIR");
        if (override != null) {
            return resolveUserPath(override);
        }
        return Path.of(homedir, STATE_DIRNAME);
    }

    // =========================================================================
    // Config file path
    // =========================================================================

    public static Path resolveConfigPath() {
        Map<String, String> env = System.getenv();
        return resolveConfigPath(env, resolveStateDir(env, homeDir()));
    }

    public static Path resolveConfigPath(Map<String, String> env, Path stateDir) {
        String override = envTrimmed(env, "CLAWCRON_CONFIG_PATH");
        if (override != null) {
            return resolveUserPath(override);
        }
        return stateDir.resolve(CONFIG_FILENAME);
    }

    // =========================================================================
    // Cron store
    // =========================================================================

    /**
     * Resolve the jobs file: explicit {@code cron.store} wins, otherwise
     * {@code <stateDir>/cron/jobs.json}.
     */
    public static Path resolveCronStorePath(ClawCronConfig cfg, Path stateDir) {
        if (cfg != null && cfg.getCron() != null) {
            String configured = cfg.getCron().getStore();
            if (configured != null && !configured.isBlank()) {
                return resolveUserPath(configured);
            }
        }
        return stateDir.resolve(CRON_DIRNAME).resolve(CRON_STORE_FILENAME);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    /**
     * Resolve a user path. Expands ~ to the home directory and makes it absolute.
     */
    public static Path resolveUserPath(String input) {
        if (input == null)
            return Path.of("");
        String trimmed = input.trim();
        if (trimmed.isEmpty())
            return Path.of("");
        if (trimmed.startsWith("~")) {
            String expanded = homeDir() + trimmed.substring(1);
            return Path.of(expanded).toAbsolutePath().normalize();
        }
        return Path.of(trimmed).toAbsolutePath().normalize();
    }

    private static String homeDir() {
        return System.getProperty("user.home");
    }

    private static String envTrimmed(Map<String, String> env, String key) {
        String val = env.get(key);
        return val != null && !val.trim().isEmpty() ? val.trim() : null;
    }
}
