package com.clawcron.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches ClawCron configuration.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, ClawCronConfig> cache;
    private final Path configPath;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL);
    }

    public ConfigService(Path configPath, Duration cacheTtl) {
        // Expand ~ to user home directory
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public ClawCronConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public ClawCronConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    /**
     * Get the config file path.
     */
    public Path getConfigPath() {
        return configPath;
    }

    private ClawCronConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new ClawCronConfig());
        }
        try {
            String raw = Files.readString(configPath);

            // Environment variable substitution
            raw = substituteEnvVars(raw);

            ClawCronConfig config = objectMapper.readValue(raw, ClawCronConfig.class);
            log.info("Config loaded from: {}", configPath);
            return applyDefaults(config);
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new ClawCronConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        return substituteEnvVars(raw, System.getenv());
    }

    String substituteEnvVars(String raw, Map<String, String> env) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Apply default values to missing config sections.
     */
    ClawCronConfig applyDefaults(ClawCronConfig config) {
        if (config.getCron() == null) {
            config.setCron(new ClawCronConfig.CronConfig());
        }
        if (config.getDelivery() == null) {
            config.setDelivery(new ClawCronConfig.DeliveryConfig());
        }
        if (config.getLogging() == null) {
            config.setLogging(new ClawCronConfig.LoggingConfig());
        }
        ClawCronConfig.CronConfig cron = config.getCron();
        if (cron.getMaxSleepMs() <= 0) {
            cron.setMaxSleepMs(60_000);
        }
        if (cron.getMinSleepMs() <= 0 || cron.getMinSleepMs() > cron.getMaxSleepMs()) {
            cron.setMinSleepMs(Math.min(100, cron.getMaxSleepMs()));
        }
        if (cron.getRunLogLimit() <= 0) {
            cron.setRunLogLimit(200);
        }
        return config;
    }
}
