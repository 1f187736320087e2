package com.clawcron.common.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("clawcron.json");
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "cron": {
                    "enabled": false,
                    "store": "/tmp/jobs.json",
                    "maxSleepMs": 5000,
                    "timezone": "Europe/Moscow"
                  },
                  "delivery": { "defaultChannel": "telegram" }
                }
                """;
        Files.writeString(configPath, json);

        ConfigService service = new ConfigService(configPath);
        ClawCronConfig config = service.loadConfig();

        assertNotNull(config.getCron());
        assertFalse(config.getCron().isEnabled());
        assertEquals("/tmp/jobs.json", config.getCron().getStore());
        assertEquals(5000, config.getCron().getMaxSleepMs());
        assertEquals("Europe/Moscow", config.getCron().getTimezone());
        assertEquals("telegram", config.getDelivery().getDefaultChannel());
        assertNotNull(config.getLogging());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        ConfigService service = new ConfigService(tempDir.resolve("nonexistent.json"));
        ClawCronConfig config = service.loadConfig();

        assertNotNull(config);
        assertTrue(config.getCron().isEnabled());
        assertEquals(60_000, config.getCron().getMaxSleepMs());
        assertEquals(100, config.getCron().getMinSleepMs());
        assertEquals(200, config.getCron().getRunLogLimit());
        assertEquals("cli", config.getDelivery().getDefaultChannel());
    }

    @Test
    void loadConfig_malformedJson_fallsBackToDefaults() throws IOException {
        Files.writeString(configPath, "{ not json");

        ClawCronConfig config = new ConfigService(configPath).loadConfig();

        assertNotNull(config.getCron());
        assertTrue(config.getCron().isEnabled());
    }

    @Test
    void loadConfig_unknownKeysIgnored() throws IOException {
        Files.writeString(configPath, """
                { "cron": { "maxSleepMs": 1000 }, "somethingElse": 42 }
                """);

        ClawCronConfig config = new ConfigService(configPath).loadConfig();

        assertEquals(1000, config.getCron().getMaxSleepMs());
    }

    @Test
    void applyDefaults_minSleepAboveCeiling_isClamped() {
        ConfigService service = new ConfigService(configPath);
        ClawCronConfig config = new ClawCronConfig();
        config.setCron(new ClawCronConfig.CronConfig());
        config.getCron().setMaxSleepMs(50);
        config.getCron().setMinSleepMs(500);

        service.applyDefaults(config);

        assertEquals(50, config.getCron().getMinSleepMs());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        ConfigService service = new ConfigService(configPath);
        assertEquals("hello", service.substituteEnvVars("hello"));
    }

    @Test
    void substituteEnvVars_withDefault_usesDefault() {
        ConfigService service = new ConfigService(configPath);
        String result = service.substituteEnvVars("${__UNLIKELY_VAR_XYZ:-fallback}");
        assertEquals("fallback", result);
    }

    @Test
    void substituteEnvVars_presentVariable_isReplaced() {
        ConfigService service = new ConfigService(configPath);
        String result = service.substituteEnvVars("\"${TZ_NAME}\"", Map.of("TZ_NAME", "Asia/Tokyo"));
        assertEquals("\"Asia/Tokyo\"", result);
    }

    @Test
    void loadConfig_isCached() throws IOException {
        Files.writeString(configPath, """
                { "cron": { "maxSleepMs": 5000 } }
                """);

        ConfigService service = new ConfigService(configPath);
        ClawCronConfig first = service.loadConfig();
        ClawCronConfig second = service.loadConfig();

        assertSame(first, second);
    }

    @Test
    void reloadConfig_picksUpChanges() throws IOException {
        Files.writeString(configPath, """
                { "cron": { "maxSleepMs": 5000 } }
                """);
        ConfigService service = new ConfigService(configPath);
        assertEquals(5000, service.loadConfig().getCron().getMaxSleepMs());

        Files.writeString(configPath, """
                { "cron": { "maxSleepMs": 7000 } }
                """);

        assertEquals(7000, service.reloadConfig().getCron().getMaxSleepMs());
    }
}
