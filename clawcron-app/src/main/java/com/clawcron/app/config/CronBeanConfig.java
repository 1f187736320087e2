package com.clawcron.app.config;

import com.clawcron.app.bridge.AgentTurnRunner;
import com.clawcron.app.bridge.CronJobDispatcher;
import com.clawcron.app.bridge.LoggingOutboundSender;
import com.clawcron.app.bridge.OutboundSender;
import com.clawcron.app.bridge.UnavailableAgentTurnRunner;
import com.clawcron.common.config.ClawCronConfig;
import com.clawcron.common.config.ConfigPaths;
import com.clawcron.common.config.ConfigService;
import com.clawcron.gateway.cron.CronService;
import com.clawcron.gateway.runtime.GatewayCronRunner;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring configuration for the scheduler beans.
 */
@Configuration
public class CronBeanConfig {

    @Value("${clawcron.config.path:}")
    private String configPath;
    @Value("${clawcron.state.dir:}")
    private String stateDir;

    private Path resolveStateDir() {
        return stateDir == null || stateDir.isBlank()
                ? ConfigPaths.resolveStateDir()
                : ConfigPaths.resolveUserPath(stateDir);
    }

    @Bean
    public ConfigService configService() {
        Path path = configPath == null || configPath.isBlank()
                ? ConfigPaths.resolveConfigPath()
                : ConfigPaths.resolveUserPath(configPath);
        return new ConfigService(path);
    }

    @Bean
    public OutboundSender outboundSender() {
        return new LoggingOutboundSender();
    }

    @Bean
    public AgentTurnRunner agentTurnRunner() {
        return new UnavailableAgentTurnRunner();
    }

    @Bean
    public CronJobDispatcher cronJobDispatcher(OutboundSender outboundSender,
            AgentTurnRunner agentTurnRunner,
            ConfigService configService) {
        return new CronJobDispatcher(outboundSender, agentTurnRunner, () -> {
            ClawCronConfig cfg = configService.loadConfig();
            return cfg.getDelivery() != null ? cfg.getDelivery().getDefaultChannel() : "cli";
        });
    }

    @Bean(destroyMethod = "close")
    public CronService cronService(ConfigService configService, CronJobDispatcher cronJobDispatcher) {
        return GatewayCronRunner.createService(configService.loadConfig(), resolveStateDir(),
                cronJobDispatcher, GatewayCronRunner::logEvent);
    }

    @Bean
    public GatewayCronRunner gatewayCronRunner(CronService cronService, ConfigService configService) {
        return new GatewayCronRunner(cronService, configService.loadConfig());
    }
}
