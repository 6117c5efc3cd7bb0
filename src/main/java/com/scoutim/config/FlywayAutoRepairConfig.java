package com.scoutim.config;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 开发期改过已执行的迁移脚本时，validate 会因为 checksum 不一致失败；这里先 repair 再迁移，避免启动卡死。
 */
@Configuration
@ConditionalOnProperty(name = "im.flyway.auto-repair", havingValue = "true", matchIfMissing = true)
public class FlywayAutoRepairConfig {
    private static final Logger log = LoggerFactory.getLogger(FlywayAutoRepairConfig.class);

    @Bean
    public FlywayMigrationStrategy flywayMigrationStrategy() {
        return FlywayAutoRepairConfig::validateRepairMigrate;
    }

    static void validateRepairMigrate(Flyway flyway) {
        try {
            flyway.validate();
        } catch (FlywayValidateException e) {
            log.warn("Flyway: validate failed, running repair() before migrate()", e);
            try {
                flyway.repair();
            } catch (Exception repairError) {
                log.warn("Flyway: repair() failed, continue migrate()", repairError);
            }
        }
        flyway.migrate();
    }
}
