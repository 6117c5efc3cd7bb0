package com.scoutim.config;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class FlywayAutoRepairConfigTest {
    private final ApplicationContextRunner contextRunner =
            new ApplicationContextRunner().withUserConfiguration(FlywayAutoRepairConfig.class);

    @Test
    void createsStrategyByDefault() {
        contextRunner.run(context -> assertThat(context).hasSingleBean(FlywayMigrationStrategy.class));
    }

    @Test
    void canDisableByProperty() {
        contextRunner
                .withPropertyValues("im.flyway.auto-repair=false")
                .run(context -> assertThat(context).doesNotHaveBean(FlywayMigrationStrategy.class));
    }

    @Test
    void validateFailure_RepairsThenMigrates() {
        Flyway flyway = mock(Flyway.class);
        doThrow(mock(FlywayValidateException.class))
                .when(flyway).validate();

        FlywayAutoRepairConfig.validateRepairMigrate(flyway);

        InOrder order = inOrder(flyway);
        order.verify(flyway).validate();
        order.verify(flyway).repair();
        order.verify(flyway).migrate();
    }

    @Test
    void validateOk_MigratesWithoutRepair() {
        Flyway flyway = mock(Flyway.class);

        FlywayAutoRepairConfig.validateRepairMigrate(flyway);

        verify(flyway, never()).repair();
        verify(flyway).migrate();
    }
}
