package com.flagship.budget_engine.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;

import java.time.Clock;

/**
 * Auto-configuration of the engine, registered in
 * {@code META-INF/spring/org.springframework.boot.autoconfigure.AutoConfiguration.imports}.
 *
 * The host must provide a {@link com.flagship.budget_engine.port.BudgetDataPort} and a
 * Micrometer {@link io.micrometer.core.instrument.MeterRegistry}. A system UTC clock is
 * used unless the host defines its own {@link Clock}. Auto-configurations are processed
 * after the host's configuration, so a host clock always wins. Hosts should not
 * {@code @Import} this class.
 */
@AutoConfiguration
@ComponentScan(basePackages = "com.flagship.budget_engine")
@EnableConfigurationProperties(BudgetEngineProperties.class)
public class BudgetEngineConfiguration {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock budgetEngineClock() {
        return Clock.systemUTC();
    }
}
