/*-
 * #%L
 * This file is part of the CERN Control and Monitoring Platform 'C2MON'.
 * %%
 * Copyright (C) 2010 - 2021 CERN
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 * 
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * #L%
 */
package cern.c2mon.opcua.subscriptions.config;

import cern.c2mon.opcua.subscriptions.exceptions.ConfigurationException;
import cern.c2mon.opcua.subscriptions.scheduling.ExecutorTimerService;
import cern.c2mon.opcua.subscriptions.scheduling.TimerService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration class providing the clock driving sampling and publishing, and a fallback meter registry when
 * the application does not export metrics.
 */
@Configuration
@EnableConfigurationProperties
@ComponentScan(basePackages = "cern.c2mon.opcua.subscriptions")
public class AppConfig {

    /**
     * The wall-clock timer service shared by all sessions. The configured limits are verified before it is created.
     * @param properties the server limits
     * @return the timer service, shut down with the application context
     * @throws ConfigurationException if the configured limits are inconsistent
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(TimerService.class)
    public ExecutorTimerService timerService(AppConfigProperties properties) throws ConfigurationException {
        properties.validate();
        return new ExecutorTimerService(properties.getSchedulerThreads());
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
