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

import cern.c2mon.opcua.subscriptions.publish.PublishEngine;
import cern.c2mon.opcua.subscriptions.publish.PublishEngineFactory;
import cern.c2mon.opcua.subscriptions.publish.PublishResult;
import cern.c2mon.opcua.subscriptions.scheduling.ExecutorTimerService;
import cern.c2mon.opcua.subscriptions.scheduling.TimerService;
import cern.c2mon.opcua.subscriptions.subscription.Subscription;
import cern.c2mon.opcua.subscriptions.subscription.SubscriptionParameters;
import cern.c2mon.opcua.subscriptions.testutils.TestUtils;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(classes = AppConfig.class)
@TestPropertySource(locations = "classpath:subscriptions.properties")
public class AppConfigTest {

    @Autowired
    AppConfigProperties properties;

    @Autowired
    TimerService timerService;

    @Autowired
    PublishEngineFactory factory;

    @Autowired
    MeterRegistry registry;

    @Test
    public void propertiesShouldBeBoundFromEnvironment() {
        assertEquals(20, properties.getMinPublishingInterval());
        assertEquals(10, properties.getMinSamplingInterval());
        assertEquals(50, properties.getMaxQueueSize());
        assertEquals(3, properties.getMaxSubscriptionsPerSession());
        assertEquals(2, properties.getSchedulerThreads());
    }

    @Test
    public void unsetPropertiesShouldKeepDefaults() {
        assertEquals(10, properties.getDefaultKeepAliveCount());
        assertEquals(36_000, properties.getMaxLifetimeCount());
    }

    @Test
    public void timerServiceShouldRunOnWallClock() {
        assertTrue(timerService instanceof ExecutorTimerService);
        assertTrue(Math.abs(System.currentTimeMillis() - timerService.now()) < 10_000);
    }

    @Test
    public void factoryShouldCreateEngineWithConfiguredLimits() throws InterruptedException {
        final List<PublishResult> results = new CopyOnWriteArrayList<>();
        final CountDownLatch keepAlive = new CountDownLatch(1);
        final PublishEngine engine = factory.createPublishEngine("spring", (request, result) -> {
            results.add(result);
            keepAlive.countDown();
        });
        try {
            final Subscription subscription = engine.createSubscription(SubscriptionParameters.builder()
                    .publishingInterval(1)
                    .build()).getSubscription();
            assertEquals(20, subscription.getPublishingInterval());

            engine.onPublishRequest(TestUtils.publishRequest(1));
            assertTrue(keepAlive.await(1, TimeUnit.SECONDS));
            assertTrue(results.get(0).getNotificationMessage().isKeepAlive());
            assertNotNull(registry.find("c2mon_opcua_keep_alives").counter());
        } finally {
            engine.shutdown();
        }
    }
}
