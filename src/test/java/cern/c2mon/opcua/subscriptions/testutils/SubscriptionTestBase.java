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
package cern.c2mon.opcua.subscriptions.testutils;

import cern.c2mon.opcua.subscriptions.config.AppConfigProperties;
import cern.c2mon.opcua.subscriptions.metrics.MetricProxy;
import cern.c2mon.opcua.subscriptions.monitoring.MonitoredItemCreateResult;
import cern.c2mon.opcua.subscriptions.publish.PublishEngine;
import cern.c2mon.opcua.subscriptions.scheduling.VirtualTimerService;
import cern.c2mon.opcua.subscriptions.subscription.Subscription;
import cern.c2mon.opcua.subscriptions.subscription.SubscriptionParameters;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;
import org.eclipse.milo.opcua.stack.core.types.enumerated.MonitoringMode;
import org.eclipse.milo.opcua.stack.core.types.enumerated.TimestampsToReturn;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Sets up a session with one subscription publishing every {@link #INTERVAL} milliseconds on a virtual clock. Nodes 1
 * to 5 exist in the address space, and monitored items sample at the publishing interval with a queue size of 10. An
 * item takes its first sample on the first tick after its creation, ahead of the publishing cycle due at the same time,
 * so that every publishing cycle sees exactly one new value per sampling item.
 */
public abstract class SubscriptionTestBase {
    protected static final long INTERVAL = 100;

    protected VirtualTimerService timerService;
    protected TestAddressSpace addressSpace;
    protected TestResponseSender sender;
    protected AppConfigProperties properties;
    protected MeterRegistry registry;
    protected PublishEngine engine;
    protected Subscription subscription;
    private int requestHandles;

    @BeforeEach
    public void setUp() {
        timerService = new VirtualTimerService(100_000L);
        addressSpace = new TestAddressSpace(timerService);
        for (int i = 1; i <= 5; i++) {
            addressSpace.set(TestUtils.node(i), i);
        }
        sender = new TestResponseSender();
        properties = configure(AppConfigProperties.builder()).build();
        registry = new SimpleMeterRegistry();
        engine = new PublishEngine("test", sender, properties, timerService, new MetricProxy(registry));
        subscription = createSubscription(SubscriptionParameters.builder().publishingInterval(INTERVAL).build());
    }

    @AfterEach
    public void tearDown() {
        engine.shutdown();
    }

    /**
     * Override to change the server limits of the session.
     */
    protected AppConfigProperties.AppConfigPropertiesBuilder configure(AppConfigProperties.AppConfigPropertiesBuilder builder) {
        return builder;
    }

    protected Subscription createSubscription(SubscriptionParameters parameters) {
        return engine.createSubscription(parameters).getSubscription();
    }

    protected UInteger create(int clientHandle, MonitoringMode mode) {
        return create(subscription, clientHandle, mode);
    }

    protected UInteger create(Subscription target, int clientHandle, MonitoringMode mode) {
        final MonitoredItemCreateResult result = target.createMonitoredItem(addressSpace, TimestampsToReturn.Both,
                TestUtils.monitor(clientHandle, mode));
        assertTrue(result.getStatusCode().isGood());
        return result.getMonitoredItemId();
    }

    protected void publishRequests(int count) {
        for (int i = 0; i < count; i++) {
            engine.onPublishRequest(TestUtils.publishRequest(++requestHandles));
        }
    }

    protected void cycle() {
        cycles(1);
    }

    protected void cycles(int count) {
        timerService.advance(count * INTERVAL);
    }
}
