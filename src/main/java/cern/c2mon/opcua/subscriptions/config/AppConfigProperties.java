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
import cern.c2mon.opcua.subscriptions.exceptions.ExceptionContext;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * This class contains the limits the server applies to subscriptions, monitored items and publish requests. Values
 * requested by a client are revised into these limits rather than rejected.
 */
@Configuration
@ConfigurationProperties(prefix = "c2mon.opcua.subscriptions")
@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class AppConfigProperties {

    /**
     * The fastest publishing interval in milliseconds a subscription may request.
     */
    @Builder.Default
    private double minPublishingInterval = 50;

    /**
     * The slowest publishing interval in milliseconds a subscription may request.
     */
    @Builder.Default
    private double maxPublishingInterval = 3_600_000;

    /**
     * The keep-alive count used when a subscription requests a keep-alive count of 0.
     */
    @Builder.Default
    private int defaultKeepAliveCount = 10;

    /**
     * The largest number of publishing cycles without notifications before a keep-alive message is sent.
     */
    @Builder.Default
    private int maxKeepAliveCount = 12_000;

    /**
     * The largest number of publishing cycles a subscription survives without any publish request of its session.
     * Must be at least three times maxKeepAliveCount.
     */
    @Builder.Default
    private int maxLifetimeCount = 36_000;

    /**
     * The fastest sampling interval in milliseconds. A requested sampling interval of 0 is revised to this value.
     */
    @Builder.Default
    private double minSamplingInterval = 50;

    /**
     * The slowest sampling interval in milliseconds.
     */
    @Builder.Default
    private double maxSamplingInterval = 3_600_000;

    /**
     * The queue size used when a monitored item requests a queue size of 0.
     */
    @Builder.Default
    private int defaultQueueSize = 1;

    /**
     * The largest number of values a monitored item queues in between publishing cycles.
     */
    @Builder.Default
    private int maxQueueSize = 1000;

    @Builder.Default
    private int maxMonitoredItemsPerSubscription = 10_000;

    @Builder.Default
    private int maxSubscriptionsPerSession = 50;

    /**
     * The largest number of notifications in a single NotificationMessage. If a publishing cycle produces more, they
     * are spread over several messages. 0 means unlimited. A subscription may request a lower value.
     */
    @Builder.Default
    private int maxNotificationsPerPublish = 0;

    /**
     * The number of publish requests a session may queue. When exceeded, the oldest request is answered with
     * Bad_TooManyPublishRequests.
     */
    @Builder.Default
    private int maxPublishRequestsPerSession = 100;

    /**
     * The number of sent but unacknowledged NotificationMessages kept per subscription for republishing.
     */
    @Builder.Default
    private int maxRetransmissionQueueSize = 10;

    /**
     * The number of threads running sampling and publishing timers.
     */
    @Builder.Default
    private int schedulerThreads = 1;

    /**
     * Verifies that the configured limits are consistent.
     * @throws ConfigurationException describing the first inconsistency found.
     */
    public void validate() throws ConfigurationException {
        if (minPublishingInterval <= 0 || minPublishingInterval > maxPublishingInterval) {
            throw new ConfigurationException(ExceptionContext.PUBLISHING_INTERVAL);
        }
        if (minSamplingInterval < 0 || minSamplingInterval > maxSamplingInterval) {
            throw new ConfigurationException(ExceptionContext.SAMPLING_INTERVAL);
        }
        if (defaultKeepAliveCount < 1 || defaultKeepAliveCount > maxKeepAliveCount) {
            throw new ConfigurationException(ExceptionContext.KEEP_ALIVE_COUNT);
        }
        if ((long) maxLifetimeCount < 3L * maxKeepAliveCount) {
            throw new ConfigurationException(ExceptionContext.LIFETIME_COUNT);
        }
        if (defaultQueueSize < 1 || defaultQueueSize > maxQueueSize) {
            throw new ConfigurationException(ExceptionContext.QUEUE_SIZE);
        }
        if (maxPublishRequestsPerSession < 1) {
            throw new ConfigurationException(ExceptionContext.PUBLISH_REQUESTS);
        }
        if (maxRetransmissionQueueSize < 1) {
            throw new ConfigurationException(ExceptionContext.RETRANSMISSION_QUEUE);
        }
        if (schedulerThreads < 1) {
            throw new ConfigurationException(ExceptionContext.SCHEDULER_THREADS);
        }
        if (maxSubscriptionsPerSession < 1 || maxMonitoredItemsPerSubscription < 1 || maxNotificationsPerPublish < 0) {
            throw new ConfigurationException(ExceptionContext.SESSION_LIMITS);
        }
    }
}
