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
package cern.c2mon.opcua.subscriptions.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * An abstraction for Micrometer {@link io.micrometer.core.instrument.Meter}s
 */
@Component(value = "metricmanager")
@RequiredArgsConstructor
public class MetricProxy {

    private static final String PREFIX = "c2mon_opcua";
    private static final String MESSAGE_COUNTER = "notification_messages";
    private static final String NOTIFICATION_COUNTER = "notifications";
    private static final String KEEP_ALIVE_COUNTER = "keep_alives";
    private static final String PUBLISH_TIMEOUT_COUNTER = "publish_request_timeouts";
    private static final String EXPIRED_SUBSCRIPTION_COUNTER = "subscriptions_expired";
    private static final String ITEMS_PER_SUBSCRIPTION_GAUGE = "monitored_items_per_subscription";
    private static final String PENDING_REQUESTS_GAUGE = "pending_publish_requests";

    private final MeterRegistry registry;
    private final Map<String, SubscriptionCounter> counters = new ConcurrentHashMap<>();

    /**
     * Registers the number of monitored items of a subscription to be gauged.
     * @param items          the monitored items of the subscription
     * @param subscriptionId the id of the respective subscription
     */
    public void initializeMonitoredItemsGauge(Map<?, ?> items, Object subscriptionId) {
        registry.gaugeMapSize(PREFIX + "_" + ITEMS_PER_SUBSCRIPTION_GAUGE, getTags("subscription_id", String.valueOf(subscriptionId)), items);
    }

    /**
     * Registers the number of publish requests waiting in a session to be gauged.
     * @param requests the queue of publish requests
     * @param session  the name of the session
     */
    public void initializePendingRequestsGauge(Collection<?> requests, String session) {
        registry.gaugeCollectionSize(PREFIX + "_" + PENDING_REQUESTS_GAUGE, getTags("session", session), requests);
    }

    /**
     * Register a NotificationMessage handed to the transport
     * @param subscriptionId the subscription the message belongs to
     * @param notifications  the number of notifications in the message, 0 for a keep-alive
     */
    public void incrementMessages(Object subscriptionId, int notifications) {
        if (notifications == 0) {
            counter(KEEP_ALIVE_COUNTER).increment(subscriptionId, 1);
        } else {
            counter(MESSAGE_COUNTER).increment(subscriptionId, 1);
            counter(NOTIFICATION_COUNTER).increment(subscriptionId, notifications);
        }
    }

    /**
     * Register a publish request answered with Bad_Timeout
     * @param session the name of the session the request was queued in
     */
    public void incrementPublishTimeouts(String session) {
        counter(PUBLISH_TIMEOUT_COUNTER).increment(session, 1);
    }

    /**
     * Register a subscription closed because its lifetime expired
     * @param subscriptionId the id of the subscription
     */
    public void incrementExpiredSubscriptions(Object subscriptionId) {
        counter(EXPIRED_SUBSCRIPTION_COUNTER).increment(subscriptionId, 1);
    }

    /**
     * Removes the item gauge and the message counters of a closed subscription from the registry. The count of expired
     * subscriptions is kept.
     * @param subscriptionId the id of the closed subscription
     */
    public void removeSubscriptionMeters(Object subscriptionId) {
        final String id = String.valueOf(subscriptionId);
        registry.find(PREFIX + "_" + ITEMS_PER_SUBSCRIPTION_GAUGE).tags("subscription_id", id).meters()
                .forEach(registry::remove);
        for (String name : new String[]{MESSAGE_COUNTER, NOTIFICATION_COUNTER, KEEP_ALIVE_COUNTER}) {
            final SubscriptionCounter counter = counters.get(name);
            if (counter != null) {
                counter.remove(id);
            }
        }
    }

    private SubscriptionCounter counter(String name) {
        return counters.computeIfAbsent(name, n -> new SubscriptionCounter(registry, PREFIX + "_" + n));
    }

    private static Iterable<Tag> getTags(String... keyValues) {
        return Tags.of(keyValues);
    }

    /**
     * The SubscriptionCounter keeps track of the total number of events for each subscription or session by ID.
     */
    @RequiredArgsConstructor
    private class SubscriptionCounter {

        @NonNull
        private final MeterRegistry meterRegistry;
        private final String name;
        private final Map<String, Counter> byId = new ConcurrentHashMap<>();

        private void increment(Object id, double amount) {
            final Counter counter = byId.computeIfAbsent(String.valueOf(id), key -> meterRegistry.counter(name, getTags("id", key)));
            counter.increment(amount);
        }

        private void remove(String id) {
            final Counter counter = byId.remove(id);
            if (counter != null) {
                meterRegistry.remove(counter);
            }
        }
    }
}
