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
package cern.c2mon.opcua.subscriptions.publish;

import cern.c2mon.opcua.subscriptions.config.AppConfigProperties;
import cern.c2mon.opcua.subscriptions.exceptions.CommunicationException;
import cern.c2mon.opcua.subscriptions.exceptions.ExceptionContext;
import cern.c2mon.opcua.subscriptions.metrics.MetricProxy;
import cern.c2mon.opcua.subscriptions.scheduling.TimerService;
import cern.c2mon.opcua.subscriptions.subscription.NotificationMessage;
import cern.c2mon.opcua.subscriptions.subscription.Subscription;
import cern.c2mon.opcua.subscriptions.subscription.SubscriptionParameters;
import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.milo.opcua.stack.core.StatusCodes;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;
import org.eclipse.milo.opcua.stack.core.types.structured.SubscriptionAcknowledgement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.uint;

/**
 * The PublishEngine of a session matches the NotificationMessages produced by the session's subscriptions with the
 * publish requests sent by the client. Requests are queued in the order they arrive and answered oldest first; a
 * subscription with a message to deliver while no request is queued is late, and late subscriptions are served in the
 * order they became late as soon as requests arrive. Every request is answered exactly once: with a message, or with a
 * bad service result when it times out, is displaced by newer requests, or the session closes.
 * <p>
 * The monitor of the engine guards the state of the engine and of all its subscriptions.
 */
@Slf4j
public class PublishEngine {

    private static final AtomicInteger SUBSCRIPTION_IDS = new AtomicInteger();

    @Getter
    private final String session;

    private final ResponseSender responseSender;
    private final AppConfigProperties properties;
    private final TimerService timerService;
    private final MetricProxy metricProxy;

    private final Map<UInteger, Subscription> subscriptions = new LinkedHashMap<>();
    private final Deque<PendingRequest> pendingRequests = new ArrayDeque<>();
    private final Deque<Subscription> lateSubscriptions = new ArrayDeque<>();

    /**
     * Status change messages of subscriptions which expired, to be delivered with the next requests.
     */
    private final Deque<ClosedSubscriptionMessage> closedSubscriptionMessages = new ArrayDeque<>();

    private boolean shutdown;

    /**
     * Creates a PublishEngine for a session.
     * @param session        the name of the session, used in logs and metrics
     * @param responseSender the transport answering publish requests
     * @param properties     the server limits
     * @param timerService   the clock driving the session's subscriptions
     * @param metricProxy    the metrics of the server
     */
    public PublishEngine(String session, ResponseSender responseSender, AppConfigProperties properties,
                         TimerService timerService, MetricProxy metricProxy) {
        this.session = session;
        this.responseSender = responseSender;
        this.properties = properties;
        this.timerService = timerService;
        this.metricProxy = metricProxy;
        metricProxy.initializePendingRequestsGauge(pendingRequests, session);
    }

    /**
     * Creates a new subscription in the session and starts its publishing timer.
     * @param parameters the parameters requested by the client, revised into the server limits
     * @return the result holding the subscription, or Bad_TooManySubscriptions if the session holds the maximum number
     * of subscriptions already.
     */
    public synchronized SubscriptionCreateResult createSubscription(SubscriptionParameters parameters) {
        if (shutdown) {
            return new SubscriptionCreateResult(new StatusCode(StatusCodes.Bad_SessionClosed), null);
        }
        if (subscriptions.size() >= properties.getMaxSubscriptionsPerSession()) {
            return new SubscriptionCreateResult(new StatusCode(StatusCodes.Bad_TooManySubscriptions), null);
        }
        final UInteger id = uint(SUBSCRIPTION_IDS.incrementAndGet());
        final Subscription subscription = new Subscription(id, parameters, this, properties, timerService, metricProxy);
        subscriptions.put(id, subscription);
        subscription.start();
        log.info("Created subscription {} in session {} with a publishing interval of {} ms.", id, session, subscription.getPublishingInterval());
        return new SubscriptionCreateResult(StatusCode.GOOD, subscription);
    }

    public synchronized Optional<Subscription> getSubscription(UInteger subscriptionId) {
        return Optional.ofNullable(subscriptions.get(subscriptionId));
    }

    public synchronized Collection<Subscription> getSubscriptions() {
        return ImmutableList.copyOf(subscriptions.values());
    }

    /**
     * Terminates a subscription of the session.
     * @param subscriptionId the id of the subscription
     * @return Good, or Bad_SubscriptionIdInvalid if the session holds no such subscription.
     */
    public synchronized StatusCode deleteSubscription(UInteger subscriptionId) {
        final Subscription subscription = subscriptions.get(subscriptionId);
        if (subscription == null) {
            return new StatusCode(StatusCodes.Bad_SubscriptionIdInvalid);
        }
        subscription.terminate();
        return StatusCode.GOOD;
    }

    /**
     * Processes a publish request of the client. The acknowledgements it carries are applied immediately and the
     * lifetime of every subscription restarts. The request is then answered at once if a subscription is late, or
     * queued until a subscription has a message to send or the request times out.
     * @param request the request
     */
    public synchronized void onPublishRequest(PublishRequest request) {
        if (shutdown) {
            send(request, failure(request, StatusCodes.Bad_SessionClosed, ImmutableList.of()));
            return;
        }
        final List<StatusCode> results = acknowledge(request.getSubscriptionAcknowledgements());
        subscriptions.values().forEach(Subscription::resetLifetimeCounter);
        if (subscriptions.isEmpty() && closedSubscriptionMessages.isEmpty()) {
            send(request, failure(request, StatusCodes.Bad_NoSubscription, results));
            return;
        }
        pendingRequests.add(new PendingRequest(request, results, deadline(request)));
        while (pendingRequests.size() > properties.getMaxPublishRequestsPerSession()) {
            final PendingRequest oldest = pendingRequests.poll();
            log.debug("Session {} exceeds {} publish requests, discarding the oldest.", session, properties.getMaxPublishRequestsPerSession());
            send(oldest.getRequest(), failure(oldest.getRequest(), StatusCodes.Bad_TooManyPublishRequests, oldest.getResults()));
        }
        serve();
    }

    /**
     * Called by a subscription which holds a message to deliver. The message is sent right away if a request is
     * queued, otherwise the subscription is served as soon as one arrives.
     * @param subscription the subscription holding a message
     */
    public synchronized void onSubscriptionReady(Subscription subscription) {
        if (!lateSubscriptions.contains(subscription)) {
            lateSubscriptions.add(subscription);
        }
        serve();
    }

    /**
     * Called by a subscription which was closed, either on termination or because its lifetime expired. Requests
     * waiting in the queue are answered with Bad_SubscriptionIdInvalid if no subscription remains to serve them.
     * @param subscription  the closed subscription
     * @param statusMessage the StatusChangeNotification to deliver to the client, null if none
     */
    public synchronized void onSubscriptionClosed(Subscription subscription, NotificationMessage statusMessage) {
        subscriptions.remove(subscription.getId());
        lateSubscriptions.remove(subscription);
        metricProxy.removeSubscriptionMeters(subscription.getId());
        if (statusMessage != null) {
            closedSubscriptionMessages.add(new ClosedSubscriptionMessage(subscription.getId(), statusMessage));
            serve();
        }
        if (subscriptions.isEmpty() && closedSubscriptionMessages.isEmpty()) {
            failPendingRequests(StatusCodes.Bad_SubscriptionIdInvalid);
        }
    }

    /**
     * Answers all queued requests whose timeout has passed with Bad_Timeout.
     */
    public synchronized void expireRequests() {
        final long now = timerService.now();
        final Iterator<PendingRequest> iterator = pendingRequests.iterator();
        while (iterator.hasNext()) {
            final PendingRequest pending = iterator.next();
            if (pending.getDeadline() <= now) {
                iterator.remove();
                log.debug("Publish request {} of session {} timed out.", pending.getRequest().getRequestHandle(), session);
                metricProxy.incrementPublishTimeouts(session);
                send(pending.getRequest(), failure(pending.getRequest(), StatusCodes.Bad_Timeout, pending.getResults()));
            }
        }
    }

    public synchronized boolean hasPendingRequests() {
        return !pendingRequests.isEmpty();
    }

    public synchronized int getPendingRequestCount() {
        return pendingRequests.size();
    }

    /**
     * Returns a message which was sent but not acknowledged yet.
     * @param subscriptionId the id of the subscription which sent the message
     * @param sequenceNumber the sequence number of the message
     * @return the result holding the message, Bad_SubscriptionIdInvalid if the subscription is unknown, or
     * Bad_MessageNotAvailable if the message was acknowledged or is no longer kept.
     */
    public synchronized RepublishResult republish(UInteger subscriptionId, UInteger sequenceNumber) {
        final Subscription subscription = subscriptions.get(subscriptionId);
        if (subscription == null) {
            return new RepublishResult(new StatusCode(StatusCodes.Bad_SubscriptionIdInvalid), null);
        }
        return subscription.republish(sequenceNumber)
                .map(m -> new RepublishResult(StatusCode.GOOD, m))
                .orElseGet(() -> new RepublishResult(new StatusCode(StatusCodes.Bad_MessageNotAvailable), null));
    }

    /**
     * Closes all subscriptions of the session and answers the queued requests with Bad_SessionClosed. Requests
     * arriving later are answered in the same way. Shutting down twice has no effect.
     */
    public synchronized void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        log.info("Shutting down the publish engine of session {} with {} subscription(s).", session, subscriptions.size());
        for (Subscription subscription : ImmutableList.copyOf(subscriptions.values())) {
            subscription.close();
            metricProxy.removeSubscriptionMeters(subscription.getId());
        }
        subscriptions.clear();
        lateSubscriptions.clear();
        closedSubscriptionMessages.clear();
        failPendingRequests(StatusCodes.Bad_SessionClosed);
    }

    public synchronized boolean isShutdown() {
        return shutdown;
    }

    private void serve() {
        while (!pendingRequests.isEmpty()) {
            if (!closedSubscriptionMessages.isEmpty()) {
                final ClosedSubscriptionMessage closed = closedSubscriptionMessages.poll();
                final PendingRequest pending = pendingRequests.poll();
                send(pending.getRequest(), PublishResult.builder()
                        .requestHandle(pending.getRequest().getRequestHandle())
                        .subscriptionId(closed.getSubscriptionId())
                        .notificationMessage(closed.getMessage())
                        .results(pending.getResults())
                        .build());
                continue;
            }
            final Subscription subscription = lateSubscriptions.poll();
            if (subscription == null) {
                return;
            }
            final NotificationMessage message = subscription.takePendingMessage();
            if (message == null) {
                continue;
            }
            final boolean moreNotifications = subscription.hasPendingMessages();
            if (moreNotifications) {
                lateSubscriptions.add(subscription);
            }
            final PendingRequest pending = pendingRequests.poll();
            send(pending.getRequest(), PublishResult.builder()
                    .requestHandle(pending.getRequest().getRequestHandle())
                    .subscriptionId(subscription.getId())
                    .availableSequenceNumbers(subscription.getAvailableSequenceNumbers())
                    .moreNotifications(moreNotifications)
                    .notificationMessage(message)
                    .results(pending.getResults())
                    .build());
        }
    }

    private List<StatusCode> acknowledge(List<SubscriptionAcknowledgement> acknowledgements) {
        final List<StatusCode> results = new ArrayList<>(acknowledgements.size());
        for (SubscriptionAcknowledgement ack : acknowledgements) {
            final Subscription subscription = subscriptions.get(ack.getSubscriptionId());
            results.add(subscription == null
                    ? new StatusCode(StatusCodes.Bad_SubscriptionIdInvalid)
                    : subscription.acknowledge(ack.getSequenceNumber()));
        }
        return results;
    }

    /**
     * The time after which a request is answered with Bad_Timeout: the client's timeout hint if given, otherwise the
     * lifetime of the subscription with the shortest publishing interval, measured in its own publishing cycles.
     */
    private long deadline(PublishRequest request) {
        final long now = timerService.now();
        if (request.getTimeoutHint() > 0) {
            return now + request.getTimeoutHint();
        }
        return subscriptions.values().stream()
                .min(Comparator.comparingDouble(Subscription::getPublishingInterval))
                .map(fastest -> now + (long) Math.ceil(fastest.getPublishingInterval() * fastest.getLifetimeCount()))
                .orElse(Long.MAX_VALUE);
    }

    private void failPendingRequests(long statusCode) {
        PendingRequest pending;
        while ((pending = pendingRequests.poll()) != null) {
            send(pending.getRequest(), failure(pending.getRequest(), statusCode, pending.getResults()));
        }
    }

    private static PublishResult failure(PublishRequest request, long statusCode, List<StatusCode> results) {
        return PublishResult.builder()
                .requestHandle(request.getRequestHandle())
                .serviceResult(new StatusCode(statusCode))
                .results(results)
                .build();
    }

    private void send(PublishRequest request, PublishResult result) {
        try {
            responseSender.send(request, result);
        } catch (CommunicationException e) {
            log.warn("{} Request {} of session {}.", ExceptionContext.SEND_RESPONSE.getMessage(), request.getRequestHandle(), session, e);
        }
    }

    @Value
    private static class PendingRequest {
        PublishRequest request;
        List<StatusCode> results;
        long deadline;
    }

    @Value
    private static class ClosedSubscriptionMessage {
        UInteger subscriptionId;
        NotificationMessage message;
    }
}
