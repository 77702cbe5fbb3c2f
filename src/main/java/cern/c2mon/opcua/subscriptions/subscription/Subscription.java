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
package cern.c2mon.opcua.subscriptions.subscription;

import cern.c2mon.opcua.subscriptions.addressspace.AddressSpace;
import cern.c2mon.opcua.subscriptions.config.AppConfigProperties;
import cern.c2mon.opcua.subscriptions.metrics.MetricProxy;
import cern.c2mon.opcua.subscriptions.monitoring.DataChangeFilters;
import cern.c2mon.opcua.subscriptions.monitoring.MonitoredItem;
import cern.c2mon.opcua.subscriptions.monitoring.MonitoredItemCreateRequest;
import cern.c2mon.opcua.subscriptions.monitoring.MonitoredItemCreateResult;
import cern.c2mon.opcua.subscriptions.monitoring.MonitoredItemModifyRequest;
import cern.c2mon.opcua.subscriptions.monitoring.MonitoredItemModifyResult;
import cern.c2mon.opcua.subscriptions.publish.PublishEngine;
import cern.c2mon.opcua.subscriptions.scheduling.Timer;
import cern.c2mon.opcua.subscriptions.scheduling.TimerPhase;
import cern.c2mon.opcua.subscriptions.scheduling.TimerService;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.milo.opcua.stack.core.AttributeId;
import org.eclipse.milo.opcua.stack.core.StatusCodes;
import org.eclipse.milo.opcua.stack.core.UaException;
import org.eclipse.milo.opcua.stack.core.types.builtin.DataValue;
import org.eclipse.milo.opcua.stack.core.types.builtin.DateTime;
import org.eclipse.milo.opcua.stack.core.types.builtin.DiagnosticInfo;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;
import org.eclipse.milo.opcua.stack.core.types.enumerated.MonitoringMode;
import org.eclipse.milo.opcua.stack.core.types.enumerated.TimestampsToReturn;
import org.eclipse.milo.opcua.stack.core.types.structured.DataChangeNotification;
import org.eclipse.milo.opcua.stack.core.types.structured.MonitoredItemNotification;
import org.eclipse.milo.opcua.stack.core.types.structured.NotificationData;
import org.eclipse.milo.opcua.stack.core.types.structured.Range;
import org.eclipse.milo.opcua.stack.core.types.structured.ReadValueId;
import org.eclipse.milo.opcua.stack.core.types.structured.StatusChangeNotification;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.uint;

/**
 * A subscription groups monitored items of one session which share a publishing interval. On every publishing cycle
 * it collects the notifications of the items due to report, either on their own in reporting mode or because a
 * triggering item fired, and wraps them in a {@link NotificationMessage} for the {@link PublishEngine} to deliver. If
 * nothing is to be reported for maxKeepAliveCount cycles, a keep-alive message is sent instead. A subscription which
 * is not served any publish request for lifetimeCount cycles expires.
 * <p>
 * All state of a subscription, including its items' monitoring modes and triggering links, is guarded by the monitor
 * of its PublishEngine. A publishing cycle therefore never interleaves with a concurrent SetTriggering, item creation
 * or publish request of the same session. A monitored item which queued a value takes the same monitor to fire its
 * triggering links, after releasing its own lock.
 */
@Slf4j
public class Subscription {

    private static final long MAX_SEQUENCE_NUMBER = 0xFFFFFFFFL;

    @Getter
    private final UInteger id;

    private final PublishEngine publishEngine;
    private final AppConfigProperties properties;
    private final TimerService timerService;
    private final MetricProxy metricProxy;

    /**
     * In order of creation, which is the order items are evaluated in a publishing cycle.
     */
    private final Map<UInteger, MonitoredItem> monitoredItems = new LinkedHashMap<>();
    private final TriggeringTable triggeringTable = new TriggeringTable();
    private final List<MonitoredItemListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Messages produced by publishing cycles which are waiting for a publish request, in sequence number order.
     */
    private final Deque<NotificationMessage> pendingMessages = new ArrayDeque<>();

    /**
     * Sent messages which were not acknowledged yet, by sequence number.
     */
    private final LinkedHashMap<UInteger, NotificationMessage> retransmissionQueue = new LinkedHashMap<>();

    @Getter
    private double publishingInterval;

    @Getter
    private int maxKeepAliveCount;

    @Getter
    private int lifetimeCount;

    @Getter
    private int maxNotificationsPerPublish;

    @Getter
    private boolean publishingEnabled;

    @Getter
    private SubscriptionState state = SubscriptionState.CREATING;

    @Getter
    private int keepAliveCounter;

    @Getter
    private int lifetimeCounter;

    private long nextSequenceNumber = 1;
    private boolean messageSent;
    private int nextMonitoredItemId = 1;
    private Timer publishingTimer;

    /**
     * Creates a new Subscription. The requested parameters are revised into the configured limits. Publishing starts
     * with {@link #start()}.
     * @param id            the identifier of the subscription, unique within the server
     * @param parameters    the parameters requested by the client
     * @param publishEngine the engine of the session the subscription belongs to
     * @param properties    the server limits
     * @param timerService  the clock driving sampling and publishing
     * @param metricProxy   Used to gauge the number of monitored items and count published messages.
     */
    public Subscription(UInteger id, SubscriptionParameters parameters, PublishEngine publishEngine,
                        AppConfigProperties properties, TimerService timerService, MetricProxy metricProxy) {
        this.id = id;
        this.publishEngine = publishEngine;
        this.properties = properties;
        this.timerService = timerService;
        this.metricProxy = metricProxy;
        revise(parameters);
        this.keepAliveCounter = maxKeepAliveCount;
        this.lifetimeCounter = lifetimeCount;
        metricProxy.initializeMonitoredItemsGauge(monitoredItems, id);
    }

    /**
     * Starts the publishing timer.
     */
    public void start() {
        synchronized (publishEngine) {
            if (state != SubscriptionState.CLOSED && publishingTimer == null) {
                publishingTimer = timerService.schedule(TimerPhase.PUBLISHING, this::onPublishingTimer, (long) Math.ceil(publishingInterval));
            }
        }
    }

    /**
     * Revises and applies new subscription parameters. Counters restart from the new values.
     * @param parameters the parameters requested by the client
     */
    public void modify(SubscriptionParameters parameters) {
        synchronized (publishEngine) {
            if (state == SubscriptionState.CLOSED) {
                return;
            }
            final double previousInterval = publishingInterval;
            revise(parameters);
            keepAliveCounter = maxKeepAliveCount;
            lifetimeCounter = lifetimeCount;
            if (publishingTimer != null && previousInterval != publishingInterval) {
                publishingTimer.cancel();
                publishingTimer = null;
                start();
            }
        }
    }

    /**
     * Enables or disables publishing. While disabled, monitored items keep sampling and queuing, but only keep-alive
     * messages are sent.
     * @param enabled true to enable publishing
     */
    public void setPublishingMode(boolean enabled) {
        synchronized (publishEngine) {
            this.publishingEnabled = enabled;
        }
    }

    public void addMonitoredItemListener(MonitoredItemListener listener) {
        listeners.add(listener);
    }

    /**
     * Creates a monitored item on an attribute of a Node. The requested sampling interval and queue size are revised
     * into the configured limits; a filter which cannot be applied rejects the request.
     * @param addressSpace       the address space holding the Node
     * @param timestampsToReturn the timestamps to keep on reported values, Both if null
     * @param request            the client's request
     * @return the result, carrying the new item's id if the status code is good.
     */
    public MonitoredItemCreateResult createMonitoredItem(AddressSpace addressSpace, TimestampsToReturn timestampsToReturn,
                                                         MonitoredItemCreateRequest request) {
        final MonitoredItem item;
        final MonitoredItemCreateResult result;
        synchronized (publishEngine) {
            if (state == SubscriptionState.CLOSED) {
                return MonitoredItemCreateResult.rejected(new StatusCode(StatusCodes.Bad_SubscriptionIdInvalid), StatusCode.GOOD);
            }
            if (monitoredItems.size() >= properties.getMaxMonitoredItemsPerSubscription()) {
                return MonitoredItemCreateResult.rejected(new StatusCode(StatusCodes.Bad_TooManyMonitoredItems), StatusCode.GOOD);
            }
            final StatusCode requestResult = validate(addressSpace, request);
            if (requestResult.isBad()) {
                return MonitoredItemCreateResult.rejected(requestResult, StatusCode.GOOD);
            }
            final ReadValueId itemToMonitor = request.getItemToMonitor();
            final Range euRange = addressSpace.getEuRange(itemToMonitor.getNodeId()).orElse(null);
            final StatusCode filterResult = DataChangeFilters.validate(request.getFilter(), itemToMonitor.getAttributeId(),
                    euRange, currentValue(addressSpace, request));
            if (filterResult.isBad()) {
                return MonitoredItemCreateResult.rejected(filterResult, filterResult);
            }
            final double samplingInterval = reviseSamplingInterval(request.getSamplingInterval());
            final int queueSize = reviseQueueSize(request.getQueueSize());
            final UInteger itemId = uint(nextMonitoredItemId++);
            item = new MonitoredItem(itemId, request, samplingInterval, queueSize, euRange,
                    timestampsToReturn == null ? TimestampsToReturn.Both : timestampsToReturn, addressSpace, timerService);
            item.setNotificationListener(this::onNotificationQueued);
            monitoredItems.put(itemId, item);
            listeners.forEach(l -> l.onMonitoredItemCreated(item));
            result = new MonitoredItemCreateResult(StatusCode.GOOD, itemId, samplingInterval, queueSize, filterResult);
        }
        log.debug("Created monitored item {} on {} in subscription {}.", result.getMonitoredItemId(), request.getItemToMonitor().getNodeId(), id);
        item.start();
        return result;
    }

    /**
     * Changes the sampling parameters of a monitored item.
     * @param request the client's request
     * @return the result carrying the revised parameters, or Bad_MonitoredItemIdInvalid if the item is unknown.
     */
    public MonitoredItemModifyResult modifyMonitoredItem(MonitoredItemModifyRequest request) {
        synchronized (publishEngine) {
            final MonitoredItem item = monitoredItems.get(request.getMonitoredItemId());
            if (item == null) {
                return new MonitoredItemModifyResult(new StatusCode(StatusCodes.Bad_MonitoredItemIdInvalid), 0, 0, StatusCode.GOOD);
            }
            final StatusCode filterResult = DataChangeFilters.validate(request.getFilter(),
                    item.getItemToMonitor().getAttributeId(), item.getEuRange(), null);
            if (filterResult.isBad()) {
                return new MonitoredItemModifyResult(filterResult, item.getSamplingInterval(), item.getQueueSize(), filterResult);
            }
            final double samplingInterval = reviseSamplingInterval(request.getSamplingInterval());
            final int queueSize = reviseQueueSize(request.getQueueSize());
            item.modify(request, samplingInterval, queueSize);
            return new MonitoredItemModifyResult(StatusCode.GOOD, samplingInterval, queueSize, filterResult);
        }
    }

    /**
     * Deletes a monitored item. Its triggering links are removed with it, whichever end of the link it was; the items
     * at the other end are unaffected.
     * @param monitoredItemId the id of the item to delete
     * @return Good, or Bad_MonitoredItemIdInvalid if the item is unknown.
     */
    public StatusCode deleteMonitoredItem(UInteger monitoredItemId) {
        synchronized (publishEngine) {
            final MonitoredItem item = monitoredItems.remove(monitoredItemId);
            if (item == null) {
                return new StatusCode(StatusCodes.Bad_MonitoredItemIdInvalid);
            }
            triggeringTable.removeItem(monitoredItemId);
            item.dispose();
            listeners.forEach(l -> l.onMonitoredItemDeleted(item));
            return StatusCode.GOOD;
        }
    }

    /**
     * Changes the monitoring mode of several monitored items.
     * @param mode             the new monitoring mode
     * @param monitoredItemIds the ids of the items to change
     * @return the outcome for each item in the order of the request.
     */
    public List<StatusCode> setMonitoringMode(MonitoringMode mode, List<UInteger> monitoredItemIds) {
        final List<StatusCode> results = new ArrayList<>(monitoredItemIds.size());
        synchronized (publishEngine) {
            for (UInteger itemId : monitoredItemIds) {
                final MonitoredItem item = monitoredItems.get(itemId);
                if (mode == null) {
                    results.add(new StatusCode(StatusCodes.Bad_MonitoringModeInvalid));
                } else if (item == null) {
                    results.add(new StatusCode(StatusCodes.Bad_MonitoredItemIdInvalid));
                } else {
                    item.setMonitoringMode(mode);
                    results.add(StatusCode.GOOD);
                }
            }
        }
        return results;
    }

    /**
     * Adds and removes links between a triggering item and items to report. The call fails as a whole only if both
     * lists are empty or if the triggering item is unknown. Each link to add or remove succeeds if the item to report
     * exists in this subscription. A new link is fired by the first notification the triggering item queues after the
     * link was created, which reports the values the linked item queued up to that moment.
     * @param triggeringItemId the id of the triggering item
     * @param linksToAdd       the ids of the items to report to link
     * @param linksToRemove    the ids of the items to report to unlink
     * @return the overall status code and the outcome of each link in the order of the request.
     */
    public SetTriggeringResult setTriggering(UInteger triggeringItemId, List<UInteger> linksToAdd, List<UInteger> linksToRemove) {
        final List<UInteger> toAdd = linksToAdd == null ? Collections.emptyList() : linksToAdd;
        final List<UInteger> toRemove = linksToRemove == null ? Collections.emptyList() : linksToRemove;
        if (toAdd.isEmpty() && toRemove.isEmpty()) {
            return SetTriggeringResult.failed(StatusCodes.Bad_NothingToDo);
        }
        synchronized (publishEngine) {
            if (!monitoredItems.containsKey(triggeringItemId)) {
                return SetTriggeringResult.failed(StatusCodes.Bad_MonitoredItemIdInvalid);
            }
            final List<StatusCode> addResults = new ArrayList<>(toAdd.size());
            for (UInteger reportItemId : toAdd) {
                if (monitoredItems.containsKey(reportItemId) && !reportItemId.equals(triggeringItemId)) {
                    triggeringTable.addLink(triggeringItemId, reportItemId);
                    addResults.add(StatusCode.GOOD);
                } else {
                    addResults.add(new StatusCode(StatusCodes.Bad_MonitoredItemIdInvalid));
                }
            }
            final List<StatusCode> removeResults = new ArrayList<>(toRemove.size());
            for (UInteger reportItemId : toRemove) {
                if (monitoredItems.containsKey(reportItemId)) {
                    triggeringTable.removeLink(triggeringItemId, reportItemId);
                    removeResults.add(StatusCode.GOOD);
                } else {
                    removeResults.add(new StatusCode(StatusCodes.Bad_MonitoredItemIdInvalid));
                }
            }
            return new SetTriggeringResult(StatusCode.GOOD, addResults, removeResults);
        }
    }

    public Optional<MonitoredItem> getMonitoredItem(UInteger monitoredItemId) {
        synchronized (publishEngine) {
            return Optional.ofNullable(monitoredItems.get(monitoredItemId));
        }
    }

    public Collection<MonitoredItem> getMonitoredItems() {
        synchronized (publishEngine) {
            return ImmutableList.copyOf(monitoredItems.values());
        }
    }

    /**
     * @param triggeringItemId the id of a monitored item
     * @return the ids of the items linked to it, in the order the links were added.
     */
    public List<UInteger> getLinkedItems(UInteger triggeringItemId) {
        synchronized (publishEngine) {
            return triggeringTable.linksOf(triggeringItemId);
        }
    }

    /**
     * Runs one publishing cycle. Called by the publishing timer; exposed for the engine and for tests.
     */
    public void onPublishingTimer() {
        synchronized (publishEngine) {
            if (state == SubscriptionState.CLOSED) {
                return;
            }
            publishEngine.expireRequests();
            if (!publishEngine.hasPendingRequests() && --lifetimeCounter <= 0) {
                expire();
                return;
            }
            final List<MonitoredItemNotification> notifications = publishingEnabled
                    ? collectNotifications()
                    : Collections.emptyList();
            if (!notifications.isEmpty()) {
                pendingMessages.removeIf(NotificationMessage::isKeepAlive);
                final int chunkSize = maxNotificationsPerPublish == 0 ? notifications.size() : maxNotificationsPerPublish;
                for (List<MonitoredItemNotification> chunk : Lists.partition(notifications, chunkSize)) {
                    pendingMessages.add(dataMessage(chunk));
                }
                keepAliveCounter = maxKeepAliveCount;
                publishEngine.onSubscriptionReady(this);
            } else if (pendingMessages.isEmpty()) {
                if (state == SubscriptionState.CREATING || --keepAliveCounter <= 0) {
                    pendingMessages.add(keepAliveMessage());
                    publishEngine.onSubscriptionReady(this);
                }
            }
            if (!pendingMessages.isEmpty()) {
                if (state != SubscriptionState.LATE && log.isDebugEnabled()) {
                    log.debug("Subscription {} is late with {} message(s).", id, pendingMessages.size());
                }
                state = SubscriptionState.LATE;
            }
        }
    }

    /**
     * @return true if messages are waiting for a publish request.
     */
    public boolean hasPendingMessages() {
        synchronized (publishEngine) {
            return !pendingMessages.isEmpty();
        }
    }

    /**
     * Takes the oldest message waiting for a publish request. Called by the {@link PublishEngine} when it binds the
     * message to a request: data messages move to the retransmission queue, and the counters restart.
     * @return the message, or null if none is waiting.
     */
    public NotificationMessage takePendingMessage() {
        synchronized (publishEngine) {
            NotificationMessage message = pendingMessages.poll();
            if (message == null) {
                return null;
            }
            if (message.isKeepAlive()) {
                message = keepAliveMessage();
            } else {
                retransmissionQueue.put(message.getSequenceNumber(), message);
                while (retransmissionQueue.size() > properties.getMaxRetransmissionQueueSize()) {
                    final Iterator<UInteger> oldest = retransmissionQueue.keySet().iterator();
                    oldest.next();
                    oldest.remove();
                }
            }
            keepAliveCounter = maxKeepAliveCount;
            lifetimeCounter = lifetimeCount;
            if (!pendingMessages.isEmpty()) {
                state = SubscriptionState.LATE;
            } else if (message.isKeepAlive() && messageSent) {
                state = SubscriptionState.KEEPALIVE;
            } else {
                state = SubscriptionState.NORMAL;
            }
            messageSent = true;
            metricProxy.incrementMessages(id, notificationCount(message));
            return message;
        }
    }

    /**
     * Called by the {@link PublishEngine} whenever the session receives a publish request.
     */
    public void resetLifetimeCounter() {
        synchronized (publishEngine) {
            lifetimeCounter = lifetimeCount;
        }
    }

    /**
     * Retires a sent message from the retransmission queue.
     * @param sequenceNumber the sequence number acknowledged by the client
     * @return Good, or Bad_SequenceNumberUnknown if no such message awaits acknowledgement.
     */
    public StatusCode acknowledge(UInteger sequenceNumber) {
        synchronized (publishEngine) {
            return retransmissionQueue.remove(sequenceNumber) != null
                    ? StatusCode.GOOD
                    : new StatusCode(StatusCodes.Bad_SequenceNumberUnknown);
        }
    }

    /**
     * @param sequenceNumber the sequence number of a sent message
     * @return the message if it was not acknowledged yet.
     */
    public Optional<NotificationMessage> republish(UInteger sequenceNumber) {
        synchronized (publishEngine) {
            return Optional.ofNullable(retransmissionQueue.get(sequenceNumber));
        }
    }

    /**
     * @return the sequence numbers of sent messages which were not acknowledged yet, oldest first.
     */
    public List<UInteger> getAvailableSequenceNumbers() {
        synchronized (publishEngine) {
            return ImmutableList.copyOf(retransmissionQueue.keySet());
        }
    }

    /**
     * Closes the subscription and removes it from its engine. All monitored items are disposed and pending messages
     * are discarded. Terminating twice has no effect.
     */
    public void terminate() {
        synchronized (publishEngine) {
            if (state == SubscriptionState.CLOSED) {
                return;
            }
            log.info("Terminating subscription {}.", id);
            close();
            publishEngine.onSubscriptionClosed(this, null);
        }
    }

    /**
     * Closes the subscription without notifying the engine. Called by the engine when shutting down.
     */
    public void close() {
        synchronized (publishEngine) {
            if (state == SubscriptionState.CLOSED) {
                return;
            }
            state = SubscriptionState.CLOSED;
            if (publishingTimer != null) {
                publishingTimer.cancel();
                publishingTimer = null;
            }
            for (MonitoredItem item : monitoredItems.values()) {
                item.dispose();
                listeners.forEach(l -> l.onMonitoredItemDeleted(item));
            }
            monitoredItems.clear();
            pendingMessages.clear();
            retransmissionQueue.clear();
        }
    }

    private void expire() {
        log.info("The lifetime of subscription {} expired after {} publishing cycles without publish request.", id, lifetimeCount);
        metricProxy.incrementExpiredSubscriptions(id);
        final NotificationData timeout = new StatusChangeNotification(new StatusCode(StatusCodes.Bad_Timeout), null);
        final NotificationMessage statusChange = new NotificationMessage(consumeSequenceNumber(), now(), ImmutableList.of(timeout));
        close();
        publishEngine.onSubscriptionClosed(this, statusChange);
    }

    /**
     * Fires the triggering links of an item which just queued a value: each linked item in sampling mode sets aside
     * what it queued so far, to be reported in the next publishing cycle.
     */
    private void onNotificationQueued(MonitoredItem trigger) {
        synchronized (publishEngine) {
            if (state == SubscriptionState.CLOSED || monitoredItems.get(trigger.getId()) != trigger) {
                return;
            }
            for (UInteger reportItemId : triggeringTable.linksOf(trigger.getId())) {
                final MonitoredItem reportItem = monitoredItems.get(reportItemId);
                if (reportItem != null) {
                    reportItem.trigger();
                }
            }
        }
    }

    /**
     * Extracts the notifications of every item with values due for reporting. Items in reporting mode come first in
     * creation order, followed by linked items in sampling mode in the order of their triggering links, and finally
     * any item still holding values triggered before its link was removed.
     */
    private List<MonitoredItemNotification> collectNotifications() {
        final Set<MonitoredItem> toReport = new LinkedHashSet<>();
        for (MonitoredItem item : monitoredItems.values()) {
            if (item.getMonitoringMode() == MonitoringMode.Reporting && item.hasNotificationsToReport()) {
                toReport.add(item);
            }
            for (UInteger reportItemId : triggeringTable.linksOf(item.getId())) {
                final MonitoredItem reportItem = monitoredItems.get(reportItemId);
                if (reportItem != null && reportItem.getMonitoringMode() == MonitoringMode.Sampling
                        && reportItem.hasNotificationsToReport()) {
                    toReport.add(reportItem);
                }
            }
        }
        for (MonitoredItem item : monitoredItems.values()) {
            if (item.hasNotificationsToReport()) {
                toReport.add(item);
            }
        }
        final List<MonitoredItemNotification> notifications = new ArrayList<>();
        for (MonitoredItem item : toReport) {
            notifications.addAll(item.extractNotifications());
        }
        return notifications;
    }

    private NotificationMessage dataMessage(List<MonitoredItemNotification> notifications) {
        final DataChangeNotification dataChange = new DataChangeNotification(
                notifications.toArray(new MonitoredItemNotification[0]), new DiagnosticInfo[0]);
        return new NotificationMessage(consumeSequenceNumber(), now(), ImmutableList.of(dataChange));
    }

    private NotificationMessage keepAliveMessage() {
        return new NotificationMessage(uint(nextSequenceNumber), now(), Collections.emptyList());
    }

    /**
     * Sets the sequence number of the next notification message. Used by tests to reach the wrap-around.
     */
    void setNextSequenceNumber(long nextSequenceNumber) {
        synchronized (publishEngine) {
            this.nextSequenceNumber = nextSequenceNumber;
        }
    }

    private UInteger consumeSequenceNumber() {
        final UInteger sequenceNumber = uint(nextSequenceNumber);
        nextSequenceNumber = nextSequenceNumber == MAX_SEQUENCE_NUMBER ? 1 : nextSequenceNumber + 1;
        return sequenceNumber;
    }

    private static int notificationCount(NotificationMessage message) {
        return message.getDataChangeNotifications().stream()
                .mapToInt(n -> n.getMonitoredItems() == null ? 0 : n.getMonitoredItems().length)
                .sum();
    }

    private StatusCode validate(AddressSpace addressSpace, MonitoredItemCreateRequest request) {
        final ReadValueId itemToMonitor = request.getItemToMonitor();
        if (itemToMonitor == null || itemToMonitor.getNodeId() == null || itemToMonitor.getNodeId().isNull()) {
            return new StatusCode(StatusCodes.Bad_NodeIdInvalid);
        }
        if (itemToMonitor.getAttributeId() == null || AttributeId.from(itemToMonitor.getAttributeId()).isEmpty()) {
            return new StatusCode(StatusCodes.Bad_AttributeIdInvalid);
        }
        if (!addressSpace.nodeExists(itemToMonitor.getNodeId())) {
            return new StatusCode(StatusCodes.Bad_NodeIdUnknown);
        }
        if (request.getMonitoringMode() == null) {
            return new StatusCode(StatusCodes.Bad_MonitoringModeInvalid);
        }
        return StatusCode.GOOD;
    }

    private DataValue currentValue(AddressSpace addressSpace, MonitoredItemCreateRequest request) {
        if (request.getFilter() == null) {
            return null;
        }
        final NodeId nodeId = request.getItemToMonitor().getNodeId();
        try {
            return addressSpace.readAttributeValue(nodeId, request.getItemToMonitor().getAttributeId());
        } catch (UaException e) {
            log.debug("Could not read {} to validate the filter, assuming a numeric value.", nodeId, e);
            return null;
        }
    }

    private void revise(SubscriptionParameters parameters) {
        final double requestedInterval = parameters.getPublishingInterval();
        publishingInterval = Double.isNaN(requestedInterval)
                ? properties.getMinPublishingInterval()
                : Math.min(properties.getMaxPublishingInterval(), Math.max(properties.getMinPublishingInterval(), requestedInterval));
        maxKeepAliveCount = parameters.getMaxKeepAliveCount() <= 0
                ? properties.getDefaultKeepAliveCount()
                : Math.min(parameters.getMaxKeepAliveCount(), properties.getMaxKeepAliveCount());
        lifetimeCount = Math.min(properties.getMaxLifetimeCount(), Math.max(parameters.getLifetimeCount(), 3 * maxKeepAliveCount));
        final int serverLimit = properties.getMaxNotificationsPerPublish();
        final int requested = Math.max(0, parameters.getMaxNotificationsPerPublish());
        maxNotificationsPerPublish = serverLimit == 0 ? requested : (requested == 0 ? serverLimit : Math.min(requested, serverLimit));
        publishingEnabled = parameters.isPublishingEnabled();
    }

    private double reviseSamplingInterval(double requested) {
        double interval = requested < 0 ? publishingInterval : requested;
        if (Double.isNaN(interval) || interval < properties.getMinSamplingInterval()) {
            interval = properties.getMinSamplingInterval();
        }
        return Math.min(interval, properties.getMaxSamplingInterval());
    }

    private int reviseQueueSize(int requested) {
        return requested <= 0 ? properties.getDefaultQueueSize() : Math.min(requested, properties.getMaxQueueSize());
    }

    private DateTime now() {
        return new DateTime(new Date(timerService.now()));
    }
}
