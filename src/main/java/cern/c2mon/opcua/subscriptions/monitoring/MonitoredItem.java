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
package cern.c2mon.opcua.subscriptions.monitoring;

import cern.c2mon.opcua.subscriptions.addressspace.AddressSpace;
import cern.c2mon.opcua.subscriptions.exceptions.ExceptionContext;
import cern.c2mon.opcua.subscriptions.exceptions.OPCUAException;
import cern.c2mon.opcua.subscriptions.scheduling.Timer;
import cern.c2mon.opcua.subscriptions.scheduling.TimerPhase;
import cern.c2mon.opcua.subscriptions.scheduling.TimerService;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.milo.opcua.stack.core.StatusCodes;
import org.eclipse.milo.opcua.stack.core.types.builtin.DataValue;
import org.eclipse.milo.opcua.stack.core.types.builtin.DateTime;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;
import org.eclipse.milo.opcua.stack.core.types.builtin.Variant;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;
import org.eclipse.milo.opcua.stack.core.types.enumerated.MonitoringMode;
import org.eclipse.milo.opcua.stack.core.types.enumerated.TimestampsToReturn;
import org.eclipse.milo.opcua.stack.core.types.structured.DataChangeFilter;
import org.eclipse.milo.opcua.stack.core.types.structured.MonitoredItemNotification;
import org.eclipse.milo.opcua.stack.core.types.structured.Range;
import org.eclipse.milo.opcua.stack.core.types.structured.ReadValueId;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Date;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A monitored item samples one attribute of a Node in the address space on its own sampling interval. Samples passing
 * the item's {@link DataChangeFilter} are kept in a bounded queue until the owning subscription extracts them in a
 * publishing cycle. While {@link MonitoringMode#Reporting}, the whole queue is reported. While {@link
 * MonitoringMode#Sampling}, values are only reported once a triggering item moves them aside with {@link #trigger()}.
 * Nothing is sampled while disabled.
 */
@Slf4j
public class MonitoredItem {

    /**
     * The InfoType "DataValue" and Overflow bits of a status code, set on a value when the queue overflowed.
     */
    public static final long OVERFLOW_BITS = 0x480L;

    @Getter
    private final UInteger id;

    @Getter
    private final ReadValueId itemToMonitor;

    @Getter
    private final TimestampsToReturn timestampsToReturn;

    private final AddressSpace addressSpace;
    private final TimerService timerService;

    @Getter
    private final Range euRange;

    private final Deque<DataValue> queue = new ArrayDeque<>();
    private final Deque<DataValue> triggered = new ArrayDeque<>();

    @Getter
    private UInteger clientHandle;

    private MonitoringMode monitoringMode;

    @Getter
    private double samplingInterval;

    @Getter
    private int queueSize;

    @Getter
    private boolean discardOldest;

    @Getter
    private DataChangeFilter filter;

    private SamplingFunction samplingFunction;
    private NotificationListener notificationListener;
    private DataValue lastValue;
    private Timer samplingTimer;
    private boolean readPending;
    private boolean nodeMissingReported;
    private boolean disposed;

    /**
     * Creates a new MonitoredItem. Sampling begins with {@link #start()}.
     * @param id                 the server-assigned identifier, unique within the subscription
     * @param request            the client's request
     * @param samplingInterval   the revised sampling interval
     * @param queueSize          the revised queue size
     * @param euRange            the engineering unit range of the Node for percent deadbands, may be null
     * @param timestampsToReturn the timestamps to keep on queued values
     * @param addressSpace       the address space to sample from
     * @param timerService       the clock driving the sampling
     */
    public MonitoredItem(UInteger id, MonitoredItemCreateRequest request, double samplingInterval, int queueSize,
                         Range euRange, TimestampsToReturn timestampsToReturn, AddressSpace addressSpace,
                         TimerService timerService) {
        this.id = id;
        this.itemToMonitor = request.getItemToMonitor();
        this.clientHandle = request.getClientHandle();
        this.monitoringMode = request.getMonitoringMode();
        this.filter = request.getFilter();
        this.discardOldest = request.isDiscardOldest();
        this.samplingInterval = samplingInterval;
        this.queueSize = queueSize;
        this.euRange = euRange;
        this.timestampsToReturn = timestampsToReturn;
        this.addressSpace = addressSpace;
        this.timerService = timerService;
        this.samplingFunction = last -> addressSpace.readAttributeValueAsync(itemToMonitor.getNodeId(), itemToMonitor.getAttributeId());
    }

    /**
     * Checks whether a status code carries the overflow bit.
     * @param statusCode the status code of a reported value
     * @return true if values were discarded from the queue before this one was reported.
     */
    public static boolean isOverflow(StatusCode statusCode) {
        return (statusCode.getValue() & 0x80L) != 0;
    }

    /**
     * Replaces the function acquiring new samples.
     * @param samplingFunction the function to use from the next sample on
     */
    public synchronized void setSamplingFunction(SamplingFunction samplingFunction) {
        this.samplingFunction = samplingFunction;
    }

    /**
     * Registers the listener informed whenever a new value was queued. It is called without holding the item's lock.
     * @param notificationListener the listener to inform, or null to inform nobody
     */
    public synchronized void setNotificationListener(NotificationListener notificationListener) {
        this.notificationListener = notificationListener;
    }

    /**
     * Starts the sampling timer. The first sample is taken on the first expiry of the sampling interval.
     */
    public synchronized void start() {
        if (!disposed && samplingTimer == null) {
            scheduleSampling();
        }
    }

    /**
     * @return the current monitoring mode.
     */
    public synchronized MonitoringMode getMonitoringMode() {
        return monitoringMode;
    }

    /**
     * Acquires a new sample and queues it if it passes the filter. Nothing is read while the item is disabled, or
     * while the previous sample is still being acquired. If the monitored Node has disappeared from the address space,
     * a single Bad_NodeIdUnknown value is queued instead and the item stays alive.
     */
    public void sample() {
        final SamplingFunction function;
        final DataValue previous;
        synchronized (this) {
            if (disposed || monitoringMode == MonitoringMode.Disabled || readPending) {
                return;
            }
            if (!addressSpace.nodeExists(itemToMonitor.getNodeId())) {
                function = null;
                previous = null;
            } else {
                nodeMissingReported = false;
                readPending = true;
                function = samplingFunction;
                previous = lastValue;
            }
        }
        if (function == null) {
            if (reportNodeMissing()) {
                notifyListener();
            }
            return;
        }
        CompletableFuture<DataValue> reading;
        try {
            reading = function.sample(previous);
        } catch (RuntimeException e) {
            reading = CompletableFuture.failedFuture(e);
        }
        reading.whenComplete(this::onSampled);
    }

    /**
     * Moves the values queued so far aside for reporting in the next publishing cycle, as when a triggering item linked
     * to this one queued a notification. Only an item in {@link MonitoringMode#Sampling} is affected: a reporting
     * item reports its queue anyway, and a disabled item holds nothing. The triggered values are bounded by the queue
     * size under the item's discard policy.
     */
    public synchronized void trigger() {
        if (disposed || monitoringMode != MonitoringMode.Sampling) {
            return;
        }
        DataValue value;
        while ((value = queue.pollFirst()) != null) {
            offer(triggered, value);
        }
    }

    /**
     * @return true if the item holds triggered values, or queued values while reporting.
     */
    public synchronized boolean hasNotificationsToReport() {
        return !triggered.isEmpty() || (monitoringMode == MonitoringMode.Reporting && !queue.isEmpty());
    }

    /**
     * Removes all values due for reporting: the triggered values, followed by the queue while the item is reporting.
     * Values queued while sampling stay in place until triggered.
     * @return the values in the order they were sampled, labelled with the item's client handle.
     */
    public synchronized List<MonitoredItemNotification> extractNotifications() {
        final List<MonitoredItemNotification> notifications = new ArrayList<>(triggered.size() + queue.size());
        for (DataValue value : triggered) {
            notifications.add(new MonitoredItemNotification(clientHandle, value));
        }
        triggered.clear();
        if (monitoringMode == MonitoringMode.Reporting) {
            for (DataValue value : queue) {
                notifications.add(new MonitoredItemNotification(clientHandle, value));
            }
            queue.clear();
        }
        return notifications;
    }

    /**
     * @return the number of values currently queued.
     */
    public synchronized int getQueueLength() {
        return queue.size();
    }

    /**
     * Changes the monitoring mode. Disabling the item discards its queued and triggered values. Leaving the disabled mode takes a new sample
     * immediately, which is reported regardless of the filter.
     * @param mode the new monitoring mode
     */
    public void setMonitoringMode(MonitoringMode mode) {
        final boolean resumed;
        synchronized (this) {
            resumed = monitoringMode == MonitoringMode.Disabled && mode != MonitoringMode.Disabled;
            monitoringMode = mode;
            if (mode == MonitoringMode.Disabled) {
                queue.clear();
                triggered.clear();
                lastValue = null;
            }
        }
        if (resumed) {
            sample();
        }
    }

    /**
     * Applies revised monitoring parameters. If the queue shrinks, values are discarded according to the discard
     * policy.
     * @param request          the client's modification request
     * @param samplingInterval the revised sampling interval
     * @param queueSize        the revised queue size
     */
    public synchronized void modify(MonitoredItemModifyRequest request, double samplingInterval, int queueSize) {
        this.clientHandle = request.getClientHandle();
        this.filter = request.getFilter();
        this.discardOldest = request.isDiscardOldest();
        this.queueSize = queueSize;
        shrink(queue);
        shrink(triggered);
        if (samplingInterval != this.samplingInterval) {
            this.samplingInterval = samplingInterval;
            if (samplingTimer != null) {
                samplingTimer.cancel();
                scheduleSampling();
            }
        }
    }

    /**
     * Stops sampling and discards all queued values. Disposing twice has no effect.
     */
    public synchronized void dispose() {
        disposed = true;
        if (samplingTimer != null) {
            samplingTimer.cancel();
            samplingTimer = null;
        }
        queue.clear();
        triggered.clear();
    }

    private void scheduleSampling() {
        samplingTimer = timerService.schedule(TimerPhase.SAMPLING, this::sample, (long) Math.ceil(samplingInterval));
    }

    private void onSampled(DataValue value, Throwable error) {
        final boolean queued;
        synchronized (this) {
            readPending = false;
            if (disposed || monitoringMode == MonitoringMode.Disabled) {
                return;
            }
            if (error != null) {
                final StatusCode statusCode = OPCUAException.statusCodeOf(error);
                if (log.isDebugEnabled()) {
                    log.debug("{} Item {} on node {} reports {}.", ExceptionContext.SAMPLE.getMessage(), id, itemToMonitor.getNodeId(), statusCode, error);
                }
                queued = record(new DataValue(Variant.NULL_VALUE, statusCode, null, now()));
            } else {
                queued = value != null && record(value);
            }
        }
        if (queued) {
            notifyListener();
        }
    }

    private synchronized boolean reportNodeMissing() {
        if (disposed || nodeMissingReported || monitoringMode == MonitoringMode.Disabled) {
            return false;
        }
        log.info("The node {} monitored by item {} was removed from the address space.", itemToMonitor.getNodeId(), id);
        nodeMissingReported = true;
        final DataValue missing = new DataValue(Variant.NULL_VALUE, new StatusCode(StatusCodes.Bad_NodeIdUnknown), null, now());
        lastValue = missing;
        offer(queue, withTimestamps(missing));
        return true;
    }

    private boolean record(DataValue value) {
        if (DataChangeFilters.passes(filter, euRange, lastValue, value)) {
            lastValue = value;
            offer(queue, withTimestamps(value));
            return true;
        }
        return false;
    }

    private void notifyListener() {
        final NotificationListener listener;
        synchronized (this) {
            listener = notificationListener;
        }
        if (listener != null) {
            listener.onNotificationQueued(this);
        }
    }

    private void offer(Deque<DataValue> target, DataValue value) {
        if (target.size() < queueSize) {
            target.addLast(value);
        } else if (discardOldest) {
            target.pollFirst();
            target.addLast(value);
            if (queueSize > 1) {
                target.addFirst(withOverflow(target.pollFirst()));
            }
        } else {
            target.pollLast();
            target.addLast(queueSize > 1 ? withOverflow(value) : value);
        }
    }

    private void shrink(Deque<DataValue> target) {
        while (target.size() > queueSize) {
            if (discardOldest) {
                target.pollFirst();
            } else {
                target.pollLast();
            }
        }
    }

    private DataValue withTimestamps(DataValue value) {
        final DateTime serverTime = value.getServerTime() != null ? value.getServerTime() : now();
        final DateTime sourceTime = value.getSourceTime();
        switch (timestampsToReturn) {
            case Source:
                return new DataValue(value.getValue(), value.getStatusCode(), sourceTime, null);
            case Server:
                return new DataValue(value.getValue(), value.getStatusCode(), null, serverTime);
            case Neither:
                return new DataValue(value.getValue(), value.getStatusCode(), null, null);
            default:
                return new DataValue(value.getValue(), value.getStatusCode(), sourceTime, serverTime);
        }
    }

    private static DataValue withOverflow(DataValue value) {
        final StatusCode statusCode = new StatusCode(value.getStatusCode().getValue() | OVERFLOW_BITS);
        return new DataValue(value.getValue(), statusCode, value.getSourceTime(), value.getServerTime());
    }

    private DateTime now() {
        return new DateTime(new Date(timerService.now()));
    }
}
