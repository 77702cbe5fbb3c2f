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

import cern.c2mon.opcua.subscriptions.monitoring.MonitoredItem;

/**
 * Receives the monitored item events of a {@link Subscription}. Listeners are called while the subscription is locked
 * and must not block.
 */
public interface MonitoredItemListener {

    /**
     * Called after a monitored item was created, before it takes its first sample. A listener may install its own
     * {@link cern.c2mon.opcua.subscriptions.monitoring.SamplingFunction} here.
     * @param monitoredItem the new item
     */
    void onMonitoredItemCreated(MonitoredItem monitoredItem);

    /**
     * Called after a monitored item was deleted by the client or disposed with its subscription.
     * @param monitoredItem the deleted item
     */
    default void onMonitoredItemDeleted(MonitoredItem monitoredItem) {
    }
}
