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

import cern.c2mon.opcua.subscriptions.monitoring.MonitoredItemCreateRequest;
import cern.c2mon.opcua.subscriptions.publish.PublishRequest;
import cern.c2mon.opcua.subscriptions.subscription.NotificationMessage;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.eclipse.milo.opcua.stack.core.AttributeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.QualifiedName;
import org.eclipse.milo.opcua.stack.core.types.enumerated.MonitoringMode;
import org.eclipse.milo.opcua.stack.core.types.structured.MonitoredItemNotification;
import org.eclipse.milo.opcua.stack.core.types.structured.ReadValueId;
import org.eclipse.milo.opcua.stack.core.types.structured.SubscriptionAcknowledgement;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.uint;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public abstract class TestUtils {

    public static NodeId node(int id) {
        return new NodeId(2, id);
    }

    public static ReadValueId valueOf(NodeId nodeId) {
        return new ReadValueId(nodeId, AttributeId.Value.uid(), null, QualifiedName.NULL_VALUE);
    }

    /**
     * A request to monitor the value of a Node, using the client handle as the Node's numeric identifier. The item
     * samples every 100 milliseconds into a queue of 10 values.
     */
    public static MonitoredItemCreateRequest monitor(int clientHandle, MonitoringMode mode) {
        return MonitoredItemCreateRequest.builder()
                .itemToMonitor(valueOf(node(clientHandle)))
                .clientHandle(uint(clientHandle))
                .monitoringMode(mode)
                .samplingInterval(100)
                .queueSize(10)
                .build();
    }

    public static PublishRequest publishRequest(int handle, SubscriptionAcknowledgement... acknowledgements) {
        return PublishRequest.builder()
                .requestHandle(uint(handle))
                .subscriptionAcknowledgements(Arrays.asList(acknowledgements))
                .build();
    }

    public static List<MonitoredItemNotification> notifications(NotificationMessage message) {
        return message.getDataChangeNotifications().stream()
                .flatMap(n -> Arrays.stream(n.getMonitoredItems()))
                .collect(Collectors.toList());
    }

    public static List<Integer> clientHandles(NotificationMessage message) {
        return notifications(message).stream()
                .map(n -> n.getClientHandle().intValue())
                .collect(Collectors.toList());
    }

    public static List<Integer> clientHandles(List<NotificationMessage> messages) {
        return messages.stream()
                .flatMap(m -> clientHandles(m).stream())
                .collect(Collectors.toList());
    }
}
