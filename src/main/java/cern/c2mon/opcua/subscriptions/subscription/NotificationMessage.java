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

import lombok.Value;
import org.eclipse.milo.opcua.stack.core.types.builtin.DateTime;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;
import org.eclipse.milo.opcua.stack.core.types.structured.DataChangeNotification;
import org.eclipse.milo.opcua.stack.core.types.structured.NotificationData;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A batch of notifications produced by one publishing cycle of a {@link Subscription}. A message without notification
 * data is a keep-alive, which carries the sequence number the next data message will use.
 */
@Value
public class NotificationMessage {
    UInteger sequenceNumber;
    DateTime publishTime;
    List<NotificationData> notificationData;

    public boolean isKeepAlive() {
        return notificationData.isEmpty();
    }

    /**
     * @return the data change notifications contained in the message.
     */
    public List<DataChangeNotification> getDataChangeNotifications() {
        return notificationData.stream()
                .filter(DataChangeNotification.class::isInstance)
                .map(DataChangeNotification.class::cast)
                .collect(Collectors.toList());
    }
}
