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

import cern.c2mon.opcua.subscriptions.subscription.NotificationMessage;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;

import java.util.List;

/**
 * The answer to a {@link PublishRequest}. If the serviceResult is bad, the result carries neither subscription nor
 * message.
 */
@Value
@Builder
public class PublishResult {

    UInteger requestHandle;

    @Builder.Default
    StatusCode serviceResult = StatusCode.GOOD;

    UInteger subscriptionId;

    /**
     * The sequence numbers of the subscription's sent messages which have not been acknowledged yet.
     */
    @Singular
    List<UInteger> availableSequenceNumbers;

    /**
     * True if the subscription holds further messages which did not fit into this response.
     */
    boolean moreNotifications;

    NotificationMessage notificationMessage;

    /**
     * The outcome of each acknowledgement of the request, in request order.
     */
    @Singular
    List<StatusCode> results;
}
