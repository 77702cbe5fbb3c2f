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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;
import org.eclipse.milo.opcua.stack.core.types.structured.SubscriptionAcknowledgement;

import java.util.List;

/**
 * A publish request of a session, as decoded by the transport. The request carries the acknowledgements of messages
 * the client received, and is answered by exactly one {@link PublishResult}.
 */
@Value
@Builder
public class PublishRequest {

    UInteger requestHandle;

    @Singular
    List<SubscriptionAcknowledgement> subscriptionAcknowledgements;

    /**
     * The time in milliseconds after which the client gives up on the request. 0 if the client gave no hint.
     */
    long timeoutHint;
}
