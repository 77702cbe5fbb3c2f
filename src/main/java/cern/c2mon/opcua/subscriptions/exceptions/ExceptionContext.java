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
package cern.c2mon.opcua.subscriptions.exceptions;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** A complete set of reasons and situations which may trigger an OPCUAException. */
@AllArgsConstructor
public enum ExceptionContext {
    SAMPLE("Could not sample the monitored attribute."),
    SEND_RESPONSE("The transport could not take the publish response."),
    PUBLISHING_INTERVAL("The publishing interval limits are invalid, the minimum must be positive and not exceed the maximum."),
    SAMPLING_INTERVAL("The sampling interval limits are invalid, the minimum must not be negative and not exceed the maximum."),
    KEEP_ALIVE_COUNT("The keep-alive count limits are invalid, the default must be positive and not exceed the maximum."),
    LIFETIME_COUNT("The maximum lifetime count must be at least three times the maximum keep-alive count."),
    QUEUE_SIZE("The queue size limits are invalid, the default must be positive and not exceed the maximum."),
    PUBLISH_REQUESTS("At least one publish request must be accepted per session."),
    RETRANSMISSION_QUEUE("The retransmission queue must hold at least one message."),
    SCHEDULER_THREADS("At least one scheduler thread is required."),
    SESSION_LIMITS("The number of subscriptions and monitored items must be positive.");

    @Getter
    private final String message;
}
