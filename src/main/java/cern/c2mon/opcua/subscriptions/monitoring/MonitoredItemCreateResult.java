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

import lombok.AllArgsConstructor;
import lombok.Value;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;

import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.uint;

/**
 * The outcome of creating a monitored item. If the statusCode is bad, no item was created and the monitoredItemId is
 * 0.
 */
@Value
@AllArgsConstructor
public class MonitoredItemCreateResult {
    StatusCode statusCode;
    UInteger monitoredItemId;
    double revisedSamplingInterval;
    int revisedQueueSize;

    /**
     * The outcome of validating the requested filter, Good if no filter was requested.
     */
    StatusCode filterResult;

    /**
     * Creates the result of a rejected request.
     * @param statusCode   the reason for the rejection
     * @param filterResult the outcome of the filter validation
     * @return a result without monitored item
     */
    public static MonitoredItemCreateResult rejected(StatusCode statusCode, StatusCode filterResult) {
        return new MonitoredItemCreateResult(statusCode, uint(0), 0, 0, filterResult);
    }
}
