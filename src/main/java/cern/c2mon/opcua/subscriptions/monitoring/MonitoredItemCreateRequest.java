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

import lombok.Builder;
import lombok.Value;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;
import org.eclipse.milo.opcua.stack.core.types.enumerated.MonitoringMode;
import org.eclipse.milo.opcua.stack.core.types.structured.DataChangeFilter;
import org.eclipse.milo.opcua.stack.core.types.structured.ReadValueId;

/**
 * A client's request to monitor one attribute of a Node, along with the requested monitoring parameters. The
 * parameters are revised by the server on creation.
 */
@Value
@Builder(toBuilder = true)
public class MonitoredItemCreateRequest {

    ReadValueId itemToMonitor;

    @Builder.Default
    MonitoringMode monitoringMode = MonitoringMode.Reporting;

    /**
     * Chosen by the client and returned in every notification of the item.
     */
    UInteger clientHandle;

    /**
     * The requested sampling interval in milliseconds. A negative value requests the publishing interval of the
     * subscription, 0 the fastest sampling interval the server supports.
     */
    @Builder.Default
    double samplingInterval = -1;

    /**
     * Null to report every sample.
     */
    DataChangeFilter filter;

    @Builder.Default
    int queueSize = 1;

    @Builder.Default
    boolean discardOldest = true;
}
