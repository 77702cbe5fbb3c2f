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

import org.eclipse.milo.opcua.stack.core.types.builtin.DataValue;

import java.util.concurrent.CompletableFuture;

/**
 * Acquires a new sample for a {@link MonitoredItem}. By default an item reads its attribute from the address space; a
 * listener on monitored item creation may install another function, for instance to sample a device directly.
 */
@FunctionalInterface
public interface SamplingFunction {

    /**
     * @param lastValue the last value queued by the item, or null if none was queued yet
     * @return a future completing with the new sample.
     */
    CompletableFuture<DataValue> sample(DataValue lastValue);
}
