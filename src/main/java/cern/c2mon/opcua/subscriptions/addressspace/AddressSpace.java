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
package cern.c2mon.opcua.subscriptions.addressspace;

import org.eclipse.milo.opcua.stack.core.UaException;
import org.eclipse.milo.opcua.stack.core.types.builtin.DataValue;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;
import org.eclipse.milo.opcua.stack.core.types.structured.Range;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The part of the server's address space the subscription service depends on. The node model itself, and the
 * resolution of node identifiers, remain with the implementation.
 */
public interface AddressSpace {

    /**
     * Reads the current value of a Node's attribute.
     * @param nodeId      the Node to read
     * @param attributeId the attribute to read
     * @return the current value, possibly with a bad status code
     * @throws UaException if the attribute cannot be read at all.
     */
    DataValue readAttributeValue(NodeId nodeId, UInteger attributeId) throws UaException;

    /**
     * Reads the current value of a Node's attribute without blocking the caller. Implementations backed by slow
     * sources should override this method; the default completes with the synchronous read.
     * @param nodeId      the Node to read
     * @param attributeId the attribute to read
     * @return a future completing with the current value, or exceptionally if it could not be read.
     */
    default CompletableFuture<DataValue> readAttributeValueAsync(NodeId nodeId, UInteger attributeId) {
        try {
            return CompletableFuture.completedFuture(readAttributeValue(nodeId, attributeId));
        } catch (UaException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * @param nodeId the Node to look up
     * @return true if the Node is currently part of the address space.
     */
    boolean nodeExists(NodeId nodeId);

    /**
     * @param nodeId the Node whose EURange property to find
     * @return the engineering unit range of an analog Node, or an empty Optional if the Node has none.
     */
    Optional<Range> getEuRange(NodeId nodeId);
}
