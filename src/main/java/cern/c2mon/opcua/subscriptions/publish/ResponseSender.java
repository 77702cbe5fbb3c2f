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

import cern.c2mon.opcua.subscriptions.exceptions.CommunicationException;

/**
 * The transport capability of a session to return the answer to a publish request. Implementations hand the result
 * over to the secure channel and return without waiting for it to be written.
 */
@FunctionalInterface
public interface ResponseSender {

    /**
     * @param request the request being answered
     * @param result  the answer
     * @throws CommunicationException if the transport cannot take the answer, for instance because the channel was
     *                                closed.
     */
    void send(PublishRequest request, PublishResult result) throws CommunicationException;
}
