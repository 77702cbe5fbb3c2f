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

import org.eclipse.milo.opcua.stack.core.StatusCodes;
import org.eclipse.milo.opcua.stack.core.UaException;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;

/**
 * An abstract exception occurring in the context of the subscription service. Errors concerning a single service
 * request are reported as {@link StatusCode}s and never thrown; this hierarchy covers the failures around the service:
 * invalid server limits and a transport that cannot take a response.
 */
public abstract class OPCUAException extends Exception {

    protected OPCUAException(final ExceptionContext context) {
        super(context.getMessage());
    }

    /**
     * Extracts the status code carried by a throwable, if it is an {@link UaException} or wraps one.
     * @param e the throwable to inspect
     * @return the status code of the UaException, or Bad_InternalError if the throwable carries none.
     */
    public static StatusCode statusCodeOf(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof UaException) {
                return ((UaException) current).getStatusCode();
            }
            current = current.getCause();
        }
        return new StatusCode(StatusCodes.Bad_InternalError);
    }
}
