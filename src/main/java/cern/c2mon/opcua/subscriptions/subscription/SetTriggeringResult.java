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
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;

import java.util.Collections;
import java.util.List;

/**
 * The outcome of a SetTriggering call. The overall status code is Good as soon as the triggering item was found, even
 * if individual links failed; the per-link outcomes are listed in the order of the request.
 */
@Value
public class SetTriggeringResult {
    StatusCode statusCode;
    List<StatusCode> addResults;
    List<StatusCode> removeResults;

    static SetTriggeringResult failed(long statusCode) {
        return new SetTriggeringResult(new StatusCode(statusCode), Collections.emptyList(), Collections.emptyList());
    }
}
