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

/**
 * The states of a {@link Subscription} (see <a href="https://reference.opcfoundation.org/v104/Core/docs/Part4/5.13.1">UA
 * Part 4, 5.13.1</a>). CLOSED is terminal.
 */
public enum SubscriptionState {
    /**
     * Created, the first publishing cycle has not completed yet.
     */
    CREATING,
    NORMAL,
    /**
     * A notification message or keep-alive is ready, but no publish request is available to carry it.
     */
    LATE,
    /**
     * The last message sent was a keep-alive.
     */
    KEEPALIVE,
    CLOSED
}
