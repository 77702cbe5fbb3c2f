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

import lombok.Builder;
import lombok.Value;

/**
 * The parameters a client requests for a subscription. The server revises them into its configured limits.
 */
@Value
@Builder
public class SubscriptionParameters {

    @Builder.Default
    double publishingInterval = 1000;

    /**
     * 0 requests the server's default keep-alive count.
     */
    @Builder.Default
    int maxKeepAliveCount = 10;

    /**
     * Raised to three times the revised keep-alive count if lower.
     */
    @Builder.Default
    int lifetimeCount = 30;

    /**
     * 0 requests no limit beyond the server's own.
     */
    @Builder.Default
    int maxNotificationsPerPublish = 0;

    @Builder.Default
    boolean publishingEnabled = true;
}
