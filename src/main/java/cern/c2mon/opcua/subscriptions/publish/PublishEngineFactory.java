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

import cern.c2mon.opcua.subscriptions.config.AppConfigProperties;
import cern.c2mon.opcua.subscriptions.metrics.MetricProxy;
import cern.c2mon.opcua.subscriptions.scheduling.TimerService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Creates the {@link PublishEngine} of each new session with the server limits, clock and metrics of the application
 * context.
 */
@Component
@RequiredArgsConstructor
public class PublishEngineFactory {

    private final AppConfigProperties properties;
    private final TimerService timerService;
    private final MetricProxy metricProxy;

    /**
     * @param session        the name of the new session
     * @param responseSender the transport answering the session's publish requests
     * @return a PublishEngine without subscriptions.
     */
    public PublishEngine createPublishEngine(String session, ResponseSender responseSender) {
        return new PublishEngine(session, responseSender, properties, timerService, metricProxy);
    }
}
