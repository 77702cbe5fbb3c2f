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
package cern.c2mon.opcua.subscriptions.scheduling;

/**
 * The clock driving sampling and publishing. Every periodic activity of the subscription service is scheduled through
 * a TimerService, so that the same code runs against wall-clock time in production and against a {@link
 * VirtualTimerService} in tests.
 */
public interface TimerService {

    /**
     * @return the current time of this clock in milliseconds since the epoch.
     */
    long now();

    /**
     * Schedules a task to run periodically, first after one period has elapsed.
     * @param phase  decides the order of tasks becoming due at the same instant: sampling precedes publishing.
     * @param task   the task to run
     * @param period the time in between two executions in milliseconds
     * @return a handle to cancel the periodic execution
     */
    Timer schedule(TimerPhase phase, Runnable task, long period);
}
