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

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * A {@link TimerService} running on wall-clock time. Tasks are executed on a shared pool of scheduler threads. The
 * {@link TimerPhase} is not honored beyond best effort, as two tasks due at the same instant may run concurrently.
 */
@Slf4j
public class ExecutorTimerService implements TimerService {

    private final ScheduledExecutorService executor;

    /**
     * Creates a new ExecutorTimerService.
     * @param threads the number of threads executing the scheduled tasks
     */
    public ExecutorTimerService(int threads) {
        this.executor = Executors.newScheduledThreadPool(threads);
    }

    @Override
    public long now() {
        return System.currentTimeMillis();
    }

    @Override
    public Timer schedule(TimerPhase phase, Runnable task, long period) {
        final long delay = Math.max(1L, period);
        final ScheduledFuture<?> future = executor.scheduleAtFixedRate(() -> runGuarded(task), delay, delay, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    /**
     * Stops all timers. Tasks in progress complete.
     */
    public void shutdown() {
        log.info("Shutting down the subscription timers.");
        executor.shutdown();
    }

    private static void runGuarded(Runnable task) {
        // a task throwing out of scheduleAtFixedRate is never run again
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("A scheduled task failed. It will be executed again on its next period.", e);
        }
    }
}
