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

import lombok.RequiredArgsConstructor;

import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * A {@link TimerService} on a virtual clock which only moves when {@link #advance(long)} is called. Tasks due at the
 * same instant run in {@link TimerPhase} order, and in the order they were (re-)armed within a phase, so that a
 * sequence of advances always produces the same interleaving.
 */
public class VirtualTimerService implements TimerService {

    private final PriorityQueue<Deadline> deadlines = new PriorityQueue<>(Comparator
            .comparingLong((Deadline d) -> d.due)
            .thenComparing(d -> d.phase)
            .thenComparingLong(d -> d.insertion));

    private long now;
    private long insertions;

    public VirtualTimerService() {
        this(0L);
    }

    /**
     * Creates a new VirtualTimerService.
     * @param start the time the clock starts at in milliseconds since the epoch.
     */
    public VirtualTimerService(long start) {
        this.now = start;
    }

    @Override
    public synchronized long now() {
        return now;
    }

    @Override
    public synchronized Timer schedule(TimerPhase phase, Runnable task, long period) {
        final Deadline deadline = new Deadline(phase, task, Math.max(1L, period));
        arm(deadline, now + deadline.period);
        return deadline;
    }

    /**
     * Moves the clock forward, running every task which becomes due on the way.
     * @param millis the amount of time to advance the clock by
     */
    public void advance(long millis) {
        final long target;
        synchronized (this) {
            target = now + millis;
        }
        Deadline next;
        while ((next = pollDue(target)) != null) {
            next.task.run();
            synchronized (this) {
                if (!next.cancelled) {
                    arm(next, next.due + next.period);
                }
            }
        }
        synchronized (this) {
            now = target;
        }
    }

    /**
     * @return the number of armed timers.
     */
    public synchronized int pendingTimers() {
        return deadlines.size();
    }

    private synchronized Deadline pollDue(long target) {
        final Deadline next = deadlines.peek();
        if (next == null || next.due > target) {
            return null;
        }
        deadlines.poll();
        now = next.due;
        return next;
    }

    private void arm(Deadline deadline, long due) {
        deadline.due = due;
        deadline.insertion = insertions++;
        deadlines.add(deadline);
    }

    @RequiredArgsConstructor
    private final class Deadline implements Timer {
        private final TimerPhase phase;
        private final Runnable task;
        private final long period;
        private long due;
        private long insertion;
        private boolean cancelled;

        @Override
        public void cancel() {
            synchronized (VirtualTimerService.this) {
                cancelled = true;
                deadlines.remove(this);
            }
        }
    }
}
