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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ExecutorTimerServiceTest {
    ExecutorTimerService timerService;

    @BeforeEach
    public void setUp() {
        timerService = new ExecutorTimerService(1);
    }

    @AfterEach
    public void tearDown() {
        timerService.shutdown();
    }

    @Test
    public void timerShouldRunRepeatedly() throws InterruptedException {
        final CountDownLatch latch = new CountDownLatch(3);
        timerService.schedule(TimerPhase.SAMPLING, latch::countDown, 2);
        assertTrue(latch.await(1, TimeUnit.SECONDS));
    }

    @Test
    public void failingTaskShouldRunAgainOnNextPeriod() throws InterruptedException {
        final CountDownLatch latch = new CountDownLatch(2);
        timerService.schedule(TimerPhase.PUBLISHING, () -> {
            latch.countDown();
            throw new IllegalStateException("test");
        }, 2);
        assertTrue(latch.await(1, TimeUnit.SECONDS));
    }

    @Test
    public void cancelledTimerShouldStopRunning() throws InterruptedException {
        final CountDownLatch latch = new CountDownLatch(1);
        final Timer timer = timerService.schedule(TimerPhase.SAMPLING, latch::countDown, 50);
        timer.cancel();
        assertFalse(latch.await(150, TimeUnit.MILLISECONDS));
    }
}
