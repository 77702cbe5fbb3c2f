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

import cern.c2mon.opcua.subscriptions.testutils.SubscriptionTestBase;
import org.eclipse.milo.opcua.stack.core.StatusCodes;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;
import org.eclipse.milo.opcua.stack.core.types.enumerated.MonitoringMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.uint;
import static org.junit.jupiter.api.Assertions.*;

public class SetTriggeringTest extends SubscriptionTestBase {
    static final UInteger UNKNOWN = uint(999);
    static final StatusCode ID_INVALID = new StatusCode(StatusCodes.Bad_MonitoredItemIdInvalid);

    UInteger trigger;
    List<UInteger> reportItems;

    @BeforeEach
    public void setUp() {
        super.setUp();
        trigger = create(1, MonitoringMode.Reporting);
        reportItems = new ArrayList<>();
        for (int i = 2; i <= 5; i++) {
            reportItems.add(create(i, MonitoringMode.Sampling));
        }
    }

    @Test
    public void emptyListsShouldReturnNothingToDo() {
        final SetTriggeringResult result = subscription.setTriggering(trigger, Collections.emptyList(), Collections.emptyList());
        assertEquals(StatusCodes.Bad_NothingToDo, result.getStatusCode().getValue());
        assertTrue(result.getAddResults().isEmpty());
        assertTrue(result.getRemoveResults().isEmpty());
    }

    @Test
    public void nullListsShouldReturnNothingToDo() {
        assertEquals(StatusCodes.Bad_NothingToDo, subscription.setTriggering(trigger, null, null).getStatusCode().getValue());
    }

    @Test
    public void emptyListsWithUnknownTriggerShouldReturnNothingToDo() {
        final SetTriggeringResult result = subscription.setTriggering(UNKNOWN, Collections.emptyList(), Collections.emptyList());
        assertEquals(StatusCodes.Bad_NothingToDo, result.getStatusCode().getValue());
    }

    @Test
    public void unknownTriggerShouldReturnMonitoredItemIdInvalid() {
        final SetTriggeringResult result = subscription.setTriggering(UNKNOWN, reportItems, Collections.emptyList());
        assertEquals(ID_INVALID, result.getStatusCode());
        assertTrue(result.getAddResults().isEmpty());
    }

    @Test
    public void unknownTriggerWithUnknownLinksShouldReturnMonitoredItemIdInvalid() {
        final SetTriggeringResult result = subscription.setTriggering(UNKNOWN, Collections.singletonList(UNKNOWN), Collections.singletonList(UNKNOWN));
        assertEquals(ID_INVALID, result.getStatusCode());
    }

    @Test
    public void validLinksShouldAllBeGoodInRequestOrder() {
        final List<UInteger> reversed = new ArrayList<>(reportItems);
        Collections.reverse(reversed);
        final SetTriggeringResult result = subscription.setTriggering(trigger, reversed, Collections.emptyList());
        assertTrue(result.getStatusCode().isGood());
        assertEquals(reversed.size(), result.getAddResults().size());
        assertTrue(result.getAddResults().stream().allMatch(StatusCode::isGood));
        assertEquals(reversed, subscription.getLinkedItems(trigger));
    }

    @Test
    public void unknownLinkShouldFailOnlyItsOwnEntry() {
        final SetTriggeringResult result = subscription.setTriggering(trigger,
                Arrays.asList(reportItems.get(0), UNKNOWN, reportItems.get(1)), Collections.emptyList());
        assertTrue(result.getStatusCode().isGood());
        assertEquals(Arrays.asList(StatusCode.GOOD, ID_INVALID, StatusCode.GOOD), result.getAddResults());
        assertEquals(Arrays.asList(reportItems.get(0), reportItems.get(1)), subscription.getLinkedItems(trigger));
    }

    @Test
    public void linkToItselfShouldBeRejected() {
        final SetTriggeringResult result = subscription.setTriggering(trigger, Collections.singletonList(trigger), Collections.emptyList());
        assertTrue(result.getStatusCode().isGood());
        assertEquals(Collections.singletonList(ID_INVALID), result.getAddResults());
        assertTrue(subscription.getLinkedItems(trigger).isEmpty());
    }

    @Test
    public void addingLinkTwiceShouldBeGoodAndKeepOneLink() {
        final List<UInteger> twice = Arrays.asList(reportItems.get(0), reportItems.get(0));
        final SetTriggeringResult result = subscription.setTriggering(trigger, twice, Collections.emptyList());
        assertEquals(Arrays.asList(StatusCode.GOOD, StatusCode.GOOD), result.getAddResults());
        assertEquals(1, subscription.getLinkedItems(trigger).size());
    }

    @Test
    public void removeShouldReportPerEntry() {
        subscription.setTriggering(trigger, reportItems, Collections.emptyList());
        final SetTriggeringResult result = subscription.setTriggering(trigger, Collections.emptyList(),
                Arrays.asList(reportItems.get(1), UNKNOWN, reportItems.get(3)));
        assertTrue(result.getStatusCode().isGood());
        assertTrue(result.getAddResults().isEmpty());
        assertEquals(Arrays.asList(StatusCode.GOOD, ID_INVALID, StatusCode.GOOD), result.getRemoveResults());
        assertEquals(Arrays.asList(reportItems.get(0), reportItems.get(2)), subscription.getLinkedItems(trigger));
    }

    @Test
    public void removingAbsentLinkBetweenExistingItemsShouldBeGood() {
        final SetTriggeringResult result = subscription.setTriggering(trigger, Collections.emptyList(), Collections.singletonList(reportItems.get(0)));
        assertEquals(Collections.singletonList(StatusCode.GOOD), result.getRemoveResults());
    }

    @Test
    public void addAndRemoveShouldBeAppliedInOneCall() {
        subscription.setTriggering(trigger, Collections.singletonList(reportItems.get(0)), Collections.emptyList());
        final SetTriggeringResult result = subscription.setTriggering(trigger,
                Collections.singletonList(reportItems.get(1)), Collections.singletonList(reportItems.get(0)));
        assertEquals(Collections.singletonList(StatusCode.GOOD), result.getAddResults());
        assertEquals(Collections.singletonList(StatusCode.GOOD), result.getRemoveResults());
        assertEquals(Collections.singletonList(reportItems.get(1)), subscription.getLinkedItems(trigger));
    }
}
