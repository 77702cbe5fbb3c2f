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
package cern.c2mon.opcua.subscriptions.monitoring;

import org.eclipse.milo.opcua.stack.core.AttributeId;
import org.eclipse.milo.opcua.stack.core.StatusCodes;
import org.eclipse.milo.opcua.stack.core.types.builtin.DataValue;
import org.eclipse.milo.opcua.stack.core.types.builtin.DateTime;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;
import org.eclipse.milo.opcua.stack.core.types.builtin.Variant;
import org.eclipse.milo.opcua.stack.core.types.enumerated.DataChangeTrigger;
import org.eclipse.milo.opcua.stack.core.types.enumerated.DeadbandType;
import org.eclipse.milo.opcua.stack.core.types.structured.DataChangeFilter;
import org.eclipse.milo.opcua.stack.core.types.structured.Range;
import org.junit.jupiter.api.Test;

import java.util.Date;

import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.uint;
import static org.junit.jupiter.api.Assertions.*;

public class DataChangeFiltersTest {
    static final DateTime T1 = new DateTime(new Date(1000L));
    static final DateTime T2 = new DateTime(new Date(2000L));
    final Range range = new Range(0.0, 200.0);

    private static DataChangeFilter filter(DataChangeTrigger trigger, DeadbandType type, double deadband) {
        return new DataChangeFilter(trigger, uint(type.getValue()), deadband);
    }

    private static DataValue value(Object o, DateTime sourceTime) {
        return new DataValue(new Variant(o), StatusCode.GOOD, sourceTime, sourceTime);
    }

    @Test
    public void noFilterShouldPassEverySample() {
        assertTrue(DataChangeFilters.passes(null, null, value(1, T1), value(1, T1)));
    }

    @Test
    public void firstSampleShouldAlwaysPass() {
        final DataChangeFilter f = filter(DataChangeTrigger.Status, DeadbandType.None, 0);
        assertTrue(DataChangeFilters.passes(f, null, null, value(1, T1)));
    }

    @Test
    public void statusValueShouldSuppressUnchangedValue() {
        final DataChangeFilter f = filter(DataChangeTrigger.StatusValue, DeadbandType.None, 0);
        assertFalse(DataChangeFilters.passes(f, null, value(1, T1), value(1, T2)));
        assertTrue(DataChangeFilters.passes(f, null, value(1, T1), value(2, T1)));
    }

    @Test
    public void statusTriggerShouldIgnoreValueChanges() {
        final DataChangeFilter f = filter(DataChangeTrigger.Status, DeadbandType.None, 0);
        assertFalse(DataChangeFilters.passes(f, null, value(1, T1), value(2, T2)));
    }

    @Test
    public void statusChangeShouldPassAnyTrigger() {
        final DataChangeFilter f = filter(DataChangeTrigger.Status, DeadbandType.None, 0);
        final DataValue bad = new DataValue(new Variant(1), new StatusCode(StatusCodes.Bad_NoCommunication), T1, T1);
        assertTrue(DataChangeFilters.passes(f, null, value(1, T1), bad));
    }

    @Test
    public void statusValueTimestampShouldPassNewSourceTime() {
        final DataChangeFilter f = filter(DataChangeTrigger.StatusValueTimestamp, DeadbandType.None, 0);
        assertTrue(DataChangeFilters.passes(f, null, value(1, T1), value(1, T2)));
        assertFalse(DataChangeFilters.passes(f, null, value(1, T1), value(1, T1)));
    }

    @Test
    public void absoluteDeadbandShouldSuppressSmallChanges() {
        final DataChangeFilter f = filter(DataChangeTrigger.StatusValue, DeadbandType.Absolute, 5);
        assertFalse(DataChangeFilters.passes(f, null, value(10.0, T1), value(15.0, T1)));
        assertTrue(DataChangeFilters.passes(f, null, value(10.0, T1), value(15.5, T1)));
        assertTrue(DataChangeFilters.passes(f, null, value(10.0, T1), value(4.0, T1)));
    }

    @Test
    public void percentDeadbandShouldScaleWithEuRange() {
        final DataChangeFilter f = filter(DataChangeTrigger.StatusValue, DeadbandType.Percent, 10);
        assertFalse(DataChangeFilters.passes(f, range, value(100, T1), value(120, T1)));
        assertTrue(DataChangeFilters.passes(f, range, value(100, T1), value(121, T1)));
    }

    @Test
    public void deadbandOnArraysShouldApplyPerElement() {
        final DataChangeFilter f = filter(DataChangeTrigger.StatusValue, DeadbandType.Absolute, 1);
        assertFalse(DataChangeFilters.passes(f, null, value(new Double[]{1.0, 2.0}, T1), value(new Double[]{1.5, 2.5}, T1)));
        assertTrue(DataChangeFilters.passes(f, null, value(new Double[]{1.0, 2.0}, T1), value(new Double[]{1.0, 4.0}, T1)));
        assertTrue(DataChangeFilters.passes(f, null, value(new Double[]{1.0, 2.0}, T1), value(new Double[]{1.0}, T1)));
    }

    @Test
    public void validateWithoutFilterShouldBeGood() {
        assertEquals(StatusCode.GOOD, DataChangeFilters.validate(null, AttributeId.DisplayName.uid(), null, null));
    }

    @Test
    public void filterOnOtherAttributeThanValueShouldNotBeAllowed() {
        final DataChangeFilter f = filter(DataChangeTrigger.StatusValue, DeadbandType.None, 0);
        final StatusCode result = DataChangeFilters.validate(f, AttributeId.DisplayName.uid(), null, null);
        assertEquals(StatusCodes.Bad_FilterNotAllowed, result.getValue());
    }

    @Test
    public void percentDeadbandWithoutEuRangeShouldBeInvalid() {
        final DataChangeFilter f = filter(DataChangeTrigger.StatusValue, DeadbandType.Percent, 10);
        final StatusCode result = DataChangeFilters.validate(f, AttributeId.Value.uid(), null, value(1.0, T1));
        assertEquals(StatusCodes.Bad_DeadbandFilterInvalid, result.getValue());
    }

    @Test
    public void percentDeadbandAbove100ShouldBeInvalid() {
        final DataChangeFilter f = filter(DataChangeTrigger.StatusValue, DeadbandType.Percent, 101);
        final StatusCode result = DataChangeFilters.validate(f, AttributeId.Value.uid(), range, value(1.0, T1));
        assertEquals(StatusCodes.Bad_DeadbandFilterInvalid, result.getValue());
    }

    @Test
    public void deadbandOnTextShouldBeInvalid() {
        final DataChangeFilter f = filter(DataChangeTrigger.StatusValue, DeadbandType.Absolute, 1);
        final StatusCode result = DataChangeFilters.validate(f, AttributeId.Value.uid(), null, value("text", T1));
        assertEquals(StatusCodes.Bad_DeadbandFilterInvalid, result.getValue());
    }

    @Test
    public void absoluteDeadbandOnNumberShouldBeGood() {
        final DataChangeFilter f = filter(DataChangeTrigger.StatusValue, DeadbandType.Absolute, 1);
        assertTrue(DataChangeFilters.validate(f, AttributeId.Value.uid(), null, value(1, T1)).isGood());
    }
}
