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

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.eclipse.milo.opcua.stack.core.AttributeId;
import org.eclipse.milo.opcua.stack.core.StatusCodes;
import org.eclipse.milo.opcua.stack.core.types.builtin.DataValue;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;
import org.eclipse.milo.opcua.stack.core.types.enumerated.DataChangeTrigger;
import org.eclipse.milo.opcua.stack.core.types.enumerated.DeadbandType;
import org.eclipse.milo.opcua.stack.core.types.structured.DataChangeFilter;
import org.eclipse.milo.opcua.stack.core.types.structured.Range;

import java.lang.reflect.Array;
import java.util.Objects;

/**
 * Evaluates a {@link DataChangeFilter} against two consecutive samples of a monitored attribute (see <a
 * href="https://reference.opcfoundation.org/v104/Core/docs/Part4/7.17.2">UA Part 4, 7.17.2</a>).
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class DataChangeFilters {

    /**
     * Checks whether a filter can be applied to a monitored attribute.
     * @param filter      the requested filter, may be null
     * @param attributeId the monitored attribute
     * @param euRange     the engineering unit range of the monitored Node, may be null
     * @param current     the current value of the attribute, may be null if unknown
     * @return Good if the filter is applicable, otherwise Bad_FilterNotAllowed or Bad_DeadbandFilterInvalid.
     */
    public static StatusCode validate(DataChangeFilter filter, UInteger attributeId, Range euRange, DataValue current) {
        if (filter == null) {
            return StatusCode.GOOD;
        }
        if (!AttributeId.Value.uid().equals(attributeId)) {
            return new StatusCode(StatusCodes.Bad_FilterNotAllowed);
        }
        final DeadbandType deadbandType = deadbandTypeOf(filter);
        if (deadbandType == null) {
            return new StatusCode(StatusCodes.Bad_DeadbandFilterInvalid);
        }
        if (deadbandType == DeadbandType.None) {
            return StatusCode.GOOD;
        }
        final double deadband = filter.getDeadbandValue() == null ? 0 : filter.getDeadbandValue();
        if (deadband < 0 || !isNumeric(current)) {
            return new StatusCode(StatusCodes.Bad_DeadbandFilterInvalid);
        }
        if (deadbandType == DeadbandType.Percent && (euRange == null || deadband > 100)) {
            return new StatusCode(StatusCodes.Bad_DeadbandFilterInvalid);
        }
        return StatusCode.GOOD;
    }

    /**
     * Decides whether a new sample is reported. Without a filter every sample is reported.
     * @param filter   the filter of the monitored item, may be null
     * @param euRange  the engineering unit range used for percent deadbands, may be null
     * @param previous the last value reported, null if none was reported yet
     * @param current  the new sample
     * @return true if the new sample shall be queued.
     */
    public static boolean passes(DataChangeFilter filter, Range euRange, DataValue previous, DataValue current) {
        if (filter == null || previous == null) {
            return true;
        }
        if (!Objects.equals(previous.getStatusCode(), current.getStatusCode())) {
            return true;
        }
        final DataChangeTrigger trigger = filter.getTrigger() == null ? DataChangeTrigger.StatusValue : filter.getTrigger();
        if (trigger == DataChangeTrigger.Status) {
            return false;
        }
        if (trigger == DataChangeTrigger.StatusValueTimestamp
                && !Objects.equals(previous.getSourceTime(), current.getSourceTime())) {
            return true;
        }
        return valueChanged(filter, euRange, previous.getValue().getValue(), current.getValue().getValue());
    }

    private static boolean valueChanged(DataChangeFilter filter, Range euRange, Object previous, Object current) {
        final DeadbandType deadbandType = deadbandTypeOf(filter);
        if (deadbandType == null || deadbandType == DeadbandType.None) {
            return !Objects.deepEquals(previous, current);
        }
        final double threshold = threshold(deadbandType, filter.getDeadbandValue(), euRange);
        if (previous != null && current != null && previous.getClass().isArray() && current.getClass().isArray()) {
            final int length = Array.getLength(current);
            if (Array.getLength(previous) != length) {
                return true;
            }
            for (int i = 0; i < length; i++) {
                if (exceeds(Array.get(previous, i), Array.get(current, i), threshold)) {
                    return true;
                }
            }
            return false;
        }
        return exceeds(previous, current, threshold);
    }

    private static boolean exceeds(Object previous, Object current, double threshold) {
        if (previous instanceof Number && current instanceof Number) {
            return Math.abs(((Number) current).doubleValue() - ((Number) previous).doubleValue()) > threshold;
        }
        return !Objects.deepEquals(previous, current);
    }

    private static double threshold(DeadbandType deadbandType, Double deadbandValue, Range euRange) {
        final double deadband = deadbandValue == null ? 0 : deadbandValue;
        if (deadbandType == DeadbandType.Percent) {
            if (euRange == null || euRange.getHigh() == null || euRange.getLow() == null) {
                return 0;
            }
            return deadband / 100 * Math.abs(euRange.getHigh() - euRange.getLow());
        }
        return deadband;
    }

    private static DeadbandType deadbandTypeOf(DataChangeFilter filter) {
        final UInteger type = filter.getDeadbandType();
        return type == null ? DeadbandType.None : DeadbandType.from(type.intValue());
    }

    private static boolean isNumeric(DataValue value) {
        if (value == null || value.getValue() == null || value.getValue().isNull()) {
            return true;
        }
        final Object o = value.getValue().getValue();
        if (o.getClass().isArray()) {
            return Array.getLength(o) == 0 || Array.get(o, 0) instanceof Number;
        }
        return o instanceof Number;
    }
}
