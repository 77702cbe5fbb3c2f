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

import com.google.common.collect.ImmutableList;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The triggering links of a subscription: a directed graph from triggering items to the items they report, keyed by
 * monitored item ids. A reverse index from items to report to their triggering items makes removing either end of a
 * link a direct lookup. Not thread-safe: the owning {@link Subscription} serializes all access.
 */
public class TriggeringTable {

    private final Map<UInteger, Set<UInteger>> linksByTrigger = new HashMap<>();
    private final Map<UInteger, Set<UInteger>> triggersByReportItem = new HashMap<>();

    /**
     * Links an item to report to a triggering item. Adding an existing link leaves it unchanged.
     * @param triggerId    the id of the triggering item
     * @param reportItemId the id of the item to report
     * @return true if the link was added, false if it existed already.
     */
    public boolean addLink(UInteger triggerId, UInteger reportItemId) {
        if (!linksByTrigger.computeIfAbsent(triggerId, k -> new LinkedHashSet<>()).add(reportItemId)) {
            return false;
        }
        triggersByReportItem.computeIfAbsent(reportItemId, k -> new LinkedHashSet<>()).add(triggerId);
        return true;
    }

    /**
     * @param triggerId    the id of the triggering item
     * @param reportItemId the id of the item to report
     * @return true if the link existed.
     */
    public boolean removeLink(UInteger triggerId, UInteger reportItemId) {
        final Set<UInteger> links = linksByTrigger.get(triggerId);
        if (links == null || !links.remove(reportItemId)) {
            return false;
        }
        if (links.isEmpty()) {
            linksByTrigger.remove(triggerId);
        }
        final Set<UInteger> triggers = triggersByReportItem.get(reportItemId);
        triggers.remove(triggerId);
        if (triggers.isEmpty()) {
            triggersByReportItem.remove(reportItemId);
        }
        return true;
    }

    /**
     * Removes every link the item takes part in, as triggering item or as item to report.
     * @param itemId the id of a deleted monitored item
     */
    public void removeItem(UInteger itemId) {
        final Set<UInteger> outgoing = linksByTrigger.get(itemId);
        if (outgoing != null) {
            for (UInteger reportItemId : ImmutableList.copyOf(outgoing)) {
                removeLink(itemId, reportItemId);
            }
        }
        final Set<UInteger> incoming = triggersByReportItem.get(itemId);
        if (incoming != null) {
            for (UInteger triggerId : ImmutableList.copyOf(incoming)) {
                removeLink(triggerId, itemId);
            }
        }
    }

    /**
     * @param triggerId the id of a monitored item
     * @return the ids of the items it reports in the order they were linked, empty if the item triggers nothing.
     */
    public List<UInteger> linksOf(UInteger triggerId) {
        final Set<UInteger> links = linksByTrigger.get(triggerId);
        return links == null ? Collections.emptyList() : ImmutableList.copyOf(links);
    }
}
