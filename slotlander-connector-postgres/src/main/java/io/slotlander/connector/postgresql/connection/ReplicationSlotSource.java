/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.connector.postgresql.connection;

import java.util.List;

import io.slotlander.connector.postgresql.SlotFetchException;

/**
 * A source of changes recorded by a logical replication slot.
 */
public interface ReplicationSlotSource extends AutoCloseable {

    /**
     * Read the next changes from the slot and advance the slot past them.
     * <p>
     * This is a consuming read. When the method returns, the slot's confirmed position has moved beyond every returned
     * entry, so the same entries are never returned again, whether or not the caller manages to store them. There is
     * no way to look at changes without consuming them.
     *
     * @param slotName the name of the logical replication slot; may not be null
     * @param maxEntries the maximum number of entries to return; must be positive
     * @return the entries in ascending log position order; never null but possibly empty
     * @throws IllegalArgumentException if {@code maxEntries} is not positive
     * @throws SlotFetchException if the changes cannot be read
     */
    List<RawChangeEntry> fetchAndAdvance(String slotName, int maxEntries);

    @Override
    void close();
}
