/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.connector.postgresql.connection;

import java.util.Objects;

import io.slotlander.annotation.Immutable;

/**
 * One row returned by a logical replication slot: the position of the change in the WAL, the id of the transaction
 * that produced it and the textual payload of the output plugin.
 */
@Immutable
public final class RawChangeEntry {

    private final Lsn logPosition;
    private final long transactionId;
    private final String payload;

    public RawChangeEntry(Lsn logPosition, long transactionId, String payload) {
        this.logPosition = Objects.requireNonNull(logPosition, "logPosition");
        this.transactionId = transactionId;
        this.payload = payload;
    }

    public Lsn logPosition() {
        return logPosition;
    }

    public long transactionId() {
        return transactionId;
    }

    /**
     * @return the text emitted by the output plugin; may be null
     */
    public String payload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RawChangeEntry that = (RawChangeEntry) o;
        return transactionId == that.transactionId
                && logPosition.equals(that.logPosition)
                && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(logPosition, transactionId, payload);
    }

    @Override
    public String toString() {
        return "RawChangeEntry [lsn=" + logPosition.asString() + ", xid=" + transactionId + ", payload=" + payload + "]";
    }
}
