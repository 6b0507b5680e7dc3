/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.connector.postgresql.connection;

import java.nio.ByteBuffer;

import io.slotlander.annotation.Immutable;

/**
 * Abstraction of a PostgreSQL log sequence number, a pointer to a location in the write-ahead log.
 */
@Immutable
public final class Lsn implements Comparable<Lsn> {

    /**
     * Zero is used to indicate an invalid pointer. Bootstrap skips the first possible WAL segment, so no WAL record
     * can begin at zero.
     */
    public static final Lsn INVALID_LSN = new Lsn(0L);

    private final long value;

    private Lsn(long value) {
        this.value = value;
    }

    /**
     * @param value numeric representation of the position in the write-ahead log stream
     * @return the LSN; never null
     */
    public static Lsn valueOf(long value) {
        if (value == 0L) {
            return INVALID_LSN;
        }
        return new Lsn(value);
    }

    /**
     * Create an LSN from its textual representation.
     *
     * @param strValue two hexadecimal numbers of up to 8 digits each, separated by a slash, e.g. {@code 16/3002D50}
     * @return the LSN, or {@link #INVALID_LSN} if the value is null or does not have the expected form
     */
    public static Lsn valueOf(String strValue) {
        if (strValue == null) {
            return INVALID_LSN;
        }
        final int slashIndex = strValue.lastIndexOf('/');
        if (slashIndex <= 0 || slashIndex == strValue.length() - 1) {
            return INVALID_LSN;
        }

        final long logicalXlog;
        final long segment;
        try {
            logicalXlog = Long.parseLong(strValue.substring(0, slashIndex), 16);
            segment = Long.parseLong(strValue.substring(slashIndex + 1), 16);
        }
        catch (NumberFormatException e) {
            return INVALID_LSN;
        }
        if (logicalXlog > 0xFFFFFFFFL || segment > 0xFFFFFFFFL) {
            return INVALID_LSN;
        }

        final ByteBuffer buf = ByteBuffer.allocate(8);
        buf.putInt((int) logicalXlog);
        buf.putInt((int) segment);
        buf.position(0);
        return valueOf(buf.getLong());
    }

    /**
     * @return numeric representation of the position in the write-ahead log stream
     */
    public long asLong() {
        return value;
    }

    /**
     * @return the position as two hexadecimal numbers separated by a slash, e.g. {@code 16/3002D50}
     */
    public String asString() {
        final ByteBuffer buf = ByteBuffer.allocate(8);
        buf.putLong(value);
        buf.position(0);

        final int logicalXlog = buf.getInt();
        final int segment = buf.getInt();
        return String.format("%X/%X", logicalXlog, segment);
    }

    /**
     * @return true if this is a valid LSN
     */
    public boolean isValid() {
        return this != INVALID_LSN && value != 0L;
    }

    @Override
    public int compareTo(Lsn o) {
        return Long.compareUnsigned(value, o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value == ((Lsn) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "LSN{" + asString() + '}';
    }
}
