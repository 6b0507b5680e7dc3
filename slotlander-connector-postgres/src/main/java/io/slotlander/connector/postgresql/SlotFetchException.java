/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.connector.postgresql;

import java.sql.SQLException;

import io.slotlander.SlotlanderException;

/**
 * Raised when changes cannot be read from the replication slot. Such a failure ends the cycle.
 */
public class SlotFetchException extends SlotlanderException {

    private static final long serialVersionUID = 1L;

    private final String slotName;
    private final String sqlState;

    public SlotFetchException(String slotName, String message, Throwable cause) {
        super(message, cause);
        this.slotName = slotName;
        this.sqlState = cause instanceof SQLException ? ((SQLException) cause).getSQLState() : null;
    }

    public String getSlotName() {
        return slotName;
    }

    /**
     * @return the SQL state reported by the server, or null if the failure was not an SQL error
     */
    public String getSqlState() {
        return sqlState;
    }
}
