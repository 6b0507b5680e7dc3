/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.connector.postgresql.connection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import io.slotlander.annotation.Immutable;
import io.slotlander.relational.TableId;

/**
 * A row-level change decoded from a single {@code test_decoding} line. Column values are kept in the textual form
 * the plugin printed them, in the order they appeared on the line.
 */
@Immutable
public final class DecodedChange {

    /**
     * The kind of row change.
     */
    public enum Operation {
        INSERT,
        UPDATE,
        DELETE;

        /**
         * Obtain the operation for the keyword printed by the output plugin.
         *
         * @param keyword the keyword, e.g. {@code INSERT}; may be null
         * @return the operation, or null if the keyword does not name a row operation
         */
        public static Operation forKeyword(String keyword) {
            for (Operation operation : values()) {
                if (operation.name().equals(keyword)) {
                    return operation;
                }
            }
            return null;
        }
    }

    private final TableId tableId;
    private final Operation operation;
    private final Map<String, String> columns;

    public DecodedChange(TableId tableId, Operation operation, Map<String, String> columns) {
        this.tableId = Objects.requireNonNull(tableId, "tableId");
        this.operation = Objects.requireNonNull(operation, "operation");
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public TableId tableId() {
        return tableId;
    }

    public String schema() {
        return tableId.schema();
    }

    public String table() {
        return tableId.table();
    }

    public Operation operation() {
        return operation;
    }

    /**
     * @return the column values keyed by column name, in line order; never null but empty for {@code (no-tuple-data)}
     */
    public Map<String, String> columns() {
        return columns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DecodedChange that = (DecodedChange) o;
        return tableId.equals(that.tableId)
                && operation == that.operation
                && columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableId, operation, columns);
    }

    @Override
    public String toString() {
        return "DecodedChange [table=" + tableId + ", operation=" + operation + ", columns=" + columns + "]";
    }
}
