/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.relational;

import java.util.Objects;

import io.slotlander.annotation.Immutable;

/**
 * Unique identifier for a database table within a schema. Names are compared exactly, including case, the same way
 * the logical decoding output reports them.
 */
@Immutable
public final class TableId implements Comparable<TableId> {

    private final String schemaName;
    private final String tableName;
    private final String id;

    /**
     * Create a new table identifier.
     *
     * @param schemaName the name of the schema; may not be null
     * @param tableName the name of the table; may not be null
     */
    public TableId(String schemaName, String tableName) {
        this.schemaName = Objects.requireNonNull(schemaName, "schemaName");
        this.tableName = Objects.requireNonNull(tableName, "tableName");
        this.id = schemaName + "." + tableName;
    }

    /**
     * Get the name of the schema.
     *
     * @return the schema name; never null
     */
    public String schema() {
        return schemaName;
    }

    /**
     * Get the name of the table.
     *
     * @return the table name; never null
     */
    public String table() {
        return tableName;
    }

    /**
     * Returns a dot-separated String representation of this identifier, e.g. {@code db_loja.cliente}.
     *
     * @return the identifier; never null
     */
    public String identifier() {
        return id;
    }

    @Override
    public int compareTo(TableId that) {
        if (this == that) {
            return 0;
        }
        return this.id.compareTo(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof TableId) {
            TableId that = (TableId) obj;
            return this.schemaName.equals(that.schemaName) && this.tableName.equals(that.tableName);
        }
        return false;
    }

    @Override
    public String toString() {
        return identifier();
    }
}
