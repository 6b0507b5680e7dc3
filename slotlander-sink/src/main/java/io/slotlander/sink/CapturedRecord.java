/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.sink;

import java.time.Instant;
import java.util.Objects;

import io.slotlander.annotation.Immutable;

/**
 * A change of the captured table as it is landed: one row of the output file.
 */
@Immutable
public final class CapturedRecord {

    private final Instant captureTimestamp;
    private final String logPosition;
    private final String operation;
    private final String columnsJson;

    /**
     * @param captureTimestamp the time the batch containing this record was captured; may not be null
     * @param logPosition the position of the change in the source log, e.g. {@code 16/B374D848}; may not be null
     * @param operation the kind of change, e.g. {@code INSERT}; may not be null
     * @param columnsJson the column values as a JSON object; may not be null
     */
    public CapturedRecord(Instant captureTimestamp, String logPosition, String operation, String columnsJson) {
        this.captureTimestamp = Objects.requireNonNull(captureTimestamp, "captureTimestamp");
        this.logPosition = Objects.requireNonNull(logPosition, "logPosition");
        this.operation = Objects.requireNonNull(operation, "operation");
        this.columnsJson = Objects.requireNonNull(columnsJson, "columnsJson");
    }

    public Instant captureTimestamp() {
        return captureTimestamp;
    }

    public String logPosition() {
        return logPosition;
    }

    public String operation() {
        return operation;
    }

    public String columnsJson() {
        return columnsJson;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CapturedRecord that = (CapturedRecord) o;
        return captureTimestamp.equals(that.captureTimestamp)
                && logPosition.equals(that.logPosition)
                && operation.equals(that.operation)
                && columnsJson.equals(that.columnsJson);
    }

    @Override
    public int hashCode() {
        return Objects.hash(captureTimestamp, logPosition, operation, columnsJson);
    }

    @Override
    public String toString() {
        return "CapturedRecord [captureTimestamp=" + captureTimestamp + ", logPosition=" + logPosition + ", operation="
                + operation + ", columns=" + columnsJson + "]";
    }
}
