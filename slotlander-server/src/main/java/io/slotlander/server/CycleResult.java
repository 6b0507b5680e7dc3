/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.server;

import java.util.Optional;

import io.slotlander.annotation.Immutable;

/**
 * The outcome of one pipeline cycle.
 */
@Immutable
public final class CycleResult {

    /**
     * The states a cycle passes through. A finished cycle is either {@link #DONE} or {@link #FAILED}.
     */
    public enum State {
        START,
        FETCHING,
        DECODING_FILTERING,
        WRITING,
        DONE,
        FAILED
    }

    private final State state;
    private final int entriesFetched;
    private final int recordsWritten;
    private final String destinationPath;
    private final Throwable failure;

    private CycleResult(State state, int entriesFetched, int recordsWritten, String destinationPath, Throwable failure) {
        this.state = state;
        this.entriesFetched = entriesFetched;
        this.recordsWritten = recordsWritten;
        this.destinationPath = destinationPath;
        this.failure = failure;
    }

    /**
     * A finished cycle that wrote nothing, either because the slot had no entries or none belonged to the table.
     */
    public static CycleResult empty(int entriesFetched) {
        return new CycleResult(State.DONE, entriesFetched, 0, null, null);
    }

    public static CycleResult written(int entriesFetched, int recordsWritten, String destinationPath) {
        return new CycleResult(State.DONE, entriesFetched, recordsWritten, destinationPath, null);
    }

    /**
     * A cycle whose entries were consumed from the slot but could not be written.
     */
    public static CycleResult failed(int entriesFetched, Throwable failure) {
        return new CycleResult(State.FAILED, entriesFetched, 0, null, failure);
    }

    public State state() {
        return state;
    }

    public int entriesFetched() {
        return entriesFetched;
    }

    public int recordsWritten() {
        return recordsWritten;
    }

    /**
     * @return the key of the written object, or empty if nothing was written
     */
    public Optional<String> destinationPath() {
        return Optional.ofNullable(destinationPath);
    }

    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Whether the cycle consumed entries from the slot without storing them. The slot cannot return them again.
     */
    public boolean isDataLost() {
        return state == State.FAILED && entriesFetched > 0;
    }

    @Override
    public String toString() {
        return "CycleResult [state=" + state + ", entriesFetched=" + entriesFetched + ", recordsWritten=" + recordsWritten
                + ", destinationPath=" + destinationPath + "]";
    }
}
