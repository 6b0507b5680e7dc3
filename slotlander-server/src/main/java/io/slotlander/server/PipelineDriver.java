/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.server;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.slotlander.annotation.NotThreadSafe;
import io.slotlander.connector.postgresql.SlotFetchException;
import io.slotlander.connector.postgresql.connection.RawChangeEntry;
import io.slotlander.connector.postgresql.connection.ReplicationSlotSource;
import io.slotlander.sink.BatchWriter;
import io.slotlander.sink.CapturedRecord;
import io.slotlander.sink.ObjectSink;
import io.slotlander.sink.SinkWriteException;
import io.slotlander.util.Clock;

/**
 * Runs one cycle: consume a batch of entries from the slot, keep the changes of the target table and land them as one
 * object.
 * <p>
 * Entries are consumed from the slot before they are written. If writing fails those entries are gone; the result
 * reports this as {@link CycleResult#isDataLost() data loss}.
 */
@NotThreadSafe
public class PipelineDriver {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineDriver.class);

    private final SlotlanderConfig config;
    private final ReplicationSlotSource source;
    private final ChangeSetFilter filter;
    private final BatchWriter writer;
    private final Clock clock;
    private CycleResult.State state = CycleResult.State.START;

    public PipelineDriver(SlotlanderConfig config, ReplicationSlotSource source, ObjectSink sink, Clock clock) {
        this.config = config;
        this.source = source;
        this.filter = new ChangeSetFilter(config.getTargetTable());
        this.writer = new BatchWriter(sink, config.getBucket(), config.getBasePath(), config.getTablePrefix(),
                config.getCaptureTimeZone());
        this.clock = clock;
    }

    /**
     * Run one cycle.
     *
     * @return the outcome; never null
     * @throws SlotFetchException if the entries cannot be read from the slot; nothing has been consumed then
     */
    public CycleResult runCycle() {
        final String slotName = config.getSlotName();
        transitionTo(CycleResult.State.START);

        transitionTo(CycleResult.State.FETCHING);
        final List<RawChangeEntry> entries;
        try {
            entries = source.fetchAndAdvance(slotName, config.getMaxChanges());
        }
        catch (SlotFetchException e) {
            transitionTo(CycleResult.State.FAILED);
            throw e;
        }
        if (entries.isEmpty()) {
            LOGGER.info("No changes in replication slot '{}'", slotName);
            return finish(CycleResult.empty(0));
        }

        transitionTo(CycleResult.State.DECODING_FILTERING);
        final Instant captureTime = clock.currentTimeAsInstant();
        final List<CapturedRecord> records = filter.filter(entries, captureTime);
        if (records.isEmpty()) {
            LOGGER.info("Consumed {} entries from replication slot '{}', none of them for table {}", entries.size(), slotName,
                    config.getTargetTable());
            return finish(CycleResult.empty(entries.size()));
        }

        transitionTo(CycleResult.State.WRITING);
        try {
            final Optional<String> key = writer.writeBatch(records, captureTime);
            LOGGER.info("Consumed {} entries from replication slot '{}' and wrote {} records to {}/{}", entries.size(),
                    slotName, records.size(), config.getBucket(), key.orElse(""));
            return finish(CycleResult.written(entries.size(), records.size(), key.orElse(null)));
        }
        catch (SinkWriteException e) {
            LOGGER.error("Failed to write {} records to {}/{}; the {} entries consumed from replication slot '{}' "
                    + "between {} and {} are lost", records.size(), e.getBucket(), e.getKey(), entries.size(), slotName,
                    entries.get(0).logPosition().asString(), entries.get(entries.size() - 1).logPosition().asString(), e);
            return finish(CycleResult.failed(entries.size(), e));
        }
    }

    /**
     * @return the state of the current or last cycle
     */
    public CycleResult.State state() {
        return state;
    }

    private CycleResult finish(CycleResult result) {
        transitionTo(result.state());
        return result;
    }

    private void transitionTo(CycleResult.State newState) {
        LOGGER.debug("Cycle state {} -> {}", state, newState);
        state = newState;
    }
}
