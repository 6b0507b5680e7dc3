/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.server;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.slotlander.SlotlanderException;
import io.slotlander.connector.postgresql.connection.DecodedChange;
import io.slotlander.connector.postgresql.connection.RawChangeEntry;
import io.slotlander.connector.postgresql.connection.TestDecodingDecoder;
import io.slotlander.relational.TableId;
import io.slotlander.sink.CapturedRecord;

/**
 * Turns the raw entries of a slot into the records of the captured table. Entries that are not row changes and
 * changes of other tables are dropped; the order of the remaining entries is kept.
 */
public class ChangeSetFilter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChangeSetFilter.class);

    private final TableId target;
    private final TestDecodingDecoder decoder;
    private final ObjectMapper mapper;

    public ChangeSetFilter(TableId target) {
        this(target, new TestDecodingDecoder(), new ObjectMapper());
    }

    public ChangeSetFilter(TableId target, TestDecodingDecoder decoder, ObjectMapper mapper) {
        this.target = target;
        this.decoder = decoder;
        this.mapper = mapper;
    }

    /**
     * Decode the entries and keep the changes of the target table.
     *
     * @param entries the entries in slot order; may not be null
     * @param captureTime the capture time given to every record; may not be null
     * @return the records in slot order; never null
     */
    public List<CapturedRecord> filter(List<RawChangeEntry> entries, Instant captureTime) {
        final List<CapturedRecord> records = new ArrayList<>();
        int skipped = 0;
        int foreign = 0;
        for (RawChangeEntry entry : entries) {
            final Optional<DecodedChange> change = decoder.decode(entry.payload());
            if (change.isEmpty()) {
                skipped++;
                continue;
            }
            if (!target.equals(change.get().tableId())) {
                LOGGER.trace("Ignoring change of table {} at {}", change.get().tableId(), entry.logPosition().asString());
                foreign++;
                continue;
            }
            records.add(new CapturedRecord(
                    captureTime,
                    entry.logPosition().asString(),
                    change.get().operation().name(),
                    toJson(change.get().columns())));
        }
        LOGGER.debug("Kept {} of {} entries for table {}; {} were not row changes, {} belonged to other tables",
                records.size(), entries.size(), target, skipped, foreign);
        return records;
    }

    private String toJson(Map<String, String> columns) {
        try {
            return mapper.writeValueAsString(columns);
        }
        catch (JsonProcessingException e) {
            throw new SlotlanderException("Unable to render column values as JSON", e);
        }
    }
}
