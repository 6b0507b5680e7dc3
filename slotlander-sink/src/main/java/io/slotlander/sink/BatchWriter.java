/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.sink;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lands a batch of captured records as a single CSV object.
 */
public class BatchWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchWriter.class);

    public static final String CONTENT_TYPE = "text/csv";

    private final ObjectSink sink;
    private final String bucket;
    private final String basePath;
    private final String tablePrefix;
    private final ZoneId zone;
    private final CsvBatchSerializer serializer;

    public BatchWriter(ObjectSink sink, String bucket, String basePath, String tablePrefix, ZoneId zone) {
        this.sink = sink;
        this.bucket = bucket;
        this.basePath = basePath;
        this.tablePrefix = tablePrefix;
        this.zone = zone;
        this.serializer = new CsvBatchSerializer(zone);
    }

    /**
     * Write the records as one object whose key is derived from the capture time. Nothing is written for an empty
     * list.
     *
     * @param records the records in landing order; may not be null
     * @param captureTime the capture time shared by the records; may not be null
     * @return the key of the written object, or empty if there was nothing to write
     * @throws SinkWriteException if the object cannot be stored
     */
    public Optional<String> writeBatch(List<CapturedRecord> records, Instant captureTime) {
        final OutputBatch batch = OutputBatch.of(records, captureTime, zone, basePath, tablePrefix);
        if (batch.isEmpty()) {
            LOGGER.debug("No records to write");
            return Optional.empty();
        }
        final byte[] content = serializer.serialize(batch.records());
        LOGGER.debug("Writing {} records ({} bytes) to {}/{}", batch.records().size(), content.length, bucket, batch.key());
        sink.putObject(bucket, batch.key(), content, CONTENT_TYPE);
        return Optional.of(batch.key());
    }
}
