/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.sink;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

import io.slotlander.annotation.Immutable;

/**
 * The records of one cycle together with the key of the object they are landed in. The key is partitioned by the
 * capture date, e.g. {@code inc/data=20250131/cliente_cdc_20250131_101530.csv}.
 */
@Immutable
public final class OutputBatch {

    static final String PARTITION_PREFIX = "data=";
    static final String FILE_EXTENSION = ".csv";
    static final DateTimeFormatter PARTITION_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");
    static final DateTimeFormatter FILE_TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final String key;
    private final List<CapturedRecord> records;

    private OutputBatch(String key, List<CapturedRecord> records) {
        this.key = key;
        this.records = records;
    }

    /**
     * Create a batch for records captured at the given time.
     *
     * @param records the records in landing order; may not be null
     * @param captureTime the capture time of the batch; may not be null
     * @param zone the zone in which the date partition and file timestamp are computed; may not be null
     * @param basePath the prefix of every key, used as is; may be empty but not null
     * @param tablePrefix the prefix of the file name; may not be null
     * @return the batch; never null
     */
    public static OutputBatch of(List<CapturedRecord> records, Instant captureTime, ZoneId zone, String basePath,
                                 String tablePrefix) {
        return new OutputBatch(keyFor(captureTime, zone, basePath, tablePrefix), List.copyOf(records));
    }

    static String keyFor(Instant captureTime, ZoneId zone, String basePath, String tablePrefix) {
        final LocalDateTime local = LocalDateTime.ofInstant(captureTime, zone);
        return basePath + PARTITION_PREFIX + PARTITION_FORMAT.format(local) + "/"
                + tablePrefix + "_" + FILE_TIMESTAMP_FORMAT.format(local) + FILE_EXTENSION;
    }

    public String key() {
        return key;
    }

    public List<CapturedRecord> records() {
        return records;
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    @Override
    public String toString() {
        return "OutputBatch [key=" + key + ", records=" + records.size() + "]";
    }
}
