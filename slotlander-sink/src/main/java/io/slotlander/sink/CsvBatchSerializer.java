/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.sink;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

import de.siegmar.fastcsv.writer.CsvWriter;
import de.siegmar.fastcsv.writer.LineDelimiter;

import io.slotlander.annotation.ThreadSafe;

/**
 * Renders captured records as UTF-8 CSV with a header line and {@code LF} line endings. Fields are quoted only when
 * they contain a delimiter, a quote or a line break, which is always the case for the JSON column data.
 */
@ThreadSafe
public class CsvBatchSerializer {

    public static final String[] HEADER = { "capture_ts", "log_position", "op", "columns" };

    /**
     * ISO-8601 local date-time with microseconds, e.g. {@code 2025-01-31T10:15:30.123456}.
     */
    static final DateTimeFormatter CAPTURE_TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS");

    private final ZoneId zone;

    /**
     * @param zone the zone in which capture timestamps are rendered; may not be null
     */
    public CsvBatchSerializer(ZoneId zone) {
        this.zone = zone;
    }

    public byte[] serialize(List<CapturedRecord> records) {
        final StringWriter out = new StringWriter();
        try (CsvWriter csv = CsvWriter.builder().lineDelimiter(LineDelimiter.LF).build(out)) {
            csv.writeRecord(HEADER);
            for (CapturedRecord record : records) {
                csv.writeRecord(
                        formatCaptureTimestamp(record),
                        record.logPosition(),
                        record.operation(),
                        record.columnsJson());
            }
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed to render CSV batch", e);
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    String formatCaptureTimestamp(CapturedRecord record) {
        return CAPTURE_TIMESTAMP_FORMAT.format(LocalDateTime.ofInstant(record.captureTimestamp(), zone));
    }
}
