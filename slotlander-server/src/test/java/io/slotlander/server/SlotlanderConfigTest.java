/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.server;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import org.apache.kafka.common.config.ConfigDef;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.slotlander.config.Configuration;
import io.slotlander.connector.postgresql.connection.PostgresConnection;
import io.slotlander.relational.TableId;
import io.slotlander.sink.S3ObjectSink;

public class SlotlanderConfigTest {

    @Test
    public void shouldUseDefaultsOfOriginalJob() {
        SlotlanderConfig config = new SlotlanderConfig(Configuration.empty());

        assertThat(config.getSlotName()).isEqualTo("data_sync_slot");
        assertThat(config.getMaxChanges()).isEqualTo(1000);
        assertThat(config.getTargetTable()).isEqualTo(new TableId("db_loja", "cliente"));
        assertThat(config.getSinkType()).isEqualTo(SlotlanderConfig.SinkType.S3);
        assertThat(config.getBucket()).isEqualTo("raw");
        assertThat(config.getBasePath()).isEqualTo("inc/");
        assertThat(config.getTablePrefix()).isEqualTo("cliente_cdc");
        assertThat(config.getCaptureTimeZone()).isEqualTo(ZoneId.systemDefault());
        assertThat(config.validateAndRecord(problem -> {
        })).isTrue();
    }

    @Test
    public void shouldExposeConnectionSettingsWithoutPrefix() {
        SlotlanderConfig config = new SlotlanderConfig(Configuration.create()
                .with(SlotlanderConfig.HOSTNAME, "pg.internal")
                .with(SlotlanderConfig.PORT, 6543)
                .build());

        Configuration connection = config.getConnectionConfiguration();

        assertThat(connection.getString(PostgresConnection.HOSTNAME)).isEqualTo("pg.internal");
        assertThat(connection.getInteger(PostgresConnection.PORT)).isEqualTo(6543);
        assertThat(connection.getString(PostgresConnection.DATABASE)).isEqualTo("mydb");
        assertThat(connection.getString(PostgresConnection.USER)).isEqualTo("myuser");
        assertThat(connection.getLong(PostgresConnection.SOCKET_TIMEOUT_MS)).isEqualTo(60_000L);
    }

    @Test
    public void shouldExposeS3SettingsWithoutPrefix() {
        SlotlanderConfig config = new SlotlanderConfig(Configuration.create()
                .with(SlotlanderConfig.SINK_SECRET_KEY, "s3cr3t")
                .build());

        Configuration s3 = config.getS3Configuration();

        assertThat(s3.getString(S3ObjectSink.ENDPOINT)).isEqualTo("http://minio:9000");
        assertThat(s3.getString(S3ObjectSink.ACCESS_KEY)).isEqualTo("minioadmin");
        assertThat(s3.getString(S3ObjectSink.SECRET_KEY)).isEqualTo("s3cr3t");
        assertThat(s3.getLong(S3ObjectSink.API_CALL_TIMEOUT_MS)).isEqualTo(30_000L);
    }

    @Test
    public void shouldReportEveryInvalidValue() {
        SlotlanderConfig config = new SlotlanderConfig(Configuration.create()
                .with(SlotlanderConfig.SLOT_NAME, "Data-Slot")
                .with(SlotlanderConfig.MAX_CHANGES, 0)
                .with(SlotlanderConfig.PORT, "abc")
                .with(SlotlanderConfig.SINK_TYPE, "ftp")
                .with(SlotlanderConfig.CAPTURE_TIME_ZONE, "Mars/Olympus")
                .with(SlotlanderConfig.TARGET_TABLE, " ")
                .build());
        List<String> problems = new ArrayList<>();

        assertThat(config.validateAndRecord(problems::add)).isFalse();

        assertThat(problems).anyMatch(p -> p.contains("slot.name"))
                .anyMatch(p -> p.contains("slot.max.changes"))
                .anyMatch(p -> p.contains("database.port"))
                .anyMatch(p -> p.contains("sink.type"))
                .anyMatch(p -> p.contains("capture.time.zone"))
                .anyMatch(p -> p.contains("target.table"));
    }

    @Test
    public void shouldRequireEndpointOnlyForS3Sink() {
        Configuration withoutEndpoint = Configuration.create()
                .with(SlotlanderConfig.SINK_ENDPOINT, "")
                .build();

        assertThat(new SlotlanderConfig(withoutEndpoint).validateAndRecord(problem -> {
        })).isFalse();
        assertThat(new SlotlanderConfig(Configuration.copy(withoutEndpoint)
                .with(SlotlanderConfig.SINK_TYPE, "filesystem")
                .build()).validateAndRecord(problem -> {
                })).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = { "minio:9000", "http://mi nio:9000", "ftp://minio:9000", "/minio", "http://" })
    public void shouldRejectEndpointThatIsNotAnHttpUrl(String endpoint) {
        Configuration config = Configuration.create()
                .with(SlotlanderConfig.SINK_ENDPOINT, endpoint)
                .build();
        List<String> problems = new ArrayList<>();

        assertThat(new SlotlanderConfig(config).validateAndRecord(problems::add)).isFalse();
        assertThat(problems).singleElement().asString().contains("sink.endpoint");
        assertThat(new SlotlanderConfig(Configuration.copy(config)
                .with(SlotlanderConfig.SINK_TYPE, "filesystem")
                .build()).validateAndRecord(problem -> {
                })).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = { "http://minio:9000", "https://s3.eu-west-1.amazonaws.com", " HTTP://localhost:9000/ " })
    public void shouldAcceptHttpEndpoint(String endpoint) {
        assertThat(new SlotlanderConfig(Configuration.create()
                .with(SlotlanderConfig.SINK_ENDPOINT, endpoint)
                .build()).validateAndRecord(problem -> {
                })).isTrue();
    }

    @Test
    public void shouldNotRevealSecretsWhenPrinted() {
        SlotlanderConfig config = new SlotlanderConfig(Configuration.create()
                .with(SlotlanderConfig.PASSWORD, "pg-secret")
                .with(SlotlanderConfig.SINK_SECRET_KEY, "s3-secret")
                .build());

        assertThat(config.toString()).doesNotContain("pg-secret").doesNotContain("s3-secret");
    }

    @Test
    public void shouldDescribeAllFields() {
        ConfigDef configDef = SlotlanderConfig.configDef();

        assertThat(configDef.names()).containsExactlyInAnyOrderElementsOf(SlotlanderConfig.ALL_FIELDS.allFieldNames());
        assertThat(configDef.configKeys().get("slot.name").group).isEqualTo("Replication slot");
    }
}
