/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.server;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneId;
import java.util.function.Consumer;
import java.util.regex.Pattern;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;

import io.slotlander.annotation.Immutable;
import io.slotlander.config.Configuration;
import io.slotlander.config.Field;
import io.slotlander.connector.postgresql.connection.PostgresConnection;
import io.slotlander.relational.TableId;
import io.slotlander.sink.FileSystemObjectSink;
import io.slotlander.sink.S3ObjectSink;

/**
 * The configuration of a Slotlander run: where changes are read from, which table is kept and where the batches are
 * landed.
 */
@Immutable
public class SlotlanderConfig {

    public static final String DATABASE_CONFIG_PREFIX = "database.";
    public static final String SINK_CONFIG_PREFIX = "sink.";

    private static final Pattern HOSTNAME_PATTERN = Pattern.compile("^[a-zA-Z0-9-_.]+$");
    private static final Pattern SLOT_NAME_PATTERN = Pattern.compile("[a-z0-9_]{1,63}");

    /**
     * The kind of object store batches are landed in.
     */
    public enum SinkType {
        /**
         * Amazon S3 or a compatible store such as MinIO.
         */
        S3("s3"),

        /**
         * A directory of the local file system.
         */
        FILESYSTEM("filesystem");

        private final String value;

        SinkType(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        /**
         * Determine the sink type for the supplied value.
         *
         * @param value the configuration property value; may be null
         * @return the matching option, or null if no match is found
         */
        public static SinkType parse(String value) {
            if (value == null) {
                return null;
            }
            value = value.trim();
            for (SinkType option : SinkType.values()) {
                if (option.getValue().equalsIgnoreCase(value)) {
                    return option;
                }
            }
            return null;
        }
    }

    public static final Field HOSTNAME = Field.create(DATABASE_CONFIG_PREFIX + PostgresConnection.HOSTNAME.name())
            .withDisplayName("Hostname")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .withDefault("db")
            .required()
            .withValidation(SlotlanderConfig::validateHostname)
            .withDescription("Resolvable hostname or IP address of the database server.");

    public static final Field PORT = Field.create(DATABASE_CONFIG_PREFIX + PostgresConnection.PORT.name())
            .withDisplayName("Port")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH)
            .withDefault(5432)
            .withValidation(Field::isPositiveInteger)
            .withDescription("Port of the database server.");

    public static final Field DATABASE_NAME = Field.create(DATABASE_CONFIG_PREFIX + PostgresConnection.DATABASE.name())
            .withDisplayName("Database")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .withDefault("mydb")
            .required()
            .withDescription("The name of the database that owns the replication slot.");

    public static final Field USER = Field.create(DATABASE_CONFIG_PREFIX + PostgresConnection.USER.name())
            .withDisplayName("User")
            .withType(Type.STRING)
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH)
            .withDefault("myuser")
            .required()
            .withDescription("Name of the database user; it needs the REPLICATION attribute or must own the slot.");

    public static final Field PASSWORD = Field.create(DATABASE_CONFIG_PREFIX + PostgresConnection.PASSWORD.name())
            .withDisplayName("Password")
            .withType(Type.PASSWORD)
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH)
            .withDefault("mypassword")
            .withDescription("Password of the database user.");

    public static final Field CONNECT_TIMEOUT_MS = Field.create(DATABASE_CONFIG_PREFIX + PostgresConnection.CONNECT_TIMEOUT_MS.name())
            .withDisplayName("Connect timeout (ms)")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDefault(10_000)
            .withValidation(Field::isNonNegativeInteger)
            .withDescription("Maximum time in milliseconds to wait for the database connection; 0 waits forever.");

    public static final Field SOCKET_TIMEOUT_MS = Field.create(DATABASE_CONFIG_PREFIX + PostgresConnection.SOCKET_TIMEOUT_MS.name())
            .withDisplayName("Socket timeout (ms)")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDefault(60_000)
            .withValidation(Field::isNonNegativeInteger)
            .withDescription("Maximum time in milliseconds to wait for a database response, so that a stalled fetch fails; "
                    + "0 waits forever.");

    public static final Field SLOT_NAME = Field.create("slot.name")
            .withDisplayName("Slot")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .withDefault("data_sync_slot")
            .required()
            .withValidation(SlotlanderConfig::validateReplicationSlotName)
            .withDescription("The name of the logical replication slot that uses the test_decoding plugin. "
                    + "The slot must exist and must not be read by any other process.");

    public static final Field MAX_CHANGES = Field.create("slot.max.changes")
            .withDisplayName("Maximum changes per cycle")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDefault(1000)
            .withValidation(Field::isPositiveInteger)
            .withDescription("Maximum number of slot entries consumed by one cycle. Transactions are never split, "
                    + "so a cycle may return more entries.");

    public static final Field TARGET_SCHEMA = Field.create("target.schema")
            .withDisplayName("Schema")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .withDefault("db_loja")
            .required()
            .withDescription("Schema of the captured table, compared exactly including case.");

    public static final Field TARGET_TABLE = Field.create("target.table")
            .withDisplayName("Table")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .withDefault("cliente")
            .required()
            .withDescription("Name of the captured table, compared exactly including case.");

    public static final Field SINK_TYPE = Field.create("sink.type")
            .withDisplayName("Sink type")
            .withType(Type.STRING)
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH)
            .withDefault(SinkType.S3.getValue())
            .withValidation(SlotlanderConfig::validateSinkType)
            .withDescription("Where batches are landed: '" + SinkType.S3.getValue() + "' for S3 compatible stores or '"
                    + SinkType.FILESYSTEM.getValue() + "' for a local directory.");

    public static final Field SINK_ENDPOINT = Field.create(SINK_CONFIG_PREFIX + S3ObjectSink.ENDPOINT.name())
            .withDisplayName("Endpoint")
            .withType(Type.STRING)
            .withWidth(Width.LONG)
            .withImportance(Importance.HIGH)
            .withDefault("http://minio:9000")
            .withValidation(SlotlanderConfig::validateSinkEndpoint)
            .withDescription("Absolute http or https URL of the S3 compatible endpoint. Required for the s3 sink.");

    public static final Field SINK_REGION = Field.create(SINK_CONFIG_PREFIX + S3ObjectSink.REGION.name())
            .withDisplayName("Region")
            .withType(Type.STRING)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDefault("us-east-1")
            .withDescription("Region the S3 client signs requests for.");

    public static final Field SINK_ACCESS_KEY = Field.create(SINK_CONFIG_PREFIX + S3ObjectSink.ACCESS_KEY.name())
            .withDisplayName("Access key")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .withDefault("minioadmin")
            .withDescription("Access key id of the object store.");

    public static final Field SINK_SECRET_KEY = Field.create(SINK_CONFIG_PREFIX + S3ObjectSink.SECRET_KEY.name())
            .withDisplayName("Secret key")
            .withType(Type.PASSWORD)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .withDefault("minioadmin")
            .withDescription("Secret access key of the object store.");

    public static final Field SINK_BUCKET = Field.create("sink.bucket")
            .withDisplayName("Bucket")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .withDefault("raw")
            .required()
            .withDescription("Bucket the batches are written to. It must already exist.");

    public static final Field SINK_BASE_PATH = Field.create("sink.base.path")
            .withDisplayName("Base path")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.MEDIUM)
            .withDefault("inc/")
            .withDescription("Prefix of every object key, used as is; it normally ends with '/'.");

    public static final Field SINK_TABLE_PREFIX = Field.create("sink.table.prefix")
            .withDisplayName("File name prefix")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.MEDIUM)
            .withDefault("cliente_cdc")
            .required()
            .withDescription("Prefix of the file names, followed by '_' and the capture time.");

    public static final Field SINK_FILESYSTEM_ROOT = Field.create(SINK_CONFIG_PREFIX + FileSystemObjectSink.ROOT.name())
            .withDisplayName("File system root")
            .withType(Type.STRING)
            .withWidth(Width.LONG)
            .withImportance(Importance.LOW)
            .withDefault("data")
            .withDescription("Directory that contains the bucket directories when the filesystem sink is used.");

    public static final Field SINK_API_CALL_TIMEOUT_MS = Field.create(SINK_CONFIG_PREFIX + S3ObjectSink.API_CALL_TIMEOUT_MS.name())
            .withDisplayName("API call timeout (ms)")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDefault(30_000)
            .withValidation(Field::isPositiveInteger)
            .withDescription("Maximum time in milliseconds for storing one object, including retries.");

    public static final Field CAPTURE_TIME_ZONE = Field.create("capture.time.zone")
            .withDisplayName("Capture time zone")
            .withType(Type.STRING)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDefault(() -> ZoneId.systemDefault().getId())
            .withValidation(Field::isZoneId)
            .withDescription("Zone of the capture timestamps and of the date partitions. Defaults to the zone of the JVM.");

    public static final Field.Set DATABASE_FIELDS = Field.setOf(HOSTNAME, PORT, DATABASE_NAME, USER, PASSWORD,
            CONNECT_TIMEOUT_MS, SOCKET_TIMEOUT_MS);
    public static final Field.Set SLOT_FIELDS = Field.setOf(SLOT_NAME, MAX_CHANGES, TARGET_SCHEMA, TARGET_TABLE);
    public static final Field.Set SINK_FIELDS = Field.setOf(SINK_TYPE, SINK_ENDPOINT, SINK_REGION, SINK_ACCESS_KEY,
            SINK_SECRET_KEY, SINK_BUCKET, SINK_BASE_PATH, SINK_TABLE_PREFIX, SINK_FILESYSTEM_ROOT, SINK_API_CALL_TIMEOUT_MS,
            CAPTURE_TIME_ZONE);

    public static final Field.Set ALL_FIELDS = DATABASE_FIELDS.with(SLOT_FIELDS.asArray()).with(SINK_FIELDS.asArray());

    /**
     * Describe all options, e.g. for generating documentation.
     *
     * @return the definition of the configuration; never null
     */
    public static ConfigDef configDef() {
        final ConfigDef config = new ConfigDef();
        Field.group(config, "Postgres", DATABASE_FIELDS.asArray());
        Field.group(config, "Replication slot", SLOT_FIELDS.asArray());
        Field.group(config, "Sink", SINK_FIELDS.asArray());
        return config;
    }

    private final Configuration config;

    public SlotlanderConfig(Configuration config) {
        this.config = config;
    }

    /**
     * Validate all fields, passing a readable message for each problem to the supplied consumer.
     *
     * @param problems the consumer of problem messages; may not be null
     * @return true if the configuration is valid
     */
    public boolean validateAndRecord(Consumer<String> problems) {
        return config.validateAndRecord(ALL_FIELDS, problems);
    }

    /**
     * @return the settings of the database connection, keyed as {@link PostgresConnection} expects them
     */
    public Configuration getConnectionConfiguration() {
        return Configuration.create()
                .with(PostgresConnection.HOSTNAME, config.getString(HOSTNAME))
                .with(PostgresConnection.PORT, config.getString(PORT))
                .with(PostgresConnection.DATABASE, config.getString(DATABASE_NAME))
                .with(PostgresConnection.USER, config.getString(USER))
                .with(PostgresConnection.PASSWORD, config.getString(PASSWORD))
                .with(PostgresConnection.CONNECT_TIMEOUT_MS, config.getString(CONNECT_TIMEOUT_MS))
                .with(PostgresConnection.SOCKET_TIMEOUT_MS, config.getString(SOCKET_TIMEOUT_MS))
                .build();
    }

    /**
     * @return the settings of the S3 client, keyed as {@link S3ObjectSink} expects them
     */
    public Configuration getS3Configuration() {
        return Configuration.create()
                .with(S3ObjectSink.ENDPOINT, config.getString(SINK_ENDPOINT))
                .with(S3ObjectSink.REGION, config.getString(SINK_REGION))
                .with(S3ObjectSink.ACCESS_KEY, config.getString(SINK_ACCESS_KEY))
                .with(S3ObjectSink.SECRET_KEY, config.getString(SINK_SECRET_KEY))
                .with(S3ObjectSink.API_CALL_TIMEOUT_MS, config.getString(SINK_API_CALL_TIMEOUT_MS))
                .build();
    }

    public String getSlotName() {
        return config.getString(SLOT_NAME);
    }

    public int getMaxChanges() {
        return config.getInteger(MAX_CHANGES);
    }

    public TableId getTargetTable() {
        return new TableId(config.getString(TARGET_SCHEMA), config.getString(TARGET_TABLE));
    }

    public SinkType getSinkType() {
        return SinkType.parse(config.getString(SINK_TYPE));
    }

    public String getBucket() {
        return config.getString(SINK_BUCKET);
    }

    public String getBasePath() {
        final String basePath = config.getString(SINK_BASE_PATH);
        return basePath != null ? basePath : "";
    }

    public String getTablePrefix() {
        return config.getString(SINK_TABLE_PREFIX);
    }

    public Path getFileSystemRoot() {
        return Paths.get(config.getString(SINK_FILESYSTEM_ROOT));
    }

    public ZoneId getCaptureTimeZone() {
        return ZoneId.of(config.getString(CAPTURE_TIME_ZONE).trim());
    }

    @Override
    public String toString() {
        return config.toString();
    }

    private static int validateHostname(Configuration config, Field field, Field.ValidationOutput problems) {
        final String hostName = config.getString(field);
        if (hostName != null && !hostName.isBlank() && !HOSTNAME_PATTERN.matcher(hostName).matches()) {
            problems.accept(field, hostName, hostName + " has invalid format (only the underscore, hyphen, dot and alphanumeric characters are allowed)");
            return 1;
        }
        return 0;
    }

    private static int validateReplicationSlotName(Configuration config, Field field, Field.ValidationOutput problems) {
        final String name = config.getString(field);
        if (name != null && !SLOT_NAME_PATTERN.matcher(name).matches()) {
            problems.accept(field, name, "Valid replication slot name must contain only digits, lowercase characters and underscores with length <= 63");
            return 1;
        }
        return 0;
    }

    private static int validateSinkType(Configuration config, Field field, Field.ValidationOutput problems) {
        final String value = config.getString(field);
        if (SinkType.parse(value) == null) {
            problems.accept(field, value, "Value must be one of '" + SinkType.S3.getValue() + "' or '" + SinkType.FILESYSTEM.getValue() + "'");
            return 1;
        }
        return 0;
    }

    private static int validateSinkEndpoint(Configuration config, Field field, Field.ValidationOutput problems) {
        if (SinkType.parse(config.getString(SINK_TYPE)) != SinkType.S3) {
            return 0;
        }
        if (Field.isRequired(config, field, problems) != 0) {
            return 1;
        }
        final String value = config.getString(field).trim();
        try {
            final URI uri = new URI(value);
            final String scheme = uri.getScheme();
            if (uri.isAbsolute() && uri.getHost() != null
                    && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                return 0;
            }
        }
        catch (URISyntaxException e) {
            // reported below
        }
        problems.accept(field, value, "An absolute http or https URL such as 'http://minio:9000' is expected");
        return 1;
    }
}
