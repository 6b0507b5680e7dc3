/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.server;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.slotlander.annotation.VisibleForTesting;
import io.slotlander.config.Configuration;
import io.slotlander.config.Field;
import io.slotlander.connector.postgresql.SlotFetchException;
import io.slotlander.connector.postgresql.connection.PostgresConnection;
import io.slotlander.connector.postgresql.connection.ReplicationSlotSource;
import io.slotlander.sink.FileSystemObjectSink;
import io.slotlander.sink.ObjectSink;
import io.slotlander.sink.S3ObjectSink;
import io.slotlander.util.Clock;
import io.slotlander.util.CommandLineOptions;

/**
 * Entry point that runs a single cycle and reports its outcome as the process exit code.
 * <p>
 * Configuration is read, later sources overriding earlier ones, from the field defaults, the properties file given
 * with {@code --config}, environment variables prefixed with {@code SLOTLANDER_} and system properties prefixed with
 * {@code slotlander.}.
 */
public class SlotlanderMain {

    private static final Logger LOGGER = LoggerFactory.getLogger(SlotlanderMain.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_WRITE_FAILED = 1;
    public static final int EXIT_FETCH_FAILED = 2;
    public static final int EXIT_INVALID_CONFIGURATION = 3;

    public static final String ENVIRONMENT_PREFIX = "SLOTLANDER_";
    public static final String SYSTEM_PROPERTY_PREFIX = "slotlander.";

    private final Function<SlotlanderConfig, ReplicationSlotSource> sourceFactory;
    private final Function<SlotlanderConfig, ObjectSink> sinkFactory;
    private final Clock clock;
    private final PrintStream out;

    public SlotlanderMain() {
        this(config -> new PostgresConnection(config.getConnectionConfiguration()), SlotlanderMain::createSink, Clock.system(),
                System.out);
    }

    @VisibleForTesting
    SlotlanderMain(Function<SlotlanderConfig, ReplicationSlotSource> sourceFactory,
                   Function<SlotlanderConfig, ObjectSink> sinkFactory, Clock clock, PrintStream out) {
        this.sourceFactory = sourceFactory;
        this.sinkFactory = sinkFactory;
        this.clock = clock;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new SlotlanderMain().run(args, System.getenv(), System.getProperties()));
    }

    /**
     * Run one cycle with the configuration assembled from the given sources.
     *
     * @param args the command line arguments
     * @param environment the environment variables
     * @param systemProperties the system properties
     * @return the exit code
     */
    public int run(String[] args, Map<String, String> environment, Properties systemProperties) {
        final CommandLineOptions options = CommandLineOptions.parse(args);
        if (options.hasOption("--help", "-h")) {
            printUsage();
            return EXIT_OK;
        }
        if (!options.getParameters().isEmpty()) {
            LOGGER.warn("Ignoring unexpected arguments {}", options.getParameters());
        }

        final SlotlanderConfig config;
        try {
            config = new SlotlanderConfig(loadConfiguration(options, environment, systemProperties));
        }
        catch (IOException e) {
            LOGGER.error("Unable to read the configuration file", e);
            return EXIT_INVALID_CONFIGURATION;
        }
        if (!config.validateAndRecord(LOGGER::error)) {
            return EXIT_INVALID_CONFIGURATION;
        }
        LOGGER.info("Starting with configuration {}", config);

        // the sink is set up before the slot is touched
        final ObjectSink sink;
        try {
            sink = sinkFactory.apply(config);
        }
        catch (RuntimeException e) {
            LOGGER.error("Unable to create the '{}' sink", config.getSinkType().getValue(), e);
            return EXIT_INVALID_CONFIGURATION;
        }

        try (ObjectSink objectSink = sink;
                ReplicationSlotSource source = sourceFactory.apply(config)) {
            final CycleResult result = new PipelineDriver(config, source, objectSink, clock).runCycle();
            return result.state() == CycleResult.State.DONE ? EXIT_OK : EXIT_WRITE_FAILED;
        }
        catch (SlotFetchException e) {
            LOGGER.error("Failed to read changes from replication slot '{}' (SQL state {})", e.getSlotName(), e.getSqlState(), e);
            return EXIT_FETCH_FAILED;
        }
    }

    @VisibleForTesting
    static Configuration loadConfiguration(CommandLineOptions options, Map<String, String> environment,
                                           Properties systemProperties)
            throws IOException {
        final Configuration.Builder builder = Configuration.create();
        for (Field field : SlotlanderConfig.ALL_FIELDS) {
            final String defaultValue = field.defaultValueAsString();
            if (defaultValue != null) {
                builder.with(field, defaultValue);
            }
        }

        final String configFile = options.getOption("--config", "-c", null);
        if (configFile != null) {
            final Path path = Paths.get(configFile);
            builder.with(Configuration.load(path));
        }

        builder.with(Configuration.fromEnvironment(environment, ENVIRONMENT_PREFIX));
        builder.with(Configuration.from(systemProperties)
                .map(key -> key.startsWith(SYSTEM_PROPERTY_PREFIX) ? key.substring(SYSTEM_PROPERTY_PREFIX.length()) : null));
        return builder.build();
    }

    static ObjectSink createSink(SlotlanderConfig config) {
        switch (config.getSinkType()) {
            case FILESYSTEM:
                LOGGER.info("Landing batches below directory {}", config.getFileSystemRoot().toAbsolutePath());
                return new FileSystemObjectSink(config.getFileSystemRoot());
            case S3:
            default:
                return new S3ObjectSink(config.getS3Configuration());
        }
    }

    private void printUsage() {
        out.println("Usage: slotlander [--config <properties file>]");
        out.println();
        out.println("Consumes one batch of changes from a test_decoding replication slot and lands the changes of one table");
        out.println("as a CSV object. Options may also be given as environment variables (" + ENVIRONMENT_PREFIX
                + "SLOT_NAME for slot.name) or system properties (" + SYSTEM_PROPERTY_PREFIX + "slot.name).");
        out.println();
        out.println(SlotlanderConfig.configDef().toRst());
    }
}
