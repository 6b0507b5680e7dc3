/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.connector.postgresql.connection;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.slotlander.annotation.NotThreadSafe;
import io.slotlander.config.Configuration;
import io.slotlander.config.Field;
import io.slotlander.connector.postgresql.SlotFetchException;

/**
 * A JDBC connection to a PostgreSQL server that reads changes from logical replication slots using the SQL interface
 * of logical decoding. The physical connection is opened on first use and kept until {@link #close()}.
 * <p>
 * The connection runs in auto-commit mode, so each {@link #fetchAndAdvance(String, int) fetch} commits the slot's new
 * position as soon as the rows have been read.
 */
@NotThreadSafe
public class PostgresConnection implements ReplicationSlotSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresConnection.class);

    public static final Field HOSTNAME = Field.create("hostname")
            .withDescription("Resolvable hostname or IP address of the database server.")
            .required();
    public static final Field PORT = Field.create("port")
            .withDescription("Port of the database server.")
            .withDefault(5432);
    public static final Field DATABASE = Field.create("dbname")
            .withDescription("Name of the database that owns the replication slot.")
            .required();
    public static final Field USER = Field.create("user")
            .withDescription("Name of the database user.")
            .required();
    public static final Field PASSWORD = Field.create("password")
            .withDescription("Password of the database user.");
    public static final Field CONNECT_TIMEOUT_MS = Field.create("connect.timeout.ms")
            .withDescription("Maximum time in milliseconds to wait for the connection to be established; 0 waits forever.")
            .withDefault(10_000);
    public static final Field SOCKET_TIMEOUT_MS = Field.create("socket.timeout.ms")
            .withDescription("Maximum time in milliseconds to wait for a server response; 0 waits forever.")
            .withDefault(60_000);

    public static final Field.Set ALL_FIELDS = Field.setOf(HOSTNAME, PORT, DATABASE, USER, PASSWORD, CONNECT_TIMEOUT_MS,
            SOCKET_TIMEOUT_MS);

    static final String URL_PATTERN = "jdbc:postgresql://%s:%d/%s";
    static final String APPLICATION_NAME = "slotlander";

    static final String GET_CHANGES_QUERY = "SELECT lsn, xid, data FROM pg_logical_slot_get_changes(?, NULL, ?, "
            + "'include-xids', '0', 'skip-empty-xacts', '1')";

    /**
     * Opens physical JDBC connections.
     */
    @FunctionalInterface
    public interface ConnectionFactory {
        /**
         * Establish a connection to the database denoted by the given URL.
         *
         * @param url the JDBC URL; never null
         * @param properties the driver properties, including the credentials; never null
         * @return the connection; never null
         * @throws SQLException if the connection cannot be established
         */
        Connection connect(String url, Properties properties) throws SQLException;
    }

    private final Configuration config;
    private final ConnectionFactory factory;
    private Connection conn;

    /**
     * Create a connection that uses the PostgreSQL JDBC driver.
     *
     * @param config the connection settings described by {@link #ALL_FIELDS}; may not be null
     */
    public PostgresConnection(Configuration config) {
        this(config, DriverManager::getConnection);
    }

    public PostgresConnection(Configuration config, ConnectionFactory factory) {
        this.config = config;
        this.factory = factory;
    }

    /**
     * @return the JDBC URL, without credentials
     */
    public String connectionString() {
        return String.format(URL_PATTERN, config.getString(HOSTNAME), config.getInteger(PORT), config.getString(DATABASE));
    }

    Properties driverProperties() {
        final Properties props = new Properties();
        props.setProperty("user", config.getString(USER));
        final String password = config.getString(PASSWORD);
        if (password != null) {
            props.setProperty("password", password);
        }
        props.setProperty("connectTimeout", Long.toString(toSeconds(config.getLong(CONNECT_TIMEOUT_MS))));
        props.setProperty("socketTimeout", Long.toString(toSeconds(config.getLong(SOCKET_TIMEOUT_MS))));
        props.setProperty("ApplicationName", APPLICATION_NAME);
        return props;
    }

    // the driver takes whole seconds; round up so that a small timeout does not turn into no timeout
    private static long toSeconds(long millis) {
        return millis <= 0 ? 0 : (millis + 999) / 1000;
    }

    /**
     * Obtain the physical connection, opening it if needed.
     *
     * @return the connection; never null
     * @throws SQLException if the connection cannot be established
     */
    public synchronized Connection connection() throws SQLException {
        if (!isConnected()) {
            LOGGER.debug("Connecting to {}", connectionString());
            conn = factory.connect(connectionString(), driverProperties());
            if (!isConnected()) {
                throw new SQLException("Unable to obtain a JDBC connection");
            }
            conn.setAutoCommit(true);
        }
        return conn;
    }

    public synchronized boolean isConnected() throws SQLException {
        return conn != null && !conn.isClosed();
    }

    @Override
    public List<RawChangeEntry> fetchAndAdvance(String slotName, int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("The maximum number of entries must be positive but was " + maxEntries);
        }
        try {
            try (PreparedStatement statement = connection().prepareStatement(GET_CHANGES_QUERY)) {
                statement.setString(1, slotName);
                statement.setInt(2, maxEntries);
                try (ResultSet rs = statement.executeQuery()) {
                    final List<RawChangeEntry> entries = new ArrayList<>();
                    while (rs.next()) {
                        final RawChangeEntry entry = new RawChangeEntry(Lsn.valueOf(rs.getString(1)), rs.getLong(2), rs.getString(3));
                        LOGGER.trace("Fetched {}", entry);
                        entries.add(entry);
                    }
                    LOGGER.debug("Fetched {} entries from replication slot '{}'", entries.size(), slotName);
                    return entries;
                }
            }
        }
        catch (SQLException e) {
            throw new SlotFetchException(slotName, "Failed to fetch changes from replication slot '" + slotName + "' at "
                    + connectionString() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        if (conn != null) {
            try {
                LOGGER.trace("Closing database connection");
                conn.close();
            }
            catch (SQLException e) {
                LOGGER.warn("Failed to close the database connection to {}", connectionString(), e);
            }
            finally {
                conn = null;
            }
        }
    }
}
