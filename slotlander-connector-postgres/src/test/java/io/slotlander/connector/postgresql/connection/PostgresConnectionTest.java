/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.connector.postgresql.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import io.slotlander.config.Configuration;
import io.slotlander.connector.postgresql.SlotFetchException;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class PostgresConnectionTest {

    @Mock
    private PostgresConnection.ConnectionFactory factory;
    @Mock
    private Connection jdbcConnection;
    @Mock
    private PreparedStatement statement;
    @Mock
    private ResultSet resultSet;

    private PostgresConnection connection;

    @BeforeEach
    public void beforeEach() throws SQLException {
        Configuration config = Configuration.create()
                .with(PostgresConnection.HOSTNAME, "db")
                .with(PostgresConnection.PORT, 5433)
                .with(PostgresConnection.DATABASE, "mydb")
                .with(PostgresConnection.USER, "myuser")
                .with(PostgresConnection.PASSWORD, "mypassword")
                .with(PostgresConnection.CONNECT_TIMEOUT_MS, 1500)
                .build();
        connection = new PostgresConnection(config, factory);

        when(factory.connect(anyString(), any(Properties.class))).thenReturn(jdbcConnection);
        when(jdbcConnection.prepareStatement(PostgresConnection.GET_CHANGES_QUERY)).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
    }

    @Test
    public void shouldReturnEntriesInSlotOrder() throws SQLException {
        when(resultSet.next()).thenReturn(true, true, true, false);
        when(resultSet.getString(1)).thenReturn("0/16B3748", "0/16B3790", "0/16B37D8");
        when(resultSet.getLong(2)).thenReturn(731L, 731L, 731L);
        when(resultSet.getString(3)).thenReturn("BEGIN", "table pub.cliente: INSERT: id[integer]:1", "COMMIT");

        List<RawChangeEntry> entries = connection.fetchAndAdvance("data_sync_slot", 1000);

        assertThat(entries).containsExactly(
                new RawChangeEntry(Lsn.valueOf("0/16B3748"), 731L, "BEGIN"),
                new RawChangeEntry(Lsn.valueOf("0/16B3790"), 731L, "table pub.cliente: INSERT: id[integer]:1"),
                new RawChangeEntry(Lsn.valueOf("0/16B37D8"), 731L, "COMMIT"));
        verify(statement).setString(1, "data_sync_slot");
        verify(statement).setInt(2, 1000);
        verify(jdbcConnection).setAutoCommit(true);
    }

    @Test
    public void shouldReturnNoEntriesForIdleSlot() throws SQLException {
        when(resultSet.next()).thenReturn(false);

        assertThat(connection.fetchAndAdvance("data_sync_slot", 10)).isEmpty();
    }

    @Test
    public void shouldPassCredentialsAndTimeoutsToDriver() throws SQLException {
        when(resultSet.next()).thenReturn(false);

        connection.fetchAndAdvance("data_sync_slot", 10);

        ArgumentCaptor<Properties> props = ArgumentCaptor.forClass(Properties.class);
        verify(factory).connect(eq("jdbc:postgresql://db:5433/mydb"), props.capture());
        assertThat(props.getValue().getProperty("user")).isEqualTo("myuser");
        assertThat(props.getValue().getProperty("password")).isEqualTo("mypassword");
        assertThat(props.getValue().getProperty("connectTimeout")).isEqualTo("2");
        assertThat(props.getValue().getProperty("socketTimeout")).isEqualTo("60");
    }

    @Test
    public void shouldReuseOpenConnection() throws SQLException {
        when(resultSet.next()).thenReturn(false);

        connection.fetchAndAdvance("data_sync_slot", 10);
        connection.fetchAndAdvance("data_sync_slot", 10);

        verify(factory).connect(anyString(), any(Properties.class));
    }

    @Test
    public void shouldRejectNonPositiveLimit() throws SQLException {
        assertThatThrownBy(() -> connection.fetchAndAdvance("data_sync_slot", 0))
                .isInstanceOf(IllegalArgumentException.class);
        verify(factory, never()).connect(anyString(), any(Properties.class));
    }

    @Test
    public void shouldWrapDatabaseErrors() throws SQLException {
        when(statement.executeQuery()).thenThrow(new SQLException("replication slot \"missing\" does not exist", "42704"));

        assertThatThrownBy(() -> connection.fetchAndAdvance("missing", 10))
                .isInstanceOfSatisfying(SlotFetchException.class, e -> {
                    assertThat(e.getSqlState()).isEqualTo("42704");
                    assertThat(e.getSlotName()).isEqualTo("missing");
                    assertThat(e.getMessage()).doesNotContain("mypassword");
                })
                .hasCauseInstanceOf(SQLException.class);
    }

    @Test
    public void shouldCloseConnection() throws SQLException {
        when(resultSet.next()).thenReturn(false);
        connection.fetchAndAdvance("data_sync_slot", 10);

        connection.close();

        verify(jdbcConnection).close();
    }
}
