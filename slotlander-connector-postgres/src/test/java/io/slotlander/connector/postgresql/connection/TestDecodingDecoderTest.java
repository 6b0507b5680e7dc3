/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.connector.postgresql.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import io.slotlander.connector.postgresql.connection.DecodedChange.Operation;
import io.slotlander.relational.TableId;

public class TestDecodingDecoderTest {

    private final TestDecodingDecoder decoder = new TestDecodingDecoder();

    @Test
    public void shouldDecodeInsert() {
        Optional<DecodedChange> change = decoder.decode("table pub.cliente: INSERT: id[integer]:1 name[text]:'Ana Silva'");

        assertThat(change).contains(new DecodedChange(new TableId("pub", "cliente"), Operation.INSERT,
                Map.of("id", "1", "name", "Ana Silva")));
    }

    @Test
    public void shouldKeepColumnOrderOfTheLine() {
        DecodedChange change = decoder.decode("table db_loja.cliente: UPDATE: zeta[integer]:3 alpha[text]:'a' mid[boolean]:true")
                .orElseThrow();

        assertThat(change.operation()).isEqualTo(Operation.UPDATE);
        assertThat(change.columns()).containsExactly(entry("zeta", "3"), entry("alpha", "a"), entry("mid", "true"));
    }

    @Test
    public void shouldKeepWhitespaceInsideQuotedValue() {
        DecodedChange change = decoder.decode("table pub.cliente: INSERT: name[text]:'Ana Maria Silva' id[integer]:7")
                .orElseThrow();

        assertThat(change.columns()).containsExactly(entry("name", "Ana Maria Silva"), entry("id", "7"));
    }

    @Test
    public void shouldReadTypesWithSpacesAndNestedBrackets() {
        DecodedChange change = decoder.decode("table public.orders: INSERT: id[bigint]:10 "
                + "created[timestamp without time zone]:'2025-01-31 10:15:30.123' "
                + "tags[character varying[]]:'{a,b}' note[character varying(20)]:null")
                .orElseThrow();

        assertThat(change.columns()).containsExactly(
                entry("id", "10"),
                entry("created", "2025-01-31 10:15:30.123"),
                entry("tags", "{a,b}"),
                entry("note", "null"));
    }

    @Test
    public void shouldNotUnescapeQuotesInsideValue() {
        DecodedChange change = decoder.decode("table pub.cliente: INSERT: name[text]:'O''Brien'").orElseThrow();

        assertThat(change.columns()).containsExactly(entry("name", "O''Brien"));
    }

    @Test
    public void shouldReadQuotedColumnNames() {
        DecodedChange change = decoder.decode("table public.orders: INSERT: \"createdAt\"[timestamp without time zone]:'2025-01-31 10:15:30' "
                + "id[integer]:1 \"Order Note\"[text]:'fragile box'")
                .orElseThrow();

        assertThat(change.columns()).containsExactly(
                entry("createdAt", "2025-01-31 10:15:30"),
                entry("id", "1"),
                entry("Order Note", "fragile box"));
    }

    @Test
    public void shouldUnescapeDoubledQuotesInColumnName() {
        DecodedChange change = decoder.decode("table pub.cliente: UPDATE: \"say \"\"hi\"\"\"[text]:'x' id[integer]:2").orElseThrow();

        assertThat(change.columns()).containsExactly(entry("say \"hi\"", "x"), entry("id", "2"));
    }

    @Test
    public void shouldDecodeDeleteWithoutTupleData() {
        DecodedChange change = decoder.decode("table pub.cliente: DELETE: (no-tuple-data)").orElseThrow();

        assertThat(change.tableId()).isEqualTo(new TableId("pub", "cliente"));
        assertThat(change.operation()).isEqualTo(Operation.DELETE);
        assertThat(change.columns()).isEmpty();
    }

    @Test
    public void shouldDecodeDeleteWithKey() {
        DecodedChange change = decoder.decode("table pub.cliente: DELETE: id[integer]:42").orElseThrow();

        assertThat(change.operation()).isEqualTo(Operation.DELETE);
        assertThat(change.columns()).containsExactly(entry("id", "42"));
    }

    @Test
    public void shouldKeepNewTupleOfUpdateWithOldKey() {
        DecodedChange change = decoder.decode("table pub.cliente: UPDATE: old-key: id[integer]:1 new-tuple: id[integer]:2 name[text]:'Ana'")
                .orElseThrow();

        assertThat(change.columns()).containsExactly(entry("id", "2"), entry("name", "Ana"));
    }

    @Test
    public void shouldIgnoreSurroundingWhitespace() {
        assertThat(decoder.decode("  table pub.cliente: INSERT: id[integer]:1 \n"))
                .contains(new DecodedChange(new TableId("pub", "cliente"), Operation.INSERT, Map.of("id", "1")));
    }

    @Test
    public void shouldCompareNamesExactly() {
        DecodedChange change = decoder.decode("table Pub.Cliente_2: INSERT: id[integer]:1").orElseThrow();

        assertThat(change.schema()).isEqualTo("Pub");
        assertThat(change.table()).isEqualTo("Cliente_2");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
            "BEGIN 1234",
            "COMMIT 1234",
            "BEGIN",
            "table",
            "tables pub.cliente: INSERT: id[integer]:1",
            "table pub: INSERT: id[integer]:1",
            "table .cliente: INSERT: id[integer]:1",
            "table pub.: INSERT: id[integer]:1",
            "table pub.cliente INSERT: id[integer]:1",
            "table pub.cliente: TRUNCATE: (no-flags)",
            "table pub.cliente: insert: id[integer]:1",
            "table pub.cliente: INSERT:id[integer]:1",
            "message: transactional: 1 prefix: test, sz: 4 content:abcd"
    })
    public void shouldSkipLinesThatAreNotRowChanges(String line) {
        assertThat(decoder.decode(line)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "table pub.cliente: INSERT: id[integer",
            "table pub.cliente: INSERT: id[integer]1",
            "table pub.cliente: INSERT: 'loose' id[integer]:1",
            "table pub.cliente: UPDATE: old-key: id[integer]:1",
            "table pub.cliente: INSERT: \"createdAt[timestamp]:1",
            "table pub.cliente: INSERT: \"createdAt\":1"
    })
    public void shouldSkipRowChangesWithUnreadableColumns(String line) {
        assertThat(decoder.decode(line)).isEmpty();
    }

    @Test
    public void shouldSplitQuotedValueContainingColumnToken() {
        // a value cannot be told apart from the start of the next column without type information
        DecodedChange change = decoder.decode("table pub.cliente: INSERT: note[text]:'see x[1]:2' id[integer]:1").orElseThrow();

        assertThat(change.columns()).containsExactly(entry("note", "'see"), entry("x", "2'"), entry("id", "1"));
    }

    @Test
    public void shouldDecodeSameInputToEqualChanges() {
        String line = "table pub.cliente: INSERT: id[integer]:1 name[text]:'Ana Silva' city[text]:'São Paulo'";

        DecodedChange first = decoder.decode(line).orElseThrow();
        DecodedChange second = decoder.decode(line).orElseThrow();

        assertThat(first).isEqualTo(second);
        assertThat(first.columns()).containsEntry("city", "São Paulo");
    }
}
