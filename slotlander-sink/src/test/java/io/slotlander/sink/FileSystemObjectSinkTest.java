/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.sink;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class FileSystemObjectSinkTest {

    @TempDir
    Path root;

    private FileSystemObjectSink sink;

    @BeforeEach
    public void beforeEach() throws IOException {
        Files.createDirectories(root.resolve("raw"));
        sink = new FileSystemObjectSink(root);
    }

    @Test
    public void shouldWriteObjectBelowBucket() throws IOException {
        sink.putObject("raw", "inc/data=20250131/cliente_cdc_20250131_101530.csv", "a,b".getBytes(StandardCharsets.UTF_8), "text/csv");

        Path target = root.resolve("raw/inc/data=20250131/cliente_cdc_20250131_101530.csv");
        assertThat(target).hasContent("a,b");
        try (Stream<Path> files = Files.list(target.getParent())) {
            assertThat(files.collect(Collectors.toList())).containsExactly(target);
        }
    }

    @Test
    public void shouldReplaceExistingObject() throws IOException {
        sink.putObject("raw", "x.csv", "first".getBytes(StandardCharsets.UTF_8), "text/csv");
        sink.putObject("raw", "x.csv", "second".getBytes(StandardCharsets.UTF_8), "text/csv");

        assertThat(root.resolve("raw/x.csv")).hasContent("second");
    }

    @Test
    public void shouldRequireExistingBucket() {
        assertThatThrownBy(() -> sink.putObject("missing", "x.csv", new byte[0], "text/csv"))
                .isInstanceOf(SinkWriteException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    public void shouldRejectKeysOutsideBucket() {
        assertThatThrownBy(() -> sink.putObject("raw", "../escape.csv", new byte[0], "text/csv"))
                .isInstanceOfSatisfying(SinkWriteException.class, e -> {
                    assertThat(e.getBucket()).isEqualTo("raw");
                    assertThat(e.getKey()).isEqualTo("../escape.csv");
                });
        assertThat(root.resolve("escape.csv")).doesNotExist();
    }
}
