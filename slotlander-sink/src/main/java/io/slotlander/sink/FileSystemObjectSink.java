/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.sink;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.slotlander.config.Field;

/**
 * Stores objects as files below a root directory, using {@code <root>/<bucket>/<key>} as path. The content is written
 * to a temporary file next to the target and then moved into place, so readers never see a partial object.
 */
public class FileSystemObjectSink implements ObjectSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemObjectSink.class);

    public static final Field ROOT = Field.create("filesystem.root")
            .withDescription("Directory below which bucket directories are located.")
            .withDefault("data");

    private final Path root;

    public FileSystemObjectSink(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    Path pathFor(String bucket, String key) {
        final Path bucketDir = root.resolve(bucket).normalize();
        final Path target = bucketDir.resolve(key).normalize();
        if (!bucketDir.startsWith(root) || !target.startsWith(bucketDir) || target.equals(bucketDir)) {
            throw new SinkWriteException(bucket, key, "Object key '" + key + "' does not denote a file within bucket '" + bucket + "'", null);
        }
        return target;
    }

    @Override
    public void putObject(String bucket, String key, byte[] content, String contentType) {
        final Path target = pathFor(bucket, key);
        if (!Files.isDirectory(root.resolve(bucket))) {
            throw new SinkWriteException(bucket, key, "Bucket directory '" + root.resolve(bucket) + "' does not exist", null);
        }
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
            Files.write(temp, content);
            move(temp, target);
            LOGGER.debug("Stored {} bytes as {}", content.length, target);
        }
        catch (IOException e) {
            deleteQuietly(temp);
            throw new SinkWriteException(bucket, key, "Failed to write object '" + key + "' to " + target + ": " + e.getMessage(), e);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        }
        catch (AtomicMoveNotSupportedException e) {
            LOGGER.warn("File system does not support atomic moves, replacing {} non-atomically", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        }
        catch (IOException e) {
            LOGGER.warn("Unable to delete temporary file {}", path, e);
        }
    }
}
