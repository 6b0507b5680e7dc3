/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.sink;

/**
 * A store of immutable objects addressed by bucket and key.
 */
public interface ObjectSink extends AutoCloseable {

    /**
     * Store the content under the given key. The object becomes visible in full or not at all; an existing object with
     * the same key is replaced.
     *
     * @param bucket the bucket, which must already exist; may not be null
     * @param key the key of the object; may not be null
     * @param content the bytes to store; may not be null
     * @param contentType the media type of the content, e.g. {@code text/csv}
     * @throws SinkWriteException if the object cannot be stored
     */
    void putObject(String bucket, String key, byte[] content, String contentType);

    @Override
    default void close() {
    }
}
