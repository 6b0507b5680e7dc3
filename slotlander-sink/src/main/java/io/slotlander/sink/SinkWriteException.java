/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander.sink;

import io.slotlander.SlotlanderException;

/**
 * Raised when a batch cannot be stored in the object store. Nothing of the batch is visible under its key.
 */
public class SinkWriteException extends SlotlanderException {

    private static final long serialVersionUID = 1L;

    private final String bucket;
    private final String key;

    public SinkWriteException(String bucket, String key, String message, Throwable cause) {
        super(message, cause);
        this.bucket = bucket;
        this.key = key;
    }

    public String getBucket() {
        return bucket;
    }

    public String getKey() {
        return key;
    }
}
