/*
 * Copyright Slotlander Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.slotlander;

/**
 * Base exception raised by Slotlander components.
 *
 */
public class SlotlanderException extends RuntimeException {

    private static final long serialVersionUID = 4470861524632120571L;

    public SlotlanderException() {
    }

    public SlotlanderException(String message) {
        super(message);
    }

    public SlotlanderException(Throwable cause) {
        super(cause);
    }

    public SlotlanderException(String message, Throwable cause) {
        super(message, cause);
    }
}
