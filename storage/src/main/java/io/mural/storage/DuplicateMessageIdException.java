package io.mural.storage;

import io.mural.core.MessageId;

/**
 * A locally authored message reused an id that is already stored.
 * Only possible if id generation is broken; the write is rejected.
 */
public class DuplicateMessageIdException extends RuntimeException {

    private final MessageId id;

    public DuplicateMessageIdException(MessageId id) {
        super("message id already present: " + id);
        this.id = id;
    }

    public MessageId id() {
        return id;
    }
}
