// file: storage/src/main/java/io/mural/storage/MessageStore.java
package io.mural.storage;

import io.mural.core.Message;
import io.mural.core.MessageId;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Authoritative per-node container of board messages.
 * <p>
 * Semantics:
 *  - insert() and merge() are durable before returning.
 *  - merge() is set union by id: idempotent, commutative and associative, so
 *    replication order, duplicates and retries never change the outcome.
 *  - Messages are never removed.
 */
public interface MessageStore {

    /**
     * Add a locally authored message.
     *
     * @throws DuplicateMessageIdException if the id is already stored
     * @throws StorageException            if the message could not be made durable
     */
    void insert(Message message);

    /**
     * Add every message whose id is not yet stored.
     *
     * @return number of messages newly added
     * @throws StorageException if a new message could not be made durable
     */
    int merge(Collection<Message> incoming);

    /** Full current message set; immutable copy. */
    Set<Message> snapshot();

    /** All messages in {@link Message#DISPLAY_ORDER}; immutable copy. */
    List<Message> orderedView();

    boolean contains(MessageId id);

    int size();
}
