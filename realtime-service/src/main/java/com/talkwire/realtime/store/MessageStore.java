package com.talkwire.realtime.store;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable store for conversations, messages and read receipts.
 * Implementations throw {@link StoreUnavailableException} when the backend
 * cannot be reached.
 */
public interface MessageStore {

    /**
     * Conversations the user participates in, used to auto-join rooms at session start.
     */
    Set<Long> conversationsOf(Long userId);

    StoredMessage saveMessage(Long conversationId, Long senderId, String content);

    /**
     * Persists a read receipt. Returns empty when the user had already read the message.
     */
    Optional<StoredReadReceipt> saveReadReceipt(Long conversationId, Long messageId, Long userId);

    /**
     * Messages with an id greater than {@code lastMessageId}, oldest first, at most {@code limit}.
     * A null {@code lastMessageId} starts from the beginning of the conversation.
     */
    List<StoredMessage> findMessagesAfter(Long conversationId, Long lastMessageId, int limit);
}
