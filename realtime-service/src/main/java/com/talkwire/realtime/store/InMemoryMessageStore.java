package com.talkwire.realtime.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local {@link MessageStore} used when no durable backend is wired in.
 * Loses everything on restart.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryMessageStore implements MessageStore {

    private final Clock clock;

    private final AtomicLong messageSequence = new AtomicLong();

    // conversationId -> messages in id order
    private final Map<Long, List<StoredMessage>> messages = new ConcurrentHashMap<>();

    // userId -> conversationIds
    private final Map<Long, Set<Long>> participants = new ConcurrentHashMap<>();

    // "messageId:userId" of receipts already recorded
    private final Set<String> receipts = ConcurrentHashMap.newKeySet();

    public void addParticipant(Long conversationId, Long userId) {
        participants.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet()).add(conversationId);
    }

    @Override
    public Set<Long> conversationsOf(Long userId) {
        Set<Long> conversations = participants.get(userId);
        return conversations == null ? Collections.emptySet() : Set.copyOf(conversations);
    }

    @Override
    public StoredMessage saveMessage(Long conversationId, Long senderId, String content) {
        List<StoredMessage> conversation = messages.computeIfAbsent(conversationId, k -> new ArrayList<>());
        synchronized (conversation) {
            StoredMessage message = new StoredMessage(messageSequence.incrementAndGet(), conversationId, senderId,
                    content, StoredMessage.TYPE_TEXT, clock.instant(), false);
            conversation.add(message);
            addParticipant(conversationId, senderId);
            return message;
        }
    }

    @Override
    public Optional<StoredReadReceipt> saveReadReceipt(Long conversationId, Long messageId, Long userId) {
        if (!receipts.add(messageId + ":" + userId)) {
            return Optional.empty();
        }
        return Optional.of(new StoredReadReceipt(messageId, conversationId, userId, clock.instant()));
    }

    @Override
    public List<StoredMessage> findMessagesAfter(Long conversationId, Long lastMessageId, int limit) {
        List<StoredMessage> conversation = messages.get(conversationId);
        if (conversation == null) {
            return List.of();
        }
        synchronized (conversation) {
            return conversation.stream()
                    .filter(message -> lastMessageId == null || message.id() > lastMessageId)
                    .limit(limit)
                    .toList();
        }
    }
}
