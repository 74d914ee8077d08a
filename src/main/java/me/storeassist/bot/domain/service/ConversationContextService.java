package me.storeassist.bot.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.storeassist.bot.domain.model.ConversationEntry;
import me.storeassist.bot.domain.model.ConversationRole;
import me.storeassist.bot.infrastructure.config.BotProperties;
import me.storeassist.bot.matching.TextNormalizer;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the bounded, per-user conversation history sent to the LLM.
 *
 * <p>
 * Each user id owns one {@link ConversationSession}, created lazily on first
 * use and kept until {@link #reset(String)} or process exit. Mutations of one
 * session are serialized on that session's own lock; sessions of different
 * users never share a lock.
 *
 * <p>
 * Once a session holds more than {@code bot.conversation.max-history}
 * entries, the oldest entries are evicted before the append returns.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationContextService {

    private final BotProperties properties;
    private final TextNormalizer normalizer;

    private final Map<String, ConversationSession> sessions = new ConcurrentHashMap<>();

    public ConversationEntry append(String userId, ConversationRole role, String text) {
        Objects.requireNonNull(role, "role");
        ConversationSession session = session(userId);
        synchronized (session) {
            return session.append(role, text, maxHistory());
        }
    }

    /**
     * Appends a user turn and the assistant answer to it with no other entry of
     * the same user in between.
     */
    public void appendExchange(String userId, String userText, String assistantText) {
        ConversationSession session = session(userId);
        synchronized (session) {
            session.append(ConversationRole.USER, userText, maxHistory());
            session.append(ConversationRole.ASSISTANT, assistantText, maxHistory());
        }
    }

    /**
     * Immutable copy of the user's history, oldest first.
     */
    public List<ConversationEntry> snapshot(String userId) {
        ConversationSession session = session(userId);
        synchronized (session) {
            return List.copyOf(session.entries);
        }
    }

    /**
     * The last {@code limit} entries of the user's history, oldest first.
     */
    public List<ConversationEntry> recent(String userId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        ConversationSession session = session(userId);
        synchronized (session) {
            List<ConversationEntry> all = new ArrayList<>(session.entries);
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        }
    }

    /**
     * Entries whose normalized text contains the normalized query, newest first.
     */
    public List<ConversationEntry> search(String userId, String query, int limit) {
        String needle = normalizer.normalize(query);
        if (needle.isEmpty() || limit <= 0) {
            return List.of();
        }

        List<ConversationEntry> copy = snapshot(userId);
        List<ConversationEntry> found = new ArrayList<>();
        for (int i = copy.size() - 1; i >= 0 && found.size() < limit; i--) {
            ConversationEntry entry = copy.get(i);
            if (normalizer.normalize(entry.text()).contains(needle)) {
                found.add(entry);
            }
        }
        return List.copyOf(found);
    }

    public void reset(String userId) {
        ConversationSession session = session(userId);
        synchronized (session) {
            int cleared = session.entries.size();
            session.entries.clear();
            log.debug("[Context] Reset session for user {} ({} entries cleared)", userId, cleared);
        }
    }

    public int size(String userId) {
        ConversationSession session = session(userId);
        synchronized (session) {
            return session.entries.size();
        }
    }

    private ConversationSession session(String userId) {
        Objects.requireNonNull(userId, "userId");
        return sessions.computeIfAbsent(userId, ConversationSession::new);
    }

    private int maxHistory() {
        return Math.max(1, properties.getConversation().getMaxHistory());
    }

    /**
     * Bounded history of one user. Guarded by its own monitor.
     */
    private static final class ConversationSession {

        private final String userId;
        private final Deque<ConversationEntry> entries = new ArrayDeque<>();
        private long nextSequence = 1;

        private ConversationSession(String userId) {
            this.userId = userId;
        }

        private ConversationEntry append(ConversationRole role, String text, int maxHistory) {
            ConversationEntry entry = new ConversationEntry(role, text != null ? text : "", nextSequence++);
            entries.addLast(entry);

            int evicted = 0;
            while (entries.size() > maxHistory) {
                entries.removeFirst();
                evicted++;
            }
            if (evicted > 0) {
                log.trace("[Context] Evicted {} oldest entries for user {}", evicted, userId);
            }
            return entry;
        }
    }
}
