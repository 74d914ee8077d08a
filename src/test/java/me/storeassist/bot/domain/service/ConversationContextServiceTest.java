package me.storeassist.bot.domain.service;

import me.storeassist.bot.domain.model.ConversationEntry;
import me.storeassist.bot.domain.model.ConversationRole;
import me.storeassist.bot.infrastructure.config.BotProperties;
import me.storeassist.bot.matching.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationContextServiceTest {

    private static final String USER = "42";

    private BotProperties properties;
    private ConversationContextService service;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        service = new ConversationContextService(properties, new TextNormalizer());
    }

    private static List<String> texts(List<ConversationEntry> entries) {
        return entries.stream().map(ConversationEntry::text).toList();
    }

    @Test
    void shouldStartWithEmptyHistory() {
        assertTrue(service.snapshot(USER).isEmpty());
        assertEquals(0, service.size(USER));
    }

    @Test
    void shouldAppendInOrderWithGrowingSequence() {
        ConversationEntry first = service.append(USER, ConversationRole.USER, "hi");
        ConversationEntry second = service.append(USER, ConversationRole.ASSISTANT, "hello");

        assertTrue(second.sequence() > first.sequence());
        assertEquals(List.of(first, second), service.snapshot(USER));
    }

    @Test
    void shouldEvictExactlyOldestEntryWhenBoundExceeded() {
        properties.getConversation().setMaxHistory(3);

        for (int i = 1; i <= 4; i++) {
            service.append(USER, ConversationRole.USER, "m" + i);
        }

        List<ConversationEntry> snapshot = service.snapshot(USER);
        assertEquals(3, snapshot.size());
        assertEquals(List.of("m2", "m3", "m4"), texts(snapshot));
    }

    @Test
    void shouldKeepBoundWithExchanges() {
        properties.getConversation().setMaxHistory(3);

        service.appendExchange(USER, "q1", "a1");
        service.appendExchange(USER, "q2", "a2");

        assertEquals(List.of("a1", "q2", "a2"), texts(service.snapshot(USER)));
    }

    @Test
    void shouldReturnImmutableSnapshot() {
        service.append(USER, ConversationRole.USER, "hi");
        List<ConversationEntry> snapshot = service.snapshot(USER);

        service.append(USER, ConversationRole.ASSISTANT, "hello");

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class,
                () -> snapshot.add(new ConversationEntry(ConversationRole.USER, "x", 99)));
    }

    @Test
    void shouldReturnRecentEntriesOldestFirst() {
        for (int i = 1; i <= 5; i++) {
            service.append(USER, ConversationRole.USER, "m" + i);
        }

        assertEquals(List.of("m4", "m5"), texts(service.recent(USER, 2)));
        assertEquals(5, service.recent(USER, 10).size());
        assertTrue(service.recent(USER, 0).isEmpty());
    }

    @Test
    void shouldSearchNewestFirstIgnoringCase() {
        service.append(USER, ConversationRole.USER, "Looking for WORK in Springfield");
        service.append(USER, ConversationRole.ASSISTANT, "Good luck");
        service.append(USER, ConversationRole.USER, "work is hard");

        List<ConversationEntry> found = service.search(USER, "work", 5);

        assertEquals(List.of("work is hard", "Looking for WORK in Springfield"), texts(found));
        assertEquals(1, service.search(USER, "work", 1).size());
        assertTrue(service.search(USER, "holiday", 5).isEmpty());
        assertTrue(service.search(USER, "  ", 5).isEmpty());
    }

    @Test
    void shouldResetOnlyGivenUser() {
        service.append(USER, ConversationRole.USER, "hi");
        service.append("other", ConversationRole.USER, "hey");

        service.reset(USER);

        assertTrue(service.snapshot(USER).isEmpty());
        assertEquals(1, service.size("other"));
    }

    @Test
    void shouldRejectNullUserId() {
        assertThrows(NullPointerException.class, () -> service.append(null, ConversationRole.USER, "hi"));
    }

    @Test
    void shouldIsolateConcurrentUsers() throws Exception {
        properties.getConversation().setMaxHistory(1000);
        int users = 8;
        int messagesPerUser = 200;
        ExecutorService executor = Executors.newFixedThreadPool(users);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int u = 0; u < users; u++) {
                String userId = "user-" + u;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < messagesPerUser; i++) {
                        service.appendExchange(userId, userId + " q" + i, userId + " a" + i);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        for (int u = 0; u < users; u++) {
            String userId = "user-" + u;
            List<ConversationEntry> history = service.snapshot(userId);
            assertEquals(messagesPerUser * 2, history.size());
            for (int i = 0; i < history.size(); i += 2) {
                assertEquals(ConversationRole.USER, history.get(i).role());
                assertEquals(ConversationRole.ASSISTANT, history.get(i + 1).role());
                assertTrue(history.get(i).text().startsWith(userId + " "));
            }
        }
    }
}
