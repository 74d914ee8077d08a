package me.storeassist.bot.adapter.outbound.llm;

import me.storeassist.bot.domain.model.LlmRequest;
import me.storeassist.bot.domain.model.LlmResponse;
import me.storeassist.bot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmAdapterFactoryTest {

    private BotProperties properties;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
    }

    private static LlmProviderAdapter createMockAdapter(String providerId, boolean available) {
        LlmProviderAdapter adapter = mock(LlmProviderAdapter.class);
        when(adapter.getProviderId()).thenReturn(providerId);
        when(adapter.isAvailable()).thenReturn(available);
        when(adapter.getCurrentModel()).thenReturn(providerId + "-model");
        return adapter;
    }

    // ===== init() =====

    @Test
    void shouldSelectAndInitializeConfiguredProvider() {
        properties.getLlm().setProvider("langchain4j");
        LlmProviderAdapter langchain4j = createMockAdapter("langchain4j", true);
        LlmProviderAdapter noop = createMockAdapter("none", false);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(langchain4j, noop));
        factory.init();

        assertEquals("langchain4j", factory.getProviderId());
        assertEquals("langchain4j-model", factory.getCurrentModel());
        verify(langchain4j).initialize();
        verify(noop, never()).initialize();
    }

    @Test
    void shouldFallbackToNoopWhenProviderNotFound() {
        properties.getLlm().setProvider("nonexistent");
        LlmProviderAdapter custom = createMockAdapter("custom", true);
        LlmProviderAdapter noop = createMockAdapter("none", false);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(custom, noop));
        factory.init();

        assertEquals("none", factory.getProviderId());
    }

    @Test
    void shouldFallbackToFirstAdapterWhenNoopNotFound() {
        properties.getLlm().setProvider("nonexistent");
        LlmProviderAdapter custom = createMockAdapter("custom", true);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(custom));
        factory.init();

        assertEquals("custom", factory.getProviderId());
    }

    @Test
    void shouldReturnNoneWhenNoAdapters() {
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of());
        factory.init();

        assertEquals("none", factory.getProviderId());
        assertEquals("none", factory.getCurrentModel());
        assertFalse(factory.isAvailable());
    }

    @Test
    void shouldNotCallNoopChatWhenConfiguredProviderIsActive() {
        properties.getLlm().setProvider("langchain4j");
        LlmProviderAdapter langchain4j = createMockAdapter("langchain4j", true);
        LlmProviderAdapter noop = createMockAdapter("none", false);
        LlmRequest request = LlmRequest.builder().userMessage("hi").build();
        when(langchain4j.chat(request)).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("hello").build()));

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(langchain4j, noop));
        factory.init();
        factory.chat(request).join();

        verify(langchain4j).chat(request);
        verify(noop, never()).chat(request);
    }

    // ===== LlmPort delegation =====

    @Test
    void shouldDelegateChatToActiveAdapter() {
        properties.getLlm().setProvider("test");
        LlmProviderAdapter adapter = createMockAdapter("test", true);
        LlmRequest request = LlmRequest.builder().userMessage("hi").build();
        when(adapter.chat(request)).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("hello").build()));

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(adapter));
        factory.init();

        assertEquals("hello", factory.chat(request).join().getContent());
        assertEquals("test-model", factory.getCurrentModel());
        assertTrue(factory.isAvailable());
    }

    @Test
    void shouldFailChatWhenNoAdapterRegistered() {
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of());
        factory.init();

        CompletableFuture<LlmResponse> future = factory.chat(LlmRequest.builder().build());

        assertTrue(future.isCompletedExceptionally());
        Throwable cause = future.handle((response, error) -> error).join();
        assertInstanceOf(IllegalStateException.class, cause);
    }
}
