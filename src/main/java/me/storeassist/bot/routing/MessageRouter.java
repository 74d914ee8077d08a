package me.storeassist.bot.routing;

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
import me.storeassist.bot.catalog.StoreCatalog;
import me.storeassist.bot.domain.model.ConversationEntry;
import me.storeassist.bot.domain.model.ConversationRole;
import me.storeassist.bot.domain.model.IntentClassification;
import me.storeassist.bot.domain.model.LlmRequest;
import me.storeassist.bot.domain.model.LlmResponse;
import me.storeassist.bot.domain.model.MatchResult;
import me.storeassist.bot.domain.model.Reply;
import me.storeassist.bot.domain.model.ReplyKind;
import me.storeassist.bot.domain.model.StoreRecord;
import me.storeassist.bot.domain.service.ConversationContextService;
import me.storeassist.bot.infrastructure.config.BotProperties;
import me.storeassist.bot.infrastructure.i18n.MessageService;
import me.storeassist.bot.matching.StoreResolver;
import me.storeassist.bot.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single entry point turning an inbound user message into a reply.
 *
 * <p>
 * Every message is classified by {@link IntentClassifier}:
 * <ul>
 * <li><b>LOOKUP</b> - resolved against the store catalog; an empty result is
 * answered with a "no match" text. Lookups never touch conversation
 * history.</li>
 * <li><b>CHAT</b> - the last {@code bot.conversation.context-window} entries
 * and the new text go to the LLM; the user/assistant exchange is appended to
 * the history once the answer arrives.</li>
 * </ul>
 *
 * <p>
 * {@link #route(String, String)} never throws. A blank message gets a
 * clarification prompt; an LLM failure or timeout gets the fixed fallback
 * text and leaves the history untouched (unless
 * {@code bot.conversation.retain-failed-user-turn} keeps the user turn). No
 * lock is held while waiting for the LLM.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageRouter {

    private static final int LOG_PREVIEW_LENGTH = 80;

    private final BotProperties properties;
    private final IntentClassifier intentClassifier;
    private final StoreResolver storeResolver;
    private final StoreCatalog storeCatalog;
    private final ConversationContextService contextService;
    private final LlmPort llmPort;
    private final MessageService messageService;

    public Reply route(String userId, String rawMessage) {
        try {
            String text = requireText(rawMessage);
            IntentClassification classification = intentClassifier.classify(text);
            log.debug("[Router] user={} intent={} cue={} text='{}'", userId, classification.intent(),
                    classification.cue(), truncate(text));

            return switch (classification.intent()) {
            case LOOKUP -> resolveStores(text);
            case CHAT -> chat(userId, text);
            };
        } catch (MalformedInputException e) {
            log.debug("[Router] Malformed input from user {}: {}", userId, e.getMessage());
            return Reply.of(ReplyKind.CLARIFICATION, messageService.getMessage("reply.clarify"));
        } catch (LlmUnavailableException e) {
            log.warn("[Router] LLM unavailable for user {}: {}", userId, e.getMessage());
            return fallback();
        } catch (RuntimeException e) {
            log.error("[Router] Failed to handle message from user {}", userId, e);
            return fallback();
        }
    }

    /**
     * Runs a store lookup regardless of the message's intent.
     */
    public Reply lookup(String userId, String query) {
        try {
            return resolveStores(requireText(query));
        } catch (MalformedInputException e) {
            return Reply.of(ReplyKind.CLARIFICATION, messageService.getMessage("reply.clarify"));
        } catch (RuntimeException e) {
            log.error("[Router] Lookup failed for user {}", userId, e);
            return fallback();
        }
    }

    private Reply resolveStores(String query) {
        List<MatchResult> matches = storeResolver.resolve(query, storeCatalog);
        if (matches.isEmpty()) {
            return Reply.of(ReplyKind.NO_MATCH, messageService.getMessage("reply.lookup.none", query.strip()));
        }
        return Reply.of(ReplyKind.LOOKUP_MATCH, formatMatches(matches));
    }

    private String formatMatches(List<MatchResult> matches) {
        int listed = Math.min(matches.size(), Math.max(1, properties.getRouting().getMaxListedMatches()));

        StringBuilder sb = new StringBuilder(messageService.getMessage("reply.lookup.header"));
        for (MatchResult match : matches.subList(0, listed)) {
            StoreRecord store = match.record();
            String location = store.hasRegion()
                    ? messageService.getMessage("reply.lookup.location.region", store.city(), store.region())
                    : store.city();
            sb.append('\n');
            if (store.hasAddress()) {
                sb.append(messageService.getMessage("reply.lookup.item.address",
                        store.storeName(), location, store.address()));
            } else {
                sb.append(messageService.getMessage("reply.lookup.item", store.storeName(), location));
            }
        }
        if (matches.size() > listed) {
            sb.append('\n').append(messageService.getMessage("reply.lookup.more", matches.size() - listed));
        }
        return sb.toString();
    }

    private Reply chat(String userId, String text) {
        BotProperties.ConversationProperties conversation = properties.getConversation();
        List<ConversationEntry> history = contextService.recent(userId, conversation.getContextWindow());

        LlmRequest request = LlmRequest.builder()
                .systemPrompt(properties.getLlm().getSystemPrompt())
                .history(history)
                .userMessage(text)
                .userId(userId)
                .build();

        String answer;
        try {
            answer = ask(request);
        } catch (LlmUnavailableException e) {
            if (conversation.isRetainFailedUserTurn()) {
                contextService.append(userId, ConversationRole.USER, text);
            }
            throw e;
        }

        contextService.appendExchange(userId, text, answer);
        return Reply.of(ReplyKind.CHAT, answer);
    }

    private String ask(LlmRequest request) {
        Duration timeout = properties.getLlm().getReplyTimeout();
        CompletableFuture<LlmResponse> future;
        try {
            future = llmPort.chat(request);
        } catch (RuntimeException e) {
            throw new LlmUnavailableException("LLM call could not be started: " + e.getMessage(), e);
        }
        if (future == null) {
            throw new LlmUnavailableException("LLM returned no response");
        }

        try {
            LlmResponse response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (response == null || !response.hasContent()) {
                throw new LlmUnavailableException("LLM returned an empty answer");
            }
            return response.getContent().strip();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new LlmUnavailableException("LLM did not answer within " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new LlmUnavailableException("LLM call failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmUnavailableException("Interrupted while waiting for the LLM", e);
        }
    }

    private Reply fallback() {
        return Reply.of(ReplyKind.FALLBACK, messageService.getMessage("reply.fallback"));
    }

    private static String requireText(String rawMessage) {
        if (rawMessage == null || rawMessage.isBlank()) {
            throw new MalformedInputException("Message has no text");
        }
        return rawMessage;
    }

    private static String truncate(String text) {
        if (text.length() <= LOG_PREVIEW_LENGTH)
            return text;
        return text.substring(0, LOG_PREVIEW_LENGTH) + "...";
    }
}
