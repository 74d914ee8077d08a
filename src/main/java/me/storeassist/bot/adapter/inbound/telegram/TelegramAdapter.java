package me.storeassist.bot.adapter.inbound.telegram;

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

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.storeassist.bot.domain.model.InboundMessageEvent;
import me.storeassist.bot.domain.model.Message;
import me.storeassist.bot.infrastructure.config.BotProperties;
import me.storeassist.bot.infrastructure.i18n.MessageService;
import me.storeassist.bot.port.inbound.ChannelPort;
import me.storeassist.bot.port.inbound.CommandPort;
import me.storeassist.bot.security.AllowlistValidator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.ActionType;
import org.telegram.telegrambots.meta.api.methods.send.SendChatAction;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Telegram channel adapter using long polling.
 *
 * <p>
 * This adapter implements both {@link ChannelPort} for outbound messaging and
 * {@link LongPollingSingleThreadUpdateConsumer} for inbound updates.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Long polling for incoming messages via Telegram Bot API
 * <li>User authorization via the channel allowlist
 * <li>Command routing (slash commands) before the message router
 * <li>Message splitting for Telegram's 4096 character limit
 * </ul>
 *
 * <p>
 * Plain text is published as an {@link InboundMessageEvent} and answered
 * asynchronously, so the polling thread is never blocked by an LLM call.
 *
 * <p>
 * The adapter is always available as a Spring bean but only starts polling if
 * {@code bot.channels.telegram.enabled=true} and a token is configured.
 *
 * @see me.storeassist.bot.port.inbound.ChannelPort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramAdapter implements ChannelPort, LongPollingSingleThreadUpdateConsumer {

    static final String CHANNEL_TYPE = "telegram";
    private static final int TELEGRAM_MAX_MESSAGE_LENGTH = 4096;
    private static final int CHUNK_LENGTH = 3800;

    private final BotProperties properties;
    private final AllowlistValidator allowlistValidator;
    private final ApplicationEventPublisher eventPublisher;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final MessageService messageService;
    private final ObjectProvider<CommandPort> commandRouter;

    private TelegramClient telegramClient;
    private volatile boolean running = false;
    private volatile boolean initialized = false;
    private final Object lifecycleLock = new Object();

    /**
     * Package-private setter for testing, allows injecting a mock TelegramClient.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
        this.initialized = true;
    }

    private BotProperties.ChannelProperties channelProperties() {
        return properties.getChannels().get(CHANNEL_TYPE);
    }

    private boolean isEnabled() {
        BotProperties.ChannelProperties channel = channelProperties();
        return channel != null && channel.isEnabled();
    }

    private String getToken() {
        BotProperties.ChannelProperties channel = channelProperties();
        return channel != null ? channel.getToken() : null;
    }

    private synchronized void ensureInitialized() {
        if (initialized || !isEnabled())
            return;

        String token = getToken();
        if (token == null || token.isBlank()) {
            log.warn("Telegram token not configured, adapter will not start");
            return;
        }
        this.telegramClient = new OkHttpTelegramClient(token);
        initialized = true;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("Telegram adapter already running");
                return;
            }
            if (!isEnabled()) {
                log.info("Telegram channel disabled");
                return;
            }
            ensureInitialized();
            if (telegramClient == null) {
                log.warn("Telegram client not initialized, cannot start");
                return;
            }

            try {
                botsApplication.registerBot(getToken(), this);
                running = true;
                log.info("Telegram adapter started");
            } catch (TelegramApiException e) {
                log.error("Failed to start Telegram adapter", e);
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            try {
                botsApplication.close();
                log.info("Telegram adapter stopped");
            } catch (Exception e) {
                log.error("Error stopping Telegram adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void consume(Update update) {
        if (update.hasMessage()) {
            handleMessage(update);
        }
    }

    private void handleMessage(Update update) {
        org.telegram.telegrambots.meta.api.objects.message.Message telegramMessage = update.getMessage();
        String chatId = telegramMessage.getChatId().toString();
        String userId = telegramMessage.getFrom().getId().toString();

        if (!allowlistValidator.isAllowed(CHANNEL_TYPE, userId)) {
            sendMessage(chatId, messageService.getMessage("security.unauthorized"));
            return;
        }

        if (!telegramMessage.hasText()) {
            log.debug("Ignoring non-text message in chat {}", chatId);
            sendMessage(chatId, messageService.getMessage("reply.clarify"));
            return;
        }

        String text = telegramMessage.getText();
        if (text.startsWith("/") && routeCommand(chatId, userId, text)) {
            return;
        }

        Message message = Message.builder()
                .id(telegramMessage.getMessageId().toString())
                .channelType(CHANNEL_TYPE)
                .chatId(chatId)
                .senderId(userId)
                .content(text)
                .timestamp(Instant.now())
                .build();

        eventPublisher.publishEvent(new InboundMessageEvent(message));
    }

    private boolean routeCommand(String chatId, String userId, String text) {
        String[] parts = text.trim().split("\\s+", 2);
        String cmd = parts[0].substring(1).split("@")[0]; // strip / and @botname

        CommandPort router = commandRouter.getIfAvailable();
        if (router == null || !router.hasCommand(cmd)) {
            return false;
        }

        List<String> args = parts.length > 1
                ? Arrays.asList(parts[1].split("\\s+"))
                : List.of();
        Map<String, Object> ctx = Map.<String, Object>of(
                CommandPort.CONTEXT_USER_ID, userId,
                CommandPort.CONTEXT_CHAT_ID, chatId,
                CommandPort.CONTEXT_CHANNEL_TYPE, CHANNEL_TYPE);
        try {
            var result = router.execute(cmd, args, ctx).join();
            sendMessage(chatId, result.output());
        } catch (Exception e) {
            log.error("Command execution failed: /{}", cmd, e);
            sendMessage(chatId, messageService.getMessage("command.failed"));
        }
        return true;
    }

    @Override
    public CompletableFuture<Void> sendMessage(String chatId, String content) {
        return CompletableFuture.runAsync(() -> {
            try {
                for (String chunk : splitAtNewlines(content, CHUNK_LENGTH)) {
                    String text = chunk.length() > TELEGRAM_MAX_MESSAGE_LENGTH
                            ? chunk.substring(0, TELEGRAM_MAX_MESSAGE_LENGTH - 3) + "..."
                            : chunk;
                    telegramClient.execute(SendMessage.builder()
                            .chatId(chatId)
                            .text(text)
                            .build());
                }
            } catch (TelegramApiException e) {
                log.error("Failed to send message to chat: {}", chatId, e);
                throw new IllegalStateException("Failed to send message", e);
            }
        });
    }

    /**
     * Split text at paragraph (\n\n) or line (\n) boundaries to keep chunks under
     * maxLength. Falls back to a hard split when a line alone is too long.
     */
    static List<String> splitAtNewlines(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        int start = 0;

        while (start < text.length()) {
            if (start + maxLength >= text.length()) {
                chunks.add(text.substring(start));
                break;
            }

            String segment = text.substring(start, start + maxLength);

            int splitAt = segment.lastIndexOf("\n\n");
            if (splitAt > maxLength / 4) {
                chunks.add(text.substring(start, start + splitAt));
                start += splitAt + 2;
                continue;
            }

            splitAt = segment.lastIndexOf('\n');
            if (splitAt > maxLength / 4) {
                chunks.add(text.substring(start, start + splitAt));
                start += splitAt + 1;
                continue;
            }

            chunks.add(text.substring(start, start + maxLength));
            start += maxLength;
        }

        return chunks;
    }

    @Override
    public void showTyping(String chatId) {
        try {
            SendChatAction action = SendChatAction.builder()
                    .chatId(chatId)
                    .action(ActionType.TYPING.toString())
                    .build();
            telegramClient.execute(action);
        } catch (Exception e) {
            log.debug("Failed to send typing indicator", e);
        }
    }
}
