package me.storeassist.bot.domain.loop;

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

import lombok.extern.slf4j.Slf4j;
import me.storeassist.bot.domain.model.InboundMessageEvent;
import me.storeassist.bot.domain.model.Message;
import me.storeassist.bot.domain.model.Reply;
import me.storeassist.bot.port.inbound.ChannelPort;
import me.storeassist.bot.routing.MessageRouter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Listens for inbound messages and answers them on the dispatch worker pool.
 *
 * <p>
 * The channel's polling thread only enqueues; routing, the LLM wait and the
 * reply happen on a worker, so different users are served in parallel.
 * </p>
 */
@Component
@Slf4j
public class InboundMessageListener {

    private final MessageRouter messageRouter;
    private final ExecutorService dispatchExecutor;
    private final Map<String, ChannelPort> channels;

    public InboundMessageListener(MessageRouter messageRouter,
            @Qualifier("dispatchExecutor") ExecutorService dispatchExecutor,
            List<ChannelPort> channelPorts) {
        this.messageRouter = messageRouter;
        this.dispatchExecutor = dispatchExecutor;
        this.channels = channelPorts.stream()
                .collect(Collectors.toMap(ChannelPort::getChannelType, Function.identity()));
    }

    @EventListener
    public void onInboundMessage(InboundMessageEvent event) {
        Message message = event.message();
        log.debug("[Inbound] enqueue message (channel={}, chatId={})", message.getChannelType(), message.getChatId());
        try {
            dispatchExecutor.submit(() -> process(message));
        } catch (RejectedExecutionException e) {
            log.warn("[Inbound] Dispatch pool rejected message from chat {}: {}", message.getChatId(),
                    e.getMessage());
        }
    }

    void process(Message message) {
        ChannelPort channel = channels.get(message.getChannelType());
        if (channel == null) {
            log.warn("[Inbound] No channel registered for type {}", message.getChannelType());
            return;
        }

        channel.showTyping(message.getChatId());
        Reply reply = messageRouter.route(message.getSenderId(), message.getContent());
        log.debug("[Inbound] reply kind={} to chatId={}", reply.kind(), message.getChatId());
        channel.sendMessage(message.getChatId(), reply.text())
                .exceptionally(e -> {
                    log.error("[Inbound] Failed to deliver reply to chat {}", message.getChatId(), e);
                    return null;
                });
    }
}
