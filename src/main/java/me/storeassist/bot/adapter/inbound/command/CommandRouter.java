package me.storeassist.bot.adapter.inbound.command;

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
import me.storeassist.bot.domain.model.ConversationEntry;
import me.storeassist.bot.domain.model.Reply;
import me.storeassist.bot.domain.service.ConversationContextService;
import me.storeassist.bot.infrastructure.i18n.MessageService;
import me.storeassist.bot.port.inbound.CommandPort;
import me.storeassist.bot.routing.MessageRouter;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Routes slash commands to appropriate handlers.
 *
 * <ul>
 * <li>/start - Greeting with a usage hint
 * <li>/help - Show available commands
 * <li>/reset - Clear the caller's conversation history
 * <li>/search &lt;text&gt; - Search the caller's own history
 * <li>/store &lt;text&gt; - Store lookup regardless of the message wording
 * </ul>
 *
 * <p>
 * Commands are routed before {@link MessageRouter} by channel adapters (e.g.,
 * TelegramAdapter).
 *
 * @see me.storeassist.bot.port.inbound.CommandPort
 */
@Component
@Slf4j
public class CommandRouter implements CommandPort {

    static final int SEARCH_LIMIT = 5;

    private static final String CMD_START = "start";
    private static final String CMD_HELP = "help";
    private static final String CMD_RESET = "reset";
    private static final String CMD_SEARCH = "search";
    private static final String CMD_STORE = "store";

    private static final List<String> KNOWN_COMMANDS = List.of(
            CMD_START, CMD_HELP, CMD_RESET, CMD_SEARCH, CMD_STORE);

    private static final Set<String> KNOWN_COMMAND_SET = Set.copyOf(KNOWN_COMMANDS);

    private final ConversationContextService contextService;
    private final MessageRouter messageRouter;
    private final MessageService messageService;

    public CommandRouter(
            ConversationContextService contextService,
            MessageRouter messageRouter,
            MessageService messageService) {
        this.contextService = contextService;
        this.messageRouter = messageRouter;
        this.messageService = messageService;
        log.info("CommandRouter initialized with commands: {}", KNOWN_COMMANDS);
    }

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context) {
        return CompletableFuture.supplyAsync(() -> {
            String userId = (String) context.get(CONTEXT_USER_ID);
            log.debug("Executing command: /{} with args: {}, userId: {}", command, args, userId);

            String name = command.toLowerCase(Locale.ROOT);
            return switch (name) {
            case CMD_START -> CommandResult.success(msg("command.start"));
            case CMD_HELP -> handleHelp();
            case CMD_RESET -> handleReset(userId);
            case CMD_SEARCH -> handleSearch(userId, args);
            case CMD_STORE -> handleStore(userId, args);
            default -> CommandResult.failure(msg("command.unknown", command));
            };
        });
    }

    @Override
    public boolean hasCommand(String command) {
        return command != null && KNOWN_COMMAND_SET.contains(command.toLowerCase(Locale.ROOT));
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return List.of(
                new CommandDefinition(CMD_START, msg("command.start.desc"), "/start"),
                new CommandDefinition(CMD_HELP, msg("command.help.desc"), "/help"),
                new CommandDefinition(CMD_RESET, msg("command.reset.desc"), "/reset"),
                new CommandDefinition(CMD_SEARCH, msg("command.search.desc"), "/search <text>"),
                new CommandDefinition(CMD_STORE, msg("command.store.desc"), "/store <text>"));
    }

    private CommandResult handleHelp() {
        StringBuilder sb = new StringBuilder();
        sb.append(msg("command.help.header")).append("\n");
        for (CommandDefinition command : listCommands()) {
            sb.append(command.usage()).append(" - ").append(command.description()).append("\n");
        }
        return CommandResult.success(sb.toString().trim());
    }

    private CommandResult handleReset(String userId) {
        contextService.reset(userId);
        log.info("[Command] Conversation reset for user {}", userId);
        return CommandResult.success(msg("command.reset.done"));
    }

    private CommandResult handleSearch(String userId, List<String> args) {
        String query = String.join(" ", args).strip();
        if (query.isEmpty()) {
            return CommandResult.success(msg("command.search.usage"));
        }

        List<ConversationEntry> hits = contextService.search(userId, query, SEARCH_LIMIT);
        if (hits.isEmpty()) {
            return CommandResult.success(msg("command.search.none", query));
        }

        StringBuilder sb = new StringBuilder(msg("command.search.header"));
        for (ConversationEntry entry : hits) {
            sb.append('\n').append(msg("command.search.item", entry.role().getValue(), entry.text()));
        }
        return CommandResult.success(sb.toString());
    }

    private CommandResult handleStore(String userId, List<String> args) {
        String query = String.join(" ", args).strip();
        if (query.isEmpty()) {
            return CommandResult.success(msg("command.store.usage"));
        }
        Reply reply = messageRouter.lookup(userId, query);
        return CommandResult.success(reply.text());
    }

    private String msg(String key, Object... args) {
        return messageService.getMessage(key, args);
    }
}
