package me.storeassist.bot.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.storeassist.bot.catalog.StoreCatalog;
import me.storeassist.bot.catalog.StoreCatalogLoader;
import me.storeassist.bot.port.inbound.ChannelPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration that wires the shared beans and starts the bot on
 * application startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Loads the store catalog once; a broken dataset stops startup</li>
 * <li>Creates the worker pool inbound messages are answered on</li>
 * <li>Auto-starts all enabled input channels (Telegram, etc.)</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;
    private final List<ChannelPort> channelPorts;

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public StoreCatalog storeCatalog(StoreCatalogLoader loader, ResourceLoader resourceLoader) {
        String location = properties.getCatalog().getLocation();
        return loader.load(resourceLoader.getResource(location));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService dispatchExecutor() {
        int threads = Math.max(1, properties.getDispatch().getWorkerThreads());
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "dispatch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        log.info("Store Assistant Bot starting...");
        log.info("LLM Provider: {} ({})", properties.getLlm().getProvider(),
                properties.getLlm().getLangchain4j().getModel());
        log.info("Catalog: {}", properties.getCatalog().getLocation());

        for (ChannelPort channel : channelPorts) {
            String channelType = channel.getChannelType();
            if (isChannelEnabled(channelType)) {
                log.info("Starting channel: {}", channelType);
                channel.start();
            }
        }

        log.info("Store Assistant Bot started successfully");
    }

    private boolean isChannelEnabled(String channelType) {
        BotProperties.ChannelProperties channelProps = properties.getChannels().get(channelType);
        return channelProps != null && channelProps.isEnabled();
    }
}
