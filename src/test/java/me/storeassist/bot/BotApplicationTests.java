package me.storeassist.bot;

import me.storeassist.bot.adapter.inbound.telegram.TelegramAdapter;
import me.storeassist.bot.catalog.StoreCatalogLoader;
import me.storeassist.bot.domain.service.ConversationContextService;
import me.storeassist.bot.infrastructure.config.AutoConfiguration;
import me.storeassist.bot.routing.MessageRouter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class BotApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(BotApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(BotApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(BotApplication.class.getMethod("main", String[].class));
    }

    @Test
    void shouldKeepComponentsInsideScannedPackage() {
        String root = BotApplication.class.getPackageName();

        assertEquals("me.storeassist.bot", root);
        assertEquals(root + ".catalog", StoreCatalogLoader.class.getPackageName());
        assertEquals(root + ".routing", MessageRouter.class.getPackageName());
        assertEquals(root + ".domain.service", ConversationContextService.class.getPackageName());
        assertEquals(root + ".adapter.inbound.telegram", TelegramAdapter.class.getPackageName());
        assertEquals(root + ".infrastructure.config", AutoConfiguration.class.getPackageName());
    }
}
