package me.storeassist.bot.infrastructure.i18n;

import me.storeassist.bot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageServiceTest {

    private static final String KEY_RESET_DONE = "command.reset.done";

    private MessageService messageService;

    @BeforeEach
    void setUp() {
        messageService = new MessageService();
    }

    // --- getMessage (current language) ---

    @Test
    void shouldReturnEnglishMessageByDefault() {
        assertEquals("Context cleared.", messageService.getMessage(KEY_RESET_DONE));
    }

    @Test
    void shouldReturnRussianMessageWhenLanguageSetToRu() {
        messageService.setLanguage("ru");

        assertEquals("Контекст очищен.", messageService.getMessage(KEY_RESET_DONE));
    }

    @Test
    void shouldReturnKeyWhenMessageNotFound() {
        assertEquals("nonexistent.key", messageService.getMessage("nonexistent.key"));
    }

    @Test
    void shouldFormatMessageWithParameters() {
        assertEquals("Nothing found for \"work\".", messageService.getMessage("command.search.none", "work"));
    }

    @Test
    void shouldKeepApostropheInFallbackText() {
        assertTrue(messageService.getMessage("reply.fallback").startsWith("I couldn't process that right now"));
    }

    @Test
    void shouldFormatLookupItems() {
        assertEquals("• Acme, Springfield: 742 Evergreen Terrace",
                messageService.getMessage("reply.lookup.item.address", "Acme", "Springfield", "742 Evergreen Terrace"));
    }

    // --- getMessageForLanguage ---

    @Test
    void shouldReturnMessageForExplicitLanguage() {
        assertEquals("Контекст очищен.", messageService.getMessageForLanguage(KEY_RESET_DONE, "ru"));
        assertEquals("Context cleared.", messageService.getMessageForLanguage(KEY_RESET_DONE, "en"));
    }

    @Test
    void shouldFallBackToEnglishForUnknownLanguage() {
        assertEquals("Context cleared.", messageService.getMessageForLanguage(KEY_RESET_DONE, "de"));
    }

    // --- language management ---

    @Test
    void shouldIgnoreUnsupportedLanguage() {
        messageService.setLanguage("fr");

        assertEquals("en", messageService.getLanguage());
    }

    @Test
    void shouldTakeLanguageFromProperties() {
        BotProperties properties = new BotProperties();
        properties.setLanguage("ru");

        assertEquals("ru", new MessageService(properties).getLanguage());
    }

    @Test
    void shouldReportSupportedLanguages() {
        assertTrue(messageService.isSupported("en"));
        assertTrue(messageService.isSupported("ru"));
        assertFalse(messageService.isSupported("de"));
    }

    @Test
    void shouldDefineEveryEnglishKeyInRussian() {
        for (String key : new String[] { "reply.clarify", "reply.fallback", "reply.lookup.header",
                "reply.lookup.none", "command.start", "command.help.header", "command.search.usage",
                "command.store.usage", "command.unknown", "command.failed", "security.unauthorized" }) {
            String ru = messageService.getMessageForLanguage(key, "ru");
            assertFalse(ru.equals(key), "missing ru message: " + key);
            assertFalse(ru.equals(messageService.getMessageForLanguage(key, "en")), "untranslated: " + key);
        }
    }
}
