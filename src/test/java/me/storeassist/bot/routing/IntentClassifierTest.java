package me.storeassist.bot.routing;

import me.storeassist.bot.domain.model.IntentClassification;
import me.storeassist.bot.domain.model.MessageIntent;
import me.storeassist.bot.infrastructure.config.BotProperties;
import me.storeassist.bot.matching.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntentClassifierTest {

    private IntentClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new IntentClassifier(new BotProperties(), new TextNormalizer());
    }

    @Test
    void shouldClassifyWhereQuestionAsLookup() {
        IntentClassification result = classifier.classify("Where is Acme in Springfield?");

        assertTrue(result.isLookup());
        assertEquals("where", result.cue());
    }

    @Test
    void shouldClassifyRussianCueAsLookup() {
        IntentClassification result = classifier.classify("Где ближайший МАГАЗИН?");

        assertEquals(MessageIntent.LOOKUP, result.intent());
        assertEquals("где", result.cue());
    }

    @Test
    void shouldClassifySmallTalkAsChat() {
        IntentClassification result = classifier.classify("How are you today?");

        assertEquals(MessageIntent.CHAT, result.intent());
        assertNull(result.cue());
    }

    @Test
    void shouldMatchWholeWordsOnly() {
        assertFalse(classifier.classify("Nowhere to go, I'm restored").isLookup());
        assertFalse(classifier.classify("shopping is fun").isLookup());
    }

    @Test
    void shouldUseConfiguredKeywords() {
        BotProperties properties = new BotProperties();
        properties.getRouting().setLookupKeywords(List.of("Locate Store", "  "));
        IntentClassifier custom = new IntentClassifier(properties, new TextNormalizer());

        assertEquals("locate store", custom.classify("please LOCATE store Acme").cue());
        assertFalse(custom.classify("where is acme").isLookup());
    }
}
