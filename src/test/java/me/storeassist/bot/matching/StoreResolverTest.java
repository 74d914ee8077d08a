package me.storeassist.bot.matching;

import me.storeassist.bot.catalog.StoreCatalog;
import me.storeassist.bot.domain.model.MatchKind;
import me.storeassist.bot.domain.model.MatchResult;
import me.storeassist.bot.domain.model.StoreRecord;
import me.storeassist.bot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StoreResolverTest {

    private static final StoreRecord ACME_SPRINGFIELD = new StoreRecord("Acme", "Springfield", List.of("ACM"));
    private static final StoreRecord ACME_SHELBYVILLE = new StoreRecord("Acme", "Shelbyville", List.of("ACM"));
    private static final StoreRecord KWIK_SPRINGFIELD = new StoreRecord("Kwik-E-Mart", "Springfield",
            List.of("Kwik"));
    private static final StoreRecord LARD_LAD_SPRINGFIELD = new StoreRecord("Lard Lad", "Springfield", List.of());

    private BotProperties properties;
    private TextNormalizer normalizer;
    private StoreResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        normalizer = new TextNormalizer();
        resolver = new StoreResolver(properties, normalizer);
    }

    private StoreCatalog catalog(StoreRecord... records) {
        return new StoreCatalog(List.of(records), normalizer);
    }

    @Test
    void shouldReturnEmptyForBlankQuery() {
        StoreCatalog catalog = catalog(ACME_SPRINGFIELD);

        assertTrue(resolver.resolve("", catalog).isEmpty());
        assertTrue(resolver.resolve("   ", catalog).isEmpty());
        assertTrue(resolver.resolve(null, catalog).isEmpty());
        assertTrue(resolver.resolve("?!", catalog).isEmpty());
    }

    @Test
    void shouldReturnEmptyForEmptyCatalog() {
        assertTrue(resolver.resolve("acme", catalog()).isEmpty());
    }

    @Test
    void shouldMatchStoreAndCityExactlyOnce() {
        List<MatchResult> results = resolver.resolve("acme springfield",
                catalog(new StoreRecord("Acme", "Springfield", List.of())));

        assertEquals(1, results.size());
        assertEquals(MatchKind.EXACT, results.get(0).matchKind());
        assertEquals(1.0, results.get(0).score());
        assertEquals("Acme", results.get(0).record().storeName());
    }

    @Test
    void shouldRankStoreInNamedCityAboveSingleFieldMatches() {
        StoreCatalog catalog = catalog(ACME_SHELBYVILLE, KWIK_SPRINGFIELD, ACME_SPRINGFIELD);

        List<MatchResult> results = resolver.resolve("Where is Acme in Springfield?", catalog);

        assertEquals(List.of(ACME_SPRINGFIELD, ACME_SHELBYVILLE, KWIK_SPRINGFIELD),
                results.stream().map(MatchResult::record).toList());
        assertTrue(results.stream().allMatch(r -> r.matchKind() == MatchKind.EXACT));
    }

    @Test
    void shouldMatchAliasWhenNoExactMatch() {
        List<MatchResult> results = resolver.resolve("ACM", catalog(ACME_SPRINGFIELD));

        assertEquals(1, results.size());
        assertEquals(MatchKind.ALIAS, results.get(0).matchKind());
        assertEquals(0.9, results.get(0).score());
    }

    @Test
    void shouldPreferExactOverAliasForSameRecord() {
        List<MatchResult> results = resolver.resolve("acme acm", catalog(ACME_SPRINGFIELD));

        assertEquals(1, results.size());
        assertEquals(MatchKind.EXACT, results.get(0).matchKind());
    }

    @Test
    void shouldMatchFuzzyAboveThreshold() {
        List<MatchResult> results = resolver.resolve("acme",
                catalog(new StoreRecord("acmee", "Springfield", List.of())));

        assertEquals(1, results.size());
        MatchResult result = results.get(0);
        assertEquals(MatchKind.FUZZY, result.matchKind());
        assertTrue(result.score() >= 0.75);
        assertTrue(result.score() < 1.0);
    }

    @Test
    void shouldSkipFuzzyStageWhenEnoughExactMatches() {
        StoreRecord typo = new StoreRecord("Acmee", "Capital City", List.of());

        List<MatchResult> results = resolver.resolve("acme", catalog(ACME_SPRINGFIELD, typo));

        assertEquals(1, results.size());
        assertEquals(ACME_SPRINGFIELD, results.get(0).record());
    }

    @Test
    void shouldRunFuzzyStageWhileBelowMinMatches() {
        properties.getResolver().setMinMatches(2);
        StoreRecord typo = new StoreRecord("Acmee", "Capital City", List.of());

        List<MatchResult> results = resolver.resolve("acme", catalog(ACME_SPRINGFIELD, typo));

        assertEquals(2, results.size());
        assertEquals(MatchKind.EXACT, results.get(0).matchKind());
        assertEquals(MatchKind.FUZZY, results.get(1).matchKind());
    }

    @Test
    void shouldIgnoreShortTokensInFuzzyStage() {
        properties.getResolver().setSimilarityThreshold(0.5);

        assertTrue(resolver.resolve("zo", catalog(new StoreRecord("Zoo", "Oslo", List.of()))).isEmpty());
    }

    @Test
    void shouldReturnNothingForUnrelatedQuery() {
        assertTrue(resolver.resolve("xyz", catalog(ACME_SPRINGFIELD, KWIK_SPRINGFIELD)).isEmpty());
    }

    @Test
    void shouldReturnStoreInEveryCity() {
        List<MatchResult> results = resolver.resolve("acme", catalog(ACME_SPRINGFIELD, ACME_SHELBYVILLE));

        assertEquals(2, results.size());
        assertEquals("Shelbyville", results.get(0).record().city());
        assertEquals("Springfield", results.get(1).record().city());
        assertTrue(results.stream().allMatch(r -> r.matchKind() == MatchKind.EXACT));
    }

    @Test
    void shouldReturnEveryStoreOfMatchedCity() {
        List<MatchResult> results = resolver.resolve("Springfield",
                catalog(ACME_SPRINGFIELD, KWIK_SPRINGFIELD, ACME_SHELBYVILLE));

        assertEquals(List.of(ACME_SPRINGFIELD, KWIK_SPRINGFIELD),
                results.stream().map(MatchResult::record).toList());
    }

    @Test
    void shouldSortByScoreThenName() {
        List<MatchResult> results = resolver.resolve("kwik, acme",
                catalog(KWIK_SPRINGFIELD, new StoreRecord("Acme", "Capital City", List.of())));

        assertEquals(2, results.size());
        assertEquals("Acme", results.get(0).record().storeName());
        assertEquals(MatchKind.EXACT, results.get(0).matchKind());
        assertEquals("Kwik-E-Mart", results.get(1).record().storeName());
        assertEquals(MatchKind.ALIAS, results.get(1).matchKind());
    }

    @Test
    void shouldTruncateToMaxResults() {
        properties.getResolver().setMaxResults(2);

        List<MatchResult> results = resolver.resolve("springfield",
                catalog(LARD_LAD_SPRINGFIELD, KWIK_SPRINGFIELD, ACME_SPRINGFIELD));

        assertEquals(List.of(ACME_SPRINGFIELD, KWIK_SPRINGFIELD),
                results.stream().map(MatchResult::record).toList());
    }

    @Test
    void shouldMatchMultiWordFieldsInsideSentence() {
        StoreRecord cornerShop = new StoreRecord("Corner Shop", "New York", List.of());

        List<MatchResult> results = resolver.resolve("Is there a store in New York?",
                catalog(cornerShop, ACME_SPRINGFIELD));

        assertEquals(1, results.size());
        assertEquals(cornerShop, results.get(0).record());
        assertEquals(MatchKind.EXACT, results.get(0).matchKind());
    }

    @Test
    void shouldIgnoreCaseAndDiacritics() {
        StoreRecord cafe = new StoreRecord("Café Noir", "Québec", List.of());

        List<MatchResult> results = resolver.resolve("CAFE NOIR", catalog(cafe));

        assertEquals(1, results.size());
        assertEquals(MatchKind.EXACT, results.get(0).matchKind());
    }

    @Test
    void shouldBuildCandidateTokensFromSegmentsAndPhrases() {
        String raw = "Where is Acme, Springfield?";
        Set<String> tokens = resolver.candidateTokens(raw, normalizer.normalize(raw), 2);

        assertTrue(tokens.contains("where is acme springfield"));
        assertTrue(tokens.contains("where is acme"));
        assertTrue(tokens.contains("springfield"));
        assertTrue(tokens.contains("acme springfield"));
        assertTrue(tokens.contains("acme"));
        assertFalse(tokens.contains("is acme springfield"));
    }
}
