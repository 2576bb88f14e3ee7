package com.cfgkit.core.gen;

import static org.junit.jupiter.api.Assertions.*;

import com.cfgkit.core.grammar.Grammar;
import com.cfgkit.core.grammar.Grammar.T;
import java.util.List;
import org.junit.jupiter.api.Test;

final class ShortestStringsGeneratorTest {

    private final ShortestStringsGenerator generator = new ShortestStringsGenerator();

    @Test
    void finiteLanguageIsListedCompletely() {
        Grammar grammar = Grammar.builder()
                .nonTerminals("S", "A", "B").terminals("a", "b").start("S")
                .production("S", "A", "B")
                .production("A", "a")
                .production("B", "b")
                .build();

        GenerationResult result = generator.generate(grammar);

        assertEquals(List.of("ab"), result.strings());
        assertTrue(result.complete());
    }

    @Test
    void rightLinearLanguageInLengthOrder() {
        Grammar grammar = Grammar.builder()
                .nonTerminals("S").terminals("a").start("S")
                .production("S", "a", "S")
                .production("S", "a")
                .build();

        GenerationResult result = generator.generate(grammar, ShortestStringsGenerator.Config.withCount(5));

        assertEquals(List.of("a", "aa", "aaa", "aaaa", "aaaaa"), result.strings());
        assertTrue(result.complete());
    }

    @Test
    void epsilonIsTheEmptyString() {
        Grammar grammar = Grammar.builder()
                .nonTerminals("S").terminals("a").start("S")
                .production("S")
                .build();

        GenerationResult result = generator.generate(grammar);

        assertEquals(List.of(""), result.strings());
        assertEquals(1, result.sentences().size());
        assertTrue(result.sentences().get(0).isEmpty());
    }

    @Test
    void equalLengthsSortLexicographicallyWithoutDuplicates() {
        Grammar grammar = Grammar.builder()
                .nonTerminals("S", "A", "B").terminals("a", "b", "c").start("S")
                .production("S", "B")
                .production("S", "A")
                .production("A", "c")
                .production("A", "b", "b")
                .production("B", "a")
                .production("B", "c")
                .build();

        GenerationResult result = generator.generate(grammar);

        assertEquals(List.of("a", "c", "bb"), result.strings());
        assertTrue(result.complete());
    }

    @Test
    void multiCharacterTerminalsAreOrderedByTextLength() {
        Grammar grammar = Grammar.builder()
                .nonTerminals("S").terminals("a", "aa", "aaa", "b").start("S")
                .production("S", "aaa")
                .production("S", "b", "b")
                .production("S", "a", "a")
                .production("S", "aa")
                .build();

        GenerationResult result = generator.generate(grammar);

        assertEquals(List.of("aa", "bb", "aaa"), result.strings());
        assertEquals(List.of(new T("aa")), result.sentences().get(0));
        assertEquals(List.of(new T("b"), new T("b")), result.sentences().get(1));
        assertTrue(result.complete());
        assertEquals(
                List.of("aa", "bb"),
                generator.generate(grammar, ShortestStringsGenerator.Config.withCount(2)).strings());
    }

    @Test
    void boundHitAfterEnoughStringsStillComplete() {
        Grammar grammar = Grammar.builder()
                .nonTerminals("S").terminals("a").start("S")
                .production("S", "S", "S")
                .production("S", "a")
                .production("S")
                .build();

        GenerationResult result = generator.generate(grammar, ShortestStringsGenerator.Config.withCount(5));

        assertEquals(List.of("", "a", "aa", "aaa", "aaaa"), result.strings());
        assertTrue(result.complete());
    }

    @Test
    void cutoffLengthIsFinishedBeforeTruncating() {
        Grammar grammar = Grammar.builder()
                .nonTerminals("S").terminals("a", "b").start("S")
                .production("S", "a", "S")
                .production("S", "b", "S")
                .production("S")
                .build();

        GenerationResult result = generator.generate(grammar, ShortestStringsGenerator.Config.withCount(4));

        assertEquals(List.of("", "a", "b", "aa"), result.strings());
    }

    @Test
    void nonGeneratingAlternativesAreIgnored() {
        Grammar grammar = Grammar.builder()
                .nonTerminals("S", "B").terminals("a", "b").start("S")
                .production("S", "a")
                .production("S", "B")
                .production("B", "B", "b")
                .build();

        GenerationResult result = generator.generate(grammar);

        assertEquals(List.of("a"), result.strings());
        assertTrue(result.complete());
    }

    @Test
    void emptyLanguageYieldsNothing() {
        Grammar grammar = Grammar.builder()
                .nonTerminals("S").terminals("a").start("S")
                .production("S", "S", "a")
                .build();

        GenerationResult result = generator.generate(grammar);

        assertEquals(0, result.size());
        assertTrue(result.complete());
    }

    @Test
    void derivationBoundMarksResultIncomplete() {
        Grammar grammar = Grammar.builder()
                .nonTerminals("S").terminals("a", "b").start("S")
                .production("S", "a", "S")
                .production("S", "b")
                .build();
        ShortestStringsGenerator.Config config = new ShortestStringsGenerator.Config();
        config.maxDerivationLength = 3;

        GenerationResult result = generator.generate(grammar, config);

        assertEquals(List.of("b", "ab", "aab"), result.strings());
        assertFalse(result.complete());
        assertTrue(result.toString().endsWith("(incomplete)"));
    }

    @Test
    void frontierBoundMarksResultIncomplete() {
        Grammar grammar = Grammar.builder()
                .nonTerminals("S").terminals("a", "b", "c").start("S")
                .production("S", "a")
                .production("S", "b")
                .production("S", "c")
                .build();
        ShortestStringsGenerator.Config config = new ShortestStringsGenerator.Config();
        config.maxFrontierSize = 1;

        GenerationResult result = assertDoesNotThrow(() -> generator.generate(grammar, config));

        assertFalse(result.complete());
        assertTrue(result.size() < 3);
    }

    @Test
    void expansionBoundMarksResultIncomplete() {
        Grammar grammar = Grammar.builder()
                .nonTerminals("S").terminals("a").start("S")
                .production("S", "S", "S")
                .production("S", "a")
                .build();
        ShortestStringsGenerator.Config config = ShortestStringsGenerator.Config.withCount(50);
        config.maxExpansions = 10;

        GenerationResult result = generator.generate(grammar, config);

        assertFalse(result.complete());
        assertTrue(result.size() < 50);
    }

    @Test
    void zeroCountReturnsEmptyList() {
        Grammar grammar = Grammar.builder()
                .nonTerminals("S").terminals("a").start("S")
                .production("S", "a")
                .build();

        GenerationResult result = generator.generate(grammar, ShortestStringsGenerator.Config.withCount(0));

        assertEquals(List.of(), result.strings());
        assertTrue(result.complete());
    }

    @Test
    void negativeBoundsAreRejected() {
        Grammar grammar = Grammar.builder()
                .nonTerminals("S").terminals("a").start("S")
                .production("S", "a")
                .build();

        assertThrows(
                IllegalArgumentException.class,
                () -> generator.generate(grammar, ShortestStringsGenerator.Config.withCount(-1)));
    }
}
