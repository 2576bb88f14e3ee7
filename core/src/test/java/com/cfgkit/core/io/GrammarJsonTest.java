package com.cfgkit.core.io;

import static org.junit.jupiter.api.Assertions.*;

import com.cfgkit.core.grammar.Grammar;
import com.cfgkit.core.grammar.Grammar.NT;
import com.cfgkit.core.grammar.GrammarType;
import com.cfgkit.core.grammar.InvalidGrammarException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class GrammarJsonTest {

    @Test
    void readsObjectProductions() {
        String json = "{\"N\": [\"S\", \"A\"], \"T\": [\"a\", \"b\"], \"S\": \"S\", \"type\": \"2\","
                + " \"P\": [{\"lhs\": \"S\", \"rhs\": [\"A\", \"b\"]}, {\"lhs\": \"A\", \"rhs\": [\"a\"]},"
                + " {\"lhs\": \"A\", \"rhs\": []}]}";

        Grammar grammar = GrammarJson.read(json);

        assertEquals(new NT("S"), grammar.start());
        assertEquals(3, grammar.productions().size());
        assertEquals("S -> A b", grammar.productions().get(0).toString());
        assertTrue(grammar.productions().get(2).isEpsilon());
        assertEquals(GrammarType.CONTEXT_FREE, grammar.type());
    }

    @Test
    void readsLegacyLayout() {
        String json = "{\"N\": [\"S\"], \"T\": [\"a\"], \"S0\": \"S\", \"type\": \"3\","
                + " \"P\": [\"S -> a S\", \"S → ε\"]}";

        Grammar grammar = GrammarJson.read(json);

        assertEquals(new NT("S"), grammar.start());
        assertEquals(GrammarType.REGULAR, grammar.type());
        assertEquals("S -> a S", grammar.productions().get(0).toString());
        assertTrue(grammar.productions().get(1).isEpsilon());
    }

    @Test
    void legacyLeftLinearRegularGrammarLoads() {
        Grammar grammar = GrammarJson.read(
                "{\"N\": [\"S\"], \"T\": [\"a\"], \"S0\": \"S\", \"type\": \"3\","
                        + " \"P\": [\"S -> S a\", \"S -> a\"]}");

        assertEquals(GrammarType.REGULAR, grammar.type());
        assertFalse(grammar.isRightLinear());
    }

    @Test
    void legacyStartKeyTakesPrecedence() {
        Grammar grammar = GrammarJson.read(
                "{\"N\": [\"S\", \"A\"], \"T\": [\"a\"], \"S0\": \"A\", \"S\": \"S\","
                        + " \"P\": [\"S -> A\", \"A -> a\"]}");

        assertEquals(new NT("A"), grammar.start());
    }

    @Test
    void writeThenReadGivesEqualGrammar(@TempDir Path dir) throws Exception {
        Grammar grammar = Grammar.builder()
                .nonTerminals("S", "A").terminals("a", "b").start("S")
                .production("S", "a", "A", "b")
                .production("A", "a")
                .production("A")
                .build();
        Path file = dir.resolve("grammar.json");

        GrammarJson.write(grammar, file);

        assertEquals(grammar, GrammarJson.read(file));
    }

    @Test
    void malformedDocumentsAreInvalidGrammars() {
        assertThrows(InvalidGrammarException.class, () -> GrammarJson.read("{not json"));
        assertThrows(InvalidGrammarException.class, () -> GrammarJson.read("[]"));
        assertThrows(
                InvalidGrammarException.class,
                () -> GrammarJson.read("{\"N\": [\"S\"], \"T\": [], \"S\": \"S\"}"));
        assertThrows(
                InvalidGrammarException.class,
                () -> GrammarJson.read("{\"N\": [\"S\"], \"T\": [\"a\"], \"S\": \"S\", \"type\": \"7\","
                        + " \"P\": [\"S -> a\"]}"));
        assertThrows(
                InvalidGrammarException.class,
                () -> GrammarJson.read("{\"N\": [\"S\"], \"T\": [\"a\"], \"S\": \"S\", \"P\": [\"S a\"]}"));
        assertThrows(
                InvalidGrammarException.class,
                () -> GrammarJson.read("{\"N\": [\"S\"], \"T\": [\"a\"], \"S\": \"S\", \"P\": [\"S -> b\"]}"));
    }

    @Test
    void productionTextAcceptsBothArrows() {
        assertEquals(Map.entry("S", List.of("a", "S")), ProductionText.parse("S -> a S"));
        assertEquals(Map.entry("S", List.of("a")), ProductionText.parse("S→a"));
        assertEquals(Map.entry("S", List.of()), ProductionText.parse("S ->"));
        assertThrows(InvalidGrammarException.class, () -> ProductionText.parse("S a"));
        assertThrows(InvalidGrammarException.class, () -> ProductionText.parse("S -> a -> b"));
        assertThrows(InvalidGrammarException.class, () -> ProductionText.parse("A B -> a"));
    }
}
