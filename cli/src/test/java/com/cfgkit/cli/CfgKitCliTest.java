package com.cfgkit.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class CfgKitCliTest {

    private static final String AB_GRAMMAR = "{\"N\": [\"S\", \"A\", \"B\"], \"T\": [\"a\", \"b\"], \"S\": \"S\","
            + " \"P\": [\"S -> A B\", \"A -> a\", \"B -> b\"]}";

    private static final String EPSILON_GRAMMAR = "{\"N\": [\"S\"], \"T\": [\"a\"], \"S\": \"S\","
            + " \"P\": [{\"lhs\": \"S\", \"rhs\": [\"a\", \"S\"]}, {\"lhs\": \"S\", \"rhs\": []}]}";

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private Path ab;

    @BeforeEach
    void writeGrammar() throws IOException {
        ab = dir.resolve("ab.json");
        Files.writeString(ab, AB_GRAMMAR, StandardCharsets.UTF_8);
    }

    private int run(String... args) {
        return CfgKitCli.run(
                args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void parsePrintsIndentedTree() {
        assertEquals(CfgKitCli.EXIT_OK, run("parse", ab.toString(), "ab"));
        assertEquals("ACCEPTED\nS\n  A -> a\n  B -> b\n", out().replace("\r\n", "\n"));
    }

    @Test
    void parseAcceptsSpaceSeparatedTokens() {
        assertEquals(CfgKitCli.EXIT_OK, run("parse", ab.toString(), "a b"));
        assertTrue(out().startsWith("ACCEPTED"), out());
    }

    @Test
    void parseReportsRejection() {
        assertEquals(CfgKitCli.EXIT_OK, run("parse", ab.toString(), "ba"));
        assertEquals("REJECTED", out().strip());
    }

    @Test
    void parseOfEmptyInputShowsEpsilon() throws IOException {
        Path grammar = dir.resolve("eps.json");
        Files.writeString(grammar, EPSILON_GRAMMAR, StandardCharsets.UTF_8);

        assertEquals(CfgKitCli.EXIT_OK, run("parse", grammar.toString(), ""));
        assertTrue(out().contains("S -> ε"), out());
    }

    @Test
    void unknownTerminalIsAnError() {
        assertEquals(CfgKitCli.EXIT_FAILURE, run("parse", ab.toString(), "c"));
        assertTrue(err().contains("Unknown terminal symbol: 'c'"), err());
    }

    @Test
    void generateListsNumberedStrings() throws IOException {
        Path grammar = dir.resolve("eps.json");
        Files.writeString(grammar, EPSILON_GRAMMAR, StandardCharsets.UTF_8);

        assertEquals(CfgKitCli.EXIT_OK, run("generate", grammar.toString(), "--count=3"));
        assertEquals("1. 'ε'\n2. 'a'\n3. 'aa'\n", out().replace("\r\n", "\n"));
    }

    @Test
    void generateReportsIncompleteSearch() throws IOException {
        Path grammar = dir.resolve("eps.json");
        Files.writeString(grammar, EPSILON_GRAMMAR, StandardCharsets.UTF_8);

        assertEquals(CfgKitCli.EXIT_OK, run("generate", grammar.toString(), "--count=5", "--max-derivation=2"));
        assertTrue(out().contains("may be incomplete"), out());
    }

    @Test
    void badOptionsAreUsageErrors() {
        assertEquals(CfgKitCli.EXIT_USAGE, run("generate", ab.toString(), "--count=many"));
        assertEquals(CfgKitCli.EXIT_USAGE, run("generate", ab.toString(), "--depth=3"));
        assertEquals(CfgKitCli.EXIT_USAGE, run("parse", ab.toString()));
        assertEquals(CfgKitCli.EXIT_USAGE, run("frobnicate", ab.toString()));
        assertEquals(CfgKitCli.EXIT_USAGE, run("show"));
        assertTrue(err().contains("usage:"), err());
    }

    @Test
    void missingFileIsAFailure() {
        assertEquals(CfgKitCli.EXIT_FAILURE, run("show", dir.resolve("missing.json").toString()));
        assertTrue(err().contains("Cannot read grammar file"), err());
    }

    @Test
    void invalidGrammarIsAFailure() throws IOException {
        Path grammar = dir.resolve("bad.json");
        Files.writeString(grammar, "{\"N\": [\"S\"], \"T\": [\"a\"], \"S\": \"S\", \"P\": [\"S -> b\"]}");

        assertEquals(CfgKitCli.EXIT_FAILURE, run("show", grammar.toString()));
        assertTrue(err().startsWith("Error:"), err());
    }

    @Test
    void showAndNormalize() {
        assertEquals(CfgKitCli.EXIT_OK, run("show", ab.toString()));
        assertTrue(out().contains("S -> A B"), out());

        out.reset();
        assertEquals(CfgKitCli.EXIT_OK, run("normalize", ab.toString()));
        assertTrue(out().startsWith("S = S"), out());
    }

    @Test
    void sessionCachesNormalForm() throws IOException {
        Session session = Session.load(ab);
        assertSame(session.normalized(), session.normalized());
    }
}
