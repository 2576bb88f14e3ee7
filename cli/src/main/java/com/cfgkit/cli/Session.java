package com.cfgkit.cli;

import com.cfgkit.core.GrammarAnalyzer;
import com.cfgkit.core.cnf.CnfGrammar;
import com.cfgkit.core.grammar.Grammar;
import com.cfgkit.core.io.GrammarJson;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * The grammar a front end is currently working with. The core keeps no state of its own; the
 * session owns the loaded grammar and caches its normal form.
 */
final class Session {
    private final Grammar grammar;
    private CnfGrammar normalized;

    Session(Grammar grammar) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
    }

    static Session load(Path path) throws IOException {
        return new Session(GrammarJson.read(path));
    }

    Grammar grammar() {
        return grammar;
    }

    CnfGrammar normalized() {
        if (normalized == null) {
            normalized = GrammarAnalyzer.normalize(grammar);
        }
        return normalized;
    }
}
