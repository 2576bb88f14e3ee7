package com.cfgkit.core;

import com.cfgkit.core.cnf.CnfGrammar;
import com.cfgkit.core.cnf.CnfNormalizer;
import com.cfgkit.core.cyk.CykParser;
import com.cfgkit.core.cyk.CykTable;
import com.cfgkit.core.gen.GenerationResult;
import com.cfgkit.core.gen.ShortestStringsGenerator;
import com.cfgkit.core.grammar.Grammar;
import com.cfgkit.core.grammar.Grammar.T;
import com.cfgkit.core.tree.TreeReconstructor;
import java.util.List;

/**
 * Entry points used by front ends: normalize a grammar, parse a token sequence into an
 * original-shaped derivation tree, and list the shortest strings of a language. All methods are
 * stateless and safe to call concurrently.
 */
public final class GrammarAnalyzer {

    private static final CnfNormalizer NORMALIZER = new CnfNormalizer();
    private static final CykParser PARSER = new CykParser();
    private static final TreeReconstructor RECONSTRUCTOR = new TreeReconstructor();
    private static final ShortestStringsGenerator GENERATOR = new ShortestStringsGenerator();

    private GrammarAnalyzer() {}

    public static CnfGrammar normalize(Grammar grammar) {
        return NORMALIZER.normalize(grammar);
    }

    /**
     * Parses {@code tokens}, each the name of a terminal.
     *
     * @throws com.cfgkit.core.cyk.UnknownSymbolException if a token is not in T
     */
    public static ParseResult parse(CnfGrammar grammar, List<String> tokens) {
        List<T> input = PARSER.resolve(grammar, tokens);
        CykTable table = PARSER.recognize(grammar, input);
        if (!table.accepted()) {
            return ParseResult.rejected(tokens);
        }
        return ParseResult.accepted(tokens, RECONSTRUCTOR.reconstruct(table));
    }

    public static ParseResult parse(Grammar grammar, List<String> tokens) {
        return parse(normalize(grammar), tokens);
    }

    public static GenerationResult generateShortest(Grammar grammar) {
        return GENERATOR.generate(grammar);
    }

    public static GenerationResult generateShortest(Grammar grammar, int count) {
        return GENERATOR.generate(grammar, ShortestStringsGenerator.Config.withCount(count));
    }

    public static GenerationResult generateShortest(
            Grammar grammar, ShortestStringsGenerator.Config config) {
        return GENERATOR.generate(grammar, config);
    }
}
