package com.cfgkit.core.gen;

import com.cfgkit.core.grammar.Grammar;
import com.cfgkit.core.grammar.Grammar.NT;
import com.cfgkit.core.grammar.Grammar.Production;
import com.cfgkit.core.grammar.Grammar.Symbol;
import com.cfgkit.core.grammar.Grammar.T;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumerates the shortest strings of a grammar's language by best-first search over leftmost
 * sentential forms. A string is the concatenation of its terminal names, and its length is the
 * length of that text. Forms are ordered by the text length of the terminals they already contain,
 * which never decreases under expansion, so strings surface in order of length.
 */
public final class ShortestStringsGenerator {

    private static final Logger log = LoggerFactory.getLogger(ShortestStringsGenerator.class);

    public static final int DEFAULT_COUNT = 10;
    public static final int DEFAULT_MAX_DERIVATION_LENGTH = 200;
    public static final int DEFAULT_MAX_FRONTIER_SIZE = 100_000;
    public static final int DEFAULT_MAX_EXPANSIONS = 100_000;

    public static final class Config {
        /** Number of strings wanted. */
        public int count = DEFAULT_COUNT;
        /** Forms derived in this many steps are not expanded further. */
        public int maxDerivationLength = DEFAULT_MAX_DERIVATION_LENGTH;
        /** The search stops once more forms than this are waiting. */
        public int maxFrontierSize = DEFAULT_MAX_FRONTIER_SIZE;
        /** The search stops after expanding this many forms. */
        public int maxExpansions = DEFAULT_MAX_EXPANSIONS;

        public static Config withCount(int count) {
            Config config = new Config();
            config.count = count;
            return config;
        }
    }

    private record Entry(List<Symbol> form, int steps, int textLength) {}

    private static final Comparator<Symbol> SYMBOL_ORDER =
            Comparator.comparing(Symbol::name).thenComparing(symbol -> symbol instanceof NT);

    private static final Comparator<List<Symbol>> FORM_ORDER =
            (a, b) -> {
                for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
                    int cmp = SYMBOL_ORDER.compare(a.get(i), b.get(i));
                    if (cmp != 0) {
                        return cmp;
                    }
                }
                return Integer.compare(a.size(), b.size());
            };

    private static final Comparator<String> TEXT_ORDER =
            Comparator.comparingInt(String::length).thenComparing(Comparator.<String>naturalOrder());

    private static final Comparator<Entry> FRONTIER_ORDER =
            Comparator.comparingInt(Entry::textLength)
                    .thenComparingInt(entry -> entry.form().size())
                    .thenComparing(Entry::form, FORM_ORDER);

    public GenerationResult generate(Grammar grammar) {
        return generate(grammar, new Config());
    }

    public GenerationResult generate(Grammar grammar, Config config) {
        Objects.requireNonNull(grammar, "grammar");
        Objects.requireNonNull(config, "config");
        if (config.count < 0 || config.maxDerivationLength < 0 || config.maxFrontierSize < 1
                || config.maxExpansions < 0) {
            throw new IllegalArgumentException("generator bounds must be non-negative");
        }
        Set<NT> generating = grammar.generating();
        Map<String, List<T>> found = new LinkedHashMap<>();
        if (config.count == 0 || !generating.contains(grammar.start())) {
            return new GenerationResult(List.of(), true);
        }

        PriorityQueue<Entry> frontier = new PriorityQueue<>(FRONTIER_ORDER);
        Set<List<Symbol>> seen = new HashSet<>();
        List<Symbol> initial = List.of(grammar.start());
        frontier.add(new Entry(initial, 0, 0));
        seen.add(initial);

        boolean bounded = false;
        int cutoff = -1;
        int expansions = 0;
        search:
        while (!frontier.isEmpty()) {
            // Once enough strings are known, finish the current length so ties are complete.
            if (cutoff >= 0 && frontier.peek().textLength() > cutoff) {
                break;
            }
            Entry entry = frontier.poll();
            int leftmost = leftmostNonTerminal(entry.form());
            if (leftmost < 0) {
                List<T> sentence = new ArrayList<>();
                entry.form().forEach(symbol -> sentence.add((T) symbol));
                found.putIfAbsent(text(sentence), sentence);
                if (cutoff < 0 && found.size() >= config.count) {
                    cutoff = entry.textLength();
                }
                continue;
            }
            if (entry.steps() >= config.maxDerivationLength) {
                bounded = true;
                continue;
            }
            if (expansions++ >= config.maxExpansions) {
                log.debug("generation stopped after {} expansions", config.maxExpansions);
                bounded = true;
                break;
            }
            NT nt = (NT) entry.form().get(leftmost);
            for (Production production : grammar.productions(nt)) {
                if (!derivesTerminals(production, generating)) {
                    continue;
                }
                List<Symbol> form = new ArrayList<>(entry.form().size() + production.rhs().size());
                form.addAll(entry.form().subList(0, leftmost));
                form.addAll(production.rhs());
                form.addAll(entry.form().subList(leftmost + 1, entry.form().size()));
                List<Symbol> key = List.copyOf(form);
                if (!seen.add(key)) {
                    continue;
                }
                int textLength = entry.textLength() + textLength(production.rhs());
                frontier.add(new Entry(key, entry.steps() + 1, textLength));
                if (frontier.size() > config.maxFrontierSize) {
                    log.debug("generation stopped: frontier exceeds {}", config.maxFrontierSize);
                    bounded = true;
                    break search;
                }
            }
        }

        List<List<T>> sentences = new ArrayList<>(found.values());
        sentences.sort(
                Comparator.<List<T>, String>comparing(ShortestStringsGenerator::text, TEXT_ORDER));
        if (sentences.size() > config.count) {
            sentences = sentences.subList(0, config.count);
        }
        log.debug("generated {} strings, bounded={}", sentences.size(), bounded);
        return new GenerationResult(sentences, !bounded || sentences.size() == config.count);
    }

    private static int leftmostNonTerminal(List<Symbol> form) {
        for (int i = 0; i < form.size(); i++) {
            if (form.get(i) instanceof NT) {
                return i;
            }
        }
        return -1;
    }

    private static boolean derivesTerminals(Production production, Set<NT> generating) {
        for (Symbol symbol : production.rhs()) {
            if (symbol instanceof NT nt && !generating.contains(nt)) {
                return false;
            }
        }
        return true;
    }

    private static int textLength(List<Symbol> symbols) {
        int length = 0;
        for (Symbol symbol : symbols) {
            if (symbol instanceof T terminal) {
                length += terminal.name().length();
            }
        }
        return length;
    }

    static String text(List<T> sentence) {
        StringBuilder sb = new StringBuilder();
        for (T terminal : sentence) {
            sb.append(terminal.name());
        }
        return sb.toString();
    }
}
