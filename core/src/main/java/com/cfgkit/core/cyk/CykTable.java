package com.cfgkit.core.cyk;

import com.cfgkit.core.cnf.CnfGrammar;
import com.cfgkit.core.grammar.Grammar.NT;
import com.cfgkit.core.grammar.Grammar.T;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Triangular CYK chart indexed by (start offset, span length). Each cell keeps one backpointer per
 * nonterminal: the first one recorded, which the parser arranges to be the smallest split point
 * and then the lowest production index.
 */
public final class CykTable {

    private final CnfGrammar grammar;
    private final List<T> input;
    private final List<List<Map<NT, Backpointer>>> cells;

    CykTable(CnfGrammar grammar, List<T> input) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        this.input = List.copyOf(input);
        int n = this.input.size();
        this.cells = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            List<Map<NT, Backpointer>> row = new ArrayList<>(n - i);
            for (int length = 1; length <= n - i; length++) {
                row.add(new LinkedHashMap<>());
            }
            cells.add(row);
        }
    }

    public CnfGrammar grammar() {
        return grammar;
    }

    public List<T> input() {
        return input;
    }

    public int size() {
        return input.size();
    }

    public Map<NT, Backpointer> cell(int start, int length) {
        checkSpan(start, length);
        return Collections.unmodifiableMap(cells.get(start).get(length - 1));
    }

    public Optional<Backpointer> backpointer(NT nt, int start, int length) {
        return Optional.ofNullable(cell(start, length).get(nt));
    }

    /** True when the start symbol covers the whole input, or the input is empty and ε is derivable. */
    public boolean accepted() {
        if (input.isEmpty()) {
            return grammar.epsilonProduction().isPresent();
        }
        return cells.get(0).get(input.size() - 1).containsKey(grammar.start());
    }

    boolean putIfAbsent(int start, int length, NT nt, Backpointer backpointer) {
        return cells.get(start).get(length - 1).putIfAbsent(nt, backpointer) == null;
    }

    boolean isEmpty(int start, int length) {
        return cells.get(start).get(length - 1).isEmpty();
    }

    private void checkSpan(int start, int length) {
        if (start < 0 || length < 1 || start + length > input.size()) {
            throw new IndexOutOfBoundsException(
                    "span (" + start + ", " + length + ") outside input of length " + input.size());
        }
    }
}
