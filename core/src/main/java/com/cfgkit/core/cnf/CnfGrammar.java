package com.cfgkit.core.cnf;

import com.cfgkit.core.grammar.Grammar;
import com.cfgkit.core.grammar.Grammar.NT;
import com.cfgkit.core.grammar.Grammar.Production;
import com.cfgkit.core.grammar.Grammar.Symbol;
import com.cfgkit.core.grammar.Grammar.T;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Grammar in Chomsky Normal Form produced by {@link CnfNormalizer}. Every production is {@code A ->
 * a}, {@code A -> B C} or {@code S -> ε}, and the start symbol never occurs on a right-hand side.
 * Unlike {@link Grammar}, the start symbol may have no productions at all when the language is
 * empty.
 */
public final class CnfGrammar {

    private final Grammar source;
    private final Set<NT> nonTerminals;
    private final Set<T> terminals;
    private final NT start;
    private final List<Production> productions;
    private final Provenance provenance;
    private final Map<NT, List<Production>> byLhs = new LinkedHashMap<>();

    CnfGrammar(
            Grammar source,
            Set<NT> nonTerminals,
            NT start,
            List<Production> productions,
            Provenance provenance) {
        this.source = Objects.requireNonNull(source, "source");
        this.nonTerminals = Collections.unmodifiableSet(new LinkedHashSet<>(nonTerminals));
        this.terminals = source.terminals();
        this.start = Objects.requireNonNull(start, "start");
        this.provenance = Objects.requireNonNull(provenance, "provenance");
        List<Production> indexed = new ArrayList<>();
        for (Production production : productions) {
            indexed.add(new Production(production.lhs(), production.rhs(), indexed.size()));
        }
        this.productions = List.copyOf(indexed);
        for (Production production : this.productions) {
            byLhs.computeIfAbsent(production.lhs(), key -> new ArrayList<>()).add(production);
        }
        checkShape();
    }

    /** The grammar this one was normalized from. */
    public Grammar source() {
        return source;
    }

    public NT start() {
        return start;
    }

    public Set<NT> nonTerminals() {
        return nonTerminals;
    }

    public Set<T> terminals() {
        return terminals;
    }

    public List<Production> productions() {
        return productions;
    }

    public List<Production> productions(NT nt) {
        return Collections.unmodifiableList(byLhs.getOrDefault(nt, List.of()));
    }

    public Provenance provenance() {
        return provenance;
    }

    public Optional<T> terminal(String name) {
        return source.terminal(name);
    }

    /** The {@code S -> ε} production, present iff the empty string is in the language. */
    public Optional<Production> epsilonProduction() {
        return productions(start).stream().filter(Production::isEpsilon).findFirst();
    }

    /**
     * The normalized productions as a plain context-free grammar, dropping provenance.
     *
     * @throws com.cfgkit.core.grammar.InvalidGrammarException if the language is empty, since the
     *     start symbol then has no productions
     */
    public Grammar toGrammar() {
        return new Grammar(nonTerminals, terminals, start, productions);
    }

    private void checkShape() {
        if (!nonTerminals.contains(start)) {
            throw new ConversionException("Start symbol " + start.name() + " missing from N");
        }
        for (Production production : productions) {
            if (!nonTerminals.contains(production.lhs())) {
                throw new ConversionException("Undeclared left-hand side in " + production);
            }
            List<Symbol> rhs = production.rhs();
            boolean valid =
                    switch (rhs.size()) {
                        case 0 -> production.lhs().equals(start);
                        case 1 -> rhs.get(0) instanceof T terminal && terminals.contains(terminal);
                        case 2 -> isInnerNonTerminal(rhs.get(0)) && isInnerNonTerminal(rhs.get(1));
                        default -> false;
                    };
            if (!valid) {
                throw new ConversionException("Production is not in Chomsky Normal Form: " + production);
            }
        }
    }

    private boolean isInnerNonTerminal(Symbol symbol) {
        return symbol instanceof NT nt && nonTerminals.contains(nt) && !nt.equals(start);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("S = ").append(start.name()).append('\n');
        sb.append("P:");
        for (Production production : productions) {
            sb.append("\n  ").append(production);
        }
        return sb.toString();
    }
}
