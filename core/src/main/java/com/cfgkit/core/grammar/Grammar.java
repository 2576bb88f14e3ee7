package com.cfgkit.core.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable context-free grammar G = (N, T, P, S).
 *
 * <p>Instances are validated on construction and never change afterwards, so they can be shared
 * between threads. Edits are expressed by building a new grammar, usually through {@link
 * #builder()}.
 */
public final class Grammar {

    /** Upper bound used for "derives no terminal string" in {@link #minYield()}. */
    public static final int UNREACHABLE_YIELD = Integer.MAX_VALUE / 4;

    public interface Symbol {
        String name();
    }

    public record T(String name) implements Symbol {
        public T {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return "'" + name + "'";
        }
    }

    public record NT(String name) implements Symbol {
        public NT {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return "<" + name + ">";
        }
    }

    /**
     * A production {@code lhs -> rhs}. An empty right-hand side is an epsilon production. The
     * origin index is the declaration position inside the owning grammar and is used as the
     * deterministic tie-breaker everywhere a choice between productions has to be made.
     */
    public record Production(NT lhs, List<Symbol> rhs, int originIndex) {
        public Production {
            Objects.requireNonNull(lhs, "lhs");
            rhs = List.copyOf(Objects.requireNonNull(rhs, "rhs"));
        }

        public Production(NT lhs, List<Symbol> rhs) {
            this(lhs, rhs, -1);
        }

        public boolean isEpsilon() {
            return rhs.isEmpty();
        }

        @Override
        public String toString() {
            return lhs.name() + " -> " + formatRhs(rhs);
        }
    }

    private final Set<NT> nonTerminals;
    private final Set<T> terminals;
    private final NT start;
    private final List<Production> productions;
    private final GrammarType type;
    private final Map<NT, List<Production>> byLhs = new LinkedHashMap<>();
    private final Map<String, T> terminalsByName = new LinkedHashMap<>();

    public Grammar(
            Collection<NT> nonTerminals,
            Collection<T> terminals,
            NT start,
            List<Production> productions,
            GrammarType type) {
        this.nonTerminals =
                Collections.unmodifiableSet(
                        new LinkedHashSet<>(Objects.requireNonNull(nonTerminals, "nonTerminals")));
        this.terminals =
                Collections.unmodifiableSet(
                        new LinkedHashSet<>(Objects.requireNonNull(terminals, "terminals")));
        this.start = Objects.requireNonNull(start, "start");
        this.type = Objects.requireNonNull(type, "type");
        List<Production> indexed = new ArrayList<>();
        for (Production production : Objects.requireNonNull(productions, "productions")) {
            indexed.add(new Production(production.lhs(), production.rhs(), indexed.size()));
        }
        this.productions = List.copyOf(indexed);
        for (NT nt : this.nonTerminals) {
            byLhs.put(nt, new ArrayList<>());
        }
        for (Production production : this.productions) {
            byLhs.computeIfAbsent(production.lhs(), key -> new ArrayList<>()).add(production);
        }
        byLhs.replaceAll((key, value) -> List.copyOf(value));
        for (T terminal : this.terminals) {
            terminalsByName.put(terminal.name(), terminal);
        }
        validate();
    }

    public Grammar(Collection<NT> nonTerminals, Collection<T> terminals, NT start, List<Production> productions) {
        this(nonTerminals, terminals, start, productions, GrammarType.CONTEXT_FREE);
    }

    public static Builder builder() {
        return new Builder();
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
        return byLhs.getOrDefault(nt, List.of());
    }

    public GrammarType type() {
        return type;
    }

    public Optional<T> terminal(String name) {
        return Optional.ofNullable(terminalsByName.get(name));
    }

    /**
     * Checks every structural invariant and throws {@link InvalidGrammarException} on the first
     * violation. Has no side effects, so calling it repeatedly is harmless.
     */
    public void validate() {
        if (!nonTerminals.contains(start)) {
            throw new InvalidGrammarException(
                    "Start symbol " + start.name() + " is not a nonterminal");
        }
        Set<String> ntNames = new HashSet<>();
        for (NT nt : nonTerminals) {
            requireName(nt.name());
            ntNames.add(nt.name());
        }
        for (T terminal : terminals) {
            requireName(terminal.name());
            if (ntNames.contains(terminal.name())) {
                throw new InvalidGrammarException(
                        "Symbol " + terminal.name() + " is both a terminal and a nonterminal");
            }
        }
        for (Production production : productions) {
            if (!nonTerminals.contains(production.lhs())) {
                throw new InvalidGrammarException(
                        "Production " + production + " has an undefined left-hand side");
            }
            for (Symbol symbol : production.rhs()) {
                boolean known =
                        symbol instanceof NT nt
                                ? nonTerminals.contains(nt)
                                : symbol instanceof T terminal && terminals.contains(terminal);
                if (!known) {
                    throw new InvalidGrammarException(
                            "Production " + production + " references undefined symbol " + symbol.name());
                }
            }
        }
        for (NT nt : nonTerminals) {
            if (productions(nt).isEmpty()) {
                throw new InvalidGrammarException("Nonterminal " + nt.name() + " has no productions");
            }
        }
    }

    /**
     * True when every right-hand side is a run of terminals optionally followed by a single
     * nonterminal. Informational only; the declared {@link GrammarType} is not checked against it.
     */
    public boolean isRightLinear() {
        for (Production production : productions) {
            List<Symbol> rhs = production.rhs();
            for (int i = 0; i < rhs.size(); i++) {
                if (rhs.get(i) instanceof NT && i != rhs.size() - 1) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Computes the length of the shortest terminal string every nonterminal derives, using a
     * Bellman-Ford style relaxation. Nonterminals deriving no terminal string map to {@link
     * #UNREACHABLE_YIELD}.
     */
    public Map<NT, Integer> minYield() {
        Map<NT, Integer> memo = new LinkedHashMap<>();
        for (NT nt : nonTerminals) {
            memo.put(nt, UNREACHABLE_YIELD);
        }
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Production production : productions) {
                int size = 0;
                for (Symbol symbol : production.rhs()) {
                    size = safeAdd(size, symbol instanceof NT nt ? memo.get(nt) : 1);
                }
                if (size < memo.get(production.lhs())) {
                    memo.put(production.lhs(), size);
                    changed = true;
                }
            }
        }
        return memo;
    }

    /** Nonterminals that derive at least one terminal string. */
    public Set<NT> generating() {
        return minYield().entrySet().stream()
                .filter(entry -> entry.getValue() < UNREACHABLE_YIELD)
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof Grammar g)) {
            return false;
        }
        return nonTerminals.equals(g.nonTerminals)
                && terminals.equals(g.terminals)
                && start.equals(g.start)
                && productions.equals(g.productions)
                && type == g.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(nonTerminals, terminals, start, productions, type);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("N = {").append(joinNames(nonTerminals)).append("}\n");
        sb.append("T = {").append(joinNames(terminals)).append("}\n");
        sb.append("S = ").append(start.name()).append('\n');
        sb.append("P:");
        for (Production production : productions) {
            sb.append("\n  ").append(production);
        }
        return sb.toString();
    }

    public static String formatRhs(List<Symbol> rhs) {
        if (rhs.isEmpty()) {
            return "ε";
        }
        return rhs.stream().map(Symbol::name).collect(Collectors.joining(" "));
    }

    private static String joinNames(Collection<? extends Symbol> symbols) {
        return symbols.stream().map(Symbol::name).sorted().collect(Collectors.joining(", "));
    }

    private static void requireName(String name) {
        if (name.isBlank()) {
            throw new InvalidGrammarException("Symbol names must not be blank");
        }
    }

    private static int safeAdd(int a, int b) {
        long sum = (long) a + (long) b;
        return (int) Math.min(sum, UNREACHABLE_YIELD);
    }

    /** Name-based construction: every rhs name is resolved against the declared N and T. */
    public static final class Builder {
        private final List<String> nonTerminals = new ArrayList<>();
        private final List<String> terminals = new ArrayList<>();
        private final List<Map.Entry<String, List<String>>> productions = new ArrayList<>();
        private String start;
        private GrammarType type = GrammarType.CONTEXT_FREE;

        private Builder() {}

        public Builder nonTerminals(String... names) {
            return nonTerminals(Arrays.asList(names));
        }

        public Builder nonTerminals(Collection<String> names) {
            nonTerminals.addAll(names);
            return this;
        }

        public Builder terminals(String... names) {
            return terminals(Arrays.asList(names));
        }

        public Builder terminals(Collection<String> names) {
            terminals.addAll(names);
            return this;
        }

        public Builder start(String name) {
            this.start = name;
            return this;
        }

        public Builder type(GrammarType type) {
            this.type = Objects.requireNonNull(type, "type");
            return this;
        }

        public Builder production(String lhs, String... rhs) {
            return production(lhs, Arrays.asList(rhs));
        }

        public Builder production(String lhs, List<String> rhs) {
            productions.add(Map.entry(lhs, List.copyOf(rhs)));
            return this;
        }

        public Grammar build() {
            if (start == null) {
                throw new InvalidGrammarException("No start symbol given");
            }
            Set<String> ntNames = new LinkedHashSet<>(nonTerminals);
            Set<String> tNames = new LinkedHashSet<>(terminals);
            for (String name : tNames) {
                if (ntNames.contains(name)) {
                    throw new InvalidGrammarException(
                            "Symbol " + name + " is both a terminal and a nonterminal");
                }
            }
            if (!ntNames.contains(start)) {
                throw new InvalidGrammarException("Start symbol " + start + " is not a nonterminal");
            }
            List<Production> resolved = new ArrayList<>();
            for (Map.Entry<String, List<String>> entry : productions) {
                if (!ntNames.contains(entry.getKey())) {
                    throw new InvalidGrammarException(
                            "Production for undefined nonterminal " + entry.getKey());
                }
                List<Symbol> rhs = new ArrayList<>();
                for (String name : entry.getValue()) {
                    if (ntNames.contains(name)) {
                        rhs.add(new NT(name));
                    } else if (tNames.contains(name)) {
                        rhs.add(new T(name));
                    } else {
                        throw new InvalidGrammarException(
                                "Production for "
                                        + entry.getKey()
                                        + " references undefined symbol "
                                        + name);
                    }
                }
                resolved.add(new Production(new NT(entry.getKey()), rhs));
            }
            return new Grammar(
                    ntNames.stream().map(NT::new).toList(),
                    tNames.stream().map(T::new).toList(),
                    new NT(start),
                    resolved,
                    type);
        }
    }
}
