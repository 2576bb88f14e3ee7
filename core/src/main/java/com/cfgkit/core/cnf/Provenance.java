package com.cfgkit.core.cnf;

import com.cfgkit.core.grammar.Grammar.NT;
import com.cfgkit.core.grammar.Grammar.Production;
import com.cfgkit.core.grammar.Grammar.Symbol;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Links the output of {@link CnfNormalizer} back to the grammar it was computed from: one list of
 * {@link DerivationTemplate}s per CNF production and a description of every nonterminal the
 * normalizer invented.
 */
public final class Provenance {

    public enum Kind {
        /** Fresh start symbol standing in for the original one. */
        START,
        /** Right-branching helper covering the tail of a long right-hand side. */
        BINARIZATION,
        /** Nonterminal deriving exactly one terminal inside a longer right-hand side. */
        TERMINAL_PROXY
    }

    public static final class Synthetic {
        public final NT symbol;
        public final Kind kind;
        public final List<Symbol> standsFor;
        private final Production source;

        Synthetic(NT symbol, Kind kind, List<Symbol> standsFor, Production source) {
            this.symbol = Objects.requireNonNull(symbol, "symbol");
            this.kind = Objects.requireNonNull(kind, "kind");
            this.standsFor = List.copyOf(standsFor);
            this.source = source;
        }

        /** Original production the symbol was introduced for; empty for shared proxies and starts. */
        public Optional<Production> source() {
            return Optional.ofNullable(source);
        }

        @Override
        public String toString() {
            return symbol.name() + " [" + kind + "] for " + standsFor;
        }
    }

    private final List<List<DerivationTemplate>> templates;
    private final Map<NT, Synthetic> synthetic;

    Provenance(List<List<DerivationTemplate>> templates, Map<NT, Synthetic> synthetic) {
        this.templates = templates.stream().map(List::copyOf).toList();
        this.synthetic = Collections.unmodifiableMap(new LinkedHashMap<>(synthetic));
    }

    /** Templates of a production of the owning {@link CnfGrammar}, looked up by origin index. */
    public List<DerivationTemplate> templates(Production cnfProduction) {
        int index = cnfProduction.originIndex();
        if (index < 0 || index >= templates.size()) {
            throw new ConversionException("No provenance recorded for " + cnfProduction);
        }
        return templates.get(index);
    }

    public boolean isSynthetic(NT nt) {
        return synthetic.containsKey(nt);
    }

    public Optional<Synthetic> synthetic(NT nt) {
        return Optional.ofNullable(synthetic.get(nt));
    }

    public Map<NT, Synthetic> syntheticSymbols() {
        return synthetic;
    }
}
