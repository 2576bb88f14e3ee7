package com.cfgkit.core.cnf;

import com.cfgkit.core.grammar.Grammar.NT;
import com.cfgkit.core.grammar.Grammar.Production;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * Fragment of a derivation in the original grammar with numbered holes. A CNF production carries a
 * list of these: when the production is used in a parse, the subtrees produced by its right-hand
 * side fill the holes in order and the instantiated fragments replace the CNF node.
 */
public interface DerivationTemplate {

    /** Placeholder for the subtree at the given filler position. */
    record Hole(int position) implements DerivationTemplate {}

    /** Node expanded by an original production; children follow the production's right-hand side. */
    record Expansion(Production production, List<DerivationTemplate> children)
            implements DerivationTemplate {
        public Expansion {
            Objects.requireNonNull(production, "production");
            children = List.copyOf(children);
            if (children.size() != production.rhs().size()) {
                throw new ConversionException(
                        "Template for " + production + " has " + children.size() + " children");
            }
        }

        public NT symbol() {
            return production.lhs();
        }
    }

    static DerivationTemplate identity() {
        return new Hole(0);
    }

    /** Template for an untouched production: every right-hand side position is its own hole. */
    static DerivationTemplate of(Production production) {
        List<DerivationTemplate> children = new ArrayList<>();
        for (int i = 0; i < production.rhs().size(); i++) {
            children.add(new Hole(i));
        }
        return new Expansion(production, children);
    }

    /** Replaces every hole with the template supplied for its position. */
    static DerivationTemplate substitute(
            DerivationTemplate template, IntFunction<DerivationTemplate> holes) {
        if (template instanceof Hole hole) {
            return holes.apply(hole.position());
        }
        Expansion expansion = (Expansion) template;
        List<DerivationTemplate> children = new ArrayList<>(expansion.children().size());
        for (DerivationTemplate child : expansion.children()) {
            children.add(substitute(child, holes));
        }
        return new Expansion(expansion.production(), children);
    }

    static int holeCount(DerivationTemplate template) {
        if (template instanceof Hole) {
            return 1;
        }
        int count = 0;
        for (DerivationTemplate child : ((Expansion) template).children()) {
            count += holeCount(child);
        }
        return count;
    }

    /** The original production whose right-hand side directly contains the holes, if any. */
    static Optional<Production> holeOwner(DerivationTemplate template) {
        if (template instanceof Expansion expansion) {
            for (DerivationTemplate child : expansion.children()) {
                if (child instanceof Hole) {
                    return Optional.of(expansion.production());
                }
                Optional<Production> nested = holeOwner(child);
                if (nested.isPresent()) {
                    return nested;
                }
            }
        }
        return Optional.empty();
    }
}
