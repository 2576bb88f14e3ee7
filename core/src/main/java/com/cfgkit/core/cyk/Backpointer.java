package com.cfgkit.core.cyk;

import com.cfgkit.core.grammar.Grammar.NT;
import com.cfgkit.core.grammar.Grammar.Production;
import com.cfgkit.core.grammar.Grammar.T;
import java.util.Objects;

/** How a nonterminal was derived over one span of the input. */
public interface Backpointer {

    /** CNF production the entry was built from. */
    Production production();

    /** Single token matched by {@code A -> a}. */
    record Leaf(T terminal, Production production) implements Backpointer {
        public Leaf {
            Objects.requireNonNull(terminal, "terminal");
            Objects.requireNonNull(production, "production");
        }
    }

    /** {@code A -> B C} with B over the first {@code k} tokens of the span and C over the rest. */
    record Split(int k, NT left, NT right, Production production) implements Backpointer {
        public Split {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
            Objects.requireNonNull(production, "production");
            if (k < 1) {
                throw new IllegalArgumentException("split point must be positive: " + k);
            }
        }
    }
}
