package com.cfgkit.core;

import com.cfgkit.core.tree.DerivationTree;
import java.util.List;
import java.util.Optional;

/** Outcome of a parse: rejection is a normal result, not an error. */
public final class ParseResult {
    private final List<String> tokens;
    private final DerivationTree tree;

    private ParseResult(List<String> tokens, DerivationTree tree) {
        this.tokens = List.copyOf(tokens);
        this.tree = tree;
    }

    static ParseResult accepted(List<String> tokens, DerivationTree tree) {
        return new ParseResult(tokens, tree);
    }

    static ParseResult rejected(List<String> tokens) {
        return new ParseResult(tokens, null);
    }

    public boolean accepted() {
        return tree != null;
    }

    /** Present iff the input was accepted. */
    public Optional<DerivationTree> tree() {
        return Optional.ofNullable(tree);
    }

    public List<String> tokens() {
        return tokens;
    }

    @Override
    public String toString() {
        return accepted() ? "accepted " + tree : "rejected " + tokens;
    }
}
