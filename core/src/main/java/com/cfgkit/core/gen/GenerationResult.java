package com.cfgkit.core.gen;

import com.cfgkit.core.grammar.Grammar.T;
import java.util.List;

/**
 * Strings produced by {@link ShortestStringsGenerator}, ordered by text length and then
 * lexicographically. {@link #complete()} is false when a search bound stopped exploration before
 * the requested number of strings was found.
 */
public final class GenerationResult {
    private final List<List<T>> sentences;
    private final boolean complete;

    GenerationResult(List<List<T>> sentences, boolean complete) {
        this.sentences = sentences.stream().map(List::copyOf).toList();
        this.complete = complete;
    }

    /** Each string as its sequence of terminals. */
    public List<List<T>> sentences() {
        return sentences;
    }

    /** Each string with its terminal names concatenated; the empty string stands for ε. */
    public List<String> strings() {
        return sentences.stream().map(ShortestStringsGenerator::text).toList();
    }

    public boolean complete() {
        return complete;
    }

    public int size() {
        return sentences.size();
    }

    @Override
    public String toString() {
        return strings() + (complete ? "" : " (incomplete)");
    }
}
