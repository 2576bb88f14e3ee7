package com.cfgkit.core.io;

import com.cfgkit.core.grammar.InvalidGrammarException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Textual production notation {@code A -> x y z}. The arrow may also be written {@code →}; an empty
 * right side or a lone {@code ε} denotes the empty string.
 */
public final class ProductionText {

    public static final String EPSILON = "ε";

    private ProductionText() {}

    public static Map.Entry<String, List<String>> parse(String line) {
        String arrow = line.contains("->") ? "->" : "→";
        int at = line.indexOf(arrow);
        if (at < 0 || line.indexOf(arrow, at + arrow.length()) >= 0) {
            throw new InvalidGrammarException("Malformed production: " + line);
        }
        String lhs = line.substring(0, at).strip();
        if (lhs.isEmpty() || lhs.chars().anyMatch(Character::isWhitespace)) {
            throw new InvalidGrammarException("Malformed left-hand side in production: " + line);
        }
        List<String> rhs = new ArrayList<>();
        for (String symbol : line.substring(at + arrow.length()).strip().split("\\s+")) {
            if (!symbol.isEmpty()) {
                rhs.add(symbol);
            }
        }
        if (rhs.size() == 1 && rhs.get(0).equals(EPSILON)) {
            rhs.clear();
        }
        return Map.entry(lhs, List.copyOf(rhs));
    }
}
