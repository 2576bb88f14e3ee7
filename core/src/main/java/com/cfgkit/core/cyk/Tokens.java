package com.cfgkit.core.cyk;

import com.cfgkit.core.grammar.Grammar.T;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** Splits raw input text into terminal names. */
public final class Tokens {

    private Tokens() {}

    /**
     * Whitespace-separated text is split on whitespace. Otherwise the text is segmented greedily by
     * the longest terminal name matching at each position, which for single-character terminals is
     * a plain character split.
     */
    public static List<String> split(Collection<T> terminals, String text) {
        String trimmed = text.strip();
        List<String> tokens = new ArrayList<>();
        if (trimmed.isEmpty()) {
            return tokens;
        }
        if (trimmed.chars().anyMatch(Character::isWhitespace)) {
            for (String part : trimmed.split("\\s+")) {
                tokens.add(part);
            }
            return tokens;
        }
        int position = 0;
        while (position < trimmed.length()) {
            String match = null;
            for (T terminal : terminals) {
                String name = terminal.name();
                boolean longer = match == null || name.length() > match.length();
                if (longer && trimmed.startsWith(name, position)) {
                    match = name;
                }
            }
            if (match == null) {
                int end = trimmed.offsetByCodePoints(position, 1);
                throw new UnknownSymbolException(trimmed.substring(position, end));
            }
            tokens.add(match);
            position += match.length();
        }
        return tokens;
    }
}
