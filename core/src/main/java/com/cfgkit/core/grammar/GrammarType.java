package com.cfgkit.core.grammar;

/** Chomsky hierarchy level a grammar is declared at, with its interchange code. */
public enum GrammarType {
    CONTEXT_FREE("2"),
    REGULAR("3");

    private final String code;

    GrammarType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static GrammarType fromCode(String code) {
        for (GrammarType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new InvalidGrammarException("Unknown grammar type: " + code);
    }
}
