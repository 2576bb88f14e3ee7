package com.cfgkit.core.cyk;

import com.cfgkit.core.grammar.GrammarException;
import java.util.Objects;

/** Raised when a parse input token is not a terminal of the grammar. */
public class UnknownSymbolException extends GrammarException {

    private final String token;

    public UnknownSymbolException(String token) {
        super("Unknown terminal symbol: '" + token + "'");
        this.token = Objects.requireNonNull(token, "token");
    }

    public String token() {
        return token;
    }
}
