package com.cfgkit.core.grammar;

/** Base class of the failures raised while building, normalizing or parsing with a grammar. */
public class GrammarException extends RuntimeException {

    public GrammarException(String message) {
        super(message);
    }

    public GrammarException(String message, Throwable cause) {
        super(message, cause);
    }
}
