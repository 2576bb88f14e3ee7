package com.cfgkit.core.grammar;

public class InvalidGrammarException extends GrammarException {

    public InvalidGrammarException(String message) {
        super(message);
    }

    public InvalidGrammarException(String message, Throwable cause) {
        super(message, cause);
    }
}
