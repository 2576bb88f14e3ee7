package com.cfgkit.core.cnf;

import com.cfgkit.core.grammar.GrammarException;

public class ConversionException extends GrammarException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
