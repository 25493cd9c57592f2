package com.ymcmp.arkade.except;

import java.util.List;

public class ParseException extends CompilationException {

    public ParseException(final String message) {
        super("Parse error: " + message);
    }

    public ParseException(final List<String> errors) {
        super("Parse error: " + String.join("; ", errors));
    }
}
