package com.localization.toolkit.parser;

import java.util.List;

/**
 * Raised inside the parser when an entry cannot be read.
 * The parser turns it into a Junk entry; it never escapes {@link FluentParser#parse(String)}.
 */
public class ParseError extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final FluentErrorCode code;
    private final List<String> arguments;

    public ParseError(FluentErrorCode code, String... arguments) {
        super(code.format((Object[]) arguments));
        this.code = code;
        this.arguments = List.of(arguments);
    }

    public FluentErrorCode getCode() {
        return code;
    }

    public List<String> getArguments() {
        return arguments;
    }
}
