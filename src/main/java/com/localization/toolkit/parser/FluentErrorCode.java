package com.localization.toolkit.parser;

/**
 * Error codes reported by the Fluent parser.
 * Each code carries a message template whose {@code %s} slots are filled
 * from the error arguments.
 */
public enum FluentErrorCode {
    E0001("Generic error"),
    E0002("Expected an entry start"),
    E0003("Expected token: \"%s\""),
    E0004("Expected a character from range: \"%s\""),
    E0005("Expected message \"%s\" to have a value or attributes"),
    E0006("Expected term \"-%s\" to have a value"),
    E0008("The callee has to be an upper-case identifier or a term"),
    E0009("The argument name has to be a simple identifier"),
    E0010("Expected one of the variants to be marked as default (*)"),
    E0011("Expected at least one variant after \"->\""),
    E0012("Expected value"),
    E0013("Expected variant key"),
    E0014("Expected literal"),
    E0015("Only one variant can be marked as default (*)"),
    E0016("Message references cannot be used as selectors"),
    E0017("Terms cannot be used as selectors"),
    E0018("Attributes of messages cannot be used as selectors"),
    E0019("Attributes of terms cannot be used as placeables"),
    E0020("Unterminated string expression"),
    E0021("Positional arguments must not follow named arguments"),
    E0022("Named arguments must be unique"),
    E0025("Unknown escape sequence: \\%s."),
    E0026("Invalid Unicode escape sequence: %s."),
    E0027("Unbalanced closing brace in TextElement."),
    E0028("Expected an inline expression"),
    E0029("Expected simple expression as selector");

    private final String template;

    FluentErrorCode(String template) {
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }

    public String format(Object... arguments) {
        if (arguments == null || arguments.length == 0) {
            return template;
        }
        return String.format(template, arguments);
    }
}
