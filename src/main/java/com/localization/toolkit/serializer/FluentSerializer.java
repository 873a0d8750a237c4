package com.localization.toolkit.serializer;

import com.localization.toolkit.model.Attribute;
import com.localization.toolkit.model.BaseComment;
import com.localization.toolkit.model.CallArguments;
import com.localization.toolkit.model.Comment;
import com.localization.toolkit.model.Expression;
import com.localization.toolkit.model.FluentDefinition;
import com.localization.toolkit.model.FluentEntry;
import com.localization.toolkit.model.FluentEntryVisitor;
import com.localization.toolkit.model.FluentResource;
import com.localization.toolkit.model.FunctionReference;
import com.localization.toolkit.model.GroupComment;
import com.localization.toolkit.model.Identifier;
import com.localization.toolkit.model.Junk;
import com.localization.toolkit.model.Message;
import com.localization.toolkit.model.MessageReference;
import com.localization.toolkit.model.NamedArgument;
import com.localization.toolkit.model.NumberLiteral;
import com.localization.toolkit.model.Pattern;
import com.localization.toolkit.model.PatternElement;
import com.localization.toolkit.model.Placeable;
import com.localization.toolkit.model.ResourceComment;
import com.localization.toolkit.model.SelectExpression;
import com.localization.toolkit.model.StringLiteral;
import com.localization.toolkit.model.Term;
import com.localization.toolkit.model.TermReference;
import com.localization.toolkit.model.TextElement;
import com.localization.toolkit.model.VariableReference;
import com.localization.toolkit.model.Variant;
import com.localization.toolkit.model.VariantKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes a Fluent AST back to canonical Fluent text.
 *
 * <p>Layout rules:
 * <ul>
 *   <li>a pattern is written on its own indented lines when it contains a
 *       select expression or a line break, unless its first text starts with
 *       {@code [}, {@code .} or {@code *}, which only parse inline;</li>
 *   <li>every nesting level is indented by four spaces; blank lines inside a
 *       pattern stay blank;</li>
 *   <li>standalone comments are followed by a blank line, and preceded by one
 *       when anything was written before them.</li>
 * </ul>
 * Junk entries are not written.
 */
public class FluentSerializer {
    private static final Logger log = LoggerFactory.getLogger(FluentSerializer.class);

    private static final String INDENT = "    ";

    public String serialize(FluentResource resource) {
        StringBuilder out = new StringBuilder();
        EntryWriter writer = new EntryWriter();

        for (FluentEntry entry : resource.getBody()) {
            if (entry instanceof Junk) {
                continue;
            }
            out.append(entry.accept(writer));
            writer.hasEntries = true;
        }

        log.debug("Serialized {} entries into {} characters", resource.getBody().size(), out.length());
        return out.toString();
    }

    /**
     * Serializes a single entry as if it were the first in its resource.
     */
    public String serializeEntry(FluentEntry entry) {
        return entry.accept(new EntryWriter());
    }

    /**
     * Writes a pattern as it follows {@code =}: a leading space for inline
     * patterns, or a line break and indent for block patterns.
     */
    public String serializePattern(Pattern pattern) {
        String content = indentExceptFirstLine(serializePatternContent(pattern));
        if (startsOnNewLine(pattern)) {
            return "\n" + INDENT + content;
        }
        return " " + content;
    }

    /**
     * The pattern elements without any leading layout. Lines of select
     * expressions are indented relative to the first line.
     */
    public String serializePatternContent(Pattern pattern) {
        StringBuilder content = new StringBuilder();
        for (PatternElement element : pattern.getElements()) {
            content.append(serializeElement(element));
        }
        return content.toString();
    }

    public boolean startsOnNewLine(Pattern pattern) {
        boolean multiline = pattern.getElements().stream().anyMatch(element ->
                isSelectExpression(element)
                        || (element instanceof TextElement text && text.getValue().contains("\n")));
        if (!multiline || pattern.isEmpty()) {
            return false;
        }

        PatternElement first = pattern.getElements().get(0);
        if (first instanceof TextElement text && !text.getValue().isEmpty()) {
            char firstChar = text.getValue().charAt(0);
            return firstChar != '[' && firstChar != '.' && firstChar != '*';
        }
        return true;
    }

    static String indentExceptFirstLine(String content) {
        String[] lines = content.split("\n", -1);
        StringBuilder indented = new StringBuilder(lines[0]);
        for (int i = 1; i < lines.length; i++) {
            indented.append('\n');
            if (!lines[i].isEmpty()) {
                indented.append(INDENT).append(lines[i]);
            }
        }
        return indented.toString();
    }

    private static boolean isSelectExpression(PatternElement element) {
        return element instanceof Placeable placeable
                && placeable.getExpression() instanceof SelectExpression;
    }

    // Entries

    private String serializeComment(BaseComment comment, String prefix) {
        List<String> lines = new ArrayList<>();
        for (String line : comment.getContent().split("\n", -1)) {
            lines.add(line.isEmpty() ? prefix : prefix + " " + line);
        }
        return String.join("\n", lines) + "\n";
    }

    private String serializeDefinition(FluentDefinition definition) {
        StringBuilder parts = new StringBuilder();

        if (definition.getComment() != null) {
            parts.append(serializeComment(definition.getComment(), "#"));
        }

        parts.append(definition.getFullId()).append(" =");
        if (definition.getValue() != null) {
            parts.append(serializePattern(definition.getValue()));
        }
        for (Attribute attribute : definition.getAttributes()) {
            parts.append(serializeAttribute(attribute));
        }

        parts.append('\n');
        return parts.toString();
    }

    private String serializeAttribute(Attribute attribute) {
        return "\n" + INDENT + "." + attribute.getId().getName() + " ="
                + indentExceptFirstLine(serializePattern(attribute.getValue()));
    }

    // Pattern elements and expressions

    private String serializeElement(PatternElement element) {
        if (element instanceof TextElement text) {
            return text.getValue();
        }
        if (element instanceof Placeable placeable) {
            return serializePlaceable(placeable);
        }
        throw new IllegalArgumentException("Unknown pattern element type: " + element.getClass().getSimpleName());
    }

    private String serializePlaceable(Placeable placeable) {
        Expression expression = placeable.getExpression();

        if (expression instanceof Placeable inner) {
            return "{" + serializePlaceable(inner) + "}";
        }
        if (expression instanceof SelectExpression) {
            // the select expression already ends with a line break
            return "{ " + serializeExpression(expression) + "}";
        }
        return "{ " + serializeExpression(expression) + " }";
    }

    public String serializeExpression(Expression expression) {
        if (expression instanceof StringLiteral literal) {
            return "\"" + literal.getValue() + "\"";
        }
        if (expression instanceof NumberLiteral literal) {
            return literal.getValue();
        }
        if (expression instanceof VariableReference reference) {
            return "$" + reference.getId().getName();
        }
        if (expression instanceof TermReference reference) {
            StringBuilder out = new StringBuilder("-").append(reference.getId().getName());
            if (reference.getAttribute() != null) {
                out.append('.').append(reference.getAttribute().getName());
            }
            if (reference.getArguments() != null) {
                out.append(serializeCallArguments(reference.getArguments()));
            }
            return out.toString();
        }
        if (expression instanceof MessageReference reference) {
            StringBuilder out = new StringBuilder(reference.getId().getName());
            if (reference.getAttribute() != null) {
                out.append('.').append(reference.getAttribute().getName());
            }
            return out.toString();
        }
        if (expression instanceof FunctionReference reference) {
            return reference.getId().getName() + serializeCallArguments(reference.getArguments());
        }
        if (expression instanceof SelectExpression select) {
            StringBuilder out = new StringBuilder(serializeExpression(select.getSelector())).append(" ->");
            for (Variant variant : select.getVariants()) {
                out.append(serializeVariant(variant));
            }
            return out.append('\n').toString();
        }
        if (expression instanceof Placeable placeable) {
            return serializePlaceable(placeable);
        }
        throw new IllegalArgumentException("Unknown expression type: " + expression.getClass().getSimpleName());
    }

    private String serializeVariant(Variant variant) {
        String marker = variant.isDefaultVariant() ? "   *" : INDENT;
        return "\n" + marker + "[" + serializeVariantKey(variant.getKey()) + "]"
                + indentExceptFirstLine(serializePattern(variant.getValue()));
    }

    private String serializeVariantKey(VariantKey key) {
        if (key instanceof Identifier identifier) {
            return identifier.getName();
        }
        if (key instanceof NumberLiteral number) {
            return number.getValue();
        }
        throw new IllegalArgumentException("Unknown variant key type: " + key.getClass().getSimpleName());
    }

    private String serializeCallArguments(CallArguments arguments) {
        List<String> parts = new ArrayList<>();
        for (Expression positional : arguments.getPositional()) {
            parts.add(serializeExpression(positional));
        }
        for (NamedArgument named : arguments.getNamed()) {
            parts.add(named.getName().getName() + ": " + serializeExpression(named.getValue()));
        }
        return "(" + String.join(", ", parts) + ")";
    }

    private class EntryWriter implements FluentEntryVisitor<String> {
        private boolean hasEntries;

        @Override
        public String visit(Message message) {
            return serializeDefinition(message);
        }

        @Override
        public String visit(Term term) {
            return serializeDefinition(term);
        }

        @Override
        public String visit(Comment comment) {
            return standalone(serializeComment(comment, "#"));
        }

        @Override
        public String visit(GroupComment comment) {
            return standalone(serializeComment(comment, "##"));
        }

        @Override
        public String visit(ResourceComment comment) {
            return standalone(serializeComment(comment, "###"));
        }

        @Override
        public String visit(Junk junk) {
            return junk.getContent();
        }

        private String standalone(String comment) {
            return hasEntries ? "\n" + comment + "\n" : comment + "\n";
        }
    }
}
