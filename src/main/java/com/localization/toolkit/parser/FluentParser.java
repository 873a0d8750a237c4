package com.localization.toolkit.parser;

import com.localization.toolkit.model.Annotation;
import com.localization.toolkit.model.Attribute;
import com.localization.toolkit.model.BaseComment;
import com.localization.toolkit.model.CallArguments;
import com.localization.toolkit.model.Comment;
import com.localization.toolkit.model.Expression;
import com.localization.toolkit.model.FluentDefinition;
import com.localization.toolkit.model.FluentEntry;
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
import com.localization.toolkit.model.Span;
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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.localization.toolkit.parser.FluentParserStream.EOF;
import static com.localization.toolkit.parser.FluentParserStream.EOL;

/**
 * Recursive descent parser for Fluent 1.0 syntax.
 *
 * <p>Parsing never fails as a whole: an entry that cannot be read becomes a
 * {@link Junk} entry carrying an {@link Annotation} per error, and parsing
 * resumes at the next line that can start an entry.
 *
 * <p>A {@code #} comment directly followed by a message or term (no blank
 * line between them) is attached to that entry; otherwise it stays standalone.
 */
public class FluentParser {
    private static final Logger log = LoggerFactory.getLogger(FluentParser.class);

    private static final java.util.regex.Pattern FUNCTION_NAME =
            java.util.regex.Pattern.compile("^[A-Z][A-Z0-9_-]*$");

    public FluentResource parse(String source) {
        FluentParserStream ps = new FluentParserStream(source);
        ps.skipBlankBlock();

        List<FluentEntry> entries = new ArrayList<>();
        Comment pendingComment = null;

        while (ps.currentChar() != EOF) {
            FluentEntry entry = getEntryOrJunk(ps);
            String blankLines = ps.skipBlankBlock();

            // A comment directly above the next entry may belong to it
            if (entry instanceof Comment comment && blankLines.isEmpty() && ps.currentChar() != EOF) {
                pendingComment = comment;
                continue;
            }

            if (pendingComment != null) {
                if (entry instanceof FluentDefinition definition) {
                    attachComment(definition, pendingComment);
                } else {
                    entries.add(pendingComment);
                }
                pendingComment = null;
            }
            entries.add(entry);
        }

        FluentResource resource = new FluentResource(entries);
        if (log.isDebugEnabled()) {
            log.debug("Parsed {} entries ({} junk) from {} characters",
                    entries.size(), resource.getJunk().size(), source.length());
        }
        return resource;
    }

    private void attachComment(FluentDefinition definition, Comment comment) {
        definition.setComment(comment);
        definition.setSpan(new Span(comment.getSpan().getStart(), definition.getSpan().getEnd()));
    }

    private FluentEntry getEntryOrJunk(FluentParserStream ps) {
        int entryStart = ps.getIndex();

        try {
            FluentEntry entry = getEntry(ps);
            ps.expectLineEnd();
            return entry;
        } catch (ParseError err) {
            int errorIndex = ps.getIndex();
            ps.skipToNextEntryStart(entryStart);
            int nextEntryStart = ps.getIndex();
            if (nextEntryStart < errorIndex) {
                // the error is reported no further than the junk extends
                errorIndex = nextEntryStart;
            }

            Annotation annotation = new Annotation(
                    err.getCode().name(), err.getArguments(), err.getMessage(),
                    new Span(errorIndex, errorIndex));
            String content = ps.slice(entryStart, nextEntryStart);
            log.debug("Junk at offset {}: {} {}", entryStart, annotation.getCode(), annotation.getMessage());
            return new Junk(content, List.of(annotation), new Span(entryStart, nextEntryStart));
        }
    }

    private FluentEntry getEntry(FluentParserStream ps) {
        int start = ps.getIndex();
        FluentEntry entry;

        if (ps.currentChar() == '#') {
            entry = getComment(ps);
        } else if (ps.currentChar() == '-') {
            entry = getTerm(ps);
        } else if (ps.isIdentifierStart()) {
            entry = getMessage(ps);
        } else {
            throw new ParseError(FluentErrorCode.E0002);
        }

        entry.setSpan(new Span(start, ps.getIndex()));
        return entry;
    }

    private BaseComment getComment(FluentParserStream ps) {
        // -1 until the first line tells us which comment level this is
        int level = -1;
        StringBuilder content = new StringBuilder();

        while (true) {
            int i = -1;
            while (ps.currentChar() == '#' && i < (level == -1 ? 2 : level)) {
                ps.next();
                i++;
            }

            if (level == -1) {
                level = i;
            }

            if (ps.currentChar() != EOL && ps.currentChar() != EOF) {
                ps.expectChar(' ');
                int ch;
                while ((ch = ps.takeChar(c -> c != EOL)) != EOF) {
                    content.append((char) ch);
                }
            }

            if (ps.isNextLineComment(level)) {
                content.append(EOL);
                ps.next();
            } else {
                break;
            }
        }

        switch (level) {
            case 0:
                return new Comment(content.toString());
            case 1:
                return new GroupComment(content.toString());
            default:
                return new ResourceComment(content.toString());
        }
    }

    private Message getMessage(FluentParserStream ps) {
        Identifier id = getIdentifier(ps);
        ps.skipBlankInline();
        ps.expectChar('=');

        Pattern value = maybeGetPattern(ps);
        List<Attribute> attributes = getAttributes(ps);

        if (value == null && attributes.isEmpty()) {
            throw new ParseError(FluentErrorCode.E0005, id.getName());
        }

        return Message.builder()
                .id(id)
                .value(value)
                .attributes(attributes)
                .build();
    }

    private Term getTerm(FluentParserStream ps) {
        ps.expectChar('-');
        Identifier id = getIdentifier(ps);
        ps.skipBlankInline();
        ps.expectChar('=');

        Pattern value = maybeGetPattern(ps);
        if (value == null) {
            throw new ParseError(FluentErrorCode.E0006, id.getName());
        }

        List<Attribute> attributes = getAttributes(ps);
        return Term.builder()
                .id(id)
                .value(value)
                .attributes(attributes)
                .build();
    }

    private Attribute getAttribute(FluentParserStream ps) {
        ps.expectChar('.');
        Identifier key = getIdentifier(ps);
        ps.skipBlankInline();
        ps.expectChar('=');

        Pattern value = maybeGetPattern(ps);
        if (value == null) {
            throw new ParseError(FluentErrorCode.E0012);
        }
        return new Attribute(key, value);
    }

    private List<Attribute> getAttributes(FluentParserStream ps) {
        List<Attribute> attributes = new ArrayList<>();
        ps.peekBlank();

        while (ps.isAttributeStart()) {
            ps.skipToPeek();
            attributes.add(getAttribute(ps));
            ps.peekBlank();
        }
        return attributes;
    }

    private Identifier getIdentifier(FluentParserStream ps) {
        StringBuilder name = new StringBuilder();
        name.append(ps.takeIdStart());

        int ch;
        while ((ch = ps.takeIdChar()) != EOF) {
            name.append((char) ch);
        }
        return new Identifier(name.toString());
    }

    // Select expressions

    private VariantKey getVariantKey(FluentParserStream ps) {
        int ch = ps.currentChar();
        if (ch == EOF) {
            throw new ParseError(FluentErrorCode.E0013);
        }
        if (FluentParserStream.isDigit(ch) || ch == '-') {
            return getNumber(ps);
        }
        return getIdentifier(ps);
    }

    private Variant getVariant(FluentParserStream ps, boolean hasDefault) {
        boolean defaultVariant = false;

        if (ps.currentChar() == '*') {
            if (hasDefault) {
                throw new ParseError(FluentErrorCode.E0015);
            }
            ps.next();
            defaultVariant = true;
        }

        ps.expectChar('[');
        ps.skipBlank();
        VariantKey key = getVariantKey(ps);
        ps.skipBlank();
        ps.expectChar(']');

        Pattern value = maybeGetPattern(ps);
        if (value == null) {
            throw new ParseError(FluentErrorCode.E0012);
        }
        return new Variant(key, value, defaultVariant);
    }

    private List<Variant> getVariants(FluentParserStream ps) {
        List<Variant> variants = new ArrayList<>();
        boolean hasDefault = false;

        ps.skipBlank();
        while (ps.isVariantStart()) {
            Variant variant = getVariant(ps, hasDefault);
            hasDefault = hasDefault || variant.isDefaultVariant();
            variants.add(variant);
            ps.expectLineEnd();
            ps.skipBlank();
        }

        if (variants.isEmpty()) {
            throw new ParseError(FluentErrorCode.E0011);
        }
        if (!hasDefault) {
            throw new ParseError(FluentErrorCode.E0010);
        }
        return variants;
    }

    // Numbers

    private String getDigits(FluentParserStream ps) {
        StringBuilder digits = new StringBuilder();
        int ch;
        while ((ch = ps.takeDigit()) != EOF) {
            digits.append((char) ch);
        }
        if (digits.length() == 0) {
            throw new ParseError(FluentErrorCode.E0004, "0-9");
        }
        return digits.toString();
    }

    private NumberLiteral getNumber(FluentParserStream ps) {
        StringBuilder value = new StringBuilder();

        if (ps.currentChar() == '-') {
            ps.next();
            value.append('-');
        }
        value.append(getDigits(ps));

        if (ps.currentChar() == '.') {
            ps.next();
            value.append('.').append(getDigits(ps));
        }
        return new NumberLiteral(value.toString());
    }

    // Patterns

    private Pattern maybeGetPattern(FluentParserStream ps) {
        ps.peekBlankInline();
        if (ps.isValueStart()) {
            ps.skipToPeek();
            return getPattern(ps, false);
        }

        ps.peekBlankBlock();
        if (ps.isValueContinuation()) {
            ps.skipToPeek();
            return getPattern(ps, true);
        }
        return null;
    }

    private Pattern getPattern(FluentParserStream ps, boolean isBlock) {
        List<PatternElement> elements = new ArrayList<>();
        int commonIndent;

        if (isBlock) {
            // the first line of a block pattern counts towards the common indent
            String firstIndent = ps.skipBlankInline();
            elements.add(new Indent(firstIndent));
            commonIndent = firstIndent.length();
        } else {
            commonIndent = Integer.MAX_VALUE;
        }

        while (ps.currentChar() != EOF) {
            if (ps.currentChar() == EOL) {
                String blankLines = ps.peekBlankBlock();
                if (ps.isValueContinuation()) {
                    ps.skipToPeek();
                    String indent = ps.skipBlankInline();
                    commonIndent = Math.min(commonIndent, indent.length());
                    elements.add(new Indent(blankLines + indent));
                    continue;
                }

                // not a continuation: the pattern ends at this line break
                ps.resetPeek();
                break;
            }

            if (ps.currentChar() == '}') {
                throw new ParseError(FluentErrorCode.E0027);
            }

            elements.add(getPatternElement(ps));
        }

        return new Pattern(dedent(elements, commonIndent));
    }

    private PatternElement getPatternElement(FluentParserStream ps) {
        if (ps.currentChar() == '{') {
            return getPlaceable(ps);
        }
        return getTextElement(ps);
    }

    /**
     * Removes the common indent from indent markers, merges adjacent text and
     * trims the trailing whitespace of the last text element.
     */
    private List<PatternElement> dedent(List<PatternElement> elements, int commonIndent) {
        List<PatternElement> trimmed = new ArrayList<>();

        for (PatternElement element : elements) {
            if (element instanceof Placeable) {
                trimmed.add(element);
                continue;
            }

            String value;
            if (element instanceof Indent indent) {
                value = indent.value.substring(0, indent.value.length() - commonIndent);
                if (value.isEmpty()) {
                    continue;
                }
            } else {
                value = ((TextElement) element).getValue();
            }

            int last = trimmed.size() - 1;
            if (last >= 0 && trimmed.get(last) instanceof TextElement previous) {
                trimmed.set(last, new TextElement(previous.getValue() + value));
                continue;
            }
            trimmed.add(new TextElement(value));
        }

        int last = trimmed.size() - 1;
        if (last >= 0 && trimmed.get(last) instanceof TextElement lastText) {
            String value = stripTrailing(lastText.getValue());
            if (value.isEmpty()) {
                trimmed.remove(last);
            } else {
                trimmed.set(last, new TextElement(value));
            }
        }
        return trimmed;
    }

    private static String stripTrailing(String value) {
        int end = value.length();
        while (end > 0) {
            char ch = value.charAt(end - 1);
            if (ch != ' ' && ch != '\n' && ch != '\r') {
                break;
            }
            end--;
        }
        return value.substring(0, end);
    }

    private TextElement getTextElement(FluentParserStream ps) {
        StringBuilder buffer = new StringBuilder();

        while (ps.currentChar() != EOF) {
            int ch = ps.currentChar();
            if (ch == '{' || ch == '}' || ch == EOL) {
                break;
            }
            buffer.append((char) ch);
            ps.next();
        }
        return new TextElement(buffer.toString());
    }

    // Placeables and expressions

    private Placeable getPlaceable(FluentParserStream ps) {
        ps.expectChar('{');
        ps.skipBlank();
        Expression expression = getExpression(ps);
        ps.expectChar('}');
        return new Placeable(expression);
    }

    private Expression getExpression(FluentParserStream ps) {
        Expression selector = getInlineExpression(ps);
        ps.skipBlank();

        if (ps.currentChar() == '-') {
            if (ps.peek() != '>') {
                ps.resetPeek();
                return selector;
            }

            validateSelector(selector);

            ps.next();
            ps.next();
            ps.skipBlankInline();
            ps.expectLineEnd();

            List<Variant> variants = getVariants(ps);
            return new SelectExpression(selector, variants);
        }

        if (selector instanceof TermReference term && term.getAttribute() != null) {
            throw new ParseError(FluentErrorCode.E0019);
        }
        return selector;
    }

    private void validateSelector(Expression selector) {
        if (selector instanceof MessageReference message) {
            throw new ParseError(message.getAttribute() == null ? FluentErrorCode.E0016 : FluentErrorCode.E0018);
        }
        if (selector instanceof TermReference term) {
            if (term.getAttribute() == null) {
                throw new ParseError(FluentErrorCode.E0017);
            }
            return;
        }
        if (!(selector instanceof StringLiteral
                || selector instanceof NumberLiteral
                || selector instanceof VariableReference
                || selector instanceof FunctionReference)) {
            throw new ParseError(FluentErrorCode.E0029);
        }
    }

    private Expression getInlineExpression(FluentParserStream ps) {
        if (ps.currentChar() == '{') {
            return getPlaceable(ps);
        }

        if (ps.isNumberStart()) {
            return getNumber(ps);
        }

        if (ps.currentChar() == '"') {
            return getString(ps);
        }

        if (ps.currentChar() == '$') {
            ps.next();
            return new VariableReference(getIdentifier(ps));
        }

        if (ps.currentChar() == '-') {
            ps.next();
            Identifier id = getIdentifier(ps);

            Identifier attribute = null;
            if (ps.currentChar() == '.') {
                ps.next();
                attribute = getIdentifier(ps);
            }

            CallArguments arguments = null;
            ps.peekBlank();
            if (ps.currentPeek() == '(') {
                ps.skipToPeek();
                arguments = getCallArguments(ps);
            }
            return new TermReference(id, attribute, arguments);
        }

        if (ps.isIdentifierStart()) {
            Identifier id = getIdentifier(ps);
            ps.peekBlank();

            if (ps.currentPeek() == '(') {
                // only upper-case identifiers name functions
                if (!FUNCTION_NAME.matcher(id.getName()).matches()) {
                    throw new ParseError(FluentErrorCode.E0008);
                }
                ps.skipToPeek();
                return new FunctionReference(id, getCallArguments(ps));
            }

            Identifier attribute = null;
            if (ps.currentChar() == '.') {
                ps.next();
                attribute = getIdentifier(ps);
            }
            return new MessageReference(id, attribute);
        }

        throw new ParseError(FluentErrorCode.E0028);
    }

    private Object getCallArgument(FluentParserStream ps) {
        Expression expression = getInlineExpression(ps);
        ps.skipBlank();

        if (ps.currentChar() != ':') {
            return expression;
        }

        if (expression instanceof MessageReference reference && reference.getAttribute() == null) {
            ps.next();
            ps.skipBlank();
            Expression value = getLiteral(ps);
            return new NamedArgument(reference.getId(), value);
        }

        throw new ParseError(FluentErrorCode.E0009);
    }

    private CallArguments getCallArguments(FluentParserStream ps) {
        List<Expression> positional = new ArrayList<>();
        List<NamedArgument> named = new ArrayList<>();
        Set<String> argumentNames = new HashSet<>();

        ps.expectChar('(');
        ps.skipBlank();

        while (true) {
            if (ps.currentChar() == ')') {
                break;
            }

            Object argument = getCallArgument(ps);
            if (argument instanceof NamedArgument namedArgument) {
                if (!argumentNames.add(namedArgument.getName().getName())) {
                    throw new ParseError(FluentErrorCode.E0022);
                }
                named.add(namedArgument);
            } else if (!argumentNames.isEmpty()) {
                throw new ParseError(FluentErrorCode.E0021);
            } else {
                positional.add((Expression) argument);
            }

            ps.skipBlank();

            if (ps.currentChar() == ',') {
                ps.next();
                ps.skipBlank();
                continue;
            }
            break;
        }

        ps.expectChar(')');
        return new CallArguments(positional, named);
    }

    // Literals

    private StringLiteral getString(FluentParserStream ps) {
        StringBuilder value = new StringBuilder();
        ps.expectChar('"');

        int ch;
        while ((ch = ps.takeChar(c -> c != '"' && c != EOL)) != EOF) {
            if (ch == '\\') {
                value.append(getEscapeSequence(ps));
            } else {
                value.append((char) ch);
            }
        }

        if (ps.currentChar() == EOL) {
            throw new ParseError(FluentErrorCode.E0020);
        }

        ps.expectChar('"');
        return new StringLiteral(value.toString());
    }

    private String getEscapeSequence(FluentParserStream ps) {
        int next = ps.currentChar();

        if (next == '\\' || next == '"') {
            ps.next();
            return "\\" + (char) next;
        }
        if (next == 'u') {
            return getUnicodeEscapeSequence(ps, 'u', 4);
        }
        if (next == 'U') {
            return getUnicodeEscapeSequence(ps, 'U', 6);
        }

        throw new ParseError(FluentErrorCode.E0025, next == EOF ? "" : String.valueOf((char) next));
    }

    private String getUnicodeEscapeSequence(FluentParserStream ps, char u, int digits) {
        ps.expectChar(u);
        StringBuilder sequence = new StringBuilder();

        for (int i = 0; i < digits; i++) {
            int ch = ps.takeHexDigit();
            if (ch == EOF) {
                int current = ps.currentChar();
                String tail = current == EOF ? "" : String.valueOf((char) current);
                throw new ParseError(FluentErrorCode.E0026, "\\" + u + sequence + tail);
            }
            sequence.append((char) ch);
        }
        return "\\" + u + sequence;
    }

    private Expression getLiteral(FluentParserStream ps) {
        if (ps.isNumberStart()) {
            return getNumber(ps);
        }
        if (ps.currentChar() == '"') {
            return getString(ps);
        }
        throw new ParseError(FluentErrorCode.E0014);
    }

    /**
     * Indentation run between pattern lines. Exists only until the pattern is dedented.
     */
    private static final class Indent implements PatternElement {
        private final String value;

        private Indent(String value) {
            this.value = value;
        }
    }
}
