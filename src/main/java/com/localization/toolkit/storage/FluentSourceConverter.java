package com.localization.toolkit.storage;

import com.localization.toolkit.model.Annotation;
import com.localization.toolkit.model.Attribute;
import com.localization.toolkit.model.FluentDefinition;
import com.localization.toolkit.model.FluentEntry;
import com.localization.toolkit.model.FluentResource;
import com.localization.toolkit.model.Junk;
import com.localization.toolkit.model.Message;
import com.localization.toolkit.model.Pattern;
import com.localization.toolkit.model.PatternElement;
import com.localization.toolkit.model.Placeable;
import com.localization.toolkit.model.StringLiteral;
import com.localization.toolkit.model.Term;
import com.localization.toolkit.model.TextElement;
import com.localization.toolkit.parser.FluentErrorCode;
import com.localization.toolkit.parser.FluentParser;
import com.localization.toolkit.parser.SourcePosition;
import com.localization.toolkit.serializer.FluentSerializer;
import com.localization.toolkit.storage.exception.FluentSourceSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts between message/term entries and the flattened source text kept
 * on a {@link FluentUnit}.
 *
 * <p>The unit source is the value followed by one {@code .name = text} block
 * per attribute, all without the entry indentation:
 * <pre>
 * Value text
 * .title = Title text
 * .label =
 * { $count -&gt;
 *     [one] One item
 *    *[other] Many items
 * }
 * </pre>
 * Going back, the source is indented under a {@code id =} line and parsed as
 * a regular entry, so unit sources obey the full Fluent grammar.
 */
public class FluentSourceConverter {

    private static final String INDENT = "    ";
    private static final String RESERVED_LEADING_CHARS = ".*[";

    private final FluentSerializer serializer = new FluentSerializer();

    /**
     * Renders the value and attributes of an entry as unit source.
     */
    public String toSource(FluentDefinition definition) {
        List<String> parts = new ArrayList<>();

        if (definition.getValue() != null) {
            parts.add(patternText(definition.getValue()));
        }
        for (Attribute attribute : definition.getAttributes()) {
            parts.add(attributeText(attribute));
        }
        return String.join("\n", parts);
    }

    public String patternText(Pattern pattern) {
        return serializer.serializePatternContent(escapeLeadingCharacter(pattern));
    }

    private String attributeText(Attribute attribute) {
        Pattern value = escapeLeadingCharacter(attribute.getValue());
        String content = serializer.serializePatternContent(value);
        String prefix = "." + attribute.getId().getName() + " =";
        if (serializer.startsOnNewLine(value)) {
            return prefix + "\n" + content;
        }
        return prefix + " " + content;
    }

    /**
     * A line of unit source starting with {@code .}, {@code *} or {@code [}
     * would read as an attribute or variant, so a leading reserved character
     * is written as a string literal placeable.
     */
    Pattern escapeLeadingCharacter(Pattern pattern) {
        List<PatternElement> elements = pattern.getElements();
        if (elements.isEmpty() || !(elements.get(0) instanceof TextElement first)) {
            return pattern;
        }

        String text = first.getValue();
        if (text.isEmpty() || RESERVED_LEADING_CHARS.indexOf(text.charAt(0)) < 0) {
            return pattern;
        }

        List<PatternElement> escaped = new ArrayList<>();
        escaped.add(new Placeable(new StringLiteral(text.substring(0, 1))));
        if (text.length() > 1) {
            escaped.add(new TextElement(text.substring(1)));
        }
        escaped.addAll(elements.subList(1, elements.size()));
        return new Pattern(escaped);
    }

    /**
     * Parses unit source back into an entry of the given type.
     *
     * @throws FluentSourceSyntaxException when the source does not parse to
     *         exactly one entry of that type; the position points into the source
     */
    public FluentDefinition toEntry(FluentType fluentType, String id, String source) {
        StringBuilder fragment = new StringBuilder(id).append(" =");
        for (String line : source.split("\n", -1)) {
            fragment.append('\n').append(INDENT).append(line);
        }

        String text = fragment.toString();
        FluentResource resource = new FluentParser().parse(text);

        for (FluentEntry entry : resource.getBody()) {
            if (entry instanceof Junk junk && !junk.getAnnotations().isEmpty()) {
                Annotation annotation = junk.getAnnotations().get(0);
                SourcePosition position = toUnitPosition(
                        SourcePosition.of(text, annotation.getSpan().getStart()));
                throw new FluentSourceSyntaxException(id, annotation.getCode(), annotation.getMessage(),
                        position.getLine(), position.getColumn());
            }
        }

        List<FluentEntry> body = resource.getBody();
        if (body.size() != 1 || !matchesType(body.get(0), fluentType)) {
            throw new FluentSourceSyntaxException(id, FluentErrorCode.E0001.name(),
                    "Expected a single " + fluentType.getDisplayName(), 1, 1);
        }
        return (FluentDefinition) body.get(0);
    }

    private static boolean matchesType(FluentEntry entry, FluentType fluentType) {
        switch (fluentType) {
            case MESSAGE:
                return entry instanceof Message;
            case TERM:
                return entry instanceof Term;
            default:
                return false;
        }
    }

    /**
     * Maps a position in the indented fragment back to the unit source.
     * The synthetic {@code id =} line maps to the start of the source.
     */
    private static SourcePosition toUnitPosition(SourcePosition fragmentPosition) {
        if (fragmentPosition.getLine() == 1) {
            return new SourcePosition(1, 1);
        }
        return new SourcePosition(fragmentPosition.getLine() - 1,
                Math.max(1, fragmentPosition.getColumn() - INDENT.length()));
    }
}
