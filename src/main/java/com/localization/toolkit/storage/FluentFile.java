package com.localization.toolkit.storage;

import com.localization.toolkit.model.Annotation;
import com.localization.toolkit.model.BaseComment;
import com.localization.toolkit.model.FluentDefinition;
import com.localization.toolkit.model.FluentEntry;
import com.localization.toolkit.model.FluentResource;
import com.localization.toolkit.model.GroupComment;
import com.localization.toolkit.model.Junk;
import com.localization.toolkit.model.ResourceComment;
import com.localization.toolkit.parser.FluentParser;
import com.localization.toolkit.parser.SourcePosition;
import com.localization.toolkit.serializer.FluentSerializer;
import com.localization.toolkit.storage.exception.FluentParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * A Fluent ({@code .ftl}) file as a list of {@link FluentUnit}s.
 *
 * <p>Parsing fails as a whole if any part of the file is not valid Fluent.
 * Serializing renders every unit first and only then produces output, so a
 * unit with invalid source leaves nothing half written.
 */
public class FluentFile extends TranslationStore<FluentUnit> {
    private static final Logger log = LoggerFactory.getLogger(FluentFile.class);

    private static final int SNIPPET_LENGTH = 80;

    public FluentFile() {
    }

    public static FluentFile fromBytes(byte[] content) {
        FluentFile file = new FluentFile();
        file.parse(content);
        return file;
    }

    public static FluentFile fromString(String content) {
        return fromBytes(content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws FluentParseException if the content has any syntax error
     */
    @Override
    public void parse(byte[] content) {
        String text = new String(content, StandardCharsets.UTF_8);
        FluentResource resource = new FluentParser().parse(text);

        if (resource.hasJunk()) {
            throw new FluentParseException(describeJunk(text, resource.getJunk()), resource.getJunk());
        }

        FluentSourceConverter converter = new FluentSourceConverter();
        List<FluentUnit> parsed = new ArrayList<>();
        for (FluentEntry entry : resource.getBody()) {
            parsed.add(toUnit(entry, converter));
        }

        units.clear();
        units.addAll(parsed);
        log.debug("Parsed {} units from {}", units.size(), getFileName() != null ? getFileName() : "<bytes>");
    }

    private FluentUnit toUnit(FluentEntry entry, FluentSourceConverter converter) {
        if (entry instanceof FluentDefinition definition) {
            return FluentUnit.builder()
                    .id(definition.getFullId())
                    .source(converter.toSource(definition))
                    .comment(definition.getComment() != null ? definition.getComment().getContent() : null)
                    .fluentType(FluentType.fromId(definition.getFullId()))
                    .build();
        }

        FluentType type;
        if (entry instanceof ResourceComment) {
            type = FluentType.RESOURCE_COMMENT;
        } else if (entry instanceof GroupComment) {
            type = FluentType.GROUP_COMMENT;
        } else {
            type = FluentType.DETACHED_COMMENT;
        }
        return FluentUnit.builder()
                .comment(((BaseComment) entry).getContent())
                .fluentType(type)
                .build();
    }

    /**
     * @throws com.localization.toolkit.storage.exception.FluentSourceSyntaxException
     *         if a unit source is not valid Fluent
     * @throws com.localization.toolkit.storage.exception.InvalidIdException
     *         if a message or term with source has no valid id
     */
    @Override
    public byte[] serialize() {
        List<FluentEntry> entries = new ArrayList<>();
        for (FluentUnit unit : units) {
            FluentEntry entry = unit.toEntry();
            if (entry != null) {
                entries.add(entry);
            }
        }

        String text = new FluentSerializer().serialize(new FluentResource(entries));
        log.debug("Serialized {} of {} units", entries.size(), units.size());
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static String describeJunk(String text, List<Junk> junk) {
        StringBuilder message = new StringBuilder("Parsing error for fluent source: ")
                .append(snippet(junk.get(0).getContent()));

        for (Junk entry : junk) {
            for (Annotation annotation : entry.getAnnotations()) {
                SourcePosition position = SourcePosition.of(text, annotation.getSpan().getStart());
                message.append('\n')
                        .append(annotation.getCode()).append(": ").append(annotation.getMessage())
                        .append(" [").append(position).append(']');
            }
        }
        return message.toString();
    }

    private static String snippet(String content) {
        String trimmed = content.strip().replace("\r\n", "\n").replace("\n", "\\n");
        if (trimmed.codePointCount(0, trimmed.length()) <= SNIPPET_LENGTH) {
            return trimmed;
        }
        return trimmed.substring(0, trimmed.offsetByCodePoints(0, SNIPPET_LENGTH)) + "…";
    }
}
