package com.localization.toolkit.storage;

import com.localization.toolkit.model.Attribute;
import com.localization.toolkit.model.Comment;
import com.localization.toolkit.model.FluentDefinition;
import com.localization.toolkit.model.FluentEntry;
import com.localization.toolkit.model.GroupComment;
import com.localization.toolkit.model.ResourceComment;
import com.localization.toolkit.storage.exception.FluentSourceSyntaxException;
import lombok.Builder;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One entry of a Fluent file.
 *
 * <p>Messages and terms keep their value and attributes as flattened source
 * text (see {@link FluentSourceConverter}). The source is only parsed when
 * the unit is rendered or inspected, so an invalid source can be stored and
 * is reported by {@link FluentSourceSyntaxException} at that point.
 *
 * <p>Resource, group and detached comments become header units with no id
 * and no source; their text is the unit notes.
 */
@ToString
public class FluentUnit extends TranslationUnit {

    private final FluentType fluentType;
    private String id;
    private String source;
    private String comment;

    /**
     * @param fluentType the unit type; inferred from the id when null
     */
    @Builder
    public FluentUnit(String source, String id, String comment, FluentType fluentType) {
        this.fluentType = fluentType != null ? fluentType : FluentType.fromId(id);
        if (id != null) {
            FluentIdValidator.validate(this.fluentType, id);
        }
        if (source != null && this.fluentType.isComment()) {
            throw new IllegalArgumentException(this.fluentType.getDisplayName() + " units have no source");
        }
        this.id = id;
        this.source = source;
        this.comment = comment;
    }

    public FluentType getFluentType() {
        return fluentType;
    }

    @Override
    public String getId() {
        return id;
    }

    /**
     * @throws com.localization.toolkit.storage.exception.InvalidIdException
     *         if the id does not fit the unit type; the unit keeps its old id
     */
    @Override
    public void setId(String id) {
        FluentIdValidator.validate(fluentType, id);
        this.id = id;
    }

    @Override
    public String getSource() {
        return source;
    }

    @Override
    public void setSource(String source) {
        if (source != null && fluentType.isComment()) {
            throw new IllegalArgumentException(fluentType.getDisplayName() + " units have no source");
        }
        this.source = source;
    }

    @Override
    public String getNotes() {
        return comment == null ? "" : comment;
    }

    public void setNotes(String comment) {
        this.comment = comment;
    }

    public void removeNotes() {
        this.comment = null;
    }

    @Override
    public boolean isHeader() {
        return fluentType.isComment();
    }

    /**
     * References used by the value, written as they appear in text, e.g. {@code { $count }}.
     */
    @Override
    public Set<String> getPlaceholders() {
        if (isHeader() || isBlank()) {
            return Collections.emptySet();
        }
        FluentDefinition definition = parseSource();
        Set<String> placeholders = new LinkedHashSet<>();
        for (String reference : new FluentReferenceCollector().collectValue(definition)) {
            placeholders.add("{ " + reference + " }");
        }
        return placeholders;
    }

    /**
     * Ids referenced anywhere in the unit: {@code message}, {@code message.attr},
     * {@code -term} and, for messages, {@code $variable}.
     */
    public Set<String> getReferences() {
        if (isHeader() || isBlank()) {
            return Collections.emptySet();
        }
        return new FluentReferenceCollector().collect(parseSource());
    }

    public Optional<String> getValue() {
        if (isHeader() || isBlank()) {
            return Optional.empty();
        }
        FluentDefinition definition = parseSource();
        if (definition.getValue() == null) {
            return Optional.empty();
        }
        return Optional.of(new FluentSourceConverter().patternText(definition.getValue()));
    }

    /**
     * Attribute texts by attribute name, in source order.
     */
    public Map<String, String> getAttributes() {
        Map<String, String> attributes = new LinkedHashMap<>();
        if (isHeader() || isBlank()) {
            return attributes;
        }
        FluentSourceConverter converter = new FluentSourceConverter();
        for (Attribute attribute : parseSource().getAttributes()) {
            attributes.put(attribute.getId().getName(), converter.patternText(attribute.getValue()));
        }
        return attributes;
    }

    /**
     * Builds the AST entry for this unit, or returns null for a message or
     * term without source, which is left out of the file.
     *
     * @throws FluentSourceSyntaxException if the source is not valid Fluent
     */
    public FluentEntry toEntry() {
        switch (fluentType) {
            case RESOURCE_COMMENT:
                return new ResourceComment(getNotes());
            case GROUP_COMMENT:
                return new GroupComment(getNotes());
            case DETACHED_COMMENT:
                return new Comment(getNotes());
            default:
                break;
        }

        if (isBlank()) {
            return null;
        }
        FluentDefinition definition = parseSource();
        if (comment != null && !comment.isEmpty()) {
            definition.setComment(new Comment(comment));
        }
        return definition;
    }

    private FluentDefinition parseSource() {
        FluentIdValidator.validate(fluentType, id);
        return new FluentSourceConverter().toEntry(fluentType, id, source);
    }
}
