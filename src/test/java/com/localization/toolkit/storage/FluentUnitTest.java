package com.localization.toolkit.storage;

import com.localization.toolkit.model.Comment;
import com.localization.toolkit.model.FluentEntry;
import com.localization.toolkit.model.GroupComment;
import com.localization.toolkit.model.Message;
import com.localization.toolkit.model.Term;
import com.localization.toolkit.storage.exception.FluentSourceSyntaxException;
import com.localization.toolkit.storage.exception.InvalidIdException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class FluentUnitTest {

    @Test
    void testTypeIsInferredFromId() {
        assertThat(FluentUnit.builder().id("message").source("a").build().getFluentType())
                .isEqualTo(FluentType.MESSAGE);
        assertThat(FluentUnit.builder().id("-term").source("a").build().getFluentType())
                .isEqualTo(FluentType.TERM);
        assertThat(FluentUnit.builder().source("a").build().getFluentType())
                .isEqualTo(FluentType.MESSAGE);
    }

    @Test
    void testSetIdKeepsOldIdOnFailure() {
        FluentUnit unit = new FluentUnit("ok", "-i9_8-h", null, FluentType.TERM);

        unit.setId("-i9_8-ha");
        assertThat(unit.getId()).isEqualTo("-i9_8-ha");

        assertThatThrownBy(() -> unit.setId("id.a"))
                .isInstanceOf(InvalidIdException.class)
                .hasMessageStartingWith("Invalid id ");
        assertThat(unit.getId()).isEqualTo("-i9_8-ha");
    }

    @Test
    void testInvalidIdInConstructor() {
        assertThatThrownBy(() -> new FluentUnit("test", "0id", null, FluentType.MESSAGE))
                .isInstanceOf(InvalidIdException.class)
                .hasMessage("Invalid id \"0id\" for Message: must match [a-zA-Z][a-zA-Z0-9_-]*");
    }

    @Test
    void testCommentUnits() {
        FluentUnit unit = FluentUnit.builder()
                .comment("Group")
                .fluentType(FluentType.GROUP_COMMENT)
                .build();

        assertThat(unit.getId()).isNull();
        assertThat(unit.isHeader()).isTrue();
        assertThat(unit.isTranslatable()).isFalse();
        assertThat(unit.getPlaceholders()).isEmpty();
        assertThat(unit.getReferences()).isEmpty();
        assertThat(unit.getValue()).isEmpty();
        assertThat(unit.toEntry()).isInstanceOf(GroupComment.class);

        assertThatThrownBy(() -> unit.setSource("text")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FluentUnit("text", null, "note", FluentType.RESOURCE_COMMENT))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FluentUnit(null, "id", "note", FluentType.DETACHED_COMMENT))
                .isInstanceOf(InvalidIdException.class);
    }

    @Test
    void testNotes() {
        FluentUnit unit = new FluentUnit("value", "key", null, null);
        assertThat(unit.getNotes()).isEmpty();

        unit.setNotes("Context");
        assertThat(unit.getNotes()).isEqualTo("Context");
        Message message = (Message) unit.toEntry();
        assertThat(message.getComment()).isEqualTo(new Comment("Context"));

        unit.removeNotes();
        assertThat(unit.getNotes()).isEmpty();
        assertThat(((Message) unit.toEntry()).getComment()).isNull();
    }

    @Test
    void testPlaceholdersAndReferences() {
        FluentUnit unit = new FluentUnit("{ $count } items in { -brand }\n.title = See { other.attr }",
                "items", null, null);

        assertThat(unit.getPlaceholders()).containsExactly("{ $count }", "{ -brand }");
        assertThat(unit.getReferences()).containsExactly("$count", "-brand", "other.attr");
    }

    @Test
    void testValueAndAttributes() {
        FluentUnit unit = new FluentUnit("Hello\n.title = Greeting\n.label =\nline one\nline two",
                "hello", null, null);

        assertThat(unit.getValue()).contains("Hello");
        assertThat(unit.getAttributes())
                .containsExactly(entry("title", "Greeting"), entry("label", "line one\nline two"));

        unit.setSource(".only = attribute");
        assertThat(unit.getValue()).isEmpty();
        assertThat(unit.getAttributes()).containsOnlyKeys("only");
    }

    @Test
    void testTermEntry() {
        FluentUnit unit = new FluentUnit("Firefox", "-brand", null, null);

        FluentEntry entry = unit.toEntry();
        assertThat(entry).isInstanceOf(Term.class);
        assertThat(((Term) entry).getFullId()).isEqualTo("-brand");
    }

    @Test
    void testInvalidSourceIsReportedWhenRendered() {
        FluentUnit unit = new FluentUnit("ok", "key", null, null);
        unit.setSource("broken }");

        assertThat(unit.getSource()).isEqualTo("broken }");
        assertThatThrownBy(unit::toEntry)
                .isInstanceOfSatisfying(FluentSourceSyntaxException.class, e -> {
                    assertThat(e.getUnitId()).isEqualTo("key");
                    assertThat(e.getCode()).isEqualTo("E0027");
                    assertThat(e.getLine()).isEqualTo(1);
                    assertThat(e.getColumn()).isEqualTo(8);
                });
        assertThatThrownBy(unit::getPlaceholders).isInstanceOf(FluentSourceSyntaxException.class);
    }

    @Test
    void testMissingIdIsReportedWhenRendered() {
        FluentUnit unit = FluentUnit.builder().source("text").build();

        assertThat(unit.getId()).isNull();
        assertThatThrownBy(unit::toEntry)
                .isInstanceOf(InvalidIdException.class)
                .hasMessage("Invalid id null for Message: an id is required");
    }

    @Test
    void testBlankUnitHasNoEntry() {
        FluentUnit unit = new FluentUnit("  \n", "key", null, null);

        assertThat(unit.isBlank()).isTrue();
        assertThat(unit.toEntry()).isNull();
        assertThat(unit.getPlaceholders()).isEmpty();
    }
}
