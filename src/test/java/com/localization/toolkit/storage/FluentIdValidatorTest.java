package com.localization.toolkit.storage;

import com.localization.toolkit.storage.exception.InvalidIdException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class FluentIdValidatorTest {

    @ParameterizedTest
    @CsvSource({
            "MESSAGE, i0,       true",
            "MESSAGE, my-id_2,  true",
            "TERM,    -id,      true",
            "TERM,    -i9_8-h,  true",
            "TERM,    id,       false",
            "TERM,    id.a,     false",
            "TERM,    -id.a,    false",
            "TERM,    --id,     false",
            "MESSAGE, -id,      false",
            "MESSAGE, id.a,     false",
            "MESSAGE, a@,       false",
            "MESSAGE, 0id,      false",
            "MESSAGE, _id,      false",
    })
    void testIdSyntax(FluentType type, String id, boolean valid) {
        assertThat(FluentIdValidator.isValid(type, id)).isEqualTo(valid);
    }

    @Test
    void testCommentsHaveNoId() {
        assertThat(FluentIdValidator.isValid(FluentType.GROUP_COMMENT, null)).isTrue();
        assertThatThrownBy(() -> FluentIdValidator.validate(FluentType.RESOURCE_COMMENT, "id"))
                .isInstanceOf(InvalidIdException.class)
                .hasMessage("Invalid id \"id\" for ResourceComment: comments cannot have an id");
    }

    @Test
    void testMessagesAndTermsNeedAnId() {
        assertThat(FluentIdValidator.isValid(FluentType.MESSAGE, null)).isFalse();
        assertThatThrownBy(() -> FluentIdValidator.validate(FluentType.TERM, null))
                .isInstanceOfSatisfying(InvalidIdException.class, e -> {
                    assertThat(e.getFluentType()).isEqualTo(FluentType.TERM);
                    assertThat(e.getId()).isNull();
                });
    }

    @Test
    void testFluentTypeFromId() {
        assertThat(FluentType.fromId("-brand")).isEqualTo(FluentType.TERM);
        assertThat(FluentType.fromId("brand")).isEqualTo(FluentType.MESSAGE);
        assertThat(FluentType.fromId(null)).isEqualTo(FluentType.MESSAGE);
        assertThat(FluentType.DETACHED_COMMENT).hasToString("DetachedComment");
        assertThat(FluentType.DETACHED_COMMENT.isComment()).isTrue();
        assertThat(FluentType.TERM.isComment()).isFalse();
    }
}
