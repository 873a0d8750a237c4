package com.localization.toolkit.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class FluentParserStreamTest {

    @Test
    void testCrlfIsSingleLineEnd() {
        FluentParserStream ps = new FluentParserStream("a\r\nb");

        assertThat(ps.currentChar()).isEqualTo('a');
        assertThat(ps.next()).isEqualTo(FluentParserStream.EOL);
        assertThat(ps.next()).isEqualTo('b');
        assertThat(ps.getIndex()).isEqualTo(3);
        assertThat(ps.next()).isEqualTo(FluentParserStream.EOF);
        assertThat(ps.next()).isEqualTo(FluentParserStream.EOF);
    }

    @Test
    void testPeekBlankBlockStopsAtContentLine() {
        FluentParserStream ps = new FluentParserStream("  \n\n  text");

        assertThat(ps.peekBlankBlock()).isEqualTo("\n\n");
        assertThat(ps.getPeekOffset()).isEqualTo(4);
        assertThat(ps.getIndex()).isZero();

        assertThat(ps.skipBlankBlock()).isEqualTo("\n\n");
        assertThat(ps.getIndex()).isEqualTo(4);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "'  next'   | true",
            "'next'     | false",
            "'  .attr'  | false",
            "'  [key]'  | false",
            "'  *[key]' | false",
            "'  }'      | false",
            "'{ $x }'   | true",
    })
    void testIsValueContinuation(String line, boolean expected) {
        FluentParserStream ps = new FluentParserStream(line);

        assertThat(ps.isValueContinuation()).isEqualTo(expected);
        if (expected) {
            assertThat(ps.getPeekOffset()).isZero();
        }
    }

    @Test
    void testVariantAndNumberStarts() {
        assertThat(new FluentParserStream("*[one]").isVariantStart()).isTrue();
        assertThat(new FluentParserStream("[one]").isVariantStart()).isTrue();
        assertThat(new FluentParserStream("[[one]").isVariantStart()).isFalse();

        assertThat(new FluentParserStream("-5").isNumberStart()).isTrue();
        assertThat(new FluentParserStream("-a").isNumberStart()).isFalse();
    }

    @Test
    void testNextLineCommentLevel() {
        FluentParserStream ps = new FluentParserStream("\n## group");

        assertThat(ps.isNextLineComment(1)).isTrue();
        assertThat(ps.isNextLineComment(0)).isFalse();
        assertThat(ps.getPeekOffset()).isZero();
    }

    @Test
    void testExpectCharReportsExpectedToken() {
        FluentParserStream ps = new FluentParserStream("x");

        assertThatThrownBy(() -> ps.expectChar('='))
                .isInstanceOf(ParseError.class)
                .hasMessage("Expected token: \"=\"");
    }

    @Test
    void testSourcePositionCountsCodePoints() {
        String source = "ab\n🍄x";

        assertThat(SourcePosition.of(source, 0)).isEqualTo(new SourcePosition(1, 1));
        assertThat(SourcePosition.of(source, 3)).isEqualTo(new SourcePosition(2, 1));
        assertThat(SourcePosition.of(source, 5)).isEqualTo(new SourcePosition(2, 2));
        assertThat(SourcePosition.of(source, 5)).hasToString("line 2, column 2");
    }
}
