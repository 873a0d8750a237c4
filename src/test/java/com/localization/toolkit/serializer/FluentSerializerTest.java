package com.localization.toolkit.serializer;

import com.localization.toolkit.model.*;
import com.localization.toolkit.parser.FluentParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FluentSerializerTest {

    private final FluentSerializer serializer = new FluentSerializer();

    @Test
    void testSimpleEntriesRoundTrip() {
        String source = """
            key = value
            -term = Term
                .attr = A
            login =
                .placeholder = Email
            """;

        assertThat(roundTrip(source)).isEqualTo(source);
    }

    @Test
    void testMultilineValueMovesToOwnLine() {
        String source = """
            key = line one
                line two
            """;

        assertThat(roundTrip(source)).isEqualTo("""
            key =
                line one
                line two
            """);
    }

    @Test
    void testBlankLinesInsidePatternStayBlank() {
        String source = "key =\n    a\n\n    b\n";

        assertThat(roundTrip(source)).isEqualTo(source);
    }

    @Test
    void testMultilineAttribute() {
        String source = """
            key =
                .attr =
                    line one
                    line two
            """;

        assertThat(roundTrip(source)).isEqualTo(source);
    }

    @Test
    void testSelectExpressionCanonicalLayout() {
        String source = """
            key = { $n ->
              [one] One
             *[other] Many
            }
            """;

        assertThat(roundTrip(source)).isEqualTo("""
            key =
                { $n ->
                    [one] One
                   *[other] Many
                }
            """);
    }

    @Test
    void testNestedSelectIsIndented() {
        String source = """
            key =
                { $a ->
                   *[x]
                        { $b ->
                           *[y] Y
                        }
                }
            """;

        assertThat(roundTrip(source)).isEqualTo(source);
    }

    @Test
    void testCallArgumentsAreNormalized() {
        assertThat(roundTrip("key = { NUMBER( $n , style:\"percent\") }\n"))
                .isEqualTo("key = { NUMBER($n, style: \"percent\") }\n");
        assertThat(roundTrip("key = { -term( case : \"gen\" ) }\n"))
                .isEqualTo("key = { -term(case: \"gen\") }\n");
    }

    @Test
    void testReservedFirstCharacterKeepsPatternInline() {
        Pattern pattern = new Pattern(List.of(new TextElement("[a]\nb")));

        assertThat(serializer.startsOnNewLine(pattern)).isFalse();
        assertThat(serializer.serializePattern(pattern)).isEqualTo(" [a]\n    b");
    }

    @Test
    void testCommentSpacing() {
        String source = """
            ### Resource

            ## Group

            # Attached
            key = value
            """;

        assertThat(roundTrip(source)).isEqualTo("""
            ### Resource


            ## Group

            # Attached
            key = value
            """);
    }

    @Test
    void testCommentWithEmptyLines() {
        FluentResource resource = new FluentResource(List.of(new Comment("one\n\ntwo")));

        assertThat(serializer.serialize(resource)).isEqualTo("# one\n#\n# two\n\n");
    }

    @Test
    void testJunkIsSkipped() {
        FluentResource resource = new FluentParser().parse("ok = fine\nbad line\nalso = fine\n");

        assertThat(resource.hasJunk()).isTrue();
        assertThat(serializer.serialize(resource)).isEqualTo("ok = fine\nalso = fine\n");
    }

    @Test
    void testSerializeEntryBuiltByHand() {
        Message message = Message.builder()
                .id(new Identifier("greeting"))
                .value(new Pattern(List.of(
                        new TextElement("Hello, "),
                        new Placeable(new VariableReference(new Identifier("name"))))))
                .attributes(List.of())
                .comment(new Comment("Greeting"))
                .build();

        assertThat(serializer.serializeEntry(message)).isEqualTo("# Greeting\ngreeting = Hello, { $name }\n");
    }

    @Test
    void testIndentExceptFirstLine() {
        assertThat(FluentSerializer.indentExceptFirstLine("a\n\nb")).isEqualTo("a\n\n    b");
        assertThat(FluentSerializer.indentExceptFirstLine("single")).isEqualTo("single");
    }

    private String roundTrip(String source) {
        return serializer.serialize(new FluentParser().parse(source));
    }
}
