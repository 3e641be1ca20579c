package org.pragmatica.combinator.abbreviation;

import org.junit.jupiter.api.Test;
import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.parser.ParseResult;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class AbbreviationParserTest {

    private final AbbreviationParser parser = AbbreviationParser.create();

    private static ParseError errorOf(ParseResult<?> result) {
        assertThat(result.isFailure()).isTrue();
        return ((ParseResult.Failure<?>) result).error();
    }

    // === Round Trips ===

    @Test
    void repeatedNodeWithClass_expandsWithContent() {
        var tree = parser.parse("div.root*3").unwrap();

        assertThat(tree).isEqualTo(AbbreviationNode.of("div").withClassName("root").withRepeatCount(3));

        var serializer = MarkupSerializer.create(SerializerConfig.DEFAULT.withContent("it"));
        assertThat(serializer.serialize(tree))
            .isEqualTo("<div class=\"root\">it</div>"
                       + "<div class=\"root\">it</div>"
                       + "<div class=\"root\">it</div>");
    }

    @Test
    void childWithCount_expandsInsideParent() {
        var tree = parser.parse("ul>li*2").unwrap();

        assertThat(tree.label()).isEqualTo("ul");
        assertThat(tree.children()).containsExactly(AbbreviationNode.of("li").withRepeatCount(2));
        assertThat(MarkupSerializer.create().serialize(tree)).isEqualTo("<ul><li></li><li></li></ul>");
    }

    @Test
    void emptyInput_failsWithEndOfInputAtStart() {
        var error = errorOf(parser.parse(""));

        assertThat(error).isInstanceOf(ParseError.EndOfInput.class);
        assertThat(error.location().offset()).isZero();
    }

    @Test
    void leadingDigits_failAsNodeButParseAsNumber() {
        var grammar = parser.grammar();

        assertThat(errorOf(parser.parse("123abc")).location().offset()).isZero();
        assertThat(grammar.node().parse("123abc").isFailure()).isTrue();
        assertThat(grammar.number().parse("123abc")).isEqualTo(ParseResult.success(123, 3));
    }

    @Test
    void zeroCount_expandsToNothing() {
        var tree = parser.parse("div*0").unwrap();

        assertThat(tree.isSuppressed()).isTrue();
        assertThat(MarkupSerializer.create().serialize(tree)).isEmpty();
    }

    // === Structure ===

    @Test
    void nestedSeparators_produceFlatSiblings() {
        var tree = parser.parse("ul>li>a").unwrap();

        assertThat(tree.children()).extracting(AbbreviationNode::label).containsExactly("li", "a");
        assertThat(tree.children()).allSatisfy(child -> assertThat(child.children()).isEmpty());
    }

    @Test
    void idAndClasses_areCollected() {
        var tree = parser.parse("section#main.wide.dark").unwrap();

        assertThat(tree.id()).isEqualTo(Optional.of("main"));
        assertThat(tree.className()).isEqualTo("wide dark");
    }

    @Test
    void trailingGarbage_isReportedAsExpectedEndOfInput() {
        var error = errorOf(parser.parse("ul>li!"));

        assertThat(error.root()).isInstanceOf(ParseError.Unsatisfied.class);
        assertThat(error.location().offset()).isEqualTo(5);
        assertThat(error.expected()).isEqualTo("end of input");
    }

    @Test
    void countWithoutNumber_reportsMissingDigit() {
        var error = errorOf(parser.parse("div*x"));

        assertThat(error.root()).isInstanceOf(ParseError.Unsatisfied.class);
        assertThat(error.location().offset()).isEqualTo(4);
        assertThat(error.expected()).isEqualTo("digit");
    }

    @Test
    void classMarkerWithoutName_reportsOffendingSymbol() {
        var error = errorOf(parser.parse("div.1"));

        assertThat(error.root()).isInstanceOfSatisfying(ParseError.Unsatisfied.class,
                                                        unsatisfied -> assertThat(unsatisfied.found()).isEqualTo("1"));
        assertThat(error.location().offset()).isEqualTo(4);
        assertThat(error.expected()).isEqualTo("letter");
    }

    @Test
    void idMarkerAtEnd_reportsMissingLabel() {
        var error = errorOf(parser.parse("div#"));

        assertThat(error.root()).isInstanceOf(ParseError.EndOfInput.class);
        assertThat(error.location().offset()).isEqualTo(4);
        assertThat(error.expected()).isEqualTo("letter");
    }

    @Test
    void oversizedCount_reportsNumericOverflow() {
        var error = errorOf(parser.parse("div*99999999999"));

        assertThat(error.root()).isInstanceOfSatisfying(ParseError.NumericOverflow.class,
                                                        overflow -> assertThat(overflow.digits())
                                                            .isEqualTo("99999999999"));
        assertThat(error.location().offset()).isEqualTo(4);
        assertThat(parser.grammar().count().parse("*99999999999").isFailure()).isTrue();
    }

    @Test
    void failureInLaterChild_isReportedThere() {
        var error = errorOf(parser.parse("ul>li.a>a#"));

        assertThat(error.location().offset()).isEqualTo(10);
        assertThat(error.expected()).isEqualTo("letter");
    }

    @Test
    void longAbbreviation_parsesInLinearTime() {
        var text = "a" + ">a".repeat(200_000);

        var tree = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> parser.parse(text).unwrap());

        assertThat(tree.children()).hasSize(200_000);
    }

    // === Entry Points ===

    @Test
    void bytes_parseLikeText() {
        var fromBytes = parser.parse("ul>li*2".getBytes(StandardCharsets.US_ASCII));

        assertThat(fromBytes).isEqualTo(parser.parse("ul>li*2"));
    }

    @Test
    void expand_parsesAndSerializes() {
        var result = parser.expand("p.note", MarkupSerializer.create());

        assertThat(result).isEqualTo(ParseResult.success("<p class=\"note\"></p>", 6));
    }

    @Test
    void expand_failure_passesErrorThrough() {
        var result = parser.expand("", MarkupSerializer.create());

        assertThat(errorOf(result)).isInstanceOf(ParseError.EndOfInput.class);
    }

    @Test
    void builder_appliesRepetitionLimit() {
        var limited = AbbreviationParser.builder()
                                        .maxRepetitions(2)
                                        .build();

        assertThat(limited.parse("ul>li>li").isSuccess()).isTrue();

        var error = errorOf(limited.parse("ul>li>li>li"));
        assertThat(error.root()).isInstanceOf(ParseError.AllocationFailure.class);
    }

    @Test
    void builder_limitAlsoBoundsLabels() {
        var limited = AbbreviationParser.builder()
                                        .maxRepetitions(2)
                                        .build();

        assertThat(errorOf(limited.parse("div")).root()).isInstanceOf(ParseError.AllocationFailure.class);
        assertThat(limited.parse("ul").unwrap().children()).isEqualTo(List.of());
    }
}
