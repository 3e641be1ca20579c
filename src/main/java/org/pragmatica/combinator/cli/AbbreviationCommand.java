package org.pragmatica.combinator.cli;

import org.pragmatica.combinator.abbreviation.AbbreviationParser;
import org.pragmatica.combinator.abbreviation.CapacityExceededException;
import org.pragmatica.combinator.abbreviation.MarkupSerializer;
import org.pragmatica.combinator.abbreviation.SerializerConfig;
import org.pragmatica.combinator.error.Diagnostic;
import org.pragmatica.combinator.parser.ParseResult;
import org.pragmatica.combinator.parser.ParserConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(
    name = "abbrev",
    description = "Expands a node abbreviation such as 'ul>li*2' into a markup fragment",
    version = "0.1.0",
    mixinStandardHelpOptions = true)
public final class AbbreviationCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbbreviationCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(
        index = "0",
        arity = "1",
        paramLabel = "ABBREVIATION",
        description = "Abbreviation to expand, e.g. div.root*3")
    private String abbreviation;

    @CommandLine.Option(
        names = {"-c", "--content"},
        defaultValue = "",
        description = "Text placed inside elements without children (default: empty)")
    private String content;

    @CommandLine.Option(
        names = "--max-length",
        defaultValue = "" + SerializerConfig.DEFAULT_MAX_LENGTH,
        description = "Largest output accepted, in characters (default: ${DEFAULT-VALUE})")
    private int maxLength;

    @CommandLine.Option(
        names = "--max-repetitions",
        defaultValue = "" + ParserConfig.DEFAULT_MAX_REPETITIONS,
        description = "Largest number of repeated items a single rule may collect")
    private int maxRepetitions;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AbbreviationCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (abbreviation.isEmpty()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "ABBREVIATION must not be empty");
        }
        if (maxLength < 0 || maxLength > SerializerConfig.MAX_LENGTH_LIMIT) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                                                     "--max-length must be between 0 and "
                                                     + SerializerConfig.MAX_LENGTH_LIMIT);
        }
        if (maxRepetitions < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--max-repetitions must be >= 1");
        }

        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        var parser = AbbreviationParser.builder()
                                       .maxRepetitions(maxRepetitions)
                                       .build();
        var serializer = MarkupSerializer.create(new SerializerConfig(content, maxLength));

        var result = parser.parse(abbreviation);
        if (result instanceof ParseResult.Failure<?> failure) {
            err.print(Diagnostic.of(failure.error()).format(abbreviation, null));
            err.flush();
            return EXIT_FAILURE;
        }

        try {
            var markup = serializer.serialize(result.unwrap());
            out.println(abbreviation);
            out.println(markup);
            out.flush();
            return EXIT_OK;
        } catch (CapacityExceededException e) {
            LOGGER.debug("Serialization of |{}| aborted", abbreviation, e);
            err.println("error: " + e.getMessage());
            err.flush();
            return EXIT_FAILURE;
        }
    }
}
