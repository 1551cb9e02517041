package com.cheader.extractor.cli;

import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cheader.extractor.cli.exception.OptionsValidationException;
import com.cheader.extractor.cli.model.ParseOptions;
import com.cheader.extractor.cli.model.ValidatedParseOptions;
import com.cheader.extractor.cli.output.ParseResultsPrinter;
import com.cheader.extractor.cli.validation.ParseOptionsValidator;
import com.cheader.extractor.model.Declaration;
import com.cheader.extractor.output.DeclarationJsonWriter;
import com.cheader.extractor.parser.HeaderParser;
import com.cheader.extractor.parser.HeaderParserOptions;
import com.cheader.extractor.parser.ParseResult;
import com.cheader.extractor.parser.exception.HeaderParseException;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that extracts the declarations of a single C/C++ header.
 */
@Command(
        name = "parse",
        mixinStandardHelpOptions = true,
        version = "cheader-extractor 1.0.0",
        description = "Extracts structs, unions, enums, typedefs, functions, classes and macros "
                + "defined in a C/C++ header, using clang as the frontend."
)
public class ParseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);

    @Mixin
    private ParseOptions options = new ParseOptions();

    private final HeaderParser parser;
    private final ParseOptionsValidator validator = new ParseOptionsValidator();
    private final ParseResultsPrinter printer = new ParseResultsPrinter();
    private final DeclarationJsonWriter jsonWriter = new DeclarationJsonWriter();

    public ParseCommand() {
        this(new HeaderParser());
    }

    public ParseCommand(HeaderParser parser) {
        this.parser = parser;
    }

    @Override
    public Integer call() {
        try {
            if (options.isVerbose()) {
                enableDebugLogging();
            }

            ValidatedParseOptions validated = validator.validate(options);
            printer.printBanner(options, validated);

            HeaderParserOptions parserOptions = HeaderParserOptions.builder()
                    .headerFile(validated.getNormalizedHeader())
                    .includePaths(validated.getIncludePaths())
                    .defines(options.getDefines())
                    .verbose(options.isVerbose())
                    .includeMacros(options.isIncludeMacros())
                    .macroPrefixes(options.getMacroPrefixes())
                    .clangBinary(options.getClangBinary().trim())
                    .extraArgs(options.getExtraArgs())
                    .groupNamespaces(options.isGroupNamespaces())
                    .build();

            ParseResult result = parser.parseHeaderFull(parserOptions);
            List<Declaration> declarations = HeaderParser.requireDeclarations(result, parserOptions.getHeaderFile());

            printer.printSuccess(result, declarations);

            if (validated.getNormalizedOutput() != null) {
                jsonWriter.write(declarations, validated.getNormalizedOutput());
                log.info("Declarations written to {}", validated.getNormalizedOutput());
            }
            if (options.isJson()) {
                System.out.println(jsonWriter.toJson(declarations));
            }

            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (HeaderParseException e) {
            printer.printFailure(e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Extraction failed with exception", e);
            return 1;
        }
    }

    private static void enableDebugLogging() {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }
}
