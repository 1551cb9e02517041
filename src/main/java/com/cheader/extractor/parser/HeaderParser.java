package com.cheader.extractor.parser;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cheader.extractor.model.Declaration;
import com.cheader.extractor.model.MacroDecl;
import com.cheader.extractor.parser.ast.AstNode;
import com.cheader.extractor.parser.ast.AstTreeDecoder;
import com.cheader.extractor.parser.clang.ClangInvoker;
import com.cheader.extractor.parser.clang.ClangMode;
import com.cheader.extractor.parser.clang.FrontendRunner;
import com.cheader.extractor.parser.exception.EmptyResultException;
import com.cheader.extractor.parser.exception.HeaderParseException;
import com.cheader.extractor.parser.extract.DeclarationExtractor;
import com.cheader.extractor.parser.extract.DeclarationFactory;
import com.cheader.extractor.parser.macro.MacroClassifier;
import com.cheader.extractor.parser.macro.MacroFilter;
import com.cheader.extractor.parser.provenance.ProvenanceTracker;
import com.cheader.extractor.parser.provenance.TargetFileMatcher;

/**
 * Extracts declarations from a C/C++ header with two frontend passes:
 *
 * 1. AST dump, for structs, unions, enums, typedefs, functions and classes.
 *    Failure here is fatal.
 * 2. Macro dump, for {@code #define}s. Failure here is downgraded to a
 *    diagnostic and the run continues without macros.
 *
 * Parsing only: no type mapping and no code generation.
 */
public class HeaderParser {
    private static final Logger log = LoggerFactory.getLogger(HeaderParser.class);

    private final FrontendRunner frontend;
    private final AstTreeDecoder decoder = new AstTreeDecoder();
    private final DeclarationFactory factory = new DeclarationFactory();
    private final MacroClassifier classifier = new MacroClassifier();

    public HeaderParser() {
        this(new ClangInvoker());
    }

    public HeaderParser(FrontendRunner frontend) {
        this.frontend = frontend;
    }

    /**
     * Runs both passes and returns their results separately.
     *
     * @throws HeaderParseException if the header is missing, or the AST pass fails
     */
    public ParseResult parseHeaderFull(HeaderParserOptions options) {
        Path header = options.getHeaderFile();
        if (!Files.isRegularFile(header)) {
            throw new HeaderParseException("Header file not found: " + header);
        }

        log.debug("Parsing header: {}", header);

        List<Declaration> declarations = runAstPass(options);

        ParseDiagnostics diagnostics = new ParseDiagnostics();
        List<MacroDecl> macros = options.isIncludeMacros()
                ? runMacroPass(options, diagnostics)
                : List.of();

        return ParseResult.builder()
                .declarations(declarations)
                .macros(macros)
                .diagnostics(diagnostics)
                .build();
    }

    /**
     * Runs both passes and merges them: AST declarations first, then macros.
     *
     * @throws EmptyResultException if nothing at all was found
     */
    public List<Declaration> parseHeader(HeaderParserOptions options) {
        return requireDeclarations(parseHeaderFull(options), options.getHeaderFile());
    }

    public List<Declaration> parse(Path headerFile, List<String> includePaths, boolean verbose) {
        return parseWithDefines(headerFile, includePaths, List.of(), verbose);
    }

    /**
     * Convenience for platform headers (CMSIS and the like) that need defines to select a device.
     */
    public List<Declaration> parseWithDefines(Path headerFile, List<String> includePaths, List<String> defines,
            boolean verbose) {
        HeaderParserOptions options = HeaderParserOptions.builder()
                .headerFile(headerFile)
                .includePaths(includePaths)
                .defines(defines)
                .verbose(verbose)
                .build();
        return parseHeader(options);
    }

    /**
     * The merged declaration list of a finished run.
     *
     * @throws EmptyResultException if the run produced nothing
     */
    public static List<Declaration> requireDeclarations(ParseResult result, Path headerFile) {
        List<Declaration> all = result.getAllDeclarations();
        if (all.isEmpty()) {
            Path name = headerFile.getFileName();
            throw new EmptyResultException(name != null ? name.toString() : headerFile.toString());
        }
        return all;
    }

    private List<Declaration> runAstPass(HeaderParserOptions options) {
        String json = frontend.run(options, ClangMode.AST_DUMP);

        log.debug("Parsing JSON AST ({} bytes)...", json.length());
        AstNode root = decoder.decode(json);

        ProvenanceTracker tracker = new ProvenanceTracker(new TargetFileMatcher(options.getHeaderFile()));
        DeclarationExtractor extractor = new DeclarationExtractor(tracker, factory, options.isGroupNamespaces());
        List<Declaration> declarations = extractor.extract(root);

        log.debug("Extracted {} AST declarations", declarations.size());
        return declarations;
    }

    private List<MacroDecl> runMacroPass(HeaderParserOptions options, ParseDiagnostics diagnostics) {
        String dump;
        try {
            dump = frontend.run(options, ClangMode.MACRO_DUMP);
        } catch (HeaderParseException e) {
            diagnostics.getWarnings().add("Macro extraction failed: " + e.getMessage());
            if (options.isVerbose()) {
                log.warn("Failed to extract macros: {}", e.getMessage());
            } else {
                log.debug("Failed to extract macros", e);
            }
            return List.of();
        }

        MacroFilter filter = new MacroFilter(options.getMacroPrefixes());
        List<MacroDecl> macros = classifier.classifyAll(dump).stream()
                .filter(m -> filter.accepts(m.getName()))
                .collect(Collectors.toList());

        diagnostics.getInfos().add("Extracted " + macros.size() + " macros");
        log.debug("Extracted {} macros", macros.size());
        return macros;
    }
}
