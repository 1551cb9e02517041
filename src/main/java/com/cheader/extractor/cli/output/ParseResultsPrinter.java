package com.cheader.extractor.cli.output;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cheader.extractor.cli.model.ParseOptions;
import com.cheader.extractor.cli.model.ValidatedParseOptions;
import com.cheader.extractor.model.ClassDecl;
import com.cheader.extractor.model.Declaration;
import com.cheader.extractor.model.DeclarationKind;
import com.cheader.extractor.model.DeclarationVisitor;
import com.cheader.extractor.model.EnumDecl;
import com.cheader.extractor.model.FunctionDecl;
import com.cheader.extractor.model.MacroDecl;
import com.cheader.extractor.model.NamespaceDecl;
import com.cheader.extractor.model.StructDecl;
import com.cheader.extractor.model.TypedefInfo;
import com.cheader.extractor.parser.ParseResult;

/**
 * Responsible only for printing CLI output for the "parse" command.
 * No validation, no execution.
 */
public class ParseResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ParseResultsPrinter.class);

    public void printBanner(ParseOptions o, ValidatedParseOptions v) {
        log.info("=================================================");
        log.info("C/C++ Header Declaration Extractor");
        log.info("=================================================");
        log.info("Header: {}", v.getNormalizedHeader());
        log.info("Include Paths: {}", v.getIncludePaths().isEmpty() ? "None" : v.getIncludePaths());
        log.info("Defines: {}", o.getDefines().isEmpty() ? "None" : o.getDefines());
        log.info("clang: {}", o.getClangBinary());
        if (!o.getExtraArgs().isEmpty()) {
            log.info("Extra Arguments: {}", o.getExtraArgs());
        }
        log.info("Macros: {}", o.isIncludeMacros() ? "Yes" : "No");
        if (o.isIncludeMacros() && !o.getMacroPrefixes().isEmpty()) {
            log.info("  Macro Prefixes: {}", o.getMacroPrefixes());
        }
        log.info("Group Namespaces: {}", o.isGroupNamespaces());
        log.info("Output: {}", v.getNormalizedOutput() != null ? v.getNormalizedOutput() : "None");
        log.info("=================================================");
    }

    public void printSuccess(ParseResult result, List<Declaration> declarations) {
        log.info("");
        log.info("=================================================");
        log.info("EXTRACTION SUCCESSFUL");
        log.info("=================================================");
        log.info("AST Declarations: {}", result.getDeclarations().size());
        log.info("Macros: {}", result.getMacros().size());

        Map<DeclarationKind, Integer> counts = countByKind(declarations);
        log.info("");
        log.info("By Kind:");
        counts.forEach((kind, count) -> log.info("  {}: {}", kind, count));

        if (result.getDiagnostics().hasWarnings()) {
            log.info("");
            log.info("Warnings:");
            result.getDiagnostics().getWarnings().forEach(w -> log.warn("  {}", w));
        }

        log.info("");
        log.info("Declarations:");
        ListingVisitor listing = new ListingVisitor("  ");
        declarations.forEach(d -> d.accept(listing));
        log.info("=================================================");
    }

    public void printFailure(String message) {
        log.error("Extraction failed: {}", message);
    }

    private Map<DeclarationKind, Integer> countByKind(List<Declaration> declarations) {
        Map<DeclarationKind, Integer> counts = new EnumMap<>(DeclarationKind.class);
        for (Declaration declaration : declarations) {
            counts.merge(declaration.declarationKind(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * One log line per declaration, nested namespaces indented.
     */
    private static final class ListingVisitor implements DeclarationVisitor {
        private final String indent;

        ListingVisitor(String indent) {
            this.indent = indent;
        }

        @Override
        public void visit(FunctionDecl function) {
            String params = function.getParameters().stream()
                    .map(p -> p.getType() + " " + p.getName())
                    .collect(Collectors.joining(", "));
            log.info("{}function {} {}({})", indent, function.getReturnType(), function.getName(), params);
        }

        @Override
        public void visit(StructDecl struct) {
            log.info("{}{} {} ({} fields)", indent, struct.isUnion() ? "union" : "struct",
                    struct.isAnonymous() ? "<anonymous>" : struct.getName(), struct.getFields().size());
        }

        @Override
        public void visit(EnumDecl enumDecl) {
            log.info("{}enum {} ({} values)", indent,
                    enumDecl.getName().isEmpty() ? "<anonymous>" : enumDecl.getName(), enumDecl.getValues().size());
        }

        @Override
        public void visit(TypedefInfo typedef) {
            log.info("{}typedef {} = {}", indent, typedef.getName(), typedef.getUnderlyingType());
        }

        @Override
        public void visit(MacroDecl macro) {
            log.info("{}macro {} [{}] {}", indent, macro.getName(), macro.getKind().label(), macro.getRawValue());
        }

        @Override
        public void visit(NamespaceDecl namespace) {
            log.info("{}namespace {} ({} declarations)", indent, namespace.getName(),
                    namespace.getDeclarations().size());
            ListingVisitor nested = new ListingVisitor(indent + "  ");
            namespace.getDeclarations().forEach(d -> d.accept(nested));
        }

        @Override
        public void visit(ClassDecl classDecl) {
            log.info("{}class {}{} ({} methods, {} fields)", indent, classDecl.getName(),
                    classDecl.isAbstract() ? " [abstract]" : "", classDecl.getMethods().size(),
                    classDecl.getFields().size());
        }
    }
}
