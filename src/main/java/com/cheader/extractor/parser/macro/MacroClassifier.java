package com.cheader.extractor.parser.macro;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cheader.extractor.model.MacroDecl;
import com.cheader.extractor.model.MacroKind;

/**
 * Classifier for the output of {@code clang -E -dM}.
 *
 * Format, one definition per line:
 * - Function-like: #define MAX(a, b) ((a) > (b) ? (a) : (b))
 * - Pointer cast:  #define GPIOA ((GPIO_TypeDef *) GPIOA_BASE)
 * - Expression:    #define FLAG_MASK (1 << 2)
 * - Value:         #define VERSION 42
 * - Empty:         #define HAVE_FEATURE
 */
public class MacroClassifier {
    private static final Logger log = LoggerFactory.getLogger(MacroClassifier.class);

    private static final String DIRECTIVE = "#define ";

    // NAME(args) BODY, no space between the name and the parenthesis
    private static final Pattern FUNCTION_LIKE_PATTERN = Pattern.compile("^(\\w+)\\(([^)]*)\\)(?:\\s+(.*))?$");

    private static final Pattern OBJECT_LIKE_PATTERN = Pattern.compile("^(\\w+)\\s+(.+)$");

    private static final Pattern EMPTY_PATTERN = Pattern.compile("^(\\w+)\\s*$");

    // ((Type*) EXPR)
    private static final Pattern TYPE_CAST_PATTERN = Pattern.compile("^\\(\\((\\w+)\\s*\\*\\)\\s*(.+)\\)$");

    private static final List<String> OPERATORS = List.of("+", "-", "*", "/", "%", "<<", ">>", "|", "&", "^", "~");

    private static final Pattern LINE_BREAK = Pattern.compile("[\\r\\n]+");

    /**
     * Classifies every definition line of a macro dump, dropping lines that do not parse.
     */
    public List<MacroDecl> classifyAll(String macroDump) {
        List<MacroDecl> macros = new ArrayList<>();
        if (macroDump == null || macroDump.isEmpty()) {
            return macros;
        }

        int dropped = 0;
        for (String line : LINE_BREAK.split(macroDump)) {
            if (line.isEmpty()) {
                continue;
            }
            MacroDecl macro = classify(line);
            if (macro != null) {
                macros.add(macro);
            } else {
                dropped++;
            }
        }

        log.debug("Classified {} macro lines, dropped {}", macros.size(), dropped);
        return macros;
    }

    /**
     * @return the classified macro, or null when the line is not a parsable {@code #define}
     */
    public MacroDecl classify(String line) {
        if (!line.startsWith(DIRECTIVE)) {
            return null;
        }
        String rest = line.substring(DIRECTIVE.length()).strip();

        Matcher function = FUNCTION_LIKE_PATTERN.matcher(rest);
        if (function.matches()) {
            String body = function.group(3) != null ? function.group(3).strip() : "";
            return MacroDecl.builder()
                    .name(function.group(1))
                    .kind(new MacroKind.FunctionLike(parseArguments(function.group(2)), body))
                    .rawValue(body)
                    .build();
        }

        Matcher object = OBJECT_LIKE_PATTERN.matcher(rest);
        if (object.matches()) {
            String value = object.group(2).strip();
            return MacroDecl.builder()
                    .name(object.group(1))
                    .kind(classifyValue(value))
                    .rawValue(value)
                    .build();
        }

        Matcher empty = EMPTY_PATTERN.matcher(rest);
        if (empty.matches()) {
            return MacroDecl.builder()
                    .name(empty.group(1))
                    .kind(new MacroKind.SimpleValue(""))
                    .rawValue("")
                    .build();
        }

        log.debug("Skipping unparsable macro line: {}", line);
        return null;
    }

    MacroKind classifyValue(String value) {
        Matcher cast = TYPE_CAST_PATTERN.matcher(value);
        if (cast.matches()) {
            return new MacroKind.TypeCast(cast.group(1), cast.group(2).strip());
        }
        if (!isStringLiteral(value) && containsOperator(value)) {
            return new MacroKind.Expression(value);
        }
        return new MacroKind.SimpleValue(value);
    }

    private static List<String> parseArguments(String args) {
        if (args.isBlank()) {
            return List.of();
        }
        return Arrays.stream(args.split(","))
                .map(String::strip)
                .toList();
    }

    private static boolean containsOperator(String value) {
        for (String operator : OPERATORS) {
            if (value.contains(operator)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isStringLiteral(String value) {
        return value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"");
    }
}
