package com.cheader.extractor.parser.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import com.cheader.extractor.model.ClassDecl;
import com.cheader.extractor.model.Declaration;
import com.cheader.extractor.model.EnumDecl;
import com.cheader.extractor.model.EnumValue;
import com.cheader.extractor.model.FieldDecl;
import com.cheader.extractor.model.FunctionDecl;
import com.cheader.extractor.model.StructDecl;
import com.cheader.extractor.model.TypedefInfo;
import com.cheader.extractor.parser.ast.AstNode;
import com.cheader.extractor.parser.ast.AstNodeKind;

/**
 * Builds typed declarations from individual AST nodes.
 *
 * Only the node and its direct children are inspected here; walking the tree
 * and deciding provenance is {@link DeclarationExtractor}'s job.
 */
public class DeclarationFactory {

    static final String UNKNOWN_TYPE = "unknown";
    static final String DEFAULT_PARAMETER_NAME = "param";

    // "union (anonymous union at foo.h:3:5)" / "struct (unnamed struct at foo.h:3:5)"
    private static final Pattern ANONYMOUS_AGGREGATE = Pattern.compile(
            "\\b(?:struct|union)\\s+\\((?:anonymous|unnamed)\\b");

    /**
     * Dispatches on the node kind. Kinds without a declaration of their own
     * (parameters, fields, namespaces, expressions, ...) yield nothing.
     */
    public Optional<Declaration> create(AstNode node) {
        AstNodeKind kind = node.getNodeKind();
        Declaration declaration = switch (kind) {
            case FUNCTION -> function(node);
            case RECORD -> record(node);
            case ENUM -> enumeration(node);
            case TYPEDEF -> typedef(node);
            case CXX_RECORD -> cxxClass(node);
            case TRANSLATION_UNIT, CXX_METHOD, ENUM_CONSTANT, FIELD, PARAMETER, NAMESPACE,
                    FULL_COMMENT, TEXT_COMMENT, UNARY_OPERATOR, OTHER -> null;
        };
        return Optional.ofNullable(declaration);
    }

    public FunctionDecl function(AstNode node) {
        if (!node.hasName()) {
            return null;
        }

        FunctionDecl.FunctionDeclBuilder builder = FunctionDecl.builder()
                .name(node.getName())
                .returnType(extractReturnType(qualType(node)))
                .documentation(documentation(node))
                .isVirtual(node.getFlag("virtual"))
                .isStatic("static".equals(node.getString("storageClass")))
                .isInline(node.getFlag("inline"));

        for (AstNode child : node.getInner()) {
            if (child.getNodeKind() == AstNodeKind.PARAMETER) {
                String paramName = child.hasName() ? child.getName() : DEFAULT_PARAMETER_NAME;
                builder.parameter(new FunctionDecl.Parameter(paramName, qualType(child)));
            }
        }

        return builder.build();
    }

    public StructDecl record(AstNode node) {
        List<FieldDecl> fields = fields(node);
        if (!node.hasName() && fields.isEmpty()) {
            return null;
        }

        return StructDecl.builder()
                .name(node.hasName() ? node.getName() : "")
                .fields(fields)
                .documentation(documentation(node))
                .isUnion("union".equals(node.getString("tagUsed", "struct")))
                .build();
    }

    public EnumDecl enumeration(AstNode node) {
        List<EnumValue> values = new ArrayList<>();
        long next = 0;
        for (AstNode child : node.getInner()) {
            if (child.getNodeKind() != AstNodeKind.ENUM_CONSTANT || !child.hasName()) {
                continue;
            }
            Long literal = ConstantValueResolver.findLiteral(child);
            long value = literal != null ? literal : next;
            values.add(EnumValue.builder()
                    .name(child.getName())
                    .value(value)
                    .documentation(documentation(child))
                    .build());
            next = value + 1;
        }

        if (!node.hasName() && values.isEmpty()) {
            return null;
        }

        return EnumDecl.builder()
                .name(node.hasName() ? node.getName() : "")
                .values(values)
                .documentation(documentation(node))
                .underlyingType(node.getNestedString("fixedUnderlyingType", "qualType"))
                .build();
    }

    public TypedefInfo typedef(AstNode node) {
        if (!node.hasName()) {
            return null;
        }
        return TypedefInfo.builder()
                .name(node.getName())
                .underlyingType(qualType(node))
                .documentation(documentation(node))
                .build();
    }

    /**
     * Anonymous classes are dropped entirely, unlike anonymous C aggregates.
     */
    public ClassDecl cxxClass(AstNode node) {
        if (!node.hasName()) {
            return null;
        }

        ClassDecl.ClassDeclBuilder builder = ClassDecl.builder()
                .name(node.getName())
                .fields(fields(node))
                .documentation(documentation(node));

        boolean isAbstract = false;
        for (AstNode child : node.getInner()) {
            AstNodeKind kind = child.getNodeKind();
            if (kind != AstNodeKind.CXX_METHOD && kind != AstNodeKind.FUNCTION) {
                continue;
            }
            if (kind == AstNodeKind.CXX_METHOD && child.getFlag("pure")) {
                isAbstract = true;
            }
            if (child.isImplicit()) {
                continue;
            }
            FunctionDecl method = function(child);
            if (method != null) {
                builder.method(method);
            }
        }

        return builder.isAbstract(isAbstract).build();
    }

    public FieldDecl field(AstNode node) {
        String type = qualType(node);
        if (!node.hasName()) {
            // Only the member that holds an anonymous struct/union may be unnamed.
            if (!ANONYMOUS_AGGREGATE.matcher(type).find()) {
                return null;
            }
        } else if (node.isImplicit()) {
            return null;
        }

        FieldDecl.FieldDeclBuilder builder = FieldTypeParser.parse(type).toBuilder()
                .name(node.hasName() ? node.getName() : "");

        if (node.getFlag("isBitfield")) {
            Long width = ConstantValueResolver.findLiteral(node);
            if (width != null) {
                builder.bitWidth(width.intValue());
            }
        }
        return builder.build();
    }

    private List<FieldDecl> fields(AstNode node) {
        List<FieldDecl> fields = new ArrayList<>();
        for (AstNode child : node.getInner()) {
            if (child.getNodeKind() == AstNodeKind.FIELD) {
                FieldDecl field = field(child);
                if (field != null) {
                    fields.add(field);
                }
            }
        }
        return fields;
    }

    /**
     * "void (int, char *)" -> "void". Everything before the first parenthesis.
     */
    static String extractReturnType(String typeStr) {
        int idx = typeStr.indexOf('(');
        return idx < 0 ? typeStr.trim() : typeStr.substring(0, idx).trim();
    }

    private static String qualType(AstNode node) {
        return node.getQualType() != null ? node.getQualType() : UNKNOWN_TYPE;
    }

    /**
     * Text of an attached doc comment, with its lines joined by single spaces.
     */
    static String documentation(AstNode node) {
        for (AstNode child : node.getInner()) {
            if (child.getNodeKind() == AstNodeKind.FULL_COMMENT) {
                List<String> parts = new ArrayList<>();
                collectCommentText(child, parts);
                return parts.isEmpty() ? null : String.join(" ", parts);
            }
        }
        return null;
    }

    private static void collectCommentText(AstNode node, List<String> parts) {
        if (node.getNodeKind() == AstNodeKind.TEXT_COMMENT) {
            String text = node.getString("text");
            if (text != null && !text.isBlank()) {
                parts.add(text.trim());
            }
        }
        for (AstNode child : node.getInner()) {
            collectCommentText(child, parts);
        }
    }
}
