package com.cheader.extractor.parser.extract;

import com.cheader.extractor.parser.ast.AstNode;
import com.cheader.extractor.parser.ast.AstNodeKind;

/**
 * Recovers constant integer values hanging below a declaration
 * (enumerator initializers, bit-field widths).
 *
 * Clang folds initializers into a {@code ConstantExpr} carrying {@code value};
 * older dumps only have the bare literal one level further down.
 */
final class ConstantValueResolver {

    private ConstantValueResolver() {
        // Utility class
    }

    /**
     * Searches the node's children, then their children, for a literal value.
     */
    static Long findLiteral(AstNode node) {
        for (AstNode child : node.getInner()) {
            Long value = literal(child);
            if (value != null) {
                return value;
            }
            for (AstNode nested : child.getInner()) {
                value = literal(nested);
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    /**
     * A literal value, or a literal under any number of unary minus operators.
     */
    private static Long literal(AstNode node) {
        boolean negate = false;
        AstNode current = node;
        while (current != null) {
            Long value = current.getLong("value");
            if (value != null) {
                return negate ? -value : value;
            }
            if (current.getNodeKind() != AstNodeKind.UNARY_OPERATOR || !"-".equals(current.getString("opcode"))) {
                return null;
            }
            negate = !negate;
            current = current.getInner().isEmpty() ? null : current.getInner().get(0);
        }
        return null;
    }
}
