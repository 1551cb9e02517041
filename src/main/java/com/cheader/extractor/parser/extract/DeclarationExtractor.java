package com.cheader.extractor.parser.extract;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cheader.extractor.model.Declaration;
import com.cheader.extractor.model.NamespaceDecl;
import com.cheader.extractor.parser.ast.AstNode;
import com.cheader.extractor.parser.ast.AstNodeKind;
import com.cheader.extractor.parser.provenance.ProvenanceState;
import com.cheader.extractor.parser.provenance.ProvenanceStep;
import com.cheader.extractor.parser.provenance.ProvenanceTracker;

/**
 * Walks the decoded AST in document order and collects the declarations that
 * are physically written in the target header.
 *
 * Every node is visited exactly once, whether or not it yields a declaration,
 * because provenance is carried from node to node. Implicit nodes and nodes
 * from included files never yield a declaration.
 */
public class DeclarationExtractor {
    private static final Logger log = LoggerFactory.getLogger(DeclarationExtractor.class);

    private final ProvenanceTracker tracker;
    private final DeclarationFactory factory;
    private final boolean groupNamespaces;

    public DeclarationExtractor(ProvenanceTracker tracker, DeclarationFactory factory, boolean groupNamespaces) {
        this.tracker = tracker;
        this.factory = factory;
        this.groupNamespaces = groupNamespaces;
    }

    public List<Declaration> extract(AstNode root) {
        List<Declaration> results = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();

        ProvenanceState state = visit(root, ProvenanceState.initial(), results, stack);
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (top.children.hasNext()) {
                state = visit(top.children.next(), state, top.out, stack);
            } else {
                stack.pop();
                top.complete();
            }
        }

        log.debug("Extracted {} AST declarations (last file: {})", results.size(), state.getCurrentFile());
        return List.copyOf(results);
    }

    /**
     * Steps provenance over {@code node}, emits its declaration into {@code out}
     * and schedules its children. The walk is iterative so expression trees of
     * any depth are safe; children are still visited in pre-order.
     *
     * @return the provenance state after the node itself
     */
    private ProvenanceState visit(AstNode node, ProvenanceState state, List<Declaration> out, Deque<Frame> stack) {
        ProvenanceStep step = tracker.step(state, node);
        boolean emit = step.isLocal() && !node.isImplicit();

        if (emit && log.isDebugEnabled()) {
            log.debug("Processing {}: {} (file: {})", node.getKind(), node.displayName(),
                    step.getNext().getCurrentFile());
        }

        if (node.getNodeKind() == AstNodeKind.NAMESPACE) {
            if (emit && groupNamespaces && node.hasName()) {
                List<Declaration> members = new ArrayList<>();
                stack.push(new Frame(node, members, () -> out.add(NamespaceDecl.builder()
                        .name(node.getName())
                        .declarations(members)
                        .build())));
                return step.getNext();
            }
        } else if (emit) {
            factory.create(node).ifPresent(out::add);
        }

        stack.push(new Frame(node, out, null));
        return step.getNext();
    }

    /** A node whose children are still being walked. */
    private static final class Frame {
        private final Iterator<AstNode> children;
        private final List<Declaration> out;
        private final Runnable onComplete;

        Frame(AstNode node, List<Declaration> out, Runnable onComplete) {
            this.children = node.getInner().iterator();
            this.out = out;
            this.onComplete = onComplete;
        }

        void complete() {
            if (onComplete != null) {
                onComplete.run();
            }
        }
    }
}
