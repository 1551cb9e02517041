package com.cheader.extractor.parser.ast;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cheader.extractor.parser.exception.TreeDecodeException;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Decodes the text of {@code clang -Xclang -ast-dump=json} into an {@link AstNode} tree.
 */
public class AstTreeDecoder {
    private static final Logger log = LoggerFactory.getLogger(AstTreeDecoder.class);

    // Vendor header sets produce deeply nested expression trees and very large documents.
    private static final int MAX_NESTING_DEPTH = 20_000;

    private final ObjectMapper mapper;

    public AstTreeDecoder() {
        JsonFactory factory = JsonFactory.builder()
                .streamReadConstraints(StreamReadConstraints.builder()
                        .maxNestingDepth(MAX_NESTING_DEPTH)
                        .maxStringLength(Integer.MAX_VALUE)
                        .build())
                .build();
        this.mapper = new ObjectMapper(factory);
    }

    public AstNode decode(String json) {
        if (json == null || json.isBlank()) {
            throw new TreeDecodeException("Failed to parse clang output: AST dump is empty");
        }

        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TreeDecodeException("Failed to parse clang output: " + e.getOriginalMessage(), e);
        }

        if (root == null || !root.isObject()) {
            throw new TreeDecodeException("Failed to parse clang output: root is not a JSON object");
        }

        AstNode node = toNode(root);
        log.debug("Decoded AST root {} with {} top-level nodes", node.getKind(), node.getInner().size());
        return node;
    }

    /**
     * Builds the node tree without recursion: vendor headers produce expression
     * chains thousands of levels deep. Children keep their document order.
     */
    private AstNode toNode(JsonNode rootJson) {
        Deque<PendingNode> stack = new ArrayDeque<>();
        stack.push(new PendingNode(rootJson, nodeBuilder(rootJson)));

        AstNode root = null;
        while (!stack.isEmpty()) {
            PendingNode top = stack.peek();
            if (top.children.hasNext()) {
                JsonNode child = top.children.next();
                if (child.isObject()) {
                    stack.push(new PendingNode(child, nodeBuilder(child)));
                }
                continue;
            }

            stack.pop();
            AstNode node = top.builder.build();
            PendingNode parent = stack.peek();
            if (parent != null) {
                parent.builder.child(node);
            } else {
                root = node;
            }
        }
        return root;
    }

    private AstNode.AstNodeBuilder nodeBuilder(JsonNode json) {
        JsonNode kind = json.get("kind");
        if (kind == null || !kind.isTextual()) {
            throw new TreeDecodeException("Failed to parse clang output: node without a kind" + describeId(json));
        }

        AstNode.AstNodeBuilder builder = AstNode.builder()
                .kind(kind.textValue())
                .name(text(json, "name"))
                .qualType(qualType(json))
                .loc(location(json.get("loc")))
                .attributes(json);

        JsonNode range = json.get("range");
        if (range != null && range.isObject()) {
            builder.rangeBegin(location(range.get("begin")));
            builder.rangeEnd(location(range.get("end")));
        }
        return builder;
    }

    /** A node whose children are still being decoded. */
    private static final class PendingNode {
        private final Iterator<JsonNode> children;
        private final AstNode.AstNodeBuilder builder;

        PendingNode(JsonNode json, AstNode.AstNodeBuilder builder) {
            JsonNode inner = json.get("inner");
            this.children = inner != null && inner.isArray()
                    ? inner.elements()
                    : Collections.emptyIterator();
            this.builder = builder;
        }
    }

    private SourceLocation location(JsonNode json) {
        if (json == null || !json.isObject()) {
            return null;
        }

        SourceLocation.SourceLocationBuilder builder = SourceLocation.builder()
                .file(text(json, "file"))
                .begin(location(json.get("begin")))
                .spelling(location(json.get("spellingLoc")))
                .expansion(location(json.get("expansionLoc")));

        JsonNode offset = json.get("offset");
        if (offset != null && offset.isIntegralNumber()) {
            builder.offset(offset.longValue());
        }

        JsonNode includedFrom = json.get("includedFrom");
        if (includedFrom != null && includedFrom.isObject()) {
            builder.includedFrom(true);
            builder.includedFromFile(text(includedFrom, "file"));
        }

        return builder.build();
    }

    private static String qualType(JsonNode json) {
        JsonNode type = json.get("type");
        if (type == null || !type.isObject()) {
            return null;
        }
        return text(type, "qualType");
    }

    private static String text(JsonNode json, String field) {
        JsonNode value = json.get(field);
        return value != null && value.isTextual() ? value.textValue() : null;
    }

    private static String describeId(JsonNode json) {
        String id = text(json, "id");
        return id != null ? " (id " + id + ")" : "";
    }
}
