package com.cheader.extractor.parser.ast;

import com.cheader.extractor.TestFixtures;
import com.cheader.extractor.parser.exception.TreeDecodeException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AstTreeDecoder and AstNode.
 */
class AstTreeDecoderTest {

    private final AstTreeDecoder decoder = new AstTreeDecoder();

    @Test
    void testDecodeSampleTree() {
        AstNode root = decoder.decode(TestFixtures.load("sample_ast.json"));

        assertThat(root.getNodeKind()).isEqualTo(AstNodeKind.TRANSLATION_UNIT);
        assertThat(root.getInner()).extracting(AstNode::getKind)
                .containsExactly("TypedefDecl", "RecordDecl", "RecordDecl", "FunctionDecl",
                        "RecordDecl", "TypedefDecl", "EnumDecl");

        AstNode bar = root.getInner().get(1);
        assertThat(bar.getName()).isEqualTo("Bar");
        assertThat(bar.getLoc().getFile()).isEqualTo("include/bar.h");
        assertThat(bar.getLoc().isIncludedFrom()).isTrue();
        assertThat(bar.getLoc().getIncludedFromFile()).isEqualTo("sample.h");
        assertThat(bar.getString("tagUsed")).isEqualTo("struct");
    }

    @Test
    void testEmptyLocationIsInvalid() {
        AstNode root = decoder.decode(TestFixtures.load("sample_ast.json"));

        AstNode builtin = root.getInner().get(0);
        assertThat(builtin.isImplicit()).isTrue();
        assertThat(builtin.getLoc()).isNotNull();
        assertThat(builtin.getLoc().isValid()).isFalse();
        assertThat(builtin.getQualType()).isEqualTo("__int128");
    }

    @Test
    void testDecodeRangeAndMacroLocations() {
        String json = """
            {
              "kind": "TranslationUnitDecl",
              "inner": [
                {
                  "kind": "VarDecl",
                  "name": "counter",
                  "loc": {
                    "spellingLoc": { "offset": 10, "file": "macros.h" },
                    "expansionLoc": { "offset": 90, "file": "target.h" }
                  },
                  "range": {
                    "begin": { "offset": 85 },
                    "end": { "offset": 99, "file": "other.h" }
                  }
                }
              ]
            }
            """;

        AstNode node = decoder.decode(json).getInner().get(0);

        assertThat(node.getNodeKind()).isEqualTo(AstNodeKind.OTHER);
        assertThat(node.getLoc().getSpelling().getFile()).isEqualTo("macros.h");
        assertThat(node.getLoc().getExpansion().getFile()).isEqualTo("target.h");
        assertThat(node.getLoc().fileStamps()).containsExactly("macros.h", "target.h");
        assertThat(node.getRangeBegin().getOffset()).isEqualTo(85L);
        assertThat(node.getRangeEnd().getFile()).isEqualTo("other.h");
    }

    @Test
    void testGetLongAcceptsStringsAndNumbers() {
        String json = """
            {
              "kind": "TranslationUnitDecl",
              "inner": [
                { "kind": "IntegerLiteral", "value": "-14" },
                { "kind": "IntegerLiteral", "value": 7 },
                { "kind": "IntegerLiteral", "value": "18446744073709551615" },
                { "kind": "IntegerLiteral", "value": "abc" }
              ]
            }
            """;

        AstNode root = decoder.decode(json);

        assertThat(root.getInner().get(0).getLong("value")).isEqualTo(-14L);
        assertThat(root.getInner().get(1).getLong("value")).isEqualTo(7L);
        assertThat(root.getInner().get(2).getLong("value")).isEqualTo(-1L);
        assertThat(root.getInner().get(3).getLong("value")).isNull();
    }

    @Test
    void testMalformedJsonFails() {
        assertThatThrownBy(() -> decoder.decode("{ \"kind\": \"TranslationUnitDecl\", "))
                .isInstanceOf(TreeDecodeException.class)
                .hasMessageStartingWith("Failed to parse clang output");
    }

    @Test
    void testEmptyDumpFails() {
        assertThatThrownBy(() -> decoder.decode("   "))
                .isInstanceOf(TreeDecodeException.class);
    }

    @Test
    void testNonObjectRootFails() {
        assertThatThrownBy(() -> decoder.decode("[1, 2, 3]"))
                .isInstanceOf(TreeDecodeException.class)
                .hasMessageContaining("root is not a JSON object");
    }

    @Test
    void testNodeWithoutKindFails() {
        assertThatThrownBy(() -> decoder.decode("{ \"kind\": \"TranslationUnitDecl\", \"inner\": [ { \"id\": \"0x9\" } ] }"))
                .isInstanceOf(TreeDecodeException.class)
                .hasMessageContaining("node without a kind")
                .hasMessageContaining("0x9");
    }

    @Test
    void testDeeplyNestedExpressionDecodes() {
        AstNode root = decoder.decode(TestFixtures.deepEnumAst("flags.h", 6000));

        AstNode node = root.getInner().get(0).getInner().get(0).getInner().get(0);
        assertThat(node.getKind()).isEqualTo("ConstantExpr");
        int depth = 0;
        while (!node.getInner().isEmpty()) {
            node = node.getInner().get(0);
            depth++;
        }
        assertThat(depth).isEqualTo(6001);
        assertThat(node.getLong("value")).isEqualTo(1L);
    }

    @Test
    void testNestingBeyondLimitFailsAsDecodeError() {
        assertThatThrownBy(() -> decoder.decode(TestFixtures.deepEnumAst("flags.h", 12000)))
                .isInstanceOf(TreeDecodeException.class)
                .hasMessageStartingWith("Failed to parse clang output");
    }
}
