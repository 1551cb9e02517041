package com.cheader.extractor.parser.extract;

import com.cheader.extractor.TestFixtures;
import com.cheader.extractor.model.ClassDecl;
import com.cheader.extractor.model.Declaration;
import com.cheader.extractor.model.EnumDecl;
import com.cheader.extractor.model.EnumValue;
import com.cheader.extractor.model.FieldDecl;
import com.cheader.extractor.model.FunctionDecl;
import com.cheader.extractor.model.NamespaceDecl;
import com.cheader.extractor.model.StructDecl;
import com.cheader.extractor.model.TypedefInfo;
import com.cheader.extractor.parser.ast.AstTreeDecoder;
import com.cheader.extractor.parser.provenance.ProvenanceTracker;
import com.cheader.extractor.parser.provenance.TargetFileMatcher;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DeclarationExtractor and DeclarationFactory over decoded AST dumps.
 */
class DeclarationExtractorTest {

    private final AstTreeDecoder decoder = new AstTreeDecoder();

    @Test
    void testSampleHeaderDeclarationsInOrder() {
        List<Declaration> declarations = extract("sample.h", TestFixtures.load("sample_ast.json"), false);

        assertThat(declarations).extracting(Declaration::getName)
                .containsExactly("Foo", "add", "", "Point", "IRQn");
    }

    @Test
    void testIncludedStructIsExcluded() {
        List<Declaration> declarations = extract("sample.h", TestFixtures.load("sample_ast.json"), false);

        assertThat(declarations).extracting(Declaration::getName).doesNotContain("Bar", "__int128_t");
    }

    @Test
    void testStructFieldsInDeclarationOrder() {
        StructDecl foo = (StructDecl) extract("sample.h", TestFixtures.load("sample_ast.json"), false).get(0);

        assertThat(foo.isUnion()).isFalse();
        assertThat(foo.getFields()).extracting(FieldDecl::getName).containsExactly("a", "b");

        FieldDecl b = foo.getFields().get(1);
        assertThat(b.getType()).isEqualTo("unsigned int");
        assertThat(b.isVolatile()).isTrue();
        assertThat(b.isArray()).isTrue();
        assertThat(b.getArraySize()).isEqualTo(4L);
    }

    @Test
    void testFunctionSignature() {
        FunctionDecl add = (FunctionDecl) extract("sample.h", TestFixtures.load("sample_ast.json"), false).get(1);

        assertThat(add.getReturnType()).isEqualTo("int");
        assertThat(add.getParameters()).containsExactly(
                new FunctionDecl.Parameter("a", "int"),
                new FunctionDecl.Parameter("param", "int"));
        assertThat(add.isStatic()).isFalse();
    }

    @Test
    void testAnonymousTypedefStructYieldsStructThenTypedef() {
        List<Declaration> declarations = extract("sample.h", TestFixtures.load("sample_ast.json"), false);

        StructDecl anonymous = (StructDecl) declarations.get(2);
        assertThat(anonymous.isAnonymous()).isTrue();
        assertThat(anonymous.getFields()).extracting(FieldDecl::getName).containsExactly("x", "y");

        TypedefInfo point = (TypedefInfo) declarations.get(3);
        assertThat(point.getUnderlyingType()).isEqualTo("struct Point");
    }

    @Test
    void testEnumValuesSignedAndImplicit() {
        EnumDecl irq = (EnumDecl) extract("sample.h", TestFixtures.load("sample_ast.json"), false).get(4);

        assertThat(irq.getValues()).extracting(EnumValue::getName)
                .containsExactly("NonMaskableInt_IRQn", "WWDG_IRQn", "PVD_IRQn");
        assertThat(irq.getValues()).extracting(EnumValue::getValue)
                .containsExactly(-14L, 0L, 1L);
        assertThat(irq.getUnderlyingType()).isNull();
    }

    @Test
    void testUnaryMinusLiteralWithoutConstantExpr() {
        String json = """
            { "kind": "TranslationUnitDecl", "inner": [
              { "kind": "EnumDecl", "name": "Level", "loc": { "offset": 1, "file": "levels.h" },
                "fixedUnderlyingType": { "qualType": "signed char" },
                "inner": [
                  { "kind": "EnumConstantDecl", "name": "LOW", "loc": { "offset": 20 },
                    "inner": [
                      { "kind": "UnaryOperator", "opcode": "-", "inner": [
                        { "kind": "IntegerLiteral", "value": "3" } ] } ] },
                  { "kind": "EnumConstantDecl", "name": "MID", "loc": { "offset": 30 } },
                  { "kind": "EnumConstantDecl", "name": "HIGH", "loc": { "offset": 40 },
                    "inner": [ { "kind": "ImplicitCastExpr", "inner": [
                      { "kind": "IntegerLiteral", "value": "10" } ] } ] }
                ] }
            ] }
            """;

        EnumDecl level = (EnumDecl) extract("levels.h", json, false).get(0);

        assertThat(level.getValues()).extracting(EnumValue::getValue).containsExactly(-3L, -2L, 10L);
        assertThat(level.getUnderlyingType()).isEqualTo("signed char");
    }

    @Test
    void testUnionWithAnonymousMemberAndBitfield() {
        String json = """
            { "kind": "TranslationUnitDecl", "inner": [
              { "kind": "RecordDecl", "name": "Reg", "tagUsed": "union", "loc": { "offset": 1, "file": "regs.h" },
                "inner": [
                  { "kind": "RecordDecl", "tagUsed": "struct", "loc": { "offset": 10 },
                    "inner": [
                      { "kind": "FieldDecl", "name": "EN", "loc": { "offset": 20 }, "isBitfield": true,
                        "type": { "qualType": "uint32_t" },
                        "inner": [ { "kind": "ConstantExpr", "value": "1",
                          "inner": [ { "kind": "IntegerLiteral", "value": "1" } ] } ] },
                      { "kind": "FieldDecl", "name": "MODE", "loc": { "offset": 30 }, "isBitfield": true,
                        "type": { "qualType": "uint32_t" },
                        "inner": [ { "kind": "ConstantExpr", "value": "3",
                          "inner": [ { "kind": "IntegerLiteral", "value": "3" } ] } ] }
                    ] },
                  { "kind": "FieldDecl", "loc": { "offset": 40 }, "isImplicit": true,
                    "type": { "qualType": "struct (anonymous struct at regs.h:2:5)" } },
                  { "kind": "FieldDecl", "name": "w", "loc": { "offset": 50 },
                    "type": { "qualType": "__IO uint32_t" } }
                ] }
            ] }
            """;

        List<Declaration> declarations = extract("regs.h", json, false);

        StructDecl reg = (StructDecl) declarations.get(0);
        assertThat(reg.isUnion()).isTrue();
        assertThat(reg.getFields()).extracting(FieldDecl::getName).containsExactly("", "w");
        assertThat(reg.getFields().get(0).getType()).isEqualTo("struct (anonymous struct at regs.h:2:5)");
        assertThat(reg.getFields().get(1).isVolatile()).isTrue();

        StructDecl bits = (StructDecl) declarations.get(1);
        assertThat(bits.isAnonymous()).isTrue();
        assertThat(bits.getFields()).extracting(FieldDecl::getBitWidth).containsExactly(1, 3);
    }

    @Test
    void testEmptyAnonymousStructIsDropped() {
        String json = """
            { "kind": "TranslationUnitDecl", "inner": [
              { "kind": "RecordDecl", "tagUsed": "struct", "loc": { "offset": 1, "file": "empty.h" } },
              { "kind": "EnumDecl", "loc": { "offset": 9 } }
            ] }
            """;

        assertThat(extract("empty.h", json, false)).isEmpty();
    }

    @Test
    void testDocumentationFromFullComment() {
        String json = """
            { "kind": "TranslationUnitDecl", "inner": [
              { "kind": "FunctionDecl", "name": "reset", "loc": { "offset": 40, "file": "doc.h" },
                "type": { "qualType": "void (void)" }, "storageClass": "static", "inline": true,
                "inner": [
                  { "kind": "FullComment", "inner": [
                    { "kind": "ParagraphComment", "inner": [
                      { "kind": "TextComment", "text": " Resets the device." },
                      { "kind": "TextComment", "text": " Blocks until done." }
                    ] } ] } ] }
            ] }
            """;

        FunctionDecl reset = (FunctionDecl) extract("doc.h", json, false).get(0);

        assertThat(reset.getDocumentation()).isEqualTo("Resets the device. Blocks until done.");
        assertThat(reset.getReturnType()).isEqualTo("void");
        assertThat(reset.getParameters()).isEmpty();
        assertThat(reset.isStatic()).isTrue();
        assertThat(reset.isInline()).isTrue();
    }

    @Test
    void testClassMethodsAndAbstractness() {
        String json = """
            { "kind": "TranslationUnitDecl", "inner": [
              { "kind": "CXXRecordDecl", "name": "Shape", "tagUsed": "class", "loc": { "offset": 6, "file": "shape.hpp" },
                "inner": [
                  { "kind": "CXXRecordDecl", "name": "Shape", "isImplicit": true, "loc": { "offset": 6 } },
                  { "kind": "FieldDecl", "name": "id_", "loc": { "offset": 20 }, "type": { "qualType": "int" } },
                  { "kind": "CXXMethodDecl", "name": "area", "loc": { "offset": 40 },
                    "type": { "qualType": "double () const" }, "virtual": true, "pure": true },
                  { "kind": "CXXMethodDecl", "name": "operator=", "loc": { "offset": 6 }, "isImplicit": true,
                    "type": { "qualType": "Shape &(const Shape &)" } }
                ] }
            ] }
            """;

        List<Declaration> declarations = extract("shape.hpp", json, false);

        assertThat(declarations).hasSize(1);
        ClassDecl shape = (ClassDecl) declarations.get(0);
        assertThat(shape.isAbstract()).isTrue();
        assertThat(shape.getMethods()).extracting(FunctionDecl::getName).containsExactly("area");
        assertThat(shape.getMethods().get(0).isVirtual()).isTrue();
        assertThat(shape.getMethods().get(0).getReturnType()).isEqualTo("double");
        assertThat(shape.getFields()).extracting(FieldDecl::getName).containsExactly("id_");
    }

    @Test
    void testNamespaceMembersFlatByDefault() {
        List<Declaration> declarations = extract("geo.hpp", namespaceJson(), false);

        assertThat(declarations).extracting(Declaration::getName).containsExactly("distance", "Unit");
    }

    @Test
    void testNamespaceMembersGroupedWhenRequested() {
        List<Declaration> declarations = extract("geo.hpp", namespaceJson(), true);

        assertThat(declarations).hasSize(1);
        NamespaceDecl geo = (NamespaceDecl) declarations.get(0);
        assertThat(geo.getName()).isEqualTo("geo");
        assertThat(geo.getDeclarations()).extracting(Declaration::getName).containsExactly("distance", "Unit");
    }

    @Test
    void testIncludedNamespaceMembersStayExcludedWhenGrouped() {
        String json = """
            { "kind": "TranslationUnitDecl", "inner": [
              { "kind": "NamespaceDecl", "name": "std",
                "loc": { "offset": 1, "file": "/usr/include/c++/vector", "includedFrom": { "file": "geo.hpp" } },
                "inner": [ { "kind": "CXXRecordDecl", "name": "vector", "loc": { "offset": 20 } } ] },
              { "kind": "FunctionDecl", "name": "area", "loc": { "offset": 5, "file": "geo.hpp" },
                "type": { "qualType": "double ()" } }
            ] }
            """;

        List<Declaration> declarations = extract("geo.hpp", json, true);

        assertThat(declarations).extracting(Declaration::getName).containsExactly("area");
    }

    private static String namespaceJson() {
        return """
            { "kind": "TranslationUnitDecl", "inner": [
              { "kind": "NamespaceDecl", "name": "geo", "loc": { "offset": 10, "file": "geo.hpp" },
                "inner": [
                  { "kind": "FunctionDecl", "name": "distance", "loc": { "offset": 30 },
                    "type": { "qualType": "double (double, double)" },
                    "inner": [
                      { "kind": "ParmVarDecl", "name": "a", "loc": { "offset": 45 }, "type": { "qualType": "double" } },
                      { "kind": "ParmVarDecl", "name": "b", "loc": { "offset": 55 }, "type": { "qualType": "double" } }
                    ] },
                  { "kind": "EnumDecl", "name": "Unit", "loc": { "offset": 70 },
                    "inner": [ { "kind": "EnumConstantDecl", "name": "METERS", "loc": { "offset": 80 } } ] }
                ] }
            ] }
            """;
    }

    private List<Declaration> extract(String headerName, String json, boolean groupNamespaces) {
        ProvenanceTracker tracker =
                new ProvenanceTracker(new TargetFileMatcher(Path.of("/nonexistent/include").resolve(headerName)));
        DeclarationExtractor extractor = new DeclarationExtractor(tracker, new DeclarationFactory(), groupNamespaces);
        return extractor.extract(decoder.decode(json));
    }

    @Test
    void testDeeplyNestedInitializer() {
        List<Declaration> declarations = extract("flags.h", TestFixtures.deepEnumAst("flags.h", 6000), false);

        assertThat(declarations).hasSize(1);
        EnumDecl flags = (EnumDecl) declarations.get(0);
        assertThat(flags.getValues()).extracting(EnumValue::getValue).containsExactly(7L);
    }

    @Test
    void testArrayDimensionBeyondIntRange() {
        String json = """
            { "kind": "TranslationUnitDecl", "inner": [
              { "kind": "RecordDecl", "name": "Blob", "tagUsed": "struct", "loc": { "offset": 7, "file": "blob.h" },
                "inner": [
                  { "kind": "FieldDecl", "name": "data", "loc": { "offset": 34 },
                    "type": { "qualType": "unsigned char[4294967296]" } }
                ] }
            ] }
            """;

        StructDecl blob = (StructDecl) extract("blob.h", json, false).get(0);

        FieldDecl data = blob.getFields().get(0);
        assertThat(data.getType()).isEqualTo("unsigned char");
        assertThat(data.getArraySize()).isEqualTo(4294967296L);
    }

    @Test
    void testRepeatedUnaryMinus() {
        String json = """
            { "kind": "TranslationUnitDecl", "inner": [
              { "kind": "EnumDecl", "name": "Sign", "loc": { "offset": 1, "file": "sign.h" },
                "inner": [
                  { "kind": "EnumConstantDecl", "name": "POS", "loc": { "offset": 20 },
                    "inner": [
                      { "kind": "UnaryOperator", "opcode": "-", "inner": [
                        { "kind": "UnaryOperator", "opcode": "-", "inner": [
                          { "kind": "IntegerLiteral", "value": "5" } ] } ] } ] }
                ] }
            ] }
            """;

        EnumDecl sign = (EnumDecl) extract("sign.h", json, false).get(0);

        assertThat(sign.getValues()).extracting(EnumValue::getValue).containsExactly(5L);
    }
}
