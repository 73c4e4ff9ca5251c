package com.hartwig.wdlc.codegen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hartwig.wdlc.error.FrontEndRejectionException;
import com.hartwig.wdlc.error.UnsupportedDialectException;
import com.hartwig.wdlc.error.UnsupportedTypeException;
import com.hartwig.wdlc.frontend.AnalysisResult;
import com.hartwig.wdlc.frontend.FakeFrontEnd;
import com.hartwig.wdlc.frontend.LanguageFrontEnd;
import com.hartwig.wdlc.frontend.LanguageFrontEnds;
import com.hartwig.wdlc.frontend.SourceBundle;
import com.hartwig.wdlc.frontend.TaskDefinition;
import com.hartwig.wdlc.ir.Applet;
import com.hartwig.wdlc.ir.AppletKindNative;
import com.hartwig.wdlc.ir.AppletKindTask;
import com.hartwig.wdlc.ir.CVar;
import com.hartwig.wdlc.ir.Callable;
import com.hartwig.wdlc.ir.DefaultInstanceType;
import com.hartwig.wdlc.ir.DockerImageNone;
import com.hartwig.wdlc.ir.Workflow;
import com.hartwig.wdlc.scan.StructuralScanner;
import com.hartwig.wdlc.wdl.ArrayType;
import com.hartwig.wdlc.wdl.Dialect;
import com.hartwig.wdlc.wdl.MapType;
import com.hartwig.wdlc.wdl.ObjectType;
import com.hartwig.wdlc.wdl.OptionalType;
import com.hartwig.wdlc.wdl.PairType;
import com.hartwig.wdlc.wdl.PrimitiveType;
import com.hartwig.wdlc.wdl.StructType;
import com.hartwig.wdlc.wdl.WdlType;
import com.hartwig.wdlc.wdl.WdlValues;

import org.junit.jupiter.api.Test;

class WdlCodeGenTest {
    private final SourceValidator validator =
            new SourceValidator(new LanguageFrontEnds(List.of(new FakeFrontEnd(Dialect.DRAFT_2), new FakeFrontEnd(Dialect.V1_0))));
    private final WdlCodeGen codeGen = new WdlCodeGen(Dialect.V1_0, Map.of(), validator);

    private final Workflow add = Workflow.builder()
            .name("Add")
            .addInputs(CVar.of("b", PrimitiveType.INT), CVar.of("a", PrimitiveType.INT))
            .addOutputs(CVar.of("result", PrimitiveType.INT))
            .build();

    @Test
    void primitiveDefaults() throws UnsupportedTypeException {
        assertThat(codeGen.defaultValueOf(PrimitiveType.BOOLEAN).toWdlString()).isEqualTo("true");
        assertThat(codeGen.defaultValueOf(PrimitiveType.INT).toWdlString()).isEqualTo("0");
        assertThat(codeGen.defaultValueOf(PrimitiveType.FLOAT).toWdlString()).isEqualTo("0.0");
        assertThat(codeGen.defaultValueOf(PrimitiveType.STRING).toWdlString()).isEqualTo("\"\"");
        assertThat(codeGen.defaultValueOf(PrimitiveType.FILE).toWdlString()).isEqualTo("\"dummy.txt\"");
    }

    @Test
    void compoundDefaults() throws UnsupportedTypeException {
        assertThat(codeGen.defaultValueOf(OptionalType.of(PrimitiveType.INT)).toWdlString()).isEqualTo("0");
        assertThat(codeGen.defaultValueOf(ArrayType.ofMaybeEmpty(PrimitiveType.STRING)).toWdlString()).isEqualTo("[]");
        assertThat(codeGen.defaultValueOf(ArrayType.ofNonEmpty(PrimitiveType.INT)).toWdlString()).isEqualTo("[0]");
        assertThat(codeGen.defaultValueOf(MapType.of(PrimitiveType.STRING, PrimitiveType.INT)).toWdlString()).isEqualTo("{\"\": 0}");
        assertThat(codeGen.defaultValueOf(PairType.of(PrimitiveType.INT, PrimitiveType.BOOLEAN)).toWdlString()).isEqualTo("(0, true)");
    }

    @Test
    void structDefaultIsObjectLiteral() throws UnsupportedTypeException {
        Map<String, WdlType> fields = new LinkedHashMap<>();
        fields.put("a", PrimitiveType.INT);
        fields.put("b", PrimitiveType.STRING);
        var struct = StructType.builder().name("Sample").putAllFields(fields).build();
        assertThat(codeGen.defaultValueOf(struct).toWdlString()).isEqualTo("object {a: 0, b: \"\"}");
    }

    @Test
    void placeholderFileIsConfigurable() throws UnsupportedTypeException {
        var custom = new WdlCodeGen(Dialect.V1_0,
                Map.of(),
                new TopologicalTypeAliasOrdering(),
                validator,
                new StructuralScanner(),
                "placeholder.txt");
        assertThat(custom.defaultValueOf(PrimitiveType.FILE).toWdlString()).isEqualTo("\"placeholder.txt\"");
    }

    @Test
    void objectHasNoDefault() {
        var exception = assertThrows(UnsupportedTypeException.class,
                () -> codeGen.defaultValueOf(PairType.of(PrimitiveType.INT, ObjectType.instance())));
        assertThat(exception.getType()).isEqualTo(ObjectType.instance());
    }

    @Test
    void interfaceStubSortsDeclarations() throws Exception {
        var expected = String.join("\n",
                "task Add {",
                "  input {",
                "    Int a",
                "    Int b",
                "  }",
                "  command {}",
                "  output {",
                "    Int result = 0",
                "  }",
                "}");
        assertThat(codeGen.interfaceStub(add).value()).isEqualTo(expected);
    }

    @Test
    void interfaceStubIsDeterministic() throws Exception {
        var reordered = Workflow.builder()
                .name("Add")
                .addInputs(CVar.of("a", PrimitiveType.INT), CVar.of("b", PrimitiveType.INT))
                .addOutputs(CVar.of("result", PrimitiveType.INT))
                .build();
        assertThat(codeGen.interfaceStub(reordered)).isEqualTo(codeGen.interfaceStub(add));
    }

    @Test
    void interfaceStubKeepsInputDefaults() throws Exception {
        var withDefault = Workflow.builder()
                .name("Greet")
                .addInputs(CVar.builder().name("name").type(PrimitiveType.STRING).defaultValue(WdlValues.string("world")).build())
                .build();
        assertThat(codeGen.interfaceStub(withDefault).value()).contains("    String name = \"world\"\n");
    }

    @Test
    void draftTwoStubHasNoInputSection() throws Exception {
        var draftTwo = new WdlCodeGen(Dialect.DRAFT_2, Map.of(), validator);
        var expected = String.join("\n",
                "task Add {",
                "    Int a",
                "    Int b",
                "",
                "  command {}",
                "  output {",
                "    Int result = 0",
                "  }",
                "}");
        assertThat(draftTwo.interfaceStub(add).value()).isEqualTo(expected);
    }

    @Test
    void cwlStubIsUnsupported() {
        var cwl = new WdlCodeGen(Dialect.CWL_1_0, Map.of(), validator);
        assertThrows(UnsupportedDialectException.class, () -> cwl.interfaceStub(add));
        assertThrows(UnsupportedDialectException.class, cwl::versionString);
    }

    @Test
    void nativeStubIsValidatedWithVersion() throws Exception {
        var frontEnd = mock(LanguageFrontEnd.class);
        when(frontEnd.dialect()).thenReturn(Dialect.V1_0);
        when(frontEnd.analyze(any(), any())).thenReturn(AnalysisResult.valid(SourceBundle.builder().build()));
        var mocked = new WdlCodeGen(Dialect.V1_0, Map.of(), new SourceValidator(new LanguageFrontEnds(List.of(frontEnd))));

        var stub = mocked.nativeStub("applet-xyz", "bwa", Map.of("reads", PrimitiveType.FILE), Map.of("bam", PrimitiveType.FILE));

        var expected = String.join("\n",
                "task bwa {",
                "  input {",
                "    File reads",
                "  }",
                "  command {}",
                "  output {",
                "    File bam = \"dummy.txt\"",
                "  }",
                "  meta {",
                "     type : \"native\"",
                "     id : \"applet-xyz\"",
                "  }",
                "}");
        assertThat(stub.value()).isEqualTo(expected);
        verify(frontEnd).analyze(eq("version 1.0\n\n" + expected + "\n"), eq(List.of()));
    }

    @Test
    void rejectedStubCarriesGeneratedText() {
        var frontEnd = mock(LanguageFrontEnd.class);
        when(frontEnd.dialect()).thenReturn(Dialect.V1_0);
        when(frontEnd.analyze(any(), any())).thenReturn(AnalysisResult.invalid(List.of("unexpected token")));
        var mocked = new WdlCodeGen(Dialect.V1_0, Map.of(), new SourceValidator(new LanguageFrontEnds(List.of(frontEnd))));

        var exception = assertThrows(FrontEndRejectionException.class,
                () -> mocked.nativeStub("applet-xyz", "bwa", Map.of(), Map.of()));
        assertThat(exception.getErrors()).containsExactly("unexpected token");
        assertThat(exception.getGeneratedSource()).hasValueSatisfying(source -> assertThat(source).contains("task bwa {"));
        assertThat(exception.getMessage()).contains("unexpected token").contains("id : \"applet-xyz\"");
    }

    @Test
    void flattensNamespacedCalls() {
        var source = String.join("\n",
                "workflow w {",
                "  call lib.Multiply as mul { input: a = 1 }",
                "    call lib.Hello",
                "  call Local",
                "  Int x = lib.value",
                "}");
        var expected = String.join("\n",
                "workflow w {",
                "  call Multiply as mul { input: a = 1 }",
                "    call Hello",
                "  call Local",
                "  Int x = lib.value",
                "}");
        var flattened = codeGen.flattenNamespacedCalls(source);
        assertThat(flattened).isEqualTo(expected);
        assertThat(codeGen.flattenNamespacedCalls(flattened)).isEqualTo(flattened);
    }

    @Test
    void flatteningKeepsTrailingNewline() {
        assertThat(codeGen.flattenNamespacedCalls("call lib.A\n")).isEqualTo("call A\n");
    }

    @Test
    void typeAliasesComeAfterTheirDependencies() {
        var sample = StructType.builder().name("Sample").putFields("id", PrimitiveType.STRING).build();
        var batch = StructType.builder().name("Batch").putFields("samples", ArrayType.ofMaybeEmpty(sample)).build();
        var withAliases = new WdlCodeGen(Dialect.V1_0, Map.of("Batch", batch, "Sample", sample), validator);

        assertThat(withAliases.typeAliasDefinitions()).isEqualTo(String.join("\n",
                "struct Sample {",
                "    String id",
                "}",
                "struct Batch {",
                "    Array[Sample] samples",
                "}"));
    }

    @Test
    void structsAreDefinedUnderTheirAliasName() {
        var sample = StructType.builder().name("Sample").putFields("id", PrimitiveType.STRING).build();
        var batch = StructType.builder().name("Batch").putFields("samples", ArrayType.ofMaybeEmpty(sample)).build();

        var renamed = new WdlCodeGen(Dialect.V1_0, Map.of("MySample", sample), validator);
        assertThat(renamed.typeAliasDefinitions()).isEqualTo("struct MySample {\n    String id\n}");

        var mixed = new WdlCodeGen(Dialect.V1_0, Map.of("Sample", sample, "MyBatch", batch), validator);
        assertThat(mixed.typeAliasDefinitions()).isEqualTo(String.join("\n",
                "struct Sample {",
                "    String id",
                "}",
                "struct MyBatch {",
                "    Array[Sample] samples",
                "}"));
    }

    @Test
    void flattensAliasedCallWithArguments() {
        assertThat(codeGen.flattenNamespacedCalls("call lib.Multiply as mul { input: x=1 }")).isEqualTo("call Multiply as mul { input: x=1 }");
    }

    @Test
    void standaloneTaskGetsVersionAndStructs() throws Exception {
        var task = "task A {\n  command {}\n}";
        var standalone = codeGen.standaloneTask(task);
        assertThat(standalone.value()).isEqualTo("version 1.0\n\n# struct definitions\n\n# Task\n" + task);
    }

    @Test
    void standaloneWorkflowDefinesEveryCallee() throws Exception {
        var taskSource = "version 1.0\n\ntask Add {\n  command {}\n}\n";
        var addApplet = Applet.builder()
                .name("Add")
                .instanceType(DefaultInstanceType.instance())
                .docker(DockerImageNone.instance())
                .kind(AppletKindTask.instance())
                .task(TaskDefinition.builder().name("Add").sourceCode(taskSource).build())
                .build();
        var subWorkflow = Workflow.builder().name("Sub").addInputs(CVar.of("x", PrimitiveType.INT)).build();
        var nativeApplet = Applet.builder()
                .name("Bwa")
                .instanceType(DefaultInstanceType.instance())
                .docker(DockerImageNone.instance())
                .kind(AppletKindNative.of("applet-xyz"))
                .build();
        var workflowSource = "workflow w {\n  call lib.Add\n  call lib.Sub as s { input: x = 1 }\n  call Bwa\n}";

        List<Callable> calls = List.of(subWorkflow, addApplet, nativeApplet, addApplet);
        var standalone = codeGen.standaloneWorkflow(workflowSource, calls).value();

        var expected = String.join("\n",
                "version 1.0\n",
                "# struct definitions",
                "",
                "# Task headers",
                "task Add {\n  command {}\n}\n\n"
                        + "task Bwa {\n  input {\n  }\n  command {}\n  output {\n  }\n}\n\n"
                        + "task Sub {\n  input {\n    Int x\n  }\n  command {}\n  output {\n  }\n}",
                "# Workflow with imports made local",
                "workflow w {\n  call Add\n  call Sub as s { input: x = 1 }\n  call Bwa\n}");
        assertThat(standalone).isEqualTo(expected);

        var reversed = new ArrayList<>(calls);
        Collections.reverse(reversed);
        assertThat(codeGen.standaloneWorkflow(workflowSource, reversed).value()).isEqualTo(standalone);
    }

    @Test
    void unrecoverableTaskFallsBackToStub() throws Exception {
        var applet = Applet.builder()
                .name("Add")
                .addInputs(CVar.of("a", PrimitiveType.INT))
                .instanceType(DefaultInstanceType.instance())
                .docker(DockerImageNone.instance())
                .kind(AppletKindTask.instance())
                .task(TaskDefinition.builder().name("Add").sourceCode("task Other {\n}\n").build())
                .build();
        var standalone = codeGen.standaloneWorkflow("workflow w {\n  call Add\n}", List.of(applet)).value();
        assertThat(standalone).contains("task Add {\n  input {\n    Int a\n  }\n  command {}");
    }
}
