package com.hartwig.wdlc.codegen;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.hartwig.wdlc.config.CompilerOptions;
import com.hartwig.wdlc.error.FrontEndRejectionException;
import com.hartwig.wdlc.error.InternalConsistencyFault;
import com.hartwig.wdlc.error.UnsupportedDialectException;
import com.hartwig.wdlc.error.UnsupportedTypeException;
import com.hartwig.wdlc.frontend.TaskDefinition;
import com.hartwig.wdlc.ir.Applet;
import com.hartwig.wdlc.ir.AppletKind;
import com.hartwig.wdlc.ir.AppletKindNative;
import com.hartwig.wdlc.ir.AppletKindTask;
import com.hartwig.wdlc.ir.AppletKindWfFragment;
import com.hartwig.wdlc.ir.CVar;
import com.hartwig.wdlc.ir.Callable;
import com.hartwig.wdlc.ir.Workflow;
import com.hartwig.wdlc.scan.StructuralScanner;
import com.hartwig.wdlc.wdl.Dialect;
import com.hartwig.wdlc.wdl.StructType;
import com.hartwig.wdlc.wdl.WdlType;
import com.hartwig.wdlc.wdl.WdlValue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates WDL source: stubs for callables, and standalone versions of tasks and workflows that do not import
 * anything. Everything handed out as a standalone source has been accepted by the front-end first.
 */
public class WdlCodeGen {
    private static final Logger LOGGER = LoggerFactory.getLogger(WdlCodeGen.class);

    private static final Pattern CALL_LIBRARY = Pattern.compile("^(\\s*)call(\\s+)(\\w+)\\.(\\w+)(\\s+)(\\S.*)$");
    private static final Pattern CALL_LIBRARY_NO_ARGS = Pattern.compile("^(\\s*)call(\\s+)(\\w+)\\.(\\w+)(\\s*)$");

    private final Dialect dialect;
    private final Map<String, StructType> typeAliases;
    private final TypeAliasOrdering typeAliasOrdering;
    private final SourceValidator validator;
    private final StructuralScanner scanner;
    private final String placeholderFile;

    public WdlCodeGen(final Dialect dialect, final Map<String, StructType> typeAliases, final SourceValidator validator) {
        this(dialect,
                typeAliases,
                new TopologicalTypeAliasOrdering(),
                validator,
                new StructuralScanner(),
                CompilerOptions.defaults().placeholderFile());
    }

    public WdlCodeGen(final Dialect dialect, final Map<String, StructType> typeAliases, final TypeAliasOrdering typeAliasOrdering,
            final SourceValidator validator, final StructuralScanner scanner, final String placeholderFile) {
        this.dialect = dialect;
        this.typeAliases = Map.copyOf(typeAliases);
        this.typeAliasOrdering = typeAliasOrdering;
        this.validator = validator;
        this.scanner = scanner;
        this.placeholderFile = placeholderFile;
    }

    public String versionString() throws UnsupportedDialectException {
        return dialect.versionString();
    }

    public WdlValue defaultValueOf(WdlType type) throws UnsupportedTypeException {
        var generator = new DefaultValueGenerator(placeholderFile);
        var value = type.accept(generator);
        if (value.isEmpty()) {
            throw new UnsupportedTypeException(generator.unsupported());
        }
        return value.get();
    }

    /**
     * An empty task with the inputs and outputs of a callable. For example, the stub of
     * <pre>
     * task Add {
     *   input {
     *     Int a
     *     Int b
     *   }
     *   command &lt;&lt;&lt;
     *     python -c "print(${a} + ${b})"
     *   &gt;&gt;&gt;
     *   output {
     *     Int result = read_int(stdout())
     *   }
     * }
     * </pre>
     * is
     * <pre>
     * task Add {
     *   input {
     *     Int a
     *     Int b
     *   }
     *   command {}
     *   output {
     *     Int result = 0
     *   }
     * }
     * </pre>
     * Inputs and outputs are sorted by name, so the same callable always gives the same text.
     */
    public WdlCodeSnippet interfaceStub(Callable callable) throws UnsupportedTypeException, UnsupportedDialectException {
        var inputs = new ArrayList<String>();
        for (CVar input : sortedByName(callable.inputs())) {
            var declaration = "    " + input.type().typeName() + " " + input.name();
            inputs.add(input.defaultValue().map(value -> declaration + " = " + value.toWdlString()).orElse(declaration));
        }
        var outputs = new ArrayList<String>();
        for (CVar output : sortedByName(callable.outputs())) {
            outputs.add(outputDeclaration(output.name(), output.type()));
        }
        return WdlCodeSnippet.of(taskSource(callable.name(), inputs, outputs, null));
    }

    /**
     * A stub for an applet that already exists on the platform, so that WDL code can call it like any other task.
     */
    public WdlCodeSnippet nativeStub(String id, String appletName, Map<String, WdlType> inputSpec, Map<String, WdlType> outputSpec)
            throws UnsupportedTypeException, UnsupportedDialectException, FrontEndRejectionException {
        var inputs = new TreeMap<>(inputSpec).entrySet()
                .stream()
                .map(entry -> "    " + entry.getValue().typeName() + " " + entry.getKey())
                .collect(Collectors.toList());
        var outputs = new ArrayList<String>();
        for (Map.Entry<String, WdlType> output : new TreeMap<>(outputSpec).entrySet()) {
            outputs.add(outputDeclaration(output.getKey(), output.getValue()));
        }
        var metaSection = String.join("\n", "  meta {", "     type : \"native\"", "     id : \"" + id + "\"", "  }");
        var taskSource = taskSource(appletName, inputs, outputs, metaSection);

        // a task on its own is only valid with a version statement in front of it
        validator.validate(versionString() + "\n\n" + taskSource + "\n", dialect);
        LOGGER.debug("Generated stub for native applet {} ({})", appletName, id);
        return WdlCodeSnippet.of(taskSource);
    }

    /**
     * Removes the namespace from calls to imported tasks, so that a workflow can be combined with local copies of
     * them.
     * <pre>
     * call lib.Multiply as mul { ... }    becomes    call Multiply as mul { ... }
     * call lib.Hello                      becomes    call Hello
     * </pre>
     */
    public String flattenNamespacedCalls(String workflowSource) {
        return splitLines(workflowSource).stream().map(WdlCodeGen::flattenLine).collect(Collectors.joining("\n"));
    }

    private static String flattenLine(String line) {
        var withArgs = CALL_LIBRARY.matcher(line);
        var noArgs = CALL_LIBRARY_NO_ARGS.matcher(line);
        var matchesWithArgs = withArgs.matches();
        var matchesNoArgs = noArgs.matches();
        if (matchesWithArgs && matchesNoArgs) {
            throw new InternalConsistencyFault("More than one call pattern matches line: " + line);
        }
        if (matchesWithArgs) {
            return withArgs.group(1) + "call " + withArgs.group(4) + " " + withArgs.group(6);
        }
        if (matchesNoArgs) {
            return noArgs.group(1) + "call " + noArgs.group(4);
        }
        return line;
    }

    /**
     * WDL definitions of the type aliases, each struct after the structs it refers to.
     */
    public String typeAliasDefinitions() {
        return typeAliasOrdering.order(typeAliases)
                .stream()
                .map(alias -> structDefinition(alias, typeAliases.get(alias)))
                .collect(Collectors.joining("\n"));
    }

    private static String structDefinition(String alias, StructType struct) {
        var lines = new ArrayList<String>();
        lines.add("struct " + alias + " {");
        struct.fields().forEach((fieldName, type) -> lines.add("    " + type.typeName() + " " + fieldName));
        lines.add("}");
        return String.join("\n", lines);
    }

    public WdlCodeSnippet standaloneTask(String originalTaskSource) throws UnsupportedDialectException, FrontEndRejectionException {
        var source = String.join("\n", versionString() + "\n", "# struct definitions", typeAliasDefinitions(), "# Task", originalTaskSource);
        validator.validate(source, dialect);
        return WdlCodeSnippet.of(source);
    }

    /**
     * A workflow has to define every task it calls, so the calls are replaced by local definitions. A task applet keeps
     * its original text, anything else gets a stub. Calls are made local by their unqualified name, which works
     * because the workflow has to be flattenable.
     */
    public WdlCodeSnippet standaloneWorkflow(String originalWorkflowSource, List<Callable> allCalls)
            throws UnsupportedTypeException, UnsupportedDialectException, FrontEndRejectionException {
        // sorted by name, so the generated code is deterministic
        Map<String, WdlCodeSnippet> taskStubs = new TreeMap<>();
        for (Callable callable : allCalls) {
            if (taskStubs.containsKey(callable.name())) {
                continue;
            }
            var original = originalTaskSource(callable);
            if (original.isPresent()) {
                taskStubs.put(callable.name(), WdlCodeSnippet.of(original.get()));
            } else {
                taskStubs.put(callable.name(), interfaceStub(callable));
            }
        }
        var tasks = taskStubs.values().stream().map(WdlCodeSnippet::value).collect(Collectors.joining("\n\n"));
        var source = String.join("\n",
                versionString() + "\n",
                "# struct definitions",
                typeAliasDefinitions(),
                "# Task headers",
                tasks,
                "# Workflow with imports made local",
                flattenNamespacedCalls(originalWorkflowSource));
        validator.validate(source, dialect);
        LOGGER.debug("Generated standalone workflow with {} task definitions", taskStubs.size());
        return WdlCodeSnippet.of(source);
    }

    private Optional<String> originalTaskSource(Callable callable) {
        var task = callable.accept(new Callable.Visitor<Optional<TaskDefinition>>() {
            @Override
            public Optional<TaskDefinition> visitApplet(final Applet applet) {
                return applet.kind().accept(new AppletKind.Visitor<Optional<TaskDefinition>>() {
                    @Override
                    public Optional<TaskDefinition> visitNative(final AppletKindNative kind) {
                        return Optional.empty();
                    }

                    @Override
                    public Optional<TaskDefinition> visitWfFragment(final AppletKindWfFragment kind) {
                        return Optional.empty();
                    }

                    @Override
                    public Optional<TaskDefinition> visitTask(final AppletKindTask kind) {
                        return applet.task();
                    }
                });
            }

            @Override
            public Optional<TaskDefinition> visitWorkflow(final Workflow workflow) {
                return Optional.empty();
            }
        });
        var original = task.map(definition -> scanner.scanForTasks(definition.sourceCode()).get(definition.name()));
        if (task.isPresent() && original.isEmpty()) {
            LOGGER.debug("Could not recover the source of task {}, using a stub", callable.name());
        }
        return original;
    }

    private String outputDeclaration(String name, WdlType type) throws UnsupportedTypeException {
        return "    " + type.typeName() + " " + name + " = " + defaultValueOf(type).toWdlString();
    }

    private String taskSource(String name, List<String> inputs, List<String> outputs, String metaSection)
            throws UnsupportedDialectException {
        var lines = new ArrayList<String>();
        lines.add("task " + name + " {");
        if (dialect == Dialect.CWL_1_0) {
            throw new UnsupportedDialectException(String.format("Unsupported language version %s", dialect));
        }
        if (dialect.hasInputSection()) {
            lines.add("  input {");
            lines.addAll(inputs);
            lines.add("  }");
        } else {
            lines.addAll(inputs);
            lines.add("");
        }
        lines.add("  command {}");
        lines.add("  output {");
        lines.addAll(outputs);
        lines.add("  }");
        if (metaSection != null) {
            lines.add(metaSection);
        }
        lines.add("}");
        return String.join("\n", lines);
    }

    private static List<CVar> sortedByName(List<CVar> variables) {
        return variables.stream().sorted(Comparator.comparing(CVar::name)).collect(Collectors.toList());
    }

    private static List<String> splitLines(String source) {
        return List.of(source.split("\n", -1));
    }
}
