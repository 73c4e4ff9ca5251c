package com.hartwig.wdlc;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import com.hartwig.wdlc.codegen.SourceValidator;
import com.hartwig.wdlc.codegen.TopologicalTypeAliasOrdering;
import com.hartwig.wdlc.codegen.WdlCodeGen;
import com.hartwig.wdlc.codegen.WdlCodeSnippet;
import com.hartwig.wdlc.config.CompilerOptions;
import com.hartwig.wdlc.error.MissingElementException;
import com.hartwig.wdlc.error.WdlcException;
import com.hartwig.wdlc.frontend.LanguageFrontEnd;
import com.hartwig.wdlc.frontend.LanguageFrontEnds;
import com.hartwig.wdlc.frontend.SourceCallable;
import com.hartwig.wdlc.frontend.TaskDefinition;
import com.hartwig.wdlc.frontend.WorkflowDefinition;
import com.hartwig.wdlc.imports.ResolvedProject;
import com.hartwig.wdlc.imports.SourceResolution;
import com.hartwig.wdlc.ir.Callable;
import com.hartwig.wdlc.scan.StructuralScanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the compiler core: resolves a main file with its imports, and regenerates standalone sources for
 * the compiled callables.
 */
public class WdlCompiler {
    private static final Logger LOGGER = LoggerFactory.getLogger(WdlCompiler.class);

    private final LanguageFrontEnds frontEnds;
    private final CompilerOptions options;
    private final SourceResolution sourceResolution;
    private final StructuralScanner scanner = new StructuralScanner();

    public WdlCompiler(final List<LanguageFrontEnd> frontEnds, final CompilerOptions options) {
        this(new LanguageFrontEnds(frontEnds), options);
    }

    private WdlCompiler(final LanguageFrontEnds frontEnds, final CompilerOptions options) {
        this(frontEnds, options, new SourceResolution(frontEnds, options));
    }

    public WdlCompiler(final LanguageFrontEnds frontEnds, final CompilerOptions options, final SourceResolution sourceResolution) {
        this.frontEnds = frontEnds;
        this.options = options;
        this.sourceResolution = sourceResolution;
    }

    public ResolvedProject resolve(Path mainFile) throws WdlcException, IOException {
        return sourceResolution.resolve(mainFile);
    }

    public WdlCodeGen codeGen(ResolvedProject project) {
        return new WdlCodeGen(project.dialect(),
                project.allTypeAliases(),
                new TopologicalTypeAliasOrdering(),
                new SourceValidator(frontEnds),
                scanner,
                options.placeholderFile());
    }

    /**
     * Names of the calls in the main workflow of the project, in source order.
     */
    public List<String> callOrder(ResolvedProject project) throws MissingElementException {
        var workflow = mainWorkflow(project);
        return scanner.scanForCalls(workflow.graph(), project.mainSource());
    }

    /**
     * The main workflow of the project with its calls replaced by local tasks, so it can be distributed on its own.
     */
    public WdlCodeSnippet standaloneWorkflow(ResolvedProject project, List<Callable> calls) throws WdlcException {
        var workflow = mainWorkflow(project);
        var workflowSource = scanner.scanForWorkflow(project.mainSource())
                .orElseThrow(() -> new MissingElementException(String.format("No workflow found in '%s'", project.mainFile())));
        LOGGER.info("Generating standalone workflow {} with {} calls", workflow.name(), calls.size());
        return codeGen(project).standaloneWorkflow(workflowSource.getRight(), calls);
    }

    private static WorkflowDefinition mainWorkflow(ResolvedProject project) throws MissingElementException {
        var primary = project.primaryBundle().primaryCallable();
        var workflow = primary.map(callable -> callable.accept(new SourceCallable.Visitor<WorkflowDefinition>() {
            @Override
            public WorkflowDefinition visitTask(final TaskDefinition task) {
                return null;
            }

            @Override
            public WorkflowDefinition visitWorkflow(final WorkflowDefinition definition) {
                return definition;
            }
        }));
        return workflow.orElseThrow(() -> new MissingElementException(String.format("'%s' has no workflow", project.mainFile())));
    }
}
