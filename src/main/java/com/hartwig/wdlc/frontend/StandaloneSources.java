package com.hartwig.wdlc.frontend;

import java.util.List;

import com.hartwig.wdlc.error.FrontEndRejectionException;
import com.hartwig.wdlc.error.MissingElementException;
import com.hartwig.wdlc.error.WdlcException;

/**
 * Analyzes sources that do not import anything, such as the standalone files generated by the compiler.
 */
public class StandaloneSources {
    private final LanguageFrontEnds frontEnds;

    public StandaloneSources(final LanguageFrontEnds frontEnds) {
        this.frontEnds = frontEnds;
    }

    public SourceBundle analyze(String source) throws WdlcException {
        var frontEnd = frontEnds.forDialect(frontEnds.detect(source));
        var result = frontEnd.analyze(source, List.of());
        if (!result.isValid()) {
            throw new FrontEndRejectionException("Standalone source is not valid", result.errors());
        }
        return result.bundle().orElseThrow();
    }

    /**
     * The workflow of a source, which has to be its primary callable.
     */
    public WorkflowDefinition parseWorkflow(String source) throws WdlcException {
        var bundle = analyze(source);
        var primary = bundle.primaryCallable().orElseThrow(() -> new MissingElementException("Could not find the workflow in the source"));
        var workflow = primary.accept(new SourceCallable.Visitor<WorkflowDefinition>() {
            @Override
            public WorkflowDefinition visitTask(final TaskDefinition task) {
                return null;
            }

            @Override
            public WorkflowDefinition visitWorkflow(final WorkflowDefinition definition) {
                return definition;
            }
        });
        if (workflow == null) {
            throw new MissingElementException(String.format("Primary callable '%s' is not a workflow", primary.name()));
        }
        return workflow;
    }

    public TaskDefinition parseTask(String source) throws WdlcException {
        return mainTask(analyze(source));
    }

    /**
     * The only task of a bundle: its primary callable, or else the single callable it holds.
     */
    public static TaskDefinition mainTask(SourceBundle bundle) throws MissingElementException {
        var primary = bundle.primaryCallable().map(StandaloneSources::asTask).orElse(null);
        if (primary != null) {
            return primary;
        }
        if (bundle.allCallables().size() != 1) {
            throw new MissingElementException("Source must contain exactly one task, found " + bundle.allCallables().size()
                    + " callables");
        }
        var task = asTask(bundle.allCallables().values().iterator().next());
        if (task == null) {
            throw new MissingElementException("Cannot find a task inside the source");
        }
        return task;
    }

    private static TaskDefinition asTask(SourceCallable callable) {
        return callable.accept(new SourceCallable.Visitor<TaskDefinition>() {
            @Override
            public TaskDefinition visitTask(final TaskDefinition task) {
                return task;
            }

            @Override
            public TaskDefinition visitWorkflow(final WorkflowDefinition workflow) {
                return null;
            }
        });
    }
}
