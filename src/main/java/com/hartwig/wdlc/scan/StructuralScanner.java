package com.hartwig.wdlc.scan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.hartwig.wdlc.error.InternalConsistencyFault;
import com.hartwig.wdlc.frontend.CallNode;
import com.hartwig.wdlc.frontend.ConditionalNode;
import com.hartwig.wdlc.frontend.DeclarationNode;
import com.hartwig.wdlc.frontend.GraphNode;
import com.hartwig.wdlc.frontend.ScatterNode;
import com.hartwig.wdlc.frontend.WorkflowGraph;

import org.apache.commons.lang3.tuple.Pair;

/**
 * Recovers the verbatim text of top-level tasks and workflows from a source file, without parsing it.
 * <p>
 * A block starts at a line like <code>task NAME {</code> and ends at the first following line that holds nothing but a
 * closing curly bracket in the first column. Curly brackets inside the block are not balanced, so this goes wrong
 * for a nested block whose closing bracket is in the first column:
 * <pre>
 * task NAME {
 *   Int a
 * command {
 *    ls -lR
 * }
 * }
 * </pre>
 * The scanner is only used on sources that the front-end has already accepted, to keep the original text of a
 * task or workflow.
 */
public class StructuralScanner {
    private static final Pattern TASK_START = Pattern.compile("^(\\s*)task(\\s+)(\\w+)(\\s*)\\{(\\s*)$");
    private static final Pattern WORKFLOW_START = Pattern.compile("^(\\s*)workflow(\\s+)(\\w+)(\\s*)\\{(\\s*)$");
    private static final Pattern ELEMENT_END = Pattern.compile("^}(\\s)*$");

    /**
     * Maps the name of every top-level task in the source to its text. Empty if there are no tasks.
     */
    public Map<String, String> scanForTasks(String sourceCode) {
        var lines = splitLines(sourceCode);
        var taskDir = new LinkedHashMap<String, String>();
        while (!lines.isEmpty()) {
            var element = findElement(lines, TASK_START);
            if (element.isEmpty()) {
                break;
            }
            taskDir.put(element.get().name(), element.get().text());
            lines = element.get().remainingLines();
        }
        return taskDir;
    }

    /**
     * The name and text of the first workflow in the source. A source file holds at most one workflow.
     */
    public Optional<Pair<String, String>> scanForWorkflow(String sourceCode) {
        return findElement(splitLines(sourceCode), WORKFLOW_START).map(element -> Pair.of(element.name(), element.text()));
    }

    /**
     * Names of the calls of a workflow, ordered by the line they appear on. Calls in scatter and conditional blocks are
     * included, calls inside sub-workflows are not. Namespaced calls such as {@code lib.Multiply} are reduced to their
     * unqualified name.
     */
    public List<String> scanForCalls(WorkflowGraph graph, String workflowSource) {
        Map<String, Integer> callToSourceLine = new LinkedHashMap<>();
        for (CallNode call : callsNotInSubWorkflows(graph)) {
            var line = call.sourceLine()
                    .orElseThrow(() -> new InternalConsistencyFault(String.format("No source line for call %s", call.localName())));
            callToSourceLine.put(unqualifiedName(call.localName()), line);
        }
        return callToSourceLine.entrySet()
                .stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().thenComparing(Map.Entry.comparingByKey()))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    private static Optional<ScannedElement> findElement(List<String> lines, Pattern startLine) {
        String name = null;
        var elementLines = new ArrayList<String>();
        for (int i = 0; i < lines.size(); i++) {
            var line = lines.get(i);
            if (name == null) {
                var matcher = startLine.matcher(line);
                if (matcher.matches()) {
                    name = matcher.group(3);
                    elementLines.add(line);
                }
            } else if (ELEMENT_END.matcher(line).matches()) {
                elementLines.add(line);
                return Optional.of(ImmutableScannedElement.builder()
                        .name(name)
                        .text(String.join("\n", elementLines))
                        .remainingLines(lines.subList(i + 1, lines.size()))
                        .build());
            } else {
                elementLines.add(line);
            }
        }
        return Optional.empty();
    }

    private static List<CallNode> callsNotInSubWorkflows(WorkflowGraph graph) {
        var calls = new ArrayList<CallNode>();
        for (GraphNode node : graph.nodes()) {
            node.accept(new GraphNode.Visitor<Void>() {
                @Override
                public Void visitCall(final CallNode call) {
                    calls.add(call);
                    return null;
                }

                @Override
                public Void visitScatter(final ScatterNode scatter) {
                    calls.addAll(callsNotInSubWorkflows(scatter.innerGraph()));
                    return null;
                }

                @Override
                public Void visitConditional(final ConditionalNode conditional) {
                    calls.addAll(callsNotInSubWorkflows(conditional.innerGraph()));
                    return null;
                }

                @Override
                public Void visitDeclaration(final DeclarationNode declaration) {
                    return null;
                }
            });
        }
        return calls;
    }

    static String unqualifiedName(String name) {
        var index = name.lastIndexOf('.');
        return index < 0 ? name : name.substring(index + 1);
    }

    private static List<String> splitLines(String sourceCode) {
        return Arrays.asList(sourceCode.split("\n"));
    }
}
