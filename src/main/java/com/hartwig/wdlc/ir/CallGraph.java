package com.hartwig.wdlc.ir;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.EdgeReversedGraph;
import org.jgrapht.nio.Attribute;
import org.jgrapht.nio.DefaultAttribute;
import org.jgrapht.nio.dot.DOTExporter;
import org.jgrapht.traverse.TopologicalOrderIterator;

/**
 * Which callable calls which, over a bundle and its sub-bundles. Workflow fragments point at the callables in their
 * call map, workflows at their stages.
 */
public class CallGraph {
    private final DefaultDirectedGraph<String, NamedEdge> graph;

    private CallGraph(final DefaultDirectedGraph<String, NamedEdge> graph) {
        this.graph = graph;
    }

    public static CallGraph of(Bundle bundle, List<Bundle> subBundles) {
        var graph = new DefaultDirectedGraph<String, NamedEdge>(NamedEdge.class);
        var bundles = withSubBundles(bundle, subBundles);
        for (Bundle current : bundles) {
            current.allCallables().keySet().forEach(graph::addVertex);
        }
        for (Bundle current : bundles) {
            for (Callable callable : current.allCallables().values()) {
                for (Map.Entry<String, String> call : callees(callable).entrySet()) {
                    if (graph.containsVertex(call.getValue()) && !graph.containsEdge(callable.name(), call.getValue())) {
                        graph.addEdge(callable.name(), call.getValue(), new NamedEdge(call.getKey()));
                    }
                }
            }
        }
        return new CallGraph(graph);
    }

    public Set<String> callees(String callableName) {
        var callees = new TreeSet<String>();
        graph.outgoingEdgesOf(callableName).forEach(edge -> callees.add(graph.getEdgeTarget(edge)));
        return callees;
    }

    /**
     * Callables ordered so that each comes after everything it calls. Ties are broken by name.
     */
    public List<String> dependencyOrder() {
        var order = new ArrayList<String>();
        var iterator = new TopologicalOrderIterator<>(new EdgeReversedGraph<>(graph), Comparator.<String>naturalOrder());
        iterator.forEachRemaining(order::add);
        return order;
    }

    public String toDotFormat() {
        var exporter = new DOTExporter<String, NamedEdge>();
        exporter.setVertexAttributeProvider((v) -> {
            Map<String, Attribute> map = new LinkedHashMap<>();
            map.put("label", DefaultAttribute.createAttribute(v));
            return map;
        });
        exporter.setEdgeAttributeProvider((e) -> {
            Map<String, Attribute> map = new LinkedHashMap<>();
            map.put("label", DefaultAttribute.createAttribute(e.name()));
            return map;
        });
        var writer = new StringWriter();
        exporter.exportGraph(graph, writer);
        return writer.toString();
    }

    static List<Bundle> withSubBundles(Bundle bundle, List<Bundle> subBundles) {
        var bundles = new ArrayList<Bundle>();
        bundles.add(bundle);
        bundles.addAll(subBundles);
        return bundles;
    }

    /**
     * Call name to callee of a workflow fragment applet, empty for any other callable.
     */
    static Map<String, String> fragmentCalls(Callable callable) {
        return callable.accept(new Callable.Visitor<Map<String, String>>() {
            @Override
            public Map<String, String> visitApplet(final Applet applet) {
                return applet.kind().accept(new AppletKind.Visitor<Map<String, String>>() {
                    @Override
                    public Map<String, String> visitNative(final AppletKindNative kind) {
                        return Map.of();
                    }

                    @Override
                    public Map<String, String> visitWfFragment(final AppletKindWfFragment kind) {
                        return kind.calls();
                    }

                    @Override
                    public Map<String, String> visitTask(final AppletKindTask kind) {
                        return Map.of();
                    }
                });
            }

            @Override
            public Map<String, String> visitWorkflow(final Workflow workflow) {
                return Map.of();
            }
        });
    }

    private static Map<String, String> callees(Callable callable) {
        return callable.accept(new Callable.Visitor<Map<String, String>>() {
            @Override
            public Map<String, String> visitApplet(final Applet applet) {
                return fragmentCalls(applet);
            }

            @Override
            public Map<String, String> visitWorkflow(final Workflow workflow) {
                Map<String, String> stages = new LinkedHashMap<>();
                workflow.stages().forEach(stage -> stages.put(stage, stage));
                return stages;
            }
        });
    }
}
