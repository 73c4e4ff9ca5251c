package com.hartwig.wdlc.codegen;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.hartwig.wdlc.error.InternalConsistencyFault;
import com.hartwig.wdlc.wdl.ArrayType;
import com.hartwig.wdlc.wdl.MapType;
import com.hartwig.wdlc.wdl.ObjectType;
import com.hartwig.wdlc.wdl.OptionalType;
import com.hartwig.wdlc.wdl.PairType;
import com.hartwig.wdlc.wdl.StructType;
import com.hartwig.wdlc.wdl.WdlTypeVisitor;

import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.TopologicalOrderIterator;

/**
 * Topological sort of the struct dependency graph. Structs without a dependency between them are ordered by name.
 */
public class TopologicalTypeAliasOrdering implements TypeAliasOrdering {

    @Override
    public List<String> order(Map<String, StructType> typeAliases) {
        var graph = new DefaultDirectedGraph<String, DefaultEdge>(DefaultEdge.class);
        typeAliases.keySet().forEach(graph::addVertex);
        try {
            for (var alias : typeAliases.entrySet()) {
                for (String referenced : referencedStructs(alias.getValue())) {
                    aliasOf(referenced, typeAliases).filter(key -> !key.equals(alias.getKey()))
                            .ifPresent(key -> graph.addEdge(key, alias.getKey()));
                }
            }
            var ordered = new ArrayList<String>();
            var iterator = new TopologicalOrderIterator<>(graph, Comparator.<String>naturalOrder());
            while (iterator.hasNext()) {
                ordered.add(iterator.next());
            }
            return ordered;
        } catch (IllegalArgumentException e) {
            throw new InternalConsistencyFault("Struct definitions refer to each other in a cycle: " + typeAliases.keySet());
        }
    }

    /**
     * The alias a struct reference resolves to: the alias with that exact name, otherwise the first alias (by name) whose struct
     * carries that name.
     */
    private static Optional<String> aliasOf(String structName, Map<String, StructType> typeAliases) {
        if (typeAliases.containsKey(structName)) {
            return Optional.of(structName);
        }
        return typeAliases.entrySet()
                .stream()
                .filter(alias -> alias.getValue().name().equals(structName))
                .map(Map.Entry::getKey)
                .sorted()
                .findFirst();
    }

    private static Set<String> referencedStructs(StructType struct) {
        var names = new LinkedHashSet<String>();
        var collector = new StructNameCollector(names);
        struct.fields().values().forEach(type -> type.accept(collector));
        return names;
    }

    private static class StructNameCollector implements WdlTypeVisitor<Void> {
        private final Set<String> names;

        StructNameCollector(final Set<String> names) {
            this.names = names;
        }

        @Override
        public Void visitBoolean() {
            return null;
        }

        @Override
        public Void visitInt() {
            return null;
        }

        @Override
        public Void visitFloat() {
            return null;
        }

        @Override
        public Void visitString() {
            return null;
        }

        @Override
        public Void visitFile() {
            return null;
        }

        @Override
        public Void visitOptional(final OptionalType type) {
            return type.inner().accept(this);
        }

        @Override
        public Void visitArray(final ArrayType type) {
            return type.element().accept(this);
        }

        @Override
        public Void visitMap(final MapType type) {
            type.keyType().accept(this);
            return type.valueType().accept(this);
        }

        @Override
        public Void visitPair(final PairType type) {
            type.left().accept(this);
            return type.right().accept(this);
        }

        @Override
        public Void visitStruct(final StructType type) {
            names.add(type.name());
            return null;
        }

        @Override
        public Void visitObject(final ObjectType type) {
            return null;
        }
    }
}
