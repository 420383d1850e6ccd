package org.regram.compiler.frontend.dependency;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The output of dependency resolution.
 * Bodies are indexed by macro id; since every reference points to an earlier definition, definition
 * order is already a topological order (dependencies before dependents).
 *
 * @param bodies The resolved body of every macro, indexed by id.
 * @param edges  Every reference, in definition order and then textual order. Repeated references
 *               yield repeated edges.
 */
public record DependencyGraph(List<MacroBody> bodies, List<DependencyEdge> edges) {

    public DependencyGraph {
        bodies = List.copyOf(bodies);
        edges = List.copyOf(edges);
    }

    /**
     * Gets the macros a macro references directly.
     * @param name The referencing macro.
     * @return Distinct referenced names, in order of first reference.
     */
    public List<String> dependenciesOf(String name) {
        Set<String> result = new LinkedHashSet<>();
        for (DependencyEdge edge : edges) {
            if (edge.fromName().equals(name)) result.add(edge.toName());
        }
        return List.copyOf(result);
    }

    /**
     * Gets the macros that reference a macro directly.
     * @param name The referenced macro.
     * @return Distinct referencing names, in definition order.
     */
    public List<String> dependentsOf(String name) {
        Set<String> result = new LinkedHashSet<>();
        for (DependencyEdge edge : edges) {
            if (edge.toName().equals(name)) result.add(edge.fromName());
        }
        return List.copyOf(result);
    }
}
