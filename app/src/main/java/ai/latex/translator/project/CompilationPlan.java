package ai.latex.translator.project;

import java.util.List;

/**
 * Dependency-first file order together with the cycles met while computing it. Each cycle lists its
 * files in traversal order and repeats the first file at the end.
 */
public record CompilationPlan(List<String> order, List<List<String>> cycles) {

    public CompilationPlan {
        order = List.copyOf(order);
        cycles = cycles.stream().map(List::copyOf).toList();
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }
}
