package ai.latex.translator.project;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Inclusion edges between the files of a project. Only dependencies resolving to a discovered file
 * become edges.
 */
public final class DependencyGraph {

    private final Map<String, List<String>> edges;
    private final Map<String, Set<String>> reverseEdges;

    private DependencyGraph(Map<String, List<String>> edges) {
        this.edges = edges;
        Map<String, Set<String>> reverse = new LinkedHashMap<>();
        edges.keySet().forEach(node -> reverse.put(node, new LinkedHashSet<>()));
        edges.forEach((node, targets) -> targets.forEach(target -> reverse.get(target).add(node)));
        this.reverseEdges = reverse;
    }

    /**
     * Builds the graph over {@code files}, iterated in discovery order.
     */
    public static DependencyGraph build(Map<String, LatexFile> files) {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        for (LatexFile file : files.values()) {
            List<String> targets = new ArrayList<>();
            for (String dependency : file.dependencies()) {
                if (files.containsKey(dependency) && !targets.contains(dependency)) {
                    targets.add(dependency);
                }
            }
            edges.put(file.path(), List.copyOf(targets));
        }
        return new DependencyGraph(Collections.unmodifiableMap(edges));
    }

    public Set<String> nodes() {
        return edges.keySet();
    }

    public Map<String, List<String>> asMap() {
        return edges;
    }

    public List<String> dependenciesOf(String path) {
        return edges.getOrDefault(path, List.of());
    }

    public Set<String> dependentsOf(String path) {
        return Collections.unmodifiableSet(reverseEdges.getOrDefault(path, Set.of()));
    }

    /**
     * Whether {@code to} can be reached from {@code from} by following one or more edges.
     */
    public boolean reaches(String from, String to) {
        Set<String> seen = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>(dependenciesOf(from));
        while (!pending.isEmpty()) {
            String node = pending.pop();
            if (node.equals(to)) {
                return true;
            }
            if (seen.add(node)) {
                pending.addAll(dependenciesOf(node));
            }
        }
        return false;
    }

    /**
     * Largest number of direct dependencies of any file.
     */
    public int maxDirectDependencies() {
        return edges.values().stream().mapToInt(List::size).max().orElse(0);
    }

    /**
     * Depth-first post-order over every node in insertion order, so each file follows the files it
     * includes. A node met again while still on the traversal stack closes a cycle: it is skipped and
     * the cycle recorded.
     */
    public CompilationPlan compilationPlan() {
        List<String> order = new ArrayList<>();
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        List<String> stack = new ArrayList<>();
        for (String node : edges.keySet()) {
            visit(node, visited, stack, order, cycles);
        }
        return new CompilationPlan(order, cycles);
    }

    private void visit(String node, Set<String> visited, List<String> stack, List<String> order,
                       List<List<String>> cycles) {
        int onStack = stack.indexOf(node);
        if (onStack >= 0) {
            List<String> cycle = new ArrayList<>(stack.subList(onStack, stack.size()));
            cycle.add(node);
            cycles.add(cycle);
            return;
        }
        if (visited.contains(node)) {
            return;
        }
        stack.add(node);
        for (String dependency : dependenciesOf(node)) {
            visit(dependency, visited, stack, order, cycles);
        }
        stack.remove(stack.size() - 1);
        visited.add(node);
        order.add(node);
    }
}
