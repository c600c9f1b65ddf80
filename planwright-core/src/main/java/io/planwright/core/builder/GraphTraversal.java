package io.planwright.core.builder;

import io.planwright.core.plan.ExecutableEdge;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Predicate;

/// Breadth-first traversal shared by the constructors.
///
/// Parallel branch discovery and loop body discovery differ only in where they stop, so
/// both go through {@link #bfs} with their own `shouldVisit` predicate.
final class GraphTraversal {

    private GraphTraversal() {}

    /// Visits nodes breadth-first from the given starts.
    ///
    /// Start nodes are always visited (once). A neighbor is visited only if it has not
    /// been visited yet and `shouldVisit.test(from, to)` holds.
    ///
    /// @param starts start node ids in priority order, not null
    /// @param successors returns the ordered successors of a node, never null
    /// @param shouldVisit predicate over `(from, to)` pairs, not null
    /// @return visited ids in visit order, never null
    static List<String> bfs(
            Collection<String> starts,
            Function<String, ? extends Collection<String>> successors,
            BiPredicate<String, String> shouldVisit) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String start : starts) {
            if (visited.add(start)) {
                queue.add(start);
            }
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : successors.apply(current)) {
                if (!visited.contains(next) && shouldVisit.test(current, next)) {
                    visited.add(next);
                    queue.add(next);
                }
            }
        }
        return new ArrayList<>(visited);
    }

    /// Builds an ordered `source → [targets]` map from edges whose ends both pass the filter.
    ///
    /// @param edges edges in list order, not null
    /// @param include node filter applied to both ends, not null
    /// @return adjacency map without duplicate targets, never null
    static Map<String, List<String>> outgoing(
            Collection<ExecutableEdge> edges, Predicate<String> include) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (ExecutableEdge edge : edges) {
            if (include.test(edge.source()) && include.test(edge.target())) {
                List<String> targets =
                        adjacency.computeIfAbsent(edge.source(), k -> new ArrayList<>());
                if (!targets.contains(edge.target())) {
                    targets.add(edge.target());
                }
            }
        }
        return adjacency;
    }

    static Set<String> orderedCopy(Set<String> source) {
        if (source == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(source));
    }
}
