package com.architecture.memory.inevitability.service.scm;

import com.architecture.memory.inevitability.exception.GraphInconsistencyException;
import com.architecture.memory.inevitability.model.graph.InfraEdge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Verifies that the enabling (non-control) subgraph is a DAG.
 *
 * Uses Kahn's algorithm for the topological order. When nodes remain unsorted, an
 * iterative DFS over the remaining nodes reconstructs one offending cycle so the error can
 * name it.
 */
@Component
@Slf4j
public class AcyclicityChecker {

    /**
     * Topological order of the given nodes over the non-control edges.
     *
     * @throws GraphInconsistencyException if the enabling subgraph has a cycle
     */
    public List<String> topologicalOrder(Collection<String> nodeIds, Collection<InfraEdge> edges) {
        Map<String, SortedSet<String>> adjacency = buildAdjacency(nodeIds, edges);

        Map<String, Integer> inDegree = new TreeMap<>();
        adjacency.keySet().forEach(id -> inDegree.put(id, 0));
        adjacency.values().forEach(targets -> targets.forEach(t -> inDegree.merge(t, 1, Integer::sum)));

        // Sorted ready set keeps the order deterministic
        PriorityQueue<String> ready = new PriorityQueue<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) ready.add(id);
        });

        List<String> order = new ArrayList<>(adjacency.size());
        while (!ready.isEmpty()) {
            String current = ready.poll();
            order.add(current);
            for (String next : adjacency.get(current)) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }

        if (order.size() < adjacency.size()) {
            Set<String> remaining = new TreeSet<>(adjacency.keySet());
            remaining.removeAll(order);
            List<String> cycle = findCycle(adjacency, remaining);
            log.warn("Causal graph contains a non-control cycle: {}", String.join(" -> ", cycle));
            throw new GraphInconsistencyException(
                    "Causal graph contains a cycle over enabling edges: " + String.join(" -> ", cycle), cycle);
        }
        return order;
    }

    public boolean isAcyclic(Collection<String> nodeIds, Collection<InfraEdge> edges) {
        try {
            topologicalOrder(nodeIds, edges);
            return true;
        } catch (GraphInconsistencyException e) {
            return false;
        }
    }

    private Map<String, SortedSet<String>> buildAdjacency(Collection<String> nodeIds, Collection<InfraEdge> edges) {
        Map<String, SortedSet<String>> adjacency = new TreeMap<>();
        nodeIds.forEach(id -> adjacency.put(id, new TreeSet<>()));
        for (InfraEdge edge : edges) {
            if (edge.isBlocking()) continue;
            adjacency.computeIfAbsent(edge.getSource(), k -> new TreeSet<>()).add(edge.getTarget());
            adjacency.computeIfAbsent(edge.getTarget(), k -> new TreeSet<>());
        }
        return adjacency;
    }

    /**
     * Iterative DFS restricted to nodes left over by Kahn's algorithm. Every such node lies on
     * or behind a cycle, so a back edge is always found.
     */
    private List<String> findCycle(Map<String, SortedSet<String>> adjacency, Set<String> remaining) {
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        Map<String, String> parent = new HashMap<>();

        for (String start : remaining) {
            if (visited.contains(start)) continue;

            Deque<Iterator<String>> iterators = new ArrayDeque<>();
            Deque<String> path = new ArrayDeque<>();
            visited.add(start);
            onStack.add(start);
            path.push(start);
            iterators.push(adjacency.get(start).iterator());

            while (!path.isEmpty()) {
                String node = path.peek();
                Iterator<String> it = iterators.peek();
                if (it.hasNext()) {
                    String neighbor = it.next();
                    if (!remaining.contains(neighbor)) continue;
                    if (onStack.contains(neighbor)) {
                        return reconstructCycle(neighbor, node, parent);
                    }
                    if (visited.add(neighbor)) {
                        parent.put(neighbor, node);
                        onStack.add(neighbor);
                        path.push(neighbor);
                        iterators.push(adjacency.get(neighbor).iterator());
                    }
                } else {
                    onStack.remove(node);
                    path.pop();
                    iterators.pop();
                }
            }
        }
        return List.copyOf(remaining);
    }

    private List<String> reconstructCycle(String start, String end, Map<String, String> parent) {
        List<String> cycle = new ArrayList<>();
        cycle.add(end);
        String current = end;
        while (!current.equals(start)) {
            current = parent.get(current);
            cycle.add(current);
        }
        Collections.reverse(cycle);
        cycle.add(start); // close the cycle
        return cycle;
    }
}
