package com.flowmable.stitcher;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * 8-connected adjacency of all pixels sharing one color.
 * <p>
 * Node iteration order is the insertion order of the builder (column-major scan) and each
 * neighbor list keeps the builder's fixed direction order, so traversals over the graph
 * are reproducible for a given image. Edges are symmetric and never self-loops.
 */
public final class AdjacencyGraph {

    private final int color;
    private final Map<Coord, List<Coord>> adjacency;

    AdjacencyGraph(int color, Map<Coord, List<Coord>> adjacency) {
        this.color = color;
        this.adjacency = adjacency;
    }

    public int color() {
        return color;
    }

    public int size() {
        return adjacency.size();
    }

    public boolean contains(Coord c) {
        return adjacency.containsKey(c);
    }

    /** Nodes in insertion order. */
    public Set<Coord> nodes() {
        return Collections.unmodifiableSet(adjacency.keySet());
    }

    public List<Coord> neighbors(Coord c) {
        List<Coord> n = adjacency.get(c);
        return n == null ? List.of() : Collections.unmodifiableList(n);
    }

    public int degree(Coord c) {
        return neighbors(c).size();
    }

    public boolean areNeighbors(Coord a, Coord b) {
        return neighbors(a).contains(b);
    }

    /**
     * Split into maximal connected subgraphs.
     * <p>
     * Components are ordered by their first node in insertion order, and each keeps the
     * insertion order of its own nodes.
     */
    public List<AdjacencyGraph> components() {
        Map<Coord, Integer> componentOf = new HashMap<>();
        int count = 0;
        for (Coord seed : adjacency.keySet()) {
            if (componentOf.containsKey(seed)) continue;
            int id = count++;
            Queue<Coord> queue = new ArrayDeque<>();
            queue.add(seed);
            componentOf.put(seed, id);
            while (!queue.isEmpty()) {
                Coord c = queue.poll();
                for (Coord n : adjacency.get(c)) {
                    if (!componentOf.containsKey(n)) {
                        componentOf.put(n, id);
                        queue.add(n);
                    }
                }
            }
        }

        List<Map<Coord, List<Coord>>> parts = new ArrayList<>(count);
        for (int i = 0; i < count; i++) parts.add(new LinkedHashMap<>());
        for (Map.Entry<Coord, List<Coord>> e : adjacency.entrySet()) {
            parts.get(componentOf.get(e.getKey())).put(e.getKey(), e.getValue());
        }

        List<AdjacencyGraph> result = new ArrayList<>(count);
        for (Map<Coord, List<Coord>> part : parts) {
            result.add(new AdjacencyGraph(color, part));
        }
        return result;
    }

    /**
     * First node with exactly one neighbor, else the node closest to the image origin
     * (smallest x² + y², earliest wins ties). Null only for an empty graph.
     */
    public Coord startingNode() {
        for (Map.Entry<Coord, List<Coord>> e : adjacency.entrySet()) {
            if (e.getValue().size() == 1) {
                return e.getKey();
            }
        }
        Coord best = null;
        long bestDist = Long.MAX_VALUE;
        for (Coord c : adjacency.keySet()) {
            long d = (long) c.x() * c.x() + (long) c.y() * c.y();
            if (d < bestDist) {
                bestDist = d;
                best = c;
            }
        }
        return best;
    }
}
