package com.flowmable.stitcher;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Backtracking search for a walk that visits every node of a connected component exactly once.
 * <p>
 * Candidates are tried in the component's neighbor order. Each forward move counts as one step;
 * the search gives up once {@code stepLimit} steps have been taken.
 */
final class SelfAvoidingWalk {

    /**
     * @param walk     the complete walk, or null if none was found
     * @param longest  longest partial walk seen
     * @param steps    forward moves taken
     * @param limitHit true when the search stopped on the step limit rather than exhausting the graph
     */
    record Result(List<Coord> walk, List<Coord> longest, long steps, boolean limitHit) {

        boolean complete() {
            return walk != null;
        }
    }

    private SelfAvoidingWalk() {}

    static Result search(AdjacencyGraph component, Coord start, long stepLimit) {
        int n = component.size();
        List<Coord> path = new ArrayList<>(n);
        Set<Coord> onPath = new HashSet<>();
        int[] cursor = new int[n];
        path.add(start);
        onPath.add(start);
        List<Coord> longest = List.of(start);
        long steps = 0;

        while (true) {
            if (path.size() == n) {
                return new Result(List.copyOf(path), List.copyOf(path), steps, false);
            }
            int depth = path.size() - 1;
            List<Coord> neighbors = component.neighbors(path.get(depth));
            Coord next = null;
            while (cursor[depth] < neighbors.size()) {
                Coord candidate = neighbors.get(cursor[depth]++);
                if (!onPath.contains(candidate)) {
                    next = candidate;
                    break;
                }
            }

            if (next != null) {
                if (steps >= stepLimit) {
                    return new Result(null, longest, steps, true);
                }
                steps++;
                path.add(next);
                onPath.add(next);
                cursor[depth + 1] = 0;
                if (path.size() > longest.size()) {
                    longest = List.copyOf(path);
                }
            } else {
                if (depth == 0) {
                    return new Result(null, longest, steps, false);
                }
                onPath.remove(path.remove(depth));
            }
        }
    }
}
