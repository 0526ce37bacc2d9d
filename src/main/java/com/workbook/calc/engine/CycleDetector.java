package com.workbook.calc.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import com.workbook.calc.node.CalculationField;

import lombok.extern.log4j.Log4j2;

/**
 * Cycle detection and depth assignment over the calculation arena.
 *
 * <p>
 * Per node the traversal moves {@code unvisited -> on path -> finalized}. A
 * depth-first visit starts from every calculation not yet finalized. Reaching a
 * node that is on the active path closes a cycle: the path from that node's
 * first occurrence to the current node is recorded, every member is flagged
 * circular, and the edge contributes a sentinel depth of 0. Finalized nodes are
 * memoized and never visited again, so the walk terminates on any graph.
 *
 * <p>
 * A memoized walk can miss cycle members: a node whose only way back into a
 * cycle runs through an already finalized node never sees it on the active
 * path. When any cycle is found, every strongly connected component holding a
 * cycle is therefore flagged as a whole, and depths are then settled over the
 * remaining acyclic nodes with circular dependencies counted as 0. Circular
 * nodes report depth 0.
 *
 * <p>
 * Every pass runs on an explicit stack of {@link Frame}s, so chain length is
 * bounded by heap, not by the thread stack. All traversal state lives in a
 * per-call {@link Traversal}; the detector is stateless and re-entrant.
 */
@Log4j2
public final class CycleDetector {

    /** Cycles found, each an ordered sequence of ids that starts and ends at the same node. */
    public record Result(List<List<Integer>> cycles) {
    }

    private CycleDetector() {
        // Utility class
    }

    public static Result detect(List<CalculationField> arena) {
        Traversal t = new Traversal(arena);
        for (int id = 0; id < arena.size(); id++)
            if (!t.finalized[id])
                t.visit(id);

        if (!t.cycles.isEmpty()) {
            flagCyclicComponents(arena);
            settleDepths(arena);
        }
        for (CalculationField calc : arena)
            if (calc.isCircular())
                calc.setDepth(0);
        return new Result(Collections.unmodifiableList(t.cycles));
    }

    /** One node being expanded: its remaining dependencies and the deepest seen so far. */
    private static final class Frame {
        final int id;
        final Iterator<Integer> deps;
        int maxChildDepth = -1;

        Frame(CalculationField node) {
            this.id = node.id();
            this.deps = node.dependsOnCalcs().iterator();
        }
    }

    private static final class Traversal {
        final List<CalculationField> arena;
        final boolean[] finalized;
        final boolean[] onPath;
        final List<Integer> path = new ArrayList<>();
        final List<List<Integer>> cycles = new ArrayList<>();
        final Set<List<Integer>> seenCycles = new HashSet<>();

        Traversal(List<CalculationField> arena) {
            this.arena = arena;
            this.finalized = new boolean[arena.size()];
            this.onPath = new boolean[arena.size()];
        }

        void visit(int start) {
            Deque<Frame> stack = new ArrayDeque<>();
            enter(start, stack);
            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                if (top.deps.hasNext()) {
                    int dep = top.deps.next();
                    if (onPath[dep]) {
                        recordCycle(dep);
                        top.maxChildDepth = Math.max(top.maxChildDepth, 0);
                    } else if (finalized[dep]) {
                        top.maxChildDepth = Math.max(top.maxChildDepth, Math.max(arena.get(dep).depth(), 0));
                    } else {
                        enter(dep, stack);
                    }
                    continue;
                }

                stack.pop();
                path.remove(path.size() - 1);
                onPath[top.id] = false;
                finalized[top.id] = true;
                CalculationField node = arena.get(top.id);
                node.setDepth(top.maxChildDepth + 1);
                if (log.isDebugEnabled())
                    log.debug("Finalized {} at depth {}", node.displayName(), node.depth());
                Frame parent = stack.peek();
                if (parent != null)
                    parent.maxChildDepth = Math.max(parent.maxChildDepth, node.depth());
            }
        }

        private void enter(int id, Deque<Frame> stack) {
            onPath[id] = true;
            path.add(id);
            stack.push(new Frame(arena.get(id)));
        }

        private void recordCycle(int id) {
            List<Integer> cycle = new ArrayList<>(path.subList(path.indexOf(id), path.size()));
            cycle.add(id);
            for (int member : cycle)
                arena.get(member).markCircular();
            if (seenCycles.add(canonical(cycle))) {
                cycles.add(Collections.unmodifiableList(cycle));
                log.debug("Cycle closed at {}", arena.get(id).displayName());
            }
        }

        /** Rotation starting at the smallest id, closing element dropped. */
        private static List<Integer> canonical(List<Integer> cycle) {
            List<Integer> open = cycle.subList(0, cycle.size() - 1);
            int start = open.indexOf(Collections.min(open));
            List<Integer> rotated = new ArrayList<>(open.size());
            for (int i = 0; i < open.size(); i++)
                rotated.add(open.get((start + i) % open.size()));
            return rotated;
        }
    }

    /** Tarjan's algorithm; flags members of every component that contains a cycle. */
    private static void flagCyclicComponents(List<CalculationField> arena) {
        int n = arena.size();
        int[] index = new int[n];
        int[] low = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(index, -1);
        int counter = 0;
        Deque<Integer> component = new ArrayDeque<>();
        Deque<Frame> frames = new ArrayDeque<>();

        for (int root = 0; root < n; root++) {
            if (index[root] >= 0)
                continue;
            index[root] = low[root] = counter++;
            component.push(root);
            onStack[root] = true;
            frames.push(new Frame(arena.get(root)));

            while (!frames.isEmpty()) {
                Frame top = frames.peek();
                int v = top.id;
                if (top.deps.hasNext()) {
                    int w = top.deps.next();
                    if (index[w] < 0) {
                        index[w] = low[w] = counter++;
                        component.push(w);
                        onStack[w] = true;
                        frames.push(new Frame(arena.get(w)));
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], index[w]);
                    }
                    continue;
                }

                frames.pop();
                Frame parent = frames.peek();
                if (parent != null)
                    low[parent.id] = Math.min(low[parent.id], low[v]);
                if (low[v] != index[v])
                    continue;

                List<Integer> members = new ArrayList<>();
                int w;
                do {
                    w = component.pop();
                    onStack[w] = false;
                    members.add(w);
                } while (w != v);
                boolean cyclic = members.size() > 1 || arena.get(v).dependsOnCalcs().contains(v);
                if (cyclic)
                    for (int member : members)
                        arena.get(member).markCircular();
            }
        }
    }

    /**
     * Recomputes depth of non-circular nodes. Once cyclic components are
     * flagged, the dependency subgraph of the remaining nodes is acyclic.
     */
    private static void settleDepths(List<CalculationField> arena) {
        boolean[] settled = new boolean[arena.size()];
        Deque<Frame> frames = new ArrayDeque<>();
        for (int root = 0; root < arena.size(); root++) {
            if (settled[root] || arena.get(root).isCircular())
                continue;
            frames.push(new Frame(arena.get(root)));
            while (!frames.isEmpty()) {
                Frame top = frames.peek();
                if (top.deps.hasNext()) {
                    CalculationField dep = arena.get(top.deps.next());
                    if (dep.isCircular())
                        top.maxChildDepth = Math.max(top.maxChildDepth, 0);
                    else if (settled[dep.id()])
                        top.maxChildDepth = Math.max(top.maxChildDepth, dep.depth());
                    else
                        frames.push(new Frame(dep));
                    continue;
                }
                frames.pop();
                CalculationField node = arena.get(top.id);
                node.setDepth(top.maxChildDepth + 1);
                settled[top.id] = true;
                Frame parent = frames.peek();
                if (parent != null)
                    parent.maxChildDepth = Math.max(parent.maxChildDepth, node.depth());
            }
        }
    }
}
