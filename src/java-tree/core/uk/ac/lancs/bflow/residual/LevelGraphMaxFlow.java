/*
 * Copyright (c) 2021, Regents of the University of Lancaster
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are
 * met:
 *
 * * Redistributions of source code must retain the above copyright
 *   notice, this list of conditions and the following disclaimer.
 *
 * * Redistributions in binary form must reproduce the above copyright
 *   notice, this list of conditions and the following disclaimer in the
 *   documentation and/or other materials provided with the
 *   distribution.
 *
 * * Neither the name of the copyright holder nor the names of its
 *   contributors may be used to endorse or promote products derived
 *   from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
 * "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
 * LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
 * A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT
 * HOLDER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL,
 * SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT
 * LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 *
 *
 *  Author: Steven Simpson <s.simpson@lancaster.ac.uk>
 */

package uk.ac.lancs.bflow.residual;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.List;
import java.util.Queue;
import java.util.logging.Logger;

/**
 * Computes maximum flows over a residual graph by building level graphs
 * and finding blocking flows in them. The graph is modified in place,
 * so successive calls continue from the flow left by earlier ones.
 *
 * <p>
 * Each phase labels vertices with their breadth-first distance from
 * the source, then repeatedly searches depth-first for a path whose
 * arcs each advance one level, and pushes the path's minimum remaining
 * capacity along it. Every vertex keeps a cursor into its arc list,
 * and the cursor only advances during a phase, so an arc found useless
 * is not examined again until the next phase. The search keeps its
 * path in arrays rather than on the call stack, so its depth is limited
 * only by the vertex count.
 *
 * <p>
 * Arcs are always examined in insertion order, so the flow found for a
 * given graph is reproducible.
 *
 * @author simpsons
 */
public final class LevelGraphMaxFlow {
    private static final Logger logger =
        Logger.getLogger("uk.ac.lancs.bflow.residual");

    private final ResidualGraph graph;
    private final int[] level;
    private final int[] cursor;
    private final int[] pathVertex;
    private final int[] pathArc;

    /**
     * Prepare to compute flows over a graph.
     *
     * @param graph the graph to be modified by flow computations
     */
    public LevelGraphMaxFlow(ResidualGraph graph) {
        this.graph = graph;
        final int n = graph.vertexCount();
        this.level = new int[n];
        this.cursor = new int[n];
        this.pathVertex = new int[n];
        this.pathArc = new int[n];
    }

    /**
     * Push as much flow as possible from one vertex to another.
     *
     * @param source the vertex flow leaves
     *
     * @param sink the vertex flow enters
     *
     * @return the amount of flow pushed
     *
     * @throws IllegalArgumentException if the source and sink are the
     * same vertex
     */
    public double maxFlow(int source, int sink) {
        if (source == sink)
            throw new IllegalArgumentException("source is sink: " + source);
        double total = 0.0;
        int phases = 0, paths = 0;
        while (assignLevels(source, sink)) {
            phases++;
            Arrays.fill(cursor, 0);
            double pushed;
            while ((pushed = augment(source, sink)) > ResidualGraph.EPSILON) {
                total += pushed;
                paths++;
            }
        }
        final int fp = phases, fa = paths;
        final double ft = total;
        logger.finer(() -> String
            .format("%d->%d: %g in %d phase(s), %d path(s)", source, sink,
                    ft, fp, fa));
        return total;
    }

    /**
     * Label each vertex reachable from the source with its
     * breadth-first distance.
     *
     * @return {@code true} if the sink is reachable
     */
    private boolean assignLevels(int source, int sink) {
        Arrays.fill(level, -1);
        Queue<Integer> queue = new ArrayDeque<>();
        level[source] = 0;
        queue.add(source);
        while (!queue.isEmpty()) {
            int u = queue.remove();
            for (Arc a : graph.arcs(u)) {
                if (a.remaining > ResidualGraph.EPSILON && level[a.target] < 0) {
                    level[a.target] = level[u] + 1;
                    queue.add(a.target);
                }
            }
        }
        return level[sink] >= 0;
    }

    /**
     * Find one path through the level graph and push its bottleneck
     * along it.
     *
     * @return the amount pushed, or zero if no path remains
     */
    private double augment(int source, int sink) {
        int depth = 0;
        int u = source;
        while (true) {
            if (u == sink) {
                double amount = Double.POSITIVE_INFINITY;
                for (int i = 0; i < depth; i++) {
                    Arc a = graph.arcs(pathVertex[i]).get(pathArc[i]);
                    amount = Math.min(amount, a.remaining);
                }
                for (int i = 0; i < depth; i++)
                    graph.push(pathVertex[i], pathArc[i], amount);
                return amount;
            }

            /* Advance this vertex's cursor to the next arc that leads
             * one level deeper. */
            List<Arc> list = graph.arcs(u);
            int next = -1;
            while (cursor[u] < list.size()) {
                Arc a = list.get(cursor[u]);
                if (a.remaining > ResidualGraph.EPSILON
                    && level[a.target] == level[u] + 1) {
                    next = a.target;
                    break;
                }
                cursor[u]++;
            }

            if (next >= 0) {
                pathVertex[depth] = u;
                pathArc[depth] = cursor[u];
                depth++;
                u = next;
                continue;
            }

            /* This vertex is a dead end for the rest of the phase.
             * Retreat, and skip the arc that led here. */
            if (depth == 0) return 0.0;
            depth--;
            u = pathVertex[depth];
            cursor[u]++;
        }
    }
}
