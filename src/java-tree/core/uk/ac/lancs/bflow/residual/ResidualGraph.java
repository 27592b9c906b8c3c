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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;

/**
 * Holds a directed graph of paired residual arcs over a fixed number of
 * vertices identified by index.
 *
 * <p>
 * Each vertex's arcs are kept in insertion order, and every traversal
 * visits them in that order. Given the same sequence of
 * {@link #addArc(int, int, double)} calls, two graphs therefore behave
 * identically under the same operations.
 *
 * @author simpsons
 */
public final class ResidualGraph {
    /**
     * The remaining capacity at or below which an arc is treated as
     * saturated, namely {@value}
     */
    public static final double EPSILON = 1e-9;

    private final List<List<Arc>> arcs;

    /**
     * Create a graph with no arcs.
     *
     * @param vertexCount the number of vertices
     */
    public ResidualGraph(int vertexCount) {
        if (vertexCount < 0)
            throw new IllegalArgumentException("-ve vertex count: "
                + vertexCount);
        List<List<Arc>> arcs = new ArrayList<>(vertexCount);
        for (int i = 0; i < vertexCount; i++)
            arcs.add(new ArrayList<>());
        this.arcs = arcs;
    }

    /**
     * Get the number of vertices.
     *
     * @return the number of vertices
     */
    public int vertexCount() {
        return arcs.size();
    }

    /**
     * Add an arc and its zero-capacity reverse.
     *
     * @param from the index of the vertex the arc leaves
     *
     * @param to the index of the vertex the arc enters
     *
     * @param capacity the capacity of the arc
     *
     * @return a handle on the forward arc
     *
     * @throws IllegalArgumentException if the capacity is negative or
     * NaN
     */
    public ArcHandle addArc(int from, int to, double capacity) {
        if (!(capacity >= 0.0))
            throw new IllegalArgumentException("bad capacity " + capacity
                + " for " + from + "->" + to);
        List<Arc> fromList = arcs.get(from);
        List<Arc> toList = arcs.get(to);
        final int fwdPos = fromList.size();
        /* A loop puts both arcs in one list, so the reverse lands one
         * place later. */
        final int revPos = from == to ? fwdPos + 1 : toList.size();
        fromList.add(new Arc(to, revPos, capacity));
        toList.add(new Arc(from, fwdPos, 0.0));
        return new ArcHandle(from, fwdPos);
    }

    /**
     * Get the arc identified by a handle.
     *
     * @param handle the arc's handle
     *
     * @return the identified arc
     */
    public Arc arc(ArcHandle handle) {
        return arcs.get(handle.vertex).get(handle.position);
    }

    /**
     * Get the arcs leaving a vertex, in insertion order.
     *
     * @param vertex the vertex index
     *
     * @return an immutable view of the vertex's arcs
     */
    public List<Arc> arcs(int vertex) {
        return Collections.unmodifiableList(arcs.get(vertex));
    }

    /**
     * Push flow along an arc, reducing its remaining capacity and
     * increasing its reverse's by the same amount.
     *
     * @param vertex the vertex whose list holds the arc
     *
     * @param position the arc's position in the list
     *
     * @param amount the amount to push
     */
    public void push(int vertex, int position, double amount) {
        Arc fwd = arcs.get(vertex).get(position);
        Arc rev = arcs.get(fwd.target).get(fwd.reverse);
        fwd.remaining -= amount;
        rev.remaining += amount;
    }

    /**
     * Find all vertices reachable from a start vertex over arcs with
     * remaining capacity above {@link #EPSILON}.
     *
     * @param start the start vertex
     *
     * @return an array indexed by vertex, {@code true} where reachable
     */
    public boolean[] reachableFrom(int start) {
        boolean[] visited = new boolean[arcs.size()];
        Queue<Integer> queue = new ArrayDeque<>();
        visited[start] = true;
        queue.add(start);
        while (!queue.isEmpty()) {
            int u = queue.remove();
            for (Arc a : arcs.get(u)) {
                if (a.remaining > EPSILON && !visited[a.target]) {
                    visited[a.target] = true;
                    queue.add(a.target);
                }
            }
        }
        return visited;
    }
}
