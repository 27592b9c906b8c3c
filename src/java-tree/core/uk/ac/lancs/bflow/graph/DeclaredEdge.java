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

package uk.ac.lancs.bflow.graph;

import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Connects two named nodes with bounds on the flow from one to the
 * other.
 *
 * <p>
 * No edge equals another edge that is not the same object, so a problem
 * may declare several edges between the same pair of nodes.
 *
 * @author simpsons
 */
public final class DeclaredEdge {
    /**
     * The name of the node that flow leaves by this edge
     */
    public final String from;

    /**
     * The name of the node that flow enters by this edge
     */
    public final String to;

    /**
     * The bounds on flow along this edge
     */
    public final Bounds bounds;

    /**
     * Orders edges by start name, then by finish name. The sort that
     * uses this must be stable, so that edges between the same pair of
     * nodes keep their declaration order.
     */
    public static final Comparator<DeclaredEdge> BY_ENDPOINTS =
        Comparator.<DeclaredEdge, String>comparing(e -> e.from)
            .thenComparing(e -> e.to);

    /**
     * Create an edge between two nodes.
     *
     * @param from the start node
     *
     * @param to the finish node
     *
     * @param bounds the bounds on flow along the edge
     *
     * @throws NullPointerException if any argument is {@code null}
     */
    public DeclaredEdge(String from, String to, Bounds bounds) {
        if (from == null) throw new NullPointerException("from");
        if (to == null) throw new NullPointerException("to");
        if (bounds == null) throw new NullPointerException("bounds");
        this.from = from;
        this.to = to;
        this.bounds = bounds;
    }

    /**
     * Create an edge between two nodes.
     *
     * @param from the start node
     *
     * @param to the finish node
     *
     * @param lo the minimum required flow
     *
     * @param hi the maximum permitted flow
     *
     * @return the new edge
     *
     * @constructor
     */
    public static DeclaredEdge of(String from, String to, double lo,
                                  double hi) {
        return new DeclaredEdge(from, to, Bounds.between(lo, hi));
    }

    /**
     * Get a stream of the two node names.
     *
     * @return a stream of the two node names
     */
    public Stream<String> stream() {
        return Stream.of(from, to);
    }

    /**
     * Get a string representation of this edge.
     *
     * @return the node names joined by an arrow, followed by the bounds
     */
    @Override
    public String toString() {
        return from + "->" + to + bounds;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

    @Override
    public boolean equals(Object obj) {
        return this == obj;
    }
}
