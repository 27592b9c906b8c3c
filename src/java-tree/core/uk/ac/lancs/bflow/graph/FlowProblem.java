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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Describes a network of bounded edges, capacitated nodes, supplying
 * sources and a single sink. Instances are immutable.
 *
 * @author simpsons
 */
public final class FlowProblem {
    /**
     * An immutable list of the edges in declaration order
     */
    public final List<DeclaredEdge> edges;

    /**
     * An immutable map from source name to supply, ordered by name
     */
    public final SortedMap<String, Double> sources;

    /**
     * The name of the sink, or {@code null} if not specified
     */
    public final String sink;

    /**
     * An immutable map from node name to throughput cap, ordered by
     * name
     */
    public final SortedMap<String, Double> nodeCaps;

    /**
     * Create a problem description. The inputs are copied.
     *
     * @param edges the edges in declaration order
     *
     * @param sources the supply of each source
     *
     * @param sink the sink name; or {@code null} if not specified
     *
     * @param nodeCaps the throughput cap of each capacitated node
     *
     * @throws IllegalArgumentException if a supply is not finite, or a
     * cap is negative or not finite
     */
    public FlowProblem(Collection<? extends DeclaredEdge> edges,
                       Map<String, ? extends Number> sources, String sink,
                       Map<String, ? extends Number> nodeCaps) {
        this.edges = List.copyOf(edges);
        SortedMap<String, Double> srcs = new TreeMap<>();
        for (Map.Entry<String, ? extends Number> entry : sources
            .entrySet()) {
            double supply = entry.getValue().doubleValue();
            if (!Double.isFinite(supply))
                throw new IllegalArgumentException("non-finite supply at "
                    + entry.getKey() + ": " + supply);
            srcs.put(entry.getKey(), supply);
        }
        SortedMap<String, Double> caps = new TreeMap<>();
        for (Map.Entry<String, ? extends Number> entry : nodeCaps
            .entrySet()) {
            double cap = entry.getValue().doubleValue();
            if (!(cap >= 0.0) || cap == Double.POSITIVE_INFINITY)
                throw new IllegalArgumentException("bad cap at "
                    + entry.getKey() + ": " + cap);
            caps.put(entry.getKey(), cap);
        }
        this.sources = Collections.unmodifiableSortedMap(srcs);
        this.sink = sink;
        this.nodeCaps = Collections.unmodifiableSortedMap(caps);
    }

    /**
     * Get the names of all nodes mentioned by this problem, in
     * lexicographic order.
     *
     * @return the sorted node names
     */
    public List<String> nodeNames() {
        Collection<String> names = new TreeSet<>();
        edges.stream().flatMap(DeclaredEdge::stream).forEach(names::add);
        names.addAll(sources.keySet());
        if (sink != null) names.add(sink);
        names.addAll(nodeCaps.keySet());
        return List.copyOf(names);
    }

    /**
     * Determine whether a node is mentioned by any edge, as the sink or
     * in the node caps. Appearing only as a source does not count.
     *
     * @param name the node name
     *
     * @return {@code true} if the node is known
     */
    public boolean isKnown(String name) {
        if (name.equals(sink)) return true;
        if (nodeCaps.containsKey(name)) return true;
        for (DeclaredEdge e : edges)
            if (e.from.equals(name) || e.to.equals(name)) return true;
        return false;
    }

    /**
     * Start building a problem description.
     *
     * @return a fresh builder
     */
    public static Builder start() {
        return new Builder();
    }

    /**
     * Accumulates the parts of a problem description.
     *
     * @author simpsons
     */
    public static final class Builder {
        private final List<DeclaredEdge> edges = new ArrayList<>();
        private final Map<String, Double> sources = new TreeMap<>();
        private final Map<String, Double> nodeCaps = new TreeMap<>();
        private String sink;

        private Builder() {}

        /**
         * Add an edge after those already added.
         *
         * @param from the start node
         *
         * @param to the finish node
         *
         * @param lo the minimum required flow
         *
         * @param hi the maximum permitted flow
         *
         * @return this object
         */
        public Builder edge(String from, String to, double lo, double hi) {
            edges.add(DeclaredEdge.of(from, to, lo, hi));
            return this;
        }

        /**
         * Declare a source.
         *
         * @param name the source name
         *
         * @param supply the amount the source may supply
         *
         * @return this object
         */
        public Builder source(String name, double supply) {
            sources.put(name, supply);
            return this;
        }

        /**
         * Set the sink.
         *
         * @param name the sink name
         *
         * @return this object
         */
        public Builder sink(String name) {
            sink = name;
            return this;
        }

        /**
         * Cap the throughput of a node.
         *
         * @param name the node name
         *
         * @param cap the maximum throughput
         *
         * @return this object
         */
        public Builder cap(String name, double cap) {
            nodeCaps.put(name, cap);
            return this;
        }

        /**
         * Create the problem description from the current parts.
         *
         * @return the new problem description
         */
        public FlowProblem create() {
            return new FlowProblem(edges, sources, sink, nodeCaps);
        }
    }
}
