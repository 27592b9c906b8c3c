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

package uk.ac.lancs.bflow.solve;

import java.util.List;
import java.util.Map;
import uk.ac.lancs.bflow.graph.DeclaredEdge;
import uk.ac.lancs.bflow.residual.ArcHandle;
import uk.ac.lancs.bflow.residual.ResidualGraph;

/**
 * Holds the residual graph built for one problem, with the bookkeeping
 * needed to interpret flows over it.
 *
 * @author simpsons
 */
final class FlowNetwork {
    /**
     * Links a declared edge to its reduced arc.
     *
     * @author simpsons
     */
    static final class EdgeRecord {
        /**
         * The declared edge
         */
        final DeclaredEdge edge;

        /**
         * The edge's position in the declaration order
         */
        final int declared;

        /**
         * The reduced arc carrying flow in excess of the lower bound
         */
        final ArcHandle arc;

        EdgeRecord(DeclaredEdge edge, int declared, ArcHandle arc) {
            this.edge = edge;
            this.declared = declared;
            this.arc = arc;
        }
    }

    final ResidualGraph graph;

    final NameRegistry registry;

    /**
     * Edge records in the order their arcs were added
     */
    final List<EdgeRecord> edges;

    /**
     * Capacity arcs of split nodes, in name order
     */
    final Map<String, ArcHandle> nodeArcs;

    final int lowerSource, lowerSink;

    final int mainSource, mainSink;

    final double totalPositiveDemand;

    final double totalSupply;

    FlowNetwork(ResidualGraph graph, NameRegistry registry,
                List<EdgeRecord> edges, Map<String, ArcHandle> nodeArcs,
                int lowerSource, int lowerSink, int mainSource,
                int mainSink, double totalPositiveDemand,
                double totalSupply) {
        this.graph = graph;
        this.registry = registry;
        this.edges = List.copyOf(edges);
        this.nodeArcs = nodeArcs;
        this.lowerSource = lowerSource;
        this.lowerSink = lowerSink;
        this.mainSource = mainSource;
        this.mainSink = mainSink;
        this.totalPositiveDemand = totalPositiveDemand;
        this.totalSupply = totalSupply;
    }
}
