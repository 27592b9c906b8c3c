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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import uk.ac.lancs.bflow.residual.Arc;
import uk.ac.lancs.bflow.residual.ArcHandle;

/**
 * Derives a certificate of infeasibility from the residual graph left
 * by a maximum flow that fell short of its target.
 *
 * @author simpsons
 */
final class CertificateExtractor {
    private final FlowNetwork network;

    CertificateExtractor(FlowNetwork network) {
        this.network = network;
    }

    /**
     * Extract a certificate.
     *
     * @param source the vertex from which the failed flow was pushed
     *
     * @param target the amount of flow that was required
     *
     * @param achieved the amount of flow actually pushed
     *
     * @return the certificate
     */
    Certificate extract(int source, double target, double achieved) {
        final boolean[] reached = network.graph.reachableFrom(source);

        /* Nodes with either vertex on the source side form the cut. The
         * registry is already in name order. */
        List<String> cut = new ArrayList<>();
        for (Map.Entry<String, NodeIdentity> entry : network.registry
            .identities().entrySet()) {
            NodeIdentity id = entry.getValue();
            if (reached[id.in()] || reached[id.out()])
                cut.add(entry.getKey());
        }

        /* Saturated edges leaving the source side block further flow. */
        List<TightEdge> tightEdges = new ArrayList<>();
        for (FlowNetwork.EdgeRecord rec : network.edges) {
            Arc arc = network.graph.arc(rec.arc);
            if (!reached[rec.arc.vertex] || reached[arc.target]) continue;
            if (!arc.isSaturated()) continue;
            tightEdges.add(new TightEdge(rec.edge.from, rec.edge.to,
                                         FlowResult
                                             .tidy(rec.edge.bounds.min()
                                                 + arc.original)));
        }

        List<String> tightNodes = new ArrayList<>();
        for (Map.Entry<String, ArcHandle> entry : network.nodeArcs
            .entrySet()) {
            if (network.graph.arc(entry.getValue()).isSaturated())
                tightNodes.add(entry.getKey());
        }

        Deficit deficit = new Deficit(FlowResult.tidy(target - achieved),
                                      tightNodes, tightEdges);
        return new Certificate(cut, deficit);
    }
}
