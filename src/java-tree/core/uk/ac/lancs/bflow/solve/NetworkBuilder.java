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
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import uk.ac.lancs.bflow.graph.DeclaredEdge;
import uk.ac.lancs.bflow.graph.FlowProblem;
import uk.ac.lancs.bflow.residual.ArcHandle;
import uk.ac.lancs.bflow.residual.ResidualGraph;

/**
 * Converts a problem with lower bounds and node caps into a residual
 * graph on which ordinary maximum flows decide feasibility and
 * delivery.
 *
 * <p>
 * Capped nodes other than sources and the sink are split into an entry
 * and an exit vertex joined by an arc carrying the cap. Each edge
 * becomes an arc carrying its excess over its lower bound, and the
 * lower bound is recorded as a demand at the finish vertex and a
 * surplus at the start vertex. Four further vertices follow those of
 * the named nodes:
 *
 * <ol>
 *
 * <li><var>S*</var> supplies each vertex with positive demand.
 *
 * <li><var>T*</var> drains each vertex with surplus.
 *
 * <li><var>S<sub>main</sub></var> supplies each source, up to its
 * supply.
 *
 * <li><var>T<sub>main</sub></var> drains the sink, and feeds
 * <var>S<sub>main</sub></var> through a return arc.
 *
 * </ol>
 *
 * <p>
 * The lower bounds can be met exactly when a maximum flow from
 * <var>S*</var> to <var>T*</var> saturates every arc leaving
 * <var>S*</var>. The return arc lets that flow pass from the sink back
 * to the sources, so lower bounds on paths between them are met from
 * supply.
 *
 * <p>
 * A builder is used for one problem, and its registry of names is not
 * shared.
 *
 * @author simpsons
 */
final class NetworkBuilder {
    private static final Logger logger =
        Logger.getLogger("uk.ac.lancs.bflow.solve");

    private final FlowProblem problem;

    /**
     * Prepare to build a network for a problem.
     *
     * @param problem the problem description
     */
    NetworkBuilder(FlowProblem problem) {
        this.problem = problem;
    }

    /**
     * Build the network.
     *
     * @return the network, with no flow yet pushed
     *
     * @throws InvertedBoundsException if an edge's maximum is below its
     * minimum
     *
     * @throws UnknownNodeException if a source is not otherwise
     * mentioned, or the sink is not specified
     */
    FlowNetwork build() throws InfeasibleNetworkException {
        /* Sort the declaration indices by their edges' endpoints. The
         * sort is stable, so parallel edges stay in declaration order,
         * and an edge listed twice keeps both positions. */
        Integer[] order = new Integer[problem.edges.size()];
        for (int i = 0; i < order.length; i++)
            order[i] = i;
        Arrays.sort(order, Comparator.<Integer, DeclaredEdge>comparing(
            problem.edges::get, DeclaredEdge.BY_ENDPOINTS));
        List<DeclaredEdge> sorted = new ArrayList<>(order.length);
        for (int i : order)
            sorted.add(problem.edges.get(i));

        validate(sorted);

        final String sink = problem.sink;
        NameRegistry registry =
            new NameRegistry(problem.nodeNames(),
                             name -> problem.nodeCaps.containsKey(name)
                                 && !name.equals(sink)
                                 && !problem.sources.containsKey(name));
        final int named = registry.vertexCount();
        final int lowerSource = named, lowerSink = named + 1;
        final int mainSource = named + 2, mainSink = named + 3;
        ResidualGraph graph = new ResidualGraph(named + 4);

        /* Give each split node its capacity arc. */
        Map<String, ArcHandle> nodeArcs = new LinkedHashMap<>();
        for (Map.Entry<String, NodeIdentity> entry : registry.identities()
            .entrySet()) {
            NodeIdentity id = entry.getValue();
            if (!id.isSplit()) continue;
            double cap = problem.nodeCaps.get(entry.getKey());
            nodeArcs.put(entry.getKey(), graph.addArc(id.in(), id.out(), cap));
        }

        /* Add the reduced edges, and accumulate the imbalance caused
         * by their lower bounds. */
        double[] demand = new double[graph.vertexCount()];
        List<FlowNetwork.EdgeRecord> records = new ArrayList<>(sorted.size());
        for (int i = 0; i < order.length; i++) {
            final DeclaredEdge e = sorted.get(i);
            final int u = registry.get(e.from).out();
            final int v = registry.get(e.to).in();
            ArcHandle arc = graph.addArc(u, v, e.bounds.excess());
            records.add(new FlowNetwork.EdgeRecord(e, order[i], arc));
            demand[v] += e.bounds.min();
            demand[u] -= e.bounds.min();
        }

        /* Connect the sources and sink. */
        double totalSupply = 0.0;
        for (Map.Entry<String, Double> entry : problem.sources.entrySet()) {
            double supply = supplyOf(entry.getKey(), entry.getValue());
            if (supply <= 0.0) continue;
            graph.addArc(mainSource, registry.get(entry.getKey()).out(),
                         supply);
            totalSupply += supply;
        }
        graph.addArc(registry.get(sink).in(), mainSink, totalSupply);
        graph.addArc(mainSink, mainSource, totalSupply);

        /* Meet each vertex's demand from S*, and drain each surplus to
         * T*. */
        double totalPositiveDemand = 0.0;
        for (int i = 0; i < named; i++) {
            if (Math.abs(demand[i]) <= ResidualGraph.EPSILON) continue;
            if (demand[i] > 0) {
                graph.addArc(lowerSource, i, demand[i]);
                totalPositiveDemand += demand[i];
            } else {
                graph.addArc(i, lowerSink, -demand[i]);
            }
        }

        final double fd = totalPositiveDemand, fs = totalSupply;
        logger.fine(() -> String
            .format("built %d vertices (%d named, %d split),"
                + " %d edges, demand %g, supply %g", graph.vertexCount(),
                    registry.identities().size(), nodeArcs.size(),
                    records.size(), fd, fs));
        return new FlowNetwork(graph, registry, records,
                               Collections.unmodifiableMap(nodeArcs),
                               lowerSource, lowerSink, mainSource, mainSink,
                               totalPositiveDemand, totalSupply);
    }

    /**
     * Check the problem for conditions that make it infeasible without
     * computing any flow.
     *
     * @param sorted the edges in endpoint order
     */
    private void validate(List<DeclaredEdge> sorted)
        throws InfeasibleNetworkException {
        for (DeclaredEdge e : sorted)
            if (e.bounds.isInverted(ResidualGraph.EPSILON))
                throw new InvertedBoundsException(e);

        List<String> unknown = new ArrayList<>();
        double unresolved = 0.0, total = 0.0;
        for (Map.Entry<String, Double> entry : problem.sources.entrySet()) {
            double supply = Math.max(0.0, entry.getValue());
            total += supply;
            if (problem.isKnown(entry.getKey())) continue;
            unknown.add(entry.getKey());
            unresolved += supply;
        }
        if (!unknown.isEmpty())
            throw new UnknownNodeException(unknown, unresolved,
                                           "unknown sources: " + unknown);
        if (problem.sink == null)
            throw new UnknownNodeException(Collections.emptyList(), total,
                                           "no sink");
    }

    private static double supplyOf(String name, double declared) {
        if (declared < 0.0) {
            logger.warning(() -> String
                .format("source %s: negative supply %g treated as zero",
                        name, declared));
            return 0.0;
        }
        return declared;
    }
}
