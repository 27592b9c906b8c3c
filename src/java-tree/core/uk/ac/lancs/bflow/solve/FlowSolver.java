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
import java.util.List;
import java.util.logging.Logger;
import uk.ac.lancs.bflow.graph.DeclaredEdge;
import uk.ac.lancs.bflow.graph.FlowProblem;
import uk.ac.lancs.bflow.residual.Arc;
import uk.ac.lancs.bflow.residual.LevelGraphMaxFlow;

/**
 * Solves flow problems with edge bounds and node caps. A solution
 * proceeds in stages, any of which may end it:
 *
 * <ol>
 *
 * <li>The network is built. An edge with inverted bounds, an unknown
 * source or a missing sink makes the problem infeasible, with an empty
 * cut.
 *
 * <li>A maximum flow from <var>S*</var> to <var>T*</var> must meet all
 * lower-bound demand. Otherwise, a certificate is taken from the
 * residual graph.
 *
 * <li>A maximum flow from <var>S<sub>main</sub></var> to
 * <var>T<sub>main</sub></var> determines the amount delivered. Under
 * {@link SupplyPolicy#EXACT}, it must equal the total supply, or a
 * certificate is taken.
 *
 * <li>The flow on each declared edge is its lower bound plus the flow
 * on its reduced arc.
 *
 * </ol>
 *
 * <p>
 * A solver holds no state between calls, and may be used by several
 * threads at once.
 *
 * @author simpsons
 */
public final class FlowSolver {
    private static final Logger logger =
        Logger.getLogger("uk.ac.lancs.bflow.solve");

    /**
     * The greatest difference between a phase's flow and its target
     * for the phase to be considered complete, namely {@value}
     */
    public static final double COMPLETION_TOLERANCE = 1e-6;

    private final SupplyPolicy policy;

    /**
     * Create a solver.
     *
     * @param policy the way supplies constrain solutions
     */
    public FlowSolver(SupplyPolicy policy) {
        if (policy == null) throw new NullPointerException("policy");
        this.policy = policy;
    }

    /**
     * Create a solver that maximizes delivery.
     */
    public FlowSolver() {
        this(SupplyPolicy.MAXIMIZE);
    }

    /**
     * Get the supply policy of this solver.
     *
     * @return the supply policy
     */
    public SupplyPolicy policy() {
        return policy;
    }

    /**
     * Solve a problem.
     *
     * @param problem the problem description
     *
     * @return a feasible flow, or a proof of infeasibility
     */
    public FlowResult solve(FlowProblem problem) {
        final FlowNetwork network;
        try {
            network = new NetworkBuilder(problem).build();
        } catch (InfeasibleNetworkException ex) {
            logger.fine(() -> "rejected: " + ex.getMessage());
            InfeasibleFlow.Cause cause = ex instanceof InvertedBoundsException
                ? InfeasibleFlow.Cause.INVERTED_BOUNDS
                : InfeasibleFlow.Cause.UNRESOLVED_NAMES;
            return new InfeasibleFlow(cause,
                                      Certificate.trivial(ex.getShortfall()));
        }

        LevelGraphMaxFlow engine = new LevelGraphMaxFlow(network.graph);
        CertificateExtractor extractor = new CertificateExtractor(network);

        final double circulated =
            engine.maxFlow(network.lowerSource, network.lowerSink);
        logger.fine(() -> String.format("lower bounds: %g of %g",
                                        circulated,
                                        network.totalPositiveDemand));
        if (Math.abs(circulated
            - network.totalPositiveDemand) > COMPLETION_TOLERANCE) {
            return new InfeasibleFlow(InfeasibleFlow.Cause.LOWER_BOUNDS,
                                      extractor
                                          .extract(network.lowerSource,
                                                   network.totalPositiveDemand,
                                                   circulated));
        }

        final double delivered =
            engine.maxFlow(network.mainSource, network.mainSink);
        logger.fine(() -> String.format("delivery: %g of %g", delivered,
                                        network.totalSupply));
        if (policy == SupplyPolicy.EXACT && Math
            .abs(delivered - network.totalSupply) > COMPLETION_TOLERANCE) {
            return new InfeasibleFlow(InfeasibleFlow.Cause.SUPPLY,
                                      extractor.extract(network.mainSource,
                                                        network.totalSupply,
                                                        delivered));
        }

        return reconstruct(problem, network);
    }

    private static FeasibleFlow reconstruct(FlowProblem problem,
                                            FlowNetwork network) {
        EdgeFlow[] flows = new EdgeFlow[network.edges.size()];
        for (FlowNetwork.EdgeRecord rec : network.edges) {
            DeclaredEdge e = rec.edge;
            Arc arc = network.graph.arc(rec.arc);
            double flow = FlowResult.tidy(arc.used() + e.bounds.min());
            flows[rec.declared] = new EdgeFlow(e.from, e.to, flow);
        }

        double intoSink = 0.0;
        for (EdgeFlow f : flows)
            if (f.to.equals(problem.sink)) intoSink += f.flow;

        List<EdgeFlow> result = new ArrayList<>(Arrays.asList(flows));
        return new FeasibleFlow(FlowResult.tidy(intoSink), result);
    }
}
