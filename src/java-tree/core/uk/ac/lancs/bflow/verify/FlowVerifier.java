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

package uk.ac.lancs.bflow.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import uk.ac.lancs.bflow.graph.DeclaredEdge;
import uk.ac.lancs.bflow.graph.FlowProblem;
import uk.ac.lancs.bflow.solve.EdgeFlow;
import uk.ac.lancs.bflow.solve.FeasibleFlow;

/**
 * Checks a flow assignment against its problem without reference to how
 * it was computed. Only the declared edges and their reported flows are
 * consulted. The following properties are checked, each within
 * {@link #TOLERANCE}:
 *
 * <ul>
 *
 * <li>The assignment covers every declared edge, in declaration order.
 *
 * <li>Each edge's flow lies within its bounds.
 *
 * <li>Every node other than the sources and the sink has equal inflow
 * and outflow.
 *
 * <li>Every capped node other than the sources and the sink passes no
 * more than its cap.
 *
 * <li>No source sends out more than its supply, net of what it
 * receives.
 *
 * <li>The reported total equals the flow on edges entering the sink.
 *
 * </ul>
 *
 * @author simpsons
 */
public final class FlowVerifier {
    /**
     * The permitted discrepancy in any check, namely {@value}
     */
    public static final double TOLERANCE = 1e-6;

    private FlowVerifier() {}

    /**
     * Check a flow assignment.
     *
     * @param problem the problem that was solved
     *
     * @param solution the reported solution
     *
     * @return a description of each violation found; empty if the
     * solution is valid
     */
    public static List<String> check(FlowProblem problem,
                                     FeasibleFlow solution) {
        List<String> violations = new ArrayList<>();
        if (solution.flows.size() != problem.edges.size()) {
            violations.add(String.format("%d flows for %d edges",
                                         solution.flows.size(),
                                         problem.edges.size()));
            return violations;
        }

        Map<String, Double> inflow = new TreeMap<>();
        Map<String, Double> outflow = new TreeMap<>();
        double intoSink = 0.0;
        for (int i = 0; i < problem.edges.size(); i++) {
            DeclaredEdge e = problem.edges.get(i);
            EdgeFlow f = solution.flows.get(i);
            if (!e.from.equals(f.from) || !e.to.equals(f.to)) {
                violations.add(String.format("flow %d is %s->%s, not %s->%s",
                                             i, f.from, f.to, e.from,
                                             e.to));
                continue;
            }
            if (f.flow < e.bounds.min() - TOLERANCE
                || f.flow > e.bounds.max() + TOLERANCE)
                violations.add(String.format("%s->%s: %g outside %s", f.from,
                                             f.to, f.flow, e.bounds));
            outflow.merge(f.from, f.flow, Double::sum);
            inflow.merge(f.to, f.flow, Double::sum);
            if (f.to.equals(problem.sink)) intoSink += f.flow;
        }

        for (String name : problem.nodeNames()) {
            double in = inflow.getOrDefault(name, 0.0);
            double out = outflow.getOrDefault(name, 0.0);
            if (name.equals(problem.sink)) continue;
            Double supply = problem.sources.get(name);
            if (supply != null) {
                double limit = Math.max(0.0, supply);
                if (out - in > limit + TOLERANCE)
                    violations.add(String
                        .format("%s: sends %g beyond supply %g", name,
                                out - in, limit));
                continue;
            }
            if (Math.abs(in - out) > TOLERANCE)
                violations.add(String.format("%s: in %g, out %g", name, in,
                                             out));
            Double cap = problem.nodeCaps.get(name);
            if (cap != null && in > cap + TOLERANCE)
                violations.add(String.format("%s: passes %g beyond cap %g",
                                             name, in, cap));
        }

        if (Math.abs(intoSink - solution.maxFlow) > TOLERANCE)
            violations.add(String.format("total %g, but sink receives %g",
                                         solution.maxFlow, intoSink));
        return violations;
    }
}
