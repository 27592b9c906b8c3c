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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import uk.ac.lancs.bflow.graph.DeclaredEdge;
import uk.ac.lancs.bflow.graph.FlowProblem;
import uk.ac.lancs.bflow.verify.FlowVerifier;

public class FlowSolverTest {
    private static final double DELTA = 1e-9;

    private static FlowProblem scenarioA() {
        return FlowProblem.start().edge("S", "A", 0, 10).edge("A", "B", 0, 5)
            .edge("B", "T", 0, 10).source("S", 10).sink("T").cap("A", 8)
            .cap("B", 10).create();
    }

    private static FeasibleFlow feasible(FlowResult result) {
        return assertInstanceOf(FeasibleFlow.class, result,
                                () -> result.toString());
    }

    private static InfeasibleFlow infeasible(FlowResult result,
                                             InfeasibleFlow.Cause cause) {
        InfeasibleFlow inf = assertInstanceOf(InfeasibleFlow.class, result,
                                              () -> result.toString());
        assertSame(cause, inf.cause);
        return inf;
    }

    private static void assertFlows(FeasibleFlow ok, double... expected) {
        assertEquals(expected.length, ok.flows.size());
        for (int i = 0; i < expected.length; i++)
            assertEquals(expected[i], ok.flows.get(i).flow, DELTA,
                         ok.flows.get(i).toString());
    }

    private static void assertValid(FlowProblem problem, FlowResult result) {
        List<String> violations =
            FlowVerifier.check(problem, feasible(result));
        assertTrue(violations.isEmpty(), violations::toString);
    }

    @Test
    public void narrowMiddleEdgeLimitsDelivery() {
        FlowProblem problem = scenarioA();
        FeasibleFlow ok = feasible(new FlowSolver().solve(problem));
        assertEquals(5.0, ok.maxFlow, DELTA);
        assertFlows(ok, 5, 5, 5);
        assertEquals("S", ok.flows.get(0).from);
        assertEquals("T", ok.flows.get(2).to);
        assertValid(problem, ok);
    }

    @Test
    public void exactSupplyReportsUndeliveredAmount() {
        FlowSolver solver = new FlowSolver(SupplyPolicy.EXACT);
        assertSame(SupplyPolicy.EXACT, solver.policy());
        InfeasibleFlow inf = infeasible(solver.solve(scenarioA()),
                                        InfeasibleFlow.Cause.SUPPLY);
        Certificate cert = inf.certificate;
        assertEquals(5.0, cert.deficit.demandBalance, DELTA);
        assertEquals(List.of("A", "S"), cert.cutReachable);
        assertEquals(1, cert.deficit.tightEdges.size());
        TightEdge te = cert.deficit.tightEdges.get(0);
        assertEquals("A", te.from);
        assertEquals("B", te.to);
        assertEquals(5.0, te.flowNeeded, DELTA);
        assertTrue(cert.deficit.tightNodes.isEmpty());
    }

    @Test
    public void invertedBoundsGiveEmptyCut() {
        FlowProblem problem = FlowProblem.start().edge("A", "B", 10, 5)
            .source("A", 10).sink("B").create();
        InfeasibleFlow inf = infeasible(new FlowSolver().solve(problem),
                                        InfeasibleFlow.Cause.INVERTED_BOUNDS);
        assertEquals(5.0, inf.certificate.deficit.demandBalance, DELTA);
        assertTrue(inf.certificate.cutReachable.isEmpty());
        assertTrue(inf.certificate.deficit.tightEdges.isEmpty());
        assertTrue(inf.certificate.deficit.tightNodes.isEmpty());
    }

    @Test
    public void firstInvertedEdgeIsTakenInEndpointOrder() {
        FlowProblem problem = FlowProblem.start().edge("B", "C", 9, 1)
            .edge("A", "B", 4, 3).source("A", 1).sink("C").create();
        InfeasibleFlow inf = infeasible(new FlowSolver().solve(problem),
                                        InfeasibleFlow.Cause.INVERTED_BOUNDS);
        assertEquals(1.0, inf.certificate.deficit.demandBalance, DELTA);
    }

    @Test
    public void unknownSourceSupplyIsTheDeficit() {
        FlowProblem problem = FlowProblem.start().edge("S", "T", 0, 10)
            .source("S", 10).source("X", 7).sink("T").create();
        InfeasibleFlow inf = infeasible(new FlowSolver().solve(problem),
                                        InfeasibleFlow.Cause.UNRESOLVED_NAMES);
        assertEquals(7.0, inf.certificate.deficit.demandBalance, DELTA);
        assertTrue(inf.certificate.cutReachable.isEmpty());
    }

    @Test
    public void missingSinkLosesAllSupply() {
        FlowProblem problem = FlowProblem.start().edge("S", "T", 0, 10)
            .source("S", 4).source("R", -2).cap("R", 1).create();
        InfeasibleFlow inf = infeasible(new FlowSolver().solve(problem),
                                        InfeasibleFlow.Cause.UNRESOLVED_NAMES);
        assertEquals(4.0, inf.certificate.deficit.demandBalance, DELTA);
    }

    @Test
    public void sinkWithoutEdgesIsKnown() {
        FlowProblem problem = FlowProblem.start().edge("S", "A", 0, 10)
            .source("S", 4).sink("T").create();
        FeasibleFlow ok = feasible(new FlowSolver().solve(problem));
        assertEquals(0.0, ok.maxFlow, DELTA);
        assertFlows(ok, 0);
    }

    @Test
    public void lowerBoundOnDeliveryPathIsMet() {
        FlowProblem problem = FlowProblem.start().edge("S", "A", 2, 10)
            .edge("A", "T", 0, 10).source("S", 10).sink("T").create();
        for (SupplyPolicy policy : SupplyPolicy.values()) {
            FeasibleFlow ok = feasible(new FlowSolver(policy).solve(problem));
            assertEquals(10.0, ok.maxFlow, DELTA, policy.label);
            assertFlows(ok, 10, 10);
            assertValid(problem, ok);
        }
    }

    @Test
    public void lowerBoundNeedsSupply() {
        FlowProblem problem = FlowProblem.start().edge("S", "A", 3, 10)
            .edge("A", "T", 0, 10).source("S", 1).sink("T").create();
        InfeasibleFlow inf = infeasible(new FlowSolver().solve(problem),
                                        InfeasibleFlow.Cause.LOWER_BOUNDS);
        assertEquals(2.0, inf.certificate.deficit.demandBalance, DELTA);
    }

    @Test
    public void lowerBoundBeyondDownstreamCapacity() {
        FlowProblem problem = FlowProblem.start().edge("S", "A", 5, 10)
            .edge("A", "T", 0, 3).source("S", 10).sink("T").create();
        InfeasibleFlow inf = infeasible(new FlowSolver().solve(problem),
                                        InfeasibleFlow.Cause.LOWER_BOUNDS);
        Certificate cert = inf.certificate;
        assertEquals(2.0, cert.deficit.demandBalance, DELTA);
        assertEquals(List.of("A"), cert.cutReachable);
        assertEquals(1, cert.deficit.tightEdges.size());
        TightEdge te = cert.deficit.tightEdges.get(0);
        assertEquals("A", te.from);
        assertEquals("T", te.to);
        assertEquals(3.0, te.flowNeeded, DELTA);
        assertTrue(cert.deficit.tightNodes.isEmpty());
    }

    @Test
    public void nodeCapBelowLowerBound() {
        FlowProblem problem = FlowProblem.start().edge("S", "A", 6, 10)
            .edge("A", "T", 0, 10).source("S", 10).sink("T").cap("A", 4)
            .create();
        InfeasibleFlow inf = infeasible(new FlowSolver().solve(problem),
                                        InfeasibleFlow.Cause.LOWER_BOUNDS);
        Certificate cert = inf.certificate;
        assertEquals(2.0, cert.deficit.demandBalance, DELTA);
        assertEquals(List.of("A"), cert.cutReachable);
        assertEquals(List.of("A"), cert.deficit.tightNodes);
        assertTrue(cert.deficit.tightEdges.isEmpty());
    }

    @Test
    public void lowerBoundIntoDeadEnd() {
        FlowProblem problem = FlowProblem.start().edge("S", "T", 0, 1)
            .edge("A", "B", 1, 5).source("S", 1).sink("T").create();
        InfeasibleFlow inf = infeasible(new FlowSolver().solve(problem),
                                        InfeasibleFlow.Cause.LOWER_BOUNDS);
        assertEquals(1.0, inf.certificate.deficit.demandBalance, DELTA);
        assertEquals(List.of("B"), inf.certificate.cutReachable);
        assertTrue(inf.certificate.deficit.tightEdges.isEmpty());
    }

    @Test
    public void nodeCapLimitsThroughput() {
        FlowProblem problem = FlowProblem.start().edge("S", "A", 0, 10)
            .edge("A", "T", 0, 10).source("S", 10).sink("T").cap("A", 4)
            .create();
        FeasibleFlow ok = feasible(new FlowSolver().solve(problem));
        assertEquals(4.0, ok.maxFlow, DELTA);
        assertFlows(ok, 4, 4);
        assertValid(problem, ok);
    }

    @Test
    public void capsOnSourceAndSinkAreNotApplied() {
        FlowProblem problem = FlowProblem.start().edge("S", "T", 0, 10)
            .source("S", 10).sink("T").cap("S", 1).cap("T", 2).create();
        FeasibleFlow ok = feasible(new FlowSolver().solve(problem));
        assertEquals(10.0, ok.maxFlow, DELTA);
    }

    @Test
    public void circulationCarriesLowerBounds() {
        FlowProblem problem = FlowProblem.start().edge("S", "T", 0, 2)
            .edge("A", "B", 3, 5).edge("B", "A", 0, 5).source("S", 2)
            .sink("T").create();
        FeasibleFlow ok = feasible(new FlowSolver().solve(problem));
        assertEquals(2.0, ok.maxFlow, DELTA);
        assertFlows(ok, 2, 3, 3);
        assertValid(problem, ok);
    }

    @Test
    public void loopCarriesItsLowerBound() {
        FlowProblem problem = FlowProblem.start().edge("S", "T", 0, 2)
            .edge("T", "T", 2, 4).source("S", 2).sink("T").create();
        FeasibleFlow ok = feasible(new FlowSolver().solve(problem));
        assertFlows(ok, 2, 2);
        assertEquals(4.0, ok.maxFlow, DELTA);
    }

    @Test
    public void negativeSupplyCountsAsNone() {
        FlowProblem problem = FlowProblem.start().edge("S", "T", 0, 2)
            .source("S", -5).sink("T").create();
        FeasibleFlow ok = feasible(new FlowSolver(SupplyPolicy.EXACT)
            .solve(problem));
        assertEquals(0.0, ok.maxFlow, DELTA);
        assertFlows(ok, 0);
    }

    @Test
    public void supplyIsShared() {
        FlowProblem problem = FlowProblem.start().edge("S1", "M", 0, 10)
            .edge("S2", "M", 0, 10).edge("M", "T", 0, 6).source("S1", 4)
            .source("S2", 5).sink("T").cap("M", 7).create();
        FeasibleFlow ok = feasible(new FlowSolver().solve(problem));
        assertEquals(6.0, ok.maxFlow, DELTA);
        assertEquals(6.0, ok.flows.get(0).flow + ok.flows.get(1).flow, DELTA);
        assertTrue(ok.flows.get(0).flow <= 4.0 + DELTA);
        assertTrue(ok.flows.get(1).flow <= 5.0 + DELTA);
        assertValid(problem, ok);
    }

    @Test
    public void flowsFollowDeclarationOrder() {
        FlowProblem problem = FlowProblem.start().edge("M", "T", 0, 3)
            .edge("S", "M", 0, 5).edge("S", "T", 1, 1).source("S", 10)
            .sink("T").create();
        FeasibleFlow ok = feasible(new FlowSolver().solve(problem));
        assertEquals("M", ok.flows.get(0).from);
        assertEquals("S", ok.flows.get(1).from);
        assertEquals("T", ok.flows.get(2).to);
        assertFlows(ok, 3, 3, 1);
        assertEquals(4.0, ok.maxFlow, DELTA);
        assertValid(problem, ok);
    }

    @Test
    public void edgeListedTwiceGetsTwoFlows() {
        DeclaredEdge e = DeclaredEdge.of("S", "T", 0, 4);
        FlowProblem problem =
            new FlowProblem(List.of(e, DeclaredEdge.of("S", "T", 0, 1), e),
                            Map.of("S", 10.0), "T", Map.of());
        FeasibleFlow ok = feasible(new FlowSolver().solve(problem));
        assertEquals(3, ok.flows.size());
        assertFlows(ok, 4, 1, 4);
        assertEquals(9.0, ok.maxFlow, DELTA);
        assertValid(problem, ok);
    }

    @Test
    public void fractionalAmountsAreRounded() {
        FlowProblem problem = FlowProblem.start().edge("S", "A", 0, 0.1)
            .edge("S", "A", 0, 0.2).edge("A", "T", 0, 1).source("S", 1)
            .sink("T").create();
        FeasibleFlow ok = feasible(new FlowSolver().solve(problem));
        assertEquals(0.3, ok.maxFlow);
        assertEquals(0.3, ok.flows.get(2).flow);
    }

    @Test
    public void repeatedSolutionsAreIdentical() {
        FlowProblem problem = FlowProblem.start().edge("S", "A", 0, 4)
            .edge("S", "B", 0, 4).edge("A", "C", 0, 3).edge("B", "C", 0, 3)
            .edge("A", "D", 0, 2).edge("B", "D", 0, 2).edge("C", "T", 1, 5)
            .edge("D", "T", 0, 5).source("S", 7).sink("T").cap("C", 5)
            .create();
        FeasibleFlow first = feasible(new FlowSolver().solve(problem));
        assertValid(problem, first);
        assertEquals(7.0, first.maxFlow, DELTA);
        for (int run = 0; run < 5; run++) {
            FeasibleFlow again = feasible(new FlowSolver().solve(problem));
            assertEquals(first.maxFlow, again.maxFlow);
            for (int i = 0; i < first.flows.size(); i++)
                assertEquals(first.flows.get(i).flow,
                             again.flows.get(i).flow);
        }
    }

    @Test
    public void tidyClampsAndRounds() {
        assertEquals(0.0, FlowResult.tidy(5e-13));
        assertEquals(0.0, FlowResult.tidy(-5e-13));
        assertEquals(1.0, FlowResult.tidy(1.0000000001));
        assertEquals(0.3, FlowResult.tidy(0.1 + 0.2));
        assertEquals(Double.POSITIVE_INFINITY,
                     FlowResult.tidy(Double.POSITIVE_INFINITY));
    }
}
