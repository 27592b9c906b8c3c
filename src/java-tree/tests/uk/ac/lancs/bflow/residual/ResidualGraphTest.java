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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class ResidualGraphTest {
    @Test
    public void arcsArePaired() {
        ResidualGraph g = new ResidualGraph(3);
        ArcHandle h = g.addArc(0, 1, 5.0);
        g.addArc(0, 2, 3.0);
        assertEquals(0, h.vertex);
        assertEquals(0, h.position);

        Arc fwd = g.arc(h);
        Arc rev = g.arcs(1).get(fwd.reverse);
        assertEquals(1, fwd.target);
        assertEquals(0, rev.target);
        assertEquals(5.0, fwd.remaining());
        assertEquals(0.0, rev.remaining());
        assertSame(fwd, g.arcs(rev.target).get(rev.reverse));
    }

    @Test
    public void pushMovesCapacityToReverse() {
        ResidualGraph g = new ResidualGraph(2);
        ArcHandle h = g.addArc(0, 1, 5.0);
        g.push(0, 0, 2.0);
        Arc fwd = g.arc(h);
        Arc rev = g.arcs(1).get(fwd.reverse);
        assertEquals(3.0, fwd.remaining());
        assertEquals(2.0, fwd.used());
        assertEquals(2.0, rev.remaining());
        assertEquals(fwd.original, fwd.remaining() + rev.remaining());

        g.push(1, fwd.reverse, 2.0);
        assertEquals(5.0, fwd.remaining());
        assertEquals(0.0, rev.remaining());
    }

    @Test
    public void loopReverseIsAdjacent() {
        ResidualGraph g = new ResidualGraph(1);
        ArcHandle h = g.addArc(0, 0, 4.0);
        assertEquals(2, g.arcs(0).size());
        Arc fwd = g.arc(h);
        assertEquals(1, fwd.reverse);
        assertEquals(0, g.arcs(0).get(1).reverse);

        g.push(0, 0, 1.5);
        assertEquals(2.5, g.arcs(0).get(0).remaining());
        assertEquals(1.5, g.arcs(0).get(1).remaining());
    }

    @Test
    public void saturationIsWithinEpsilon() {
        ResidualGraph g = new ResidualGraph(2);
        ArcHandle h = g.addArc(0, 1, 1.0);
        assertFalse(g.arc(h).isSaturated());
        g.push(0, 0, 1.0 - 1e-12);
        assertTrue(g.arc(h).isSaturated());
    }

    @Test
    public void reachabilityIgnoresSaturatedArcs() {
        ResidualGraph g = new ResidualGraph(4);
        g.addArc(0, 1, 1.0);
        g.addArc(1, 2, 0.0);
        g.addArc(0, 3, 2.0);
        assertArrayEquals(new boolean[] { true, true, false, true },
                          g.reachableFrom(0));

        g.push(0, 0, 1.0);
        assertArrayEquals(new boolean[] { true, false, false, true },
                          g.reachableFrom(0));
        // the reverse of 0->1 now leads back
        assertArrayEquals(new boolean[] { true, true, false, true },
                          g.reachableFrom(1));
        g.addArc(1, 2, 1.0);
        assertArrayEquals(new boolean[] { true, true, true, true },
                          g.reachableFrom(1));
    }

    @Test
    public void badCapacityIsRejected() {
        ResidualGraph g = new ResidualGraph(2);
        assertThrows(IllegalArgumentException.class,
                     () -> g.addArc(0, 1, -1.0));
        assertThrows(IllegalArgumentException.class,
                     () -> g.addArc(0, 1, Double.NaN));
        assertThrows(IllegalArgumentException.class,
                     () -> new ResidualGraph(-1));
    }
}
