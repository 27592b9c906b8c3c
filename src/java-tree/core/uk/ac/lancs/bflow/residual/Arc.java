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

/**
 * Carries flow from the vertex whose list holds it to a target vertex.
 * Every arc is paired with a reverse arc in the target's list, and the
 * remaining capacities of the two always sum to the original capacity
 * of the forward arc.
 *
 * @author simpsons
 */
public final class Arc {
    /**
     * The index of the vertex this arc leads to
     */
    public final int target;

    /**
     * The position of the paired reverse arc in the target's list
     */
    public final int reverse;

    /**
     * The capacity with which the arc was created; zero for a reverse
     * arc
     */
    public final double original;

    double remaining;

    Arc(int target, int reverse, double capacity) {
        this.target = target;
        this.reverse = reverse;
        this.original = capacity;
        this.remaining = capacity;
    }

    /**
     * Get the capacity that can still be pushed along this arc.
     *
     * @return the remaining capacity
     */
    public double remaining() {
        return remaining;
    }

    /**
     * Get the flow carried by this arc. For a forward arc, this is the
     * original capacity minus the remaining capacity.
     *
     * @return the flow carried
     */
    public double used() {
        return original - remaining;
    }

    /**
     * Determine whether the arc can carry no more flow.
     *
     * @return {@code true} if the remaining capacity does not exceed
     * {@link ResidualGraph#EPSILON}
     */
    public boolean isSaturated() {
        return remaining <= ResidualGraph.EPSILON;
    }

    @Override
    public String toString() {
        return String.format("->%d(%g/%g)", target, remaining, original);
    }
}
