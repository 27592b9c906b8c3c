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

/**
 * Specifies the permitted flow along an edge as a required minimum
 * rate and a maximum permitted rate.
 *
 * <p>
 * Unlike a range normalized on construction, the two rates are kept as
 * declared. A maximum below the minimum is representable, so that the
 * solver can report it as an infeasibility rather than reject the
 * problem outright.
 *
 * @author simpsons
 */
public final class Bounds {
    private final double min, max;

    /**
     * Get the minimum required flow.
     *
     * @return the minimum flow
     */
    public double min() {
        return min;
    }

    /**
     * Get the maximum permitted flow.
     *
     * @return the maximum flow
     */
    public double max() {
        return max;
    }

    /**
     * Get a string representation of these bounds. This is the minimum
     * value, a comma and the maximum value, all in square brackets.
     *
     * @return the string representation
     */
    @Override
    public String toString() {
        return String.format("[ %g, %g ]", min, max);
    }

    /**
     * Get the excess flow. This is the maximum minus the minimum, and
     * never less than zero.
     *
     * @return the excess
     */
    public double excess() {
        return Math.max(0.0, max - min);
    }

    /**
     * Determine whether the maximum falls short of the minimum by more
     * than a given tolerance.
     *
     * @param tolerance the amount by which the maximum may fall below
     * the minimum and still be considered consistent
     *
     * @return {@code true} if the bounds cannot be met
     */
    public boolean isInverted(double tolerance) {
        return max + tolerance < min;
    }

    /**
     * Get the amount by which the maximum falls short of the minimum.
     *
     * @return the shortfall, or zero if the bounds are consistent
     */
    public double shortfall() {
        return Math.max(0.0, min - max);
    }

    private Bounds(double min, double max) {
        if (!Double.isFinite(min))
            throw new IllegalArgumentException("non-finite min: " + min);
        if (!Double.isFinite(max))
            throw new IllegalArgumentException("non-finite max: " + max);
        if (min < 0) throw new IllegalArgumentException("-ve min: " + min);
        this.min = min;
        this.max = max;
    }

    /**
     * Express bounds between two rates. The rates are not re-ordered.
     *
     * @param min the minimum required rate
     *
     * @param max the maximum permitted rate
     *
     * @return the requested bounds
     *
     * @throws IllegalArgumentException if the minimum is negative, or
     * either rate is not finite
     *
     * @constructor
     */
    public static Bounds between(double min, double max) {
        return new Bounds(min, max);
    }

    @Override
    public int hashCode() {
        return Double.hashCode(min) * 31 + Double.hashCode(max);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Bounds)) return false;
        Bounds other = (Bounds) obj;
        return Double.compare(min, other.min) == 0
            && Double.compare(max, other.max) == 0;
    }
}
