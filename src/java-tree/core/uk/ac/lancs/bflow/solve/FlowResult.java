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

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Reports the outcome of solving a flow problem. The outcome is one of
 * {@link FeasibleFlow}, {@link InfeasibleFlow} or {@link SolverFault},
 * as indicated by {@link #status()}.
 *
 * @author simpsons
 */
public abstract class FlowResult {
    /**
     * The magnitude below which a reported amount is zeroed, namely
     * {@value}
     */
    public static final double OUTPUT_CLAMP = 1e-12;

    /**
     * The number of decimal places to which reported amounts are
     * rounded, namely {@value}
     */
    public static final int OUTPUT_SCALE = 9;

    /**
     * Distinguishes the kinds of outcome.
     *
     * @author simpsons
     */
    public enum Status {
        /**
         * The problem is feasible, and a flow assignment is available.
         */
        OK("ok"),

        /**
         * The problem is infeasible, and a certificate is available.
         */
        INFEASIBLE("infeasible"),

        /**
         * The problem could not be solved because of malformed input or
         * an internal fault.
         */
        ERROR("error");

        /**
         * The external label for this status
         */
        public final String label;

        Status(String label) {
            this.label = label;
        }
    }

    FlowResult() {}

    /**
     * Get the kind of outcome.
     *
     * @return the outcome's status
     */
    public abstract Status status();

    /**
     * Prepare an amount for reporting. Magnitudes below
     * {@link #OUTPUT_CLAMP} become zero, and others are rounded to
     * {@link #OUTPUT_SCALE} decimal places, halves to even.
     *
     * @param amount the raw amount
     *
     * @return the reportable amount
     */
    public static double tidy(double amount) {
        if (Math.abs(amount) < OUTPUT_CLAMP) return 0.0;
        if (!Double.isFinite(amount)) return amount;
        double result = new BigDecimal(amount)
            .setScale(OUTPUT_SCALE, RoundingMode.HALF_EVEN).doubleValue();
        return result == 0.0 ? 0.0 : result;
    }
}
