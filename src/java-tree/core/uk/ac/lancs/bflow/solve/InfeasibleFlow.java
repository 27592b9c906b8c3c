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

/**
 * Reports that a problem is infeasible, with a certificate.
 *
 * @author simpsons
 */
public final class InfeasibleFlow extends FlowResult {
    /**
     * Identifies the stage at which infeasibility was detected.
     *
     * @author simpsons
     */
    public enum Cause {
        /**
         * An edge's maximum is below its minimum.
         */
        INVERTED_BOUNDS,

        /**
         * A source or the sink could not be resolved.
         */
        UNRESOLVED_NAMES,

        /**
         * The lower bounds cannot be met together with the caps.
         */
        LOWER_BOUNDS,

        /**
         * The supply cannot all be delivered to the sink.
         */
        SUPPLY;
    }

    /**
     * The stage at which infeasibility was detected
     */
    public final Cause cause;

    /**
     * The proof of infeasibility
     */
    public final Certificate certificate;

    InfeasibleFlow(Cause cause, Certificate certificate) {
        this.cause = cause;
        this.certificate = certificate;
    }

    @Override
    public Status status() {
        return Status.INFEASIBLE;
    }

    @Override
    public String toString() {
        return "infeasible (" + cause + ") by "
            + certificate.deficit.demandBalance;
    }
}
