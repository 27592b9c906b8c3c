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
 * Reports that a problem could not be solved at all. This is distinct
 * from a proof of infeasibility.
 *
 * @author simpsons
 */
public final class SolverFault extends FlowResult {
    /**
     * Distinguishes bad input from internal failures.
     *
     * @author simpsons
     */
    public enum Kind {
        /**
         * The input could not be interpreted as a problem.
         */
        INPUT("input"),

        /**
         * An unexpected failure occurred.
         */
        INTERNAL("internal");

        /**
         * The external label for this kind
         */
        public final String label;

        Kind(String label) {
            this.label = label;
        }
    }

    /**
     * The kind of fault
     */
    public final Kind kind;

    /**
     * A description of the fault
     */
    public final String message;

    /**
     * Create a fault report.
     *
     * @param kind the kind of fault
     *
     * @param message a description of the fault
     */
    public SolverFault(Kind kind, String message) {
        this.kind = kind;
        this.message = message == null ? "" : message;
    }

    /**
     * Create a fault report from an exception.
     *
     * @param kind the kind of fault
     *
     * @param t the exception
     *
     * @return the new fault report
     *
     * @constructor
     */
    public static SolverFault of(Kind kind, Throwable t) {
        String msg = t.getMessage();
        return new SolverFault(kind, msg == null ? t.getClass().getName()
            : msg);
    }

    @Override
    public Status status() {
        return Status.ERROR;
    }

    @Override
    public String toString() {
        return "error (" + kind.label + "): " + message;
    }
}
