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
 * Determines how source supplies constrain a solution.
 *
 * @author simpsons
 */
public enum SupplyPolicy {
    /**
     * Supplies are ceilings. The solution delivers as much as the
     * network allows, and a shortfall against total supply is not an
     * infeasibility.
     */
    MAXIMIZE("maximize"),

    /**
     * Every unit of supply must reach the sink. A shortfall is reported
     * as an infeasibility with a certificate.
     */
    EXACT("exact");

    /**
     * The name of the policy in configuration and on the command line
     */
    public final String label;

    SupplyPolicy(String label) {
        this.label = label;
    }

    /**
     * Find the policy with a given name.
     *
     * @param label the policy's name
     *
     * @return the named policy
     *
     * @throws IllegalArgumentException if no policy has the name
     */
    public static SupplyPolicy forLabel(String label) {
        for (SupplyPolicy p : values())
            if (p.label.equals(label)) return p;
        throw new IllegalArgumentException("unknown supply policy: "
            + label);
    }
}
