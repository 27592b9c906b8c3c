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

import java.util.Collections;
import java.util.List;

/**
 * Proves that a problem is infeasible. The cut is the set of nodes
 * still reachable from the source of the failed phase, and the deficit
 * says by how much the phase fell short and which saturated parts of
 * the network were responsible.
 *
 * @author simpsons
 */
public final class Certificate {
    /**
     * The names of nodes on the source side of the cut, in
     * lexicographic order
     */
    public final List<String> cutReachable;

    /**
     * The shortfall and its causes
     */
    public final Deficit deficit;

    Certificate(List<String> cutReachable, Deficit deficit) {
        this.cutReachable = List.copyOf(cutReachable);
        this.deficit = deficit;
    }

    /**
     * Create a certificate for a shortfall detected before any flow was
     * computed. It has an empty cut and no tight parts.
     *
     * @param shortfall the shortfall
     *
     * @return the new certificate
     */
    static Certificate trivial(double shortfall) {
        return new Certificate(Collections.emptyList(),
                               new Deficit(FlowResult.tidy(shortfall),
                                           Collections.emptyList(),
                                           Collections.emptyList()));
    }
}
