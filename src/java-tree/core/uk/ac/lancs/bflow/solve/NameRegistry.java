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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Assigns vertex indices to named nodes. Names are processed in
 * lexicographic order, and each receives the next free index, or the
 * next two if it is to be split. Indices beyond those assigned to names
 * are available for other purposes.
 *
 * @author simpsons
 */
final class NameRegistry {
    private final Map<String, NodeIdentity> identities;
    private final int vertexCount;

    /**
     * Assign indices to a set of names.
     *
     * @param names the names to be registered
     *
     * @param splitting identifies the names whose nodes are to be split
     */
    NameRegistry(Collection<String> names, Predicate<? super String> splitting) {
        Map<String, NodeIdentity> identities = new LinkedHashMap<>();
        int next = 0;
        for (String name : new TreeSet<>(names)) {
            if (splitting.test(name)) {
                identities.put(name, NodeIdentity.split(next));
                next += 2;
            } else {
                identities.put(name, NodeIdentity.single(next));
                next++;
            }
        }
        this.identities = Collections.unmodifiableMap(identities);
        this.vertexCount = next;
    }

    /**
     * Get the identity of a named node.
     *
     * @param name the node name
     *
     * @return the node's identity, or {@code null} if not registered
     */
    NodeIdentity get(String name) {
        return identities.get(name);
    }

    /**
     * Get all identities, in name order.
     *
     * @return an immutable map from name to identity
     */
    Map<String, NodeIdentity> identities() {
        return identities;
    }

    /**
     * Get the number of indices assigned.
     *
     * @return the lowest unassigned index
     */
    int vertexCount() {
        return vertexCount;
    }
}
