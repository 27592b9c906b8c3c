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
 * Identifies the internal vertices representing a named node. An
 * unsplit node has one vertex, used both for flow entering and for flow
 * leaving it. A split node has an entry vertex and an exit vertex,
 * joined by an arc carrying the node's throughput cap.
 *
 * @author simpsons
 */
public abstract class NodeIdentity {
    private NodeIdentity() {}

    /**
     * Get the vertex that flow enters the node by.
     *
     * @return the entry vertex index
     */
    public abstract int in();

    /**
     * Get the vertex that flow leaves the node by.
     *
     * @return the exit vertex index
     */
    public abstract int out();

    /**
     * Determine whether the node has distinct entry and exit vertices.
     *
     * @return {@code true} if the node is split
     */
    public abstract boolean isSplit();

    /**
     * Determine whether this node is represented by a given vertex.
     *
     * @param vertex the vertex index
     *
     * @return {@code true} if the vertex is the entry or exit vertex
     */
    public final boolean covers(int vertex) {
        return in() == vertex || out() == vertex;
    }

    /**
     * Identify an unsplit node.
     *
     * @param vertex the node's only vertex
     *
     * @return the requested identity
     *
     * @constructor
     */
    public static NodeIdentity single(int vertex) {
        return new Single(vertex);
    }

    /**
     * Identify a split node. The exit vertex immediately follows the
     * entry vertex.
     *
     * @param in the node's entry vertex
     *
     * @return the requested identity
     *
     * @constructor
     */
    public static NodeIdentity split(int in) {
        return new Split(in, in + 1);
    }

    private static final class Single extends NodeIdentity {
        private final int vertex;

        Single(int vertex) {
            this.vertex = vertex;
        }

        @Override
        public int in() {
            return vertex;
        }

        @Override
        public int out() {
            return vertex;
        }

        @Override
        public boolean isSplit() {
            return false;
        }

        @Override
        public String toString() {
            return Integer.toString(vertex);
        }
    }

    private static final class Split extends NodeIdentity {
        private final int in, out;

        Split(int in, int out) {
            assert in != out;
            this.in = in;
            this.out = out;
        }

        @Override
        public int in() {
            return in;
        }

        @Override
        public int out() {
            return out;
        }

        @Override
        public boolean isSplit() {
            return true;
        }

        @Override
        public String toString() {
            return in + "/" + out;
        }
    }
}
