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

package uk.ac.lancs.bflow.json;

import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.json.Json;
import javax.json.JsonArray;
import javax.json.JsonArrayBuilder;
import javax.json.JsonException;
import javax.json.JsonNumber;
import javax.json.JsonObject;
import javax.json.JsonObjectBuilder;
import javax.json.JsonReader;
import javax.json.JsonString;
import javax.json.JsonValue;
import javax.json.JsonWriter;
import javax.json.JsonWriterFactory;
import javax.json.stream.JsonGenerator;
import uk.ac.lancs.bflow.graph.Bounds;
import uk.ac.lancs.bflow.graph.DeclaredEdge;
import uk.ac.lancs.bflow.graph.FlowProblem;
import uk.ac.lancs.bflow.solve.Certificate;
import uk.ac.lancs.bflow.solve.EdgeFlow;
import uk.ac.lancs.bflow.solve.FeasibleFlow;
import uk.ac.lancs.bflow.solve.FlowResult;
import uk.ac.lancs.bflow.solve.InfeasibleFlow;
import uk.ac.lancs.bflow.solve.SolverFault;
import uk.ac.lancs.bflow.solve.TightEdge;

/**
 * Converts flow problems from JSON, and results to JSON.
 *
 * <p>
 * A problem is an object with the following members:
 *
 * <dl>
 *
 * <dt><samp>edges</samp>
 *
 * <dd>An array of objects, each with string members <samp>from</samp>
 * and <samp>to</samp>, and numeric members <samp>lo</samp> and
 * <samp>hi</samp>, both defaulting to zero. This member is required.
 *
 * <dt><samp>sources</samp>
 *
 * <dd>An object mapping source names to supplies. The default is
 * empty.
 *
 * <dt><samp>sink</samp>
 *
 * <dd>The name of the sink. A missing sink is not a format error, but
 * makes the problem infeasible.
 *
 * <dt><samp>node_caps</samp>
 *
 * <dd>An object mapping node names to non-negative throughput caps. The
 * default is empty.
 *
 * </dl>
 *
 * <p>
 * Other members are ignored.
 *
 * @author simpsons
 */
public final class JsonFlowCodec {
    private final JsonWriterFactory writerFactory;

    /**
     * Create a codec.
     *
     * @param pretty {@code true} if written documents should be
     * indented
     */
    public JsonFlowCodec(boolean pretty) {
        Map<String, Object> config = new LinkedHashMap<>();
        if (pretty) config.put(JsonGenerator.PRETTY_PRINTING, true);
        this.writerFactory = Json.createWriterFactory(config);
    }

    /**
     * Create a codec producing compact documents.
     */
    public JsonFlowCodec() {
        this(false);
    }

    /**
     * Read a problem from a character stream. Exactly one JSON object
     * is read.
     *
     * @param in the source of the document
     *
     * @return the problem
     *
     * @throws ProblemFormatException if the stream does not hold a
     * well-formed problem
     */
    public FlowProblem readProblem(Reader in) throws ProblemFormatException {
        final JsonObject root;
        try (JsonReader reader = Json.createReader(in)) {
            root = reader.readObject();
        } catch (JsonException | IllegalStateException ex) {
            throw new ProblemFormatException("not a JSON object: "
                + ex.getMessage(), ex);
        }
        return decodeProblem(root);
    }

    /**
     * Interpret a JSON object as a problem.
     *
     * @param root the JSON object
     *
     * @return the problem
     *
     * @throws ProblemFormatException if the object is not a well-formed
     * problem
     */
    public FlowProblem decodeProblem(JsonObject root)
        throws ProblemFormatException {
        JsonArray edgesDesc = member(root, "edges", JsonArray.class, null);
        if (edgesDesc == null)
            throw new ProblemFormatException("missing edges");

        List<DeclaredEdge> edges = new ArrayList<>(edgesDesc.size());
        for (int i = 0; i < edgesDesc.size(); i++) {
            JsonValue item = edgesDesc.get(i);
            if (!(item instanceof JsonObject))
                throw new ProblemFormatException("edge " + i
                    + " not an object");
            JsonObject edgeDesc = (JsonObject) item;
            String from = text(edgeDesc, "from", "edge " + i);
            String to = text(edgeDesc, "to", "edge " + i);
            double lo = number(edgeDesc, "lo", 0.0);
            double hi = number(edgeDesc, "hi", 0.0);
            try {
                edges.add(new DeclaredEdge(from, to, Bounds.between(lo, hi)));
            } catch (IllegalArgumentException ex) {
                throw new ProblemFormatException("edge " + i + " (" + from
                    + "->" + to + "): " + ex.getMessage(), ex);
            }
        }

        Map<String, Double> sources = amounts(root, "sources");
        Map<String, Double> caps = amounts(root, "node_caps");

        String sink = null;
        JsonValue sinkDesc = root.get("sink");
        if (sinkDesc instanceof JsonString) {
            sink = ((JsonString) sinkDesc).getString();
        } else if (sinkDesc != null && sinkDesc != JsonValue.NULL) {
            throw new ProblemFormatException("sink not a string");
        }

        try {
            return new FlowProblem(edges, sources, sink, caps);
        } catch (IllegalArgumentException ex) {
            throw new ProblemFormatException(ex.getMessage(), ex);
        }
    }

    /**
     * Express a result as a JSON object.
     *
     * @param result the result to express
     *
     * @return the JSON representation
     */
    public JsonObject encode(FlowResult result) {
        JsonObjectBuilder builder = Json.createObjectBuilder()
            .add("status", result.status().label);
        switch (result.status()) {
        case OK: {
            FeasibleFlow ok = (FeasibleFlow) result;
            JsonArrayBuilder flows = Json.createArrayBuilder();
            for (EdgeFlow f : ok.flows)
                flows.add(Json.createObjectBuilder().add("from", f.from)
                    .add("to", f.to).add("flow", f.flow));
            builder.add("max_flow_per_min", ok.maxFlow).add("flows", flows);
            break;
        }

        case INFEASIBLE: {
            Certificate cert = ((InfeasibleFlow) result).certificate;
            JsonArrayBuilder edges = Json.createArrayBuilder();
            for (TightEdge te : cert.deficit.tightEdges)
                edges.add(Json.createObjectBuilder().add("from", te.from)
                    .add("to", te.to).add("flow_needed", te.flowNeeded));
            builder.add("cut_reachable", strings(cert.cutReachable))
                .add("deficit", Json.createObjectBuilder()
                    .add("demand_balance", cert.deficit.demandBalance)
                    .add("tight_nodes", strings(cert.deficit.tightNodes))
                    .add("tight_edges", edges));
            break;
        }

        case ERROR: {
            SolverFault fault = (SolverFault) result;
            builder.add("error", Json.createObjectBuilder()
                .add("type", fault.kind.label).add("message", fault.message));
            break;
        }
        }
        return builder.build();
    }

    /**
     * Write a result as a single JSON document. The writer is not
     * closed.
     *
     * @param result the result to write
     *
     * @param out the destination
     */
    public void writeResult(FlowResult result, Writer out) {
        write(encode(result), out);
    }

    /**
     * Write an encoded result as a single JSON document. The writer is
     * not closed.
     *
     * @param doc the encoded result
     *
     * @param out the destination
     */
    public void write(JsonObject doc, Writer out) {
        /* The JSON writer is left open, as closing it would close the
         * destination. Writing the object flushes it to the
         * destination anyway. */
        JsonWriter writer = writerFactory.createWriter(out);
        writer.writeObject(doc);
    }

    private static JsonArrayBuilder strings(List<String> items) {
        JsonArrayBuilder builder = Json.createArrayBuilder();
        for (String s : items)
            builder.add(s);
        return builder;
    }

    private static <T extends JsonValue> T
        member(JsonObject obj, String key, Class<T> type, T defaultValue)
            throws ProblemFormatException {
        JsonValue value = obj.get(key);
        if (value == null || value == JsonValue.NULL) return defaultValue;
        if (!type.isInstance(value))
            throw new ProblemFormatException(key + " is "
                + value.getValueType() + ", not " + type.getSimpleName());
        return type.cast(value);
    }

    private static String text(JsonObject obj, String key, String context)
        throws ProblemFormatException {
        JsonString value = member(obj, key, JsonString.class, null);
        if (value == null)
            throw new ProblemFormatException(context + ": missing " + key);
        return value.getString();
    }

    private static double number(JsonObject obj, String key,
                                 double defaultValue)
        throws ProblemFormatException {
        JsonNumber value = member(obj, key, JsonNumber.class, null);
        if (value == null) return defaultValue;
        return finite(key, value);
    }

    private static double finite(String key, JsonNumber value)
        throws ProblemFormatException {
        double result = value.doubleValue();
        if (!Double.isFinite(result))
            throw new ProblemFormatException(key + " out of range: "
                + value);
        return result;
    }

    private static Map<String, Double> amounts(JsonObject root, String key)
        throws ProblemFormatException {
        JsonObject desc = member(root, key, JsonObject.class, null);
        if (desc == null) return Collections.emptyMap();
        Map<String, Double> result = new LinkedHashMap<>();
        for (Map.Entry<String, JsonValue> entry : desc.entrySet()) {
            if (!(entry.getValue() instanceof JsonNumber))
                throw new ProblemFormatException(key + "." + entry.getKey()
                    + " not a number");
            result.put(entry.getKey(),
                       finite(key + "." + entry.getKey(),
                              (JsonNumber) entry.getValue()));
        }
        return result;
    }
}
