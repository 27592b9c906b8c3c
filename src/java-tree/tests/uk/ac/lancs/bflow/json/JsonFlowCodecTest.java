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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import javax.json.Json;
import javax.json.JsonArray;
import javax.json.JsonObject;
import org.junit.jupiter.api.Test;
import uk.ac.lancs.bflow.graph.DeclaredEdge;
import uk.ac.lancs.bflow.graph.FlowProblem;
import uk.ac.lancs.bflow.solve.FlowSolver;
import uk.ac.lancs.bflow.solve.SolverFault;
import uk.ac.lancs.bflow.solve.SupplyPolicy;

public class JsonFlowCodecTest {
    private final JsonFlowCodec codec = new JsonFlowCodec();

    private FlowProblem fixture(String name)
        throws IOException, ProblemFormatException {
        try (Reader in =
            new InputStreamReader(getClass().getResourceAsStream(name),
                                  StandardCharsets.UTF_8)) {
            return codec.readProblem(in);
        }
    }

    private FlowProblem parse(String text) throws ProblemFormatException {
        return codec.readProblem(new StringReader(text));
    }

    private static JsonObject reparse(JsonObject obj) {
        return Json.createReader(new StringReader(obj.toString()))
            .readObject();
    }

    @Test
    public void readsFullProblem() throws Exception {
        FlowProblem problem = fixture("scenario-a.json");
        assertEquals(3, problem.edges.size());
        DeclaredEdge mid = problem.edges.get(1);
        assertEquals("A", mid.from);
        assertEquals("B", mid.to);
        assertEquals(0.0, mid.bounds.min());
        assertEquals(5.0, mid.bounds.max());
        assertEquals(Map.of("S", 10.0), problem.sources);
        assertEquals("T", problem.sink);
        assertEquals(Map.of("A", 8.0, "B", 10.0), problem.nodeCaps);
    }

    @Test
    public void missingMembersTakeDefaults() throws Exception {
        FlowProblem problem = fixture("unknown-source.json");
        assertEquals(0.0, problem.edges.get(0).bounds.min());
        assertEquals(10.0, problem.edges.get(0).bounds.max());
        assertTrue(problem.nodeCaps.isEmpty());

        FlowProblem bare = parse("{\"edges\":[{\"from\":\"A\",\"to\":\"B\"}]}");
        assertEquals(0.0, bare.edges.get(0).bounds.max());
        assertTrue(bare.sources.isEmpty());
        assertNull(bare.sink);
    }

    @Test
    public void invertedBoundsAreNotAFormatError() throws Exception {
        FlowProblem problem = fixture("inverted.json");
        assertTrue(problem.edges.get(0).bounds.isInverted(0.0));
    }

    @Test
    public void rejectsMalformedDocuments() {
        assertThrows(ProblemFormatException.class, () -> parse("not json"));
        assertThrows(ProblemFormatException.class, () -> parse("{"));
        assertThrows(ProblemFormatException.class, () -> parse("[]"));
        assertThrows(ProblemFormatException.class, () -> parse("{}"));
        assertThrows(ProblemFormatException.class,
                     () -> parse("{\"edges\":{}}"));
        assertThrows(ProblemFormatException.class,
                     () -> parse("{\"edges\":[3]}"));
        assertThrows(ProblemFormatException.class,
                     () -> parse("{\"edges\":[{\"to\":\"B\"}]}"));
        assertThrows(ProblemFormatException.class,
                     () -> parse("{\"edges\":[{\"from\":\"A\",\"to\":\"B\","
                         + "\"hi\":\"lots\"}]}"));
        assertThrows(ProblemFormatException.class,
                     () -> parse("{\"edges\":[],\"sink\":4}"));
        assertThrows(ProblemFormatException.class,
                     () -> parse("{\"edges\":[],\"sources\":{\"S\":\"x\"}}"));
    }

    @Test
    public void rejectsNegativeQuantities() {
        ProblemFormatException ex =
            assertThrows(ProblemFormatException.class,
                         () -> parse("{\"edges\":[{\"from\":\"A\","
                             + "\"to\":\"B\",\"lo\":-1,\"hi\":2}]}"));
        assertTrue(ex.getMessage().contains("A->B"), ex.getMessage());
        assertThrows(ProblemFormatException.class,
                     () -> parse("{\"edges\":[],"
                         + "\"node_caps\":{\"A\":-3}}"));
    }

    @Test
    public void rejectsOutOfRangeNumbers() {
        assertThrows(ProblemFormatException.class,
                     () -> parse("{\"edges\":[{\"from\":\"S\","
                         + "\"to\":\"T\",\"hi\":1e400}],"
                         + "\"sources\":{\"S\":10},\"sink\":\"T\"}"));
        assertThrows(ProblemFormatException.class,
                     () -> parse("{\"edges\":[{\"from\":\"S\","
                         + "\"to\":\"T\",\"lo\":1e400,\"hi\":1}]}"));
        ProblemFormatException ex =
            assertThrows(ProblemFormatException.class,
                         () -> parse("{\"edges\":[],"
                             + "\"sources\":{\"S\":1e400}}"));
        assertTrue(ex.getMessage().contains("sources.S"), ex.getMessage());
        assertThrows(ProblemFormatException.class,
                     () -> parse("{\"edges\":[],"
                         + "\"sources\":{\"S\":-1e400}}"));
        assertThrows(ProblemFormatException.class,
                     () -> parse("{\"edges\":[],"
                         + "\"node_caps\":{\"A\":1e400}}"));
    }

    @Test
    public void encodesFeasibleFlow() throws Exception {
        JsonObject obj = codec.encode(new FlowSolver()
            .solve(fixture("scenario-a.json")));
        obj = reparse(obj);
        assertEquals("ok", obj.getString("status"));
        assertEquals(5.0, obj.getJsonNumber("max_flow_per_min").doubleValue());
        JsonArray flows = obj.getJsonArray("flows");
        assertEquals(3, flows.size());
        JsonObject first = flows.getJsonObject(0);
        assertEquals("S", first.getString("from"));
        assertEquals("A", first.getString("to"));
        assertEquals(5.0, first.getJsonNumber("flow").doubleValue());
        assertFalse(obj.containsKey("deficit"));
    }

    @Test
    public void encodesCertificate() throws Exception {
        JsonObject obj = codec.encode(new FlowSolver(SupplyPolicy.EXACT)
            .solve(fixture("scenario-a.json")));
        obj = reparse(obj);
        assertEquals("infeasible", obj.getString("status"));
        assertEquals(Json.createArrayBuilder().add("A").add("S").build(),
                     obj.getJsonArray("cut_reachable"));
        JsonObject deficit = obj.getJsonObject("deficit");
        assertEquals(5.0,
                     deficit.getJsonNumber("demand_balance").doubleValue());
        assertTrue(deficit.getJsonArray("tight_nodes").isEmpty());
        JsonObject edge = deficit.getJsonArray("tight_edges").getJsonObject(0);
        assertEquals("A", edge.getString("from"));
        assertEquals("B", edge.getString("to"));
        assertEquals(5.0, edge.getJsonNumber("flow_needed").doubleValue());
    }

    @Test
    public void encodesTrivialCertificate() throws Exception {
        JsonObject obj =
            codec.encode(new FlowSolver().solve(fixture("unknown-source.json")));
        assertEquals("infeasible", obj.getString("status"));
        assertTrue(obj.getJsonArray("cut_reachable").isEmpty());
        assertEquals(7.0, obj.getJsonObject("deficit")
            .getJsonNumber("demand_balance").doubleValue());
    }

    @Test
    public void encodesFault() {
        JsonObject obj = codec
            .encode(SolverFault.of(SolverFault.Kind.INTERNAL,
                                   new IllegalStateException("broken")));
        assertEquals("error", obj.getString("status"));
        JsonObject error = obj.getJsonObject("error");
        assertEquals("internal", error.getString("type"));
        assertEquals("broken", error.getString("message"));
    }

    @Test
    public void writtenDocumentStandsAlone() throws Exception {
        StringWriter out = new StringWriter();
        codec.writeResult(new FlowSolver().solve(fixture("inverted.json")),
                          out);
        JsonObject obj =
            Json.createReader(new StringReader(out.toString())).readObject();
        assertEquals("infeasible", obj.getString("status"));
        assertFalse(out.toString().contains("\n"));
    }

    @Test
    public void prettyDocumentsAreIndented() {
        StringWriter out = new StringWriter();
        new JsonFlowCodec(true)
            .writeResult(new SolverFault(SolverFault.Kind.INPUT, "bad"), out);
        assertTrue(out.toString().contains("\n"), out.toString());
        JsonObject obj =
            Json.createReader(new StringReader(out.toString())).readObject();
        assertEquals("input",
                     obj.getJsonObject("error").getString("type"));
    }
}
