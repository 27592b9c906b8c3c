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

package uk.ac.lancs.bflow.apps;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import javax.json.JsonObject;
import uk.ac.lancs.bflow.graph.FlowProblem;
import uk.ac.lancs.bflow.json.JsonFlowCodec;
import uk.ac.lancs.bflow.json.ProblemFormatException;
import uk.ac.lancs.bflow.solve.FeasibleFlow;
import uk.ac.lancs.bflow.solve.FlowResult;
import uk.ac.lancs.bflow.solve.FlowSolver;
import uk.ac.lancs.bflow.solve.SolverFault;
import uk.ac.lancs.bflow.solve.SupplyPolicy;
import uk.ac.lancs.bflow.verify.FlowVerifier;
import uk.ac.lancs.config.Configuration;
import uk.ac.lancs.config.ConfigurationContext;

/**
 * Reads a flow problem as JSON, solves it, and writes the result as
 * JSON. Exactly one document is written, and nothing else appears on
 * the output. Diagnostics go to the log.
 *
 * <p>
 * The following configuration parameters are recognized:
 *
 * <dl>
 *
 * <dt><samp>solver.supply-policy</samp>
 *
 * <dd><samp>maximize</samp> (the default) to treat supplies as
 * ceilings, or <samp>exact</samp> to require that all supply be
 * delivered
 *
 * <dt><samp>output.pretty</samp>
 *
 * <dd><samp>true</samp> to indent the output document
 *
 * <dt><samp>output.verify</samp>
 *
 * <dd><samp>true</samp> to check feasible results independently, and
 * log any violations as warnings
 *
 * </dl>
 *
 * <p>
 * Parameters are taken from the file named by <samp>-c</samp>. System
 * properties supply defaults, and the bundled
 * <samp>solveflow.properties</samp> supplies defaults for those.
 *
 * @author simpsons
 */
public final class SolveFlow {
    private static final Logger logger =
        Logger.getLogger("uk.ac.lancs.bflow.apps");

    private final FlowSolver solver;
    private final JsonFlowCodec codec;
    private final boolean verify;

    /**
     * Prepare to solve problems.
     *
     * @param policy the way supplies constrain solutions
     *
     * @param pretty whether to indent output documents
     *
     * @param verify whether to check feasible results independently
     */
    public SolveFlow(SupplyPolicy policy, boolean pretty, boolean verify) {
        this.solver = new FlowSolver(policy);
        this.codec = new JsonFlowCodec(pretty);
        this.verify = verify;
    }

    /**
     * Prepare to solve problems according to configuration.
     *
     * @param config the configuration
     *
     * @throws IllegalArgumentException if a parameter has an
     * unrecognized value
     */
    public SolveFlow(Configuration config) {
        this(SupplyPolicy.forLabel(config.get("solver.supply-policy",
                                              SupplyPolicy.MAXIMIZE.label)),
             config.getBoolean("output.pretty", false),
             config.getBoolean("output.verify", false));
    }

    /**
     * Solve one problem. Malformed input and unexpected failures are
     * reported as faults in the output document rather than thrown.
     *
     * @param in the source of the problem document
     *
     * @param out the destination for the result document; flushed but
     * not closed
     *
     * @return the result written
     *
     * @throws IOException if the result could not be written
     */
    public FlowResult run(Reader in, Writer out) throws IOException {
        FlowResult result;
        try {
            FlowProblem problem = codec.readProblem(in);
            final FlowResult solved = solver.solve(problem);
            logger.fine(() -> "result: " + solved);
            if (verify && solved instanceof FeasibleFlow) {
                List<String> violations =
                    FlowVerifier.check(problem, (FeasibleFlow) solved);
                for (String v : violations)
                    logger.warning(() -> "verification: " + v);
            }
            result = solved;
        } catch (ProblemFormatException ex) {
            logger.log(Level.INFO, "bad input", ex);
            result = SolverFault.of(SolverFault.Kind.INPUT, ex);
        } catch (RuntimeException ex) {
            logger.log(Level.SEVERE, "failure solving problem", ex);
            result = SolverFault.of(SolverFault.Kind.INTERNAL, ex);
        }

        /* Encode before writing anything, so that a failure here still
         * leaves one complete document. */
        JsonObject doc;
        try {
            doc = codec.encode(result);
        } catch (RuntimeException ex) {
            logger.log(Level.SEVERE, "failure encoding " + result, ex);
            result = SolverFault.of(SolverFault.Kind.INTERNAL, ex);
            doc = codec.encode(result);
        }
        codec.write(doc, out);
        out.flush();
        return result;
    }

    private static void usage() {
        System.err.printf("usage: SolveFlow [-c config] [-i input]"
            + " [-o output] [-p maximize|exact] [-v]%n");
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null)
            return;
        try (InputStream in =
            SolveFlow.class.getResourceAsStream("logging.properties")) {
            if (in != null) LogManager.getLogManager().readConfiguration(in);
        } catch (IOException ex) {
            logger.log(Level.WARNING, "default logging configuration", ex);
        }
    }

    /**
     * Get the bundled configuration defaults, overridden by system
     * properties.
     *
     * @return the defaults
     *
     * @throws IOException if the bundled defaults could not be read
     */
    static Properties defaults() throws IOException {
        Properties result = new Properties();
        try (InputStream in =
            SolveFlow.class.getResourceAsStream("solveflow.properties")) {
            if (in != null) result.load(in);
        }
        Properties system = System.getProperties();
        for (String key : system.stringPropertyNames())
            result.setProperty(key, system.getProperty(key));
        return result;
    }

    /**
     * Solve a problem from the command line.
     *
     * <p>
     * Arguments are:
     *
     * <dl>
     *
     * <dt><samp>-c <var>file</var></samp>
     *
     * <dd>Load configuration from the file.
     *
     * <dt><samp>-i <var>file</var></samp>
     *
     * <dd>Read the problem from the file instead of standard input.
     *
     * <dt><samp>-o <var>file</var></samp>
     *
     * <dd>Write the result to the file instead of standard output.
     *
     * <dt><samp>-p <var>policy</var></samp>
     *
     * <dd>Override the supply policy.
     *
     * <dt><samp>-v</samp>
     *
     * <dd>Verify feasible results.
     *
     * </dl>
     *
     * @param args the command-line arguments
     *
     * @throws Exception if an error occurs
     *
     * @see #launch(String[], InputStream, OutputStream)
     */
    public static void main(String[] args) throws Exception {
        configureLogging();
        System.exit(launch(args, System.in, System.out));
    }

    /**
     * Interpret command-line arguments, and solve the problem they
     * identify.
     *
     * @param args the command-line arguments
     *
     * @param stdin the input to use when no input file is specified
     *
     * @param stdout the output to use when no output file is specified;
     * flushed but not closed
     *
     * @return 0 if the problem was solved (feasible or not); 1 if it
     * could not be solved; 2 if the arguments were wrong
     *
     * @throws IOException if the result could not be written
     */
    static int launch(String[] args, InputStream stdin, OutputStream stdout)
        throws IOException {
        File confFile = null, inFile = null, outFile = null;
        String policy = null;
        boolean verify = false;
        try {
            for (Iterator<String> iter = Arrays.asList(args).iterator(); iter
                .hasNext();) {
                final String arg = iter.next();
                switch (arg) {
                case "-c":
                    confFile = new File(iter.next());
                    break;
                case "-i":
                    inFile = new File(iter.next());
                    break;
                case "-o":
                    outFile = new File(iter.next());
                    break;
                case "-p":
                    policy = iter.next();
                    break;
                case "-v":
                    verify = true;
                    break;
                default:
                    System.err.printf("Unknown argument: %s%n", arg);
                    usage();
                    return 2;
                }
            }
        } catch (NoSuchElementException ex) {
            usage();
            return 2;
        }

        ConfigurationContext configCtxt = new ConfigurationContext(defaults());
        final Configuration config;
        try {
            config = confFile == null ? configCtxt.defaults()
                : configCtxt.get(confFile);
        } catch (IOException ex) {
            System.err.printf("Cannot read configuration %s: %s%n", confFile,
                              ex.getMessage());
            usage();
            return 2;
        }
        final SolveFlow app;
        try {
            SupplyPolicy chosen = SupplyPolicy
                .forLabel(policy != null ? policy
                    : config.get("solver.supply-policy",
                                 SupplyPolicy.MAXIMIZE.label));
            app = new SolveFlow(chosen,
                                config.getBoolean("output.pretty", false),
                                verify || config.getBoolean("output.verify",
                                                            false));
            logger.config(() -> "policy " + chosen.label);
        } catch (IllegalArgumentException ex) {
            System.err.printf("%s%n", ex.getMessage());
            usage();
            return 2;
        }

        final InputStream in;
        try {
            in = inFile == null ? stdin : Files.newInputStream(inFile.toPath());
        } catch (IOException ex) {
            System.err.printf("Cannot read input %s: %s%n", inFile,
                              ex.getMessage());
            usage();
            return 2;
        }

        final FlowResult result;
        try (InputStream closing = inFile == null ? null : in;
             OutputStream file = outFile == null ? null
                 : Files.newOutputStream(outFile.toPath())) {
            Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
            Writer writer =
                new OutputStreamWriter(file == null ? stdout : file,
                                       StandardCharsets.UTF_8);
            result = app.run(reader, writer);
        }
        return result.status() == FlowResult.Status.ERROR ? 1 : 0;
    }
}
