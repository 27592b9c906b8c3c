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

package uk.ac.lancs.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;

public class ConfigurationContextTest {
    private static URI location() throws Exception {
        return ConfigurationContextTest.class
            .getResource("solver.properties").toURI();
    }

    private static List<String> keys(Configuration conf) {
        List<String> result = new ArrayList<>();
        conf.keys().forEach(result::add);
        return result;
    }

    @Test
    public void loadsPropertiesFile() throws Exception {
        ConfigurationContext ctxt = new ConfigurationContext();
        Configuration conf = ctxt.get(location());
        assertEquals("exact", conf.get("solver.supply-policy"));
        assertTrue(conf.getBoolean("output.pretty", false));
        assertTrue(conf.getBoolean("output.verify", false));
        assertFalse(conf.getBoolean("output.missing", false));
        assertNull(conf.get("output.missing"));
        assertEquals("x", conf.get("output.missing", "x"));
        assertEquals("", conf.prefix());
        assertEquals(List.of("alt.solver.supply-policy", "output.pretty",
                             "output.verify", "solver.supply-policy"),
                     keys(conf));
    }

    @Test
    public void filesAreCached() throws Exception {
        ConfigurationContext ctxt = new ConfigurationContext();
        assertSame(ctxt.get(location()), ctxt.get(location()));
        assertSame(ctxt.get(location()), ctxt.get(new File(location())));
        assertEquals(location().toString(), ctxt.get(location()).toString());
    }

    @Test
    public void fragmentSelectsSubview() throws Exception {
        ConfigurationContext ctxt = new ConfigurationContext();
        Configuration alt =
            ctxt.get(new URI(location().toString() + "#alt"));
        assertEquals("alt.", alt.prefix());
        assertEquals("maximize", alt.get("solver.supply-policy"));
        assertEquals(List.of("solver.supply-policy"), keys(alt));
        assertEquals("maximize",
                     alt.toProperties().getProperty("solver.supply-policy"));
        assertEquals(1, alt.toProperties().size());
    }

    @Test
    public void subviewsNest() throws Exception {
        Configuration conf = new ConfigurationContext().get(location());
        Configuration solver = conf.subview("alt").subview("solver");
        assertEquals("alt.solver.", solver.prefix());
        assertEquals("maximize", solver.get("supply-policy"));
        assertSame(conf, conf.subview(""));
    }

    @Test
    public void defaultsFillGaps() throws Exception {
        Properties defaults = new Properties();
        defaults.setProperty("solver.supply-policy", "maximize");
        defaults.setProperty("extra", "1");
        ConfigurationContext ctxt = new ConfigurationContext(defaults);
        Configuration conf = ctxt.get(location());
        assertEquals("exact", conf.get("solver.supply-policy"));
        assertEquals("1", conf.get("extra"));

        Configuration plain = ctxt.defaults();
        assertEquals("maximize", plain.get("solver.supply-policy"));
        defaults.setProperty("extra", "2");
        assertEquals("1", plain.get("extra"));
    }

    @Test
    public void badBooleanIsRejected() {
        Properties props = new Properties();
        props.setProperty("flag", "perhaps");
        Configuration conf = new ConfigurationContext(props).defaults();
        assertThrows(IllegalArgumentException.class,
                     () -> conf.getBoolean("flag", true));
    }

    @Test
    public void keysAreNormalized() {
        assertEquals("a.b", Configuration.normalizeKey("a..b."));
        assertEquals("a.b", Configuration.normalizeKey(".a.b"));
        assertEquals("a.b.", Configuration.normalizePrefix("a.b"));
        assertEquals("", Configuration.normalizePrefix(""));
        assertNull(Configuration.normalizeKey(null));
    }
}
