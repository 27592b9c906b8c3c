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

import java.util.Arrays;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Views a set of named configuration properties. Property names are the
 * same as for Java properties files.
 * 
 * <p>
 * Subviews of a configuration are obtainable. For example, if the
 * subview <samp>foo.bar</samp> is obtained, then only properties whose
 * names in the original view begin with <samp>foo.bar.</samp> will be
 * visible. Furthermore, their names will lack the prefix
 * <samp>foo.bar.</samp>.
 * 
 * @author simpsons
 */
public interface Configuration {
    /**
     * Get a configuration parameter.
     * 
     * @param key the parameter key
     * 
     * @return the parameter's value, or {@code null} if not present
     */
    String get(String key);

    /**
     * Get a configuration parameter, or a default.
     * 
     * @param key the parameter key
     * 
     * @param defaultValue the value to return if the parameter is not
     * set
     * 
     * @return the parameter's value, or <samp>defaultValue</samp> if
     * not set
     */
    default String get(String key, String defaultValue) {
        String value = get(key);
        if (value == null) return defaultValue;
        return value;
    }

    /**
     * Get a boolean configuration parameter, or a default. The values
     * <samp>true</samp>, <samp>yes</samp> and <samp>on</samp> are
     * true, ignoring case; <samp>false</samp>, <samp>no</samp> and
     * <samp>off</samp> are false.
     * 
     * @param key the parameter key
     * 
     * @param defaultValue the value to return if the parameter is not
     * set
     * 
     * @return the parameter's value, or <samp>defaultValue</samp> if
     * not set
     * 
     * @throws IllegalArgumentException if the value is set but not
     * recognized
     */
    default boolean getBoolean(String key, boolean defaultValue) {
        String value = get(key);
        if (value == null) return defaultValue;
        switch (value.trim().toLowerCase()) {
        case "true":
        case "yes":
        case "on":
            return true;
        case "false":
        case "no":
        case "off":
            return false;
        default:
            throw new IllegalArgumentException("not boolean: " + key + "="
                + value);
        }
    }

    /**
     * Convert the properties in this configuration into a conventional
     * Java properties object.
     * 
     * @return a copy of this configuration's properties
     */
    default Properties toProperties() {
        Properties result = new Properties();
        for (String key : keys())
            result.setProperty(key, get(key));
        return result;
    }

    /**
     * Get a subview.
     * 
     * @param prefix the additional prefix to narrow down the available
     * parameters
     * 
     * @return the requested subview
     */
    Configuration subview(String prefix);

    /**
     * List keys in this configuration.
     * 
     * @return the keys
     */
    Iterable<String> keys();

    /**
     * Get the prefix of this view relative to the base configuration.
     * 
     * @return the prefix, ending with a dot; or an empty string for the
     * base configuration
     */
    String prefix();

    /**
     * Normalize a node key. Double dots are condensed to single ones.
     * Leading and trailing dots are removed.
     * 
     * @param key the node key to normalize
     * 
     * @return the normalized node key
     */
    public static String normalizeKey(String key) {
        if (key == null) return null;
        List<String> parts =
            new LinkedList<>(Arrays.asList(key.split("\\.+")));
        for (ListIterator<String> iter = parts.listIterator(); iter
            .hasNext();) {
            String val = iter.next();
            if (val.isEmpty()) iter.remove();
        }
        return parts.stream().collect(Collectors.joining("."));
    }

    /**
     * Normalize a node key prefix. An empty prefix stays empty.
     * 
     * @param prefix the node key prefix to normalize
     * 
     * @return the normalized prefix
     */
    public static String normalizePrefix(String prefix) {
        if (prefix == null) return null;
        String key = normalizeKey(prefix);
        return key.isEmpty() ? "" : key + '.';
    }
}
