/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.celestialproj.math;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default solver settings of the projections that need an iterative inverse.
 *
 * <p>Values come from the classpath resource
 * <code>celestial-projection.properties</code> and are loaded lazily by the
 * first caller. Call {@link #preload()} once at startup to detect a missing or
 * malformed resource early instead of on the first inverse projection.</p>
 */
public final class SolverDefaults {
    private static final Logger log = LoggerFactory.getLogger(SolverDefaults.class);
    static final String RESOURCE = "celestial-projection.properties";

    private static volatile boolean loaded = false;
    private static SolverSettings zpn;
    private static SolverSettings air;
    private static SolverSettings mol;
    private static SolverSettings sip;
    private static int sipReseedGridSize;

    private SolverDefaults() {}

    /**
     * Zenithal polynomial settings. {@code epsilon} is the angular tolerance and
     * {@code step} the domain-discovery scan step, both in radians.
     */
    public static SolverSettings zpn() {
        ensureLoaded();
        return zpn;
    }

    /** Airy settings, the unknown being half the angular distance to the center. */
    public static SolverSettings air() {
        ensureLoaded();
        return air;
    }

    /** Mollweide settings, the unknown being the auxiliary angle {@code 2g}. */
    public static SolverSettings mol() {
        ensureLoaded();
        return mol;
    }

    /** SIP bivariate Newton settings, {@code epsilon} in pixels. */
    public static SolverSettings sip() {
        ensureLoaded();
        return sip;
    }

    /** Number of nodes per axis of the SIP re-seeding grid. */
    public static int sipReseedGridSize() {
        ensureLoaded();
        return sipReseedGridSize;
    }

    /**
     * Load the settings now. Safe to call repeatedly.
     *
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static void preload() {
        ensureLoaded();
    }

    private static synchronized void ensureLoaded() {
        if (loaded) return;
        loadFromResource();
        loaded = true;
    }

    private static void loadFromResource() {
        InputStream in = SolverDefaults.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.error("Solver settings file '{}' not found on classpath", RESOURCE);
            throw new IllegalStateException("Solver settings file '" + RESOURCE + "' not found on classpath");
        }
        Properties props = new Properties();
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            log.error("Failed to read solver settings file", e);
            throw new IllegalStateException("Failed to read solver settings file", e);
        }
        try {
            zpn = new SolverSettings(
                    intValue(props, "zpn.maxIterations"),
                    doubleValue(props, "zpn.epsilonMas") * FloatMath.MAS,
                    doubleValue(props, "zpn.domainStepArcmin") * FloatMath.ARCMIN);
            air = new SolverSettings(
                    intValue(props, "air.maxIterations"),
                    doubleValue(props, "air.epsilon"),
                    doubleValue(props, "air.bisectionStep"));
            mol = new SolverSettings(
                    intValue(props, "mol.maxIterations"),
                    doubleValue(props, "mol.epsilon"),
                    doubleValue(props, "mol.bisectionStep"));
            // The step is unused by the bivariate solver
            double sipEps = doubleValue(props, "sip.epsilon");
            sip = new SolverSettings(intValue(props, "sip.maxIterations"), sipEps, sipEps);
            sipReseedGridSize = intValue(props, "sip.reseedGridSize");
            if (sipReseedGridSize < 2) {
                throw new IllegalArgumentException("sip.reseedGridSize must be >= 2: " + sipReseedGridSize);
            }
        } catch (RuntimeException e) {
            log.error("Failed to parse solver settings file", e);
            throw new IllegalStateException("Failed to parse solver settings file", e);
        }
        log.debug("Loaded solver settings: zpn={}, air={}, mol={}, sip={}, grid={}",
                zpn, air, mol, sip, sipReseedGridSize);
    }

    private static String required(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing key '" + key + "'");
        }
        return value.trim();
    }

    private static int intValue(Properties props, String key) {
        return Integer.parseInt(required(props, key));
    }

    private static double doubleValue(Properties props, String key) {
        return Double.parseDouble(required(props, key));
    }
}
