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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.celestialproj.Interval;
import java.util.function.DoubleUnaryOperator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests of the Newton / bisection root finder. */
class RobustInverterTest {

    private static final SolverSettings SETTINGS = new SolverSettings(50, 1e-12, 1e-3);
    private static final DifferentiableFunction CUBE = function(x -> x * x * x, x -> 3 * x * x);
    private static final DifferentiableFunction IDENTITY = function(x -> x, x -> 1.0);
    private static final DifferentiableFunction ATAN = function(Math::atan, x -> 1.0 / (1.0 + x * x));

    @Nested
    @DisplayName("Newton")
    class NewtonTests {

        @Test
        @DisplayName("Converges from a nearby guess")
        void convergesFromNearbyGuess() {
            RobustInverter inverter = new RobustInverter(SETTINGS);
            RootResult r = inverter.solve(CUBE, 8.0, 1.0, new Interval(0.0, 10.0));

            assertEquals(RootResult.Method.NEWTON, r.method());
            assertTrue(r.converged());
            assertTrue(r.isSuccess());
            assertEquals(2.0, r.value(), 1e-12);
            assertTrue(Math.abs(r.residual()) <= SETTINGS.epsilon());
        }

        @Test
        @DisplayName("A root just outside the domain is snapped onto the domain end")
        void snapsOntoDomainEnd() {
            RobustInverter inverter = new RobustInverter(SETTINGS);
            RootResult r = inverter.newton(IDENTITY, 1.0 + 1e-13, 0.5, new Interval(0.0, 1.0), new Interval(0.0, 2.0));

            assertEquals(RootResult.Method.NEWTON, r.method());
            assertTrue(r.converged());
            assertEquals(1.0, r.value(), 0.0);
        }

        @Test
        @DisplayName("A root far outside the domain is a failure")
        void rootOutsideDomainFails() {
            RobustInverter inverter = new RobustInverter(SETTINGS);
            RootResult r = inverter.newton(IDENTITY, 5.0, 0.5, new Interval(0.0, 1.0), new Interval(0.0, 10.0));

            assertEquals(RootResult.Method.FAILED, r.method());
            assertFalse(r.isSuccess());
        }

        @Test
        @DisplayName("NaN function values fail")
        void nanFails() {
            DifferentiableFunction undefined = function(x -> Double.NaN, x -> 1.0);
            RobustInverter inverter = new RobustInverter(SETTINGS);
            RootResult r = inverter.newton(undefined, 1.0, 0.5, new Interval(0.0, 1.0), new Interval(0.0, 1.0));
            assertFalse(r.isSuccess());
        }
    }

    @Nested
    @DisplayName("Fallback Strategies")
    class FallbackTests {

        @Test
        @DisplayName("Diverging Newton is rescued by bisection then Newton")
        void hybridRescue() {
            // Newton on atan from x0 = 3 oscillates between the domain ends
            RobustInverter inverter = new RobustInverter(SETTINGS);
            RootResult r = inverter.solve(ATAN, Math.atan(0.5), 3.0, new Interval(-10.0, 10.0));

            assertEquals(RootResult.Method.HYBRID, r.method());
            assertTrue(r.converged());
            assertEquals(0.5, r.value(), 1e-10);
        }

        @Test
        @DisplayName("Target out of range fails even when Newton stayed in the domain")
        void targetNotBracketed() {
            RobustInverter inverter = new RobustInverter(SETTINGS);
            Interval domain = new Interval(-10.0, 10.0);
            // newton alone keeps its last iterate, unconverged
            RootResult newton = inverter.newton(ATAN, 2.0, 0.0, domain, domain);
            assertTrue(newton.isSuccess());
            assertFalse(newton.converged());

            RootResult r = inverter.solve(ATAN, 2.0, 0.0, domain);
            assertFalse(r.isSuccess());
            assertEquals(RootResult.Method.FAILED, r.method());
            assertFalse(r.converged());
        }

        @Test
        @DisplayName("Plain bisection")
        void plainBisection() {
            DifferentiableFunction square = function(x -> x * x, x -> 2 * x);
            RobustInverter inverter = new RobustInverter(SETTINGS);
            RootResult r = inverter.bisect(square, 2.0, 0.0, 2.0);

            assertEquals(RootResult.Method.BISECTION, r.method());
            assertTrue(r.converged());
            assertEquals(Math.sqrt(2.0), r.value(), 1e-12);
        }

        @Test
        @DisplayName("Bisection of a decreasing function")
        void decreasingBisection() {
            DifferentiableFunction minus = function(x -> -x, x -> -1.0);
            RobustInverter inverter = new RobustInverter(SETTINGS);
            RootResult r = inverter.bisect(minus, -0.3, 0.0, 1.0);

            assertTrue(r.converged());
            assertEquals(0.3, r.value(), 1e-12);
        }

        @Test
        @DisplayName("Bisection fails when the target is not bracketed")
        void bisectionNotBracketed() {
            RobustInverter inverter = new RobustInverter(SETTINGS);
            RootResult r = inverter.bisect(CUBE, 100.0, 0.0, 2.0);
            assertEquals(RootResult.Method.FAILED, r.method());
        }
    }

    @Nested
    @DisplayName("Settings")
    class SettingsTests {

        @Test
        @DisplayName("Invalid settings are rejected")
        void invalidSettings() {
            assertThrows(IllegalArgumentException.class, () -> new SolverSettings(0, 1e-12, 1e-3));
            assertThrows(IllegalArgumentException.class, () -> new SolverSettings(10, 0.0, 1e-3));
            assertThrows(IllegalArgumentException.class, () -> new SolverSettings(10, 1e-12, Double.NaN));
            assertThrows(IllegalArgumentException.class, () -> new RobustInverter(null));
        }

        @Test
        @DisplayName("Copy with new values")
        void copies() {
            SolverSettings s = SETTINGS.withMaxIterations(7).withEpsilon(1e-6);
            assertEquals(7, s.maxIterations());
            assertEquals(1e-6, s.epsilon(), 0.0);
            assertEquals(SETTINGS.step(), s.step(), 0.0);
        }
    }

    // Helper methods

    static DifferentiableFunction function(DoubleUnaryOperator value, DoubleUnaryOperator derivative) {
        return new DifferentiableFunction() {
            @Override
            public double value(double t) {
                return value.applyAsDouble(t);
            }

            @Override
            public double derivative(double t) {
                return derivative.applyAsDouble(t);
            }
        };
    }
}
