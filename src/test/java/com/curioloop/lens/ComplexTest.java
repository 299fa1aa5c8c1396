/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.lens;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for complex arithmetic and principal branches.
 */
public class ComplexTest {

    @Test
    @DisplayName("Multiplication and conjugation")
    void testArithmetic() {
        Complex z = Complex.of(1.0, 2.0);
        Complex w = Complex.of(3.0, -1.0);

        Complex product = z.multiply(w);
        assertThat(product.re()).isEqualTo(5.0);
        assertThat(product.im()).isEqualTo(5.0);

        assertThat(z.conjugate()).isEqualTo(Complex.of(1.0, -2.0));
        assertThat(z.square()).isEqualTo(Complex.of(-3.0, 4.0));
        assertThat(z.subtract(1.0)).isEqualTo(Complex.of(0.0, 2.0));
        assertThat(z.multiply(2.0).divide(4.0)).isEqualTo(Complex.of(0.5, 1.0));
        assertThat(z.abs()).isCloseTo(Math.sqrt(5.0), within(1e-15));
    }

    @Test
    @DisplayName("Square root is principal and squares back")
    void testSqrt() {
        Complex z = Complex.of(-3.0, 4.0);
        Complex root = z.sqrt();

        assertThat(root.re()).isCloseTo(1.0, within(1e-15));
        assertThat(root.im()).isCloseTo(2.0, within(1e-15));
        assertThat(Complex.of(4.0, 0.0).sqrt()).isEqualTo(Complex.of(2.0, 0.0));
        assertThat(Complex.ZERO.sqrt().abs()).isZero();

        Complex w = Complex.of(0.3, -1.7);
        Complex back = w.sqrt().square();
        assertThat(back.re()).isCloseTo(w.re(), within(1e-14));
        assertThat(back.im()).isCloseTo(w.im(), within(1e-14));
    }

    @Test
    @DisplayName("Square root on the negative real axis follows the sign of zero")
    void testSqrtSignedZero() {
        Complex above = Complex.of(-4.0, 0.0).sqrt();
        Complex below = Complex.of(-4.0, -0.0).sqrt();

        assertThat(above.re()).isZero();
        assertThat(above.im()).isEqualTo(2.0);
        assertThat(below.re()).isZero();
        assertThat(below.im()).isEqualTo(-2.0);
    }

    @Test
    @DisplayName("Logarithm uses the principal argument")
    void testLog() {
        Complex log = Complex.of(-1.0, 0.0).log();
        assertThat(log.re()).isCloseTo(0.0, within(1e-15));
        assertThat(log.im()).isCloseTo(Math.PI, within(1e-15));

        Complex below = Complex.of(-1.0, -0.0).log();
        assertThat(below.im()).isCloseTo(-Math.PI, within(1e-15));

        Complex e = Complex.polar(Math.E, 0.5).log();
        assertThat(e.re()).isCloseTo(1.0, within(1e-15));
        assertThat(e.im()).isCloseTo(0.5, within(1e-15));
    }

    @Test
    @DisplayName("Branch sign selects the closed right half plane")
    void testBranchSign() {
        assertThat(Complex.of(1.0, -5.0).branchSign()).isEqualTo(1);
        assertThat(Complex.of(0.0, 2.0).branchSign()).isEqualTo(1);
        assertThat(Complex.of(0.0, 0.0).branchSign()).isEqualTo(1);
        assertThat(Complex.of(0.0, -2.0).branchSign()).isEqualTo(-1);
        assertThat(Complex.of(-1e-300, 3.0).branchSign()).isEqualTo(-1);
    }

    @Test
    @DisplayName("Polar and unit phasor constructors")
    void testPolar() {
        Complex z = Complex.polar(2.0, Math.PI / 2);
        assertThat(z.re()).isCloseTo(0.0, within(1e-15));
        assertThat(z.im()).isCloseTo(2.0, within(1e-15));

        Complex unit = Complex.expi(0.7);
        assertThat(unit.abs()).isCloseTo(1.0, within(1e-15));
        assertThat(unit.arg()).isCloseTo(0.7, within(1e-15));
        assertThat(Complex.I.square()).isEqualTo(Complex.of(-1.0, 0.0));
    }
}
