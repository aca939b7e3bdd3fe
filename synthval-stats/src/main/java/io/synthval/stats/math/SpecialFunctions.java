package io.synthval.stats.math;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/// Special functions backing the p-value computations of the comparison battery.
///
/// ## Functions
///
/// ```text
///   lnΓ(x)         Lanczos approximation, |relative error| < 2e-10 for x > 0
///   P(a, x)        regularized lower incomplete gamma  γ(a,x)/Γ(a)
///   Q(a, x)        regularized upper incomplete gamma  1 - P(a,x)
///   I_x(a, b)      regularized incomplete beta
///   erf(x)         P(1/2, x²) with the sign of x
/// ```
///
/// The incomplete gamma uses the power series below `a + 1` and a Lentz
/// continued fraction above it; the incomplete beta uses the continued
/// fraction on whichever side of `(a+1)/(a+b+2)` converges fastest.
public final class SpecialFunctions {

    private static final int MAX_ITERATIONS = 1000;
    private static final double EPSILON = 1e-15;
    private static final double FP_MIN = 1e-300;

    private static final double[] LANCZOS = {
        76.18009172947146, -86.50532032941677, 24.01409824083091,
        -1.231739572450155, 0.1208650973866179e-2, -0.5395239384953e-5
    };

    private SpecialFunctions() {
        // Utility class
    }

    /// Natural logarithm of the gamma function for `x > 0`.
    ///
    /// @param x the argument, must be positive
    /// @return lnΓ(x)
    public static double logGamma(double x) {
        if (!(x > 0)) {
            throw new IllegalArgumentException("logGamma requires x > 0, got " + x);
        }
        double y = x;
        double tmp = x + 5.5;
        tmp -= (x + 0.5) * Math.log(tmp);
        double ser = 1.000000000190015;
        for (double c : LANCZOS) {
            ser += c / ++y;
        }
        return -tmp + Math.log(2.5066282746310005 * ser / x);
    }

    /// Regularized lower incomplete gamma function P(a, x).
    ///
    /// @param a shape, must be positive
    /// @param x upper integration limit
    /// @return P(a, x) in [0, 1]
    public static double regularizedGammaP(double a, double x) {
        checkShape(a);
        if (x <= 0) {
            return 0.0;
        }
        if (x < a + 1.0) {
            return gammaSeries(a, x);
        }
        return 1.0 - gammaContinuedFraction(a, x);
    }

    /// Regularized upper incomplete gamma function Q(a, x) = 1 - P(a, x).
    ///
    /// Computed directly on the continued-fraction side so that small tail
    /// probabilities keep their precision.
    ///
    /// @param a shape, must be positive
    /// @param x lower integration limit
    /// @return Q(a, x) in [0, 1]
    public static double regularizedGammaQ(double a, double x) {
        checkShape(a);
        if (x <= 0) {
            return 1.0;
        }
        if (x < a + 1.0) {
            return 1.0 - gammaSeries(a, x);
        }
        return gammaContinuedFraction(a, x);
    }

    /// Regularized incomplete beta function I_x(a, b).
    ///
    /// @param x evaluation point in [0, 1]
    /// @param a first shape, must be positive
    /// @param b second shape, must be positive
    /// @return I_x(a, b) in [0, 1]
    public static double regularizedBeta(double x, double a, double b) {
        checkShape(a);
        checkShape(b);
        if (x <= 0) {
            return 0.0;
        }
        if (x >= 1) {
            return 1.0;
        }
        double front = Math.exp(logGamma(a + b) - logGamma(a) - logGamma(b)
            + a * Math.log(x) + b * Math.log1p(-x));
        if (x < (a + 1.0) / (a + b + 2.0)) {
            return front * betaContinuedFraction(a, b, x) / a;
        }
        return 1.0 - front * betaContinuedFraction(b, a, 1.0 - x) / b;
    }

    /// Error function, expressed through the incomplete gamma: erf(x) = P(1/2, x²).
    ///
    /// @param x the argument
    /// @return erf(x)
    public static double erf(double x) {
        double value = regularizedGammaP(0.5, x * x);
        return x < 0 ? -value : value;
    }

    /// Complementary error function erfc(x) = 1 - erf(x), accurate in the upper tail.
    ///
    /// @param x the argument
    /// @return erfc(x)
    public static double erfc(double x) {
        if (x < 0) {
            return 1.0 + regularizedGammaP(0.5, x * x);
        }
        return regularizedGammaQ(0.5, x * x);
    }

    private static double gammaSeries(double a, double x) {
        double ap = a;
        double sum = 1.0 / a;
        double del = sum;
        for (int n = 1; n <= MAX_ITERATIONS; n++) {
            ap++;
            del *= x / ap;
            sum += del;
            if (Math.abs(del) < Math.abs(sum) * EPSILON) {
                break;
            }
        }
        return sum * Math.exp(-x + a * Math.log(x) - logGamma(a));
    }

    private static double gammaContinuedFraction(double a, double x) {
        double b = x + 1.0 - a;
        double c = 1.0 / FP_MIN;
        double d = 1.0 / b;
        double h = d;
        for (int i = 1; i <= MAX_ITERATIONS; i++) {
            double an = -i * (i - a);
            b += 2.0;
            d = an * d + b;
            if (Math.abs(d) < FP_MIN) d = FP_MIN;
            c = b + an / c;
            if (Math.abs(c) < FP_MIN) c = FP_MIN;
            d = 1.0 / d;
            double del = d * c;
            h *= del;
            if (Math.abs(del - 1.0) < EPSILON) {
                break;
            }
        }
        return Math.exp(-x + a * Math.log(x) - logGamma(a)) * h;
    }

    private static double betaContinuedFraction(double a, double b, double x) {
        double qab = a + b;
        double qap = a + 1.0;
        double qam = a - 1.0;
        double c = 1.0;
        double d = 1.0 - qab * x / qap;
        if (Math.abs(d) < FP_MIN) d = FP_MIN;
        d = 1.0 / d;
        double h = d;
        for (int m = 1; m <= MAX_ITERATIONS; m++) {
            int m2 = 2 * m;
            double aa = m * (b - m) * x / ((qam + m2) * (a + m2));
            d = 1.0 + aa * d;
            if (Math.abs(d) < FP_MIN) d = FP_MIN;
            c = 1.0 + aa / c;
            if (Math.abs(c) < FP_MIN) c = FP_MIN;
            d = 1.0 / d;
            h *= d * c;
            aa = -(a + m) * (qab + m) * x / ((a + m2) * (qap + m2));
            d = 1.0 + aa * d;
            if (Math.abs(d) < FP_MIN) d = FP_MIN;
            c = 1.0 + aa / c;
            if (Math.abs(c) < FP_MIN) c = FP_MIN;
            d = 1.0 / d;
            double del = d * c;
            h *= del;
            if (Math.abs(del - 1.0) < EPSILON) {
                break;
            }
        }
        return h;
    }

    private static void checkShape(double shape) {
        if (!(shape > 0) || Double.isInfinite(shape)) {
            throw new IllegalArgumentException("shape parameter must be positive and finite, got " + shape);
        }
    }
}
