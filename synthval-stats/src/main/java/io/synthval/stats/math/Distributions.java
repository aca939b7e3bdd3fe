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

/// Tail probabilities of the reference distributions used by the battery.
///
/// ```text
///   chi-square survival     P(X² ≥ x | df)      = Q(df/2, x/2)
///   Student-t two-sided     P(|T| ≥ |t| | df)   = I_{df/(df+t²)}(df/2, 1/2)
///   standard normal CDF     Φ(z)                = ½·erfc(-z/√2)
///   Kolmogorov survival     Q_KS(λ)             = 2 Σ (-1)^(j-1) exp(-2 j² λ²)
/// ```
///
/// @see SpecialFunctions
public final class Distributions {

    private static final double SQRT2 = Math.sqrt(2.0);

    private Distributions() {
        // Utility class
    }

    /// Upper-tail probability of the chi-square distribution.
    ///
    /// @param x the statistic
    /// @param degreesOfFreedom degrees of freedom, must be positive
    /// @return P(X² ≥ x)
    public static double chiSquareSurvival(double x, double degreesOfFreedom) {
        if (x <= 0) {
            return 1.0;
        }
        return SpecialFunctions.regularizedGammaQ(degreesOfFreedom / 2.0, x / 2.0);
    }

    /// Two-sided p-value of a Student-t statistic.
    ///
    /// @param t the statistic
    /// @param degreesOfFreedom degrees of freedom, must be positive
    /// @return P(|T| ≥ |t|)
    public static double studentTTwoSided(double t, double degreesOfFreedom) {
        if (Double.isInfinite(t)) {
            return 0.0;
        }
        double x = degreesOfFreedom / (degreesOfFreedom + t * t);
        return SpecialFunctions.regularizedBeta(x, degreesOfFreedom / 2.0, 0.5);
    }

    /// Standard normal cumulative distribution Φ(z).
    ///
    /// @param z the standard score
    /// @return P(Z ≤ z)
    public static double normalCdf(double z) {
        return 0.5 * SpecialFunctions.erfc(-z / SQRT2);
    }

    /// Standard normal survival 1 - Φ(z), computed without cancellation.
    ///
    /// @param z the standard score
    /// @return P(Z ≥ z)
    public static double normalSurvival(double z) {
        return 0.5 * SpecialFunctions.erfc(z / SQRT2);
    }

    /// Survival function of the Kolmogorov distribution.
    ///
    /// The alternating series converges fast for λ above roughly 0.3; below
    /// that the probability is indistinguishable from 1.
    ///
    /// @param lambda the scaled K-S statistic
    /// @return Q_KS(λ) in [0, 1]
    public static double kolmogorovSurvival(double lambda) {
        if (lambda <= 0) {
            return 1.0;
        }
        double a2 = -2.0 * lambda * lambda;
        double fac = 2.0;
        double sum = 0.0;
        double previous = 0.0;
        for (int j = 1; j <= 100; j++) {
            double term = fac * Math.exp(a2 * j * j);
            sum += term;
            if (Math.abs(term) <= 1e-3 * previous || Math.abs(term) <= 1e-8 * sum) {
                return Math.max(0.0, Math.min(1.0, sum));
            }
            fac = -fac;
            previous = Math.abs(term);
        }
        // No convergence: λ is tiny and the samples are indistinguishable.
        return 1.0;
    }

    /// Asymptotic two-sample Kolmogorov-Smirnov p-value with the Stephens
    /// small-sample correction.
    ///
    /// @param d the K-S statistic
    /// @param n1 size of the first sample
    /// @param n2 size of the second sample
    /// @return approximate P(D ≥ d)
    public static double kolmogorovSmirnovPValue(double d, int n1, int n2) {
        double en = Math.sqrt((double) n1 * n2 / (n1 + n2));
        return kolmogorovSurvival((en + 0.12 + 0.11 / en) * d);
    }
}
