package com.hybridrouter.infrastructure.bandit;

import java.util.Random;

/**
 * Draws from Beta(a, b) as X / (X + Y) with X ~ Gamma(a), Y ~ Gamma(b).
 * Gamma draws use Marsaglia-Tsang; shapes below 1 are boosted by one and corrected with U^(1/a).
 */
final class BetaSampler {

    private BetaSampler() {
    }

    static double sample(double alpha, double beta, Random random) {
        double x = gamma(alpha, random);
        double y = gamma(beta, random);
        double sum = x + y;
        if (sum <= 0.0) {
            return alpha / (alpha + beta);
        }
        return x / sum;
    }

    static double gamma(double shape, Random random) {
        if (shape < 1.0) {
            double u = random.nextDouble();
            return gamma(shape + 1.0, random) * Math.pow(u, 1.0 / shape);
        }
        double d = shape - 1.0 / 3.0;
        double c = 1.0 / Math.sqrt(9.0 * d);
        while (true) {
            double x;
            double v;
            do {
                x = random.nextGaussian();
                v = 1.0 + c * x;
            } while (v <= 0.0);
            v = v * v * v;
            double u = random.nextDouble();
            if (u < 1.0 - 0.0331 * x * x * x * x) {
                return d * v;
            }
            if (Math.log(u) < 0.5 * x * x + d * (1.0 - v + Math.log(v))) {
                return d * v;
            }
        }
    }
}
