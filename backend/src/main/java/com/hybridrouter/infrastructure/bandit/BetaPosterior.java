package com.hybridrouter.infrastructure.bandit;

/**
 * Beta(alpha, beta) posterior of one arm, updated with fractional rewards:
 * a reward r adds r to alpha and 1 - r to beta.
 */
public record BetaPosterior(
        double alpha,
        double beta,
        long samples
) {
    private static final BetaPosterior UNIFORM = new BetaPosterior(1.0, 1.0, 0);

    public static BetaPosterior prior() {
        return UNIFORM;
    }

    public BetaPosterior plus(double reward) {
        return new BetaPosterior(alpha + reward, beta + (1.0 - reward), samples + 1);
    }

    public double mean() {
        return alpha / (alpha + beta);
    }
}
