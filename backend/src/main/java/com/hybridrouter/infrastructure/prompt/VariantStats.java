package com.hybridrouter.infrastructure.prompt;

public record VariantStats(
        long trials,
        double rewardSum
) {
    public static final VariantStats NONE = new VariantStats(0, 0.0);

    public VariantStats plus(double reward) {
        return new VariantStats(trials + 1, rewardSum + reward);
    }

    public double mean() {
        return trials == 0 ? 0.0 : rewardSum / trials;
    }
}
