package com.hybridrouter.domain.quality.model;

import java.util.List;

/**
 * Reward samples of one subject (a provider, or a category/variant pair) split into a recent
 * half and a trailing baseline half.
 */
public record QualityWindow(
        SubjectType subjectType,
        String subject,
        List<RewardSample> recent,
        List<RewardSample> baseline
) {
    public enum SubjectType {
        PROVIDER,
        VARIANT
    }

    public QualityWindow {
        recent = List.copyOf(recent);
        baseline = List.copyOf(baseline);
    }

    public static int passed(List<RewardSample> samples) {
        return (int) samples.stream().filter(RewardSample::validationPassed).count();
    }

    public static double mean(List<RewardSample> samples) {
        return samples.stream().mapToDouble(RewardSample::reward).average().orElse(0.0);
    }

    /**
     * Unbiased sample variance of the rewards; 0 for fewer than two samples.
     */
    public static double variance(List<RewardSample> samples) {
        int n = samples.size();
        if (n < 2) {
            return 0.0;
        }
        double mean = mean(samples);
        double sumSq = samples.stream().mapToDouble(s -> (s.reward() - mean) * (s.reward() - mean)).sum();
        return sumSq / (n - 1);
    }
}
