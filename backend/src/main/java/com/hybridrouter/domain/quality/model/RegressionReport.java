package com.hybridrouter.domain.quality.model;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

public record RegressionReport(
        List<RegressionFinding> findings,
        Instant checkedAt
) {
    public RegressionReport {
        findings = List.copyOf(findings);
    }

    public boolean regressionDetected() {
        return findings.stream().anyMatch(RegressionFinding::flagged);
    }

    public List<RegressionFinding> regressions() {
        return findings.stream().filter(RegressionFinding::flagged).toList();
    }

    public String summary() {
        if (!regressionDetected()) {
            return "no regression (" + findings.size() + " comparisons)";
        }
        return regressions().stream().map(RegressionFinding::describe).collect(Collectors.joining("; "));
    }
}
