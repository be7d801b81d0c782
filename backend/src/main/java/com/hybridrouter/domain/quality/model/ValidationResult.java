package com.hybridrouter.domain.quality.model;

import java.util.List;

/**
 * Result of generated-item validation.
 *
 * @param passed true if no ERROR-level issues were found
 * @param issues list of all validation issues (both ERROR and WARNING)
 */
public record ValidationResult(
        boolean passed,
        List<ValidationIssue> issues
) {
    public static ValidationResult of(List<ValidationIssue> issues) {
        boolean passed = issues.stream().noneMatch(i -> i.severity() == ValidationIssue.Severity.ERROR);
        return new ValidationResult(passed, List.copyOf(issues));
    }

    public List<ValidationIssue> errors() {
        return issues.stream().filter(i -> i.severity() == ValidationIssue.Severity.ERROR).toList();
    }

    public List<ValidationIssue> warnings() {
        return issues.stream().filter(i -> i.severity() == ValidationIssue.Severity.WARNING).toList();
    }

    public boolean has(ValidationIssueType type) {
        return issues.stream().anyMatch(i -> i.type() == type);
    }
}
