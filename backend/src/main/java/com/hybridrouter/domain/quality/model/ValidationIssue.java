package com.hybridrouter.domain.quality.model;

/**
 * Individual validation issue found in a generated item.
 *
 * @param type        the type of validation issue
 * @param severity    ERROR fails validation, WARNING only lowers the heuristic score
 * @param message     human-readable description of the issue
 * @param matchedText the specific text that triggered this issue (nullable)
 */
public record ValidationIssue(
        ValidationIssueType type,
        Severity severity,
        String message,
        String matchedText
) {
    public enum Severity {
        ERROR,
        WARNING
    }
}
