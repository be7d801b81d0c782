package com.hybridrouter.domain.quality.model;

public enum ValidationIssueType {
    MISSING_FIELD,
    BANNED_PHRASE,
    NO_SOURCES,
    UNRESOLVABLE_SOURCE,
    HEDGED_CLAIM,
    DUPLICATE_SENTENCE,
    MISSING_ANALYSIS
}
