package com.hybridrouter.infrastructure.evaluation;

import com.hybridrouter.domain.feedback.model.GenerationOutcome;
import com.hybridrouter.domain.quality.model.ValidationIssue;
import com.hybridrouter.domain.quality.model.ValidationIssue.Severity;
import com.hybridrouter.domain.quality.model.ValidationIssueType;
import com.hybridrouter.domain.quality.model.ValidationResult;
import com.hybridrouter.infrastructure.config.RouterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Rule-based validator for generated items. ERROR issues fail the item; WARNING issues only
 * feed the heuristic score and penalties.
 */
@Slf4j
@Component
public class OutputValidator {

    // Filler and meta phrases an editor would strike
    private static final List<String> DEFAULT_BANNED_PHRASES = List.of(
            "why it matters:",
            "this could be significant",
            "experts say",
            "raises questions",
            "time will tell",
            "could have implications",
            "ongoing situation",
            "as of press time",
            "controversial move",
            "it remains to be seen",
            "generally speaking"
    );

    // Unconfirmed-claim markers, English and Finnish
    private static final List<String> DEFAULT_HEDGE_TERMS = List.of(
            "unconfirmed",
            "alleged",
            "reportedly",
            "sources say",
            "rumors suggest",
            "väitetään",
            "kerrotaan",
            "huhutaan",
            "epävirallinen"
    );

    private final List<String> requiredFields;
    private final List<String> bannedPhrases;
    private final List<String> hedgeTerms;

    public OutputValidator(RouterProperties properties) {
        RouterProperties.Evaluator config = properties.getEvaluator();
        this.requiredFields = List.copyOf(config.getRequiredFields());
        this.bannedPhrases = lower(config.getBannedPhrases().isEmpty() ? DEFAULT_BANNED_PHRASES : config.getBannedPhrases());
        this.hedgeTerms = lower(config.getHedgeTerms().isEmpty() ? DEFAULT_HEDGE_TERMS : config.getHedgeTerms());
    }

    public ValidationResult validate(GenerationOutcome outcome) {
        List<ValidationIssue> issues = new ArrayList<>();

        checkRequiredFields(outcome, issues);
        checkBannedPhrases(outcome, issues);
        checkSources(outcome.sources(), issues);
        checkHedgedClaims(outcome.fullText(), issues);
        checkDuplicateSentences(outcome.fullText(), issues);
        checkAnalysis(outcome, issues);

        ValidationResult result = ValidationResult.of(issues);
        if (!issues.isEmpty()) {
            log.debug("Validation completed: {} issues ({} errors, {} warnings)",
                    issues.size(), result.errors().size(), result.warnings().size());
        }
        return result;
    }

    public List<String> hedgeTerms() {
        return hedgeTerms;
    }

    // Rule 1: required fields present and non-blank
    private void checkRequiredFields(GenerationOutcome outcome, List<ValidationIssue> issues) {
        for (String field : requiredFields) {
            if (outcome.field(field).isBlank()) {
                issues.add(new ValidationIssue(
                        ValidationIssueType.MISSING_FIELD,
                        Severity.ERROR,
                        "Missing or empty field: " + field,
                        field
                ));
            }
        }
    }

    // Rule 2: banned phrases, any field
    private void checkBannedPhrases(GenerationOutcome outcome, List<ValidationIssue> issues) {
        outcome.fields().forEach((field, value) -> {
            String lower = value == null ? "" : value.toLowerCase(Locale.ROOT);
            for (String phrase : bannedPhrases) {
                if (lower.contains(phrase)) {
                    issues.add(new ValidationIssue(
                            ValidationIssueType.BANNED_PHRASE,
                            Severity.ERROR,
                            "Banned phrase in " + field + ": \"" + phrase + "\"",
                            phrase
                    ));
                }
            }
        });
    }

    // Rule 3: at least one source, every source a resolvable http(s) URL
    private void checkSources(List<String> sources, List<ValidationIssue> issues) {
        if (sources.isEmpty()) {
            issues.add(new ValidationIssue(
                    ValidationIssueType.NO_SOURCES,
                    Severity.ERROR,
                    "Item cites no sources",
                    null
            ));
            return;
        }
        for (String source : sources) {
            if (!QualityHeuristics.isResolvableReference(source)) {
                issues.add(new ValidationIssue(
                        ValidationIssueType.UNRESOLVABLE_SOURCE,
                        Severity.WARNING,
                        "Unresolvable source reference: \"" + source + "\"",
                        source
                ));
            }
        }
    }

    // Rule 4: hedged or unconfirmed phrasing
    private void checkHedgedClaims(String text, List<ValidationIssue> issues) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String term : hedgeTerms) {
            if (lower.contains(term)) {
                issues.add(new ValidationIssue(
                        ValidationIssueType.HEDGED_CLAIM,
                        Severity.WARNING,
                        "Hedged claim: \"" + term + "\"",
                        term
                ));
            }
        }
    }

    // Rule 5: repeated sentences
    private void checkDuplicateSentences(String text, List<ValidationIssue> issues) {
        Set<String> seen = new HashSet<>();
        for (String sentence : QualityHeuristics.sentences(text)) {
            String key = sentence.toLowerCase(Locale.ROOT);
            if (!seen.add(key)) {
                issues.add(new ValidationIssue(
                        ValidationIssueType.DUPLICATE_SENTENCE,
                        Severity.WARNING,
                        "Repeated sentence: \"" + sentence + "\"",
                        sentence
                ));
                break; // Report once
            }
        }
    }

    // Rule 6: the analysis should carry a figure or a date
    private void checkAnalysis(GenerationOutcome outcome, List<ValidationIssue> issues) {
        String why = outcome.field(QualityHeuristics.WHY_IT_MATTERS);
        if (!why.isBlank() && !QualityHeuristics.hasFigureOrDate(why)) {
            issues.add(new ValidationIssue(
                    ValidationIssueType.MISSING_ANALYSIS,
                    Severity.WARNING,
                    "Analysis has no figure or date",
                    null
            ));
        }
    }

    private static List<String> lower(List<String> values) {
        return values.stream().map(v -> v.toLowerCase(Locale.ROOT)).toList();
    }
}
