package com.controlplane.core.model;

import java.util.List;
import java.util.Map;

/**
 * Post-execution verdict for one candidate plan.
 * <p>
 * Consumers switch on {@link #kind()}, which the compiler checks for exhaustiveness, instead of
 * catching exceptions for advisory outcomes.
 */
public sealed interface Verdict permits Verdict.Passed, Verdict.AutoFixed, Verdict.Failed, Verdict.NeedsReview {

    enum Kind { PASSED, AUTO_FIXED, FAILED, NEEDS_REVIEW }

    Kind kind();

    String notes();

    /** Wire status written to {@code latest_validation.status}. */
    default String status() {
        return switch (kind()) {
            case PASSED -> "passed";
            case AUTO_FIXED -> "auto_fix";
            case FAILED -> "retry_later";
            case NEEDS_REVIEW -> "ask_reviewer";
        };
    }

    default Map<String, Object> toMap() {
        List<String> violations = this instanceof Failed f ? f.violations()
                : this instanceof NeedsReview r ? r.violations() : List.of();
        return Map.of(
                "status", status(),
                "notes", notes(),
                "violations", violations,
                "reviewer_required", kind() == Kind.NEEDS_REVIEW);
    }

    record Passed(String notes) implements Verdict {
        public Kind kind() { return Kind.PASSED; }
    }

    record AutoFixed(String notes, List<String> fixedSafeguards) implements Verdict {
        public AutoFixed {
            fixedSafeguards = List.copyOf(fixedSafeguards);
        }
        public Kind kind() { return Kind.AUTO_FIXED; }
    }

    /** Violations that may clear on a different candidate; the loop moves on. */
    record Failed(String notes, List<String> violations) implements Verdict {
        public Failed {
            violations = List.copyOf(violations);
        }
        public Kind kind() { return Kind.FAILED; }
    }

    /** Automated retries must stop until a human reviewer decides. */
    record NeedsReview(String notes, List<String> violations) implements Verdict {
        public NeedsReview {
            violations = List.copyOf(violations);
        }
        public Kind kind() { return Kind.NEEDS_REVIEW; }
    }
}
