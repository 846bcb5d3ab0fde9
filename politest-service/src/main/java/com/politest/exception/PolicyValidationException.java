package com.politest.exception;

import java.util.Collections;
import java.util.List;

/**
 * Raised in strict mode when a policy carries fields outside the IAM policy grammar.
 */
public class PolicyValidationException extends PolicyLoadException {

    private final List<String> violations;

    public PolicyValidationException(String documentLabel, List<String> violations) {
        super(documentLabel + " validation failed:\npolicy contains non-IAM fields:\n"
                + String.join("\n", violations)
                + "\n\nUse standard IAM schema fields only, or disable politest.strict-policy");
        this.violations = Collections.unmodifiableList(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
