package com.leadflow.core.rule;

import com.leadflow.core.model.RuleExpression;

/**
 * Detailed outcome of evaluating a rule set.
 * ERROR means a field could not be resolved; callers treat it as not matched
 * but report it separately.
 */
public record RuleEvaluation(Outcome outcome, RuleExpression failedRule, String error) {

    public enum Outcome {
        MATCHED,
        NOT_MATCHED,
        ERROR
    }

    private static final RuleEvaluation MATCHED = new RuleEvaluation(Outcome.MATCHED, null, null);

    public static RuleEvaluation matched() {
        return MATCHED;
    }

    public static RuleEvaluation notMatched(RuleExpression rule) {
        return new RuleEvaluation(Outcome.NOT_MATCHED, rule, null);
    }

    public static RuleEvaluation error(RuleExpression rule, String error) {
        return new RuleEvaluation(Outcome.ERROR, rule, error);
    }

    public boolean isMatched() {
        return outcome == Outcome.MATCHED;
    }

    public boolean isError() {
        return outcome == Outcome.ERROR;
    }
}
