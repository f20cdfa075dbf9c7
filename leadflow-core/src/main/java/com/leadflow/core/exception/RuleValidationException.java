package com.leadflow.core.exception;

import com.leadflow.core.model.RuleExpression;

/**
 * Thrown when a rule set references an unknown field, or applies an operator
 * to a field type or value it does not support. Raised at definition time only.
 */
public class RuleValidationException extends LeadflowException {
    
    public static final String ERROR_CODE = "RULE_VALIDATION_FAILED";
    
    private final RuleExpression rule;
    
    public RuleValidationException(RuleExpression rule, String reason) {
        super(ERROR_CODE, String.format(
            "Invalid rule [%s %s %s]: %s",
            rule.field(), rule.operator().code(), rule.value(), reason
        ));
        this.rule = rule;
    }
    
    public RuleExpression getRule() {
        return rule;
    }
}
