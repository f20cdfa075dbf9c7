package com.leadflow.core.rule;

import com.leadflow.core.model.EntitySnapshot;
import com.leadflow.core.model.Operator;
import com.leadflow.core.model.RuleExpression;
import com.leadflow.core.model.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.function.IntPredicate;

/**
 * Evaluates rule sets against entity snapshots.
 *
 * Rules are combined with AND and evaluation stops at the first rule that
 * does not hold. A missing value never satisfies a rule, whatever the
 * operator. Evaluation performs no I/O beyond computed fields and gives the
 * same answer for the same snapshot, rules and evaluation time.
 */
public class RuleEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RuleEvaluator.class);

    private final FieldResolver fieldResolver;
    private final ValueResolver valueResolver;

    public RuleEvaluator(FieldResolver fieldResolver, ValueResolver valueResolver) {
        this.fieldResolver = fieldResolver;
        this.valueResolver = valueResolver;
    }

    public RuleEvaluator(FieldResolver fieldResolver) {
        this(fieldResolver, new ValueResolver());
    }

    /**
     * Evaluate a rule set. Evaluation errors count as not matched.
     */
    public boolean evaluate(EntitySnapshot snapshot, RuleSet ruleSet, Instant evaluationTime) {
        return evaluateDetailed(snapshot, ruleSet, evaluationTime).isMatched();
    }

    /**
     * Evaluate a rule set and report which rule stopped it, distinguishing a
     * rule that does not hold from one that could not be evaluated.
     */
    public RuleEvaluation evaluateDetailed(EntitySnapshot snapshot, RuleSet ruleSet, Instant evaluationTime) {
        for (RuleExpression rule : ruleSet.rules()) {
            Object actual;
            boolean holds;
            try {
                actual = valueResolver.normalize(fieldResolver.resolve(snapshot, rule.field(), evaluationTime));
                Object expected = valueResolver.resolveExpected(rule.value(), evaluationTime);
                holds = test(rule.operator(), actual, expected);
            } catch (RuntimeException e) {
                log.warn("Could not evaluate rule [{}] for entity {}: {}",
                    rule, snapshot.entityId(), e.getMessage());
                return RuleEvaluation.error(rule, e.getMessage());
            }
            
            if (!holds) {
                log.debug("Rule [{}] not satisfied for entity {} (actual={})",
                    rule, snapshot.entityId(), actual);
                return RuleEvaluation.notMatched(rule);
            }
        }
        return RuleEvaluation.matched();
    }

    /**
     * Apply an operator to normalized operands.
     */
    public boolean test(Operator operator, Object actual, Object expected) {
        if (actual == null) {
            return false;
        }
        return switch (operator) {
            case EQ -> valueResolver.valuesEqual(actual, expected);
            case NOT_EQ -> expected != null && !valueResolver.valuesEqual(actual, expected);
            case GT -> ordered(actual, expected, c -> c > 0);
            case LT -> ordered(actual, expected, c -> c < 0);
            case GTE -> ordered(actual, expected, c -> c >= 0);
            case LTE -> ordered(actual, expected, c -> c <= 0);
            case IN -> expected instanceof List<?> options
                && options.stream().anyMatch(option -> valueResolver.valuesEqual(actual, option));
            case CONTAINS -> contains(actual, expected);
            case STARTS_WITH -> actual instanceof String text && expected != null
                && lower(text).startsWith(lower(valueResolver.asText(expected)));
            case ENDS_WITH -> actual instanceof String text && expected != null
                && lower(text).endsWith(lower(valueResolver.asText(expected)));
        };
    }

    // ========== Internal Methods ==========

    private boolean ordered(Object actual, Object expected, IntPredicate accept) {
        Integer comparison = valueResolver.compare(actual, expected);
        return comparison != null && accept.test(comparison);
    }

    private boolean contains(Object actual, Object expected) {
        if (expected == null) {
            return false;
        }
        if (actual instanceof List<?> items) {
            return items.stream().anyMatch(item -> valueResolver.valuesEqual(item, expected));
        }
        if (actual instanceof String text) {
            return lower(text).contains(lower(valueResolver.asText(expected)));
        }
        return false;
    }

    private static String lower(String text) {
        return text.toLowerCase(Locale.ROOT);
    }
}
