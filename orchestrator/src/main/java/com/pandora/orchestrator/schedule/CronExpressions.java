package com.pandora.orchestrator.schedule;

import org.springframework.scheduling.support.CronExpression;

/**
 * Skill definitions use classic five-field cron ({@code min hour dom mon dow});
 * Spring wants a leading seconds field.
 */
public final class CronExpressions {

    private CronExpressions() {}

    /**
     * @throws IllegalArgumentException if the expression is not valid five- or six-field cron
     */
    public static String toSpring(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression is empty");
        }
        String trimmed = expression.trim();
        int fields = trimmed.split("\\s+").length;
        String spring = switch (fields) {
            case 5  -> "0 " + trimmed;
            case 6  -> trimmed;
            default -> throw new IllegalArgumentException(
                    "Cron expression must have 5 or 6 fields, got " + fields + ": '" + expression + "'");
        };
        if (!CronExpression.isValidExpression(spring)) {
            throw new IllegalArgumentException("Invalid cron expression: '" + expression + "'");
        }
        return spring;
    }
}
