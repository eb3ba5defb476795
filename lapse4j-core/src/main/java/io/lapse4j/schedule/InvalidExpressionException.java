package io.lapse4j.schedule;

/**
 * Thrown when a schedule, filter or subject definition cannot be accepted.
 *
 * <p>Raised synchronously while an expression is being built, so an invalid definition never
 * reaches the scheduler or the time filter.
 */
public class InvalidExpressionException extends IllegalArgumentException {

    private final String field;
    private final String expression;
    private final String reason;

    public InvalidExpressionException(String field, String expression, String reason) {
        super("Invalid " + field + " expression '" + expression + "': " + reason);
        this.field = field;
        this.expression = expression;
        this.reason = reason;
    }

    /**
     * Name of the field being parsed (e.g. "hour", "minute", "interval").
     */
    public String field() {
        return field;
    }

    /**
     * The offending input, as given.
     */
    public String expression() {
        return expression;
    }

    public String reason() {
        return reason;
    }
}
