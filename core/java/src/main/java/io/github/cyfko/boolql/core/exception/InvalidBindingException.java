package io.github.cyfko.boolql.core.exception;

/**
 * Raised when the environment binds a variable to something other than a {@link Boolean}.
 * <p>
 * A typed {@code Map<String, Boolean>} can still hold {@code null} values, or foreign
 * values after an unchecked cast. Such a binding is a contract violation on the caller
 * side and is reported apart from {@link UnknownVariableException}.
 * </p>
 *
 * @since 1.0.0
 */
public class InvalidBindingException extends EvaluationException {

    private final String variableName;
    private final transient Object value;

    public InvalidBindingException(String variableName, Object value) {
        super("Non-boolean value bound to '" + variableName + "': "
                + (value == null ? "null" : value + " (" + value.getClass().getSimpleName() + ")"));
        this.variableName = variableName;
        this.value = value;
    }

    public String getVariableName() {
        return variableName;
    }

    public Object getValue() {
        return value;
    }
}
