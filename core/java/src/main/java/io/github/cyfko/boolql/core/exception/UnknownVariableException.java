package io.github.cyfko.boolql.core.exception;

import java.util.List;

/**
 * Raised when an expression references a variable the environment does not bind.
 * <p>
 * Carries the names of the environment ranked by closeness to the missing one
 * (see {@link io.github.cyfko.boolql.core.utils.EditDistanceUtils#suggest}). The message
 * shows at most {@value #DISPLAYED_SUGGESTIONS} of them:
 * </p>
 * <pre>{@code
 * Unknown variable 'UNKNON'. Did you mean: UNKNOWN
 * }</pre>
 *
 * @since 1.0.0
 */
public class UnknownVariableException extends EvaluationException {

    /**
     * Number of suggestions rendered in the message.
     */
    public static final int DISPLAYED_SUGGESTIONS = 3;

    private final String variableName;
    private final List<String> suggestions;

    public UnknownVariableException(String variableName, List<String> suggestions) {
        super(buildMessage(variableName, suggestions));
        this.variableName = variableName;
        this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    private static String buildMessage(String variableName, List<String> suggestions) {
        String message = "Unknown variable '" + variableName + "'";
        if (suggestions != null && !suggestions.isEmpty()) {
            List<String> shown = suggestions.subList(0, Math.min(DISPLAYED_SUGGESTIONS, suggestions.size()));
            message += ". Did you mean: " + String.join(", ", shown);
        }
        return message;
    }

    public String getVariableName() {
        return variableName;
    }

    /**
     * @return every candidate name, closest first; may be longer than what the message shows
     */
    public List<String> getSuggestions() {
        return suggestions;
    }
}
