package io.github.cyfko.boolql.core.utils;

/**
 * Outcome of checking an expression without throwing.
 * <p>
 * Either a success, or a failure carrying the formatted diagnostic of the first error.
 * Instances are immutable and created via {@link #success()} and {@link #failure(String)}.
 * </p>
 *
 * <pre>{@code
 * ValidationResult result = BoolQl.validate(userInput);
 * if (!result.isValid()) {
 *     System.out.println(result.getErrorMessage());
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class ValidationResult {

    private final boolean valid;
    private final String errorMessage;

    private ValidationResult(boolean valid, String errorMessage) {
        this.valid = valid;
        this.errorMessage = errorMessage;
    }

    public static ValidationResult success() {
        return new ValidationResult(true, null);
    }

    public static ValidationResult failure(String errorMessage) {
        return new ValidationResult(false, errorMessage);
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * @return the diagnostic if invalid, or {@code null} if valid
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return valid ? "ValidationResult[valid=true]"
                : "ValidationResult[valid=false, error=" + errorMessage + "]";
    }
}
