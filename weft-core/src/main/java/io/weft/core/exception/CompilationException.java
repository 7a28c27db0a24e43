package io.weft.core.exception;

import io.weft.core.validation.ValidationResult;
import java.io.Serial;

/// Thrown when a workflow cannot be compiled because validation reported errors.
///
/// The full validation report, including warnings, is kept for the caller.
///
/// @see io.weft.core.WeftCompiler#compile
public class CompilationException extends Exception {

    @Serial private static final long serialVersionUID = -3850287461133027659L;

    private final transient ValidationResult validationResult;

    public CompilationException(String message, ValidationResult validationResult) {
        super(message);
        this.validationResult = validationResult;
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
        this.validationResult = null;
    }

    /// @return the failing validation report, or null if compilation failed later
    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
