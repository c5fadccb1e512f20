package org.p4hlir.p4Compiler.compiler;

import org.p4hlir.p4Compiler.compiler.errors.BaseCompilerException;

/** Interface for reporting errors. */
public interface IErrorReporter {
    /** Report a problem (error or warning).
     * @param warning      True if this is a warning.
     * @param errorType    A short string that categorizes the error type.
     * @param message      Error message. */
    void reportProblem(boolean warning, String errorType, String message);

    default void reportError(String errorType, String message) {
        this.reportProblem(false, errorType, message);
    }

    default void reportWarning(String errorType, String message) {
        this.reportProblem(true, errorType, message);
    }

    default void reportError(BaseCompilerException exception) {
        this.reportError(exception.getErrorKind(), exception.getMessage());
    }

    /** True if any error (but not a warning) has been reported. */
    boolean hasErrors();
}
