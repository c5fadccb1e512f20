package org.p4hlir.p4Compiler.compiler.errors;

import javax.annotation.Nullable;

/** Base class for exceptions which are thrown by the compiler. */
public abstract class BaseCompilerException extends RuntimeException {
    protected BaseCompilerException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }

    protected BaseCompilerException(String message) {
        this(message, null);
    }

    /** A short description of the error category, used when reporting. */
    public abstract String getErrorKind();
}
