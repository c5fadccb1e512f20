package org.p4hlir.p4Compiler.compiler.errors;

/** The HLIR document could not be read or does not have the expected shape. */
public final class ProgramLoadError extends BaseCompilerException {
    public ProgramLoadError(String message) {
        super(message);
    }

    public ProgramLoadError(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorKind() {
        return "Error reading program";
    }
}
