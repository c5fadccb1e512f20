package org.p4hlir.p4Compiler.compiler.errors;

/** Invalid command-line configuration: bad output directory, unreadable
 * primitive definitions, unknown options values.  Detected before any analysis. */
public final class ConfigurationError extends BaseCompilerException {
    public ConfigurationError(String message) {
        super(message);
    }

    public ConfigurationError(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorKind() {
        return "Invalid configuration";
    }
}
