package org.p4hlir.util;

import org.p4hlir.p4Compiler.compiler.IErrorReporter;

public interface IValidate {
    /** Report errors if the object is invalid.
     * Return 'true' if it is valid. */
    boolean validate(IErrorReporter reporter);
}
