/**
 * Backend generating graphviz dot format outputs.
 * Package that doesn't allow null values as method parameters.
 */

@ParametersAreNonnullByDefault
@FieldsAreNonnullByDefault
@MethodsAreNonnullByDefault
package org.p4hlir.p4Compiler.compiler.backend.dot;

import org.p4hlir.util.FieldsAreNonnullByDefault;
import org.p4hlir.util.MethodsAreNonnullByDefault;

import javax.annotation.ParametersAreNonnullByDefault;
