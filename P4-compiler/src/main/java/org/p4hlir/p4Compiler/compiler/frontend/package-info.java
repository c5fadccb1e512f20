/**
 * Loading programs and primitive definitions.
 * Package that doesn't allow null values as method parameters.
 */

@ParametersAreNonnullByDefault
@FieldsAreNonnullByDefault
@MethodsAreNonnullByDefault
package org.p4hlir.p4Compiler.compiler.frontend;

import org.p4hlir.util.FieldsAreNonnullByDefault;
import org.p4hlir.util.MethodsAreNonnullByDefault;

import javax.annotation.ParametersAreNonnullByDefault;
