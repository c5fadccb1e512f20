/**
 * Generic graph algorithms.
 * Package that doesn't allow null values as method parameters.
 */

@ParametersAreNonnullByDefault
@FieldsAreNonnullByDefault
@MethodsAreNonnullByDefault
package org.p4hlir.util.graph;

import org.p4hlir.util.FieldsAreNonnullByDefault;
import org.p4hlir.util.MethodsAreNonnullByDefault;

import javax.annotation.ParametersAreNonnullByDefault;
