package org.p4hlir.p4Compiler.compiler.errors;

import java.util.List;

/** The program has a shape the dependency analysis cannot handle: a cyclic
 * control-flow region, a reference to an undeclared entity, or a field access
 * whose writer cannot be determined.  No partial graph is produced. */
public final class StructuralError extends BaseCompilerException {
    /** Names of the program entities involved; may be empty. */
    public final List<String> entities;

    public StructuralError(String message, List<String> entities) {
        super(message);
        this.entities = List.copyOf(entities);
    }

    public StructuralError(String message) {
        this(message, List.of());
    }

    @Override
    public String getErrorKind() {
        return "Unsupported program structure";
    }
}
