package org.p4hlir.p4Compiler.compiler.frontend;

import org.p4hlir.p4Compiler.ir.P4Program;

import java.nio.file.Path;
import java.util.List;

/** Produces the HLIR of a P4 program.  The returned program is frozen. */
public interface IHlirLoader {
    /**
     * @param source            Program to load.
     * @param preprocessorArgs  Definitions and include flags, passed through untouched. */
    P4Program load(Path source, List<String> preprocessorArgs);
}
