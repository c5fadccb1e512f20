package org.p4hlir.p4Compiler.ir;

/** A program entity with a unique name within its kind. */
public interface IHasName {
    String getName();
}
