package org.p4hlir.util;

/** Marker for classes whose logging level can be controlled with the -T option. */
public interface IWritesLogs {
}
