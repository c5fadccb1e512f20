package org.p4hlir.p4Compiler.ir;

import javax.annotation.Nullable;

/** How a primitive uses one of its parameters. */
public enum AccessMode {
    READ("read"),
    WRITE("write"),
    READ_WRITE("read_write");

    public final String text;

    AccessMode(String text) {
        this.text = text;
    }

    public boolean reads() {
        return this != WRITE;
    }

    public boolean writes() {
        return this != READ;
    }

    @Nullable
    public static AccessMode fromString(String text) {
        for (AccessMode mode: AccessMode.values())
            if (mode.text.equals(text))
                return mode;
        return null;
    }

    @Override
    public String toString() {
        return this.text;
    }
}
