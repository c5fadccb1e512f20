package org.p4hlir.p4Compiler.ir;

import javax.annotation.Nullable;

public enum MatchType {
    EXACT,
    TERNARY,
    LPM,
    RANGE,
    VALID;

    @Nullable
    public static MatchType fromString(String text) {
        for (MatchType type: MatchType.values())
            if (type.name().equalsIgnoreCase(text))
                return type;
        return null;
    }

    @Override
    public String toString() {
        return this.name().toLowerCase();
    }
}
