package org.p4hlir.util;

/** An object that can print itself into an {@link IIndentStream}. */
public interface ToIndentableString {
    IIndentStream toString(IIndentStream builder);
}
