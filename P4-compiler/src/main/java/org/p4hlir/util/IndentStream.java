/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.p4hlir.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/** An {@link IIndentStream} writing to an {@link Appendable}.
 * Indentation is emitted lazily, before the first non-space character of each line. */
public class IndentStream implements IIndentStream {
    private Appendable stream;
    /** Current nesting depth. */
    int depth = 0;
    /** Spaces per nesting level. */
    int amount = 4;
    /** Indentation prefix for each depth seen so far. */
    final List<String> prefixes = new ArrayList<>();
    boolean atLineStart = false;

    public IndentStream(Appendable appendable) {
        this.stream = appendable;
        this.setIndentAmount(this.amount);
    }

    /** Set the output stream.
     * @return The previous output stream. */
    public Appendable setOutputStream(Appendable appendable) {
        Appendable result = this.stream;
        this.stream = appendable;
        return result;
    }

    /** Set the indent amount.  If 0, newlines are suppressed and the output is on a single line. */
    public IIndentStream setIndentAmount(int amount) {
        Utilities.enforce(amount >= 0);
        this.amount = amount;
        this.prefixes.clear();
        this.prefixes.add("");
        return this;
    }

    String prefix() {
        while (this.prefixes.size() <= this.depth)
            this.prefixes.add(" ".repeat(this.prefixes.size() * this.amount));
        return this.prefixes.get(this.depth);
    }

    private void write(CharSequence data) {
        try {
            this.stream.append(data);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    @Override
    public IIndentStream appendChar(char c) {
        if (c == '\n') {
            if (this.amount > 0) {
                this.write("\n");
                this.atLineStart = true;
            }
            return this;
        }
        if (this.atLineStart && !Character.isSpaceChar(c)) {
            this.atLineStart = false;
            this.write(this.prefix());
        }
        this.write(String.valueOf(c));
        return this;
    }

    /** Append a string that does not contain newlines */
    @Override
    public IIndentStream appendFast(String s) {
        if (s.isEmpty())
            return this;
        if (this.atLineStart) {
            this.atLineStart = false;
            this.write(this.prefix());
        }
        this.write(s);
        return this;
    }

    @Override
    public IIndentStream increase() {
        this.depth++;
        return this.newline();
    }

    @Override
    public IIndentStream decrease() {
        if (this.depth == 0)
            throw new IllegalStateException("Negative indent");
        this.depth--;
        return this;
    }

    @Override
    public String toString() {
        return this.stream.toString();
    }
}
